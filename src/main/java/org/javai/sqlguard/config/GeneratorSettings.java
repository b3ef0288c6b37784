package org.javai.sqlguard.config;

/**
 * Settings for the language-model SQL generator.
 *
 * @param provider provider name; only "openai" (and OpenAI-compatible endpoints) is wired
 * @param model model name
 * @param temperature sampling temperature, 0 for deterministic output
 * @param apiKey provider API key, may be blank when no generator is used
 * @param baseUrl optional base url of an OpenAI-compatible endpoint
 */
public record GeneratorSettings(
		String provider,
		String model,
		double temperature,
		String apiKey,
		String baseUrl
) {

	public static final String DEFAULT_MODEL = "gpt-4o";

	public GeneratorSettings {
		provider = provider != null && !provider.isBlank() ? provider.trim().toLowerCase(java.util.Locale.ROOT) : "openai";
		model = model != null && !model.isBlank() ? model : DEFAULT_MODEL;
	}

	public static GeneratorSettings defaults() {
		return new GeneratorSettings("openai", DEFAULT_MODEL, 0.0, null, null);
	}

	public boolean hasApiKey() {
		return apiKey != null && !apiKey.isBlank();
	}

	@Override
	public String toString() {
		return "GeneratorSettings[provider=%s, model=%s, temperature=%s, baseUrl=%s]"
				.formatted(provider, model, temperature, baseUrl);
	}
}
