package org.javai.sqlguard.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.javai.sqlguard.catalog.Identifiers;

/**
 * Role → row filter template. Roles without a template are not row-filtered.
 */
public final class RlsPolicy {

	private final Map<String, RowFilterTemplate> templates;

	private RlsPolicy(Map<String, RowFilterTemplate> templates) {
		this.templates = templates;
	}

	/**
	 * @throws IllegalArgumentException if any template is malformed
	 */
	public static RlsPolicy of(Map<String, String> rawTemplates) {
		Map<String, RowFilterTemplate> parsed = new LinkedHashMap<>();
		if (rawTemplates != null) {
			rawTemplates.forEach((role, template) ->
					parsed.put(Identifiers.normalize(role), RowFilterTemplate.parse(template)));
		}
		return new RlsPolicy(Collections.unmodifiableMap(parsed));
	}

	public static RlsPolicy empty() {
		return new RlsPolicy(Map.of());
	}

	public Optional<RowFilterTemplate> templateFor(String role) {
		return Optional.ofNullable(templates.get(Identifiers.normalize(role)));
	}

	public Map<String, RowFilterTemplate> templates() {
		return templates;
	}
}
