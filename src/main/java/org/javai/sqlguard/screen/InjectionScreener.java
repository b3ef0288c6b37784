package org.javai.sqlguard.screen;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pattern-based screen for dangerous SQL constructs.
 *
 * <p>Patterns are evaluated case-insensitively, in configuration order, against the raw
 * statement text; the first match rejects the statement. The screen runs before any structural
 * parsing so that hostile input never reaches the extractor. It complements, and does not
 * replace, parameterized execution.</p>
 */
public final class InjectionScreener {

	private static final Logger logger = LoggerFactory.getLogger(InjectionScreener.class);

	/**
	 * Comment markers, stacked statements, data-modifying keywords, UNION not followed by
	 * SELECT, and the classic {@code OR 1=1} tautology.
	 */
	public static final List<String> DEFAULT_PATTERNS = List.of(
			"--|#",
			";(?!\\s*$)",
			"\\b(DROP|DELETE|INSERT|UPDATE|ALTER|EXEC)\\b",
			"\\bUNION\\b(?!(\\s+SELECT))",
			"\\bOR\\s+1\\s*=\\s*1\\b");

	private final List<Pattern> patterns;

	private InjectionScreener(List<Pattern> patterns) {
		this.patterns = patterns;
	}

	/**
	 * @throws java.util.regex.PatternSyntaxException if a pattern does not compile
	 */
	public static InjectionScreener of(List<String> patterns) {
		return new InjectionScreener(patterns.stream()
				.map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
				.toList());
	}

	public static InjectionScreener withDefaults() {
		return of(DEFAULT_PATTERNS);
	}

	/**
	 * @return true if the statement matches any configured pattern and must be rejected
	 */
	public boolean scan(String sql) {
		return firstMatch(sql).isPresent();
	}

	/**
	 * Finds the first configured pattern that matches the statement.
	 */
	public Optional<InjectionMatch> firstMatch(String sql) {
		if (sql == null) {
			return Optional.empty();
		}
		for (Pattern pattern : patterns) {
			Matcher matcher = pattern.matcher(sql);
			if (matcher.find()) {
				InjectionMatch match = new InjectionMatch(pattern.pattern(), matcher.group());
				logger.warn("SQL injection pattern matched: pattern={}, match='{}'", match.pattern(), match.matchedText());
				return Optional.of(match);
			}
		}
		return Optional.empty();
	}

	public List<String> patterns() {
		return patterns.stream().map(Pattern::pattern).toList();
	}

	/**
	 * @param pattern the pattern source that matched
	 * @param matchedText the matched fragment of the statement
	 */
	public record InjectionMatch(String pattern, String matchedText) {
	}
}
