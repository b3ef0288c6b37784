package org.javai.sqlguard.policy;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.sqlguard.catalog.Identifiers;
import org.javai.sqlguard.identity.Identity;

/**
 * A per-role row filter of the form {@code [table.]column = {user_id}}.
 *
 * <p>Quotes written around the placeholder in configuration are ignored; the literal is
 * always derived from the caller's id when the template is bound.</p>
 */
public record RowFilterTemplate(String table, String column, String template) {

	public static final String PLACEHOLDER = "{user_id}";

	private static final Pattern TEMPLATE_PATTERN = Pattern.compile(
			"^\\s*(?:([A-Za-z_][A-Za-z0-9_$]*)\\.)?([A-Za-z_][A-Za-z0-9_$]*)\\s*=\\s*('?)\\{user_id\\}\\3\\s*$");

	/**
	 * @throws IllegalArgumentException if the template is not a single equality on the placeholder
	 */
	public static RowFilterTemplate parse(String template) {
		if (template == null || !template.contains(PLACEHOLDER)) {
			throw new IllegalArgumentException("Row filter template must contain " + PLACEHOLDER + ": " + template);
		}
		Matcher matcher = TEMPLATE_PATTERN.matcher(template);
		if (!matcher.matches()) {
			throw new IllegalArgumentException(
					"Row filter template must have the form [table.]column = " + PLACEHOLDER + ": " + template);
		}
		return new RowFilterTemplate(
				Identifiers.normalize(matcher.group(1)),
				Identifiers.normalize(matcher.group(2)),
				template);
	}

	/**
	 * Substitutes the caller's id: integers stay bare, anything else is quoted with embedded
	 * quotes doubled.
	 *
	 * @throws IllegalArgumentException if the identity carries no subject id
	 */
	public RowFilterPredicate bind(Identity identity) {
		if (!identity.hasSubjectId()) {
			throw new IllegalArgumentException("Cannot bind row filter for identity without subject id: " + identity.describe());
		}
		String literal = identity.isNumericSubject()
				? identity.subjectId().trim()
				: "'" + identity.subjectId().replace("'", "''") + "'";
		return new RowFilterPredicate(table, column, literal);
	}
}
