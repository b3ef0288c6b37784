package org.javai.sqlguard.generate;

import org.javai.sqlguard.catalog.SchemaCatalog;
import org.javai.sqlguard.catalog.TableRelationship;
import org.javai.sqlguard.identity.Identity;

/**
 * Renders the system and user messages for SQL generation.
 *
 * <p>The schema section lists only what the caller's role may read, so the model is never told
 * about tables it cannot use. Whatever the model answers is still authorized independently.</p>
 */
public class GenerationPromptBuilder {

	private static final String RULES = """
			You translate questions into SQL for a PostgreSQL database.
			- ONLY generate a single SELECT statement. Never modify data or the database (INSERT, UPDATE, DELETE, DROP, ...).
			- Use only the tables and columns listed in the schema below. If a name is not listed, do not use it.
			- If the request requires tables or columns that are not listed, answer exactly "Access Denied."
			- If the question is not related to the database, answer exactly "I don't know."
			- Join tables only through the foreign key relationships listed below. Do not invent join conditions.
			- Do not use table aliases; always reference tables by their full names.
			- Always list column names in the SELECT clause; do not use SELECT *.
			- You may order the results by a relevant column to return the most interesting examples.
			- If the request is vague or ambiguous, do not guess: answer with CLARIFY: followed by a short clarifying question.
			  Example: User: "Show orders" -> CLARIFY: Do you want all orders, or only open ones?
			- Your response must contain only the SQL query, with no additional text.
			""";

	public String systemPrompt(GenerationRequest request) {
		StringBuilder sb = new StringBuilder(RULES);
		Identity identity = request.identity();
		sb.append("\nCALLER:\n");
		sb.append("- role: ").append(identity.role()).append("\n");
		sb.append("- user id: ").append(identity.subjectId()).append("\n");
		if (request.rowFilter() != null) {
			sb.append("- always apply this WHERE condition: ").append(request.rowFilter().render()).append("\n");
		}
		sb.append("\n").append(schemaSection(request.visibleSchema()));
		return sb.toString().trim();
	}

	public String userPrompt(GenerationRequest request) {
		return "User request: " + request.question().replace("\n", " ").trim();
	}

	String schemaSection(SchemaCatalog schema) {
		if (schema.isEmpty()) {
			return "SCHEMA:\n(no tables are available to this role)\n";
		}
		StringBuilder sb = new StringBuilder("SCHEMA:\n");
		schema.tables().forEach((table, columns) ->
				sb.append("- ").append(table).append(": ").append(String.join(", ", columns)).append("\n"));
		if (!schema.relationships().isEmpty()) {
			sb.append("\nFOREIGN KEY RELATIONSHIPS:\n");
			for (TableRelationship relationship : schema.relationships()) {
				sb.append("- ").append(relationship.describe())
						.append(" (").append(relationship.joinHint()).append(")\n");
			}
		}
		return sb.toString();
	}
}
