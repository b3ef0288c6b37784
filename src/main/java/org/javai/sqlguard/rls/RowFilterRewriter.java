package org.javai.sqlguard.rls;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.javai.sqlguard.identity.Identity;
import org.javai.sqlguard.policy.RlsPolicy;
import org.javai.sqlguard.policy.RowFilterPredicate;
import org.javai.sqlguard.policy.RowFilterTemplate;
import org.javai.sqlguard.sql.SqlToken;
import org.javai.sqlguard.sql.SqlTokenKind;
import org.javai.sqlguard.sql.SqlTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds the caller's row filter to an authorized statement.
 *
 * <p>Each top-level SELECT branch (branches are separated by UNION, INTERSECT or EXCEPT) is
 * filtered on its own, and so is every subquery that reads the filtered table:</p>
 * <ul>
 *   <li>the predicate is written once for every occurrence of the table in the branch, against
 *       that occurrence's alias, so a self-join is filtered on both sides;</li>
 *   <li>a branch whose top-level WHERE already contains each of those predicates as a
 *       conjunct, and has no top-level OR, is left alone;</li>
 *   <li>an existing WHERE gets {@code AND <predicate>}, with the original condition
 *       parenthesised when it contains a top-level OR;</li>
 *   <li>otherwise a WHERE clause is inserted before any GROUP BY, HAVING, WINDOW, ORDER BY,
 *       LIMIT, OFFSET or FETCH tail.</li>
 * </ul>
 *
 * <p>A top-level branch that names the table nowhere, not even in a subquery, still gets the
 * table-qualified predicate, which the database rejects. Matching is done on tokens, so text inside string literals never
 * counts as a filter. Applying the rewrite to its own output returns that output unchanged.</p>
 */
public class RowFilterRewriter {

	private static final Logger logger = LoggerFactory.getLogger(RowFilterRewriter.class);

	private static final Set<String> SET_OPERATORS = Set.of("UNION", "INTERSECT", "EXCEPT");
	private static final Set<String> TAIL_KEYWORDS = Set.of("GROUP", "HAVING", "WINDOW", "ORDER", "LIMIT", "OFFSET", "FETCH");
	private static final Set<String> TABLE_KEYWORDS = Set.of("FROM", "JOIN");

	private final RlsPolicy rls;

	public RowFilterRewriter(RlsPolicy rls) {
		this.rls = rls;
	}

	/**
	 * @return the statement restricted to the caller's rows, or the input unchanged when the
	 *         role has no row filter or every branch already carries it
	 * @throws IllegalArgumentException if the role is row-filtered but the identity has no subject id
	 */
	public String applyRowFilter(String sql, Identity identity) {
		Optional<RowFilterTemplate> template = rls.templateFor(identity.role());
		if (template.isEmpty()) {
			return sql;
		}
		RowFilterPredicate predicate = template.get().bind(identity);

		List<SqlToken> tokens = significantTokens(SqlTokenizer.tokenize(sql));
		if (tokens.isEmpty()) {
			return sql;
		}
		int[] depths = depths(tokens);

		List<Insertion> insertions = new ArrayList<>();
		filterScope(tokens, depths, 0, tokens.size(), 0, true, predicate, insertions);
		if (predicate.isQualified()) {
			for (int i = 0; i < tokens.size(); i++) {
				if (opensSubquery(tokens, i)) {
					int close = closingParen(tokens, depths, i);
					filterScope(tokens, depths, i + 1, close, depths[i] + 1, false, predicate, insertions);
				}
			}
		}

		if (insertions.isEmpty()) {
			logger.debug("Row filter {} already present; statement unchanged", predicate);
			return sql;
		}

		StringBuilder rewritten = new StringBuilder(sql.substring(0, tokens.get(tokens.size() - 1).end()));
		// equal offsets: apply later insertions first so that the earlier text ends up in front
		insertions.sort(Comparator.comparingInt(Insertion::offset).thenComparingInt(Insertion::sequence).reversed());
		for (Insertion insertion : insertions) {
			rewritten.insert(insertion.offset(), insertion.text());
		}
		String result = rewritten.toString();
		logger.debug("Applied row filter {} for {}: {}", predicate, identity.describe(), result);
		return result;
	}

	/**
	 * Filters every set-operation branch of the SELECT spanning {@code [from, to)} whose own
	 * tokens sit at parenthesis depth {@code level}.
	 *
	 * @param required whether branches that never name the table still get the predicate
	 */
	private void filterScope(List<SqlToken> tokens, int[] depths, int from, int to, int level, boolean required,
			RowFilterPredicate predicate, List<Insertion> insertions) {
		int branchStart = from;
		for (int i = from; i <= to; i++) {
			boolean boundary = i == to || (depths[i] == level && tokens.get(i).isKeywordIn(SET_OPERATORS));
			if (boundary) {
				if (i > branchStart) {
					filterBranch(tokens, depths, branchStart, i, level, required, predicate, insertions);
				}
				branchStart = i + 1;
			}
		}
	}

	private void filterBranch(List<SqlToken> tokens, int[] depths, int from, int to, int level, boolean required,
			RowFilterPredicate predicate, List<Insertion> insertions) {
		List<RowFilterPredicate> locals = new ArrayList<>();
		if (predicate.isQualified()) {
			for (String qualifier : qualifiersFor(tokens, from, to, predicate.table())) {
				locals.add(new RowFilterPredicate(qualifier, predicate.column(), predicate.valueLiteral()));
			}
			if (locals.isEmpty()) {
				// subqueries that read the table are filtered in their own scope
				if (!required || namesTable(tokens, from, to, predicate.table())) {
					return;
				}
				locals.add(predicate);
			}
		}
		else {
			locals.add(predicate);
		}

		int where = -1;
		int tail = -1;
		for (int i = from; i < to; i++) {
			if (depths[i] != level) {
				continue;
			}
			SqlToken token = tokens.get(i);
			if (where < 0 && tail < 0 && token.isKeyword("WHERE")) {
				where = i;
			}
			else if (tail < 0 && token.isKeywordIn(TAIL_KEYWORDS)) {
				tail = i;
			}
		}

		if (where < 0) {
			String condition = render(locals);
			if (tail >= 0) {
				insertions.add(new Insertion(tokens.get(tail).start(), insertions.size(), "WHERE " + condition + " "));
			}
			else {
				insertions.add(new Insertion(tokens.get(to - 1).end(), insertions.size(), " WHERE " + condition));
			}
			return;
		}

		int spanStart = where + 1;
		int spanEnd = tail >= 0 ? tail : to;
		if (spanStart >= spanEnd) {
			insertions.add(new Insertion(tokens.get(where).end(), insertions.size(), " " + render(locals)));
			return;
		}
		boolean topLevelOr = false;
		for (int i = spanStart; i < spanEnd; i++) {
			if (depths[i] == level && tokens.get(i).isKeyword("OR")) {
				topLevelOr = true;
				break;
			}
		}
		List<RowFilterPredicate> missing = new ArrayList<>();
		for (RowFilterPredicate local : locals) {
			List<RowFilterPredicate> forms = locals.size() == 1 ? List.of(predicate, local) : List.of(local);
			boolean unqualifiedAccepted = locals.size() == 1;
			if (topLevelOr || !containsConjunct(tokens, depths, spanStart, spanEnd, level, forms, unqualifiedAccepted)) {
				missing.add(local);
			}
		}
		if (missing.isEmpty()) {
			return;
		}
		int conditionEnd = tokens.get(spanEnd - 1).end();
		if (topLevelOr) {
			insertions.add(new Insertion(tokens.get(spanStart).start(), insertions.size(), "("));
			insertions.add(new Insertion(conditionEnd, insertions.size(), ") AND " + render(missing)));
		}
		else {
			insertions.add(new Insertion(conditionEnd, insertions.size(), " AND " + render(missing)));
		}
	}

	private static String render(List<RowFilterPredicate> predicates) {
		StringBuilder condition = new StringBuilder();
		for (RowFilterPredicate predicate : predicates) {
			if (condition.length() > 0) {
				condition.append(" AND ");
			}
			condition.append(predicate.render());
		}
		return condition.toString();
	}

	/**
	 * Looks for one of the predicate forms, or its unqualified form when that is unambiguous,
	 * standing as a whole conjunct of the WHERE condition.
	 */
	private boolean containsConjunct(List<SqlToken> tokens, int[] depths, int spanStart, int spanEnd, int level,
			List<RowFilterPredicate> predicates, boolean unqualifiedAccepted) {
		List<List<SqlToken>> forms = new ArrayList<>();
		for (RowFilterPredicate predicate : predicates) {
			forms.add(SqlTokenizer.tokenize(predicate.render()));
		}
		if (unqualifiedAccepted) {
			forms.add(SqlTokenizer.tokenize(predicates.get(0).unqualified()));
		}
		for (int i = spanStart; i < spanEnd; i++) {
			if (depths[i] != level) {
				continue;
			}
			boolean startsConjunct = i == spanStart || tokens.get(i - 1).isKeyword("AND");
			if (!startsConjunct) {
				continue;
			}
			for (List<SqlToken> form : forms) {
				int end = i + form.size();
				if (end <= spanEnd && matches(tokens, i, form)
						&& (end == spanEnd || tokens.get(end).isKeyword("AND"))) {
					return true;
				}
			}
		}
		return false;
	}

	private boolean matches(List<SqlToken> tokens, int at, List<SqlToken> form) {
		for (int k = 0; k < form.size(); k++) {
			if (!tokens.get(at + k).sameAs(form.get(k))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return the alias (or the bare table name) of every place the branch names the table in a
	 *         FROM list, including parenthesised joins but not nested subqueries
	 */
	private Set<String> qualifiersFor(List<SqlToken> tokens, int from, int to, String table) {
		Set<String> qualifiers = new LinkedHashSet<>();
		Deque<Boolean> parens = new ArrayDeque<>();
		int subqueries = 0;
		for (int i = from; i < to; i++) {
			SqlToken token = tokens.get(i);
			if (token.is(SqlTokenKind.LEFT_PAREN)) {
				boolean subquery = opensSubquery(tokens, i);
				parens.push(subquery);
				if (subquery) {
					subqueries++;
				}
				continue;
			}
			if (token.is(SqlTokenKind.RIGHT_PAREN)) {
				if (!parens.isEmpty() && parens.pop()) {
					subqueries--;
				}
				continue;
			}
			if (subqueries > 0 || !token.is(SqlTokenKind.IDENTIFIER) || !token.text().equals(table)
					|| !inTablePosition(tokens, from, i)) {
				continue;
			}
			int next = i + 1;
			if (next < to && tokens.get(next).isKeyword("AS")) {
				next++;
			}
			if (next < to && tokens.get(next).is(SqlTokenKind.IDENTIFIER)) {
				qualifiers.add(tokens.get(next).text());
			}
			else {
				qualifiers.add(table);
			}
		}
		return qualifiers;
	}

	private boolean namesTable(List<SqlToken> tokens, int from, int to, String table) {
		for (int i = from; i < to; i++) {
			SqlToken token = tokens.get(i);
			if (token.is(SqlTokenKind.IDENTIFIER) && token.text().equals(table) && inTablePosition(tokens, from, i)) {
				return true;
			}
		}
		return false;
	}

	private static boolean opensSubquery(List<SqlToken> tokens, int index) {
		return tokens.get(index).is(SqlTokenKind.LEFT_PAREN) && index + 1 < tokens.size()
				&& (tokens.get(index + 1).isKeyword("SELECT") || tokens.get(index + 1).isKeyword("WITH"));
	}

	/**
	 * @return the index of the parenthesis closing the one at {@code open}, or the token count
	 */
	private static int closingParen(List<SqlToken> tokens, int[] depths, int open) {
		for (int j = open + 1; j < tokens.size(); j++) {
			if (tokens.get(j).is(SqlTokenKind.RIGHT_PAREN) && depths[j] == depths[open]) {
				return j;
			}
		}
		return tokens.size();
	}

	private boolean inTablePosition(List<SqlToken> tokens, int from, int index) {
		int prev = index - 1;
		// schema-qualified table name
		if (prev - 1 >= from && tokens.get(prev).is(SqlTokenKind.DOT) && tokens.get(prev - 1).is(SqlTokenKind.IDENTIFIER)) {
			prev -= 2;
		}
		if (prev < from) {
			return false;
		}
		SqlToken before = tokens.get(prev);
		return before.isKeywordIn(TABLE_KEYWORDS) || before.isKeyword("ONLY") || before.is(SqlTokenKind.COMMA)
				|| before.is(SqlTokenKind.LEFT_PAREN);
	}

	private static List<SqlToken> significantTokens(List<SqlToken> tokens) {
		int last = tokens.size() - 1;
		while (last >= 0 && tokens.get(last).is(SqlTokenKind.SEMICOLON)) {
			last--;
		}
		return tokens.subList(0, last + 1);
	}

	private static int[] depths(List<SqlToken> tokens) {
		int[] depths = new int[tokens.size()];
		int depth = 0;
		for (int i = 0; i < tokens.size(); i++) {
			SqlToken token = tokens.get(i);
			if (token.is(SqlTokenKind.RIGHT_PAREN)) {
				depth = Math.max(0, depth - 1);
			}
			depths[i] = depth;
			if (token.is(SqlTokenKind.LEFT_PAREN)) {
				depth++;
			}
		}
		return depths;
	}

	private record Insertion(int offset, int sequence, String text) {
	}
}
