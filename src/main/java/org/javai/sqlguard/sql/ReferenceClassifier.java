package org.javai.sqlguard.sql;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Token-classification pass over a single statement.
 *
 * <p>A small state machine decides, for every identifier, whether it names a table, an alias, a
 * column, a function, a type, or an output label. Parentheses push a frame: a subquery frame
 * starts a fresh clause context, a function frame ignores {@code FROM} (as in
 * {@code EXTRACT(YEAR FROM d)}) and a plain group inherits the surrounding context. Names are
 * not checked against the schema here; see {@link StatementExtractor}.</p>
 */
final class ReferenceClassifier {

	enum ClauseState {
		/** Projection, predicates, ordering: identifiers are column candidates. */
		EXPRESSION,
		/** Directly after FROM, JOIN or a comma in a FROM list. */
		EXPECT_TABLE,
		/** After a table reference: the next bare identifier is its alias. */
		AFTER_TABLE,
		/** After {@code AS} in a FROM list. */
		EXPECT_ALIAS,
		/** After a table alias; a comma returns to {@link #EXPECT_TABLE}. */
		AFTER_ALIAS
	}

	enum FrameKind {
		STATEMENT, SUBQUERY, FUNCTION, GROUP
	}

	private static final Set<String> CLAUSE_KEYWORDS = Set.of(
			"ON", "USING", "WHERE", "GROUP", "HAVING", "ORDER", "LIMIT", "OFFSET", "FETCH", "WINDOW",
			"UNION", "INTERSECT", "EXCEPT", "INTO", "WITH");

	private static final class Frame {
		final FrameKind kind;
		final Frame scope;
		final Set<String> scopeTables = new LinkedHashSet<>();
		ClauseState state;
		String currentTable;
		boolean bareWildcard;

		Frame(FrameKind kind, ClauseState state, Frame enclosing) {
			this.kind = kind;
			this.state = state;
			this.scope = kind == FrameKind.STATEMENT || kind == FrameKind.SUBQUERY ? this : enclosing.scope;
		}
	}

	/**
	 * A possibly qualified name as written; {@code qualifier} is null for a bare name.
	 */
	record NameReference(String qualifier, String name) {
	}

	/**
	 * Raw classification output, before any schema lookup.
	 *
	 * @param tables names in table position, in order of appearance
	 * @param aliases alias → tables it stands for; an empty set marks a derived table
	 * @param columns column candidates
	 * @param qualifiedWildcards qualifiers of {@code q.*} projections
	 * @param wildcardTables tables whose every column is projected by a bare {@code *}
	 */
	record Classification(
			Set<String> tables,
			Map<String, Set<String>> aliases,
			List<NameReference> columns,
			List<String> qualifiedWildcards,
			Set<String> wildcardTables
	) {
	}

	private final List<SqlToken> tokens;
	private final Deque<Frame> frames = new ArrayDeque<>();

	private final Set<String> tables = new LinkedHashSet<>();
	private final Map<String, Set<String>> aliases = new LinkedHashMap<>();
	private final List<NameReference> columns = new ArrayList<>();
	private final List<String> qualifiedWildcards = new ArrayList<>();
	private final Set<String> wildcardTables = new LinkedHashSet<>();

	private SqlToken previous;
	private FrameKind lastClosed;
	private boolean pendingFunction;
	private boolean aliasNext;
	private boolean typeNext;

	private ReferenceClassifier(List<SqlToken> tokens) {
		this.tokens = tokens;
	}

	static Classification classify(List<SqlToken> statement) {
		return new ReferenceClassifier(statement).run();
	}

	private Classification run() {
		frames.push(new Frame(FrameKind.STATEMENT, ClauseState.EXPRESSION, null));
		int i = 0;
		while (i < tokens.size()) {
			SqlToken token = tokens.get(i);
			if (token.is(SqlTokenKind.IDENTIFIER)) {
				i = identifierChain(i);
				continue;
			}
			aliasNext = false;
			typeNext = false;
			switch (token.kind()) {
				case KEYWORD -> keyword(token);
				case STAR -> star();
				case LEFT_PAREN -> openParen(i);
				case RIGHT_PAREN -> closeParen();
				case COMMA -> comma();
				case OPERATOR -> typeNext = "::".equals(token.text());
				default -> {
				}
			}
			if (!token.is(SqlTokenKind.LEFT_PAREN)) {
				pendingFunction = false;
			}
			previous = token;
			i++;
		}
		while (!frames.isEmpty()) {
			closeScope(frames.pop());
		}
		return new Classification(tables, aliases, columns, qualifiedWildcards, wildcardTables);
	}

	/**
	 * Consumes {@code name(.name)*} or {@code name(.name)*.*} starting at {@code start}.
	 *
	 * @return the index of the first token after the chain
	 */
	private int identifierChain(int start) {
		List<String> parts = new ArrayList<>();
		parts.add(tokens.get(start).text());
		int j = start + 1;
		boolean wildcard = false;
		while (j + 1 < tokens.size() && tokens.get(j).is(SqlTokenKind.DOT)) {
			SqlToken next = tokens.get(j + 1);
			if (next.is(SqlTokenKind.IDENTIFIER)) {
				parts.add(next.text());
				j += 2;
			}
			else if (next.is(SqlTokenKind.STAR)) {
				wildcard = true;
				j += 2;
				break;
			}
			else {
				break;
			}
		}
		previous = tokens.get(j - 1);
		String last = parts.get(parts.size() - 1);
		Frame frame = frames.peek();
		boolean call = !wildcard && j < tokens.size() && tokens.get(j).is(SqlTokenKind.LEFT_PAREN);
		boolean skip = aliasNext || typeNext;
		aliasNext = false;
		typeNext = false;

		if (wildcard) {
			qualifiedWildcards.add(last);
		}
		else if (call) {
			pendingFunction = true;
			if (frame.state == ClauseState.EXPECT_TABLE) {
				// a table-valued function; recorded so that it is denied unless it is a catalog table
				recordTable(frame, last);
				frame.currentTable = null;
			}
		}
		else if (skip) {
			pendingFunction = false;
		}
		else {
			switch (frame.state) {
				case EXPECT_TABLE -> {
					recordTable(frame, last);
					frame.currentTable = last;
					frame.state = ClauseState.AFTER_TABLE;
				}
				case AFTER_TABLE, EXPECT_ALIAS -> {
					if (parts.size() == 1) {
						recordAlias(last, frame.currentTable);
						frame.state = ClauseState.AFTER_ALIAS;
					}
					else {
						recordColumn(parts);
					}
				}
				default -> recordColumn(parts);
			}
		}
		return j;
	}

	private void keyword(SqlToken token) {
		Frame frame = frames.peek();
		switch (token.text()) {
			case "SELECT" -> frame.state = ClauseState.EXPRESSION;
			case "FROM", "JOIN" -> {
				// IS [NOT] DISTINCT FROM is a comparison
				boolean comparison = previous != null && previous.isKeyword("DISTINCT");
				if (frame.kind != FrameKind.FUNCTION && !comparison) {
					frame.state = ClauseState.EXPECT_TABLE;
				}
			}
			case "AS" -> {
				if (frame.state == ClauseState.AFTER_TABLE) {
					frame.state = ClauseState.EXPECT_ALIAS;
				}
				else if (frame.state == ClauseState.EXPRESSION) {
					aliasNext = true;
				}
			}
			default -> {
				if (CLAUSE_KEYWORDS.contains(token.text())) {
					frame.state = ClauseState.EXPRESSION;
				}
			}
		}
	}

	private void star() {
		boolean multiplication = previous != null && switch (previous.kind()) {
			case IDENTIFIER, NUMBER, STRING, PARAMETER -> true;
			case RIGHT_PAREN -> lastClosed == FrameKind.FUNCTION;
			default -> false;
		};
		boolean countAll = previous != null && previous.is(SqlTokenKind.LEFT_PAREN)
				&& frames.peek().kind == FrameKind.FUNCTION;
		if (!multiplication && !countAll) {
			frames.peek().scope.bareWildcard = true;
		}
	}

	private void openParen(int index) {
		SqlToken next = index + 1 < tokens.size() ? tokens.get(index + 1) : null;
		Frame parent = frames.peek();
		FrameKind kind;
		if (next != null && (next.isKeyword("SELECT") || next.isKeyword("WITH"))) {
			kind = FrameKind.SUBQUERY;
		}
		else if (pendingFunction || (previous != null && (previous.isKeyword("CAST") || previous.isKeyword("ARRAY")))) {
			kind = FrameKind.FUNCTION;
		}
		else {
			kind = FrameKind.GROUP;
		}
		pendingFunction = false;
		ClauseState state = ClauseState.EXPRESSION;
		if (kind == FrameKind.GROUP && parent.state == ClauseState.EXPECT_TABLE) {
			state = ClauseState.EXPECT_TABLE;
		}
		frames.push(new Frame(kind, state, parent));
	}

	private void closeParen() {
		if (frames.size() == 1) {
			return;
		}
		Frame closed = frames.pop();
		closeScope(closed);
		lastClosed = closed.kind;
		Frame parent = frames.peek();
		if (parent.state == ClauseState.EXPECT_TABLE) {
			parent.state = ClauseState.AFTER_TABLE;
			parent.currentTable = null;
		}
	}

	private void comma() {
		Frame frame = frames.peek();
		if (frame.state == ClauseState.AFTER_TABLE || frame.state == ClauseState.EXPECT_ALIAS
				|| frame.state == ClauseState.AFTER_ALIAS) {
			frame.state = ClauseState.EXPECT_TABLE;
		}
	}

	private void closeScope(Frame frame) {
		if (frame.scope == frame && frame.bareWildcard) {
			wildcardTables.addAll(frame.scopeTables);
		}
	}

	private void recordTable(Frame frame, String table) {
		tables.add(table);
		frame.scope.scopeTables.add(table);
	}

	private void recordAlias(String alias, String table) {
		Set<String> targets = aliases.computeIfAbsent(alias, k -> new LinkedHashSet<>());
		if (table != null) {
			targets.add(table);
		}
	}

	private void recordColumn(List<String> parts) {
		int size = parts.size();
		String qualifier = size > 1 ? parts.get(size - 2) : null;
		columns.add(new NameReference(qualifier, parts.get(size - 1)));
	}
}
