package org.javai.sqlguard.sql;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.CaseExpression;
import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExtractExpression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.WhenClause;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.ExistsExpression;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsBooleanExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.GroupByElement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.javai.sqlguard.catalog.Identifiers;
import org.javai.sqlguard.sql.ReferenceClassifier.NameReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Table, alias and column names read from the JSqlParser tree of a statement.
 *
 * <p>Used alongside {@link ReferenceClassifier} so that a reference the database will see is
 * recorded even where the two lexers disagree about where a literal ends.</p>
 */
final class ParseTreeReferences {

	private static final Logger logger = LoggerFactory.getLogger(ParseTreeReferences.class);

	private final Set<String> tables = new LinkedHashSet<>();
	private final Map<String, Set<String>> aliases = new LinkedHashMap<>();
	private final List<NameReference> columns = new ArrayList<>();

	private ParseTreeReferences() {
	}

	/**
	 * @return the references of a single SELECT, or empty when JSqlParser does not accept the text
	 */
	static Optional<ParseTreeReferences> of(String sql) {
		Statement statement;
		try {
			statement = CCJSqlParserUtil.parse(sql);
		}
		catch (JSQLParserException e) {
			logger.debug("Statement not accepted by JSqlParser; using the token scan only: {}", e.getMessage());
			return Optional.empty();
		}
		if (!(statement instanceof Select select)) {
			return Optional.empty();
		}
		ParseTreeReferences references = new ParseTreeReferences();
		try {
			TablesNamesFinder<Void> finder = new TablesNamesFinder<>();
			for (String name : finder.getTables((Statement) select)) {
				references.tables.add(normalize(name));
			}
		}
		catch (UnsupportedOperationException e) {
			logger.debug("TablesNamesFinder does not support this statement: {}", e.getMessage());
		}
		references.select(select);
		return Optional.of(references);
	}

	Set<String> tables() {
		return tables;
	}

	Map<String, Set<String>> aliases() {
		return aliases;
	}

	List<NameReference> columns() {
		return columns;
	}

	private void select(Select select) {
		if (select instanceof PlainSelect plain) {
			plainSelect(plain);
		}
		else if (select instanceof SetOperationList setOperations) {
			setOperations.getSelects().forEach(this::select);
		}
		else if (select instanceof ParenthesedSelect parenthesed) {
			select(parenthesed.getSelect());
		}
	}

	private void plainSelect(PlainSelect plain) {
		if (plain.getSelectItems() != null) {
			for (SelectItem<?> item : plain.getSelectItems()) {
				expression(item.getExpression());
			}
		}
		fromItem(plain.getFromItem());
		joins(plain.getJoins());
		expression(plain.getWhere());
		GroupByElement groupBy = plain.getGroupBy();
		if (groupBy != null) {
			expression(groupBy.getGroupByExpressionList());
		}
		expression(plain.getHaving());
		if (plain.getOrderByElements() != null) {
			for (OrderByElement element : plain.getOrderByElements()) {
				expression(element.getExpression());
			}
		}
	}

	private void joins(List<Join> joins) {
		if (joins == null) {
			return;
		}
		for (Join join : joins) {
			fromItem(join.getRightItem());
			if (join.getOnExpressions() != null) {
				join.getOnExpressions().forEach(this::expression);
			}
			if (join.getUsingColumns() != null) {
				join.getUsingColumns().forEach(this::expression);
			}
		}
	}

	private void fromItem(FromItem item) {
		if (item == null) {
			return;
		}
		String alias = item.getAlias() != null ? normalize(item.getAlias().getName()) : null;
		if (item instanceof Table table) {
			String name = normalize(table.getName());
			tables.add(name);
			if (alias != null) {
				aliases.computeIfAbsent(alias, k -> new LinkedHashSet<>()).add(name);
			}
		}
		else if (item instanceof Select subquery) {
			if (alias != null) {
				// derived table
				aliases.computeIfAbsent(alias, k -> new LinkedHashSet<>());
			}
			select(subquery);
		}
		else if (item instanceof ParenthesedFromItem parenthesed) {
			fromItem(parenthesed.getFromItem());
			joins(parenthesed.getJoins());
		}
		else if (item instanceof TableFunction function) {
			expression(function.getFunction());
		}
	}

	private void expression(Expression expression) {
		if (expression == null) {
			return;
		}
		if (expression instanceof Column column) {
			Table table = column.getTable();
			String qualifier = table != null && table.getName() != null ? normalize(table.getName()) : null;
			columns.add(new NameReference(qualifier, normalize(column.getColumnName())));
		}
		else if (expression instanceof Select subquery) {
			select(subquery);
		}
		else if (expression instanceof ExpressionList<?> list) {
			for (Expression item : list) {
				expression(item);
			}
		}
		else if (expression instanceof BinaryExpression binary) {
			expression(binary.getLeftExpression());
			expression(binary.getRightExpression());
		}
		else if (expression instanceof Function function) {
			expression(function.getParameters());
		}
		else if (expression instanceof AnalyticExpression analytic) {
			expression(analytic.getExpression());
		}
		else if (expression instanceof CaseExpression caseExpression) {
			expression(caseExpression.getSwitchExpression());
			if (caseExpression.getWhenClauses() != null) {
				for (WhenClause when : caseExpression.getWhenClauses()) {
					expression(when.getWhenExpression());
					expression(when.getThenExpression());
				}
			}
			expression(caseExpression.getElseExpression());
		}
		else if (expression instanceof CastExpression cast) {
			expression(cast.getLeftExpression());
		}
		else if (expression instanceof NotExpression not) {
			expression(not.getExpression());
		}
		else if (expression instanceof SignedExpression signed) {
			expression(signed.getExpression());
		}
		else if (expression instanceof InExpression in) {
			expression(in.getLeftExpression());
			expression(in.getRightExpression());
		}
		else if (expression instanceof Between between) {
			expression(between.getLeftExpression());
			expression(between.getBetweenExpressionStart());
			expression(between.getBetweenExpressionEnd());
		}
		else if (expression instanceof IsNullExpression isNull) {
			expression(isNull.getLeftExpression());
		}
		else if (expression instanceof IsBooleanExpression isBoolean) {
			expression(isBoolean.getLeftExpression());
		}
		else if (expression instanceof ExistsExpression exists) {
			expression(exists.getRightExpression());
		}
		else if (expression instanceof ExtractExpression extract) {
			expression(extract.getExpression());
		}
	}

	/**
	 * Strips a schema prefix and identifier quotes, then normalizes like catalog names.
	 */
	static String normalize(String name) {
		if (name == null) {
			return "";
		}
		String last = name.trim();
		if (!last.endsWith("\"") && !last.endsWith("`")) {
			last = last.substring(last.lastIndexOf('.') + 1);
		}
		else {
			char quote = last.charAt(last.length() - 1);
			int open = last.lastIndexOf("." + quote);
			last = last.substring(open + 1);
			if (last.length() >= 2 && last.charAt(0) == quote) {
				last = last.substring(1, last.length() - 1).replace(String.valueOf(quote) + quote, String.valueOf(quote));
			}
		}
		return Identifiers.normalize(last);
	}
}
