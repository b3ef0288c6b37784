package org.javai.sqlguard.policy;

/**
 * A concrete row filter bound to one caller, e.g. {@code orders.employee_id = 8}.
 *
 * @param table the qualifying table, or an empty string for an unqualified predicate
 * @param column the filtered column
 * @param valueLiteral the SQL literal of the caller's id: a bare integer or a quoted string
 */
public record RowFilterPredicate(String table, String column, String valueLiteral) {

	public boolean isQualified() {
		return !table.isEmpty();
	}

	/**
	 * @return the predicate as it is appended to statements
	 */
	public String render() {
		return isQualified() ? table + "." + unqualified() : unqualified();
	}

	/**
	 * @return the predicate without its table qualifier, e.g. {@code employee_id = 8}
	 */
	public String unqualified() {
		return column + " = " + valueLiteral;
	}

	@Override
	public String toString() {
		return render();
	}
}
