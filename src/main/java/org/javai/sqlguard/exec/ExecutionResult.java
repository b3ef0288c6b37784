package org.javai.sqlguard.exec;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by one statement.
 *
 * @param columns result column labels, in select-list order
 * @param rows one map per row, keyed by column label and ordered like {@code columns}
 * @param rowCount number of rows
 * @param elapsedMillis wall time from submission to the last row read
 */
public record ExecutionResult(List<String> columns, List<Map<String, Object>> rows, int rowCount, long elapsedMillis) {

	public ExecutionResult {
		columns = List.copyOf(columns);
		rows = List.copyOf(rows);
	}

	public boolean isEmpty() {
		return rowCount == 0;
	}
}
