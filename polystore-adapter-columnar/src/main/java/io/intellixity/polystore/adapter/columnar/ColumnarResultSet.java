package io.intellixity.polystore.adapter.columnar;

import java.util.List;
import java.util.Map;

/**
 * Column-oriented query result.
 *
 * @param source  named query name, or {@code "statement"} for raw SQL
 * @param trusted true only for named queries
 * @param vectors column label to its values, in row order
 */
public record ColumnarResultSet(String source,
                                boolean trusted,
                                List<String> columns,
                                List<String> types,
                                Map<String, List<Object>> vectors,
                                long rowCount) {}
