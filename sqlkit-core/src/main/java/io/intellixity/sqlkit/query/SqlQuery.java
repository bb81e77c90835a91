package io.intellixity.sqlkit.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** SQL text with positional ({@code ?}) parameters. */
public record SqlQuery(String sql, List<Object> params) {
  public SqlQuery {
    Objects.requireNonNull(sql, "sql");
    if (sql.isBlank()) throw new IllegalArgumentException("sql must not be blank");
    // List.copyOf rejects nulls, and SQL NULL is a legitimate parameter.
    params = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static SqlQuery of(String sql, Object... params) {
    return new SqlQuery(sql, (params == null) ? List.of() : Arrays.asList(params));
  }

  /** This query with extra trailing SQL and parameters appended. */
  public SqlQuery append(String moreSql, Object... moreParams) {
    List<Object> all = new ArrayList<>(params);
    if (moreParams != null) all.addAll(Arrays.asList(moreParams));
    return new SqlQuery(sql + moreSql, all);
  }
}
