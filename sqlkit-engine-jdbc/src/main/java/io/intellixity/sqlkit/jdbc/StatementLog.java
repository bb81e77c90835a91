package io.intellixity.sqlkit.jdbc;

import io.intellixity.sqlkit.query.SqlQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Statement logging shared by sessions and schema materialization. Bound values are never logged. */
final class StatementLog {
  private static final Logger log = LoggerFactory.getLogger("io.intellixity.sqlkit.jdbc.sql");

  private StatementLog() {}

  static void sql(JdbcHandle h, String op, SqlQuery q) {
    sql(h, op, q.sql(), q.params());
  }

  static void sql(JdbcHandle h, String op, String sql, List<Object> params) {
    int bindCount = params.size();
    if (h.echo()) {
      log.info("sqlkit.jdbc op={} bindCount={} handleId={} sql={}", op, bindCount, h.id(), sql);
    } else if (log.isDebugEnabled()) {
      log.debug("sqlkit.jdbc op={} bindCount={} handleId={} sql={}", op, bindCount, h.id(), sql);
    }

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : params) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : (v instanceof byte[] b) ? b.length : -1;
        log.trace("sqlkit.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  static void done(JdbcHandle h, String op, Object result, long durationNanos) {
    if (!h.echo() && !log.isDebugEnabled()) return;
    String msg = "sqlkit.jdbc_done op={} handleId={} durationMs={} result={}";
    if (h.echo()) log.info(msg, op, h.id(), durationNanos / 1_000_000.0, safeResult(result));
    else log.debug(msg, op, h.id(), durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof CharSequence cs) return "len=" + cs.length();
    return r.getClass().getSimpleName();
  }
}
