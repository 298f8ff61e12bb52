package com.enterprise.securedb.template;

import com.enterprise.securedb.debug.SqlLiteralFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Driver-ready statement: SQL with positional {@code ?} markers and the values to bind,
 * in marker order. Values may be {@code null}.
 */
public record BoundQuery(String sql, List<Object> params) {

    public BoundQuery {
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    /** Values as an array, for {@code PreparedStatement}-style APIs. */
    public Object[] values() {
        return params.toArray();
    }

    /**
     * Returns the SQL with each {@code ?} replaced by its value as a literal. For logs only;
     * a {@code ?} inside a quoted identifier or string literal is replaced too.
     */
    public String toDebugString() {
        StringBuilder sb = new StringBuilder(sql.length() + params.size() * 8);
        int next = 0;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '?' && next < params.size()) {
                sb.append(SqlLiteralFormatter.format(params.get(next++)));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
