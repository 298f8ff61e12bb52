package com.enterprise.securedb.debug;

import com.enterprise.securedb.template.BoundQuery;

import java.util.List;

/**
 * Debug utility: formats a template next to its {@link BoundQuery}, showing the
 * positional SQL, values-inlined SQL, and the parameter list with types.
 */
public final class QueryDebugger {

    private QueryDebugger() {}

    public static String format(String template, BoundQuery query) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== SQL Query Debug ===\n");

        sb.append("Template:\n  ").append(template).append("\n");
        sb.append("SQL (positional):\n  ").append(query.sql()).append("\n");
        sb.append("SQL (values inlined):\n  ").append(query.toDebugString()).append("\n");

        List<Object> params = query.params();
        sb.append("Parameters (").append(params.size()).append("):\n");
        for (int i = 0; i < params.size(); i++) {
            Object val = params.get(i);
            String typeName = val != null ? val.getClass().getSimpleName() : "null";
            sb.append("  ").append(i + 1).append(" = ").append(val)
                    .append(" (").append(typeName).append(")\n");
        }
        sb.append("======================");
        return sb.toString();
    }
}
