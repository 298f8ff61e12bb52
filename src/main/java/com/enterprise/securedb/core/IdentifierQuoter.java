package com.enterprise.securedb.core;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Dialect-aware quoting of table and column names.
 *
 * <p>Qualified names are split on every {@code .} and each segment is quoted on its own,
 * so {@code app.users} becomes {@code `app`.`users`}. Within a segment, leading and trailing
 * quote characters of the dialect's pair are stripped first (quoting an already quoted name
 * does not double-wrap it), then embedded quote characters are doubled: the open character
 * always, and the close character too when the pair is asymmetric ({@code [ ]}).
 *
 * <p>Immutable and thread-safe.
 */
public final class IdentifierQuoter {

    private final SqlDialect dialect;
    private final String open;
    private final String close;

    public IdentifierQuoter(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.open = String.valueOf(dialect.openQuote());
        this.close = String.valueOf(dialect.closeQuote());
    }

    public IdentifierQuoter(String dialectName) {
        this(Dialects.forName(dialectName));
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public String quoteIdentifier(String identifier) {
        Objects.requireNonNull(identifier, "identifier");
        if (identifier.indexOf('.') < 0) {
            return quoteSegment(identifier);
        }
        // split with limit -1 keeps empty segments: "a." -> ["a", ""]
        StringBuilder sb = new StringBuilder();
        String[] parts = identifier.split("\\.", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(quoteSegment(parts[i]));
        }
        return sb.toString();
    }

    public List<String> quoteIdentifiers(List<String> identifiers) {
        return identifiers.stream()
                .map(this::quoteIdentifier)
                .collect(Collectors.toList());
    }

    private String quoteSegment(String segment) {
        String escaped = strip(segment).replace(open, open + open);
        if (!close.equals(open)) {
            escaped = escaped.replace(close, close + close);
        }
        return open + escaped + close;
    }

    private String strip(String segment) {
        int start = 0;
        int end = segment.length();
        while (start < end && isQuoteChar(segment.charAt(start))) {
            start++;
        }
        while (end > start && isQuoteChar(segment.charAt(end - 1))) {
            end--;
        }
        return segment.substring(start, end);
    }

    private boolean isQuoteChar(char c) {
        return c == dialect.openQuote() || c == dialect.closeQuote();
    }
}
