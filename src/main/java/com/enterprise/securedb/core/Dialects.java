package com.enterprise.securedb.core;

import org.springframework.boot.jdbc.DatabaseDriver;

import java.util.Locale;
import java.util.Map;

public final class Dialects {

    private Dialects() {}

    public static final SqlDialect ANSI = new Standard("ansi", '"', '"', false);
    public static final SqlDialect MYSQL = new Standard("mysql", '`', '`', true);
    public static final SqlDialect POSTGRES = new Standard("pgsql", '"', '"', true);
    public static final SqlDialect SQLITE = new Standard("sqlite", '`', '`', true);
    public static final SqlDialect SQLSERVER = new Standard("sqlsrv", '[', ']', false);
    public static final SqlDialect ORACLE = new Standard("oci", '"', '"', false);
    public static final SqlDialect FIREBIRD = new Standard("firebird", '"', '"', false);
    public static final SqlDialect H2 = new Standard("h2", '"', '"', true);

    private static final Map<String, SqlDialect> BY_NAME = Map.ofEntries(
            Map.entry("ansi", ANSI),
            Map.entry("mysql", MYSQL),
            Map.entry("mariadb", MYSQL),
            Map.entry("pgsql", POSTGRES),
            Map.entry("postgres", POSTGRES),
            Map.entry("postgresql", POSTGRES),
            Map.entry("sqlite", SQLITE),
            Map.entry("sqlsrv", SQLSERVER),
            Map.entry("sqlserver", SQLSERVER),
            Map.entry("mssql", SQLSERVER),
            Map.entry("oci", ORACLE),
            Map.entry("oracle", ORACLE),
            Map.entry("firebird", FIREBIRD),
            Map.entry("h2", H2));

    /**
     * Resolves a dialect tag, case-insensitively. Unknown or null tags fall back to
     * {@link #ANSI} (double quotes on both sides).
     */
    public static SqlDialect forName(String name) {
        if (name == null) {
            return ANSI;
        }
        return BY_NAME.getOrDefault(name.trim().toLowerCase(Locale.ROOT), ANSI);
    }

    /** Maps Spring Boot's driver detection onto a dialect. */
    public static SqlDialect forDriver(DatabaseDriver driver) {
        if (driver == null) {
            return ANSI;
        }
        return switch (driver) {
            case MYSQL, MARIADB -> MYSQL;
            case POSTGRESQL -> POSTGRES;
            case SQLITE -> SQLITE;
            case SQLSERVER -> SQLSERVER;
            case ORACLE -> ORACLE;
            case FIREBIRD -> FIREBIRD;
            case H2 -> H2;
            default -> ANSI;
        };
    }

    public static SqlDialect forJdbcUrl(String url) {
        return forDriver(DatabaseDriver.fromJdbcUrl(url));
    }

    public static SqlDialect forProductName(String productName) {
        return forDriver(DatabaseDriver.fromProductName(productName));
    }

    private record Standard(String name, char openQuote, char closeQuote, boolean limitKeyword)
            implements SqlDialect {

        @Override
        public String limitOffset(int count, int skip) {
            if (limitKeyword) {
                return "LIMIT " + count + " OFFSET " + skip;
            }
            // OFFSET .. FETCH is shared by SQL Server 2012+, Oracle 12c+ and Firebird 3+
            return "OFFSET " + skip + " ROWS FETCH NEXT " + count + " ROWS ONLY";
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
