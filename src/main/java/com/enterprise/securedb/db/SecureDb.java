package com.enterprise.securedb.db;

import com.enterprise.securedb.core.Dialects;
import com.enterprise.securedb.core.SqlDialect;
import com.enterprise.securedb.exception.EmptyDataException;
import com.enterprise.securedb.exception.SecureDbException;
import com.enterprise.securedb.template.BoundQuery;
import com.enterprise.securedb.template.QueryTemplateEngine;
import com.enterprise.securedb.template.TemplateSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.jdbc.support.MetaDataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * Data-access facade: every query is a template rendered by {@link QueryTemplateEngine}
 * and executed through Spring's {@link JdbcTemplate}.
 *
 * <pre>{@code
 * SecureDb db = SecureDb.withDataSource(dataSource)
 *     .dialect("mysql")
 *     .identifierPrefix("app_")
 *     .build();
 *
 * List<Map<String, Object>> rows = db.select(
 *     "SELECT * FROM ?_users WHERE id IN(?a) { AND active = ? }",
 *     List.of(1, 2, 3), MacroControl.SKIP);
 * }</pre>
 *
 * <p>Thread-safe. Explicit transactions ({@link #transaction()}, {@link #commit()},
 * {@link #rollback()}) are bound to the calling thread.
 */
public final class SecureDb {

    private static final Logger log = LoggerFactory.getLogger(SecureDb.class);

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final PlatformTransactionManager transactionManager;
    private final ThreadLocal<Deque<TransactionStatus>> transactions;
    private final QueryTemplateEngine engine;
    private final ErrorHandler errorHandler;
    private final QueryLogger queryLogger;

    private SecureDb(Builder builder) {
        this.dataSource = builder.dataSource;
        this.jdbcTemplate = new JdbcTemplate(builder.dataSource);
        this.transactionManager = new DataSourceTransactionManager(builder.dataSource);
        this.transactions = new ThreadLocal<>();
        SqlDialect dialect = builder.dialect != null ? builder.dialect : detectDialect(builder.dataSource);
        this.engine = new QueryTemplateEngine(new TemplateSettings(dialect, builder.identifierPrefix));
        this.errorHandler = builder.errorHandler;
        this.queryLogger = builder.queryLogger;
    }

    private SecureDb(SecureDb source, QueryTemplateEngine engine) {
        this.dataSource = source.dataSource;
        this.jdbcTemplate = source.jdbcTemplate;
        this.transactionManager = source.transactionManager;
        this.transactions = source.transactions;
        this.engine = engine;
        this.errorHandler = source.errorHandler;
        this.queryLogger = source.queryLogger;
    }

    public static Builder withDataSource(DataSource dataSource) {
        return new Builder(dataSource);
    }

    /**
     * Opens a {@link DriverManagerDataSource} for the URL and checks that a connection can
     * be made. The dialect is derived from the URL.
     *
     * @throws SecureDbException if no connection can be opened
     */
    public static SecureDb connect(String url, String username, String password) {
        Objects.requireNonNull(url, "url");
        DriverManagerDataSource ds = new DriverManagerDataSource(url, username, password);
        try (Connection ignored = ds.getConnection()) {
            log.debug("Connected to {}", url);
        } catch (SQLException e) {
            throw new SecureDbException("Database connection failed: " + e.getMessage(), e);
        }
        return withDataSource(ds).dialect(Dialects.forJdbcUrl(url)).build();
    }

    public static SecureDb connect(String url) {
        return connect(url, null, null);
    }

    /** A view of this instance that renders {@code ?_name} with the given prefix. */
    public SecureDb withIdentifierPrefix(String prefix) {
        return new SecureDb(this, new QueryTemplateEngine(engine.settings().withIdentifierPrefix(prefix)));
    }

    public QueryTemplateEngine engine() {
        return engine;
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    // ==================== Queries ====================

    /** Alias of {@link #select}. */
    public List<Map<String, Object>> run(String query, Object... params) {
        return select(query, params);
    }

    public List<Map<String, Object>> select(String query, Object... params) {
        return execute(query, params, bound -> jdbcTemplate.queryForList(bound.sql(), bound.values()));
    }

    public Optional<Map<String, Object>> selectRow(String query, Object... params) {
        ResultSetExtractor<Map<String, Object>> firstRow =
                rs -> rs.next() ? new ColumnMapRowMapper().mapRow(rs, 0) : null;
        return Optional.ofNullable(
                execute(query, params, bound -> jdbcTemplate.query(bound.sql(), firstRow, bound.values())));
    }

    /** Values of the first column of every row. */
    public List<Object> selectCol(String query, Object... params) {
        RowMapper<Object> firstColumn = (rs, rowNum) -> JdbcUtils.getResultSetValue(rs, 1);
        return execute(query, params, bound -> jdbcTemplate.query(bound.sql(), firstColumn, bound.values()));
    }

    /** First column of the first row. */
    public Optional<Object> selectCell(String query, Object... params) {
        ResultSetExtractor<Object> firstCell =
                rs -> rs.next() ? JdbcUtils.getResultSetValue(rs, 1) : null;
        return Optional.ofNullable(
                execute(query, params, bound -> jdbcTemplate.query(bound.sql(), firstCell, bound.values())));
    }

    /**
     * Runs the query once wrapped in {@code COUNT(*)} for the total, and once with the
     * dialect's limit/offset clause appended for the rows.
     */
    public Page selectPage(String query, int limit, int offset, Object... params) {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must be >= 0");
        }
        long total = selectCell("SELECT COUNT(*) FROM (" + query + ") AS count_query", params)
                .map(v -> ((Number) v).longValue())
                .orElse(0L);
        SqlDialect dialect = engine.settings().dialect();
        List<Map<String, Object>> rows = select(query + " " + dialect.limitOffset(limit, offset), params);
        return new Page(total, rows);
    }

    /** Executes a non-SELECT statement and returns the affected row count. */
    public int query(String query, Object... params) {
        return execute(query, params, bound -> jdbcTemplate.update(bound.sql(), bound.values()));
    }

    // ==================== CRUD helpers ====================

    /**
     * Inserts one row and returns the first generated key, or null when the driver
     * reports none.
     */
    public Object insert(String table, Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            throw new EmptyDataException("Insert data cannot be empty");
        }
        List<Object> params = new ArrayList<>();
        params.add(table);
        StringJoiner columns = new StringJoiner(", ");
        for (String column : data.keySet()) {
            columns.add("?#");
            params.add(column);
        }
        params.add(new ArrayList<>(data.values()));
        String template = "INSERT INTO ?# (" + columns + ") VALUES (?a)";

        KeyHolder keyHolder = new GeneratedKeyHolder();
        execute(template, params.toArray(), bound -> {
            PreparedStatementCreator creator = con -> {
                PreparedStatement ps = con.prepareStatement(bound.sql(), Statement.RETURN_GENERATED_KEYS);
                new ArgumentPreparedStatementSetter(bound.values()).setValues(ps);
                return ps;
            };
            return jdbcTemplate.update(creator, keyHolder);
        });

        List<Map<String, Object>> keys = keyHolder.getKeyList();
        if (keys.isEmpty() || keys.get(0).isEmpty()) {
            return null;
        }
        return keys.get(0).values().iterator().next();
    }

    public int update(String table, Map<String, ?> data, Map<String, ?> where) {
        if (data == null || data.isEmpty()) {
            throw new EmptyDataException("Update data cannot be empty");
        }
        if (where == null || where.isEmpty()) {
            throw new EmptyDataException("Update WHERE clause cannot be empty");
        }
        List<Object> params = new ArrayList<>();
        params.add(table);
        params.add(new LinkedHashMap<>(data));
        String template = "UPDATE ?# SET ?a WHERE " + whereClause(where, params);
        return query(template, params.toArray());
    }

    public int delete(String table, Map<String, ?> where) {
        if (where == null || where.isEmpty()) {
            throw new EmptyDataException("Delete WHERE clause cannot be empty");
        }
        List<Object> params = new ArrayList<>();
        params.add(table);
        String template = "DELETE FROM ?# WHERE " + whereClause(where, params);
        return query(template, params.toArray());
    }

    private static String whereClause(Map<String, ?> where, List<Object> params) {
        StringJoiner clause = new StringJoiner(" AND ");
        for (Map.Entry<String, ?> entry : where.entrySet()) {
            clause.add("?# = ?");
            params.add(entry.getKey());
            params.add(entry.getValue());
        }
        return clause.toString();
    }

    // ==================== Transactions ====================

    /** Begins a transaction on the calling thread; nested calls join the outer one. */
    public void transaction() {
        TransactionStatus status;
        try {
            status = transactionManager.getTransaction(new DefaultTransactionDefinition());
        } catch (TransactionException e) {
            throw new SecureDbException("Cannot begin transaction: " + e.getMessage(), e);
        }
        Deque<TransactionStatus> stack = transactions.get();
        if (stack == null) {
            stack = new ArrayDeque<>();
            transactions.set(stack);
        }
        stack.push(status);
    }

    public void commit() {
        TransactionStatus status = popTransaction("commit");
        try {
            transactionManager.commit(status);
        } catch (TransactionException e) {
            throw new SecureDbException("Transaction commit failed: " + e.getMessage(), e);
        }
    }

    public void rollback() {
        TransactionStatus status = popTransaction("rollback");
        try {
            transactionManager.rollback(status);
        } catch (TransactionException e) {
            throw new SecureDbException("Transaction rollback failed: " + e.getMessage(), e);
        }
    }

    /** Whether the calling thread has a transaction opened by {@link #transaction()}. */
    public boolean inTransaction() {
        Deque<TransactionStatus> stack = transactions.get();
        return stack != null && !stack.isEmpty();
    }

    /**
     * Runs the callback in a transaction: commits when it returns, rolls back and rethrows
     * when it throws.
     */
    public <T> T tryFlatTransaction(Function<SecureDb, T> callback) {
        Objects.requireNonNull(callback, "callback");
        try {
            return new TransactionTemplate(transactionManager).execute(status -> callback.apply(this));
        } catch (TransactionException e) {
            throw new SecureDbException("Transaction failed: " + e.getMessage(), e);
        }
    }

    private TransactionStatus popTransaction(String operation) {
        Deque<TransactionStatus> stack = transactions.get();
        if (stack == null || stack.isEmpty()) {
            throw new SecureDbException("Cannot " + operation + ": no active transaction");
        }
        TransactionStatus status = stack.pop();
        if (stack.isEmpty()) {
            transactions.remove();
        }
        return status;
    }

    // ==================== Execution ====================

    private <T> T execute(String template, Object[] params, Function<BoundQuery, T> action) {
        Instant startedAt = Instant.now();
        BoundQuery bound = engine.bind(template, params);
        log.debug("Executing: {} with {}", bound.sql(), bound.params());
        logQuery(bound, null, startedAt);

        long start = System.nanoTime();
        try {
            T result = action.apply(bound);
            logQuery(bound, Duration.ofNanos(System.nanoTime() - start), startedAt);
            return result;
        } catch (DataAccessException e) {
            List<Object> rawParams = params == null ? List.of() : Arrays.asList(params);
            SecureDbException failure = new SecureDbException("Database query failed", e);
            handleError(e, template, rawParams, failure);
            throw failure;
        }
    }

    private void handleError(DataAccessException e, String template, List<Object> rawParams,
                             SecureDbException failure) {
        log.warn("Query failed: {} ({})", template, e.getMostSpecificCause().getMessage());
        if (errorHandler != null) {
            try {
                errorHandler.onError(e, template, rawParams);
            } catch (RuntimeException handlerFailure) {
                log.warn("Error handler threw", handlerFailure);
                failure.addSuppressed(handlerFailure);
            }
        }
        if (queryLogger != null) {
            QueryLogEntry entry = new QueryLogEntry(template, rawParams, null, Instant.now(),
                    callerInfo(), e.getMostSpecificCause().getMessage());
            try {
                queryLogger.log(entry);
            } catch (RuntimeException loggerFailure) {
                log.warn("Query logger threw", loggerFailure);
                failure.addSuppressed(loggerFailure);
            }
        }
    }

    private void logQuery(BoundQuery bound, Duration executionTime, Instant startedAt) {
        if (queryLogger == null) {
            return;
        }
        QueryLogEntry entry = new QueryLogEntry(bound.sql(), bound.params(), executionTime, startedAt,
                callerInfo(), null);
        try {
            queryLogger.log(entry);
        } catch (RuntimeException loggerFailure) {
            log.warn("Query logger threw", loggerFailure);
        }
    }

    private static QueryLogEntry.Caller callerInfo() {
        String self = SecureDb.class.getName();
        return StackWalker.getInstance().walk(frames -> frames
                .filter(f -> !f.getClassName().equals(self)
                        && !f.getClassName().startsWith(self + "$")
                        && !f.getClassName().startsWith("org.springframework."))
                .findFirst()
                .map(QueryLogEntry.Caller::of)
                .orElse(QueryLogEntry.Caller.UNKNOWN));
    }

    private static SqlDialect detectDialect(DataSource dataSource) {
        try {
            String product = JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getDatabaseProductName);
            SqlDialect dialect = Dialects.forProductName(product);
            log.debug("Detected dialect {} for {}", dialect.name(), product);
            return dialect;
        } catch (MetaDataAccessException e) {
            throw new SecureDbException("Cannot detect database dialect: " + e.getMessage(), e);
        }
    }

    // ==================== Builder ====================

    public static final class Builder {

        private final DataSource dataSource;
        private SqlDialect dialect;
        private String identifierPrefix = "";
        private ErrorHandler errorHandler;
        private QueryLogger queryLogger;

        private Builder(DataSource dataSource) {
            this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        }

        /** Quoting and pagination dialect. Detected from connection metadata when unset. */
        public Builder dialect(SqlDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder dialect(String dialectName) {
            this.dialect = dialectName == null ? null : Dialects.forName(dialectName);
            return this;
        }

        public Builder identifierPrefix(String identifierPrefix) {
            this.identifierPrefix = identifierPrefix == null ? "" : identifierPrefix;
            return this;
        }

        public Builder errorHandler(ErrorHandler errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        public Builder queryLogger(QueryLogger queryLogger) {
            this.queryLogger = queryLogger;
            return this;
        }

        public SecureDb build() {
            return new SecureDb(this);
        }
    }
}
