package com.enterprise.securedb.spring;

import com.enterprise.securedb.core.Dialects;
import com.enterprise.securedb.param.MacroControl;
import com.enterprise.securedb.template.BoundQuery;
import com.enterprise.securedb.template.QueryTemplateEngine;
import com.enterprise.securedb.template.TemplateSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.database.JdbcCursorItemReader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class TemplateReaderFactoryTest {

    private TemplateReaderFactory factory;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:h2:mem:" + UUID.randomUUID()
                + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("CREATE TABLE t_orders (id INT PRIMARY KEY, status VARCHAR(20), amount INT)");
        jdbc.execute("""
                INSERT INTO t_orders VALUES
                (1, 'PENDING', 100), (2, 'SHIPPED', 250), (3, 'PENDING', 75), (4, 'CANCELLED', 10)""");

        factory = new TemplateReaderFactory(dataSource,
                new QueryTemplateEngine(new TemplateSettings(Dialects.MYSQL, "t_")));
        factory.setFetchSize(2);
    }

    private static <T> List<T> readAll(JdbcCursorItemReader<T> reader) throws Exception {
        reader.afterPropertiesSet();
        reader.open(new ExecutionContext());
        List<T> items = new ArrayList<>();
        try {
            T item;
            while ((item = reader.read()) != null) {
                items.add(item);
            }
        } finally {
            reader.close();
        }
        return items;
    }

    @Test
    void readsRowsOfRenderedTemplate() throws Exception {
        JdbcCursorItemReader<Integer> reader = factory.cursorReader("pendingOrders",
                "SELECT id FROM ?_orders WHERE 1=1{ AND status = ?}{ AND amount > ?} ORDER BY id",
                (rs, rowNum) -> rs.getInt("id"),
                "PENDING", MacroControl.SKIP);

        assertThat(readAll(reader)).containsExactly(1, 3);
    }

    @Test
    void arrayPlaceholderInReader() throws Exception {
        JdbcCursorItemReader<String> reader = factory.cursorReader("byStatus",
                "SELECT status FROM ?_orders WHERE status IN(?a) ORDER BY id",
                (rs, rowNum) -> rs.getString(1),
                List.of("SHIPPED", "CANCELLED"));

        assertThat(readAll(reader)).containsExactly("SHIPPED", "CANCELLED");
    }

    @Test
    void resolveQueryRendersWithoutReader() {
        BoundQuery query = factory.resolveQuery("SELECT * FROM ?_orders WHERE id IN(?a)", List.of(1, 2));
        assertThat(query.sql()).isEqualTo("SELECT * FROM `t_orders` WHERE id IN(?, ?)");
        assertThat(query.params()).containsExactly(1, 2);
    }

    @Test
    void queryTimeoutIsOptional() throws Exception {
        factory.setQueryTimeout(5);
        JdbcCursorItemReader<Integer> reader = factory.cursorReader("all",
                "SELECT id FROM ?_orders ORDER BY id", (rs, rowNum) -> rs.getInt(1));

        assertThat(readAll(reader)).hasSize(4);
    }
}
