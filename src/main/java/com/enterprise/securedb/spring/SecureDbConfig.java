package com.enterprise.securedb.spring;

import com.enterprise.securedb.db.SecureDb;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring wiring for the template engine.
 *
 * <p>Provides a {@link SecureDb} and a {@link TemplateReaderFactory} bean over the context's
 * {@link DataSource}. Import this configuration:
 * <pre>{@code
 * @Import(SecureDbConfig.class)
 * @Configuration
 * public class MyDataConfig { ... }
 * }</pre>
 *
 * <p>and configure it in {@code application.properties}:
 * <pre>
 * secure-db.dialect=mysql
 * secure-db.identifier-prefix=app_
 * </pre>
 */
@Configuration
@EnableConfigurationProperties(SecureDbProperties.class)
public class SecureDbConfig {

    @Bean
    public SecureDb secureDb(DataSource dataSource, SecureDbProperties properties) {
        return SecureDb.withDataSource(dataSource)
                .dialect(properties.dialect())
                .identifierPrefix(properties.identifierPrefix())
                .build();
    }

    @Bean
    public TemplateReaderFactory templateReaderFactory(DataSource dataSource, SecureDb secureDb) {
        return new TemplateReaderFactory(dataSource, secureDb.engine());
    }
}
