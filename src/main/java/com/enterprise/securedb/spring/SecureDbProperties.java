package com.enterprise.securedb.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * {@code secure-db.*} settings.
 *
 * @param dialect          dialect tag ({@code mysql}, {@code pgsql}, ...); detected from the
 *                         data source when absent
 * @param identifierPrefix prefix for {@code ?_name} table names
 */
@ConfigurationProperties(prefix = "secure-db")
public record SecureDbProperties(String dialect, @DefaultValue("") String identifierPrefix) {
}
