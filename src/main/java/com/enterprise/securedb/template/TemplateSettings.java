package com.enterprise.securedb.template;

import com.enterprise.securedb.core.Dialects;
import com.enterprise.securedb.core.SqlDialect;

import java.util.Objects;

/**
 * Immutable engine configuration: the quoting dialect and the prefix prepended to
 * {@code ?_name} table names. A different prefix means a different settings instance.
 */
public record TemplateSettings(SqlDialect dialect, String identifierPrefix) {

    public TemplateSettings {
        Objects.requireNonNull(dialect, "dialect");
        identifierPrefix = identifierPrefix == null ? "" : identifierPrefix;
    }

    public static TemplateSettings of(SqlDialect dialect) {
        return new TemplateSettings(dialect, "");
    }

    public static TemplateSettings of(String dialectName) {
        return new TemplateSettings(Dialects.forName(dialectName), "");
    }

    public TemplateSettings withIdentifierPrefix(String prefix) {
        return new TemplateSettings(dialect, prefix);
    }
}
