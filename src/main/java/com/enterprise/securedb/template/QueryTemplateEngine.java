package com.enterprise.securedb.template;

import com.enterprise.securedb.core.IdentifierQuoter;
import com.enterprise.securedb.exception.ParameterCountException;
import com.enterprise.securedb.param.Param;
import com.enterprise.securedb.param.Params;

import java.util.List;
import java.util.Objects;

/**
 * Turns a query template and its parameters into a {@link BoundQuery}: macro blocks are
 * resolved first ({@link MacroProcessor}), then placeholders ({@link PlaceholderProcessor}).
 *
 * <p>Example:
 * <pre>{@code
 * QueryTemplateEngine engine = new QueryTemplateEngine(TemplateSettings.of(Dialects.MYSQL));
 * BoundQuery q = engine.bind(
 *     "SELECT * FROM ?_users WHERE id IN(?a) { AND active = ? }",
 *     List.of(1, 2, 3), MacroControl.SKIP);
 * // q.sql()    -> SELECT * FROM `users` WHERE id IN(?, ?, ?)
 * // q.params() -> [1, 2, 3]
 * }</pre>
 *
 * <p>Stateless apart from its immutable settings; safe to share between threads.
 */
public final class QueryTemplateEngine {

    private final TemplateSettings settings;
    private final IdentifierQuoter quoter;
    private final MacroProcessor macroProcessor;
    private final PlaceholderProcessor placeholderProcessor;

    public QueryTemplateEngine(TemplateSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.quoter = new IdentifierQuoter(settings.dialect());
        this.macroProcessor = new MacroProcessor();
        this.placeholderProcessor = new PlaceholderProcessor(settings);
    }

    public BoundQuery process(String query, List<Param> params) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(params, "params");

        List<TemplateToken> tokens = TemplateLexer.tokenize(query);
        FilteredTemplate filtered = macroProcessor.filter(tokens, params);

        int expected = filtered.placeholderCount();
        if (filtered.params().size() > expected) {
            throw new ParameterCountException(expected, filtered.params().size());
        }
        return placeholderProcessor.substitute(filtered.tokens(), filtered.params());
    }

    /** Same as {@link #process} with raw values converted by {@link Params#of(Object)}. */
    public BoundQuery bind(String query, Object... params) {
        return process(query, Params.list(params));
    }

    public TemplateSettings settings() {
        return settings;
    }

    public IdentifierQuoter quoter() {
        return quoter;
    }
}
