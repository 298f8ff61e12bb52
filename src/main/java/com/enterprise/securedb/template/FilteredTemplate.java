package com.enterprise.securedb.template;

import com.enterprise.securedb.param.Param;

import java.util.List;

/**
 * Output of {@link MacroProcessor}: the template with macro blocks resolved (kept blocks
 * inlined without braces, skipped blocks removed) and the parameters that remain.
 */
public record FilteredTemplate(List<TemplateToken> tokens, List<Param> params) {

    public FilteredTemplate {
        tokens = List.copyOf(tokens);
        params = List.copyOf(params);
    }

    public String query() {
        return TemplateLexer.render(tokens);
    }

    public int placeholderCount() {
        return TemplateLexer.countParameters(tokens);
    }
}
