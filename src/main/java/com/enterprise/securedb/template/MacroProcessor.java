package com.enterprise.securedb.template;

import com.enterprise.securedb.param.Param;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves {@code { ... }} macro blocks.
 *
 * <p>A cursor walks the original parameter list in placeholder order. Outside blocks each
 * placeholder takes one parameter, which is copied unless it is the skip marker. A block
 * takes as many parameters as it has placeholders: if any of them is the skip marker the
 * block's text and all its parameters are dropped, otherwise the text is kept (without the
 * braces) and the parameters are copied in order. The cursor advances past a block's
 * placeholders either way.
 *
 * <p>Running out of parameters is not an error here: a block keeps whatever is left and
 * {@link PlaceholderProcessor} reports the missing one. Parameters beyond the last
 * placeholder are passed through (skip markers excepted) so the caller can detect them.
 */
public final class MacroProcessor {

    public FilteredTemplate filter(String query, List<Param> params) {
        return filter(TemplateLexer.tokenize(query), params);
    }

    public FilteredTemplate filter(List<TemplateToken> tokens, List<Param> params) {
        List<TemplateToken> out = new ArrayList<>(tokens.size());
        List<Param> outParams = new ArrayList<>(params.size());
        int cursor = 0;

        int i = 0;
        while (i < tokens.size()) {
            TemplateToken token = tokens.get(i);
            if (token instanceof TemplateToken.MacroBlockStart) {
                int end = blockEnd(tokens, i);
                List<TemplateToken> body = tokens.subList(i + 1, end);
                int needed = TemplateLexer.countParameters(body);
                int available = Math.max(0, Math.min(needed, params.size() - cursor));
                List<Param> blockParams = available == 0
                        ? List.of()
                        : params.subList(cursor, cursor + available);

                if (blockParams.stream().noneMatch(Param::isSkip)) {
                    out.addAll(body);
                    outParams.addAll(blockParams);
                }
                cursor += needed;
                i = end + 1;
                continue;
            }

            out.add(token);
            if (token.consumesParameter()) {
                copyUnlessSkip(params, cursor, outParams);
                cursor++;
            }
            i++;
        }

        for (; cursor < params.size(); cursor++) {
            copyUnlessSkip(params, cursor, outParams);
        }
        return new FilteredTemplate(out, outParams);
    }

    private static void copyUnlessSkip(List<Param> params, int index, List<Param> outParams) {
        if (index < params.size() && !params.get(index).isSkip()) {
            outParams.add(params.get(index));
        }
    }

    private static int blockEnd(List<TemplateToken> tokens, int start) {
        for (int j = start + 1; j < tokens.size(); j++) {
            if (tokens.get(j) instanceof TemplateToken.MacroBlockEnd) {
                return j;
            }
        }
        // TemplateLexer only opens a block when a closing brace follows
        throw new IllegalStateException("Unterminated macro block at token " + start);
    }
}
