package com.enterprise.securedb.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass tokenizer for query templates.
 *
 * <p>Grammar, scanned left to right:
 * <ul>
 *   <li>{@code ?_name} prefixed identifier, {@code name = [A-Za-z_][A-Za-z0-9_]*}</li>
 *   <li>{@code ?#} identifier, {@code ?a} array, any other {@code ?} positional</li>
 *   <li>an opening brace starts a macro block when a closing brace follows somewhere later
 *       with at least one character in between; the block ends at the first closing brace.
 *       Empty braces are text. Blocks do not nest: an opening brace inside a block is text.</li>
 * </ul>
 * Everything else is literal text. SQL string literals and comments are not recognised, so a
 * {@code ?} or brace inside {@code 'quotes'} is still treated as a token.
 */
public final class TemplateLexer {

    private TemplateLexer() {}

    public static List<TemplateToken> tokenize(String query) {
        Objects.requireNonNull(query, "query");
        List<TemplateToken> tokens = new ArrayList<>();
        char[] chars = query.toCharArray();
        int fragmentStart = 0;
        boolean inBlock = false;

        for (int i = 0; i < chars.length; ++i) {
            switch (chars[i]) {
                case '?':
                    addLiteral(tokens, chars, fragmentStart, i);
                    i = parsePlaceholder(tokens, chars, i);
                    fragmentStart = i + 1;
                    break;
                case '{':
                    if (!inBlock && query.indexOf('}', i + 1) > i + 1) {
                        addLiteral(tokens, chars, fragmentStart, i);
                        tokens.add(TemplateToken.BLOCK_START);
                        inBlock = true;
                        fragmentStart = i + 1;
                    }
                    break;
                case '}':
                    if (inBlock) {
                        addLiteral(tokens, chars, fragmentStart, i);
                        tokens.add(TemplateToken.BLOCK_END);
                        inBlock = false;
                        fragmentStart = i + 1;
                    }
                    break;
                default:
                    break;
            }
        }
        addLiteral(tokens, chars, fragmentStart, chars.length);
        return tokens;
    }

    /**
     * Number of parameters the text consumes: {@code ?a}, {@code ?#} and bare {@code ?}
     * count one each, {@code ?_name} counts zero. Macro braces are ignored.
     */
    public static int countParameters(String query) {
        return countParameters(tokenize(query));
    }

    public static int countParameters(List<TemplateToken> tokens) {
        int count = 0;
        for (TemplateToken token : tokens) {
            if (token.consumesParameter()) {
                count++;
            }
        }
        return count;
    }

    /** Writes tokens back as template text. */
    public static String render(List<TemplateToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (TemplateToken token : tokens) {
            sb.append(token.text());
        }
        return sb.toString();
    }

    /** Returns the index of the last character belonging to the placeholder. */
    private static int parsePlaceholder(List<TemplateToken> tokens, char[] chars, int offset) {
        char next = offset + 1 < chars.length ? chars[offset + 1] : 0;
        switch (next) {
            case '#':
                tokens.add(TemplateToken.IDENTIFIER);
                return offset + 1;
            case 'a':
                tokens.add(TemplateToken.ARRAY);
                return offset + 1;
            case '_':
                if (offset + 2 < chars.length && isIdentifierStart(chars[offset + 2])) {
                    int end = offset + 3;
                    while (end < chars.length && isIdentifierPart(chars[end])) {
                        end++;
                    }
                    tokens.add(new TemplateToken.PrefixedPlaceholder(
                            new String(chars, offset + 2, end - offset - 2)));
                    return end - 1;
                }
                tokens.add(TemplateToken.POSITIONAL);
                return offset;
            default:
                tokens.add(TemplateToken.POSITIONAL);
                return offset;
        }
    }

    private static void addLiteral(List<TemplateToken> tokens, char[] chars, int from, int to) {
        if (to > from) {
            tokens.add(new TemplateToken.Literal(new String(chars, from, to - from)));
        }
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
