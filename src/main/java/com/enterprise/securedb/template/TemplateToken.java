package com.enterprise.securedb.template;

/**
 * Lexical unit of a query template. See {@link TemplateLexer}.
 */
public sealed interface TemplateToken {

    Positional POSITIONAL = new Positional();
    ArrayPlaceholder ARRAY = new ArrayPlaceholder();
    IdentifierPlaceholder IDENTIFIER = new IdentifierPlaceholder();
    MacroBlockStart BLOCK_START = new MacroBlockStart();
    MacroBlockEnd BLOCK_END = new MacroBlockEnd();

    /** The token as written in the template. */
    String text();

    /** Whether the token pops a value from the parameter stream. */
    default boolean consumesParameter() {
        return false;
    }

    record Literal(String text) implements TemplateToken {}

    /** {@code ?} */
    record Positional() implements TemplateToken {
        @Override
        public String text() {
            return "?";
        }

        @Override
        public boolean consumesParameter() {
            return true;
        }
    }

    /** {@code ?a} */
    record ArrayPlaceholder() implements TemplateToken {
        @Override
        public String text() {
            return "?a";
        }

        @Override
        public boolean consumesParameter() {
            return true;
        }
    }

    /** {@code ?#} */
    record IdentifierPlaceholder() implements TemplateToken {
        @Override
        public String text() {
            return "?#";
        }

        @Override
        public boolean consumesParameter() {
            return true;
        }
    }

    /** {@code ?_name}: a prefixed table name. */
    record PrefixedPlaceholder(String name) implements TemplateToken {
        @Override
        public String text() {
            return "?_" + name;
        }
    }

    record MacroBlockStart() implements TemplateToken {
        @Override
        public String text() {
            return "{";
        }
    }

    record MacroBlockEnd() implements TemplateToken {
        @Override
        public String text() {
            return "}";
        }
    }
}
