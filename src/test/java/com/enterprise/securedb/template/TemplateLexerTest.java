package com.enterprise.securedb.template;

import com.enterprise.securedb.template.TemplateToken.Literal;
import com.enterprise.securedb.template.TemplateToken.PrefixedPlaceholder;
import org.junit.jupiter.api.Test;

import static com.enterprise.securedb.template.TemplateToken.BLOCK_END;
import static com.enterprise.securedb.template.TemplateToken.BLOCK_START;
import static com.enterprise.securedb.template.TemplateToken.IDENTIFIER;
import static com.enterprise.securedb.template.TemplateToken.POSITIONAL;
import static org.assertj.core.api.Assertions.*;

class TemplateLexerTest {

    @Test
    void placeholdersInOrder() {
        assertThat(TemplateLexer.tokenize("SELECT * FROM ?_users WHERE id = ? AND name IN(?a) ORDER BY ?#"))
                .containsExactly(
                        new Literal("SELECT * FROM "),
                        new PrefixedPlaceholder("users"),
                        new Literal(" WHERE id = "),
                        POSITIONAL,
                        new Literal(" AND name IN("),
                        TemplateToken.ARRAY,
                        new Literal(") ORDER BY "),
                        IDENTIFIER);
    }

    @Test
    void prefixNeedsIdentifierStart() {
        assertThat(TemplateLexer.tokenize("?_ x")).containsExactly(POSITIONAL, new Literal("_ x"));
        assertThat(TemplateLexer.tokenize("?_1")).containsExactly(POSITIONAL, new Literal("_1"));
        assertThat(TemplateLexer.tokenize("?__tmp9 x"))
                .containsExactly(new PrefixedPlaceholder("_tmp9"), new Literal(" x"));
    }

    @Test
    void arrayMarkerIsTwoCharacters() {
        assertThat(TemplateLexer.tokenize("?abc")).containsExactly(TemplateToken.ARRAY, new Literal("bc"));
    }

    @Test
    void macroBlock() {
        assertThat(TemplateLexer.tokenize("a { b = ? } c"))
                .containsExactly(new Literal("a "), BLOCK_START, new Literal(" b = "), POSITIONAL,
                        new Literal(" "), BLOCK_END, new Literal(" c"));
    }

    @Test
    void unmatchedBracesAreText() {
        assertThat(TemplateLexer.tokenize("a { b")).containsExactly(new Literal("a { b"));
        assertThat(TemplateLexer.tokenize("a } b")).containsExactly(new Literal("a } b"));
    }

    @Test
    void emptyBracesAreText() {
        assertThat(TemplateLexer.tokenize("a{}b")).containsExactly(new Literal("a{}b"));
        assertThat(TemplateLexer.tokenize("{}{ x = ? }"))
                .containsExactly(new Literal("{}"), BLOCK_START, new Literal(" x = "), POSITIONAL,
                        new Literal(" "), BLOCK_END);
    }

    @Test
    void blocksDoNotNest() {
        assertThat(TemplateLexer.tokenize("{ a { b } }"))
                .containsExactly(BLOCK_START, new Literal(" a { b "), BLOCK_END, new Literal(" }"));
    }

    @Test
    void countIgnoresPrefixedNames() {
        assertThat(TemplateLexer.countParameters("? ?a ?# ?_t { AND x = ? }")).isEqualTo(4);
        assertThat(TemplateLexer.countParameters("SELECT 1")).isZero();
    }

    @Test
    void questionMarkInsideStringLiteralIsStillAPlaceholder() {
        assertThat(TemplateLexer.countParameters("SELECT 'why?' FROM t WHERE id = ?")).isEqualTo(2);
    }

    @Test
    void renderReproducesTemplate() {
        String template = "SELECT ?# FROM ?_t WHERE a IN(?a) { AND b = ? } AND c = '{x}'";
        assertThat(TemplateLexer.render(TemplateLexer.tokenize(template))).isEqualTo(template);
    }
}
