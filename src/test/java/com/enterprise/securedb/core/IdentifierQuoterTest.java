package com.enterprise.securedb.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class IdentifierQuoterTest {

    private final IdentifierQuoter mysql = new IdentifierQuoter(Dialects.MYSQL);
    private final IdentifierQuoter postgres = new IdentifierQuoter(Dialects.POSTGRES);
    private final IdentifierQuoter sqlServer = new IdentifierQuoter(Dialects.SQLSERVER);

    @Test
    void simpleName() {
        assertThat(mysql.quoteIdentifier("users")).isEqualTo("`users`");
        assertThat(postgres.quoteIdentifier("users")).isEqualTo("\"users\"");
        assertThat(sqlServer.quoteIdentifier("users")).isEqualTo("[users]");
    }

    @Test
    void qualifiedNameQuotesEachSegment() {
        assertThat(mysql.quoteIdentifier("a.b.c"))
                .isEqualTo(mysql.quoteIdentifier("a") + "." + mysql.quoteIdentifier("b")
                        + "." + mysql.quoteIdentifier("c"))
                .isEqualTo("`a`.`b`.`c`");
        assertThat(sqlServer.quoteIdentifier("dbo.users")).isEqualTo("[dbo].[users]");
    }

    @Test
    void quotingIsIdempotent() {
        String once = mysql.quoteIdentifier("users");
        assertThat(mysql.quoteIdentifier(once)).isEqualTo(once);
        assertThat(mysql.quoteIdentifier("``users``")).isEqualTo("`users`");
        assertThat(sqlServer.quoteIdentifier("[users]")).isEqualTo("[users]");
        assertThat(postgres.quoteIdentifier("\"app\".\"users\"")).isEqualTo("\"app\".\"users\"");
    }

    @Test
    void embeddedOpenQuoteIsDoubled() {
        assertThat(mysql.quoteIdentifier("we`ird")).isEqualTo("`we``ird`");
        assertThat(postgres.quoteIdentifier("say\"hi")).isEqualTo("\"say\"\"hi\"");
        assertThat(sqlServer.quoteIdentifier("a[b")).isEqualTo("[a[[b]");
    }

    @Test
    void embeddedCloseBracketIsDoubled() {
        assertThat(sqlServer.quoteIdentifier("a]b")).isEqualTo("[a]]b]");
        assertThat(mysql.quoteIdentifier("a]b")).isEqualTo("`a]b`");
    }

    @Test
    void bracketInjectionStaysInsideIdentifier() {
        assertThat(sqlServer.quoteIdentifier("users]; DROP TABLE x; --"))
                .isEqualTo("[users]]; DROP TABLE x; --]");
    }

    @Test
    void injectionAttemptStaysInsideIdentifier() {
        assertThat(mysql.quoteIdentifier("users` WHERE 1=1; DROP TABLE x; --"))
                .isEqualTo("`users`` WHERE 1=1; DROP TABLE x; --`");
    }

    @Test
    void emptySegmentsAreStillWrapped() {
        assertThat(mysql.quoteIdentifier("")).isEqualTo("``");
        assertThat(mysql.quoteIdentifier("a.")).isEqualTo("`a`.``");
    }

    @Test
    void reservedWordsAreQuotedLikeAnyOtherName() {
        assertThat(new IdentifierQuoter("sqlite").quoteIdentifier("order")).isEqualTo("`order`");
    }

    @Test
    void unknownDialectFallsBackToDoubleQuotes() {
        assertThat(new IdentifierQuoter("cobol-db").quoteIdentifier("t")).isEqualTo("\"t\"");
    }

    @Test
    void quoteIdentifiersKeepsOrder() {
        assertThat(mysql.quoteIdentifiers(List.of("id", "name", "app.email")))
                .containsExactly("`id`", "`name`", "`app`.`email`");
    }
}
