// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.test;

import lrmgen.bnf.DeclarationErrorCondition;
import lrmgen.bnf.Grammar;
import lrmgen.source.SourceLocation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class GrammarTest {
    @Test
    void registersBacktickRuns() {
        final var grammar = new Grammar();
        grammar.registerBacktickTerminals("`(` and `)` enclose arguments, `=>` separates them", location);
        assertThat(grammar.terminals()).containsExactly("(", ")", "=>");
        assertThat(grammar.hasTerminal("=>")).isTrue();
        assertThat(grammar.hasTerminal("and")).isFalse();
    }

    @Test
    void textWithoutBackticksRegistersNothing() {
        final var grammar = new Grammar();
        grammar.registerBacktickTerminals("Nothing to see here", location);
        assertThat(grammar.terminals()).isEmpty();
    }

    @Test
    void emptyBacktickRunIsError() {
        final var grammar = new Grammar();
        final var outcome = Conditions.run(() -> grammar.registerBacktickTerminals("`foo` and ``", location));
        assertThat(outcome.requireError()).isInstanceOf(DeclarationErrorCondition.class);
        assertThat(outcome.requireError().message()).isEqualTo("empty terminal is not permitted");
        assertThat(grammar.terminals()).containsExactly("foo");
    }

    @Test
    void duplicateExplicitTerminalIsError() {
        final var grammar = new Grammar();
        final var outcome = Conditions.run(() -> {
            grammar.registerTerminal("package", location);
            grammar.registerTerminal("package", location);
        });
        assertThat(outcome.requireError()).isInstanceOf(DeclarationErrorCondition.class);
        assertThat(outcome.requireError().message()).isEqualTo("duplicate definition of terminal 'package'");
    }

    @Test
    void duplicateBacktickAfterExplicitIsError() {
        final var grammar = new Grammar();
        final var outcome = Conditions.run(() -> {
            grammar.registerTerminal(";", location);
            grammar.registerBacktickTerminals("`;` ends a statement", location);
        });
        assertThat(outcome.requireError().message()).isEqualTo("duplicate definition of terminal ';'");
    }

    @Test
    void duplicateExplicitAfterBacktickIsError() {
        final var grammar = new Grammar();
        final var outcome = Conditions.run(() -> {
            grammar.registerBacktickTerminals("`abstract`", location);
            grammar.registerTerminal("abstract", location);
        });
        assertThat(outcome.requireError().message()).isEqualTo("duplicate definition of terminal 'abstract'");
    }

    @Test
    void duplicateWithinOneTextIsError() {
        final var grammar = new Grammar();
        final var outcome = Conditions.run(() -> grammar.registerBacktickTerminals("`,` or `,`", location));
        assertThat(outcome.requireError().message()).isEqualTo("duplicate definition of terminal ','");
    }

    @Test
    void sealedGrammarIsReadOnly() {
        final var grammar = new Grammar();
        grammar.registerTerminal("type", location);
        assertThat(grammar.isSealed()).isFalse();
        grammar.seal();
        assertThat(grammar.isSealed()).isTrue();
        assertThatExceptionOfType(IllegalStateException.class)
            .isThrownBy(() -> grammar.registerTerminal("enum", location));
        assertThatExceptionOfType(IllegalStateException.class)
            .isThrownBy(() -> grammar.registerBacktickTerminals("`;`", location));
        assertThatExceptionOfType(UnsupportedOperationException.class)
            .isThrownBy(() -> grammar.terminals().add("enum"));
        assertThat(grammar.terminals()).containsExactly("type");
    }

    @Test
    void unknownLookupsReturnNothing() {
        final var grammar = new Grammar();
        assertThat(grammar.production("missing")).isNull();
        assertThat(grammar.bundle("missing")).isNull();
        assertThat(grammar.hasProduction("missing")).isFalse();
        assertThat(grammar.productions()).isEmpty();
    }

    private static final SourceLocation location = new SourceLocation("manual.lrm", 3, 7, 42);
}
