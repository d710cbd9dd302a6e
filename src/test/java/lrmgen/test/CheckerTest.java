// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.test;

import lrmgen.bnf.Checker;
import lrmgen.bnf.Grammar;
import lrmgen.bnf.Parser;
import lrmgen.bnf.UnknownReferenceCondition;
import lrmgen.source.SourceLocation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class CheckerTest {
    @Test
    void terminalNamesAreNotLookedUp() {
        final var outcome = check("'''foo ::= UNKNOWN_TERM'''");
        assertThat(outcome.failed()).isFalse();
        assertThat(outcome.warnings()).isEmpty();
    }

    @Test
    void unknownSymbolIsWarning() {
        final var outcome = check("'''foo ::= 'unknown' BAR'''");
        assertThat(outcome.failed()).isFalse();
        assertThat(outcome.warnings()).hasSize(1);
        final var warning = (UnknownReferenceCondition) outcome.warnings().get(0);
        assertThat(warning.target()).isEqualTo(UnknownReferenceCondition.Target.TERMINAL);
        assertThat(warning.name()).isEqualTo("unknown");
        assertThat(warning.message()).isEqualTo("unknown terminal 'unknown'");
        assertThat(warning.location().columnNumber()).isEqualTo(12);
    }

    @Test
    void unknownProductionIsWarning() {
        final var outcome = check("'''foo ::= [ missing_LEFT ]'''");
        assertThat(outcome.warnings()).hasSize(1);
        final var warning = (UnknownReferenceCondition) outcome.warnings().get(0);
        assertThat(warning.target()).isEqualTo(UnknownReferenceCondition.Target.PRODUCTION);
        assertThat(warning.name()).isEqualTo("missing");
        assertThat(warning.message()).isEqualTo("unknown production 'missing'");
    }

    @Test
    void knownReferencesAreAccepted() {
        final var outcome = check(
            "'''file ::= { declaration } 'end'\n\ndeclaration ::= 'package' IDENTIFIER ';' | file'''",
            "'''extra ::= declaration_NESTED'''"
        );
        assertThat(outcome.failed()).isFalse();
        assertThat(outcome.warnings()).isEmpty();
    }

    @Test
    void referencesAcrossBundlesInAnyOrder() {
        final var outcome = check("'''first ::= second'''", "'''second ::= first'''");
        assertThat(outcome.warnings()).isEmpty();
    }

    @Test
    void reportsEveryUnknownReferenceInOrder() {
        final var outcome = check("'''foo ::= a | 'x' { b 'y' } | c_SUFFIX'''");
        assertThat(outcome.failed()).isFalse();
        assertThat(outcome.warnings())
            .extracting(condition -> ((UnknownReferenceCondition) condition).name())
            .containsExactly("a", "x", "b", "y", "c");
    }

    @Test
    void requiresSealedGrammar() {
        assertThatExceptionOfType(IllegalStateException.class).isThrownBy(() -> Checker.check(new Grammar()));
    }

    private static Conditions.Outcome<Void> check(final String... bundles) {
        final var grammar = new Grammar();
        for (final var terminal : new String[] {"end", "package", ";"}) {
            grammar.registerTerminal(terminal, location);
        }
        final var parser = new Parser(grammar);
        for (int i = 0; i < bundles.length; i += 1) {
            parser.parse("bundle" + i, bundles[i], location);
        }
        grammar.seal();
        return Conditions.run(() -> Checker.check(grammar));
    }

    private static final SourceLocation location = new SourceLocation("manual.lrm", 1, 1, 0);
}
