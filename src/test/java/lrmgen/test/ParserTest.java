// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.test;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;
import java.util.stream.LongStream;
import lrmgen.bnf.DeclarationErrorCondition;
import lrmgen.bnf.Expansion;
import lrmgen.bnf.Expansions;
import lrmgen.bnf.Grammar;
import lrmgen.bnf.Parser;
import lrmgen.bnf.Production;
import lrmgen.bnf.ProductionRenderer;
import lrmgen.bnf.SyntaxErrorCondition;
import lrmgen.source.LocatedCondition;
import lrmgen.source.SourceLocation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

final class ParserTest {
    static LongStream provideSeeds() {
        return RandomUtils.seeds(16);
    }

    @Test
    void parsesAlternativesOfSequenceAndOptional() {
        final var grammar = new Grammar();
        grammar.registerTerminal("a", location);
        final var names = new Parser(grammar).parse("file", "'''foo ::= 'a' BAR | [ baz ]'''", location);
        assertThat(names).containsExactly("foo");

        final var production = requireProduction(grammar, "foo");
        final var alternatives = (Expansion.Alternatives) production.expansion();
        assertThat(alternatives.members()).hasSize(2);

        final var sequence = (Expansion.Sequence) alternatives.members().get(0);
        assertThat(sequence.members()).hasSize(2);
        assertLiteral(sequence.members().get(0), Expansion.LiteralKind.SYMBOL, "a");
        assertLiteral(sequence.members().get(1), Expansion.LiteralKind.TERMINAL, "BAR");

        final var optional = (Expansion.Optional) alternatives.members().get(1);
        assertLiteral(optional.inner(), Expansion.LiteralKind.NONTERMINAL, "baz");

        assertThat(ProductionRenderer.renderLinear(production)).isEqualTo("foo ::= 'a' BAR | [ baz ]");
    }

    @Test
    void collapsesSingleMembers() {
        final var grammar = parse("'''foo ::= BAR\n\nbar ::= { [ baz ] }'''");
        assertLiteral(requireProduction(grammar, "foo").expansion(), Expansion.LiteralKind.TERMINAL, "BAR");
        final var repeated = (Expansion.Repeated) requireProduction(grammar, "bar").expansion();
        final var optional = (Expansion.Optional) repeated.inner();
        assertLiteral(optional.inner(), Expansion.LiteralKind.NONTERMINAL, "baz");
    }

    @Test
    void keepsSuffixes() {
        final var grammar = parse("'''call ::= name_FUNCTION '(' IDENTIFIER_arg ')'\n'''");
        final var sequence = (Expansion.Sequence) requireProduction(grammar, "call").expansion();
        final var function = (Expansion.Literal) sequence.members().get(0);
        assertThat(function.name()).isEqualTo("name");
        assertThat(function.suffix()).isEqualTo("FUNCTION");
        final var argument = (Expansion.Literal) sequence.members().get(2);
        assertThat(argument.kind()).isEqualTo(Expansion.LiteralKind.TERMINAL);
        assertThat(argument.name()).isEqualTo("IDENTIFIER");
        assertThat(argument.suffix()).isEqualTo("arg");
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 5, 9})
    void keepsAlternativesInOrder(final int count) {
        final var builder = new StringBuilder("'''choice ::= ");
        for (int i = 0; i < count; i += 1) {
            if (i > 0) {
                builder.append(" | ");
            }
            builder.append("option ").append((char) ('A' + i));
        }
        builder.append("'''");
        final var alternatives =
            (Expansion.Alternatives) requireProduction(parse(builder.toString()), "choice").expansion();
        assertThat(alternatives.members()).hasSize(count);
        for (int i = 0; i < count; i += 1) {
            final var sequence = (Expansion.Sequence) alternatives.members().get(i);
            assertLiteral(sequence.members().get(1), Expansion.LiteralKind.TERMINAL, String.valueOf((char) ('A' + i)));
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "foo ::= 'a' BAR | [ baz ]",
        "list ::= item { ',' item } [ ',' ]",
        "expression ::= relation { 'and' relation | 'or' relation }",
        "nested ::= { [ a | b c ] | { d } } e_LEFT F_right",
        "qualified_name ::= IDENTIFIER_namespace '.' IDENTIFIER_name | IDENTIFIER",
    })
    void renderedFormParsesBackToSameTree(final String text) {
        final var original = requireProduction(parse("'''" + text + "'''"), text.substring(0, text.indexOf(' ')));
        final var rendered = ProductionRenderer.renderLinear(original);
        final var reparsed = requireProduction(parse("'''" + rendered + "'''"), original.name());
        assertThat(Expansions.structurallyEqual(original.expansion(), reparsed.expansion())).isTrue();
        assertThat(ProductionRenderer.renderLinear(reparsed)).isEqualTo(rendered);
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void randomTreesSurviveRenderingAndParsing(final long seed) {
        final var generator = RandomUtils.createGenerator(seed);
        for (int i = 0; i < 32; i += 1) {
            final var original = new Production("rule", randomExpansion(generator, 0), location);
            final var linear = ProductionRenderer.renderLinear(original);
            final var fromLinear = requireProduction(parse("'''" + linear + "'''"), "rule");
            assertThat(Expansions.structurallyEqual(original.expansion(), fromLinear.expansion()))
                .as("seed %d, %s", seed, linear)
                .isTrue();
            final var text = ProductionRenderer.renderText(original);
            final var fromText = requireProduction(parse("'''" + text + "'''"), "rule");
            assertThat(Expansions.structurallyEqual(original.expansion(), fromText.expansion()))
                .as("seed %d, %s", seed, text)
                .isTrue();
        }
    }

    @Test
    void multiLineRenderingParsesBackToSameTree() {
        final var original =
            requireProduction(parse("'''statement ::= assignment | call_STATEMENT | 'return' [ expression ]'''"),
                "statement");
        final var rendered = ProductionRenderer.renderText(original);
        final var reparsed = requireProduction(parse("'''" + rendered + "'''"), "statement");
        assertThat(Expansions.structurallyEqual(original.expansion(), reparsed.expansion())).isTrue();
    }

    @Test
    void returnsBundleInDeclarationOrder() {
        final var grammar = new Grammar();
        final var parser = new Parser(grammar);
        final var names = parser.parse("types", "'''\n\ntype ::= record | enum\n\nrecord ::= 'record' IDENTIFIER\n\n"
            + "enum ::= 'enum' IDENTIFIER\n'''", location);
        assertThat(names).containsExactly("type", "record", "enum");
        assertThat(grammar.bundle("types")).containsExactly("type", "record", "enum");
        assertThat(grammar.bundleNames()).containsExactly("types");
    }

    @Test
    void acceptsEmptyBundle() {
        final var grammar = new Grammar();
        assertThat(new Parser(grammar).parse("empty", "''''''", location)).isEmpty();
        assertThat(grammar.bundle("empty")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"foo ::= BAR", "'foo ::= BAR'", "''foo ::= BAR''", "'''foo ::= BAR", "'''''"})
    void requiresTripleQuotes(final String text) {
        final var grammar = new Grammar();
        final var outcome = Conditions.run(() -> new Parser(grammar).parse("file", text, location));
        assertThat(outcome.requireError()).isInstanceOf(SyntaxErrorCondition.class);
        assertThat(outcome.requireError().message()).isEqualTo("grammar text must use triple-quoted strings");
        assertThat(((LocatedCondition) outcome.requireError()).location()).isEqualTo(location);
        assertThat(grammar.bundleNames()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', quoteCharacter = '"', value = {
        "foo ::= [ BAR; expected ']', encountered end of rule instead",
        "foo ::= { BAR ]; expected '}', encountered ']' instead",
        "foo ::=; expected grammar fragment, encountered end of rule instead",
        "foo ::= | BAR; expected grammar fragment, encountered '|' instead",
        "::= BAR; expected nonterminal, encountered '::=' instead",
        "FOO ::= BAR; expected nonterminal, encountered terminal instead",
        "foo BAR; expected '::=', encountered terminal instead",
        "a ::= b\\nc ::= d; expected end of rule, encountered '::=' instead",
    })
    void reportsSyntaxErrors(final String text, final String message) {
        final var outcome = Conditions.run(() -> parse("'''" + text.replace("\\n", "\n") + "'''"));
        assertThat(outcome.requireError()).isInstanceOf(SyntaxErrorCondition.class);
        assertThat(outcome.requireError().message()).isEqualTo(message);
    }

    @Test
    void syntaxErrorPointsAtOffendingToken() {
        final var outcome = Conditions.run(() -> parse("'''foo ::= BAR\n  ] baz'''"));
        final var error = (LocatedCondition) outcome.requireError();
        assertThat(error.location().lineNumber()).isEqualTo(2);
        assertThat(error.location().columnNumber()).isEqualTo(3);
        assertThat(error.detailedMessage()).isEqualTo(
            "expected end of rule, encountered ']' instead\nIn manual.lrm, line 2, column 3");
    }

    @Test
    void duplicateProductionAcrossBundlesIsSingleError() {
        final var grammar = new Grammar();
        final var parser = new Parser(grammar);
        final var outcome = Conditions.run(() -> {
            parser.parse("first", "'''foo ::= BAR'''", location);
            parser.parse("second", "'''\nfoo ::= BAR'''", new SourceLocation("manual.lrm", 20, 11, 400));
            throw new AssertionError("Parsing should have been aborted");
        });
        assertThat(outcome.warnings()).isEmpty();
        final var error = (LocatedCondition) outcome.requireError();
        assertThat(error).isInstanceOf(DeclarationErrorCondition.class);
        assertThat(error.message())
            .isEqualTo("duplicate definition of production 'foo', already declared in grammar 'first'");
        assertThat(error.location().lineNumber()).isEqualTo(21);
        assertThat(error.location().columnNumber()).isEqualTo(1);
        assertThat(grammar.bundleNames()).containsExactly("first");
    }

    @Test
    void duplicateProductionWithinBundleIsError() {
        final var outcome = Conditions.run(() -> parse("'''foo ::= BAR\n\nfoo ::= BAZ'''"));
        assertThat(outcome.requireError()).isInstanceOf(DeclarationErrorCondition.class);
        assertThat(outcome.requireError().message())
            .isEqualTo("duplicate definition of production 'foo', already declared in grammar 'test'");
    }

    @Test
    void duplicateBundleIsError() {
        final var grammar = new Grammar();
        final var parser = new Parser(grammar);
        final var outcome = Conditions.run(() -> {
            parser.parse("file", "'''foo ::= BAR'''", location);
            parser.parse("file", "'''bar ::= FOO'''", location);
        });
        assertThat(outcome.requireError()).isInstanceOf(DeclarationErrorCondition.class);
        assertThat(outcome.requireError().message()).isEqualTo("duplicate definition of grammar bundle 'file'");
    }

    @Test
    void sealedGrammarRejectsBundles() {
        final var grammar = new Grammar();
        grammar.seal();
        assertThatExceptionOfType(IllegalStateException.class)
            .isThrownBy(() -> new Parser(grammar).parse("file", "'''foo ::= BAR'''", location));
    }

    // Alternatives never directly contain alternatives, sequences never directly contain either; the notation has no
    // grouping other than brackets and braces.
    private static Expansion randomExpansion(final RandomGenerator generator, final int depth) {
        if (generator.nextInt(3) != 0) {
            return randomSequence(generator, depth);
        }
        final var members = new ArrayList<Expansion>();
        final var count = 2 + generator.nextInt(3);
        for (int i = 0; i < count; i += 1) {
            members.add(randomSequence(generator, depth));
        }
        return new Expansion.Alternatives(members);
    }

    private static Expansion randomSequence(final RandomGenerator generator, final int depth) {
        if (generator.nextBoolean()) {
            return randomFragment(generator, depth);
        }
        final var members = new ArrayList<Expansion>();
        final var count = 2 + generator.nextInt(3);
        for (int i = 0; i < count; i += 1) {
            members.add(randomFragment(generator, depth));
        }
        return new Expansion.Sequence(members);
    }

    private static Expansion randomFragment(final RandomGenerator generator, final int depth) {
        final var choice = generator.nextInt((depth < 3) ? 5 : 3);
        return switch (choice) {
            case 0 -> new Expansion.Literal(
                Expansion.LiteralKind.SYMBOL, RandomUtils.pick(generator, symbols), null, location);
            case 1 -> new Expansion.Literal(
                Expansion.LiteralKind.TERMINAL,
                RandomUtils.pick(generator, terminals),
                generator.nextBoolean() ? RandomUtils.pick(generator, terminalSuffixes) : null,
                location
            );
            case 2 -> new Expansion.Literal(
                Expansion.LiteralKind.NONTERMINAL,
                RandomUtils.pick(generator, nonterminals),
                generator.nextBoolean() ? RandomUtils.pick(generator, nonterminalSuffixes) : null,
                location
            );
            case 3 -> new Expansion.Optional(randomExpansion(generator, depth + 1), location);
            default -> new Expansion.Repeated(randomExpansion(generator, depth + 1), location);
        };
    }

    private static Grammar parse(final String text) {
        final var grammar = new Grammar();
        new Parser(grammar).parse("test", text, location);
        return grammar;
    }

    private static Production requireProduction(final Grammar grammar, final String name) {
        final var production = grammar.production(name);
        assertThat(production).isNotNull();
        return production;
    }

    private static void assertLiteral(final Expansion expansion, final Expansion.LiteralKind kind, final String name) {
        assertThat(expansion).isInstanceOf(Expansion.Literal.class);
        final var literal = (Expansion.Literal) expansion;
        assertThat(literal.kind()).isEqualTo(kind);
        assertThat(literal.name()).isEqualTo(name);
    }

    private static final SourceLocation location = new SourceLocation("manual.lrm", 1, 1, 0);
    private static final List<String> symbols = List.of("begin", ";", "::=", "|", "[", "}", "a b");
    private static final List<String> terminals = List.of("IDENTIFIER", "INTEGER_LITERAL", "X");
    private static final List<String> terminalSuffixes = List.of("name", "value");
    private static final List<String> nonterminals = List.of("expression", "beta_gamma", "x");
    private static final List<String> nonterminalSuffixes = List.of("LEFT", "RIGHT");
}
