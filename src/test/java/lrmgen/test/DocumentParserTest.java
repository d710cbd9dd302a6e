// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;
import lrmgen.document.DocumentParseErrorCondition;
import lrmgen.document.DocumentParser;
import lrmgen.document.Entry;
import lrmgen.document.Manual;
import lrmgen.sexp.SymbolTable;
import lrmgen.sexp.reader.ByteStream;
import lrmgen.sexp.reader.Reader;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import org.junit.jupiter.params.provider.MethodSource;

final class DocumentParserTest {
    @Test
    void parsesEveryEntryKind() {
        final var manual = parse("""
            (deflrm :title "Toy Language Reference" :license "Licensed under the `GFDL`.")
            (deftext :section ("Lexis") "Source files" "are UTF-8.")
            (defterminal IDENTIFIER :section ("Lexis" "Identifiers") :def "[a-z]+" "Names.")
            (defkeywords :section ("Lexis" "Keywords") :bullets ("package" "type"))
            (defpunctuation :bullets ("`(` and `)`" "`;`"))
            (defgrammar file_preamble :section ("Files") :bnf '''file ::= 'package' IDENTIFIER ';'''' "A file.")
            (defsemantics :kind "Static" "Checked early.")
            (defrecommendation "Cache it.")
            (defexample "See below.")
            """);
        assertThat(manual.title()).isEqualTo("Toy Language Reference");
        assertThat(manual.license()).isEqualTo("Licensed under the `GFDL`.");
        final var entries = manual.entries();
        assertThat(entries).hasSize(8);

        final var text = (Entry.Text) entries.get(0);
        assertThat(text.body().section()).containsExactly("Lexis");
        assertThat(text.body().text()).isEqualTo("Source files are UTF-8.");
        assertThat(text.location().lineNumber()).isEqualTo(2);

        final var terminal = (Entry.Terminal) entries.get(1);
        assertThat(terminal.name()).isEqualTo("IDENTIFIER");
        assertThat(terminal.definition()).isEqualTo("[a-z]+");
        assertThat(terminal.body().section()).containsExactly("Lexis", "Identifiers");

        final var keywords = (Entry.Keywords) entries.get(2);
        assertThat(keywords.body().bullets()).extracting(bullet -> bullet.text()).containsExactly("package", "type");
        assertThat(keywords.body().text()).isEmpty();

        final var punctuation = (Entry.Punctuation) entries.get(3);
        assertThat(punctuation.body().section()).isEmpty();
        assertThat(punctuation.body().bullets()).hasSize(2);

        final var grammar = (Entry.GrammarBlock) entries.get(4);
        assertThat(grammar.declaration().name()).isEqualTo("file_preamble");
        assertThat(grammar.declaration().rawText()).isEqualTo("'''file ::= 'package' IDENTIFIER ';''''");
        assertThat(grammar.declaration().location().lineNumber()).isEqualTo(6);
        assertThat(grammar.body().text()).isEqualTo("A file.");

        final var semantics = (Entry.Semantics) entries.get(5);
        assertThat(semantics.kind()).isEqualTo("Static");
        assertThat(semantics.extraHeading()).isEqualTo("Static Semantics");
        assertThat(entries.get(6).extraHeading()).isEqualTo("Implementation Recommendation");
        assertThat(entries.get(7).extraHeading()).isEqualTo("Example");
        assertThat(entries.get(0).extraHeading()).isNull();
    }

    @Test
    void plainStringGrammarIsPassedThrough() {
        final var manual = parse("(deflrm :title \"T\")\n(defgrammar g :bnf \"foo ::= BAR\")");
        final var grammar = (Entry.GrammarBlock) manual.entries().get(0);
        assertThat(grammar.declaration().rawText()).isEqualTo("foo ::= BAR");
        assertThat(manual.license()).isNull();
    }

    static Stream<Arguments> malformedSources() {
        return Stream.of(
            arguments("", "Cannot magically turn empty input into a manual"),
            arguments("(deftext \"x\")", "This doesn't appear to be a valid deflrm form: (deftext\n \"x\")"),
            arguments("(deflrm)", "Required property :title not found"),
            arguments("(deflrm :title \"T\" \"extra\")", "The deflrm form accepts no text"),
            arguments("(deflrm :title \"T\" :title \"U\")", "Duplicate value for property :title"),
            arguments("(deflrm :title \"T\" :license x)", "Property :license doesn't appear to be a string: x"),
            arguments(header + "(deftext :title \"x\")", "Property key :title not allowed in this context"),
            arguments(
                header + "(deftext :section (\"a\") :section (\"b\"))",
                "Duplicate value for property :section"
            ),
            arguments(header + "(defterminal :def \"x\")", "This entry kind requires a name"),
            arguments(header + "(defterminal FOO)", "Required property :def not found"),
            arguments(header + "(defsemantics \"x\")", "Required property :kind not found"),
            arguments(header + "(defgrammar g :bnf x)", "Property :bnf doesn't appear to be a string: x"),
            arguments(header + "(defgrammar g :bnf '''''')(defgrammar g :bnf '''''')", "Duplicate entry name g"),
            arguments(header + "(deflrm :title \"U\")", "Unknown manual entry kind deflrm"),
            arguments(header + "(defunknown)", "This doesn't appear to be a valid manual entry: (defunknown)"),
            arguments(header + "(deftext :bullets (x))", "This doesn't appear to be a bullet point: x"),
            arguments(header + "(deftext :section \"x\")", "Property :section doesn't appear to be a list: \"x\""),
            arguments(header + "(deftext \"a\" b)", "Entry text doesn't appear to be a string: b")
        );
    }

    @ParameterizedTest
    @MethodSource("malformedSources")
    void reportsStructuralErrors(final String source, final String message) {
        final var outcome = Conditions.run(() -> parse(source));
        assertThat(outcome.requireError()).isInstanceOf(DocumentParseErrorCondition.class);
        assertThat(outcome.requireError().message()).isEqualTo(message);
    }

    @Test
    void errorsPointAtEntry() {
        final var outcome = Conditions.run(() -> parse(header + "\n\n  (defterminal FOO)"));
        final var error = (DocumentParseErrorCondition) outcome.requireError();
        assertThat(error.location().lineNumber()).isEqualTo(3);
        assertThat(error.location().columnNumber()).isEqualTo(3);
    }

    private static Manual parse(final String source) {
        final var stream = new ByteStream(new ByteArrayInputStream(source.getBytes(StandardCharsets.UTF_8)));
        return DocumentParser.parseManualForms(new Reader(stream, new SymbolTable(), "manual.lrm"));
    }

    private static final String header = "(deflrm :title \"T\")";
}
