// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lrmgen.sexp.Sexp;
import lrmgen.sexp.Sexps;
import lrmgen.sexp.SymbolTable;
import lrmgen.sexp.reader.ByteStream;
import lrmgen.sexp.reader.ReadErrorCondition;
import lrmgen.sexp.reader.Reader;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class ReaderTest {
    @Test
    void readsListsSymbolsAndStrings() {
        final var forms = read("(deftext :section (\"Intro\") \"Hello, \\\"world\\\"\") ; trailing comment\n");
        assertThat(forms).hasSize(1);
        final var list = Sexps.asList(forms.get(0));
        assertThat(list).isNotNull().hasSize(4);
        assertThat(list.get(0)).isSameAs(Sexp.KnownSymbol.DEFTEXT);
        assertThat(list.get(1)).isSameAs(Sexp.KnownSymbol.KW_SECTION);
        assertThat(Sexps.asList(list.get(2))).extracting(Sexps::asString).containsExactly("Intro");
        assertThat(Sexps.asString(list.get(3))).isEqualTo("Hello, \"world\"");
    }

    @Test
    void internsSymbols() {
        final var forms = read("(foo foo :bar) nil ()");
        final var list = Sexps.asList(forms.get(0));
        assertThat(list).isNotNull();
        assertThat(list.get(0)).isSameAs(list.get(1));
        assertThat(Sexps.asKeyword(list.get(2))).isNotNull();
        assertThat(Sexps.asKeyword(list.get(0))).isNull();
        assertThat(forms.get(1)).isSameAs(Sexp.KnownSymbol.NIL);
        assertThat(Sexps.isNil(forms.get(2))).isTrue();
    }

    @Test
    void readsRawStringVerbatim() {
        final var forms = read("(defgrammar g :bnf '''foo ::= 'a' \"b\" \\c\n\nbar ::= D''')");
        final var list = Sexps.asList(forms.get(0));
        assertThat(list).isNotNull();
        final var raw = (Sexp.RawString) list.get(3);
        assertThat(raw.text()).isEqualTo("'''foo ::= 'a' \"b\" \\c\n\nbar ::= D'''");
        assertThat(raw.location().lineNumber()).isEqualTo(1);
        assertThat(raw.location().columnNumber()).isEqualTo(20);
        assertThat(raw.location().offset()).isEqualTo(19);
    }

    @Test
    void rawStringMayEndWithQuote() {
        final var forms = read("'''x ::= 'a'''' next");
        assertThat(((Sexp.RawString) forms.get(0)).text()).isEqualTo("'''x ::= 'a''''");
        assertThat(forms.get(1)).isInstanceOf(Sexp.RegularSymbol.class);
    }

    @Test
    void rawStringIsNotString() {
        final var forms = read("'''text'''");
        assertThat(Sexps.asString(forms.get(0))).isNull();
    }

    @Test
    void tracksLocations() {
        final var forms = read("; header\n\n  (a\n   \"two\")");
        final var list = (Sexp.List) forms.get(0);
        assertThat(list.location().lineNumber()).isEqualTo(3);
        assertThat(list.location().columnNumber()).isEqualTo(3);
        final var string = (Sexp.String) list.value().get(1);
        assertThat(string.location().lineNumber()).isEqualTo(4);
        assertThat(string.location().columnNumber()).isEqualTo(4);
        assertThat(string.location().sourceName()).isEqualTo("test.lrm");
    }

    @Test
    void decodesUtf8() {
        final var forms = read("\"Zażółć\"");
        assertThat(Sexps.asString(forms.get(0))).isEqualTo("Zażółć");
    }

    @Test
    void emptyInputHasNoForms() {
        assertThat(read("  ; nothing\n")).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', quoteCharacter = '"', value = {
        "(a b; Expected closing ')' but found end of input instead",
        "); Expected a form, but found ')' instead",
        "(a #b); Reserved character '#' found",
        "(a |b|); Reserved character '|' found",
        "'x'; Expected ''' to open a raw string",
        "'''abc; Expected closing ''' but found end of input instead",
    })
    void reportsReadErrors(final String text, final String message) {
        final var outcome = Conditions.run(() -> read(text));
        assertThat(outcome.requireError()).isInstanceOf(ReadErrorCondition.class);
        assertThat(outcome.requireError().message()).isEqualTo(message);
    }

    @Test
    void unterminatedStringIsError() {
        final var outcome = Conditions.run(() -> read("(a \"b"));
        assertThat(outcome.requireError().message()).isEqualTo("Expected closing '\"' but found end of input instead");
    }

    @Test
    void controlCharacterIsError() {
        final var outcome = Conditions.run(() -> read("(a \u0001)"));
        assertThat(outcome.requireError().message()).isEqualTo("Reserved control character U+0001 found");
    }

    @Test
    void deepNestingIsError() {
        final var outcome = Conditions.run(() -> read("(".repeat(200) + ")".repeat(200)));
        assertThat(outcome.requireError().message()).isEqualTo("Recursion limit reached, try to limit nesting");
    }

    private static List<Sexp> read(final String text) {
        final var stream = new ByteStream(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
        final var reader = new Reader(stream, new SymbolTable(), "test.lrm");
        final var forms = new ArrayList<Sexp>();
        for (Sexp form; (form = reader.readTopLevelForm()) != null; ) {
            forms.add(form);
        }
        return forms;
    }
}
