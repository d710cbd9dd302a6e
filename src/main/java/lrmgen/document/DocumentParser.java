// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.document;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import lrmgen.bnf.GrammarDeclaration;
import lrmgen.sexp.Sexp;
import lrmgen.sexp.Sexps;
import lrmgen.sexp.reader.Reader;
import lrmgen.source.SourceLocation;
import lrmgen.util.Trace;
import lrmgen.util.condition.ConditionContext;
import lrmgen.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The manual parser: the primary means of turning S-expressions into a {@link Manual}.
 * <p>
 * The first form must be {@code (deflrm :title "...")}, optionally with a {@code :license} notice. Every following
 * form is an entry: a head symbol, a name for the entry kinds that have one, {@code :keyword value} properties, and
 * finally the strings making up the paragraph text.
 */
public final class DocumentParser {
    private DocumentParser(final Reader reader) {
        this.reader = reader;
    }

    /**
     * Parses the forms coming from the given S-expression {@code reader} into a {@link Manual}.
     * <p>
     * On error, a fatal condition is signaled:
     * <ul>
     * <li>{@link DocumentParseErrorCondition} if the forms don't describe a valid manual.
     * <li>Any condition type that {@link Reader} can signal, if there's a problem with parsing S-expressions
     * themselves.
     * </ul>
     *
     * @return The freshly parsed manual.
     */
    public static Manual parseManualForms(final Reader reader) {
        return new DocumentParser(reader).parse();
    }

    private Manual parse() {
        final var front = parseDeflrm();
        parseEntries();
        return new Manual(front.title, front.license, entries);
    }

    private FrontMatter parseDeflrm() {
        try (final var trace = new Trace("Parsing the deflrm form")) {
            trace.use();
            final var form = reader.readTopLevelForm();
            if (form == null) {
                throw signalError(
                    "Cannot magically turn empty input into a manual",
                    new SourceLocation(reader.sourceName(), 1, 1, 0)
                );
            }
            final var location = locationOf(form, reader.topLevelFormLocation());
            final var list = Sexps.asList(form);
            if (list == null || list.isEmpty() || list.get(0) != Sexp.KnownSymbol.DEFLRM) {
                throw signalError(
                    "This doesn't appear to be a valid deflrm form: " + Sexps.prettyPrint(form), location);
            }
            final var properties = extractProperties(list.subList(1, list.size()), allowedDeflrmKeys, location);
            if (!properties.tail.isEmpty()) {
                throw signalError("The deflrm form accepts no text", location);
            }
            final var title =
                parseString(properties.require(Sexp.KnownSymbol.KW_TITLE), Sexp.KnownSymbol.KW_TITLE, location);
            final var licenseSexp = properties.properties.get(Sexp.KnownSymbol.KW_LICENSE);
            final var license = (licenseSexp != null)
                ? parseString(licenseSexp, Sexp.KnownSymbol.KW_LICENSE, location)
                : null;
            return new FrontMatter(title, license);
        }
    }

    private void parseEntries() {
        try (final var outerTrace = new Trace("Parsing manual entries")) {
            outerTrace.use();
            int entryCounter = 1; // Count entries for improved trace readability.
            for (@Nullable Sexp form; (form = reader.readTopLevelForm()) != null; entryCounter += 1) {
                final var entryIndex = entryCounter;
                try (final var innerTrace = new Trace(() -> "Parsing manual entry #" + entryIndex)) {
                    innerTrace.use();
                    entries.add(parseEntry(form));
                }
            }
        }
    }

    private Entry parseEntry(final Sexp form) {
        final var location = locationOf(form, reader.topLevelFormLocation());
        final var list = Sexps.asList(form);
        if (list == null || list.isEmpty() || !(list.get(0) instanceof Sexp.KnownSymbol head)) {
            throw signalError("This doesn't appear to be a valid manual entry: " + Sexps.prettyPrint(form), location);
        }
        final var tail = list.subList(1, list.size());
        return switch (head) {
            case DEFTEXT -> new Entry.Text(parseBody(extractCommon(tail, Set.of(), location), location), location);
            case DEFKEYWORDS ->
                new Entry.Keywords(parseBody(extractCommon(tail, Set.of(), location), location), location);
            case DEFPUNCTUATION ->
                new Entry.Punctuation(parseBody(extractCommon(tail, Set.of(), location), location), location);
            case DEFRECOMMENDATION ->
                new Entry.Recommendation(parseBody(extractCommon(tail, Set.of(), location), location), location);
            case DEFEXAMPLE ->
                new Entry.Example(parseBody(extractCommon(tail, Set.of(), location), location), location);
            case DEFSEMANTICS -> parseSemantics(tail, location);
            case DEFTERMINAL -> parseTerminal(tail, location);
            case DEFGRAMMAR -> parseGrammar(tail, location);
            default -> throw signalError("Unknown manual entry kind " + head, location);
        };
    }

    private Entry.Semantics parseSemantics(final List<Sexp> tail, final SourceLocation location) {
        final var properties = extractCommon(tail, EnumSet.of(Sexp.KnownSymbol.KW_KIND), location);
        final var kind = parseString(properties.require(Sexp.KnownSymbol.KW_KIND), Sexp.KnownSymbol.KW_KIND, location);
        return new Entry.Semantics(kind, parseBody(properties, location), location);
    }

    private Entry.Terminal parseTerminal(final List<Sexp> tail, final SourceLocation location) {
        final var name = parseEntryName(tail, location);
        try (final var trace = new Trace(() -> "Parsing terminal " + name)) {
            trace.use();
            final var properties = extractCommon(
                tail.subList(1, tail.size()), EnumSet.of(Sexp.KnownSymbol.KW_DEF), location);
            final var definition =
                parseString(properties.require(Sexp.KnownSymbol.KW_DEF), Sexp.KnownSymbol.KW_DEF, location);
            return new Entry.Terminal(name, definition, parseBody(properties, location), location);
        }
    }

    private Entry.GrammarBlock parseGrammar(final List<Sexp> tail, final SourceLocation location) {
        final var name = parseEntryName(tail, location);
        try (final var trace = new Trace(() -> "Parsing grammar " + name)) {
            trace.use();
            final var properties = extractCommon(
                tail.subList(1, tail.size()), EnumSet.of(Sexp.KnownSymbol.KW_BNF), location);
            final var value = properties.require(Sexp.KnownSymbol.KW_BNF);
            final GrammarDeclaration declaration;
            if (value instanceof Sexp.RawString rawString) {
                declaration = new GrammarDeclaration(name, rawString.text(), rawString.location());
            } else if (value instanceof Sexp.String string) {
                // Passed on as is, so that the grammar parser reports the missing delimiters.
                declaration = new GrammarDeclaration(name, string.value(), string.location());
            } else {
                throw signalError(
                    "Property " + Sexp.KnownSymbol.KW_BNF + " doesn't appear to be a string: "
                        + Sexps.prettyPrint(value),
                    locationOf(value, location)
                );
            }
            return new Entry.GrammarBlock(declaration, parseBody(properties, location), location);
        }
    }

    private String parseEntryName(final List<Sexp> tail, final SourceLocation location) {
        final var nameSexp = tail.isEmpty() ? null : Sexps.asSymbol(tail.get(0));
        if (nameSexp == null || Sexps.asKeyword(nameSexp) != null) {
            throw signalError("This entry kind requires a name", location);
        }
        final var name = nameSexp.symbolName();
        if (!entryNames.add(name)) {
            throw signalError("Duplicate entry name " + name, location);
        }
        return name;
    }

    private static ExtractedProperties extractCommon(
        final List<Sexp> list,
        final Set<Sexp.KnownSymbol> extraKeys,
        final SourceLocation location
    ) {
        final var allowedKeys = EnumSet.copyOf(commonKeys);
        allowedKeys.addAll(extraKeys);
        return extractProperties(list, allowedKeys, location);
    }

    private static Body parseBody(final ExtractedProperties properties, final SourceLocation location) {
        final var section = parseList(properties, Sexp.KnownSymbol.KW_SECTION, location, sexp -> {
            final var heading = Sexps.asString(sexp);
            if (heading == null) {
                throw signalError(
                    "This doesn't appear to be a section heading: " + Sexps.prettyPrint(sexp),
                    locationOf(sexp, location)
                );
            }
            return heading;
        });
        final var bullets = parseList(properties, Sexp.KnownSymbol.KW_BULLETS, location, sexp -> {
            if (!(sexp instanceof Sexp.String string)) {
                throw signalError(
                    "This doesn't appear to be a bullet point: " + Sexps.prettyPrint(sexp),
                    locationOf(sexp, location)
                );
            }
            return new Bullet(string.value(), string.location());
        });
        final var paragraphs = new ArrayList<String>();
        for (final var sexp : properties.tail) {
            final var paragraph = Sexps.asString(sexp);
            if (paragraph == null) {
                throw signalError(
                    "Entry text doesn't appear to be a string: " + Sexps.prettyPrint(sexp), locationOf(sexp, location));
            }
            paragraphs.add(paragraph);
        }
        return new Body(section, String.join(" ", paragraphs), bullets);
    }

    private static <T> List<T> parseList(
        final ExtractedProperties properties,
        final Sexp.KnownSymbol key,
        final SourceLocation location,
        final Function<Sexp, T> function
    ) {
        final var value = properties.get(key);
        final var list = Sexps.asList(value);
        if (list == null) {
            throw signalError(
                "Property " + key + " doesn't appear to be a list: " + Sexps.prettyPrint(value),
                locationOf(value, location)
            );
        }
        final var result = new ArrayList<T>(list.size());
        for (final var element : list) {
            result.add(function.apply(element));
        }
        return result;
    }

    private static String parseString(final Sexp value, final Sexp.KnownSymbol key, final SourceLocation location) {
        final var string = Sexps.asString(value);
        if (string == null) {
            throw signalError(
                "Property " + key + " doesn't appear to be a string: " + Sexps.prettyPrint(value),
                locationOf(value, location)
            );
        }
        return string;
    }

    private static ExtractedProperties extractProperties(
        final List<Sexp> list,
        final Set<? extends Sexp.Symbol> allowedKeys,
        final SourceLocation location
    ) {
        final var properties = new HashMap<Sexp.Symbol, Sexp>();
        var index = 0;
        while (index < list.size()) {
            final var keyword = Sexps.asKeyword(list.get(index));
            if (keyword == null) {
                break;
            }
            index += 1;
            if (!allowedKeys.contains(keyword)) {
                throw signalError("Property key " + keyword + " not allowed in this context", location);
            }
            final var value = (index < list.size()) ? list.get(index) : Sexp.KnownSymbol.NIL;
            index += 1;
            if (properties.put(keyword, value) != null) {
                throw signalError("Duplicate value for property " + keyword, location);
            }
        }
        return new ExtractedProperties(properties, list.subList(Math.min(index, list.size()), list.size()), location);
    }

    private static SourceLocation locationOf(final Sexp sexp, final SourceLocation fallback) {
        final var location = Sexps.locationOf(sexp);
        return (location != null) ? location : fallback;
    }

    private static UnhandledErrorError signalError(final String message, final SourceLocation location) {
        return ConditionContext.error(new DocumentParseErrorCondition(message, location));
    }

    private static final EnumSet<Sexp.KnownSymbol> allowedDeflrmKeys = EnumSet.of(
        Sexp.KnownSymbol.KW_TITLE,
        Sexp.KnownSymbol.KW_LICENSE
    );
    private static final EnumSet<Sexp.KnownSymbol> commonKeys = EnumSet.of(
        Sexp.KnownSymbol.KW_SECTION,
        Sexp.KnownSymbol.KW_BULLETS
    );

    private final Reader reader;
    private final ArrayList<Entry> entries = new ArrayList<>();
    private final HashSet<String> entryNames = new HashSet<>();

    private record FrontMatter(String title, @Nullable String license) {
    }

    private record ExtractedProperties(Map<Sexp.Symbol, Sexp> properties, List<Sexp> tail, SourceLocation location) {
        private Sexp get(final Sexp.Symbol symbol) {
            final var sexp = properties.get(symbol);
            return (sexp != null) ? sexp : Sexp.KnownSymbol.NIL;
        }

        private Sexp require(final Sexp.Symbol symbol) {
            final var sexp = properties.get(symbol);
            if (sexp == null) {
                throw signalError("Required property " + symbol + " not found", location);
            }
            return sexp;
        }
    }
}
