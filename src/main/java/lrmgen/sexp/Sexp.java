// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.sexp;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lrmgen.source.SourceLocation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Marker interface serving as the base type of S-expression objects.
 * <p>
 * S-expression objects are guaranteed to be immutable. Lists and strings remember where they were read from; symbols
 * are interned, so they don't.
 */
public sealed interface Sexp {
    /**
     * Base interface for Lisp symbols.
     * <p>
     * Symbol equality is guaranteed to be the same as object identity.
     */
    sealed interface Symbol extends Sexp {
        /**
         * Retrieves the name of this symbol.
         */
        java.lang.String symbolName();
    }

    /**
     * An S-expression list object.
     * <p>
     * Dotted lists are unsupported.
     *
     * @param location The location of the opening parenthesis.
     */
    record List(java.util.List<Sexp> value, SourceLocation location) implements Sexp {
        public List {
            value = java.util.List.copyOf(value);
        }
    }

    /**
     * An S-expression string object, {@code "..."}, with escapes already processed.
     *
     * @param location The location of the opening quote.
     */
    record String(java.lang.String value, SourceLocation location) implements Sexp {
    }

    /**
     * A raw string, {@code '''...'''}, taken verbatim from the source.
     *
     * @param text     The source text, <em>including</em> both delimiters.
     * @param location The location of the opening delimiter.
     */
    record RawString(java.lang.String text, SourceLocation location) implements Sexp {
    }

    /**
     * A regular Lisp symbol, not directly used by Java code.
     */
    final class RegularSymbol implements Sexp.Symbol {
        /**
         * Initializes a new, <em>uninterned</em> symbol.
         * <p>
         * Direct use of this constructor is usually not needed, prefer {@link SymbolTable#intern(java.lang.String)}
         * instead.
         */
        public RegularSymbol(final java.lang.String name) {
            this.name = name;
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private final java.lang.String name;
    }

    /**
     * Lisp symbols directly used by Java code.
     */
    enum KnownSymbol implements Sexp.Symbol {
        NIL("nil"),
        T("t"),
        DEFLRM("deflrm"),
        DEFTEXT("deftext"),
        DEFTERMINAL("defterminal"),
        DEFKEYWORDS("defkeywords"),
        DEFPUNCTUATION("defpunctuation"),
        DEFGRAMMAR("defgrammar"),
        DEFSEMANTICS("defsemantics"),
        DEFRECOMMENDATION("defrecommendation"),
        DEFEXAMPLE("defexample"),
        KW_BNF(":bnf"),
        KW_BULLETS(":bullets"),
        KW_DEF(":def"),
        KW_KIND(":kind"),
        KW_LICENSE(":license"),
        KW_SECTION(":section"),
        KW_TITLE(":title");

        KnownSymbol(final java.lang.String name) {
            this.name = name;
        }

        /**
         * Retrieves the known symbol with the given name, or {@code null} if there's none.
         */
        public static @Nullable KnownSymbol byName(final java.lang.String name) {
            return symbolsByName.get(name);
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private static final Map<java.lang.String, KnownSymbol> symbolsByName = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(KnownSymbol::symbolName, Function.identity()));

        private final java.lang.String name;
    }
}
