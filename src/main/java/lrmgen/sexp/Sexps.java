// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.sexp;

import java.util.List;
import lrmgen.source.SourceLocation;
import lrmgen.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A utility class containing common operations on S-expressions.
 */
public final class Sexps {
    private Sexps() {
    }

    /**
     * Returns the string the given {@code sexp} represents, or {@code null} if it doesn't represent a string.
     * <p>
     * Raw strings are not strings in this sense.
     */
    public static @Nullable String asString(final Sexp sexp) {
        return (sexp instanceof Sexp.String string) ? string.value() : null;
    }

    /**
     * Returns the list the given {@code sexp} represents, or {@code null} if it doesn't represent a list.
     * <p>
     * Note that the known symbol {@code nil} represents an empty list.
     */
    public static @Nullable List<Sexp> asList(final Sexp sexp) {
        if (sexp instanceof Sexp.List list) {
            return list.value();
        } else if (sexp == Sexp.KnownSymbol.NIL) {
            return List.of();
        } else {
            return null;
        }
    }

    /**
     * Returns the symbol the given {@code sexp} represents, or {@code null} if it doesn't represent a symbol.
     * <p>
     * Note that empty lists represent the known symbol {@code nil}.
     */
    public static Sexp.@Nullable Symbol asSymbol(final Sexp sexp) {
        if (sexp instanceof Sexp.Symbol symbol) {
            return symbol;
        } else if (sexp instanceof Sexp.List list && list.value().isEmpty()) {
            return Sexp.KnownSymbol.NIL;
        } else {
            return null;
        }
    }

    /**
     * Returns the passed sexp iff the given {@code symbol} represents a Lisp keyword, or {@code null} otherwise.
     * <p>
     * A Lisp keyword is any symbol whose name begins with a colon.
     */
    public static Sexp.@Nullable Symbol asKeyword(final Sexp sexp) {
        return (sexp instanceof Sexp.Symbol symbol && symbol.symbolName().startsWith(":")) ? symbol : null;
    }

    /**
     * Returns {@code true} iff the given {@code sexp} represents the symbol {@code nil}.
     * <p>
     * Note that empty lists represent {@code nil}.
     */
    public static boolean isNil(final Sexp sexp) {
        return sexp == Sexp.KnownSymbol.NIL || (sexp instanceof Sexp.List list && list.value().isEmpty());
    }

    /**
     * Retrieves the location the given {@code sexp} was read from, or {@code null} for symbols.
     */
    public static @Nullable SourceLocation locationOf(final Sexp sexp) {
        if (sexp instanceof Sexp.List list) {
            return list.location();
        } else if (sexp instanceof Sexp.String string) {
            return string.location();
        } else if (sexp instanceof Sexp.RawString rawString) {
            return rawString.location();
        } else {
            return null;
        }
    }

    /**
     * Pretty-prints the given S-expression into a string. Used in diagnostics.
     */
    public static String prettyPrint(final Sexp sexp) {
        final var prettyPrinter = new PrettyPrinter();
        prettyPrinter.prettyPrint(sexp);
        return prettyPrinter.builder.toString();
    }

    private static final class PrettyPrinter {
        private void prettyPrint(final Sexp sexp) {
            appendDispatch(sexp, 1);
        }

        private void appendDispatch(final Sexp sexp, final int level) {
            if (sexp instanceof Sexp.String string) {
                append(string.value());
            } else if (sexp instanceof Sexp.RawString rawString) {
                builder.append(rawString.text());
            } else if (sexp instanceof Sexp.List list) {
                append(list.value(), level);
            } else if (sexp instanceof Sexp.Symbol symbol) {
                builder.append(symbol.symbolName());
            } else {
                throw new UnreachableCodeReachedError();
            }
        }

        private void append(final String string) {
            final var replaced = string.replace("\\", "\\\\").replace("\"", "\\\"");
            builder.append('"');
            builder.append(replaced);
            builder.append('"');
        }

        private void append(final List<Sexp> list, final int level) {
            final var iterator = list.iterator();
            if (!iterator.hasNext()) {
                builder.append("()");
                return;
            }
            builder.append('(');
            appendDispatch(iterator.next(), level + 1);
            final var indentation = " ".repeat(level);
            while (iterator.hasNext()) {
                builder.append('\n');
                builder.append(indentation);
                appendDispatch(iterator.next(), level + 1);
            }
            builder.append(')');
        }

        private final StringBuilder builder = new StringBuilder();
    }
}
