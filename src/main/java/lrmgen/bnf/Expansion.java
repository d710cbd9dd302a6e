// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import java.util.List;
import lrmgen.source.SourceLocation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The right-hand side of a production, or any part of it.
 * <p>
 * Expansions are immutable trees: every node owns its children, nothing is shared. {@link Sequence} and
 * {@link Alternatives} always have at least two members; the parser collapses single-member lists.
 * <p>
 * Code that needs to handle every kind of node implements {@link Visitor}, so that adding a node kind breaks every
 * such place at compile time.
 */
public sealed interface Expansion {
    /**
     * Retrieves the location of the first token of this expansion.
     */
    SourceLocation location();

    /**
     * Calls the {@code visitor} method corresponding to the kind of this node.
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * A reference to a terminal, a nonterminal, or a quoted symbol.
     *
     * @param kind     What the literal refers to.
     * @param name     The base name for terminals and nonterminals, the text between the quotes for symbols.
     * @param suffix   The disambiguating suffix of a terminal or nonterminal, if any.
     * @param location Where the literal was found.
     */
    record Literal(LiteralKind kind, String name, @Nullable String suffix, SourceLocation location)
        implements Expansion {
        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /**
     * {@code [ inner ]}: zero or one occurrence.
     */
    record Optional(Expansion inner, SourceLocation location) implements Expansion {
        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitOptional(this);
        }
    }

    /**
     * <code>{ inner }</code>: zero or more occurrences.
     */
    record Repeated(Expansion inner, SourceLocation location) implements Expansion {
        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitRepeated(this);
        }
    }

    /**
     * Concatenation of two or more members, in order.
     */
    record Sequence(List<Expansion> members) implements Expansion {
        public Sequence {
            members = requireSeveral(members, "sequence");
        }

        @Override
        public SourceLocation location() {
            return members.get(0).location();
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitSequence(this);
        }
    }

    /**
     * A choice between two or more members, kept in declaration order.
     */
    record Alternatives(List<Expansion> members) implements Expansion {
        public Alternatives {
            members = requireSeveral(members, "alternation");
        }

        @Override
        public SourceLocation location() {
            return members.get(0).location();
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAlternatives(this);
        }
    }

    /**
     * The kinds of things a {@link Literal} can refer to.
     */
    enum LiteralKind {
        TERMINAL,
        NONTERMINAL,
        SYMBOL
    }

    /**
     * An operation over every kind of expansion node.
     */
    interface Visitor<R> {
        R visitLiteral(Literal literal);

        R visitOptional(Optional optional);

        R visitRepeated(Repeated repeated);

        R visitSequence(Sequence sequence);

        R visitAlternatives(Alternatives alternatives);
    }

    private static List<Expansion> requireSeveral(
        final List<Expansion> members,
        final String what
    ) {
        if (members.size() < 2) {
            throw new IllegalArgumentException("A " + what + " needs at least two members, got " + members.size());
        }
        return List.copyOf(members);
    }
}
