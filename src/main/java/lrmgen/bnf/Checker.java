// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import lrmgen.util.Trace;
import lrmgen.util.condition.ConditionContext;

/**
 * Cross-reference validation of a sealed {@link Grammar}.
 * <p>
 * Every literal of every production is looked up: quoted symbols must be registered terminals, nonterminals must have
 * a production. Terminal names such as {@code IDENTIFIER} are not looked up. Each failed lookup signals a non-fatal
 * {@link UnknownReferenceCondition}.
 */
public final class Checker {
    private Checker() {
    }

    /**
     * Checks every production of the given grammar, in declaration order.
     *
     * @throws IllegalStateException if the grammar has not been sealed yet.
     */
    public static void check(final Grammar grammar) {
        if (!grammar.isSealed()) {
            throw new IllegalStateException("Only a sealed grammar can be checked");
        }
        try (final var trace = new Trace("Checking grammar references")) {
            trace.use();
            final var visitor = new ReferenceVisitor(grammar);
            for (final var production : grammar.productions()) {
                production.expansion().accept(visitor);
            }
        }
    }

    private record ReferenceVisitor(Grammar grammar) implements Expansion.Visitor<Void> {
        @Override
        public Void visitLiteral(final Expansion.Literal literal) {
            switch (literal.kind()) {
                case SYMBOL -> {
                    if (!grammar.hasTerminal(literal.name())) {
                        warn(UnknownReferenceCondition.Target.TERMINAL, literal);
                    }
                }
                case NONTERMINAL -> {
                    if (!grammar.hasProduction(literal.name())) {
                        warn(UnknownReferenceCondition.Target.PRODUCTION, literal);
                    }
                }
                case TERMINAL -> {
                    // Terminal classes are described in prose, there is nothing to look them up in.
                }
            }
            return null;
        }

        @Override
        public Void visitOptional(final Expansion.Optional optional) {
            return optional.inner().accept(this);
        }

        @Override
        public Void visitRepeated(final Expansion.Repeated repeated) {
            return repeated.inner().accept(this);
        }

        @Override
        public Void visitSequence(final Expansion.Sequence sequence) {
            for (final var member : sequence.members()) {
                member.accept(this);
            }
            return null;
        }

        @Override
        public Void visitAlternatives(final Expansion.Alternatives alternatives) {
            for (final var member : alternatives.members()) {
                member.accept(this);
            }
            return null;
        }

        private static void warn(final UnknownReferenceCondition.Target target, final Expansion.Literal literal) {
            ConditionContext.signal(new UnknownReferenceCondition(target, literal.name(), literal.location()));
        }
    }
}
