// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import java.util.List;
import java.util.Objects;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * A utility class containing common operations on {@link Expansion} trees.
 */
public final class Expansions {
    private Expansions() {
    }

    /**
     * Returns {@code true} iff both trees have the same shape and the same literals, ignoring source locations.
     */
    @CheckReturnValue
    public static boolean structurallyEqual(final Expansion left, final Expansion right) {
        return left.accept(new Comparison(right));
    }

    private static boolean allStructurallyEqual(final List<Expansion> left, final List<Expansion> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i += 1) {
            if (!structurallyEqual(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    private record Comparison(Expansion other) implements Expansion.Visitor<Boolean> {
        @Override
        public Boolean visitLiteral(final Expansion.Literal literal) {
            return other instanceof Expansion.Literal that
                && literal.kind() == that.kind()
                && literal.name().equals(that.name())
                && Objects.equals(literal.suffix(), that.suffix());
        }

        @Override
        public Boolean visitOptional(final Expansion.Optional optional) {
            return other instanceof Expansion.Optional that && structurallyEqual(optional.inner(), that.inner());
        }

        @Override
        public Boolean visitRepeated(final Expansion.Repeated repeated) {
            return other instanceof Expansion.Repeated that && structurallyEqual(repeated.inner(), that.inner());
        }

        @Override
        public Boolean visitSequence(final Expansion.Sequence sequence) {
            return other instanceof Expansion.Sequence that && allStructurallyEqual(sequence.members(), that.members());
        }

        @Override
        public Boolean visitAlternatives(final Expansion.Alternatives alternatives) {
            return other instanceof Expansion.Alternatives that
                && allStructurallyEqual(alternatives.members(), that.members());
        }
    }
}
