// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import lrmgen.source.LocatedCondition;
import lrmgen.source.SourceLocation;

/**
 * A warning indicating that a production refers to a terminal or a production nobody declared.
 * <p>
 * Signaled with {@link lrmgen.util.condition.ConditionContext#signal(lrmgen.util.condition.Condition)}: it never
 * stops generation.
 */
public final class UnknownReferenceCondition extends LocatedCondition {
    UnknownReferenceCondition(final Target target, final String name, final SourceLocation location) {
        super("unknown " + target + " '" + name + '\'', location);
        this.target = target;
        this.name = name;
    }

    /**
     * Retrieves what kind of declaration was expected.
     */
    public Target target() {
        return target;
    }

    /**
     * Retrieves the name that could not be resolved.
     */
    public String name() {
        return name;
    }

    private final Target target;
    private final String name;

    /**
     * The kinds of declarations a reference can point to.
     */
    public enum Target {
        TERMINAL("terminal"),
        PRODUCTION("production");

        Target(final String readableName) {
            this.readableName = readableName;
        }

        @Override
        public String toString() {
            return readableName;
        }

        private final String readableName;
    }
}
