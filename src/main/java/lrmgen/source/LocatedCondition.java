// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.source;

import lrmgen.util.condition.Condition;

/**
 * The base type of conditions describing a problem at a specific place in a manual source.
 */
public abstract class LocatedCondition extends Condition {
    protected LocatedCondition(final String message, final SourceLocation location) {
        super(message);
        this.location = location;
    }

    /**
     * Retrieves the place the problem was found at.
     */
    public final SourceLocation location() {
        return location;
    }

    @Override
    public final String detailedMessage() {
        return message() + '\n' + location;
    }

    private final SourceLocation location;
}
