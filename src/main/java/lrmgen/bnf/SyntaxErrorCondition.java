// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import lrmgen.source.LocatedCondition;
import lrmgen.source.SourceLocation;

/**
 * A condition type indicating that a grammar bundle does not follow the production syntax.
 */
public final class SyntaxErrorCondition extends LocatedCondition {
    SyntaxErrorCondition(final String message, final SourceLocation location) {
        super(message, location);
    }
}
