// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import lrmgen.source.LocatedCondition;
import lrmgen.source.SourceLocation;

/**
 * A condition type indicating that a production, terminal or grammar bundle was declared more than once, or that an
 * empty terminal was declared.
 */
public final class DeclarationErrorCondition extends LocatedCondition {
    DeclarationErrorCondition(final String message, final SourceLocation location) {
        super(message, location);
    }
}
