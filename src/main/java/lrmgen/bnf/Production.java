// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import lrmgen.source.SourceLocation;

/**
 * A production: a nonterminal together with its expansion.
 *
 * @param name      The name of the nonterminal being defined.
 * @param expansion The right-hand side.
 * @param location  The location of the nonterminal on the left-hand side.
 */
public record Production(String name, Expansion expansion, SourceLocation location) {
}
