// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import lrmgen.source.SourceLocation;

/**
 * A grammar bundle as found in a manual source, before parsing.
 *
 * @param name     The name of the bundle, unique within the manual.
 * @param rawText  The unprocessed source text of the grammar field, delimiters included.
 * @param location The location of the opening delimiter.
 */
public record GrammarDeclaration(String name, String rawText, SourceLocation location) {
}
