// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import lrmgen.source.SourceLocation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A grammar notation token.
 *
 * @param kind     The kind of the token.
 * @param value    For names, the base name; for symbols, the text between the quotes; {@code null} otherwise.
 * @param suffix   For names, the disambiguating suffix, if any.
 * @param start    The index of the first character of the token within the grammar text.
 * @param end      The index of the last character of the token within the grammar text.
 * @param location The location of the token in the manual source.
 */
public record Token(
    TokenKind kind,
    @Nullable String value,
    @Nullable String suffix,
    int start,
    int end,
    SourceLocation location
) {
    public Token {
        if (start > end) {
            throw new IllegalArgumentException("Token ends before it starts: " + start + " > " + end);
        }
    }
}
