// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

/**
 * The kinds of grammar notation tokens.
 */
public enum TokenKind {
    /** {@code foo} or {@code foo_NAME}. */
    NONTERMINAL("nonterminal"),
    /** {@code FOO} or {@code FOO_name}. */
    TERMINAL("terminal"),
    PRODUCTION("'::='"),
    ALTERNATIVE("'|'"),
    /** A quoted literal, such as {@code 'package'}. */
    SYMBOL("quoted symbol"),
    OPEN_OPTIONAL("'['"),
    CLOSE_OPTIONAL("']'"),
    OPEN_REPEAT("'{'"),
    CLOSE_REPEAT("'}'"),
    /** A blank line, or the end of the grammar text. */
    RULE_END("end of rule");

    TokenKind(final String readableName) {
        this.readableName = readableName;
    }

    @Override
    public String toString() {
        return readableName;
    }

    private final String readableName;
}
