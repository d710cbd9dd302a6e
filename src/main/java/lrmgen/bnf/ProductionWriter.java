// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The output side of {@link ProductionRenderer}: receives a production piece by piece, in reading order.
 */
interface ProductionWriter {
    /**
     * Marks the place other productions link to. Called once, before the production's name.
     */
    void anchor(String productionName);

    /**
     * Writes punctuation, whitespace, quoted symbols, or the defined name.
     */
    void text(String text);

    /**
     * Writes a reference to a terminal.
     */
    void terminal(String name, @Nullable String suffix);

    /**
     * Writes a reference to a nonterminal; {@code declared} tells whether its production exists.
     */
    void nonterminal(String name, @Nullable String suffix, boolean declared);

    /**
     * Writes plain text into a {@link StringBuilder}. Suffixes are written as {@code _suffix}, so the output can be
     * parsed again.
     */
    final class Plain implements ProductionWriter {
        Plain(final StringBuilder builder) {
            this.builder = builder;
        }

        @Override
        public void anchor(final String productionName) {
            // Plain text has nowhere to put an anchor.
        }

        @Override
        public void text(final String text) {
            builder.append(text);
        }

        @Override
        public void terminal(final String name, final @Nullable String suffix) {
            appendName(name, suffix);
        }

        @Override
        public void nonterminal(final String name, final @Nullable String suffix, final boolean declared) {
            appendName(name, suffix);
        }

        private void appendName(final String name, final @Nullable String suffix) {
            builder.append(name);
            if (suffix != null) {
                builder.append('_').append(suffix);
            }
        }

        private final StringBuilder builder;
    }
}
