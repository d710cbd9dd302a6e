// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.document;

import lrmgen.bnf.GrammarDeclaration;
import lrmgen.source.SourceLocation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An entry of a manual: one top-level form of the source, other than {@code deflrm}.
 */
public sealed interface Entry {
    /**
     * Retrieves the section path, text and bullet points of this entry.
     */
    Body body();

    /**
     * Retrieves the location of the form this entry was parsed from.
     */
    SourceLocation location();

    /**
     * Retrieves the heading this kind of entry adds below its section path, or {@code null} if it adds none.
     */
    default @Nullable String extraHeading() {
        return null;
    }

    /**
     * Plain descriptive text, {@code deftext}.
     */
    record Text(Body body, SourceLocation location) implements Entry {
    }

    /**
     * A terminal class, such as identifiers, defined by a regular expression; {@code defterminal}.
     */
    record Terminal(String name, String definition, Body body, SourceLocation location) implements Entry {
    }

    /**
     * A list of keywords, {@code defkeywords}. Every bullet point is a keyword and declares a terminal.
     */
    record Keywords(Body body, SourceLocation location) implements Entry {
    }

    /**
     * A list of punctuation, {@code defpunctuation}. Every back-quoted run in a bullet point declares a terminal.
     */
    record Punctuation(Body body, SourceLocation location) implements Entry {
    }

    /**
     * A grammar bundle, {@code defgrammar}.
     */
    record GrammarBlock(GrammarDeclaration declaration, Body body, SourceLocation location) implements Entry {
    }

    /**
     * A semantic rule of the given kind, such as "Static" or "Dynamic"; {@code defsemantics}.
     */
    record Semantics(String kind, Body body, SourceLocation location) implements Entry {
        @Override
        public String extraHeading() {
            return kind + " Semantics";
        }
    }

    /**
     * Advice for implementers, {@code defrecommendation}.
     */
    record Recommendation(Body body, SourceLocation location) implements Entry {
        @Override
        public String extraHeading() {
            return "Implementation Recommendation";
        }
    }

    /**
     * An example, {@code defexample}.
     */
    record Example(Body body, SourceLocation location) implements Entry {
        @Override
        public String extraHeading() {
            return "Example";
        }
    }
}
