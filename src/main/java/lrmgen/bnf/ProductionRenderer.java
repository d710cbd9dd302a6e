// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import java.util.List;
import lrmgen.dom.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The canonical production renderer.
 * <p>
 * Three forms are available:
 * <ul>
 * <li>{@link #renderLinear(Production)}: a single line, such as {@code foo ::= 'a' BAR | [ baz ]}.
 * <li>{@link #renderText(Production)}: the layout used in manuals, with every top-level alternative on its own line
 * and the {@code |} aligned under the {@code ::=}.
 * <li>{@link #renderHyperlinked(Production, Grammar)}: the same layout as DOM nodes, with an anchor for the production
 * and links to the productions it refers to.
 * </ul>
 * Output depends only on the expansion tree and, for links, on which productions the grammar declares.
 */
public final class ProductionRenderer {
    private ProductionRenderer() {
    }

    /**
     * Renders the given production on a single line, without a trailing line break.
     * <p>
     * The result can be parsed back into a structurally equal production.
     */
    public static String renderLinear(final Production production) {
        final var builder = new StringBuilder();
        write(production, new ProductionWriter.Plain(builder), null, false);
        return builder.toString();
    }

    /**
     * Renders the given production in the multi-line layout as plain text. Every line ends with a line break.
     */
    public static String renderText(final Production production) {
        final var builder = new StringBuilder();
        write(production, new ProductionWriter.Plain(builder), null, true);
        return builder.toString();
    }

    /**
     * Renders the production of the given nonterminal in the multi-line layout as plain text.
     *
     * @throws IllegalArgumentException if the grammar has no such production.
     */
    public static String renderText(final String productionName, final Grammar grammar) {
        return renderText(lookup(productionName, grammar));
    }

    /**
     * Renders the given production in the multi-line layout as DOM nodes, to be placed inside a {@code <pre>}.
     * <p>
     * The nodes start with an anchor whose ID is {@code bnf-} followed by the production name. Nonterminals whose
     * production is declared in the grammar link to that anchor; others are plain text.
     */
    public static List<Node> renderHyperlinked(final Production production, final Grammar grammar) {
        final var writer = new HyperlinkWriter();
        write(production, writer, grammar, true);
        return writer.nodes();
    }

    /**
     * Renders the production of the given nonterminal as DOM nodes.
     *
     * @throws IllegalArgumentException if the grammar has no such production.
     * @see #renderHyperlinked(Production, Grammar)
     */
    public static List<Node> renderHyperlinked(final String productionName, final Grammar grammar) {
        return renderHyperlinked(lookup(productionName, grammar), grammar);
    }

    /**
     * Returns the ID of the anchor {@link #renderHyperlinked(Production, Grammar)} emits for the given production.
     */
    public static String anchorId(final String productionName) {
        return HyperlinkWriter.anchorId(productionName);
    }

    private static Production lookup(final String productionName, final Grammar grammar) {
        final var production = grammar.production(productionName);
        if (production == null) {
            throw new IllegalArgumentException("No production named " + productionName);
        }
        return production;
    }

    private static void write(
        final Production production,
        final ProductionWriter writer,
        final @Nullable Grammar grammar,
        final boolean multiLine
    ) {
        final var name = production.name();
        final var expansionWriter = new ExpansionWriter(writer, grammar);
        writer.anchor(name);
        writer.text(name + productionOperator);
        if (multiLine && production.expansion() instanceof Expansion.Alternatives alternatives) {
            final var continuation = " ".repeat(name.length() + 3) + "| ";
            final var members = alternatives.members();
            members.get(0).accept(expansionWriter);
            writer.text("\n");
            for (final var member : members.subList(1, members.size())) {
                writer.text(continuation);
                member.accept(expansionWriter);
                writer.text("\n");
            }
        } else {
            production.expansion().accept(expansionWriter);
            if (multiLine) {
                writer.text("\n");
            }
        }
    }

    private static final String productionOperator = " ::= ";

    private record ExpansionWriter(ProductionWriter writer, @Nullable Grammar grammar)
        implements Expansion.Visitor<Void> {
        @Override
        public Void visitLiteral(final Expansion.Literal literal) {
            switch (literal.kind()) {
                case SYMBOL -> writer.text('\'' + literal.name() + '\'');
                case TERMINAL -> writer.terminal(literal.name(), literal.suffix());
                case NONTERMINAL -> writer.nonterminal(
                    literal.name(),
                    literal.suffix(),
                    grammar != null && grammar.hasProduction(literal.name())
                );
            }
            return null;
        }

        @Override
        public Void visitOptional(final Expansion.Optional optional) {
            writer.text("[ ");
            optional.inner().accept(this);
            writer.text(" ]");
            return null;
        }

        @Override
        public Void visitRepeated(final Expansion.Repeated repeated) {
            writer.text("{ ");
            repeated.inner().accept(this);
            writer.text(" }");
            return null;
        }

        @Override
        public Void visitSequence(final Expansion.Sequence sequence) {
            writeJoined(sequence.members(), " ");
            return null;
        }

        @Override
        public Void visitAlternatives(final Expansion.Alternatives alternatives) {
            writeJoined(alternatives.members(), " | ");
            return null;
        }

        private void writeJoined(final List<Expansion> members, final String separator) {
            var first = true;
            for (final var member : members) {
                if (!first) {
                    writer.text(separator);
                }
                first = false;
                member.accept(this);
            }
        }
    }
}
