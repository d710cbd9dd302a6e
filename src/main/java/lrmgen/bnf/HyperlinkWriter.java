// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import java.util.ArrayList;
import java.util.List;
import lrmgen.dom.Attribute;
import lrmgen.dom.Node;
import lrmgen.dom.Tag;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Writes a production as DOM nodes meant to be placed inside a {@code <pre>}.
 * <p>
 * The production gets an {@code <a id="bnf-NAME">} anchor, references to declared productions become links to their
 * anchors, and suffixes are italicized. Adjacent text is merged into a single text node.
 */
final class HyperlinkWriter implements ProductionWriter {
    /**
     * Returns the ID of the anchor of the given production.
     */
    static String anchorId(final String productionName) {
        return anchorPrefix + productionName;
    }

    @Override
    public void anchor(final String productionName) {
        add(Node.empty(Tag.A, List.of(Attribute.of("id", anchorId(productionName)))));
    }

    @Override
    public void text(final String text) {
        pendingText.append(text);
    }

    @Override
    public void terminal(final String name, final @Nullable String suffix) {
        text(name);
        writeSuffix(suffix);
    }

    @Override
    public void nonterminal(final String name, final @Nullable String suffix, final boolean declared) {
        if (declared) {
            add(new Node.Element(
                Tag.A,
                List.of(Attribute.of("href", '#' + anchorId(name))),
                List.of(new Node.Text(name))
            ));
        } else {
            text(name);
        }
        writeSuffix(suffix);
    }

    /**
     * Retrieves everything written so far.
     */
    List<Node> nodes() {
        flushText();
        return List.copyOf(nodes);
    }

    private void writeSuffix(final @Nullable String suffix) {
        if (suffix != null) {
            add(Node.simple(Tag.I, '_' + suffix));
        }
    }

    private void add(final Node node) {
        flushText();
        nodes.add(node);
    }

    private void flushText() {
        if (pendingText.length() > 0) {
            nodes.add(new Node.Text(pendingText.toString()));
            pendingText.setLength(0);
        }
    }

    private static final String anchorPrefix = "bnf-";

    private final ArrayList<Node> nodes = new ArrayList<>();
    private final StringBuilder pendingText = new StringBuilder();
}
