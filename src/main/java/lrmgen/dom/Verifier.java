// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.dom;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import lrmgen.util.UnreachableCodeReachedError;
import lrmgen.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The DOM verifier.
 * <p>
 * This class implements a best-effort verification of the DOM tree, to ensure that the document can be serialized into
 * valid HTML: elements appear only where they're allowed, attributes are known and well-formed, IDs are unique, and
 * every in-page link points to an existing ID.
 */
public final class Verifier {
    private Verifier() {
    }

    /**
     * Verifies the DOM tree rooted at {@code rootNode}.
     * <p>
     * If the DOM tree is valid, this method simply returns. Otherwise, if any verification errors have been found,
     * a fatal condition of type {@link VerificationErrorCondition} is signaled.
     */
    public static void verify(final Node rootNode) {
        final var verifier = new Verifier();
        verifier.verifyRoot(rootNode);
    }

    private void verifyRoot(final Node rootNode) {
        verify(rootNode, Context.ROOT);
        for (final var target : linkTargets) {
            if (!foundIds.contains(target)) {
                recordError("Link to '#" + target + "' points to no element");
            }
        }
        if (!verificationErrors.isEmpty()) {
            throw ConditionContext.error(new VerificationErrorCondition(verificationErrors));
        }
    }

    private void verify(final Node node, final Context context) {
        if (node instanceof Node.Text) {
            verifyTextNode(context);
        } else if (node instanceof Node.Element element) {
            verifyElement(element, context);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void verifyTextNode(final Context context) {
        if (!rawTextContexts.contains(context)) {
            recordNestingError(null, context, rawTextContexts.toString());
        }
    }

    private void verifyElement(final Node.Element element, final Context context) {
        final var tag = element.tag();
        verifyTagContext(tag, context);
        verifyAttributes(element);
        verifyChildren(element, getEffectiveChildContext(tag, context));
    }

    private void verifyAttributes(final Node.Element element) {
        final var tag = element.tag();
        final var seenNames = new HashSet<String>();
        for (final var attribute : element.attributes()) {
            if (!seenNames.add(attribute.name())) {
                recordAttributeError(tag, attribute.name(), "attribute specified more than once");
                continue;
            }
            final var verifier = findAttributeVerifier(attribute, tag);
            if (verifier != null) {
                verifier.verify(new AttributeVerificationContext(this, tag, attribute));
            } else {
                recordAttributeError(tag, attribute.name(), "not a valid attribute for this element");
            }
        }

        for (final var attributeName : tag.requiredAttributes()) {
            if (element.attribute(attributeName) == null) {
                recordAttributeError(tag, attributeName, "required attribute not found");
            }
        }

        final var id = element.attribute("id");
        if (id != null && !foundIds.add(id.value())) {
            recordAttributeError(tag, "id", "duplicate ID found: '" + id.value() + '\'');
        }
    }

    private static @Nullable AttributeVerifier findAttributeVerifier(final Attribute attribute, final Tag tag) {
        final var name = attribute.name();
        final var globalVerifier = globalAttributeTypes.get(name);
        if (globalVerifier != null) {
            return globalVerifier;
        }
        return tag.allowedAttributes().get(name);
    }

    private void verifyChildren(final Node.Element element, final @Nullable Context childContext) {
        if (childContext == null) {
            if (!element.children().isEmpty()) {
                final var tagName = element.tag().htmlName();
                recordError("Empty element '" + tagName + "' has children");
            }
        } else {
            ancestors.add(element.tag());
            try {
                for (final var child : element.children()) {
                    verify(child, childContext);
                }
            } finally {
                ancestors.remove(ancestors.size() - 1);
            }
        }
    }

    private void verifyTagContext(final Tag tag, final Context context) {
        if (!tag.allowedIn(context)) {
            recordNestingError(tag, context, tag.allowedContextsString());
        }
    }

    private void recordAttributeError(final Tag tag, final String attributeName, final String message) {
        recordError("Attribute '" + attributeName + "' of element '" + tag.htmlName() + "': " + message);
    }

    private void recordNestingError(
        final @Nullable Tag tag,
        final Context actualContext,
        final String allowedContexts
    ) {
        final var tagName = (tag == null)
            ? "A text node"
            : "A '" + tag.htmlName() + "' element";
        final var message =
            tagName + " found in context " + actualContext + ", but is allowed only in contexts " + allowedContexts;
        recordError(message);
    }

    private void recordError(final String message) {
        verificationErrors.add(new VerificationError(message, List.copyOf(ancestors)));
    }

    private static @Nullable Context getEffectiveChildContext(final Tag tag, final Context context) {
        final var childContext = tag.childContext();
        if (childContext instanceof Context c) {
            return c;
        } else if (childContext instanceof ChildContext.None) {
            return null;
        } else if (childContext instanceof ChildContext.Transparent) {
            return context;
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    static final AttributeVerifier attributeIsNonEmpty = context -> {
        if (context.attribute().value().isEmpty()) {
            context.recordError("empty value");
        }
    };

    private static final Map<String, AttributeVerifier> globalAttributeTypes = Map.of(
        "class", attributeIsNonEmpty,
        "id", attributeIsNonEmpty
    );
    private static final EnumSet<Context> rawTextContexts =
        EnumSet.of(Context.FLOW, Context.PHRASING, Context.TEXT_ONLY);

    private final ArrayList<VerificationError> verificationErrors = new ArrayList<>();
    private final ArrayList<Tag> ancestors = new ArrayList<>();
    private final HashSet<String> foundIds = new HashSet<>();
    private final LinkedHashSet<String> linkTargets = new LinkedHashSet<>();

    @FunctionalInterface
    interface AttributeVerifier {
        void verify(AttributeVerificationContext context);
    }

    record AttributeVerificationContext(Verifier verifier, Tag tag, Attribute attribute) {
        void recordError(final String message) {
            verifier.recordAttributeError(tag, attribute.name(), message);
        }

        void recordFragmentLink(final String target) {
            verifier.linkTargets.add(target);
        }
    }
}
