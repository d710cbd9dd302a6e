// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.dom;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * HTML elements known to the generator.
 * <p>
 * Only the elements a manual page needs are here. {@code <meta>} is split into pseudo-elements.
 */
public enum Tag {
    HTML(build(Context.ROOT, Context.HEAD_AND_BODY)
        .setAllowedAttributes(Map.of("lang", Verifier.attributeIsNonEmpty))
    ),
    HEAD(build(Context.HEAD_AND_BODY, Context.METADATA)),
    /**
     * A pseudo-element representing the UTF-8 encoding declaration, that is {@code <meta charset="UTF-8">}.
     */
    META_CHARSET_UTF8(build(Context.METADATA, ChildContext.none())
        .setOmitClosingTag()
        .setElementSerializer((final Serializer serializer, final Node.Element element) ->
            serializer.serializePseudoElement(
                "meta",
                List.of(Attribute.of("charset", "UTF-8")),
                element.children(),
                true
            ))
    ),
    /**
     * A pseudo-element representing {@code <meta name="…" content="…">}.
     */
    META_NAMED(build(Context.METADATA, ChildContext.none())
        .setOmitClosingTag()
        .setAllowedAttributes(Map.of(
            "name", new StringSetVerifier(Set.of("generator", "viewport")),
            "content", Verifier.attributeIsNonEmpty
        ))
        .setRequiredAttributes(List.of("name", "content"))
        .setElementSerializer((final Serializer serializer, final Node.Element element) ->
            serializer.serializePseudoElement("meta", element.attributes(), element.children(), true))
    ),
    TITLE(build(Context.METADATA, Context.TEXT_ONLY)),
    STYLE(build(Context.METADATA, Context.TEXT_ONLY)),
    BODY(build(Context.HEAD_AND_BODY, Context.FLOW)),
    HEADER(build(Context.FLOW, Context.FLOW)),
    FOOTER(build(Context.FLOW, Context.FLOW)),
    H1(build(Context.FLOW, Context.PHRASING)),
    H2(build(Context.FLOW, Context.PHRASING)),
    H3(build(Context.FLOW, Context.PHRASING)),
    H4(build(Context.FLOW, Context.PHRASING)),
    H5(build(Context.FLOW, Context.PHRASING)),
    H6(build(Context.FLOW, Context.PHRASING)),
    DIV(build(Context.FLOW, ChildContext.transparent())),
    P(build(Context.FLOW, Context.PHRASING)),
    PRE(build(Context.FLOW, Context.PHRASING)),
    UL(build(Context.FLOW, Context.LIST_ELEMENT)),
    LI(build(Context.LIST_ELEMENT, Context.FLOW)),
    A(build(EnumSet.of(Context.FLOW, Context.PHRASING), ChildContext.transparent())
        .setAllowedAttributes(Map.of("href", new HrefVerifier()))
    ),
    I(build(EnumSet.of(Context.FLOW, Context.PHRASING), Context.PHRASING)),
    CODE(build(EnumSet.of(Context.FLOW, Context.PHRASING), Context.PHRASING));

    Tag(final Builder builder) {
        htmlName = name().toLowerCase(Locale.ROOT).replace('_', '-');
        allowedContexts = builder.allowedContexts;
        childContext = builder.childContext;
        omitClosingTag = builder.omitClosingTag;
        elementSerializer = builder.elementSerializer;
        allowedAttributes = builder.allowedAttributes;
        requiredAttributes = builder.requiredAttributes;
    }

    /**
     * Retrieves the tag with the given HTML name, or {@code null} if one doesn't exist.
     * <p>
     * The HTML name of a tag is a lowercase string, with words separated with the ASCII dash symbol "-".
     */
    public static @Nullable Tag byHtmlName(final String htmlName) {
        return tagsByHtmlName.get(htmlName);
    }

    /**
     * Retrieves the HTML name of the tag.
     */
    public String htmlName() {
        return htmlName;
    }

    /**
     * Returns the heading tag of the given level, clamped to the range {@code h1}..{@code h6}.
     */
    public static Tag heading(final int level) {
        return headings[Math.max(0, Math.min(level, headings.length) - 1)];
    }

    boolean allowedIn(final Context context) {
        return allowedContexts.contains(context);
    }

    String allowedContextsString() {
        return allowedContexts.toString();
    }

    ChildContext childContext() {
        return childContext;
    }

    boolean omitClosingTag() {
        return omitClosingTag;
    }

    Serializer.@Nullable ForElement elementSerializer() {
        return elementSerializer;
    }

    Map<String, Verifier.AttributeVerifier> allowedAttributes() {
        return allowedAttributes;
    }

    List<String> requiredAttributes() {
        return requiredAttributes;
    }

    private static Builder build(
        final Context allowedContext,
        final ChildContext childContext
    ) {
        return new Builder(EnumSet.of(allowedContext), childContext);
    }

    private static Builder build(
        final EnumSet<Context> allowedContexts,
        final ChildContext childContext
    ) {
        return new Builder(allowedContexts, childContext);
    }

    private static final Map<String, Tag> tagsByHtmlName =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(Tag::htmlName, Function.identity()));
    private static final Tag[] headings = {H1, H2, H3, H4, H5, H6};

    private final String htmlName;
    private final EnumSet<Context> allowedContexts;
    private final ChildContext childContext;
    private final boolean omitClosingTag;
    private final Serializer.@Nullable ForElement elementSerializer;
    private final Map<String, Verifier.AttributeVerifier> allowedAttributes;
    private final List<String> requiredAttributes;

    private record StringSetVerifier(Set<String> allowed) implements Verifier.AttributeVerifier {
        @Override
        public void verify(final Verifier.AttributeVerificationContext context) {
            if (!allowed.contains(context.attribute().value())) {
                context.recordError("invalid value, expected one of " + allowed);
            }
        }
    }

    private static final class HrefVerifier implements Verifier.AttributeVerifier {
        @Override
        public void verify(final Verifier.AttributeVerificationContext context) {
            final var value = context.attribute().value();
            if (value.startsWith("#")) {
                context.recordFragmentLink(value.substring(1));
            } else if (!absoluteUriPattern.matcher(value).matches()) {
                context.recordError("invalid link '" + value + "', expected a fragment or an absolute URI");
            }
        }

        private static final Pattern absoluteUriPattern = Pattern.compile("https?://\\S+");
    }

    private static final class Builder {
        private Builder(final EnumSet<Context> allowedContexts, final ChildContext childContext) {
            this.allowedContexts = allowedContexts;
            this.childContext = childContext;
        }

        private Builder setOmitClosingTag() {
            omitClosingTag = true;
            return this;
        }

        private Builder setElementSerializer(final Serializer.ForElement elementSerializer) {
            this.elementSerializer = elementSerializer;
            return this;
        }

        private Builder setAllowedAttributes(final Map<String, Verifier.AttributeVerifier> allowedAttributes) {
            this.allowedAttributes = allowedAttributes;
            return this;
        }

        private Builder setRequiredAttributes(final List<String> requiredAttributes) {
            this.requiredAttributes = requiredAttributes;
            return this;
        }

        private final EnumSet<Context> allowedContexts;
        private final ChildContext childContext;
        private boolean omitClosingTag = false;
        private Serializer.@Nullable ForElement elementSerializer = null;
        private Map<String, Verifier.AttributeVerifier> allowedAttributes = Collections.emptyMap();
        private List<String> requiredAttributes = List.of();
    }
}
