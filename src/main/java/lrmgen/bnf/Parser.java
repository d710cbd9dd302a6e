// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import lrmgen.source.SourceLocation;
import lrmgen.util.Trace;
import lrmgen.util.condition.ConditionContext;
import lrmgen.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The grammar notation parser: the primary means of turning grammar bundles into {@link Production}s.
 * <p>
 * The notation, in itself:
 * <pre>
 * production ::= NONTERMINAL '::=' expansion
 * expansion  ::= sequence { '|' sequence }
 * sequence   ::= fragment { fragment }
 * fragment   ::= '{' expansion '}'
 *              | '[' expansion ']'
 *              | TERMINAL | NONTERMINAL | SYMBOL
 * </pre>
 * Productions are separated by blank lines. The parser is LL(1): it never looks further than the next token.
 */
public final class Parser {
    /**
     * Initializes a new parser registering everything it parses into the given grammar.
     */
    public Parser(final Grammar grammar) {
        this.grammar = grammar;
    }

    /**
     * Parses the given grammar bundle.
     *
     * @see #parse(String, String, SourceLocation)
     */
    public List<String> parse(final GrammarDeclaration declaration) {
        return parse(declaration.name(), declaration.rawText(), declaration.location());
    }

    /**
     * Parses a grammar bundle, registering its productions and the bundle itself in the grammar.
     * <p>
     * {@code rawText} has to be the unprocessed source text of the grammar field, enclosed in {@code '''}.
     * <p>
     * On error, a fatal condition is signaled:
     * <ul>
     * <li>{@link LexicalErrorCondition} if the text cannot be tokenized.
     * <li>{@link SyntaxErrorCondition} if the text isn't enclosed in {@code '''} or doesn't follow the notation.
     * <li>{@link DeclarationErrorCondition} if a production or the bundle itself is declared twice.
     * </ul>
     *
     * @return The names of the productions declared by the bundle, in declaration order.
     */
    public List<String> parse(final String bundleName, final String rawText, final SourceLocation location) {
        try (final var trace = new Trace(() -> "Parsing grammar bundle " + bundleName)) {
            trace.use();
            if (rawText.length() < 2 * delimiter.length()
                || !rawText.startsWith(delimiter)
                || !rawText.endsWith(delimiter)) {
                throw signalError("grammar text must use triple-quoted strings", location);
            }
            final var fragment = rawText.substring(delimiter.length(), rawText.length() - delimiter.length());
            lexer = new Lexer(fragment, location);
            currentBundle = bundleName;
            currentToken = null;
            nextToken = lexer.nextToken();

            final var productionNames = new ArrayList<String>();
            while (nextToken != null) {
                if (peek(TokenKind.RULE_END)) {
                    // Only an empty bundle starts with the end of a rule.
                    advance();
                    continue;
                }
                productionNames.add(parseProduction());
                match(TokenKind.RULE_END);
            }
            grammar.defineBundle(bundleName, productionNames, location);
            return List.copyOf(productionNames);
        } finally {
            lexer = null;
            currentBundle = null;
            currentToken = null;
            nextToken = null;
        }
    }

    private String parseProduction() {
        final var nameToken = match(TokenKind.NONTERMINAL);
        final var name = valueOf(nameToken);
        try (final var trace = new Trace(() -> "Parsing production " + name)) {
            trace.use();
            if (grammar.hasProduction(name)) {
                throw Grammar.signalError(
                    "duplicate definition of production '" + name + "', already declared in grammar '"
                        + declaringBundle(name) + '\'',
                    nameToken.location()
                );
            }
            match(TokenKind.PRODUCTION);
            grammar.defineProduction(new Production(name, parseExpansion(), nameToken.location()));
            return name;
        }
    }

    // Productions of the bundle being parsed are only registered as a bundle once it is complete.
    private String declaringBundle(final String productionName) {
        for (final var bundleName : grammar.bundleNames()) {
            final var names = grammar.bundle(bundleName);
            if (names != null && names.contains(productionName)) {
                return bundleName;
            }
        }
        assert currentBundle != null;
        return currentBundle;
    }

    private Expansion parseExpansion() {
        final var alternatives = new ArrayList<Expansion>();
        alternatives.add(parseSequence());
        while (peek(TokenKind.ALTERNATIVE)) {
            match(TokenKind.ALTERNATIVE);
            alternatives.add(parseSequence());
        }
        return (alternatives.size() == 1) ? alternatives.get(0) : new Expansion.Alternatives(alternatives);
    }

    private Expansion parseSequence() {
        final var members = new ArrayList<Expansion>();
        members.add(parseFragment());
        while (nextToken != null && fragmentStarts.contains(nextToken.kind())) {
            members.add(parseFragment());
        }
        return (members.size() == 1) ? members.get(0) : new Expansion.Sequence(members);
    }

    private Expansion parseFragment() {
        final var token = nextToken;
        if (token == null) {
            throw signalError("expected grammar fragment, encountered end of input instead", currentLocation());
        }
        final var location = token.location();
        return switch (token.kind()) {
            case OPEN_REPEAT -> {
                advance();
                final var inner = parseExpansion();
                match(TokenKind.CLOSE_REPEAT);
                yield new Expansion.Repeated(inner, location);
            }
            case OPEN_OPTIONAL -> {
                advance();
                final var inner = parseExpansion();
                match(TokenKind.CLOSE_OPTIONAL);
                yield new Expansion.Optional(inner, location);
            }
            case TERMINAL -> {
                advance();
                yield new Expansion.Literal(Expansion.LiteralKind.TERMINAL, valueOf(token), token.suffix(), location);
            }
            case NONTERMINAL -> {
                advance();
                yield new Expansion.Literal(Expansion.LiteralKind.NONTERMINAL, valueOf(token), token.suffix(),
                    location);
            }
            case SYMBOL -> {
                advance();
                yield new Expansion.Literal(Expansion.LiteralKind.SYMBOL, valueOf(token), null, location);
            }
            default -> throw signalError(
                "expected grammar fragment, encountered " + token.kind() + " instead", location);
        };
    }

    private boolean peek(final TokenKind kind) {
        return nextToken != null && nextToken.kind() == kind;
    }

    private Token match(final TokenKind kind) {
        final var token = nextToken;
        if (token == null) {
            throw signalError("expected " + kind + ", encountered end of input instead", currentLocation());
        }
        if (token.kind() != kind) {
            throw signalError("expected " + kind + ", encountered " + token.kind() + " instead", token.location());
        }
        advance();
        return token;
    }

    private void advance() {
        final var activeLexer = lexer;
        assert activeLexer != null : "advance called outside of parse";
        currentToken = nextToken;
        nextToken = activeLexer.nextToken();
    }

    private SourceLocation currentLocation() {
        final var token = currentToken;
        assert token != null : "The lexer produced no tokens at all";
        return token.location();
    }

    private static String valueOf(final Token token) {
        final var value = token.value();
        assert value != null : "Names and symbols always carry a value";
        return value;
    }

    private static UnhandledErrorError signalError(final String message, final SourceLocation location) {
        throw ConditionContext.error(new SyntaxErrorCondition(message, location));
    }

    private static final String delimiter = "'''";
    private static final EnumSet<TokenKind> fragmentStarts = EnumSet.of(
        TokenKind.OPEN_REPEAT,
        TokenKind.OPEN_OPTIONAL,
        TokenKind.TERMINAL,
        TokenKind.NONTERMINAL,
        TokenKind.SYMBOL
    );

    private final Grammar grammar;
    private @Nullable Lexer lexer = null;
    private @Nullable String currentBundle = null;
    private @Nullable Token currentToken = null;
    private @Nullable Token nextToken = null;
}
