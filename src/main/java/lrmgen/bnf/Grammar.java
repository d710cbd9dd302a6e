// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lrmgen.source.SourceLocation;
import lrmgen.util.condition.ConditionContext;
import lrmgen.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The symbol table shared by every grammar bundle of a manual: known terminals, declared productions, and the
 * productions declared by each bundle.
 * <p>
 * A grammar is created empty at the start of a run and filled while terminals are registered and bundles are parsed.
 * It is then {@link #seal() sealed}; from that point on it is read-only, and only then may it be checked and rendered.
 * Attempting to modify a sealed grammar is a programming error and throws {@link IllegalStateException}.
 * <p>
 * Declaration errors are signaled as fatal {@link DeclarationErrorCondition}s.
 */
public final class Grammar {
    /**
     * Registers an explicitly declared terminal, such as a keyword.
     */
    public void registerTerminal(final String name, final SourceLocation location) {
        checkNotSealed();
        if (!terminals.add(name)) {
            throw signalError("duplicate definition of terminal '" + name + '\'', location);
        }
    }

    /**
     * Registers every back-quoted run in the given description text as a terminal.
     * <p>
     * For example, {@code "`(` and `)` enclose arguments"} registers {@code (} and {@code )}. Registering a terminal
     * that is already known is an error, and so is an empty run ({@code ``}).
     */
    public void registerBacktickTerminals(final String text, final SourceLocation location) {
        checkNotSealed();
        final var matcher = backtickRun.matcher(text);
        while (matcher.find()) {
            final var terminal = matcher.group(1);
            if (terminal.isEmpty()) {
                throw signalError("empty terminal is not permitted", location);
            }
            registerTerminal(terminal, location);
        }
    }

    /**
     * Marks the end of the declaration phase. Afterwards this grammar is read-only.
     */
    public void seal() {
        sealed = true;
    }

    /**
     * Returns {@code true} iff {@link #seal()} has been called.
     */
    public boolean isSealed() {
        return sealed;
    }

    /**
     * Returns {@code true} iff a terminal with the given name has been registered.
     */
    public boolean hasTerminal(final String name) {
        return terminals.contains(name);
    }

    /**
     * Returns {@code true} iff a production of the given nonterminal has been declared.
     */
    public boolean hasProduction(final String name) {
        return productions.containsKey(name);
    }

    /**
     * Retrieves the production of the given nonterminal, or {@code null} if there's none.
     */
    public @Nullable Production production(final String name) {
        return productions.get(name);
    }

    /**
     * Retrieves all registered terminals, in registration order.
     */
    public Set<String> terminals() {
        return Collections.unmodifiableSet(terminals);
    }

    /**
     * Retrieves all declared productions, in declaration order.
     */
    public Collection<Production> productions() {
        return Collections.unmodifiableCollection(productions.values());
    }

    /**
     * Retrieves the names of the productions declared by the given bundle, in declaration order, or {@code null} if
     * no such bundle has been parsed.
     */
    public @Nullable List<String> bundle(final String bundleName) {
        return bundles.get(bundleName);
    }

    /**
     * Retrieves the names of all parsed bundles, in parsing order.
     */
    public Set<String> bundleNames() {
        return Collections.unmodifiableSet(bundles.keySet());
    }

    void defineProduction(final Production production) {
        checkNotSealed();
        if (productions.putIfAbsent(production.name(), production) != null) {
            throw new IllegalStateException("Production " + production.name() + " defined twice");
        }
    }

    void defineBundle(final String bundleName, final List<String> productionNames, final SourceLocation location) {
        checkNotSealed();
        if (bundles.containsKey(bundleName)) {
            throw signalError("duplicate definition of grammar bundle '" + bundleName + '\'', location);
        }
        bundles.put(bundleName, List.copyOf(productionNames));
    }

    static UnhandledErrorError signalError(final String message, final SourceLocation location) {
        throw ConditionContext.error(new DeclarationErrorCondition(message, location));
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new IllegalStateException("The grammar is sealed, declarations are no longer accepted");
        }
    }

    private static final Pattern backtickRun = Pattern.compile("`([^`]*)`");

    private final LinkedHashSet<String> terminals = new LinkedHashSet<>();
    private final LinkedHashMap<String, Production> productions = new LinkedHashMap<>();
    private final Map<String, List<String>> bundles = new LinkedHashMap<>();
    private boolean sealed = false;
}
