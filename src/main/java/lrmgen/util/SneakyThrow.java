// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.util;

/**
 * Facilities for bypassing the checked exception mechanism.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as if it were unchecked, whatever its actual type.
     * <p>
     * Only meant for throwables that cross layers which cannot reasonably declare them, such as
     * {@link lrmgen.util.condition.Unwind} travelling from a condition handler to its restart point.
     * <p>
     * Never returns normally; the declared return type lets call sites write {@code throw SneakyThrow.doThrow(e)} so
     * the compiler's control flow analysis knows that too.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    /**
     * Pretends to throw {@code E}, so that a sneakily thrown checked exception of that type can be caught by the
     * caller.
     */
    @SuppressWarnings({"RedundantThrows", "EmptyMethod"})
    public static <E extends Throwable> void pretendThrows() throws E {
    }

    // E is erased to Throwable, so the cast vanishes at runtime and the throwable escapes undeclared.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
