// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.cli;

import java.io.PrintStream;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive access to the standard streams, so that multi-line reports are never interleaved.
 */
final class Streams implements AutoCloseable {
    // The corresponding unlock is in close().
    @SuppressWarnings("LockAcquiredButNotSafelyReleased")
    private Streams() {
        lock.lock();
    }

    static Streams acquire() {
        return new Streams();
    }

    @Override
    public void close() {
        lock.unlock();
    }

    @SuppressWarnings({"MethodMayBeStatic", "SameReturnValue", "UseOfSystemOutOrSystemErr"})
    PrintStream err() {
        return System.err;
    }

    private static final ReentrantLock lock = new ReentrantLock();
}
