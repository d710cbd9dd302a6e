// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.cli;

import java.nio.file.Path;
import lrmgen.generator.Generator;
import lrmgen.util.condition.ConditionContext;
import lrmgen.util.condition.Handler;

/**
 * {@code lrmgen <source file> <destination file>}: generates the HTML page of a language reference manual.
 * <p>
 * Exits with 0 on success, even if warnings were reported; 1 if a fatal condition stopped generation; 64 on wrong
 * usage.
 */
final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        if (args.length != 2) {
            try (final var streams = Streams.acquire()) {
                streams.err().println("Exactly two arguments <source file> <destination file> expected");
                return ExitCode.USAGE;
            }
        }
        final var sourcePath = Path.of(args[0]);
        final var destinationPath = Path.of(args[1]);

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                new Generator(sourcePath, destinationPath).generate();
                return ExitCode.SUCCESS;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
