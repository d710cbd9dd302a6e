// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Condition and restart system modelled after Common Lisp's.
 * <p>
 * The generator reports every diagnostic, fatal or not, by signaling a {@link lrmgen.util.condition.Condition}.
 * Whoever drives a run decides what happens next by installing {@link lrmgen.util.condition.Handler}s: print and
 * carry on for warnings, unwind to a {@link lrmgen.util.condition.Restart} for errors.
 */
@NonNullByDefault
package lrmgen.util.condition;

import lrmgen.util.annotation.NonNullByDefault;
