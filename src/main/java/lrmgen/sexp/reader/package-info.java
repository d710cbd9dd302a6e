// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The S-expression reader, turning manual source bytes into {@link lrmgen.sexp.Sexp} objects.
 */
@NonNullByDefault
package lrmgen.sexp.reader;

import lrmgen.util.annotation.NonNullByDefault;
