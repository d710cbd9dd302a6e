// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Representation of S-expressions, the notation manual sources are written in, as Java objects.
 */
@NonNullByDefault
package lrmgen.sexp;

import lrmgen.util.annotation.NonNullByDefault;
