// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A minimal immutable HTML DOM: just enough to describe a manual page, verify that it is well-formed, and serialize it.
 */
@NonNullByDefault
package lrmgen.dom;

import lrmgen.util.annotation.NonNullByDefault;
