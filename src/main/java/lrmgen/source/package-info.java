// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Positions in manual sources and the conditions that point at them.
 */
@NonNullByDefault
package lrmgen.source;

import lrmgen.util.annotation.NonNullByDefault;
