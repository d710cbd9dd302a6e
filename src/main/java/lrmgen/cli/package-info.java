// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The command line interface.
 */
@NonNullByDefault
package lrmgen.cli;

import lrmgen.util.annotation.NonNullByDefault;
