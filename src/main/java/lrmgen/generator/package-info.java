// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The generation process proper: from a manual source file to a single HTML page.
 */
@NonNullByDefault
package lrmgen.generator;

import lrmgen.util.annotation.NonNullByDefault;
