// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The document model of a language reference manual, and the parser building it from S-expressions.
 */
@NonNullByDefault
package lrmgen.document;

import lrmgen.util.annotation.NonNullByDefault;
