// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The grammar notation front end: lexing, parsing, checking and rendering of the simplified EBNF embedded in manual
 * sources.
 * <p>
 * A run goes through three phases sharing one {@link lrmgen.bnf.Grammar}: every bundle is parsed into it, the grammar
 * is sealed, and only then is it checked by the {@link lrmgen.bnf.Checker} and rendered by the
 * {@link lrmgen.bnf.ProductionRenderer}.
 */
@NonNullByDefault
package lrmgen.bnf;

import lrmgen.util.annotation.NonNullByDefault;
