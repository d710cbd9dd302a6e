// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.sexp.reader;

enum HitEof {
    NO,
    YES;

    boolean hitEof() {
        return this == YES;
    }
}
