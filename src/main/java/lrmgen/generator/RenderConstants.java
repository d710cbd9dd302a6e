// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.generator;

// Assorted constants of the rendered page.
final class RenderConstants {
    private RenderConstants() {
    }

    static final String generatorName = "lrmgen";
    static final String documentLanguage = "en";
    static final String viewport = "width=device-width, initial-scale=1.0";
    static final String codeBlockClass = "code";
    static final String licenseClass = "license";
    static final String stylesheet = String.join("\n",
        "body { font-family: sans-serif; }",
        "footer { color: #16588e; }",
        "h1, h2, h3, h4, h5, h6 { color: #16588e; }",
        "div { margin-top: 0.2em; }",
        "div.code { margin-top: 1.5em; margin-bottom: 1.5em; border-radius: 1em; padding: 1em; "
            + "background-color: #e6e6e6; }",
        "div.license { font-size: smaller; }",
        "a { color: #0166b1; }",
        "pre a { text-decoration: none; }",
        "pre a:hover { text-decoration: underline; }"
    );
}
