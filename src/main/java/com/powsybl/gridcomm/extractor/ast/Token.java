/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import java.util.Objects;

/**
 * @param type   token type
 * @param text   source text of the token, or the decoded value for strings
 * @param prefix string prefix letters in lower case, empty for other tokens
 * @param line   1-based line of the first character
 * @param column 1-based column of the first character
 */
public record Token(TokenType type, String text, String prefix, int line, int column) {

    public Token {
        Objects.requireNonNull(type);
        Objects.requireNonNull(text);
        Objects.requireNonNull(prefix);
    }

    public Token(TokenType type, String text, int line, int column) {
        this(type, text, "", line, column);
    }

    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    public boolean isOperator(String operator) {
        return is(TokenType.OPERATOR, operator);
    }

    public boolean isName(String name) {
        return is(TokenType.NAME, name);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case END_OF_FILE -> "end of file";
            default -> "'" + text + "'";
        };
    }
}
