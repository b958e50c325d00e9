/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PythonLexerTest {

    private static List<TokenType> types(String source) {
        return new PythonLexer(source).tokenize().stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void indentationBlocks() {
        assertEquals(List.of(TokenType.NAME, TokenType.NAME, TokenType.OPERATOR, TokenType.NEWLINE,
                        TokenType.INDENT, TokenType.NAME, TokenType.OPERATOR, TokenType.STRING, TokenType.NEWLINE,
                        TokenType.DEDENT, TokenType.NAME, TokenType.OPERATOR, TokenType.INTEGER, TokenType.NEWLINE,
                        TokenType.END_OF_FILE),
                types("if x:\n    y = 'a'\nz = 1\n"));
    }

    @Test
    void commentsAndBlankLinesAreSkipped() {
        assertEquals(List.of(TokenType.NAME, TokenType.NEWLINE, TokenType.END_OF_FILE),
                types("# header\n\n   \nx  # trailing\n\n# end"));
    }

    @Test
    void bracketsJoinLines() {
        List<Token> tokens = new PythonLexer("f(1,\n  2.5)\n").tokenize();
        assertEquals(List.of(TokenType.NAME, TokenType.OPERATOR, TokenType.INTEGER, TokenType.OPERATOR,
                        TokenType.FLOAT, TokenType.OPERATOR, TokenType.NEWLINE, TokenType.END_OF_FILE),
                tokens.stream().map(Token::type).collect(Collectors.toList()));
        assertEquals(2, tokens.get(4).line());
    }

    @Test
    void stringPrefixesAndEscapes() {
        List<Token> tokens = new PythonLexer("a = r'\\d' + f\"{x}\" + 'it\\'s'\n\"\"\"two\nlines\"\"\"\n").tokenize();
        Token raw = tokens.get(2);
        assertEquals("\\d", raw.text());
        assertEquals("r", raw.prefix());
        assertEquals("f", tokens.get(4).prefix());
        assertEquals("it's", tokens.get(6).text());
        Token docstring = tokens.get(8);
        assertEquals("two\nlines", docstring.text());
        assertEquals(2, docstring.line());
    }

    @Test
    void numbers() {
        List<Token> tokens = new PythonLexer("0x1F 1_000 1e-3 .5 2j").tokenize();
        assertEquals(TokenType.INTEGER, tokens.get(0).type());
        assertEquals("0x1F", tokens.get(0).text());
        assertEquals(TokenType.INTEGER, tokens.get(1).type());
        assertEquals(TokenType.FLOAT, tokens.get(2).type());
        assertEquals(TokenType.FLOAT, tokens.get(3).type());
        assertEquals(TokenType.FLOAT, tokens.get(4).type());
    }

    @Test
    void errors() {
        ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class, () -> new PythonLexer("x = 'abc\n").tokenize());
        assertEquals(1, e.getLine());
        assertEquals("Unterminated string literal", e.getReason());

        e = assertThrows(ScriptSyntaxException.class, () -> new PythonLexer("if x:\n    a = 1\n  b = 2\n").tokenize());
        assertEquals(3, e.getLine());

        assertThrows(ScriptSyntaxException.class, () -> new PythonLexer("f(1, 2\n").tokenize());
        assertThrows(ScriptSyntaxException.class, () -> new PythonLexer("x = 1)\n").tokenize());
        assertThrows(ScriptSyntaxException.class, () -> new PythonLexer("x = $\n").tokenize());
    }
}
