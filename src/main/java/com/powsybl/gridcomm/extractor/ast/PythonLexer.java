/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Splits Python source text into tokens, turning indentation changes into {@link TokenType#INDENT} and
 * {@link TokenType#DEDENT} tokens.
 * <p>
 * Newlines inside brackets and after a backslash continue the logical line. Blank and comment only lines produce no
 * token. Tabs advance the indentation to the next multiple of 8.
 */
public class PythonLexer {

    private static final String[] OPERATORS = {
        "**=", "//=", ">>=", "<<=", "...",
        "->", ":=", "**", "//", "==", "!=", "<=", ">=", "<<", ">>", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
        "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };

    private final String source;

    private final List<Token> tokens = new ArrayList<>();

    private final Deque<Integer> indents = new ArrayDeque<>();

    private int pos = 0;

    private int line = 1;

    private int lineStart = 0;

    private int bracketDepth = 0;

    public PythonLexer(String source) {
        this.source = Objects.requireNonNull(source).replace("\r\n", "\n").replace('\r', '\n');
    }

    public List<Token> tokenize() {
        indents.push(0);
        boolean atLineStart = true;
        while (pos < source.length()) {
            if (atLineStart && bracketDepth == 0) {
                if (readIndentation()) {
                    continue;
                }
                atLineStart = false;
            }
            char c = source.charAt(pos);
            if (c == '\n') {
                if (bracketDepth == 0) {
                    addNewlineToken();
                    atLineStart = true;
                }
                newLine();
            } else if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\' && peek(1) == '\n') {
                pos++;
                newLine();
            } else if (isStringStart()) {
                readString();
            } else if (Character.isDigit(c) || c == '.' && Character.isDigit(peek(1))) {
                readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                readName();
            } else {
                readOperator();
            }
        }
        if (bracketDepth > 0) {
            throw error("Unexpected end of file inside brackets");
        }
        addNewlineToken();
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", line, 1));
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", line, 1));
        return tokens;
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private int column() {
        return pos - lineStart + 1;
    }

    private void newLine() {
        pos++;
        line++;
        lineStart = pos;
    }

    private ScriptSyntaxException error(String message) {
        return new ScriptSyntaxException(message, line, column());
    }

    private void addNewlineToken() {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE
                && tokens.get(tokens.size() - 1).type() != TokenType.INDENT
                && tokens.get(tokens.size() - 1).type() != TokenType.DEDENT) {
            tokens.add(new Token(TokenType.NEWLINE, "", line, column()));
        }
    }

    private void skipComment() {
        while (pos < source.length() && source.charAt(pos) != '\n') {
            pos++;
        }
    }

    /**
     * Measures the indentation of a new line and emits indent or dedent tokens.
     *
     * @return true when the line is blank or holds a comment only
     */
    private boolean readIndentation() {
        int width = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else if (c != '\f') {
                break;
            }
            pos++;
        }
        if (pos >= source.length()) {
            return true;
        }
        char c = source.charAt(pos);
        if (c == '\n') {
            newLine();
            return true;
        }
        if (c == '#') {
            skipComment();
            if (pos < source.length()) {
                newLine();
            }
            return true;
        }
        if (c == '\\' && peek(1) == '\n') {
            return false;
        }
        if (width > indents.peek()) {
            indents.push(width);
            tokens.add(new Token(TokenType.INDENT, "", line, column()));
        } else {
            while (width < indents.peek()) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, "", line, column()));
            }
            if (width != indents.peek()) {
                throw error("Unindent does not match any outer indentation level");
            }
        }
        return false;
    }

    private boolean isStringStart() {
        int i = pos;
        while (i < source.length() && i - pos < 2 && "rRbBuUfF".indexOf(source.charAt(i)) >= 0) {
            i++;
        }
        return i < source.length() && (source.charAt(i) == '\'' || source.charAt(i) == '"');
    }

    private void readString() {
        int startLine = line;
        int startColumn = column();
        StringBuilder prefixBuilder = new StringBuilder();
        while (source.charAt(pos) != '\'' && source.charAt(pos) != '"') {
            prefixBuilder.append(source.charAt(pos++));
        }
        String prefix = prefixBuilder.toString().toLowerCase(Locale.ROOT);
        boolean raw = prefix.contains("r");
        char quote = source.charAt(pos);
        boolean triple = peek(1) == quote && peek(2) == quote;
        pos += triple ? 3 : 1;

        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= source.length()) {
                throw new ScriptSyntaxException("Unterminated string literal", startLine, startColumn);
            }
            char c = source.charAt(pos);
            if (c == quote && (!triple || peek(1) == quote && peek(2) == quote)) {
                pos += triple ? 3 : 1;
                break;
            }
            if (c == '\n') {
                if (!triple) {
                    throw new ScriptSyntaxException("Unterminated string literal", startLine, startColumn);
                }
                value.append('\n');
                newLine();
            } else if (c == '\\' && pos + 1 < source.length()) {
                char next = source.charAt(pos + 1);
                if (raw) {
                    value.append(c).append(next);
                } else {
                    appendEscape(value, next);
                }
                pos += 2;
                if (next == '\n') {
                    line++;
                    lineStart = pos;
                }
            } else {
                value.append(c);
                pos++;
            }
        }
        tokens.add(new Token(TokenType.STRING, value.toString(), prefix, startLine, startColumn));
    }

    private static void appendEscape(StringBuilder value, char next) {
        switch (next) {
            case 'n' -> value.append('\n');
            case 't' -> value.append('\t');
            case 'r' -> value.append('\r');
            case '0' -> value.append('\0');
            case '\\', '\'', '"' -> value.append(next);
            case '\n' -> {
                // line continuation inside a string
            }
            default -> value.append('\\').append(next);
        }
    }

    private void readNumber() {
        int start = pos;
        int startColumn = column();
        boolean isFloat = false;
        if (source.charAt(pos) == '0' && "xXoObB".indexOf(peek(1)) >= 0) {
            pos += 2;
            while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (Character.isDigit(c) || c == '_') {
                    pos++;
                } else if (c == '.' && !isFloat) {
                    isFloat = true;
                    pos++;
                } else if ((c == 'e' || c == 'E') && (Character.isDigit(peek(1))
                        || (peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2)))) {
                    isFloat = true;
                    pos += 2;
                } else if (c == 'j' || c == 'J') {
                    isFloat = true;
                    pos++;
                    break;
                } else {
                    break;
                }
            }
        }
        tokens.add(new Token(isFloat ? TokenType.FLOAT : TokenType.INTEGER, source.substring(start, pos), line, startColumn));
    }

    private void readName() {
        int start = pos;
        int startColumn = column();
        while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        tokens.add(new Token(TokenType.NAME, source.substring(start, pos), line, startColumn));
    }

    private void readOperator() {
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, pos)) {
                switch (operator) {
                    case "(", "[", "{" -> bracketDepth++;
                    case ")", "]", "}" -> {
                        if (bracketDepth == 0) {
                            throw error("Unmatched '" + operator + "'");
                        }
                        bracketDepth--;
                    }
                    default -> {
                        // not a bracket
                    }
                }
                tokens.add(new Token(TokenType.OPERATOR, operator, line, column()));
                pos += operator.length();
                return;
            }
        }
        throw error("Invalid character '" + source.charAt(pos) + "'");
    }
}
