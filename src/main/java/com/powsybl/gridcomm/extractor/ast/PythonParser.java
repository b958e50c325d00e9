/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import com.powsybl.gridcomm.extractor.ast.Expression.*;
import com.powsybl.gridcomm.extractor.ast.Statement.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive descent parser for the Python subset simulation scripts are written in: imports, function and class
 * definitions, control flow statements, assignments and the full expression grammar except assignment expressions in
 * comprehensions and pattern matching.
 */
public class PythonParser {

    private static final Set<String> KEYWORDS = Set.of("False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if",
            "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with",
            "yield");

    private static final Set<String> AUGMENTED_OPERATORS = Set.of("+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=",
            "<<=", "&=", "|=", "^=", "@=");

    private static final Set<String> COMPARISON_OPERATORS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private static final Set<String> EXPRESSION_END_OPERATORS = Set.of(")", "]", "}", "=", ":", ";");

    private final List<Token> tokens;

    private int pos = 0;

    public PythonParser(String source) {
        this.tokens = new PythonLexer(Objects.requireNonNull(source)).tokenize();
    }

    public static List<Statement> parse(String source) {
        return new PythonParser(source).parseModule();
    }

    public List<Statement> parseModule() {
        List<Statement> body = new ArrayList<>();
        while (!check(TokenType.END_OF_FILE)) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            if (check(TokenType.INDENT)) {
                throw error("Unexpected indent");
            }
            parseStatement(body);
        }
        return body;
    }

    // token helpers

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (token.type() != TokenType.END_OF_FILE) {
            pos++;
        }
        return token;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkOperator(String operator) {
        return peek().isOperator(operator);
    }

    private boolean checkKeyword(String keyword) {
        return peek().isName(keyword);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchOperator(String operator) {
        if (checkOperator(operator)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String description) {
        if (!check(type)) {
            throw error("Expected " + description + " but found " + peek());
        }
        return advance();
    }

    private void expectOperator(String operator) {
        if (!matchOperator(operator)) {
            throw error("Expected '" + operator + "' but found " + peek());
        }
    }

    private void expectKeyword(String keyword) {
        if (!matchKeyword(keyword)) {
            throw error("Expected '" + keyword + "' but found " + peek());
        }
    }

    private String expectIdentifier() {
        Token token = expect(TokenType.NAME, "a name");
        if (KEYWORDS.contains(token.text())) {
            throw new ScriptSyntaxException("Unexpected keyword '" + token.text() + "'", token.line(), token.column());
        }
        return token.text();
    }

    private ScriptSyntaxException error(String message) {
        Token token = peek();
        return new ScriptSyntaxException(message, token.line(), token.column());
    }

    // statements

    private void parseStatement(List<Statement> out) {
        Token token = peek();
        if (token.type() == TokenType.OPERATOR && token.text().equals("@")) {
            parseDecorated(out);
        } else if (token.type() == TokenType.NAME) {
            switch (token.text()) {
                case "def" -> out.add(parseFunctionDefinition());
                case "class" -> out.add(parseClassDefinition());
                case "if" -> out.add(parseIf());
                case "for" -> out.add(parseFor());
                case "while" -> out.add(parseWhile());
                case "try" -> out.add(parseTry());
                case "with" -> out.add(parseWith());
                case "async" -> {
                    advance();
                    if (!checkKeyword("def") && !checkKeyword("for") && !checkKeyword("with")) {
                        throw error("Expected 'def', 'for' or 'with' after 'async'");
                    }
                    parseStatement(out);
                }
                default -> parseSimpleStatements(out);
            }
        } else {
            parseSimpleStatements(out);
        }
    }

    private List<Statement> parseBlock() {
        expectOperator(":");
        List<Statement> body = new ArrayList<>();
        if (match(TokenType.NEWLINE)) {
            expect(TokenType.INDENT, "an indented block");
            while (!match(TokenType.DEDENT)) {
                if (check(TokenType.END_OF_FILE)) {
                    throw error("Unexpected end of file in block");
                }
                if (!match(TokenType.NEWLINE)) {
                    parseStatement(body);
                }
            }
        } else {
            parseSimpleStatements(body);
        }
        return body;
    }

    private void parseDecorated(List<Statement> out) {
        while (matchOperator("@")) {
            parseTest();
            expect(TokenType.NEWLINE, "end of line after decorator");
        }
        matchKeyword("async");
        if (checkKeyword("def")) {
            out.add(parseFunctionDefinition());
        } else if (checkKeyword("class")) {
            out.add(parseClassDefinition());
        } else {
            throw error("Expected a definition after decorator");
        }
    }

    private FunctionDefinition parseFunctionDefinition() {
        int line = advance().line();
        String name = expectIdentifier();
        expectOperator("(");
        List<String> parameters = parseParameters(")");
        expectOperator(")");
        if (matchOperator("->")) {
            parseTest();
        }
        return new FunctionDefinition(name, parameters, parseBlock(), line);
    }

    private List<String> parseParameters(String end) {
        boolean annotations = end.equals(")");
        List<String> parameters = new ArrayList<>();
        while (!checkOperator(end)) {
            if (matchOperator("/")) {
                // positional only marker
            } else if (matchOperator("*") || matchOperator("**")) {
                if (check(TokenType.NAME)) {
                    parameters.add(expectIdentifier());
                }
            } else {
                parameters.add(expectIdentifier());
            }
            if (annotations && matchOperator(":")) {
                parseTest();
            }
            if (matchOperator("=")) {
                parseTest();
            }
            if (!matchOperator(",")) {
                break;
            }
        }
        return parameters;
    }

    private ClassDefinition parseClassDefinition() {
        int line = advance().line();
        String name = expectIdentifier();
        List<Expression> bases = new ArrayList<>();
        if (matchOperator("(")) {
            List<Keyword> keywords = new ArrayList<>();
            parseArguments(bases, keywords);
        }
        return new ClassDefinition(name, bases, parseBlock(), line);
    }

    private If parseIf() {
        int line = advance().line();
        Expression test = parseNamedTest();
        List<Statement> body = parseBlock();
        List<Statement> orElse = new ArrayList<>();
        if (checkKeyword("elif")) {
            orElse.add(parseIf());
        } else if (matchKeyword("else")) {
            orElse = parseBlock();
        }
        return new If(test, body, orElse, line);
    }

    private For parseFor() {
        int line = advance().line();
        Expression target = parseTargetList();
        expectKeyword("in");
        Expression iterable = parseExpressionList();
        List<Statement> body = parseBlock();
        List<Statement> orElse = matchKeyword("else") ? parseBlock() : List.of();
        return new For(target, iterable, body, orElse, line);
    }

    private While parseWhile() {
        int line = advance().line();
        Expression test = parseNamedTest();
        List<Statement> body = parseBlock();
        List<Statement> orElse = matchKeyword("else") ? parseBlock() : List.of();
        return new While(test, body, orElse, line);
    }

    private Try parseTry() {
        int line = advance().line();
        List<Statement> body = parseBlock();
        List<ExceptHandler> handlers = new ArrayList<>();
        while (matchKeyword("except")) {
            matchOperator("*");
            Expression type = null;
            String name = null;
            if (!checkOperator(":")) {
                type = parseTest();
                if (matchOperator(",")) {
                    type = new CollectionLiteral(CollectionKind.TUPLE, List.of(type, parseTest()));
                }
                if (matchKeyword("as")) {
                    name = expectIdentifier();
                }
            }
            handlers.add(new ExceptHandler(type, name, parseBlock()));
        }
        List<Statement> orElse = matchKeyword("else") ? parseBlock() : List.of();
        List<Statement> finalBody = matchKeyword("finally") ? parseBlock() : List.of();
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw error("Expected 'except' or 'finally' block");
        }
        return new Try(body, handlers, orElse, finalBody, line);
    }

    private With parseWith() {
        int line = advance().line();
        List<WithItem> items = new ArrayList<>();
        do {
            Expression context = parseTest();
            Expression target = matchKeyword("as") ? parseOrExpression() : null;
            items.add(new WithItem(context, target));
        } while (matchOperator(","));
        return new With(items, parseBlock(), line);
    }

    private void parseSimpleStatements(List<Statement> out) {
        out.add(parseSmallStatement());
        while (matchOperator(";")) {
            if (check(TokenType.NEWLINE)) {
                break;
            }
            out.add(parseSmallStatement());
        }
        if (!match(TokenType.NEWLINE) && !check(TokenType.END_OF_FILE)) {
            throw error("Unexpected " + peek());
        }
    }

    private boolean atStatementEnd() {
        return check(TokenType.NEWLINE) || check(TokenType.END_OF_FILE) || checkOperator(";");
    }

    private Statement parseSmallStatement() {
        Token token = peek();
        int line = token.line();
        if (token.type() == TokenType.NAME) {
            switch (token.text()) {
                case "pass", "break", "continue" -> {
                    advance();
                    return new Simple(token.text(), List.of(), line);
                }
                case "return", "del", "yield" -> {
                    advance();
                    return new Simple(token.text(), atStatementEnd() ? List.of() : List.of(parseExpressionList()), line);
                }
                case "raise" -> {
                    advance();
                    List<Expression> values = new ArrayList<>();
                    if (!atStatementEnd()) {
                        values.add(parseTest());
                        if (matchKeyword("from")) {
                            values.add(parseTest());
                        }
                    }
                    return new Simple("raise", values, line);
                }
                case "assert" -> {
                    advance();
                    List<Expression> values = new ArrayList<>();
                    values.add(parseTest());
                    if (matchOperator(",")) {
                        values.add(parseTest());
                    }
                    return new Simple("assert", values, line);
                }
                case "global", "nonlocal" -> {
                    advance();
                    List<Expression> names = new ArrayList<>();
                    do {
                        names.add(new Name(expectIdentifier()));
                    } while (matchOperator(","));
                    return new Simple(token.text(), names, line);
                }
                case "import" -> {
                    return parseImport();
                }
                case "from" -> {
                    return parseFromImport();
                }
                default -> {
                    // expression statement
                }
            }
        }
        return parseExpressionStatement(line);
    }

    private String parseDottedName() {
        StringBuilder name = new StringBuilder(expectIdentifier());
        while (matchOperator(".")) {
            name.append('.').append(expectIdentifier());
        }
        return name.toString();
    }

    private Import parseImport() {
        int line = advance().line();
        List<String> names = new ArrayList<>();
        do {
            String name = parseDottedName();
            names.add(matchKeyword("as") ? expectIdentifier() : name);
        } while (matchOperator(","));
        return new Import(null, names, line);
    }

    private Import parseFromImport() {
        int line = advance().line();
        StringBuilder module = new StringBuilder();
        while (checkOperator(".") || checkOperator("...")) {
            module.append(advance().text());
        }
        if (!checkKeyword("import")) {
            module.append(parseDottedName());
        }
        expectKeyword("import");
        List<String> names = new ArrayList<>();
        if (matchOperator("*")) {
            names.add("*");
        } else {
            boolean parenthesized = matchOperator("(");
            do {
                if (parenthesized && checkOperator(")")) {
                    break;
                }
                String name = expectIdentifier();
                names.add(matchKeyword("as") ? expectIdentifier() : name);
            } while (matchOperator(","));
            if (parenthesized) {
                expectOperator(")");
            }
        }
        return new Import(module.toString(), names, line);
    }

    private Statement parseExpressionStatement(int line) {
        Expression first = parseExpressionList();
        Token token = peek();
        if (token.type() == TokenType.OPERATOR && AUGMENTED_OPERATORS.contains(token.text())) {
            advance();
            String operator = token.text().substring(0, token.text().length() - 1);
            return new AugmentedAssignment(first, operator, parseAssignedValue(), line);
        }
        if (matchOperator(":")) {
            parseTest();
            Expression value = matchOperator("=") ? parseAssignedValue() : null;
            return new Assignment(List.of(first), value, line);
        }
        if (checkOperator("=")) {
            List<Expression> targets = new ArrayList<>();
            Expression current = first;
            while (matchOperator("=")) {
                targets.add(current);
                current = parseAssignedValue();
            }
            return new Assignment(targets, current, line);
        }
        return new ExpressionStatement(first, line);
    }

    private Expression parseAssignedValue() {
        if (matchKeyword("yield")) {
            return new UnaryOperation("yield", atStatementEnd() ? new KeywordConstant("None") : parseExpressionList());
        }
        return parseExpressionList();
    }

    // expressions

    private boolean atExpressionEnd() {
        Token token = peek();
        return token.type() == TokenType.NEWLINE || token.type() == TokenType.END_OF_FILE
                || token.type() == TokenType.OPERATOR
                && (EXPRESSION_END_OPERATORS.contains(token.text()) || AUGMENTED_OPERATORS.contains(token.text()));
    }

    /**
     * Comma separated expressions, a tuple when there is more than one or a trailing comma.
     */
    private Expression parseExpressionList() {
        Expression first = parseStarOrTest();
        if (!checkOperator(",")) {
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (atExpressionEnd()) {
                break;
            }
            elements.add(parseStarOrTest());
        }
        return new CollectionLiteral(CollectionKind.TUPLE, elements);
    }

    private Expression parseTargetList() {
        Expression first = parseStarTarget();
        if (!checkOperator(",")) {
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (checkKeyword("in") || checkOperator("=")) {
                break;
            }
            elements.add(parseStarTarget());
        }
        return new CollectionLiteral(CollectionKind.TUPLE, elements);
    }

    private Expression parseStarTarget() {
        return matchOperator("*") ? new Starred(parseOrExpression()) : parseOrExpression();
    }

    private Expression parseStarOrTest() {
        return matchOperator("*") ? new Starred(parseOrExpression()) : parseTest();
    }

    private Expression parseNamedTest() {
        Expression test = parseTest();
        if (matchOperator(":=")) {
            return new BinaryOperation(test, ":=", parseTest());
        }
        return test;
    }

    private Expression parseTest() {
        if (checkKeyword("lambda")) {
            return parseLambda();
        }
        Expression body = parseOrTest();
        if (matchKeyword("if")) {
            Expression test = parseOrTest();
            expectKeyword("else");
            return new Conditional(test, body, parseTest());
        }
        return body;
    }

    private Expression parseLambda() {
        advance();
        List<String> parameters = parseParameters(":");
        expectOperator(":");
        return new Lambda(parameters, parseTest());
    }

    private Expression parseOrTest() {
        Expression left = parseAndTest();
        while (matchKeyword("or")) {
            left = new BinaryOperation(left, "or", parseAndTest());
        }
        return left;
    }

    private Expression parseAndTest() {
        Expression left = parseNotTest();
        while (matchKeyword("and")) {
            left = new BinaryOperation(left, "and", parseNotTest());
        }
        return left;
    }

    private Expression parseNotTest() {
        if (matchKeyword("not")) {
            return new UnaryOperation("not", parseNotTest());
        }
        return parseComparison();
    }

    private String matchComparisonOperator() {
        Token token = peek();
        if (token.type() == TokenType.OPERATOR && COMPARISON_OPERATORS.contains(token.text())) {
            advance();
            return token.text();
        }
        if (token.isName("in")) {
            advance();
            return "in";
        }
        if (token.isName("not") && peek(1).isName("in")) {
            advance();
            advance();
            return "not in";
        }
        if (token.isName("is")) {
            advance();
            return matchKeyword("not") ? "is not" : "is";
        }
        return null;
    }

    private Expression parseComparison() {
        Expression left = parseOrExpression();
        String operator;
        while ((operator = matchComparisonOperator()) != null) {
            left = new BinaryOperation(left, operator, parseOrExpression());
        }
        return left;
    }

    private Expression parseOrExpression() {
        Expression left = parseXorExpression();
        while (matchOperator("|")) {
            left = new BinaryOperation(left, "|", parseXorExpression());
        }
        return left;
    }

    private Expression parseXorExpression() {
        Expression left = parseAndExpression();
        while (matchOperator("^")) {
            left = new BinaryOperation(left, "^", parseAndExpression());
        }
        return left;
    }

    private Expression parseAndExpression() {
        Expression left = parseShiftExpression();
        while (matchOperator("&")) {
            left = new BinaryOperation(left, "&", parseShiftExpression());
        }
        return left;
    }

    private Expression parseShiftExpression() {
        Expression left = parseArithmeticExpression();
        while (checkOperator("<<") || checkOperator(">>")) {
            String operator = advance().text();
            left = new BinaryOperation(left, operator, parseArithmeticExpression());
        }
        return left;
    }

    private Expression parseArithmeticExpression() {
        Expression left = parseTerm();
        while (checkOperator("+") || checkOperator("-")) {
            String operator = advance().text();
            left = new BinaryOperation(left, operator, parseTerm());
        }
        return left;
    }

    private Expression parseTerm() {
        Expression left = parseFactor();
        while (checkOperator("*") || checkOperator("/") || checkOperator("//") || checkOperator("%")
                || checkOperator("@")) {
            String operator = advance().text();
            left = new BinaryOperation(left, operator, parseFactor());
        }
        return left;
    }

    private Expression parseFactor() {
        if (checkOperator("+") || checkOperator("-") || checkOperator("~")) {
            String operator = advance().text();
            return new UnaryOperation(operator, parseFactor());
        }
        return parsePower();
    }

    private Expression parsePower() {
        if (matchKeyword("await")) {
            return new UnaryOperation("await", parsePower());
        }
        Expression base = parsePrimary();
        if (matchOperator("**")) {
            return new BinaryOperation(base, "**", parseFactor());
        }
        return base;
    }

    private Expression parsePrimary() {
        Expression expression = parseAtom();
        while (true) {
            if (matchOperator("(")) {
                List<Expression> arguments = new ArrayList<>();
                List<Keyword> keywords = new ArrayList<>();
                parseArguments(arguments, keywords);
                expression = new Call(expression, arguments, keywords);
            } else if (matchOperator("[")) {
                expression = new Subscript(expression, parseSubscriptList());
                expectOperator("]");
            } else if (matchOperator(".")) {
                expression = new Attribute(expression, expect(TokenType.NAME, "an attribute name").text());
            } else {
                return expression;
            }
        }
    }

    /**
     * Parses call arguments up to and including the closing parenthesis.
     */
    private void parseArguments(List<Expression> arguments, List<Keyword> keywords) {
        while (!matchOperator(")")) {
            if (matchOperator("*")) {
                arguments.add(new Starred(parseTest()));
            } else if (matchOperator("**")) {
                keywords.add(new Keyword(null, parseTest()));
            } else if (check(TokenType.NAME) && peek(1).isOperator("=")) {
                String name = advance().text();
                advance();
                keywords.add(new Keyword(name, parseTest()));
            } else {
                Expression argument = parseNamedTest();
                if (checkKeyword("for") || checkKeyword("async")) {
                    argument = parseComprehension(CollectionKind.TUPLE, false, argument);
                }
                arguments.add(argument);
            }
            if (!matchOperator(",")) {
                expectOperator(")");
                return;
            }
        }
    }

    private Expression parseSubscriptList() {
        Expression first = parseSubscriptItem();
        if (!checkOperator(",")) {
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (checkOperator("]")) {
                break;
            }
            elements.add(parseSubscriptItem());
        }
        return new CollectionLiteral(CollectionKind.TUPLE, elements);
    }

    private boolean atSliceBoundEnd() {
        return checkOperator(":") || checkOperator("]") || checkOperator(",");
    }

    private Expression parseSubscriptItem() {
        Expression lower = checkOperator(":") ? null : parseStarOrTest();
        if (!matchOperator(":")) {
            return lower;
        }
        Expression upper = atSliceBoundEnd() ? null : parseTest();
        Expression step = null;
        if (matchOperator(":") && !atSliceBoundEnd()) {
            step = parseTest();
        }
        return new Slice(lower, upper, step);
    }

    private Expression parseComprehension(CollectionKind kind, boolean dict, Expression element) {
        List<ComprehensionClause> clauses = new ArrayList<>();
        while (checkKeyword("for") || checkKeyword("async")) {
            matchKeyword("async");
            expectKeyword("for");
            Expression target = parseTargetList();
            expectKeyword("in");
            Expression iterable = parseOrTest();
            List<Expression> conditions = new ArrayList<>();
            while (matchKeyword("if")) {
                conditions.add(parseOrTest());
            }
            clauses.add(new ComprehensionClause(target, iterable, conditions));
        }
        return new Comprehension(kind, dict, element, clauses);
    }

    private Expression parseAtom() {
        Token token = peek();
        switch (token.type()) {
            case NAME -> {
                return parseNameAtom(token);
            }
            case INTEGER -> {
                advance();
                return new NumberLiteral(parseInteger(token));
            }
            case FLOAT -> {
                advance();
                String text = token.text().replace("_", "");
                if (text.endsWith("j") || text.endsWith("J")) {
                    text = text.substring(0, text.length() - 1);
                }
                return new NumberLiteral(Double.parseDouble(text));
            }
            case STRING -> {
                StringBuilder value = new StringBuilder();
                boolean formatted = false;
                while (check(TokenType.STRING)) {
                    Token part = advance();
                    value.append(part.text());
                    formatted |= part.prefix().contains("f");
                }
                return new StringLiteral(value.toString(), formatted);
            }
            case OPERATOR -> {
                return parseBracketAtom(token);
            }
            default -> throw error("Unexpected " + token);
        }
    }

    private Expression parseNameAtom(Token token) {
        switch (token.text()) {
            case "True", "False", "None" -> {
                advance();
                return new KeywordConstant(token.text());
            }
            default -> {
                if (KEYWORDS.contains(token.text())) {
                    throw error("Unexpected keyword '" + token.text() + "'");
                }
                advance();
                return new Name(token.text());
            }
        }
    }

    private static Number parseInteger(Token token) {
        String text = token.text().replace("_", "").toLowerCase(Locale.ROOT);
        int radix = 10;
        if (text.startsWith("0x")) {
            radix = 16;
        } else if (text.startsWith("0o")) {
            radix = 8;
        } else if (text.startsWith("0b")) {
            radix = 2;
        }
        if (radix != 10) {
            text = text.substring(2);
        }
        try {
            BigInteger value = new BigInteger(text, radix);
            return value.bitLength() < 64 ? (Number) value.longValue() : (Number) value.doubleValue();
        } catch (NumberFormatException e) {
            throw new ScriptSyntaxException("Invalid number '" + token.text() + "'", token.line(), token.column());
        }
    }

    private Expression parseBracketAtom(Token token) {
        switch (token.text()) {
            case "(" -> {
                advance();
                return parseParenthesized();
            }
            case "[" -> {
                advance();
                return parseList();
            }
            case "{" -> {
                advance();
                return parseDictOrSet();
            }
            case "..." -> {
                advance();
                return new KeywordConstant("...");
            }
            default -> throw error("Unexpected " + token);
        }
    }

    private Expression parseParenthesized() {
        if (matchOperator(")")) {
            return new CollectionLiteral(CollectionKind.TUPLE, List.of());
        }
        if (matchKeyword("yield")) {
            Expression value = checkOperator(")") ? new KeywordConstant("None") : parseExpressionList();
            expectOperator(")");
            return new UnaryOperation("yield", value);
        }
        Expression first = checkOperator("*") ? parseStarOrTest() : parseNamedTest();
        if (checkKeyword("for") || checkKeyword("async")) {
            Expression generator = parseComprehension(CollectionKind.TUPLE, false, first);
            expectOperator(")");
            return generator;
        }
        if (matchOperator(")")) {
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (checkOperator(")")) {
                break;
            }
            elements.add(parseStarOrTest());
        }
        expectOperator(")");
        return new CollectionLiteral(CollectionKind.TUPLE, elements);
    }

    private Expression parseList() {
        if (matchOperator("]")) {
            return new CollectionLiteral(CollectionKind.LIST, List.of());
        }
        Expression first = parseStarOrTest();
        if (checkKeyword("for") || checkKeyword("async")) {
            Expression comprehension = parseComprehension(CollectionKind.LIST, false, first);
            expectOperator("]");
            return comprehension;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (checkOperator("]")) {
                break;
            }
            elements.add(parseStarOrTest());
        }
        expectOperator("]");
        return new CollectionLiteral(CollectionKind.LIST, elements);
    }

    private Expression parseDictOrSet() {
        if (matchOperator("}")) {
            return new DictLiteral(List.of(), List.of());
        }
        List<Expression> keys = new ArrayList<>();
        List<Expression> values = new ArrayList<>();
        if (matchOperator("**")) {
            keys.add(null);
            values.add(parseOrExpression());
        } else {
            Expression first = parseStarOrTest();
            if (!matchOperator(":")) {
                return parseSetRest(first);
            }
            Expression value = parseTest();
            if (checkKeyword("for") || checkKeyword("async")) {
                Expression comprehension = parseComprehension(CollectionKind.SET, true,
                        new CollectionLiteral(CollectionKind.TUPLE, List.of(first, value)));
                expectOperator("}");
                return comprehension;
            }
            keys.add(first);
            values.add(value);
        }
        while (matchOperator(",")) {
            if (checkOperator("}")) {
                break;
            }
            if (matchOperator("**")) {
                keys.add(null);
                values.add(parseOrExpression());
            } else {
                keys.add(parseTest());
                expectOperator(":");
                values.add(parseTest());
            }
        }
        expectOperator("}");
        return new DictLiteral(keys, values);
    }

    private Expression parseSetRest(Expression first) {
        if (checkKeyword("for") || checkKeyword("async")) {
            Expression comprehension = parseComprehension(CollectionKind.SET, false, first);
            expectOperator("}");
            return comprehension;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (checkOperator("}")) {
                break;
            }
            elements.add(parseStarOrTest());
        }
        expectOperator("}");
        return new CollectionLiteral(CollectionKind.SET, elements);
    }
}
