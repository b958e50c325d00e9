/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import java.util.List;
import java.util.Objects;

/**
 * Expression node of the syntax tree.
 */
public interface Expression {

    <R> R accept(ExpressionVisitor<R> visitor);

    record Name(String id) implements Expression {
        public Name {
            Objects.requireNonNull(id);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    /**
     * Integer literals hold a {@link Long}, float and imaginary literals a {@link Double}.
     */
    record NumberLiteral(Number value) implements Expression {
        public NumberLiteral {
            Objects.requireNonNull(value);
        }

        public boolean isInteger() {
            return value instanceof Long;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    /**
     * Formatted strings keep their template text, replacement fields are not parsed.
     */
    record StringLiteral(String value, boolean formatted) implements Expression {
        public StringLiteral {
            Objects.requireNonNull(value);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    /**
     * {@code True}, {@code False}, {@code None} or {@code ...}.
     */
    record KeywordConstant(String keyword) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitKeywordConstant(this);
        }
    }

    record Attribute(Expression value, String name) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitAttribute(this);
        }
    }

    /**
     * A keyword argument, or a {@code **mapping} argument when the name is null.
     */
    record Keyword(String name, Expression value) {
    }

    record Call(Expression function, List<Expression> arguments, List<Keyword> keywords) implements Expression {
        public Call {
            arguments = List.copyOf(arguments);
            keywords = List.copyOf(keywords);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    record Starred(Expression value) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitStarred(this);
        }
    }

    record Subscript(Expression value, Expression index) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitSubscript(this);
        }
    }

    /**
     * Bounds and step are null when omitted.
     */
    record Slice(Expression lower, Expression upper, Expression step) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitSlice(this);
        }
    }

    enum CollectionKind {
        TUPLE,
        LIST,
        SET
    }

    record CollectionLiteral(CollectionKind kind, List<Expression> elements) implements Expression {
        public CollectionLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitCollection(this);
        }
    }

    /**
     * A null key stands for a {@code **mapping} entry.
     */
    record DictLiteral(List<Expression> keys, List<Expression> values) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitDict(this);
        }
    }

    record UnaryOperation(String operator, Expression operand) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitUnaryOperation(this);
        }
    }

    /**
     * Arithmetic, bitwise, boolean and comparison operations. Chained comparisons are nested from the left.
     */
    record BinaryOperation(Expression left, String operator, Expression right) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitBinaryOperation(this);
        }
    }

    record Conditional(Expression test, Expression body, Expression orElse) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }

    record Lambda(List<String> parameters, Expression body) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitLambda(this);
        }
    }

    record ComprehensionClause(Expression target, Expression iterable, List<Expression> conditions) {
    }

    /**
     * List, set, dict or generator comprehension. Generators have the tuple kind, dict comprehensions the set kind
     * with a key value tuple as element.
     */
    record Comprehension(CollectionKind kind, boolean dict, Expression element, List<ComprehensionClause> clauses)
            implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitComprehension(this);
        }
    }
}
