/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import com.powsybl.gridcomm.extractor.ast.Expression.*;

import java.util.List;

/**
 * Visits an expression and all its sub-expressions, parents before children and children left to right.
 */
public abstract class ExpressionWalker implements ExpressionVisitor<Void> {

    public void walk(Expression expression) {
        if (expression != null) {
            expression.accept(this);
        }
    }

    public void walk(List<Expression> expressions) {
        expressions.forEach(this::walk);
    }

    @Override
    public Void visitName(Name name) {
        return null;
    }

    @Override
    public Void visitNumber(NumberLiteral number) {
        return null;
    }

    @Override
    public Void visitString(StringLiteral string) {
        return null;
    }

    @Override
    public Void visitKeywordConstant(KeywordConstant constant) {
        return null;
    }

    @Override
    public Void visitAttribute(Attribute attribute) {
        walk(attribute.value());
        return null;
    }

    @Override
    public Void visitCall(Call call) {
        walk(call.function());
        walk(call.arguments());
        call.keywords().forEach(keyword -> walk(keyword.value()));
        return null;
    }

    @Override
    public Void visitStarred(Starred starred) {
        walk(starred.value());
        return null;
    }

    @Override
    public Void visitSubscript(Subscript subscript) {
        walk(subscript.value());
        walk(subscript.index());
        return null;
    }

    @Override
    public Void visitSlice(Slice slice) {
        walk(slice.lower());
        walk(slice.upper());
        walk(slice.step());
        return null;
    }

    @Override
    public Void visitCollection(CollectionLiteral collection) {
        walk(collection.elements());
        return null;
    }

    @Override
    public Void visitDict(DictLiteral dict) {
        walk(dict.keys());
        walk(dict.values());
        return null;
    }

    @Override
    public Void visitUnaryOperation(UnaryOperation operation) {
        walk(operation.operand());
        return null;
    }

    @Override
    public Void visitBinaryOperation(BinaryOperation operation) {
        walk(operation.left());
        walk(operation.right());
        return null;
    }

    @Override
    public Void visitConditional(Conditional conditional) {
        walk(conditional.test());
        walk(conditional.body());
        walk(conditional.orElse());
        return null;
    }

    @Override
    public Void visitLambda(Lambda lambda) {
        walk(lambda.body());
        return null;
    }

    @Override
    public Void visitComprehension(Comprehension comprehension) {
        walk(comprehension.element());
        for (ComprehensionClause clause : comprehension.clauses()) {
            walk(clause.target());
            walk(clause.iterable());
            walk(clause.conditions());
        }
        return null;
    }
}
