/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import com.powsybl.gridcomm.extractor.ast.Statement.*;

import java.util.List;

/**
 * Visits statements and the statements nested in their bodies, in source order. Expressions are handed to
 * {@link #visitExpressions(List)}, which does nothing by default.
 */
public abstract class StatementWalker implements StatementVisitor<Void> {

    public void walk(List<Statement> statements) {
        for (Statement statement : statements) {
            statement.accept(this);
        }
    }

    protected void visitExpressions(List<Expression> expressions) {
        // nothing by default
    }

    @Override
    public Void visitExpression(ExpressionStatement statement) {
        visitExpressions(List.of(statement.expression()));
        return null;
    }

    @Override
    public Void visitAssignment(Assignment statement) {
        if (statement.value() != null) {
            visitExpressions(List.of(statement.value()));
        }
        return null;
    }

    @Override
    public Void visitAugmentedAssignment(AugmentedAssignment statement) {
        visitExpressions(List.of(statement.value()));
        return null;
    }

    @Override
    public Void visitImport(Import statement) {
        return null;
    }

    @Override
    public Void visitSimple(Simple statement) {
        visitExpressions(statement.values());
        return null;
    }

    @Override
    public Void visitFunctionDefinition(FunctionDefinition statement) {
        walk(statement.body());
        return null;
    }

    @Override
    public Void visitClassDefinition(ClassDefinition statement) {
        walk(statement.body());
        return null;
    }

    @Override
    public Void visitIf(If statement) {
        visitExpressions(List.of(statement.test()));
        walk(statement.body());
        walk(statement.orElse());
        return null;
    }

    @Override
    public Void visitFor(For statement) {
        visitExpressions(List.of(statement.iterable()));
        walk(statement.body());
        walk(statement.orElse());
        return null;
    }

    @Override
    public Void visitWhile(While statement) {
        visitExpressions(List.of(statement.test()));
        walk(statement.body());
        walk(statement.orElse());
        return null;
    }

    @Override
    public Void visitTry(Try statement) {
        walk(statement.body());
        for (ExceptHandler handler : statement.handlers()) {
            walk(handler.body());
        }
        walk(statement.orElse());
        walk(statement.finalBody());
        return null;
    }

    @Override
    public Void visitWith(With statement) {
        for (WithItem item : statement.items()) {
            visitExpressions(List.of(item.context()));
        }
        walk(statement.body());
        return null;
    }
}
