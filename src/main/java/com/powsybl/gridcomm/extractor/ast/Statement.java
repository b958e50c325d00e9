/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import java.util.List;

/**
 * Statement node of the syntax tree. Every statement knows the line it starts on.
 */
public interface Statement {

    int line();

    <R> R accept(StatementVisitor<R> visitor);

    record ExpressionStatement(Expression expression, int line) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitExpression(this);
        }
    }

    /**
     * {@code a = b = value} has two targets. An annotated assignment without value has a null value.
     */
    record Assignment(List<Expression> targets, Expression value, int line) implements Statement {
        public Assignment {
            targets = List.copyOf(targets);
        }

        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    /**
     * @param operator the operator without its trailing {@code =}
     */
    record AugmentedAssignment(Expression target, String operator, Expression value, int line) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitAugmentedAssignment(this);
        }
    }

    /**
     * {@code import a.b} has a null module, {@code from a import b} has module {@code a}.
     */
    record Import(String module, List<String> names, int line) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitImport(this);
        }
    }

    /**
     * return, pass, break, continue, raise, del, global, nonlocal and assert.
     */
    record Simple(String keyword, List<Expression> values, int line) implements Statement {
        public Simple {
            values = List.copyOf(values);
        }

        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitSimple(this);
        }
    }

    record FunctionDefinition(String name, List<String> parameters, List<Statement> body, int line) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitFunctionDefinition(this);
        }
    }

    record ClassDefinition(String name, List<Expression> bases, List<Statement> body, int line) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitClassDefinition(this);
        }
    }

    /**
     * An {@code elif} chain is an if statement nested in the else branch.
     */
    record If(Expression test, List<Statement> body, List<Statement> orElse, int line) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record For(Expression target, Expression iterable, List<Statement> body, List<Statement> orElse, int line)
            implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    record While(Expression test, List<Statement> body, List<Statement> orElse, int line) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    /**
     * @param type exception type, null for a bare except clause
     * @param name bound name, null when absent
     */
    record ExceptHandler(Expression type, String name, List<Statement> body) {
    }

    record Try(List<Statement> body, List<ExceptHandler> handlers, List<Statement> orElse, List<Statement> finalBody,
               int line) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitTry(this);
        }
    }

    /**
     * @param target the {@code as} target, null when absent
     */
    record WithItem(Expression context, Expression target) {
    }

    record With(List<WithItem> items, List<Statement> body, int line) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitWith(this);
        }
    }
}
