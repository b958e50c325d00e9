/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import com.powsybl.gridcomm.extractor.ast.Statement.*;

public interface StatementVisitor<R> {

    R visitExpression(ExpressionStatement statement);

    R visitAssignment(Assignment statement);

    R visitAugmentedAssignment(AugmentedAssignment statement);

    R visitImport(Import statement);

    R visitSimple(Simple statement);

    R visitFunctionDefinition(FunctionDefinition statement);

    R visitClassDefinition(ClassDefinition statement);

    R visitIf(If statement);

    R visitFor(For statement);

    R visitWhile(While statement);

    R visitTry(Try statement);

    R visitWith(With statement);
}
