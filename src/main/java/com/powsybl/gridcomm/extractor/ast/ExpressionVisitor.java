/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import com.powsybl.gridcomm.extractor.ast.Expression.*;

public interface ExpressionVisitor<R> {

    R visitName(Name name);

    R visitNumber(NumberLiteral number);

    R visitString(StringLiteral string);

    R visitKeywordConstant(KeywordConstant constant);

    R visitAttribute(Attribute attribute);

    R visitCall(Call call);

    R visitStarred(Starred starred);

    R visitSubscript(Subscript subscript);

    R visitSlice(Slice slice);

    R visitCollection(CollectionLiteral collection);

    R visitDict(DictLiteral dict);

    R visitUnaryOperation(UnaryOperation operation);

    R visitBinaryOperation(BinaryOperation operation);

    R visitConditional(Conditional conditional);

    R visitLambda(Lambda lambda);

    R visitComprehension(Comprehension comprehension);
}
