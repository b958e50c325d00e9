/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import com.powsybl.commons.PowsyblException;

/**
 * A script that cannot be tokenized or parsed.
 */
public class ScriptSyntaxException extends PowsyblException {

    private final String reason;

    private final int line;

    private final int column;

    public ScriptSyntaxException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.reason = message;
        this.line = line;
        this.column = column;
    }

    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
