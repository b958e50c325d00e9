/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.generator;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * Accumulates script lines. Lines written through {@link #line(String)} belong to the body of the main function.
 */
public class ScriptWriter {

    private static final String INDENT = "    ";

    private final StringBuilder builder = new StringBuilder();

    private int depth = 1;

    public ScriptWriter raw(String text) {
        builder.append(text).append('\n');
        return this;
    }

    public ScriptWriter line(String text) {
        if (text.isEmpty()) {
            return blank();
        }
        builder.append(StringUtils.repeat(INDENT, depth)).append(text).append('\n');
        return this;
    }

    public ScriptWriter line(String format, Object... args) {
        return line(String.format(Locale.ROOT, format, args));
    }

    public ScriptWriter comment(String text) {
        return line("# " + PythonLiterals.comment(text));
    }

    public ScriptWriter blank() {
        builder.append('\n');
        return this;
    }

    public ScriptWriter section(ScriptSection section) {
        blank();
        return line(section.getMarker());
    }

    public ScriptWriter indent() {
        depth++;
        return this;
    }

    public ScriptWriter dedent() {
        if (depth == 0) {
            throw new IllegalStateException("Cannot dedent the module level");
        }
        depth--;
        return this;
    }

    public ScriptWriter moduleLevel() {
        depth = 0;
        return this;
    }

    @Override
    public String toString() {
        return builder.toString();
    }
}
