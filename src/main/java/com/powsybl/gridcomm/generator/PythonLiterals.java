/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.generator;

import java.util.Locale;

/**
 * Formatting of Python literals.
 */
final class PythonLiterals {

    private PythonLiterals() {
    }

    static String string(String value) {
        StringBuilder builder = new StringBuilder(value.length() + 2).append('\'');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> builder.append("\\\\");
                case '\'' -> builder.append("\\'");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> builder.append(c);
            }
        }
        return builder.append('\'').toString();
    }

    static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.format(Locale.ROOT, "%.1f", value);
        }
        return Double.toString(value);
    }

    static String bool(boolean value) {
        return value ? "True" : "False";
    }

    /**
     * Turns an identifier coming from the network into a fragment usable in a Python name.
     */
    static String identifier(String value) {
        String id = value.replaceAll("[^A-Za-z0-9_]", "_");
        return id.isEmpty() || Character.isDigit(id.charAt(0)) ? "_" + id : id;
    }

    /**
     * Text of a comment, kept on a single line.
     */
    static String comment(String value) {
        return value.replace('\n', ' ').replace('\r', ' ');
    }
}
