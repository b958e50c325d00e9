/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

import java.util.Objects;

/**
 * A warning or a pending manual action attached to a network, usually produced while importing a script.
 *
 * @param type    short machine-readable category, for instance {@code parse_error}
 * @param source  component which raised the issue
 * @param message human readable description
 */
public record NetworkIssue(String type, String source, String message) {

    public NetworkIssue {
        Objects.requireNonNull(type);
        Objects.requireNonNull(source);
        Objects.requireNonNull(message);
    }
}
