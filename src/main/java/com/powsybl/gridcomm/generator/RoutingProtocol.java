/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.generator;

import java.util.Locale;
import java.util.Optional;

/**
 * Routing protocols the generator knows how to install. Static and global routing share the default stack, the
 * dynamic protocols get their own stack with a list routing of static routing first and the protocol second.
 */
public enum RoutingProtocol {
    STATIC(null),
    GLOBAL(null),
    OLSR("OlsrHelper"),
    AODV("AodvHelper"),
    RIP("RipHelper");

    static final int STATIC_ROUTING_PRIORITY = 0;

    static final int DYNAMIC_ROUTING_PRIORITY = 10;

    private final String helperClass;

    RoutingProtocol(String helperClass) {
        this.helperClass = helperClass;
    }

    public String getHelperClass() {
        return helperClass;
    }

    public boolean isDynamic() {
        return helperClass != null;
    }

    public String getVariablePrefix() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RoutingProtocol> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (RoutingProtocol protocol : values()) {
            if (protocol.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(protocol);
            }
        }
        return Optional.empty();
    }
}
