/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

import java.util.Objects;

/**
 * An address helper assign call: the device container it numbered and the base and mask in effect at that time.
 */
public record ExtractedAddressAssignment(String deviceContainer, String base, String netmask) {

    public ExtractedAddressAssignment {
        Objects.requireNonNull(deviceContainer);
        Objects.requireNonNull(base);
        netmask = Objects.requireNonNullElse(netmask, "");
    }
}
