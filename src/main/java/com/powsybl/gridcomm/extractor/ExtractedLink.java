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
 * A channel between two extracted nodes.
 *
 * @param source     key of the first node
 * @param target     key of the second node
 * @param medium     channel installed between them
 * @param dataRate   configured data rate of the helper, empty when unset
 * @param delay      configured delay of the helper, empty when unset
 * @param helperName      variable name of the installing helper
 * @param deviceContainer variable the install returned its devices in, empty when not assigned
 */
public record ExtractedLink(NodeKey source, NodeKey target, ChannelMedium medium, String dataRate, String delay,
                            String helperName, String deviceContainer) {

    public ExtractedLink {
        Objects.requireNonNull(source);
        Objects.requireNonNull(target);
        Objects.requireNonNull(medium);
        dataRate = Objects.requireNonNullElse(dataRate, "");
        delay = Objects.requireNonNullElse(delay, "");
        helperName = Objects.requireNonNullElse(helperName, "");
        deviceContainer = Objects.requireNonNullElse(deviceContainer, "");
    }

    public boolean connects(NodeKey source, NodeKey target) {
        return this.source.equals(source) && this.target.equals(target);
    }
}
