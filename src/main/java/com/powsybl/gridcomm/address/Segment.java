/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.address;

import java.util.List;
import java.util.Objects;

/**
 * A set of endpoints sharing one subnet. A switch segment is anchored at its switch node. The wireless segment
 * gathers every node reached through a wifi link and has no anchor.
 */
public record Segment(Kind kind, String anchorNodeId, String subnet, List<SegmentMember> members) {

    public enum Kind {
        SWITCH,
        WIRELESS
    }

    public static final String WIRELESS_ID = "wifi";

    public Segment {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(subnet);
        members = List.copyOf(members);
    }

    public String getId() {
        return kind == Kind.SWITCH ? anchorNodeId : WIRELESS_ID;
    }
}
