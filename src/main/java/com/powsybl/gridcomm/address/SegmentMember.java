/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.address;

/**
 * A non-switch endpoint of a shared medium: the node, its port and the link attaching it to the segment.
 */
public record SegmentMember(String nodeId, String portId, String linkId) {
}
