/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.address;

import java.util.*;

/**
 * Outcome of one address resolution: the segments found, the subnet of every resolved link and the links skipped.
 * Addresses themselves are written into the network ports.
 */
public class AddressResolution {

    private final List<Segment> segments = new ArrayList<>();

    private final Map<String, String> subnetByLinkId = new LinkedHashMap<>();

    private final Set<String> skippedLinkIds = new LinkedHashSet<>();

    void addSegment(Segment segment) {
        segments.add(segment);
        for (SegmentMember member : segment.members()) {
            subnetByLinkId.put(member.linkId(), segment.subnet());
        }
    }

    void setLinkSubnet(String linkId, String subnet) {
        subnetByLinkId.put(linkId, subnet);
    }

    void skipLink(String linkId) {
        skippedLinkIds.add(linkId);
    }

    public List<Segment> getSegments() {
        return Collections.unmodifiableList(segments);
    }

    public Optional<Segment> getSwitchSegment(String switchId) {
        return segments.stream()
                .filter(s -> s.kind() == Segment.Kind.SWITCH && s.anchorNodeId().equals(switchId))
                .findFirst();
    }

    public Optional<Segment> getWirelessSegment() {
        return segments.stream().filter(s -> s.kind() == Segment.Kind.WIRELESS).findFirst();
    }

    public Optional<String> getSubnet(String linkId) {
        return Optional.ofNullable(subnetByLinkId.get(linkId));
    }

    /**
     * Distinct subnets in resolution order.
     */
    public List<String> getSubnets() {
        return new ArrayList<>(new LinkedHashSet<>(subnetByLinkId.values()));
    }

    public boolean isSkipped(String linkId) {
        return skippedLinkIds.contains(linkId);
    }

    public Set<String> getSkippedLinkIds() {
        return Collections.unmodifiableSet(skippedLinkIds);
    }
}
