/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.address;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridcomm.network.*;
import com.powsybl.gridcomm.util.Ipv4Addresses;
import com.powsybl.gridcomm.util.Markers;
import com.powsybl.gridcomm.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Assigns an address to every port that needs one and groups switch attached endpoints into segments.
 * <p>
 * Resolution runs on a network whose topology no longer changes. Switch segments are resolved first in node order,
 * then the wireless segment, then the remaining links in link order. Configured addresses are kept as they are and
 * the subnets they live in are never synthesized again, nor are the subnets of switch subnet bases. Dangling links are
 * skipped and reported.
 */
public class AddressResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(AddressResolver.class);

    private final AddressingParameters parameters;

    public AddressResolver() {
        this(new AddressingParameters());
    }

    public AddressResolver(AddressingParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public AddressResolution resolve(Network network) {
        return resolve(network, ReportNode.NO_OP);
    }

    public AddressResolution resolve(Network network, ReportNode reportNode) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(reportNode);
        Stopwatch stopwatch = Stopwatch.createStarted();

        ReportNode resolutionReportNode = Reports.createAddressResolutionReportNode(reportNode, network.getId());
        AddressResolution resolution = new AddressResolution();
        SubnetAllocator allocator = new SubnetAllocator(parameters);
        for (Node collision : AddressPolicy.reserveConfiguredAddresses(network, allocator)) {
            String subnet = Ipv4Addresses.subnet24(collision.getSubnetBase());
            LOGGER.warn("Subnet {} of switch {} is shared with another switch", subnet, collision.getId());
            Reports.reportSubnetCollision(resolutionReportNode, subnet, collision.getId());
        }

        for (Link link : network.getLinks()) {
            if (AddressPolicy.isDangling(network, link)) {
                LOGGER.warn("Link {} of network {} has a missing endpoint, skipped", link.getId(), network.getId());
                resolution.skipLink(link.getId());
                Reports.reportDanglingLink(resolutionReportNode, link.getId());
            }
        }

        resolveSwitchSegments(network, allocator, resolution, resolutionReportNode);
        resolveWirelessSegment(network, allocator, resolution);
        resolvePointToPointLinks(network, allocator, resolution);
        checkDuplicateAddresses(network, resolutionReportNode);

        stopwatch.stop();
        LOGGER.info(Markers.PERFORMANCE_MARKER, "Addresses of network {} resolved in {} ms: {} segments, {} subnets",
                network.getId(), stopwatch.elapsed(TimeUnit.MILLISECONDS), resolution.getSegments().size(),
                resolution.getSubnets().size());
        return resolution;
    }

    private static void resolveSwitchSegments(Network network, SubnetAllocator allocator, AddressResolution resolution,
                                              ReportNode reportNode) {
        for (Node node : network.getNodes()) {
            if (!node.isSwitch()) {
                continue;
            }
            for (Port port : node.getPorts()) {
                if (port.hasIpAddress()) {
                    Reports.reportSwitchPortAddress(reportNode, port.getIpAddress(), port.getId());
                }
            }
            List<SegmentMember> members = AddressPolicy.getSwitchSegmentMembers(network, node.getId());
            if (members.isEmpty()) {
                continue;
            }
            String subnet = AddressPolicy.chooseSegmentSubnet(network, node, members, allocator);
            AddressPolicy.assignSegment(network, subnet, members, allocator);
            resolution.addSegment(new Segment(Segment.Kind.SWITCH, node.getId(), subnet, members));
            members.forEach(member -> resolution.setLinkSubnet(member.linkId(), subnet));
            LOGGER.debug("Switch segment {} uses subnet {} for {} members", node.getId(), subnet, members.size());
        }
    }

    private static void resolveWirelessSegment(Network network, SubnetAllocator allocator, AddressResolution resolution) {
        List<SegmentMember> members = AddressPolicy.getWirelessSegmentMembers(network);
        if (members.isEmpty()) {
            return;
        }
        String subnet = AddressPolicy.chooseSegmentSubnet(network, null, members, allocator);
        AddressPolicy.assignSegment(network, subnet, members, allocator);
        resolution.addSegment(new Segment(Segment.Kind.WIRELESS, null, subnet, members));
        for (Link link : network.getLinks()) {
            if (link.getChannel() == ChannelKind.WIFI && !resolution.isSkipped(link.getId())) {
                resolution.setLinkSubnet(link.getId(), subnet);
            }
        }
        LOGGER.debug("Wireless segment uses subnet {} for {} nodes", subnet, members.size());
    }

    private static void resolvePointToPointLinks(Network network, SubnetAllocator allocator, AddressResolution resolution) {
        for (Link link : network.getLinks()) {
            if (resolution.isSkipped(link.getId())
                    || link.getChannel() == ChannelKind.WIFI
                    || AddressPolicy.touchesSwitch(network, link)) {
                continue;
            }
            String subnet = AddressPolicy.assignPointToPoint(network, link, allocator);
            resolution.setLinkSubnet(link.getId(), subnet);
            LOGGER.debug("Link {} uses subnet {}", link.getId(), subnet);
        }
    }

    private static void checkDuplicateAddresses(Network network, ReportNode reportNode) {
        Map<String, List<String>> portIdsByAddress = new LinkedHashMap<>();
        for (Node node : network.getNodes()) {
            if (node.isSwitch()) {
                continue;
            }
            for (Port port : node.getPorts()) {
                if (port.hasIpAddress()) {
                    portIdsByAddress.computeIfAbsent(port.getIpAddress(), k -> new ArrayList<>()).add(port.getId());
                }
            }
        }
        portIdsByAddress.forEach((address, portIds) -> {
            if (portIds.size() > 1) {
                Reports.reportDuplicateAddress(reportNode, address, portIds);
            }
        });
    }
}
