/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.address;

import com.powsybl.gridcomm.network.*;
import com.powsybl.gridcomm.util.Ipv4Addresses;

import java.util.*;

/**
 * The addressing rules shared by the resolver, the script generator and the topology converter.
 * <p>
 * Switch ports never carry an address. On a link touching a switch only the other endpoint is addressed and its
 * address is the first one of the link interface container. On any other link the source address comes first and the
 * target address second. A configured address is never changed: a link reuses the subnet of its source address, then
 * of its target address, before a subnet is synthesized.
 */
public final class AddressPolicy {

    private AddressPolicy() {
    }

    public static Optional<Port> getEndpointPort(Network network, Link link, LinkSide side) {
        LinkEndpoint endpoint = link.getEndpoint(side);
        Node node = network.getNode(endpoint.nodeId());
        return node != null ? node.getPort(endpoint.portId()) : Optional.empty();
    }

    public static Optional<String> getEndpointAddress(Network network, Link link, LinkSide side) {
        return getEndpointPort(network, link, side).filter(Port::hasIpAddress).map(Port::getIpAddress);
    }

    public static boolean isSwitchEndpoint(Network network, Link link, LinkSide side) {
        Node node = network.getNode(link.getEndpoint(side).nodeId());
        return node != null && node.isSwitch();
    }

    /**
     * A link is dangling when one of its endpoint nodes or ports no longer exists.
     */
    public static boolean isDangling(Network network, Link link) {
        return getEndpointPort(network, link, LinkSide.SOURCE).isEmpty()
                || getEndpointPort(network, link, LinkSide.TARGET).isEmpty();
    }

    public static boolean isSwitchToSwitch(Network network, Link link) {
        return isSwitchEndpoint(network, link, LinkSide.SOURCE) && isSwitchEndpoint(network, link, LinkSide.TARGET);
    }

    public static boolean touchesSwitch(Network network, Link link) {
        return isSwitchEndpoint(network, link, LinkSide.SOURCE) || isSwitchEndpoint(network, link, LinkSide.TARGET);
    }

    /**
     * Whether the endpoint on this side of the link gets an address: it must not be a switch port.
     */
    public static boolean isAddressable(Network network, Link link, LinkSide side) {
        return !isSwitchEndpoint(network, link, side);
    }

    /**
     * Index of the endpoint address in the interface container of the link.
     */
    public static int getInterfaceSlot(Network network, Link link, LinkSide side) {
        if (isSwitchEndpoint(network, link, side.getOpposite())) {
            return 0;
        }
        return side == LinkSide.SOURCE ? 0 : 1;
    }

    /**
     * Index of the endpoint device in the device container of the link, which always lists the source first.
     */
    public static int getDeviceSlot(LinkSide side) {
        return side == LinkSide.SOURCE ? 0 : 1;
    }

    /**
     * The /24 of the first configured address on the link, source side first, ignoring switch ports.
     */
    public static Optional<String> getConfiguredSubnet(Network network, Link link) {
        for (LinkSide side : LinkSide.values()) {
            if (isAddressable(network, link, side)) {
                Optional<String> address = getEndpointAddress(network, link, side);
                if (address.isPresent()) {
                    return Optional.of(Ipv4Addresses.subnet24(address.get()));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * The non-switch endpoints attached to a switch, in link order. Switch to switch and dangling links are left out.
     */
    public static List<SegmentMember> getSwitchSegmentMembers(Network network, String switchId) {
        List<SegmentMember> members = new ArrayList<>();
        for (Link link : network.getLinks()) {
            if (!link.touches(switchId) || link.getChannel() == ChannelKind.WIFI
                    || isDangling(network, link) || isSwitchToSwitch(network, link)) {
                continue;
            }
            LinkEndpoint other = link.getEndpoint(link.getSide(switchId).getOpposite());
            members.add(new SegmentMember(other.nodeId(), other.portId(), link.getId()));
        }
        return members;
    }

    /**
     * The nodes reached through wifi links, each represented by its endpoint on the first such link.
     */
    public static List<SegmentMember> getWirelessSegmentMembers(Network network) {
        Map<String, SegmentMember> membersByNode = new LinkedHashMap<>();
        for (Link link : network.getLinks()) {
            if (link.getChannel() != ChannelKind.WIFI || isDangling(network, link)) {
                continue;
            }
            for (LinkSide side : LinkSide.values()) {
                LinkEndpoint endpoint = link.getEndpoint(side);
                membersByNode.putIfAbsent(endpoint.nodeId(), new SegmentMember(endpoint.nodeId(), endpoint.portId(), link.getId()));
            }
        }
        return new ArrayList<>(membersByNode.values());
    }

    public static Optional<Port> getMemberPort(Network network, SegmentMember member) {
        Node node = network.getNode(member.nodeId());
        return node != null ? node.getPort(member.portId()) : Optional.empty();
    }

    /**
     * The /24 of the first configured member address, otherwise the subnet base of the switch, otherwise a
     * synthesized subnet.
     */
    public static String chooseSegmentSubnet(Network network, Node anchor, List<SegmentMember> members,
                                             SubnetAllocator allocator) {
        for (SegmentMember member : members) {
            Optional<String> address = getMemberPort(network, member).filter(Port::hasIpAddress).map(Port::getIpAddress);
            if (address.isPresent()) {
                return Ipv4Addresses.subnet24(address.get());
            }
        }
        if (anchor != null && anchor.getSubnetBase() != null) {
            return Ipv4Addresses.subnet24(anchor.getSubnetBase());
        }
        return allocator.nextSubnet();
    }

    /**
     * Gives every unaddressed member the next free host address of the subnet.
     */
    public static void assignSegment(Network network, String subnet, List<SegmentMember> members, SubnetAllocator allocator) {
        for (SegmentMember member : members) {
            getMemberPort(network, member)
                    .filter(port -> !port.hasIpAddress())
                    .ifPresent(port -> port.setAddress(allocator.nextHost(subnet), allocator.getParameters().getNetmask()));
        }
    }

    /**
     * Addresses both endpoints of a link that touches no switch, and returns the subnet used.
     */
    public static String assignPointToPoint(Network network, Link link, SubnetAllocator allocator) {
        String subnet = getConfiguredSubnet(network, link).orElseGet(allocator::nextSubnet);
        for (LinkSide side : LinkSide.values()) {
            getEndpointPort(network, link, side)
                    .filter(port -> !port.hasIpAddress())
                    .ifPresent(port -> port.setAddress(allocator.nextHost(subnet), allocator.getParameters().getNetmask()));
        }
        return subnet;
    }

    /**
     * Reserves every address already configured on a non-switch port of the network, then the subnet of every
     * switch subnet base. Returns the switches whose subnet base was already taken by another switch.
     */
    public static List<Node> reserveConfiguredAddresses(Network network, SubnetAllocator allocator) {
        for (Node node : network.getNodes()) {
            if (node.isSwitch()) {
                continue;
            }
            for (Port port : node.getPorts()) {
                if (port.hasIpAddress()) {
                    allocator.reserveAddress(port.getIpAddress());
                }
            }
        }
        Set<String> baseSubnets = new HashSet<>();
        List<Node> collisions = new ArrayList<>();
        for (Node node : network.getNodes()) {
            if (node.isSwitch() && node.getSubnetBase() != null) {
                String subnet = Ipv4Addresses.subnet24(node.getSubnetBase());
                allocator.reserveSubnet(subnet);
                if (!baseSubnets.add(subnet)) {
                    collisions.add(node);
                }
            }
        }
        return collisions;
    }
}
