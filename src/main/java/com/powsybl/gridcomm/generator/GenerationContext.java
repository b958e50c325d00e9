/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.generator;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridcomm.address.AddressPolicy;
import com.powsybl.gridcomm.address.AddressResolution;
import com.powsybl.gridcomm.address.Segment;
import com.powsybl.gridcomm.address.SegmentMember;
import com.powsybl.gridcomm.network.*;
import com.powsybl.gridcomm.simulation.SimulationConfig;

import java.util.*;

/**
 * State of one script generation: the resolved network and the index tables every section refers to.
 * <p>
 * Node slots follow node insertion order. Device groups number the wired links that are carried by a channel, in
 * link order; wifi links and dangling links have no device group. The wireless segment members are numbered in
 * the wifi node container. A context belongs to a single generation call.
 */
public class GenerationContext {

    static final String WIFI_INTERFACE_KEY = "wifi";

    private final Network network;

    private final SimulationConfig config;

    private final GenerationParameters parameters;

    private final AddressResolution resolution;

    private final Map<String, Integer> nodeSlots = new LinkedHashMap<>();

    private final Map<String, Integer> deviceGroups = new LinkedHashMap<>();

    private final Map<String, Transport> transports = new HashMap<>();

    private final Map<String, Integer> wifiSlots = new LinkedHashMap<>();

    private final Map<String, List<String>> interfaceKeysByNode = new HashMap<>();

    private final ReportNode reportNode;

    public GenerationContext(Network network, SimulationConfig config, GenerationParameters parameters,
                             AddressResolution resolution, ReportNode reportNode) {
        this.network = Objects.requireNonNull(network);
        this.config = Objects.requireNonNull(config);
        this.parameters = Objects.requireNonNull(parameters);
        this.resolution = Objects.requireNonNull(resolution);
        this.reportNode = Objects.requireNonNull(reportNode);
        buildIndexTables();
    }

    private void buildIndexTables() {
        int slot = 0;
        for (Node node : network.getNodes()) {
            nodeSlots.put(node.getId(), slot++);
        }

        int group = 0;
        for (Link link : network.getLinks()) {
            if (link.getChannel() == ChannelKind.WIFI || resolution.isSkipped(link.getId())) {
                continue;
            }
            deviceGroups.put(link.getId(), group++);
            transports.put(link.getId(), Transport.of(network, link));
            for (LinkSide side : LinkSide.values()) {
                if (AddressPolicy.isAddressable(network, link, side)) {
                    interfaceKeysByNode.computeIfAbsent(link.getEndpoint(side).nodeId(), k -> new ArrayList<>())
                            .add(link.getId());
                }
            }
        }

        resolution.getWirelessSegment().ifPresent(segment -> {
            int wifiSlot = 0;
            for (SegmentMember member : segment.members()) {
                wifiSlots.put(member.nodeId(), wifiSlot++);
                interfaceKeysByNode.computeIfAbsent(member.nodeId(), k -> new ArrayList<>()).add(WIFI_INTERFACE_KEY);
            }
        });
    }

    public Network getNetwork() {
        return network;
    }

    public SimulationConfig getConfig() {
        return config;
    }

    public GenerationParameters getParameters() {
        return parameters;
    }

    public AddressResolution getResolution() {
        return resolution;
    }

    public int getNodeSlot(String nodeId) {
        Integer slot = nodeSlots.get(nodeId);
        if (slot == null) {
            throw new IllegalArgumentException("Node '" + nodeId + "' has no slot");
        }
        return slot;
    }

    public boolean hasNode(String nodeId) {
        return nodeSlots.containsKey(nodeId);
    }

    public int getNodeCount() {
        return nodeSlots.size();
    }

    /**
     * Wired links carried by a channel, in device group order.
     */
    public List<Link> getChannelLinks() {
        List<Link> links = new ArrayList<>(deviceGroups.size());
        for (String linkId : deviceGroups.keySet()) {
            links.add(network.getLink(linkId));
        }
        return links;
    }

    public OptionalInt getDeviceGroup(String linkId) {
        Integer group = deviceGroups.get(linkId);
        return group != null ? OptionalInt.of(group) : OptionalInt.empty();
    }

    public Transport getTransport(String linkId) {
        return transports.get(linkId);
    }

    public boolean usesTransport(Transport transport) {
        return transports.containsValue(transport);
    }

    public Map<String, Integer> getWifiSlots() {
        return Collections.unmodifiableMap(wifiSlots);
    }

    public boolean hasWifi() {
        return !wifiSlots.isEmpty();
    }

    /**
     * Ipv4 interface index of the node on a link, the loopback being interface 0.
     *
     * @param interfaceKey a link id, or the wifi key
     */
    public OptionalInt getInterfaceIndex(String nodeId, String interfaceKey) {
        int index = interfaceKeysByNode.getOrDefault(nodeId, List.of()).indexOf(interfaceKey);
        return index >= 0 ? OptionalInt.of(index + 1) : OptionalInt.empty();
    }

    /**
     * Interface keys of a node in address assignment order.
     */
    public List<String> getInterfaceKeys(String nodeId) {
        return interfaceKeysByNode.getOrDefault(nodeId, List.of());
    }

    /**
     * The first address of a node the script can refer to: on its first wired link with an addressed endpoint on the
     * node side, otherwise in the wireless segment.
     */
    public Optional<TargetAddress> getTargetAddress(String nodeId) {
        for (Map.Entry<String, Integer> e : deviceGroups.entrySet()) {
            Link link = network.getLink(e.getKey());
            if (!link.touches(nodeId)) {
                continue;
            }
            LinkSide side = link.getSide(nodeId);
            if (!AddressPolicy.isAddressable(network, link, side)) {
                continue;
            }
            Optional<String> address = AddressPolicy.getEndpointAddress(network, link, side);
            if (address.isPresent()) {
                return Optional.of(new TargetAddress("interfaces" + e.getValue(),
                        AddressPolicy.getInterfaceSlot(network, link, side), address.get()));
            }
        }
        Integer wifiSlot = wifiSlots.get(nodeId);
        if (wifiSlot != null) {
            Optional<Segment> segment = resolution.getWirelessSegment();
            Optional<String> address = segment.flatMap(s -> s.members().stream()
                            .filter(m -> m.nodeId().equals(nodeId))
                            .findFirst())
                    .flatMap(m -> AddressPolicy.getMemberPort(network, m))
                    .filter(Port::hasIpAddress)
                    .map(Port::getIpAddress);
            if (address.isPresent()) {
                return Optional.of(new TargetAddress("wifi_interfaces", wifiSlot, address.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * Section every anomaly of this generation is reported under, address resolution included.
     */
    public ReportNode getReportNode() {
        return reportNode;
    }
}
