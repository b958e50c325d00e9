/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.converter;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridcomm.address.AddressPolicy;
import com.powsybl.gridcomm.address.SegmentMember;
import com.powsybl.gridcomm.address.SubnetAllocator;
import com.powsybl.gridcomm.extractor.*;
import com.powsybl.gridcomm.network.*;
import com.powsybl.gridcomm.simulation.TrafficApplication;
import com.powsybl.gridcomm.simulation.TrafficFlow;
import com.powsybl.gridcomm.util.Ipv4Addresses;
import com.powsybl.gridcomm.util.Markers;
import com.powsybl.gridcomm.util.Reports;
import org.apache.commons.lang3.StringUtils;
import org.jgrapht.Graph;
import org.jgrapht.graph.Pseudograph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Turns an extraction result into a valid network.
 * <p>
 * Shared medium segments with more than two members are drawn through a switch: an existing switch endpoint when the
 * segment has one, otherwise a virtual one. A shared medium link between two switches is kept as a bridged trunk.
 * Other links become direct links. The network is then laid out and its
 * ports are addressed with the same subnet policy as the address resolver. Identifiers come from counters local to
 * one conversion, so converting the same extraction twice gives the same network.
 */
public class TopologyConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TopologyConverter.class);

    public static final String INFERRED_ROLE_PROPERTY = "inferredRole";

    static final String DIRECT_DATA_RATE = "1Gbps";

    static final String SHARED_MEDIUM_DATA_RATE = "100Mbps";

    static final String LINK_DELAY = "1ms";

    private static final double CIRCLE_MIN_RADIUS = 100;

    private static final double SWITCH_OFFSET = 80;

    private static final String ISSUE_SOURCE = "parser";

    private static final String SEGMENT_PREFIX = "csma_";

    private static final String HUB_PREFIX = "csma_hub_";

    private final ConverterParameters parameters;

    public TopologyConverter() {
        this(new ConverterParameters());
    }

    public TopologyConverter(ConverterParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    /**
     * State of one conversion.
     */
    private static final class Conversion {

        private final Network network;
        private final ReportNode reportNode;
        private final Map<NodeKey, String> nodeIds = new HashMap<>();
        private final Map<String, String> hubIds = new HashMap<>();
        private int nodeCounter = 0;
        private int linkCounter = 0;
        private int flowCounter = 0;

        private Conversion(Network network, ReportNode reportNode) {
            this.network = network;
            this.reportNode = reportNode;
        }

        private String newNodeId() {
            return "n" + ++nodeCounter;
        }

        private String newLinkId() {
            return "l" + ++linkCounter;
        }

        private String newFlowId() {
            return "f" + ++flowCounter;
        }
    }

    public Network convert(ExtractionResult extraction) {
        return convert(extraction, Reports.createRootReportNode());
    }

    public Network convert(ExtractionResult extraction, ReportNode reportNode) {
        Objects.requireNonNull(extraction);
        Objects.requireNonNull(reportNode);
        Stopwatch stopwatch = Stopwatch.createStarted();

        String networkId = StringUtils.defaultIfEmpty(extraction.getScriptName(), "imported");
        Network network = new Network(networkId).setAutoAddressing(false);
        Conversion conversion = new Conversion(network, Reports.createConversionReportNode(reportNode, networkId));
        copySideChannels(extraction, network);

        List<ExtractedNode> nodes = deduplicateNodes(extraction);
        Map<NodeKey, ExtractedNode> nodesByKey = new LinkedHashMap<>();
        nodes.forEach(node -> nodesByKey.put(node.getKey(), node));
        List<ExtractedLink> links = validLinks(extraction, nodesByKey, network);

        Map<String, List<NodeKey>> segments = new LinkedHashMap<>();
        Map<String, NodeKey> segmentSwitches = new HashMap<>();
        identifySharedMediumSegments(links, nodesByKey, segments, segmentSwitches);

        for (ExtractedNode node : nodes) {
            createNode(conversion, node);
        }
        createSegmentHubs(conversion, segments, segmentSwitches);

        applyLayout(network);

        for (ExtractedLink link : links) {
            if (link.medium() == ChannelMedium.CSMA) {
                createSharedMediumLinks(conversion, link);
            } else {
                createDirectLink(conversion, link, toChannel(link.medium(), network), DIRECT_DATA_RATE);
            }
        }

        inferRoles(network);
        backfillAddresses(conversion);
        convertApplications(conversion, extraction);

        stopwatch.stop();
        LOGGER.info(Markers.PERFORMANCE_MARKER, "Extraction of {} converted in {} ms: {} nodes, {} links, {} flows",
                extraction.getScriptName(), stopwatch.elapsed(TimeUnit.MILLISECONDS), network.getNodeCount(),
                network.getLinkCount(), network.getTrafficFlows().size());
        return network;
    }

    private static void copySideChannels(ExtractionResult extraction, Network network) {
        Map<String, String> metadata = network.getMetadata();
        metadata.put("source_file", extraction.getSourceFile());
        metadata.put("script_name", extraction.getScriptName());
        metadata.put("module_name", extraction.getModuleName());
        metadata.put("description", extraction.getDescription());
        metadata.put("original_duration", Double.toString(extraction.getDuration()));
        for (ReportNode warning : extraction.getWarnings()) {
            network.addWarning(new NetworkIssue("parser_warning", ISSUE_SOURCE, warning.getMessage()));
        }
        for (ReportNode error : extraction.getErrors()) {
            network.addTodo(new NetworkIssue("parse_error", ISSUE_SOURCE, error.getMessage()));
        }
        if (extraction.getDuration() > 0) {
            network.setSimulationDuration(extraction.getDuration());
        }
    }

    private static List<ExtractedNode> deduplicateNodes(ExtractionResult extraction) {
        Set<NodeKey> keys = new HashSet<>();
        List<ExtractedNode> nodes = new ArrayList<>();
        for (ExtractedNode node : extraction.getNodes()) {
            if (keys.add(node.getKey())) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    private static List<ExtractedLink> validLinks(ExtractionResult extraction, Map<NodeKey, ExtractedNode> nodesByKey,
                                                  Network network) {
        List<ExtractedLink> links = new ArrayList<>();
        for (ExtractedLink link : extraction.getLinks()) {
            if (!nodesByKey.containsKey(link.source()) || !nodesByKey.containsKey(link.target())) {
                LOGGER.warn("Link {} - {} references an unknown node, dropped", link.source(), link.target());
                network.addWarning(new NetworkIssue("unknown_node", "converter",
                        "Link " + link.source() + " - " + link.target() + " references an unknown node and is dropped"));
            } else if (link.source().equals(link.target())) {
                network.addWarning(new NetworkIssue("self_link", "converter",
                        "Link of node " + link.source() + " to itself is dropped"));
            } else {
                links.add(link);
            }
        }
        return links;
    }

    /**
     * Groups the non-switch endpoints of shared medium links by segment. A segment is keyed {@code csma_<container>},
     * after the switch container when one endpoint is a switch, and after the source container otherwise.
     */
    private static void identifySharedMediumSegments(List<ExtractedLink> links, Map<NodeKey, ExtractedNode> nodesByKey,
                                                     Map<String, List<NodeKey>> segments,
                                                     Map<String, NodeKey> segmentSwitches) {
        for (ExtractedLink link : links) {
            if (link.medium() != ChannelMedium.CSMA) {
                continue;
            }
            boolean sourceIsSwitch = nodesByKey.get(link.source()).getRole() == NodeRole.SWITCH;
            boolean targetIsSwitch = nodesByKey.get(link.target()).getRole() == NodeRole.SWITCH;
            String segment = segmentOf(link, targetIsSwitch);
            if (targetIsSwitch) {
                segmentSwitches.put(segment, link.target());
            } else if (sourceIsSwitch) {
                segmentSwitches.put(segment, link.source());
            }
            List<NodeKey> members = segments.computeIfAbsent(segment, k -> new ArrayList<>());
            if (!sourceIsSwitch && !members.contains(link.source())) {
                members.add(link.source());
            }
            if (!targetIsSwitch && !members.contains(link.target())) {
                members.add(link.target());
            }
        }
    }

    private static String segmentOf(ExtractedLink link, boolean targetIsSwitch) {
        return SEGMENT_PREFIX + (targetIsSwitch ? link.target().container() : link.source().container());
    }

    private static void createNode(Conversion conversion, ExtractedNode extracted) {
        NodeKind kind = switch (extracted.getRole()) {
            case ROUTER, ACCESS_POINT -> NodeKind.ROUTER;
            case SWITCH -> NodeKind.SWITCH;
            case HOST, UNKNOWN -> NodeKind.HOST;
        };
        MediumType medium = switch (extracted.getMediumHint()) {
            case WIRED -> MediumType.WIRED;
            case WIFI_STATION -> MediumType.WIFI_STATION;
            case WIFI_AP -> MediumType.WIFI_AP;
            case LTE_UE -> MediumType.LTE_UE;
            case LTE_ENB -> MediumType.LTE_ENB;
        };
        Node node = new Node(conversion.newNodeId(), extracted.getContainer() + "_" + extracted.getIndex(), kind)
                .setMedium(medium)
                .setDescription("From container '" + extracted.getContainer() + "' index " + extracted.getIndex());
        if (!extracted.getInferredRole().isEmpty()) {
            node.setProperty(INFERRED_ROLE_PROPERTY, extracted.getInferredRole());
        }
        conversion.network.addNode(node);
        conversion.nodeIds.put(extracted.getKey(), node.getId());
    }

    private void createSegmentHubs(Conversion conversion, Map<String, List<NodeKey>> segments,
                                   Map<String, NodeKey> segmentSwitches) {
        segments.forEach((segment, members) -> {
            NodeKey switchKey = segmentSwitches.get(segment);
            if (switchKey != null && conversion.nodeIds.containsKey(switchKey)) {
                conversion.hubIds.put(segment, conversion.nodeIds.get(switchKey));
            } else if (members.size() > parameters.getVirtualSwitchMemberThreshold()) {
                Node hub = new Node(conversion.newNodeId(), HUB_PREFIX + segment, NodeKind.SWITCH)
                        .setDescription("Virtual hub of the shared medium segment '" + segment + "'");
                conversion.network.addNode(hub);
                conversion.hubIds.put(segment, hub.getId());
                LOGGER.debug("Virtual hub {} created for {} members of segment {}", hub.getId(), members.size(), segment);
            }
        });
    }

    private static Port availablePort(Node node) {
        List<Port> available = node.getAvailablePorts();
        return available.isEmpty() ? node.addPort(PortType.GIGABIT_ETHERNET) : available.get(0);
    }

    private static Link connect(Conversion conversion, Node source, Node target, ChannelKind channel, String dataRate,
                                String delay) {
        Port sourcePort = availablePort(source);
        Port targetPort = availablePort(target);
        Link link = new Link(conversion.newLinkId(), new LinkEndpoint(source.getId(), sourcePort.getId()),
                new LinkEndpoint(target.getId(), targetPort.getId()))
                .setChannel(channel)
                .setDataRate(dataRate)
                .setDelay(delay);
        return conversion.network.addLink(link);
    }

    private static void createDirectLink(Conversion conversion, ExtractedLink extracted, ChannelKind channel,
                                         String defaultDataRate) {
        Node source = conversion.network.getNodeOrThrow(conversion.nodeIds.get(extracted.source()));
        Node target = conversion.network.getNodeOrThrow(conversion.nodeIds.get(extracted.target()));
        connect(conversion, source, target, channel, StringUtils.defaultIfEmpty(extracted.dataRate(), defaultDataRate),
                StringUtils.defaultIfEmpty(extracted.delay(), LINK_DELAY));
    }

    private static void createSharedMediumLinks(Conversion conversion, ExtractedLink extracted) {
        Network network = conversion.network;
        Node source = network.getNodeOrThrow(conversion.nodeIds.get(extracted.source()));
        Node target = network.getNodeOrThrow(conversion.nodeIds.get(extracted.target()));
        if (source.isSwitch() && target.isSwitch()) {
            createSwitchTrunkLink(conversion, extracted, source, target);
            return;
        }
        String segment = segmentOf(extracted, target.isSwitch());
        String hubId = conversion.hubIds.get(segment);
        if (hubId == null) {
            createDirectLink(conversion, extracted, ChannelKind.CSMA, SHARED_MEDIUM_DATA_RATE);
            return;
        }
        Node hub = network.getNodeOrThrow(hubId);
        for (Node member : List.of(source, target)) {
            if (member.isSwitch() || isConnected(network, member.getId(), hubId)) {
                continue;
            }
            connect(conversion, member, hub, ChannelKind.CSMA,
                    StringUtils.defaultIfEmpty(extracted.dataRate(), SHARED_MEDIUM_DATA_RATE),
                    StringUtils.defaultIfEmpty(extracted.delay(), LINK_DELAY));
        }
    }

    /**
     * Both switches bridge the trunk, it carries no address.
     */
    private static void createSwitchTrunkLink(Conversion conversion, ExtractedLink extracted, Node source, Node target) {
        if (isConnected(conversion.network, source.getId(), target.getId())) {
            return;
        }
        createDirectLink(conversion, extracted, ChannelKind.CSMA, SHARED_MEDIUM_DATA_RATE);
        LOGGER.debug("Switches {} and {} linked by a trunk", source.getName(), target.getName());
        Reports.reportSwitchTrunkLink(conversion.reportNode, source.getName(), target.getName());
    }

    private static boolean isConnected(Network network, String nodeId, String otherNodeId) {
        return network.getLinksOf(nodeId).stream().anyMatch(link -> link.getOtherNodeId(nodeId).equals(otherNodeId));
    }

    private static ChannelKind toChannel(ChannelMedium medium, Network network) {
        if (medium == ChannelMedium.POINT_TO_POINT) {
            return ChannelKind.POINT_TO_POINT;
        }
        network.addTodo(new NetworkIssue("unsupported_link_type", "converter",
                "Link type '" + medium.getLabel() + "' is not yet supported, using point-to-point as fallback"));
        return ChannelKind.POINT_TO_POINT;
    }

    // layout

    private void applyLayout(Network network) {
        List<Node> switches = new ArrayList<>();
        List<Node> others = new ArrayList<>();
        for (Node node : network.getNodes()) {
            (node.isSwitch() ? switches : others).add(node);
        }
        if (others.size() <= parameters.getLineLayoutThreshold()) {
            layoutLine(others);
        } else {
            layoutCircle(others);
        }
        if (!switches.isEmpty()) {
            layoutCenter(switches, others);
        }
    }

    private void layoutLine(List<Node> nodes) {
        double startX = -(nodes.size() - 1) * parameters.getNodeSpacing() / 2;
        for (int i = 0; i < nodes.size(); i++) {
            nodes.get(i).setPosition(new Position(startX + i * parameters.getNodeSpacing(), 0));
        }
    }

    private void layoutCircle(List<Node> nodes) {
        int n = nodes.size();
        double radius = Math.max(CIRCLE_MIN_RADIUS, n * parameters.getNodeSpacing() / (2 * Math.PI));
        for (int i = 0; i < n; i++) {
            // first node on top
            double angle = 2 * Math.PI * i / n - Math.PI / 2;
            nodes.get(i).setPosition(new Position(radius * Math.cos(angle), radius * Math.sin(angle)));
        }
    }

    private void layoutCenter(List<Node> switches, List<Node> others) {
        if (others.isEmpty()) {
            layoutLine(switches);
            return;
        }
        double cx = others.stream().mapToDouble(node -> node.getPosition().x()).average().orElse(0);
        double cy = others.stream().mapToDouble(node -> node.getPosition().y()).average().orElse(0);
        int n = switches.size();
        for (int i = 0; i < n; i++) {
            switches.get(i).setPosition(new Position(cx + (i - (n - 1) / 2.0) * SWITCH_OFFSET, cy));
        }
    }

    // roles and addresses

    /**
     * Records on every node a role guessed from its degree in the converted network. Nothing else reads it.
     */
    private static void inferRoles(Network network) {
        Graph<String, String> graph = new Pseudograph<>(String.class);
        network.getNodes().forEach(node -> graph.addVertex(node.getId()));
        network.getLinks().forEach(link -> graph.addEdge(link.getSourceNodeId(), link.getTargetNodeId(), link.getId()));
        for (Node node : network.getNodes()) {
            int degree = graph.degreeOf(node.getId());
            String role;
            if (node.isSwitch()) {
                role = "switch";
            } else if (degree > 2) {
                role = "router";
            } else if (degree == 0) {
                role = "isolated";
            } else {
                role = node.hasProperty(INFERRED_ROLE_PROPERTY) ? node.getProperty(INFERRED_ROLE_PROPERTY) : "host";
            }
            node.setProperty(INFERRED_ROLE_PROPERTY, role);
        }
    }

    /**
     * Addresses every port left without an address: one subnet per switch segment, then one per remaining link.
     */
    private void backfillAddresses(Conversion conversion) {
        Network network = conversion.network;
        SubnetAllocator allocator = new SubnetAllocator(parameters.getAddressingParameters());
        for (Node collision : AddressPolicy.reserveConfiguredAddresses(network, allocator)) {
            Reports.reportSubnetCollision(conversion.reportNode, Ipv4Addresses.subnet24(collision.getSubnetBase()),
                    collision.getId());
        }
        for (Node node : network.getNodes()) {
            if (!node.isSwitch()) {
                continue;
            }
            List<SegmentMember> members = AddressPolicy.getSwitchSegmentMembers(network, node.getId());
            if (!members.isEmpty()) {
                String subnet = AddressPolicy.chooseSegmentSubnet(network, node, members, allocator);
                AddressPolicy.assignSegment(network, subnet, members, allocator);
            }
        }
        for (Link link : network.getLinks()) {
            if (!AddressPolicy.touchesSwitch(network, link) && !AddressPolicy.isDangling(network, link)) {
                AddressPolicy.assignPointToPoint(network, link, allocator);
            }
        }
    }

    // applications

    private static void convertApplications(Conversion conversion, ExtractionResult extraction) {
        Network network = conversion.network;
        for (ExtractedApplication application : extraction.getApplications()) {
            String nodeId = conversion.nodeIds.get(application.getNode());
            if (nodeId == null) {
                network.addWarning(new NetworkIssue("unknown_node", "converter",
                        "Application " + application + " is installed on an unknown node and is dropped"));
                continue;
            }
            if (application.isServer()) {
                network.getNodeOrThrow(nodeId).setServer(true);
                continue;
            }
            String targetId = findNodeByAddress(conversion, extraction, application.getRemoteAddress()).orElse("");
            if (targetId.isEmpty()) {
                network.addWarning(new NetworkIssue("unresolved_flow_target", "converter",
                        "Target of application " + application + " at '" + application.getRemoteAddress() + "' not found"));
            }
            TrafficApplication trafficApplication = switch (application.getKind()) {
                case BULK_SEND -> TrafficApplication.BULK_SEND;
                case UDP_ECHO_CLIENT -> TrafficApplication.ECHO;
                default -> TrafficApplication.ONOFF;
            };
            TrafficFlow flow = new TrafficFlow(conversion.newFlowId(), nodeId, targetId)
                    .setName(application.getKind().getLabel() + "_" + application.getNode().container() + "_"
                            + application.getNode().index())
                    .setProtocol(application.getProtocol())
                    .setApplication(trafficApplication)
                    .setPort(application.getPort())
                    .setStartTime(application.getStartTime())
                    .setStopTime(application.getStopTime() > 0 ? application.getStopTime() : network.getSimulationDuration())
                    .setDataRate(StringUtils.defaultIfEmpty(application.getDataRate(), TrafficFlow.DATA_RATE_DEFAULT_VALUE))
                    .setPacketSize(application.getPacketSize() > 0 ? application.getPacketSize() : TrafficFlow.PACKET_SIZE_DEFAULT_VALUE);
            if (!application.getRemoteAddress().isEmpty()) {
                flow.setDestinationAddress(application.getRemoteAddress());
            }
            network.addTrafficFlow(flow);
        }
    }

    /**
     * Finds the node an address helper gave the address to. The helper numbers the devices of the assigned container
     * from host 1, in the order the install call created them.
     */
    private static Optional<String> findNodeByAddress(Conversion conversion, ExtractionResult extraction, String address) {
        if (!Ipv4Addresses.isValid(address) || address.equals(Ipv4Addresses.ANY)) {
            return Optional.empty();
        }
        int hostNumber = Ipv4Addresses.hostOctet(address);
        for (ExtractedAddressAssignment assignment : extraction.getAddressAssignments()) {
            if (!Ipv4Addresses.isValid(assignment.base())
                    || !Ipv4Addresses.subnet24(assignment.base()).equals(Ipv4Addresses.subnet24(address))) {
                continue;
            }
            List<NodeKey> devices = devicesOf(extraction, assignment.deviceContainer());
            NodeKey key = null;
            if (hostNumber >= 1 && hostNumber <= devices.size()) {
                key = devices.get(hostNumber - 1);
            } else if (devices.isEmpty()) {
                key = extraction.getNodes().stream()
                        .map(ExtractedNode::getKey)
                        .filter(k -> k.index() == hostNumber - 1)
                        .filter(k -> assignment.deviceContainer().equals(k.container()))
                        .findFirst()
                        .orElse(null);
            }
            if (key != null && conversion.nodeIds.containsKey(key)) {
                return Optional.of(conversion.nodeIds.get(key));
            }
        }
        return Optional.empty();
    }

    private static List<NodeKey> devicesOf(ExtractionResult extraction, String deviceContainer) {
        List<NodeKey> devices = new ArrayList<>();
        for (ExtractedLink link : extraction.getLinks()) {
            if (link.deviceContainer().equals(deviceContainer)) {
                for (NodeKey key : List.of(link.source(), link.target())) {
                    if (!devices.contains(key)) {
                        devices.add(key);
                    }
                }
            }
        }
        return devices;
    }
}
