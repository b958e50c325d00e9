/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.generator;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridcomm.address.AddressPolicy;
import com.powsybl.gridcomm.address.AddressResolution;
import com.powsybl.gridcomm.address.AddressResolver;
import com.powsybl.gridcomm.address.Segment;
import com.powsybl.gridcomm.address.SegmentMember;
import com.powsybl.gridcomm.failure.FailureEvent;
import com.powsybl.gridcomm.failure.FailureScenario;
import com.powsybl.gridcomm.network.*;
import com.powsybl.gridcomm.network.grid.ErrorModel;
import com.powsybl.gridcomm.network.grid.GridLink;
import com.powsybl.gridcomm.network.grid.GridLinkType;
import com.powsybl.gridcomm.network.grid.GridNode;
import com.powsybl.gridcomm.simulation.SimulationConfig;
import com.powsybl.gridcomm.util.Ipv4Addresses;
import com.powsybl.gridcomm.util.Markers;
import com.powsybl.gridcomm.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

import static com.powsybl.gridcomm.generator.PythonLiterals.number;
import static com.powsybl.gridcomm.generator.PythonLiterals.string;

/**
 * Compiles a network into a self-contained ns-3 Python script.
 * <p>
 * The network is copied and its addresses resolved on the copy, so generation never modifies its input. Sections are
 * written in a fixed order: nodes, channels and bridges, internet stack, addresses, routing, applications, failure
 * scenario, tracing and run. Anomalies never abort the generation: the faulty element is skipped and reported under
 * the report node returned with the script.
 */
public class ScriptGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptGenerator.class);

    private final GenerationParameters parameters;

    private final ApplicationSectionWriter applicationWriter = new ApplicationSectionWriter();

    public ScriptGenerator() {
        this(new GenerationParameters());
    }

    public ScriptGenerator(GenerationParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public GenerationParameters getParameters() {
        return parameters;
    }

    public GenerationResult generate(Network network) {
        return generate(network, new SimulationConfig().setDuration(network.getSimulationDuration()));
    }

    public GenerationResult generate(Network network, SimulationConfig config) {
        return generate(network, config, network.getFailureScenario().orElse(null));
    }

    /**
     * @param failureScenario the failure scenario to list in the script, may be null
     */
    public GenerationResult generate(Network network, SimulationConfig config, FailureScenario failureScenario) {
        return generate(network, config, failureScenario, Reports.createRootReportNode());
    }

    /**
     * @param failureScenario the failure scenario to list in the script, may be null
     * @param reportNode      the node the generation section is added to
     */
    public GenerationResult generate(Network network, SimulationConfig config, FailureScenario failureScenario,
                                     ReportNode reportNode) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(config);
        Objects.requireNonNull(reportNode);
        Stopwatch stopwatch = Stopwatch.createStarted();

        ReportNode generationReportNode = Reports.createScriptGenerationReportNode(reportNode, network.getId());
        Network resolved = network.copy();
        AddressResolution resolution = new AddressResolver(parameters.getAddressingParameters())
                .resolve(resolved, generationReportNode);
        GenerationContext context = new GenerationContext(resolved, config, parameters, resolution, generationReportNode);
        Map<Node, RoutingProtocol> protocols = getRoutingProtocols(context);

        ScriptWriter writer = new ScriptWriter();
        writeHeader(context, failureScenario, writer);
        writeNodes(context, writer);
        writeChannels(context, writer);
        writeInternetStack(context, protocols, writer);
        writeAddresses(context, writer);
        writeRouting(context, protocols, writer);
        applicationWriter.write(context, writer);
        writeFailureScenario(failureScenario, writer);
        writeTracing(context, writer);
        writeRun(context, writer);
        writeFooter(context, writer);

        stopwatch.stop();
        GenerationResult result = new GenerationResult(writer.toString(), generationReportNode);
        LOGGER.info(Markers.PERFORMANCE_MARKER, "Script of network {} generated in {} ms ({} diagnostics)",
                network.getId(), stopwatch.elapsed(TimeUnit.MILLISECONDS), result.getDiagnostics().size());
        return result;
    }

    private static String docstringText(String text) {
        return PythonLiterals.comment(text).replace("\\", "/").replace("\"", "'");
    }

    private static void writeHeader(GenerationContext context, FailureScenario failureScenario, ScriptWriter writer) {
        Network network = context.getNetwork();
        long gridNodeCount = network.getNodes().stream().filter(GridNode.class::isInstance).count();
        long gridLinkCount = network.getLinks().stream().filter(GridLink.class::isInstance).count();
        writer.moduleLevel()
                .raw("#!/usr/bin/env python3")
                .raw("# -*- coding: utf-8 -*-")
                .raw("\"\"\"")
                .raw("ns-3 simulation of network " + docstringText(network.getId()))
                .raw("")
                .raw("Topology:")
                .raw("  - Nodes: " + network.getNodeCount() + " (" + gridNodeCount + " grid nodes)")
                .raw("  - Links: " + network.getLinkCount() + " (" + gridLinkCount + " grid links)")
                .raw("  - Traffic flows: " + ApplicationSectionWriter.getFlows(context).size())
                .raw("  - Duration: " + number(context.getConfig().getDuration()) + " s");
        if (failureScenario != null) {
            writer.raw("Failure scenario: " + docstringText(failureScenario.getName())
                    + " (" + failureScenario.getEventCount() + " events)");
        }
        writer.raw("\"\"\"")
                .blank()
                .raw("import sys")
                .blank()
                .raw("from ns import ns")
                .blank()
                .blank()
                .raw("def main():")
                .indent()
                .line("ns.RngSeedManager.SetSeed(%d)", context.getConfig().getRandomSeed());
    }

    private static void writeNodes(GenerationContext context, ScriptWriter writer) {
        writer.section(ScriptSection.NODES)
                .line("nodes = ns.NodeContainer()")
                .line("nodes.Create(%d)", context.getNodeCount());
        for (Node node : context.getNetwork().getNodes()) {
            String kind = node instanceof GridNode gridNode ? gridNode.getGridType().name() : node.getKind().name();
            writer.comment("Node " + context.getNodeSlot(node.getId()) + ": " + node.getName() + " (" + kind + ")");
        }
    }

    private static void writeChannels(GenerationContext context, ScriptWriter writer) {
        writer.section(ScriptSection.CHANNELS);
        Network network = context.getNetwork();
        for (Link link : context.getChannelLinks()) {
            writeChannel(context, link, writer);
        }
        for (Node node : network.getNodes()) {
            if (node.isSwitch()) {
                writeBridge(context, node, writer);
            }
        }
        if (context.hasWifi()) {
            writeWirelessSegment(context, writer);
        }
    }

    private static String getChannelDelay(GridLink link) {
        return link.getSatelliteParameters()
                .map(satellite -> formatValue(satellite.getRoundTripDelayMs()) + "ms")
                .orElse(link.getDelay());
    }

    private static String formatValue(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }

    private static void writeChannel(GenerationContext context, Link link, ScriptWriter writer) {
        Network network = context.getNetwork();
        int group = context.getDeviceGroup(link.getId()).orElseThrow();
        Transport transport = context.getTransport(link.getId());
        String helper = transport.getVariablePrefix() + group;
        String delay = link.getDelay();

        writer.blank()
                .comment("Link " + link.getId() + ": " + link.getSourceNodeId() + " <-> " + link.getTargetNodeId()
                        + " (" + link.getDataRate() + ", " + link.getDelay() + ")");
        if (link instanceof GridLink gridLink) {
            GridLinkType type = gridLink.getGridLinkType();
            if (type.isSatellite()) {
                delay = getChannelDelay(gridLink);
                writer.comment("Satellite link, round trip delay " + delay);
            } else if (type.isCellular()) {
                writer.comment("Cellular link simplified as a dedicated channel");
            } else if (type == GridLinkType.EMULATED) {
                Reports.reportUnsupportedLinkKind(context.getReportNode(), link.getId(), type.name());
            }
        }

        writer.line("%s = ns.%s()", helper, transport.getHelperClass());
        if (transport == Transport.CSMA) {
            writer.line("%s.SetChannelAttribute('DataRate', ns.StringValue(%s))", helper, string(link.getDataRate()));
        } else {
            writer.line("%s.SetDeviceAttribute('DataRate', ns.StringValue(%s))", helper, string(link.getDataRate()));
        }
        writer.line("%s.SetChannelAttribute('Delay', ns.StringValue(%s))", helper, string(delay))
                .line("link_nodes%d = ns.NodeContainer()", group)
                .line("link_nodes%d.Add(nodes.Get(%d))", group, context.getNodeSlot(link.getSourceNodeId()))
                .line("link_nodes%d.Add(nodes.Get(%d))", group, context.getNodeSlot(link.getTargetNodeId()))
                .line("devices%d = %s.Install(link_nodes%d)", group, helper, group);

        if (link instanceof GridLink gridLink) {
            gridLink.getErrorModel().ifPresent(errorModel -> writeErrorModel(group, errorModel, writer));
        }
        if (AddressPolicy.isSwitchToSwitch(network, link)) {
            writer.comment("Switch to switch link, not addressed");
        }
    }

    private static void writeErrorModel(int group, ErrorModel errorModel, ScriptWriter writer) {
        String variable = "error_model" + group;
        writer.line("%s = ns.CreateObject[ns.%s]()", variable, errorModel.kind().getSimulatorClass())
                .line("%s.SetAttribute('ErrorRate', ns.DoubleValue(%s))", variable, number(errorModel.errorRate()));
        String unit = errorModel.errorUnit();
        if (unit != null) {
            writer.line("%s.SetAttribute('ErrorUnit', ns.StringValue(%s))", variable, string(unit));
        }
        writer.line("devices%d.Get(0).SetAttribute('ReceiveErrorModel', ns.PointerValue(%s))", group, variable)
                .line("devices%d.Get(1).SetAttribute('ReceiveErrorModel', ns.PointerValue(%s))", group, variable);
    }

    private static void writeBridge(GenerationContext context, Node switchNode, ScriptWriter writer) {
        List<String> ports = new ArrayList<>();
        for (Link link : context.getChannelLinks()) {
            if (link.touches(switchNode.getId())) {
                int group = context.getDeviceGroup(link.getId()).orElseThrow();
                ports.add("devices" + group + ".Get(" + AddressPolicy.getDeviceSlot(link.getSide(switchNode.getId())) + ")");
            }
        }
        if (ports.isEmpty()) {
            return;
        }
        int slot = context.getNodeSlot(switchNode.getId());
        writer.blank()
                .comment("Switch " + switchNode.getName() + " bridges " + ports.size() + " ports")
                .line("bridge_devices%d = ns.NetDeviceContainer()", slot);
        for (String port : ports) {
            writer.line("bridge_devices%d.Add(%s)", slot, port);
        }
        writer.line("bridge%d = ns.BridgeHelper()", slot)
                .line("bridge%d.Install(nodes.Get(%d), bridge_devices%d)", slot, slot, slot);
    }

    private static void writeWirelessSegment(GenerationContext context, ScriptWriter writer) {
        Network network = context.getNetwork();
        writer.blank()
                .comment("Wireless segment of " + context.getWifiSlots().size() + " nodes")
                .line("wifi_nodes = ns.NodeContainer()");
        for (String nodeId : context.getWifiSlots().keySet()) {
            writer.line("wifi_nodes.Add(nodes.Get(%d))", context.getNodeSlot(nodeId));
        }
        writer.line("wifi = ns.WifiHelper()")
                .line("wifi.SetStandard(ns.%s)", context.getParameters().getWifiStandard())
                .line("wifi_channel = ns.YansWifiChannelHelper.Default()")
                .line("wifi_phy = ns.YansWifiPhyHelper()")
                .line("wifi_phy.SetChannel(wifi_channel.Create())")
                .line("wifi_mac = ns.WifiMacHelper()")
                .line("wifi_mac.SetType('ns3::AdhocWifiMac')")
                .line("wifi_devices = wifi.Install(wifi_phy, wifi_mac, wifi_nodes)")
                .line("wifi_positions = ns.CreateObject[ns.ListPositionAllocator]()");
        for (String nodeId : context.getWifiSlots().keySet()) {
            Position position = Optional.ofNullable(network.getNode(nodeId).getPosition()).orElse(Position.ORIGIN);
            writer.line("wifi_positions.Add(ns.Vector(%s, %s, 0.0))", number(position.x()), number(position.y()));
        }
        writer.line("mobility = ns.MobilityHelper()")
                .line("mobility.SetPositionAllocator(wifi_positions)")
                .line("mobility.SetMobilityModel('ns3::ConstantPositionMobilityModel')")
                .line("mobility.Install(wifi_nodes)");
    }

    /**
     * Routing protocol of every non-switch node, in node order. Unknown protocols fall back to static routing.
     */
    private static Map<Node, RoutingProtocol> getRoutingProtocols(GenerationContext context) {
        Map<Node, RoutingProtocol> protocols = new LinkedHashMap<>();
        for (Node node : context.getNetwork().getNodes()) {
            if (node.isSwitch()) {
                continue;
            }
            String name = node.getRoutingProtocol();
            Optional<RoutingProtocol> protocol = RoutingProtocol.fromName(name);
            if (protocol.isEmpty()) {
                LOGGER.warn("Routing protocol {} of node {} is not supported", name, node.getId());
                Reports.reportUnsupportedRoutingProtocol(context.getReportNode(), name, node.getId());
            }
            protocols.put(node, protocol.orElse(RoutingProtocol.STATIC));
        }
        return protocols;
    }

    private static List<Node> getNodesRoutedBy(Map<Node, RoutingProtocol> protocols, RoutingProtocol protocol) {
        return protocols.entrySet().stream()
                .filter(e -> e.getValue() == protocol)
                .map(Map.Entry::getKey)
                .toList();
    }

    private static void writeInternetStack(GenerationContext context, Map<Node, RoutingProtocol> protocols,
                                           ScriptWriter writer) {
        writer.section(ScriptSection.INTERNET_STACK)
                .line("stack = ns.InternetStackHelper()");
        protocols.forEach((node, protocol) -> {
            if (!protocol.isDynamic()) {
                writer.line("stack.Install(nodes.Get(%d))", context.getNodeSlot(node.getId()));
            }
        });
        for (RoutingProtocol protocol : RoutingProtocol.values()) {
            List<Node> routed = getNodesRoutedBy(protocols, protocol);
            if (protocol.isDynamic() && !routed.isEmpty()) {
                writeDynamicRoutingStack(context, protocol, routed, writer);
            }
        }
    }

    private static void writeDynamicRoutingStack(GenerationContext context, RoutingProtocol protocol, List<Node> routed,
                                                 ScriptWriter writer) {
        String prefix = protocol.getVariablePrefix();
        writer.blank()
                .comment(protocol + " stack of " + routed.size() + " nodes, static routing keeps precedence")
                .line("%s = ns.%s()", prefix, protocol.getHelperClass())
                .line("%s_static_routing = ns.Ipv4StaticRoutingHelper()", prefix)
                .line("%s_list_routing = ns.Ipv4ListRoutingHelper()", prefix)
                .line("%s_list_routing.Add(%s_static_routing, %d)", prefix, prefix, RoutingProtocol.STATIC_ROUTING_PRIORITY)
                .line("%s_list_routing.Add(%s, %d)", prefix, prefix, RoutingProtocol.DYNAMIC_ROUTING_PRIORITY)
                .line("%s_stack = ns.InternetStackHelper()", prefix)
                .line("%s_stack.SetRoutingHelper(%s_list_routing)", prefix, prefix)
                .line("%s_nodes = ns.NodeContainer()", prefix);
        for (Node node : routed) {
            writer.line("%s_nodes.Add(nodes.Get(%d))", prefix, context.getNodeSlot(node.getId()));
        }
        writer.line("%s_stack.Install(%s_nodes)", prefix, prefix);
    }

    private static void writeAddresses(GenerationContext context, ScriptWriter writer) {
        Network network = context.getNetwork();
        AddressResolution resolution = context.getResolution();
        Set<String> commentedSubnets = new HashSet<>();

        writer.section(ScriptSection.ADDRESSING)
                .line("ipv4 = ns.Ipv4AddressHelper()");
        for (Link link : context.getChannelLinks()) {
            if (AddressPolicy.isSwitchToSwitch(network, link)) {
                continue;
            }
            int group = context.getDeviceGroup(link.getId()).orElseThrow();
            resolution.getSubnet(link.getId())
                    .filter(commentedSubnets::add)
                    .ifPresent(subnet -> writer.comment("Subnet " + subnet + "/24"));
            writer.line("interfaces%d = ns.Ipv4InterfaceContainer()", group);
            for (LinkSide side : LinkSide.values()) {
                if (!AddressPolicy.isAddressable(network, link, side)) {
                    continue;
                }
                Port port = AddressPolicy.getEndpointPort(network, link, side).orElseThrow();
                writeAssign(port, "interfaces" + group,
                        "devices" + group + ".Get(" + AddressPolicy.getDeviceSlot(side) + ")", writer);
            }
        }

        resolution.getWirelessSegment().ifPresent(segment -> {
            writer.comment("Subnet " + segment.subnet() + "/24 (wireless)")
                    .line("wifi_interfaces = ns.Ipv4InterfaceContainer()");
            for (SegmentMember member : segment.members()) {
                AddressPolicy.getMemberPort(network, member).ifPresent(port -> writeAssign(port, "wifi_interfaces",
                        "wifi_devices.Get(" + context.getWifiSlots().get(member.nodeId()) + ")", writer));
            }
        });
    }

    private static void writeAssign(Port port, String container, String device, ScriptWriter writer) {
        String address = port.getIpAddress();
        String netmask = port.getNetmask();
        int prefixLength = Ipv4Addresses.netmaskToPrefix(netmask);
        String hostPart = Ipv4Addresses.fromInt(Ipv4Addresses.toInt(address) & ~Ipv4Addresses.toInt(netmask));
        writer.line("ipv4.SetBase(ns.Ipv4Address(%s), ns.Ipv4Mask(%s), ns.Ipv4Address(%s))",
                        string(Ipv4Addresses.networkOf(address, prefixLength)), string(netmask), string(hostPart))
                .line("%s.Add(ipv4.Assign(ns.NetDeviceContainer(%s)))", container, device);
    }

    private static boolean hasMultipleRoutersOnSegment(GenerationContext context) {
        Network network = context.getNetwork();
        boolean found = false;
        for (Segment segment : context.getResolution().getSegments()) {
            long routerCount = segment.members().stream()
                    .map(member -> network.getNode(member.nodeId()))
                    .filter(Node::isRouter)
                    .map(Node::getId)
                    .distinct()
                    .count();
            if (routerCount > 1) {
                Reports.reportMultipleRoutersOnSegment(context.getReportNode(), segment.getId(), (int) routerCount);
                found = true;
            }
        }
        return found;
    }

    private static void writeRouting(GenerationContext context, Map<Node, RoutingProtocol> protocols, ScriptWriter writer) {
        Network network = context.getNetwork();
        writer.section(ScriptSection.ROUTING);

        boolean dynamicRouting = false;
        for (RoutingProtocol protocol : RoutingProtocol.values()) {
            List<Node> routed = getNodesRoutedBy(protocols, protocol);
            if (protocol.isDynamic() && !routed.isEmpty()) {
                dynamicRouting = true;
                writer.comment(protocol + " routes " + String.join(", ", routed.stream().map(Node::getName).toList()));
            }
        }
        boolean globalRouting = !dynamicRouting || protocols.values().stream().anyMatch(p -> !p.isDynamic());

        List<Node> manualNodes = network.getNodes().stream()
                .filter(node -> !node.isSwitch())
                .filter(node -> node.getRoutingMode() == RoutingMode.MANUAL && !node.getRoutingTable().isEmpty())
                .toList();
        boolean multipleRouters = hasMultipleRoutersOnSegment(context);

        if (!manualNodes.isEmpty() || multipleRouters) {
            writer.line("static_routing = ns.Ipv4StaticRoutingHelper()");
        }
        for (Node node : manualNodes) {
            writeStaticRoutes(context, node, writer);
        }

        if (multipleRouters) {
            writeDefaultGateways(context, manualNodes, writer);
        } else if (globalRouting) {
            writer.line("ns.Ipv4GlobalRoutingHelper.PopulateRoutingTables()")
                    .line("print('Routing tables populated by global routing')");
        } else {
            writer.line("print('Routing tables built by dynamic routing protocols')");
        }
    }

    private static void writeStaticRoutes(GenerationContext context, Node node, ScriptWriter writer) {
        int slot = context.getNodeSlot(node.getId());
        String routing = "routing" + slot;
        writer.comment("Static routes of " + node.getName())
                .line("%s = static_routing.GetStaticRouting(nodes.Get(%d).GetObject[ns.Ipv4]())", routing, slot);
        for (RouteEntry route : node.getRoutingTable()) {
            if (!route.isEnabled()) {
                continue;
            }
            if (route.isDirect()) {
                writer.comment("Directly connected " + route.getCidr() + " installed by the stack");
                continue;
            }
            int interfaceIndex = route.getInterfaceIndex() + 1;
            if (route.isDefaultRoute()) {
                writer.line("%s.SetDefaultRoute(ns.Ipv4Address(%s), %d)", routing, string(route.getGateway()), interfaceIndex);
            } else {
                writer.line("%s.AddNetworkRouteTo(ns.Ipv4Address(%s), ns.Ipv4Mask(%s), ns.Ipv4Address(%s), %d)",
                        routing, string(route.getDestination()), string(route.getNetmask()),
                        string(route.getGateway()), interfaceIndex);
            }
        }
    }

    /**
     * Gateway of a host on one of its interfaces: the address of a router attached to the same segment or link.
     */
    private static Optional<String> findGateway(GenerationContext context, Node host, String interfaceKey) {
        Network network = context.getNetwork();
        if (GenerationContext.WIFI_INTERFACE_KEY.equals(interfaceKey)) {
            return context.getResolution().getWirelessSegment()
                    .flatMap(segment -> findRouterAddress(network, segment.members(), host.getId()));
        }
        Link link = network.getLink(interfaceKey);
        LinkSide otherSide = link.getSide(host.getId()).getOpposite();
        Node other = network.getNode(link.getEndpoint(otherSide).nodeId());
        if (other.isSwitch()) {
            return context.getResolution().getSwitchSegment(other.getId())
                    .flatMap(segment -> findRouterAddress(network, segment.members(), host.getId()));
        }
        return other.isRouter() ? AddressPolicy.getEndpointAddress(network, link, otherSide) : Optional.empty();
    }

    private static Optional<String> findRouterAddress(Network network, List<SegmentMember> members, String hostId) {
        return members.stream()
                .filter(member -> !member.nodeId().equals(hostId) && network.getNode(member.nodeId()).isRouter())
                .map(member -> AddressPolicy.getMemberPort(network, member))
                .flatMap(Optional::stream)
                .filter(Port::hasIpAddress)
                .map(Port::getIpAddress)
                .findFirst();
    }

    private static void writeDefaultGateways(GenerationContext context, List<Node> manualNodes, ScriptWriter writer) {
        for (Node node : context.getNetwork().getNodes()) {
            if (node.isSwitch() || node.isRouter() || manualNodes.contains(node)) {
                continue;
            }
            for (String interfaceKey : context.getInterfaceKeys(node.getId())) {
                Optional<String> gateway = findGateway(context, node, interfaceKey);
                if (gateway.isPresent()) {
                    int slot = context.getNodeSlot(node.getId());
                    int interfaceIndex = context.getInterfaceIndex(node.getId(), interfaceKey).orElseThrow();
                    writer.line("gateway_routing%d = static_routing.GetStaticRouting(nodes.Get(%d).GetObject[ns.Ipv4]())", slot, slot)
                            .line("gateway_routing%d.SetDefaultRoute(ns.Ipv4Address(%s), %d)", slot, string(gateway.get()), interfaceIndex);
                    break;
                }
            }
        }
    }

    private static void writeFailureScenario(FailureScenario scenario, ScriptWriter writer) {
        writer.section(ScriptSection.FAILURES);
        if (scenario == null || scenario.getEvents().isEmpty()) {
            writer.comment("No failure scenario");
            return;
        }
        writer.comment("Scenario " + scenario.getName() + ": " + scenario.getEventCount() + " events over "
                + number(scenario.getDuration()) + " s");
        List<FailureEvent> events = new ArrayList<>(scenario.getEvents());
        events.sort(Comparator.comparingDouble(FailureEvent::getTriggerTime));
        for (FailureEvent event : events) {
            String recovery = event.hasDuration() ? ", recovers at t=" + number(event.getEffectiveRecoveryTime()) + "s" : "";
            writer.comment("  t=" + number(event.getTriggerTime()) + "s " + event.getType() + " on "
                    + event.getTargetType() + " " + String.join(", ", event.getAllTargets()) + recovery);
        }
        // events are listed only, the simulator callback model cannot schedule them reliably
        writer.line("print(%s)", string("Failure scenario " + scenario.getName() + " lists "
                + scenario.getEventCount() + " events that are not injected in this run"));
    }

    private static void writeTracing(GenerationContext context, ScriptWriter writer) {
        SimulationConfig config = context.getConfig();
        String directory = context.getParameters().getOutputDirectory();
        writer.section(ScriptSection.TRACING);
        if (config.isEnableAsciiTrace() || config.isEnablePcap()) {
            if (context.usesTransport(Transport.POINT_TO_POINT)) {
                writer.line("p2p_trace = ns.PointToPointHelper()");
            }
            if (context.usesTransport(Transport.CSMA)) {
                writer.line("csma_trace = ns.CsmaHelper()");
            }
        }
        if (config.isEnableAsciiTrace()) {
            writer.line("ascii_trace = ns.AsciiTraceHelper()");
            if (context.usesTransport(Transport.POINT_TO_POINT)) {
                writer.line("p2p_trace.EnableAsciiAll(ascii_trace.CreateFileStream(%s))", string(directory + "/trace.tr"));
            }
            if (context.usesTransport(Transport.CSMA)) {
                writer.line("csma_trace.EnableAsciiAll(ascii_trace.CreateFileStream(%s))", string(directory + "/trace-csma.tr"));
            }
        }
        if (config.isEnablePcap()) {
            if (context.usesTransport(Transport.POINT_TO_POINT)) {
                writer.line("p2p_trace.EnablePcapAll(%s)", string(directory + "/capture"));
            }
            if (context.usesTransport(Transport.CSMA)) {
                writer.line("csma_trace.EnablePcapAll(%s)", string(directory + "/capture-csma"));
            }
            if (context.hasWifi()) {
                writer.line("wifi_phy.EnablePcapAll(%s)", string(directory + "/capture-wifi"));
            }
        }
        if (config.isEnableFlowMonitor()) {
            writer.line("flow_helper = ns.FlowMonitorHelper()")
                    .line("flow_monitor = flow_helper.InstallAll()");
        }
    }

    private static void writeRun(GenerationContext context, ScriptWriter writer) {
        SimulationConfig config = context.getConfig();
        String duration = number(config.getDuration());
        writer.section(ScriptSection.RUN)
                .line("ns.Simulator.Stop(ns.Seconds(%s))", duration)
                .line("print('Starting simulation for %s seconds')", duration)
                .line("ns.Simulator.Run()");
        if (config.isEnableFlowMonitor()) {
            String xml = context.getParameters().getOutputDirectory() + "/flowmon-results.xml";
            writer.blank()
                    .line("flow_monitor.CheckForLostPackets()")
                    .line("classifier = flow_helper.GetClassifier()")
                    .line("for flow_id, flow_stats in flow_monitor.GetFlowStats():")
                    .indent()
                    .line("t = classifier.FindFlow(flow_id)")
                    .line("print(f'Flow {flow_id}: {t.sourceAddress} -> {t.destinationAddress}')")
                    .line("print(f'  Tx packets: {flow_stats.txPackets}, Rx packets: {flow_stats.rxPackets}')")
                    .line("if flow_stats.rxPackets > 0:")
                    .indent()
                    .line("delay = flow_stats.delaySum.GetSeconds() / flow_stats.rxPackets * 1000")
                    .line("print(f'  Mean delay: {delay:.2f} ms')")
                    .dedent()
                    .dedent()
                    .line("flow_monitor.SerializeToXmlFile(%s, True, True)", string(xml));
        }
        writer.blank()
                .line("ns.Simulator.Destroy()")
                .line("print('Simulation completed')")
                .line("return 0");
    }

    private static void writeFooter(GenerationContext context, ScriptWriter writer) {
        writer.moduleLevel()
                .blank()
                .blank()
                .raw("if __name__ == '__main__':")
                .raw("    sys.exit(main())");
        List<ReportNode> diagnostics = Reports.getDiagnostics(context.getReportNode());
        if (context.getParameters().isDiagnosticComments() && !diagnostics.isEmpty()) {
            writer.blank();
            for (ReportNode diagnostic : diagnostics) {
                String severity = Reports.getSeverity(diagnostic).orElse("");
                writer.raw("# " + PythonLiterals.comment(severity + " " + diagnostic.getMessageKey() + ": "
                        + diagnostic.getMessage()));
            }
        }
    }
}
