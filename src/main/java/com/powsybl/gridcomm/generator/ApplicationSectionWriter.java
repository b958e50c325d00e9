/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.generator;

import com.powsybl.gridcomm.network.Node;
import com.powsybl.gridcomm.network.grid.GooseMessageConfig;
import com.powsybl.gridcomm.network.grid.GridTrafficClass;
import com.powsybl.gridcomm.network.grid.GridTrafficFlow;
import com.powsybl.gridcomm.simulation.TrafficFlow;
import com.powsybl.gridcomm.simulation.TrafficProtocol;
import com.powsybl.gridcomm.util.Reports;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;

import static com.powsybl.gridcomm.generator.PythonLiterals.number;
import static com.powsybl.gridcomm.generator.PythonLiterals.string;

/**
 * Writes one application pattern per traffic flow. Every pattern needs the address of the flow target, so this
 * section comes after addressing.
 * <p>
 * Polling flows become request/response echo exchanges at the poll interval, GOOSE flows near periodic on/off
 * bursts, control flows a select/operate exchange of two requests. Other flows use the pattern of their application.
 */
class ApplicationSectionWriter {

    static final int ECHO_PORT_BASE = 9000;

    static final String GOOSE_DATA_RATE = "1Mbps";

    static final double GOOSE_ON_TIME_S = 0.001;

    static final int CONTROL_PACKETS = 2;

    static final double CONTROL_INTERVAL_S = 0.5;

    static final int CONTROL_PACKET_SIZE = 64;

    private static final double SERVER_LEAD_TIME_S = 0.5;

    static List<TrafficFlow> getFlows(GenerationContext context) {
        List<TrafficFlow> flows = context.getConfig().getFlows();
        return flows.isEmpty() ? context.getNetwork().getTrafficFlows() : flows;
    }

    static int getPort(TrafficFlow flow, int index) {
        if (flow.getPort() == TrafficFlow.PORT_DEFAULT_VALUE) {
            return ECHO_PORT_BASE + index;
        }
        if (flow instanceof GridTrafficFlow && flow.getPort() == GridTrafficFlow.SCADA_PORT_DEFAULT_VALUE) {
            return flow.getPort() + index;
        }
        return flow.getPort();
    }

    private static String getSocketFactory(TrafficProtocol protocol) {
        return switch (protocol) {
            case UDP -> "ns3::UdpSocketFactory";
            case TCP -> "ns3::TcpSocketFactory";
        };
    }

    void write(GenerationContext context, ScriptWriter writer) {
        writer.section(ScriptSection.APPLICATIONS);
        List<TrafficFlow> flows = getFlows(context);
        if (flows.isEmpty()) {
            writer.comment("No traffic flows");
            return;
        }
        for (int i = 0; i < flows.size(); i++) {
            writeFlow(context, flows.get(i), i, writer);
        }
    }

    private static void skip(TrafficFlow flow, int index, String reason, ScriptWriter writer) {
        writer.comment("Flow " + index + " (" + flow.getId() + ") skipped: " + reason);
    }

    private static Optional<String> getTargetExpression(GenerationContext context, TrafficFlow flow) {
        if (StringUtils.isNotEmpty(flow.getDestinationAddress())) {
            return Optional.of("ns.Ipv4Address(" + string(flow.getDestinationAddress()) + ")");
        }
        return context.getTargetAddress(flow.getTargetNodeId()).map(TargetAddress::expression);
    }

    private void writeFlow(GenerationContext context, TrafficFlow flow, int index, ScriptWriter writer) {
        writer.blank();
        for (String nodeId : new String[] {flow.getSourceNodeId(), flow.getTargetNodeId()}) {
            if (nodeId == null || !context.hasNode(nodeId)) {
                String reason = "node '" + nodeId + "' does not exist";
                Reports.reportFlowEndpointMissing(context.getReportNode(), flow.getId(), reason);
                skip(flow, index, reason, writer);
                return;
            }
            Node node = context.getNetwork().getNode(nodeId);
            if (node.isSwitch()) {
                String reason = "node '" + nodeId + "' is a switch";
                Reports.reportFlowEndpointIsSwitch(context.getReportNode(), flow.getId(), reason);
                skip(flow, index, reason, writer);
                return;
            }
        }
        Optional<String> target = getTargetExpression(context, flow);
        if (target.isEmpty()) {
            String reason = "node '" + flow.getTargetNodeId() + "' has no address";
            Reports.reportUnresolvedFlowTarget(context.getReportNode(), flow.getId(), reason);
            skip(flow, index, reason, writer);
            return;
        }

        FlowNodes nodes = new FlowNodes(index, context.getNodeSlot(flow.getSourceNodeId()),
                context.getNodeSlot(flow.getTargetNodeId()), getPort(flow, index));
        writer.comment("Flow " + index + ": " + flow.getName() + ", " + flow.getSourceNodeId() + " -> "
                        + flow.getTargetNodeId() + " (" + flow.getApplication() + "/" + flow.getProtocol() + ")")
                .line("target_addr%d = %s", index, target.get());

        if (flow instanceof GridTrafficFlow gridFlow) {
            writeGridFlow(context, gridFlow, nodes, writer);
        } else {
            writeGenericFlow(context, flow, nodes, writer);
        }
    }

    private record FlowNodes(int index, int sourceSlot, int targetSlot, int port) {
    }

    private void writeGridFlow(GenerationContext context, GridTrafficFlow flow, FlowNodes nodes, ScriptWriter writer) {
        GridTrafficClass trafficClass = flow.getTrafficClass();
        writer.comment(trafficClass + " over " + flow.getGridProtocol() + ", priority " + flow.getPriority()
                + " (DSCP " + flow.getDscp() + ")");
        double start = flow.getStartTime() + flow.getInitialDelayMs() / 1000.0;
        if (trafficClass == GridTrafficClass.GOOSE) {
            GooseMessageConfig goose = flow.getGooseConfig().orElseGet(GooseMessageConfig::new);
            if (!flow.getAdditionalTargetIds().isEmpty()) {
                writer.comment("Multicast to " + (flow.getAdditionalTargetIds().size() + 1)
                        + " subscribers simulated towards the first one");
            }
            writeOnOff(nodes, TrafficProtocol.UDP, GOOSE_DATA_RATE, goose.getEstimatedBytes(),
                    GOOSE_ON_TIME_S, goose.getMaxTimeMs() / 1000.0, start, flow.getStopTime(), writer);
        } else if (trafficClass.isPolling()) {
            double interval = flow.getEffectiveIntervalMs() / 1000.0;
            int maxPackets = Math.max(1, (int) ((flow.getStopTime() - start) / interval));
            writer.comment("DNP3 request " + flow.getDnp3Config().getEstimatedRequestBytes() + " bytes, response "
                    + flow.getDnp3Config().getEstimatedResponseBytes() + " bytes");
            writeEcho(nodes, maxPackets, interval, flow.getDnp3Config().getEstimatedRequestBytes(), start,
                    flow.getStopTime(), writer);
        } else if (trafficClass.isControl()) {
            writer.comment("Select before operate exchange");
            writeEcho(nodes, CONTROL_PACKETS, CONTROL_INTERVAL_S, CONTROL_PACKET_SIZE, start, flow.getStopTime(), writer);
        } else {
            writeGenericFlow(context, flow, nodes, writer);
        }
    }

    private void writeGenericFlow(GenerationContext context, TrafficFlow flow, FlowNodes nodes, ScriptWriter writer) {
        switch (flow.getApplication()) {
            case ECHO -> writeEcho(nodes, flow.getEchoPackets(), flow.getEchoInterval(), flow.getPacketSize(),
                    flow.getStartTime(), flow.getStopTime(), writer);
            case ONOFF -> writeOnOff(nodes, flow.getProtocol(), flow.getDataRate(), flow.getPacketSize(), 1, 0,
                    flow.getStartTime(), flow.getStopTime(), writer);
            case BULK_SEND -> writeBulkSend(nodes, flow, writer);
            case PING, CUSTOM_SOCKET -> {
                Reports.reportUnsupportedApplication(context.getReportNode(), flow.getApplication().name(), flow.getId());
                writeEcho(nodes, flow.getEchoPackets(), flow.getEchoInterval(), flow.getPacketSize(),
                        flow.getStartTime(), flow.getStopTime(), writer);
            }
        }
    }

    private static void writeServerTimes(String apps, double start, double stop, ScriptWriter writer) {
        writer.line("%s.Start(ns.Seconds(%s))", apps, number(Math.max(0, start - SERVER_LEAD_TIME_S)))
                .line("%s.Stop(ns.Seconds(%s))", apps, number(stop + SERVER_LEAD_TIME_S));
    }

    private static void writeClientTimes(String apps, double start, double stop, ScriptWriter writer) {
        writer.line("%s.Start(ns.Seconds(%s))", apps, number(start))
                .line("%s.Stop(ns.Seconds(%s))", apps, number(stop));
    }

    private static void writeEcho(FlowNodes nodes, int maxPackets, double interval, int packetSize, double start,
                                  double stop, ScriptWriter writer) {
        int i = nodes.index();
        writer.line("echo_server%d = ns.UdpEchoServerHelper(%d)", i, nodes.port())
                .line("server_apps%d = echo_server%d.Install(nodes.Get(%d))", i, i, nodes.targetSlot());
        writeServerTimes("server_apps" + i, start, stop, writer);
        writer.line("remote_addr%d = ns.InetSocketAddress(target_addr%d, %d)", i, i, nodes.port())
                .line("echo_client%d = ns.UdpEchoClientHelper(remote_addr%d.ConvertTo())", i, i)
                .line("echo_client%d.SetAttribute('MaxPackets', ns.UintegerValue(%d))", i, maxPackets)
                .line("echo_client%d.SetAttribute('Interval', ns.TimeValue(ns.Seconds(%s)))", i, number(interval))
                .line("echo_client%d.SetAttribute('PacketSize', ns.UintegerValue(%d))", i, packetSize)
                .line("client_apps%d = echo_client%d.Install(nodes.Get(%d))", i, i, nodes.sourceSlot());
        writeClientTimes("client_apps" + i, start, stop, writer);
    }

    private static void writeSink(FlowNodes nodes, TrafficProtocol protocol, double start, double stop, ScriptWriter writer) {
        int i = nodes.index();
        writer.line("sink%d = ns.PacketSinkHelper(%s, ns.InetSocketAddress(ns.Ipv4Address.GetAny(), %d).ConvertTo())",
                        i, string(getSocketFactory(protocol)), nodes.port())
                .line("server_apps%d = sink%d.Install(nodes.Get(%d))", i, i, nodes.targetSlot());
        writeServerTimes("server_apps" + i, start, stop, writer);
    }

    private static void writeOnOff(FlowNodes nodes, TrafficProtocol protocol, String dataRate, int packetSize,
                                   double onTime, double offTime, double start, double stop, ScriptWriter writer) {
        int i = nodes.index();
        writeSink(nodes, protocol, start, stop, writer);
        writer.line("onoff%d = ns.OnOffHelper(%s, ns.InetSocketAddress(target_addr%d, %d).ConvertTo())",
                        i, string(getSocketFactory(protocol)), i, nodes.port())
                .line("onoff%d.SetAttribute('DataRate', ns.StringValue(%s))", i, string(dataRate))
                .line("onoff%d.SetAttribute('PacketSize', ns.UintegerValue(%d))", i, packetSize)
                .line("onoff%d.SetAttribute('OnTime', ns.StringValue(%s))", i,
                        string("ns3::ConstantRandomVariable[Constant=" + number(onTime) + "]"))
                .line("onoff%d.SetAttribute('OffTime', ns.StringValue(%s))", i,
                        string("ns3::ConstantRandomVariable[Constant=" + number(offTime) + "]"))
                .line("client_apps%d = onoff%d.Install(nodes.Get(%d))", i, i, nodes.sourceSlot());
        writeClientTimes("client_apps" + i, start, stop, writer);
    }

    private static void writeBulkSend(FlowNodes nodes, TrafficFlow flow, ScriptWriter writer) {
        int i = nodes.index();
        writeSink(nodes, TrafficProtocol.TCP, flow.getStartTime(), flow.getStopTime(), writer);
        writer.line("bulk%d = ns.BulkSendHelper('ns3::TcpSocketFactory', ns.InetSocketAddress(target_addr%d, %d).ConvertTo())",
                        i, i, nodes.port())
                .line("bulk%d.SetAttribute('MaxBytes', ns.UintegerValue(0))", i)
                .line("bulk%d.SetAttribute('SendSize', ns.UintegerValue(%d))", i, flow.getPacketSize())
                .line("client_apps%d = bulk%d.Install(nodes.Get(%d))", i, i, nodes.sourceSlot());
        writeClientTimes("client_apps" + i, flow.getStartTime(), flow.getStopTime(), writer);
    }
}
