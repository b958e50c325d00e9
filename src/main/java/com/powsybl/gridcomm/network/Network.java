/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.gridcomm.failure.FailureScenario;
import com.powsybl.gridcomm.simulation.TrafficFlow;
import com.powsybl.gridcomm.util.Ipv4Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Root of the topology graph: nodes and links keyed by id, plus the traffic flows and the failure scenario
 * attached to it.
 * <p>
 * Every link endpoint references an existing node, and every bound port references the link bound to it.
 * Removing a node removes all the links touching it.
 */
public class Network {

    private static final Logger LOGGER = LoggerFactory.getLogger(Network.class);

    public static final double SIMULATION_DURATION_DEFAULT_VALUE = 10;

    private final String id;

    private final Map<String, Node> nodesById = new LinkedHashMap<>();

    private final Map<String, Link> linksById = new LinkedHashMap<>();

    private final List<TrafficFlow> trafficFlows = new ArrayList<>();

    private FailureScenario failureScenario;

    private int subnetCounter = 1;

    private int linkCounter = 0;

    private boolean autoAddressing = true;

    private double simulationDuration = SIMULATION_DURATION_DEFAULT_VALUE;

    private final Map<String, String> metadata = new LinkedHashMap<>();

    private final List<NetworkIssue> warnings = new ArrayList<>();

    private final List<NetworkIssue> todos = new ArrayList<>();

    @FunctionalInterface
    public interface LinkFactory<L extends Link> {

        L create(String id, LinkEndpoint source, LinkEndpoint target);
    }

    public Network(String id) {
        this.id = Objects.requireNonNull(id);
    }

    public String getId() {
        return id;
    }

    public Node addNode(Node node) {
        Objects.requireNonNull(node);
        if (nodesById.containsKey(node.getId())) {
            throw new PowsyblException("Node '" + node.getId() + "' already exists in network '" + id + "'");
        }
        nodesById.put(node.getId(), node);
        return node;
    }

    /**
     * Removes a node and every link touching it.
     */
    public Node removeNode(String nodeId) {
        Node node = getNodeOrThrow(nodeId);
        for (Link link : getLinksOf(nodeId)) {
            removeLink(link.getId());
        }
        nodesById.remove(nodeId);
        LOGGER.debug("Node {} removed from network {}", nodeId, id);
        return node;
    }

    public Node getNode(String nodeId) {
        Objects.requireNonNull(nodeId);
        return nodesById.get(nodeId);
    }

    public Node getNodeOrThrow(String nodeId) {
        Node node = getNode(nodeId);
        if (node == null) {
            throw new PowsyblException("Node '" + nodeId + "' not found in network '" + id + "'");
        }
        return node;
    }

    public boolean hasNode(String nodeId) {
        return nodesById.containsKey(nodeId);
    }

    public Collection<Node> getNodes() {
        return Collections.unmodifiableCollection(nodesById.values());
    }

    public int getNodeCount() {
        return nodesById.size();
    }

    public Link getLink(String linkId) {
        Objects.requireNonNull(linkId);
        return linksById.get(linkId);
    }

    public Collection<Link> getLinks() {
        return Collections.unmodifiableCollection(linksById.values());
    }

    public int getLinkCount() {
        return linksById.size();
    }

    public List<Link> getLinksOf(String nodeId) {
        Objects.requireNonNull(nodeId);
        return linksById.values().stream().filter(l -> l.touches(nodeId)).toList();
    }

    public String newLinkId() {
        String linkId;
        do {
            linkId = "link" + ++linkCounter;
        } while (linksById.containsKey(linkId));
        return linkId;
    }

    /**
     * Connects two nodes through their first available port, with a point-to-point channel.
     */
    public Link addLink(String sourceNodeId, String targetNodeId) {
        return addLink(sourceNodeId, targetNodeId, Link::new);
    }

    public <L extends Link> L addLink(String sourceNodeId, String targetNodeId, LinkFactory<L> factory) {
        Objects.requireNonNull(factory);
        Port sourcePort = firstAvailablePort(getNodeOrThrow(sourceNodeId));
        Port targetPort = firstAvailablePort(getNodeOrThrow(targetNodeId));
        L link = factory.create(newLinkId(), new LinkEndpoint(sourceNodeId, sourcePort.getId()),
                new LinkEndpoint(targetNodeId, targetPort.getId()));
        return addLink(link);
    }

    private static Port firstAvailablePort(Node node) {
        List<Port> available = node.getAvailablePorts();
        if (available.isEmpty()) {
            throw new PowsyblException("No available port on node '" + node.getId() + "'");
        }
        return available.get(0);
    }

    /**
     * Adds a link built by the caller, binding both its ports. When automatic addressing is enabled, addresses are
     * assigned right away: a host attached to a switch with a subnet base takes the next host number of that subnet,
     * and a link between two non-switch nodes gets a fresh {@code 10.0.n.0/24} subnet.
     */
    public <L extends Link> L addLink(L link) {
        Objects.requireNonNull(link);
        if (linksById.containsKey(link.getId())) {
            throw new PowsyblException("Link '" + link.getId() + "' already exists in network '" + id + "'");
        }
        Node source = getNodeOrThrow(link.getSourceNodeId());
        Node target = getNodeOrThrow(link.getTargetNodeId());
        if (source == target) {
            throw new PowsyblException("Link '" + link.getId() + "' connects node '" + source.getId() + "' to itself");
        }
        Port sourcePort = getPortOrThrow(source, link.getSource().portId());
        Port targetPort = getPortOrThrow(target, link.getTarget().portId());
        for (Port port : List.of(sourcePort, targetPort)) {
            if (port.isBound()) {
                throw new PowsyblException("Port '" + port.getId() + "' is already bound to link '" + port.getLinkId() + "'");
            }
        }
        sourcePort.bind(link.getId());
        targetPort.bind(link.getId());
        linksById.put(link.getId(), link);
        if (autoAddressing) {
            assignAddresses(source, sourcePort, target, targetPort);
        }
        LOGGER.debug("Link {} added between {}:{} and {}:{}", link.getId(), source.getId(), sourcePort.getName(),
                target.getId(), targetPort.getName());
        return link;
    }

    private static Port getPortOrThrow(Node node, String portId) {
        return node.getPort(portId)
                .orElseThrow(() -> new PowsyblException("Port '" + portId + "' not found on node '" + node.getId() + "'"));
    }

    private void assignAddresses(Node source, Port sourcePort, Node target, Port targetPort) {
        if (source.isSwitch() && target.isSwitch()) {
            return;
        }
        if (source.isSwitch() || target.isSwitch()) {
            Node switchNode = source.isSwitch() ? source : target;
            Port hostPort = source.isSwitch() ? targetPort : sourcePort;
            if (switchNode.getSubnetBase() != null && !hostPort.hasIpAddress()) {
                String address = Ipv4Addresses.withHostNumber(switchNode.getSubnetBase(), switchNode.allocateHostNumber());
                hostPort.setAddress(address, switchNode.getSubnetMask());
            }
            return;
        }
        int n = subnetCounter++;
        if (!sourcePort.hasIpAddress()) {
            sourcePort.setAddress("10.0." + n + ".1", Ipv4Addresses.NETMASK_24);
        }
        if (!targetPort.hasIpAddress()) {
            targetPort.setAddress("10.0." + n + ".2", Ipv4Addresses.NETMASK_24);
        }
    }

    /**
     * Removes a link, unbinding both its ports and clearing their addresses.
     */
    public Link removeLink(String linkId) {
        Link link = linksById.remove(linkId);
        if (link == null) {
            throw new PowsyblException("Link '" + linkId + "' not found in network '" + id + "'");
        }
        for (LinkSide side : LinkSide.values()) {
            LinkEndpoint endpoint = link.getEndpoint(side);
            Node node = nodesById.get(endpoint.nodeId());
            if (node != null) {
                node.getPort(endpoint.portId()).ifPresent(port -> {
                    port.unbind();
                    port.clearAddress();
                });
            }
        }
        return link;
    }

    /**
     * Renumbers the hosts attached to a switch from the first host number of its subnet, in link order.
     */
    public void reassignSwitchAddresses(String switchId) {
        Node switchNode = getNodeOrThrow(switchId);
        if (!switchNode.isSwitch() || switchNode.getSubnetBase() == null) {
            return;
        }
        switchNode.setNextHostNumber(1);
        for (Link link : getLinksOf(switchId)) {
            Node other = getNode(link.getOtherNodeId(switchId));
            if (other == null || other.isSwitch()) {
                continue;
            }
            other.getPortForLink(link.getId()).ifPresent(port -> {
                String address = Ipv4Addresses.withHostNumber(switchNode.getSubnetBase(), switchNode.allocateHostNumber());
                port.setAddress(address, switchNode.getSubnetMask());
            });
        }
    }

    public void clear() {
        linksById.clear();
        nodesById.clear();
        trafficFlows.clear();
        failureScenario = null;
        subnetCounter = 1;
        linkCounter = 0;
        metadata.clear();
        warnings.clear();
        todos.clear();
    }

    /**
     * Full deep copy. Generation state is not shared between a network and its copy.
     */
    public Network copy() {
        Network copy = new Network(id);
        nodesById.values().forEach(n -> copy.nodesById.put(n.getId(), n.copy()));
        linksById.values().forEach(l -> copy.linksById.put(l.getId(), l.copy()));
        trafficFlows.forEach(f -> copy.trafficFlows.add(f.copy()));
        copy.failureScenario = failureScenario != null ? failureScenario.copy() : null;
        copy.subnetCounter = subnetCounter;
        copy.linkCounter = linkCounter;
        copy.autoAddressing = autoAddressing;
        copy.simulationDuration = simulationDuration;
        copy.metadata.putAll(metadata);
        copy.warnings.addAll(warnings);
        copy.todos.addAll(todos);
        return copy;
    }

    public int getSubnetCounter() {
        return subnetCounter;
    }

    public boolean isAutoAddressing() {
        return autoAddressing;
    }

    public Network setAutoAddressing(boolean autoAddressing) {
        this.autoAddressing = autoAddressing;
        return this;
    }

    public List<TrafficFlow> getTrafficFlows() {
        return Collections.unmodifiableList(trafficFlows);
    }

    public Network addTrafficFlow(TrafficFlow flow) {
        trafficFlows.add(Objects.requireNonNull(flow));
        return this;
    }

    public Optional<FailureScenario> getFailureScenario() {
        return Optional.ofNullable(failureScenario);
    }

    public Network setFailureScenario(FailureScenario failureScenario) {
        this.failureScenario = failureScenario;
        return this;
    }

    public double getSimulationDuration() {
        return simulationDuration;
    }

    public Network setSimulationDuration(double simulationDuration) {
        this.simulationDuration = simulationDuration;
        return this;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public List<NetworkIssue> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public Network addWarning(NetworkIssue warning) {
        warnings.add(Objects.requireNonNull(warning));
        return this;
    }

    public List<NetworkIssue> getTodos() {
        return Collections.unmodifiableList(todos);
    }

    /**
     * Records a pending manual action, ignoring exact duplicates.
     */
    public Network addTodo(NetworkIssue todo) {
        Objects.requireNonNull(todo);
        if (!todos.contains(todo)) {
            todos.add(todo);
        }
        return this;
    }

    public void logSize() {
        LOGGER.info("Network {} has {} nodes and {} links", id, nodesById.size(), linksById.size());
    }

    @Override
    public String toString() {
        return id;
    }
}
