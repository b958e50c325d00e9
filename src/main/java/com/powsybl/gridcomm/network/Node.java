/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.gridcomm.util.Ipv4Addresses;
import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * A host, router, switch or wireless device of the communication network.
 * Default ports are created at construction according to the node kind.
 */
public class Node extends AbstractElement {

    public static final String ROUTING_PROTOCOL_DEFAULT_VALUE = "static";

    public static final String SUBNET_MASK_DEFAULT_VALUE = Ipv4Addresses.NETMASK_24;

    protected final NodeKind kind;

    private MediumType medium = MediumType.WIRED;

    private Position position = Position.ORIGIN;

    private final List<Port> ports = new ArrayList<>();

    private boolean server = false;

    private String routingProtocol = ROUTING_PROTOCOL_DEFAULT_VALUE;

    private boolean forwardingEnabled;

    private boolean stpEnabled;

    private String subnetBase;

    private String subnetMask = SUBNET_MASK_DEFAULT_VALUE;

    private int nextHostNumber = 1;

    private RoutingMode routingMode = RoutingMode.AUTO;

    private final List<RouteEntry> routingTable = new ArrayList<>();

    private String defaultGateway;

    private String description = "";

    public Node(String id, NodeKind kind) {
        this(id, defaultName(id, kind), kind);
    }

    public Node(String id, String name, NodeKind kind) {
        super(id, name);
        this.kind = Objects.requireNonNull(kind);
        this.forwardingEnabled = kind == NodeKind.ROUTER;
        this.stpEnabled = kind == NodeKind.SWITCH;
        for (int i = 0; i < kind.getDefaultPortCount(); i++) {
            addPort(kind.getDefaultPortType());
        }
    }

    protected Node(Node other) {
        super(other.id, other.name);
        kind = other.kind;
        medium = other.medium;
        position = other.position;
        for (Port port : other.ports) {
            ports.add(port.copy());
        }
        server = other.server;
        routingProtocol = other.routingProtocol;
        forwardingEnabled = other.forwardingEnabled;
        stpEnabled = other.stpEnabled;
        subnetBase = other.subnetBase;
        subnetMask = other.subnetMask;
        nextHostNumber = other.nextHostNumber;
        routingMode = other.routingMode;
        for (RouteEntry route : other.routingTable) {
            routingTable.add(route.copy());
        }
        defaultGateway = other.defaultGateway;
        description = other.description;
        copyPropertiesFrom(other);
    }

    private static String defaultName(String id, NodeKind kind) {
        return kind.name().toLowerCase(Locale.ROOT) + "_" + StringUtils.left(id, 4);
    }

    /**
     * Deep copy, ports and routing table included.
     */
    public Node copy() {
        return new Node(this);
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean isSwitch() {
        return kind == NodeKind.SWITCH;
    }

    public boolean isRouter() {
        return kind == NodeKind.ROUTER;
    }

    public MediumType getMedium() {
        return medium;
    }

    public Node setMedium(MediumType medium) {
        this.medium = Objects.requireNonNull(medium);
        return this;
    }

    public Position getPosition() {
        return position;
    }

    public Node setPosition(Position position) {
        this.position = Objects.requireNonNull(position);
        return this;
    }

    public List<Port> getPorts() {
        return Collections.unmodifiableList(ports);
    }

    public Port addPort(PortType type) {
        int number = ports.stream().mapToInt(Port::getNumber).max().orElse(-1) + 1;
        Port port = new Port(id + "-" + type.getPrefix() + number, number, type);
        ports.add(port);
        return port;
    }

    public void removePort(String portId) {
        Port port = getPort(portId)
                .orElseThrow(() -> new PowsyblException("Port " + portId + " not found on node " + id));
        if (port.isBound()) {
            throw new PowsyblException("Port " + portId + " is bound to link " + port.getLinkId() + " and cannot be removed");
        }
        ports.remove(port);
    }

    public Optional<Port> getPort(String portId) {
        Objects.requireNonNull(portId);
        return ports.stream().filter(p -> p.getId().equals(portId)).findFirst();
    }

    public Optional<Port> getPortByNumber(int number) {
        return ports.stream().filter(p -> p.getNumber() == number).findFirst();
    }

    public List<Port> getAvailablePorts() {
        return ports.stream().filter(p -> !p.isBound() && p.isEnabled()).toList();
    }

    public Optional<Port> getPortForLink(String linkId) {
        Objects.requireNonNull(linkId);
        return ports.stream().filter(p -> linkId.equals(p.getLinkId())).findFirst();
    }

    public boolean isServer() {
        return server;
    }

    public Node setServer(boolean server) {
        this.server = server;
        return this;
    }

    public String getRoutingProtocol() {
        return routingProtocol;
    }

    public Node setRoutingProtocol(String routingProtocol) {
        this.routingProtocol = Objects.requireNonNull(routingProtocol);
        return this;
    }

    public boolean isForwardingEnabled() {
        return forwardingEnabled;
    }

    public Node setForwardingEnabled(boolean forwardingEnabled) {
        this.forwardingEnabled = forwardingEnabled;
        return this;
    }

    public boolean isStpEnabled() {
        return stpEnabled;
    }

    public Node setStpEnabled(boolean stpEnabled) {
        this.stpEnabled = stpEnabled;
        return this;
    }

    /**
     * Subnet handed out by a switch to the hosts attached to it, or null when the switch has none.
     */
    public String getSubnetBase() {
        return subnetBase;
    }

    public Node setSubnetBase(String subnetBase) {
        if (subnetBase != null && !Ipv4Addresses.isValid(subnetBase)) {
            throw new PowsyblException("Invalid subnet base '" + subnetBase + "' on node " + id);
        }
        this.subnetBase = subnetBase;
        return this;
    }

    public String getSubnetMask() {
        return subnetMask;
    }

    public Node setSubnetMask(String subnetMask) {
        this.subnetMask = Objects.requireNonNull(subnetMask);
        return this;
    }

    public int getNextHostNumber() {
        return nextHostNumber;
    }

    public Node setNextHostNumber(int nextHostNumber) {
        this.nextHostNumber = nextHostNumber;
        return this;
    }

    int allocateHostNumber() {
        return nextHostNumber++;
    }

    public RoutingMode getRoutingMode() {
        return routingMode;
    }

    public Node setRoutingMode(RoutingMode routingMode) {
        this.routingMode = Objects.requireNonNull(routingMode);
        return this;
    }

    public List<RouteEntry> getRoutingTable() {
        return Collections.unmodifiableList(routingTable);
    }

    public List<RouteEntry> getRoutes(RouteType type) {
        return routingTable.stream().filter(r -> r.getType() == type).toList();
    }

    public Node addRoute(RouteEntry route) {
        routingTable.add(Objects.requireNonNull(route));
        return this;
    }

    public boolean removeRoute(RouteEntry route) {
        return routingTable.remove(route);
    }

    public void clearRoutes() {
        routingTable.clear();
    }

    /**
     * Replaces any existing default route by one through the given gateway.
     */
    public RouteEntry setDefaultGatewayRoute(String gateway, int interfaceIndex) {
        routingTable.removeIf(RouteEntry::isDefaultRoute);
        RouteEntry route = new RouteEntry(Ipv4Addresses.ANY, 0, gateway, interfaceIndex)
                .setType(RouteType.DEFAULT)
                .setDescription("Default gateway");
        routingTable.add(route);
        defaultGateway = gateway;
        return route;
    }

    public String getDefaultGateway() {
        return defaultGateway;
    }

    public Node setDefaultGateway(String defaultGateway) {
        this.defaultGateway = defaultGateway;
        return this;
    }

    public String getDescription() {
        return description;
    }

    public Node setDescription(String description) {
        this.description = Objects.requireNonNull(description);
        return this;
    }
}
