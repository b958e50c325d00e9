/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

import com.powsybl.gridcomm.util.Ipv4Addresses;

import java.util.Objects;

/**
 * One entry of a node routing table. The interface index is the number of the node port the route leaves through.
 */
public class RouteEntry {

    public static final int PREFIX_LENGTH_DEFAULT_VALUE = 24;

    public static final int METRIC_DEFAULT_VALUE = 1;

    private String destination = Ipv4Addresses.ANY;

    private int prefixLength = PREFIX_LENGTH_DEFAULT_VALUE;

    private String gateway = Ipv4Addresses.ANY;

    private int interfaceIndex = 0;

    private int metric = METRIC_DEFAULT_VALUE;

    private RouteType type = RouteType.STATIC;

    private boolean enabled = true;

    private String description = "";

    public RouteEntry() {
    }

    public RouteEntry(String destination, int prefixLength, String gateway, int interfaceIndex) {
        this.destination = Objects.requireNonNull(destination);
        this.prefixLength = prefixLength;
        this.gateway = Objects.requireNonNull(gateway);
        this.interfaceIndex = interfaceIndex;
    }

    public String getDestination() {
        return destination;
    }

    public RouteEntry setDestination(String destination) {
        this.destination = Objects.requireNonNull(destination);
        return this;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public RouteEntry setPrefixLength(int prefixLength) {
        this.prefixLength = prefixLength;
        return this;
    }

    public String getGateway() {
        return gateway;
    }

    public RouteEntry setGateway(String gateway) {
        this.gateway = Objects.requireNonNull(gateway);
        return this;
    }

    public int getInterfaceIndex() {
        return interfaceIndex;
    }

    public RouteEntry setInterfaceIndex(int interfaceIndex) {
        this.interfaceIndex = interfaceIndex;
        return this;
    }

    public int getMetric() {
        return metric;
    }

    public RouteEntry setMetric(int metric) {
        this.metric = metric;
        return this;
    }

    public RouteType getType() {
        return type;
    }

    public RouteEntry setType(RouteType type) {
        this.type = Objects.requireNonNull(type);
        return this;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public RouteEntry setEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public String getDescription() {
        return description;
    }

    public RouteEntry setDescription(String description) {
        this.description = Objects.requireNonNull(description);
        return this;
    }

    public String getNetmask() {
        return Ipv4Addresses.prefixToNetmask(prefixLength);
    }

    public String getCidr() {
        return destination + "/" + prefixLength;
    }

    public boolean isDefaultRoute() {
        return Ipv4Addresses.ANY.equals(destination) && prefixLength == 0;
    }

    /**
     * Directly connected routes are installed by the simulator itself when interfaces are addressed.
     */
    public boolean isDirect() {
        return Ipv4Addresses.ANY.equals(gateway) || type == RouteType.CONNECTED;
    }

    public boolean matchesNetwork(String address) {
        return Ipv4Addresses.sameNetwork(address, destination, prefixLength);
    }

    RouteEntry copy() {
        RouteEntry copy = new RouteEntry(destination, prefixLength, gateway, interfaceIndex);
        copy.metric = metric;
        copy.type = type;
        copy.enabled = enabled;
        copy.description = description;
        return copy;
    }

    @Override
    public String toString() {
        return getCidr() + " via " + gateway;
    }
}
