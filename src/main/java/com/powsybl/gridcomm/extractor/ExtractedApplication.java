/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

import com.powsybl.gridcomm.simulation.TrafficProtocol;

import java.util.Objects;

/**
 * An application installed on one extracted node. Start and stop times are updated by later calls on the
 * application container the install returned.
 */
public class ExtractedApplication {

    public static final int PORT_DEFAULT_VALUE = 9;

    private final ApplicationKind kind;

    private final NodeKey node;

    private final String helperName;

    private int port = PORT_DEFAULT_VALUE;

    private TrafficProtocol protocol = TrafficProtocol.UDP;

    private String remoteAddress = "";

    private String dataRate = "";

    private int packetSize = 0;

    private double startTime = 0;

    private double stopTime = 0;

    public ExtractedApplication(ApplicationKind kind, NodeKey node, String helperName) {
        this.kind = Objects.requireNonNull(kind);
        this.node = Objects.requireNonNull(node);
        this.helperName = Objects.requireNonNullElse(helperName, "");
    }

    public ApplicationKind getKind() {
        return kind;
    }

    public boolean isServer() {
        return kind.isServer();
    }

    public NodeKey getNode() {
        return node;
    }

    public String getHelperName() {
        return helperName;
    }

    public int getPort() {
        return port;
    }

    public ExtractedApplication setPort(int port) {
        this.port = port;
        return this;
    }

    public TrafficProtocol getProtocol() {
        return protocol;
    }

    public ExtractedApplication setProtocol(TrafficProtocol protocol) {
        this.protocol = Objects.requireNonNull(protocol);
        return this;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public ExtractedApplication setRemoteAddress(String remoteAddress) {
        this.remoteAddress = Objects.requireNonNullElse(remoteAddress, "");
        return this;
    }

    public String getDataRate() {
        return dataRate;
    }

    public ExtractedApplication setDataRate(String dataRate) {
        this.dataRate = Objects.requireNonNullElse(dataRate, "");
        return this;
    }

    public int getPacketSize() {
        return packetSize;
    }

    public ExtractedApplication setPacketSize(int packetSize) {
        this.packetSize = packetSize;
        return this;
    }

    public double getStartTime() {
        return startTime;
    }

    public ExtractedApplication setStartTime(double startTime) {
        this.startTime = startTime;
        return this;
    }

    public double getStopTime() {
        return stopTime;
    }

    public ExtractedApplication setStopTime(double stopTime) {
        this.stopTime = stopTime;
        return this;
    }

    @Override
    public String toString() {
        return kind.getLabel() + "@" + node;
    }
}
