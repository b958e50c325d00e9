/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.simulation;

import java.util.Objects;

/**
 * Traffic between a source and a target node of the network.
 */
public class TrafficFlow {

    public static final int PORT_DEFAULT_VALUE = 9;

    public static final double START_TIME_DEFAULT_VALUE = 1.0;

    public static final double STOP_TIME_DEFAULT_VALUE = 9.0;

    public static final String DATA_RATE_DEFAULT_VALUE = "500kb/s";

    public static final int PACKET_SIZE_DEFAULT_VALUE = 1024;

    public static final int ECHO_PACKETS_DEFAULT_VALUE = 10;

    public static final double ECHO_INTERVAL_DEFAULT_VALUE = 1.0;

    protected final String id;

    protected String name;

    protected String sourceNodeId;

    protected String targetNodeId;

    protected String destinationAddress = "";

    protected TrafficProtocol protocol = TrafficProtocol.UDP;

    protected TrafficApplication application = TrafficApplication.ECHO;

    protected int port = PORT_DEFAULT_VALUE;

    protected double startTime = START_TIME_DEFAULT_VALUE;

    protected double stopTime = STOP_TIME_DEFAULT_VALUE;

    protected String dataRate = DATA_RATE_DEFAULT_VALUE;

    protected int packetSize = PACKET_SIZE_DEFAULT_VALUE;

    protected int echoPackets = ECHO_PACKETS_DEFAULT_VALUE;

    protected double echoInterval = ECHO_INTERVAL_DEFAULT_VALUE;

    public TrafficFlow(String id, String sourceNodeId, String targetNodeId) {
        this.id = Objects.requireNonNull(id);
        this.name = id;
        this.sourceNodeId = Objects.requireNonNull(sourceNodeId);
        this.targetNodeId = Objects.requireNonNull(targetNodeId);
    }

    protected TrafficFlow(TrafficFlow other) {
        id = other.id;
        name = other.name;
        sourceNodeId = other.sourceNodeId;
        targetNodeId = other.targetNodeId;
        destinationAddress = other.destinationAddress;
        protocol = other.protocol;
        application = other.application;
        port = other.port;
        startTime = other.startTime;
        stopTime = other.stopTime;
        dataRate = other.dataRate;
        packetSize = other.packetSize;
        echoPackets = other.echoPackets;
        echoInterval = other.echoInterval;
    }

    public TrafficFlow copy() {
        return new TrafficFlow(this);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TrafficFlow setName(String name) {
        this.name = Objects.requireNonNull(name);
        return this;
    }

    public String getSourceNodeId() {
        return sourceNodeId;
    }

    public TrafficFlow setSourceNodeId(String sourceNodeId) {
        this.sourceNodeId = Objects.requireNonNull(sourceNodeId);
        return this;
    }

    public String getTargetNodeId() {
        return targetNodeId;
    }

    public TrafficFlow setTargetNodeId(String targetNodeId) {
        this.targetNodeId = Objects.requireNonNull(targetNodeId);
        return this;
    }

    public String getDestinationAddress() {
        return destinationAddress;
    }

    public TrafficFlow setDestinationAddress(String destinationAddress) {
        this.destinationAddress = Objects.requireNonNull(destinationAddress);
        return this;
    }

    public TrafficProtocol getProtocol() {
        return protocol;
    }

    public TrafficFlow setProtocol(TrafficProtocol protocol) {
        this.protocol = Objects.requireNonNull(protocol);
        return this;
    }

    public TrafficApplication getApplication() {
        return application;
    }

    public TrafficFlow setApplication(TrafficApplication application) {
        this.application = Objects.requireNonNull(application);
        return this;
    }

    public int getPort() {
        return port;
    }

    public TrafficFlow setPort(int port) {
        this.port = port;
        return this;
    }

    public double getStartTime() {
        return startTime;
    }

    public TrafficFlow setStartTime(double startTime) {
        this.startTime = startTime;
        return this;
    }

    public double getStopTime() {
        return stopTime;
    }

    public TrafficFlow setStopTime(double stopTime) {
        this.stopTime = stopTime;
        return this;
    }

    public String getDataRate() {
        return dataRate;
    }

    public TrafficFlow setDataRate(String dataRate) {
        this.dataRate = Objects.requireNonNull(dataRate);
        return this;
    }

    public int getPacketSize() {
        return packetSize;
    }

    public TrafficFlow setPacketSize(int packetSize) {
        this.packetSize = packetSize;
        return this;
    }

    public int getEchoPackets() {
        return echoPackets;
    }

    public TrafficFlow setEchoPackets(int echoPackets) {
        this.echoPackets = echoPackets;
        return this;
    }

    public double getEchoInterval() {
        return echoInterval;
    }

    public TrafficFlow setEchoInterval(double echoInterval) {
        this.echoInterval = echoInterval;
        return this;
    }

    @Override
    public String toString() {
        return id + " (" + sourceNodeId + " -> " + targetNodeId + ")";
    }
}
