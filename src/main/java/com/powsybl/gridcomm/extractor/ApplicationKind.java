/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

/**
 * Application helpers recognized in scripts.
 */
public enum ApplicationKind {
    ON_OFF("OnOff", false),
    PACKET_SINK("PacketSink", true),
    UDP_ECHO_SERVER("UdpEchoServer", true),
    UDP_ECHO_CLIENT("UdpEchoClient", false),
    BULK_SEND("BulkSend", false);

    private final String label;

    private final boolean server;

    ApplicationKind(String label, boolean server) {
        this.label = label;
        this.server = server;
    }

    public String getLabel() {
        return label;
    }

    public boolean isServer() {
        return server;
    }

    public String getHelperClass() {
        return label + "Helper";
    }
}
