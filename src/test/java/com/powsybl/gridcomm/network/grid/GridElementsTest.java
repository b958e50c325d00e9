/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import com.powsybl.commons.PowsyblException;
import com.powsybl.gridcomm.network.*;
import com.powsybl.gridcomm.simulation.TrafficApplication;
import com.powsybl.gridcomm.simulation.TrafficFlow;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GridElementsTest {

    private static final LinkEndpoint SOURCE = new LinkEndpoint("a", "a-eth0");

    private static final LinkEndpoint TARGET = new LinkEndpoint("b", "b-eth0");

    @Test
    void nodeTypeDefaults() {
        GridNode ied = new GridNode("ied1", GridNodeType.IED);
        assertEquals(NodeKind.HOST, ied.getKind());
        assertEquals(GridNodeRole.SLAVE, ied.getRole());
        assertEquals(ScanClass.CLASS_1, ied.getScanClass());
        assertEquals(GridProtocol.IEC_61850, ied.getProtocol());
        assertEquals("ied_ied1", ied.getName());

        GridNode gateway = new GridNode("gw", GridNodeType.GATEWAY);
        assertTrue(gateway.isRouter());
        assertTrue(new GridNode("sub", GridNodeType.SUBSTATION).isSwitch());
    }

    @Test
    void nodeOverridesAreIdempotent() {
        GridNode.Overrides overrides = new GridNode.Overrides()
                .setRole(GridNodeRole.SLAVE)
                .setProtocol(GridProtocol.MODBUS_TCP);
        GridNode first = new GridNode("cc", GridNodeType.CONTROL_CENTER, overrides);
        GridNode second = new GridNode("cc", GridNodeType.CONTROL_CENTER, overrides);
        for (GridNode node : new GridNode[] {first, second}) {
            assertEquals(GridNodeRole.SLAVE, node.getRole());
            assertEquals(GridProtocol.MODBUS_TCP, node.getProtocol());
            assertEquals(ScanClass.INTEGRITY, node.getScanClass());
        }
        assertEquals(first.getEffectivePollIntervalMs(), second.getEffectivePollIntervalMs());
    }

    @Test
    void linkOverrideEqualToGenericDefaultIsKept() {
        GridLink fiber = new GridLink("l1", SOURCE, TARGET, GridLinkType.FIBER);
        assertEquals("1Gbps", fiber.getDataRate());
        assertEquals("0.1ms", fiber.getDelay());
        assertEquals(ChannelKind.POINT_TO_POINT, fiber.getChannel());
        assertEquals(ReliabilityClass.HIGH, fiber.getReliabilityClass());

        GridLink.Overrides overrides = new GridLink.Overrides().setDataRate(Link.DATA_RATE_DEFAULT_VALUE);
        GridLink first = new GridLink("l2", SOURCE, TARGET, GridLinkType.FIBER, overrides);
        GridLink second = new GridLink("l2", SOURCE, TARGET, GridLinkType.FIBER, overrides);
        assertEquals(Link.DATA_RATE_DEFAULT_VALUE, first.getDataRate());
        assertEquals(first.getDataRate(), second.getDataRate());
        assertEquals(first.getDelay(), second.getDelay());
        assertEquals(first.getBitErrorRate(), second.getBitErrorRate(), 0);
    }

    @Test
    void everyLinkTypeHasDefaults() {
        for (GridLinkType type : GridLinkType.values()) {
            assertNotNull(type.getChannel(), type.name());
            assertNotNull(type.getDefaultDataRate(), type.name());
            assertNotNull(type.getDefaultDelay(), type.name());
            assertNotNull(type.getDefaultReliabilityClass(), type.name());
        }
    }

    @Test
    void physicalParametersMustMatchLinkType() {
        GridLink radio = new GridLink("r", SOURCE, TARGET, GridLinkType.LICENSED_RADIO);
        assertTrue(radio.getWirelessParameters().isPresent());
        GridLink.Overrides overrides = new GridLink.Overrides().setPhysicalParameters(new CellularParameters());
        assertThrows(PowsyblException.class, () -> new GridLink("f", SOURCE, TARGET, GridLinkType.FIBER, overrides));
        assertTrue(new GridLink("leo", SOURCE, TARGET, GridLinkType.SATELLITE_LEO).getSatelliteParameters().isPresent());
    }

    @Test
    void flowClassDefaults() {
        GridTrafficFlow poll = new GridTrafficFlow("f1", "cc", "rtu", GridTrafficClass.SCADA_EXCEPTION_POLL);
        assertEquals(TrafficApplication.ECHO, poll.getApplication());
        assertEquals(4000, poll.getIntervalMs());
        assertEquals(GridTrafficPriority.SCADA_NORMAL, poll.getPriority());
        assertEquals(GridTrafficFlow.SCADA_PORT_DEFAULT_VALUE, poll.getPort());
        assertEquals(4.0, poll.getEchoInterval(), 0);

        GridTrafficFlow goose = new GridTrafficFlow("f2", "ied1", "ied2", GridTrafficClass.GOOSE);
        assertEquals(GridProtocol.GOOSE, goose.getGridProtocol());
        assertTrue(goose.getGooseConfig().isPresent());
    }

    @Test
    void flowOverridesAreIdempotent() {
        GridTrafficFlow.Overrides overrides = new GridTrafficFlow.Overrides()
                .setPacketSize(TrafficFlow.PACKET_SIZE_DEFAULT_VALUE)
                .setIntervalMs(2000);
        GridTrafficFlow first = new GridTrafficFlow("f", "a", "b", GridTrafficClass.HEARTBEAT, overrides);
        GridTrafficFlow second = new GridTrafficFlow("f", "a", "b", GridTrafficClass.HEARTBEAT, overrides);
        assertEquals(TrafficFlow.PACKET_SIZE_DEFAULT_VALUE, first.getPacketSize());
        assertEquals(first.getPacketSize(), second.getPacketSize());
        assertEquals(2000, first.getIntervalMs());
        assertEquals(first.getEffectiveIntervalMs(), second.getEffectiveIntervalMs());
        assertEquals(first.getDscp(), second.getDscp());
    }
}
