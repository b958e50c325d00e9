/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.failure;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FailureScenarioTest {

    @Test
    void singleLinkFailure() {
        FailureScenario scenario = FailureScenarios.singleLinkFailure("l1", 2.0, 3.0);
        assertEquals(1, scenario.getEventCount());
        assertEquals(5.0, scenario.getDuration(), 0);
        assertEquals(1, scenario.getActiveEventsAtTime(4.0).size());
        assertTrue(scenario.getActiveEventsAtTime(1.0).isEmpty());
        assertTrue(scenario.getActiveEventsAtTime(5.0).isEmpty());
        assertEquals(Set.of("l1"), scenario.getUniqueTargets());
        assertFalse(scenario.hasCascading());
    }

    @Test
    void eventsStaySortedByTriggerTime() {
        FailureScenario scenario = new FailureScenario("s")
                .addEvent(new FailureEvent("late", FailureEventType.LINK_DOWN).setTriggerTime(8.0))
                .addEvent(new FailureEvent("early", FailureEventType.LINK_DOWN).setTriggerTime(1.0))
                .addEvent(new FailureEvent("same", FailureEventType.NODE_POWER_LOSS).setTriggerTime(8.0));
        assertEquals(List.of("early", "late", "same"), scenario.getEvents().stream().map(FailureEvent::getId).toList());
        assertEquals(2, scenario.getEventsAtTime(8.0).size());
        assertEquals(1, scenario.getEventsInRange(0, 2).size());
    }

    @Test
    void permanentEventsStayActive() {
        FailureScenario scenario = FailureScenarios.cascading("l1", List.of("n1", "n2"), 1.0, 2.0);
        assertEquals(3, scenario.getEventCount());
        assertTrue(scenario.hasCascading());
        assertEquals(5.0, scenario.getDuration(), 0);
        assertEquals(3, scenario.getActiveEventsAtTime(100).size());
        assertEquals(2, scenario.getActiveEventsAtTime(3.0).size());

        FailureEvent initial = scenario.getEvents().get(0);
        assertTrue(initial.isCascadingRoot());
        assertTrue(scenario.getEvents().get(1).isCascadingEffect());
        assertEquals(-1.0, initial.getEffectiveRecoveryTime(), 0);
    }

    @Test
    void copyIsDeep() {
        FailureScenario scenario = FailureScenarios.nodePowerLoss("n1");
        FailureScenario copy = scenario.copy("other");
        assertEquals("other", copy.getId());
        assertEquals(scenario.getName() + " (copy)", copy.getName());
        copy.removeEvent(copy.getEvents().get(0).getId());
        assertEquals(1, scenario.getEventCount());
        assertEquals(0, copy.getEventCount());
    }
}
