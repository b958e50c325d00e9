/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import java.util.Objects;

/**
 * IEC 61850 GOOSE publication: retransmission times and data set size.
 */
public class GooseMessageConfig {

    static final int FRAME_OVERHEAD_BYTES = 26;

    static final int ENTRY_BYTES = 4;

    public static final int MIN_TIME_MS_DEFAULT_VALUE = 2;
    public static final int MAX_TIME_MS_DEFAULT_VALUE = 1000;
    public static final int ENTRIES_DEFAULT_VALUE = 10;

    private String gocbRef = "";
    private String goId = "";
    private String dataSet = "";
    private int minTimeMs = MIN_TIME_MS_DEFAULT_VALUE;
    private int maxTimeMs = MAX_TIME_MS_DEFAULT_VALUE;
    private int entries = ENTRIES_DEFAULT_VALUE;
    private int vlanId = 0;
    private int vlanPriority = 4;
    private boolean triggerOnChange = true;
    private double changeProbability = 0.01;

    public String getGocbRef() {
        return gocbRef;
    }

    public GooseMessageConfig setGocbRef(String gocbRef) {
        this.gocbRef = Objects.requireNonNull(gocbRef);
        return this;
    }

    public String getGoId() {
        return goId;
    }

    public GooseMessageConfig setGoId(String goId) {
        this.goId = Objects.requireNonNull(goId);
        return this;
    }

    public String getDataSet() {
        return dataSet;
    }

    public GooseMessageConfig setDataSet(String dataSet) {
        this.dataSet = Objects.requireNonNull(dataSet);
        return this;
    }

    public int getMinTimeMs() {
        return minTimeMs;
    }

    public GooseMessageConfig setMinTimeMs(int minTimeMs) {
        this.minTimeMs = minTimeMs;
        return this;
    }

    public int getMaxTimeMs() {
        return maxTimeMs;
    }

    public GooseMessageConfig setMaxTimeMs(int maxTimeMs) {
        this.maxTimeMs = maxTimeMs;
        return this;
    }

    public int getEntries() {
        return entries;
    }

    public GooseMessageConfig setEntries(int entries) {
        this.entries = entries;
        return this;
    }

    public int getVlanId() {
        return vlanId;
    }

    public GooseMessageConfig setVlanId(int vlanId) {
        this.vlanId = vlanId;
        return this;
    }

    public int getVlanPriority() {
        return vlanPriority;
    }

    public GooseMessageConfig setVlanPriority(int vlanPriority) {
        this.vlanPriority = vlanPriority;
        return this;
    }

    public boolean isTriggerOnChange() {
        return triggerOnChange;
    }

    public GooseMessageConfig setTriggerOnChange(boolean triggerOnChange) {
        this.triggerOnChange = triggerOnChange;
        return this;
    }

    public double getChangeProbability() {
        return changeProbability;
    }

    public GooseMessageConfig setChangeProbability(double changeProbability) {
        this.changeProbability = changeProbability;
        return this;
    }

    /**
     * Ethernet header, GOOSE PDU header and APDU tag, plus four bytes per data set entry.
     */
    public int getEstimatedBytes() {
        return FRAME_OVERHEAD_BYTES + entries * ENTRY_BYTES;
    }

    GooseMessageConfig copy() {
        GooseMessageConfig copy = new GooseMessageConfig();
        copy.gocbRef = gocbRef;
        copy.goId = goId;
        copy.dataSet = dataSet;
        copy.minTimeMs = minTimeMs;
        copy.maxTimeMs = maxTimeMs;
        copy.entries = entries;
        copy.vlanId = vlanId;
        copy.vlanPriority = vlanPriority;
        copy.triggerOnChange = triggerOnChange;
        copy.changeProbability = changeProbability;
        return copy;
    }
}
