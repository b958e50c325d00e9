/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class Iec61850Config {

    public static final String AP_NAME_DEFAULT_VALUE = "S1";
    public static final String GOOSE_MULTICAST_MAC_DEFAULT_VALUE = "01:0C:CD:01:00:00";
    public static final int GOOSE_VLAN_PRIORITY_DEFAULT_VALUE = 4;
    public static final int MMS_PORT_DEFAULT_VALUE = 102;

    private boolean enabled = false;
    private String iedName = "";
    private String apName = AP_NAME_DEFAULT_VALUE;
    private boolean gooseEnabled = false;
    private int gooseAppId = 0;
    private String gooseMulticastMac = GOOSE_MULTICAST_MAC_DEFAULT_VALUE;
    private int gooseVlanId = 0;
    private int gooseVlanPriority = GOOSE_VLAN_PRIORITY_DEFAULT_VALUE;
    private boolean mmsEnabled = true;
    private int mmsPort = MMS_PORT_DEFAULT_VALUE;
    private final List<String> logicalDevices = new ArrayList<>(List.of("LD0"));

    public boolean isEnabled() {
        return enabled;
    }

    public Iec61850Config setEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public String getIedName() {
        return iedName;
    }

    public Iec61850Config setIedName(String iedName) {
        this.iedName = Objects.requireNonNull(iedName);
        return this;
    }

    public String getApName() {
        return apName;
    }

    public Iec61850Config setApName(String apName) {
        this.apName = Objects.requireNonNull(apName);
        return this;
    }

    public boolean isGooseEnabled() {
        return gooseEnabled;
    }

    public Iec61850Config setGooseEnabled(boolean gooseEnabled) {
        this.gooseEnabled = gooseEnabled;
        return this;
    }

    public int getGooseAppId() {
        return gooseAppId;
    }

    public Iec61850Config setGooseAppId(int gooseAppId) {
        this.gooseAppId = gooseAppId;
        return this;
    }

    public String getGooseMulticastMac() {
        return gooseMulticastMac;
    }

    public Iec61850Config setGooseMulticastMac(String gooseMulticastMac) {
        this.gooseMulticastMac = Objects.requireNonNull(gooseMulticastMac);
        return this;
    }

    public int getGooseVlanId() {
        return gooseVlanId;
    }

    public Iec61850Config setGooseVlanId(int gooseVlanId) {
        this.gooseVlanId = gooseVlanId;
        return this;
    }

    public int getGooseVlanPriority() {
        return gooseVlanPriority;
    }

    public Iec61850Config setGooseVlanPriority(int gooseVlanPriority) {
        this.gooseVlanPriority = gooseVlanPriority;
        return this;
    }

    public boolean isMmsEnabled() {
        return mmsEnabled;
    }

    public Iec61850Config setMmsEnabled(boolean mmsEnabled) {
        this.mmsEnabled = mmsEnabled;
        return this;
    }

    public int getMmsPort() {
        return mmsPort;
    }

    public Iec61850Config setMmsPort(int mmsPort) {
        this.mmsPort = mmsPort;
        return this;
    }

    public List<String> getLogicalDevices() {
        return Collections.unmodifiableList(logicalDevices);
    }

    public Iec61850Config addLogicalDevice(String logicalDevice) {
        logicalDevices.add(Objects.requireNonNull(logicalDevice));
        return this;
    }

    Iec61850Config copy() {
        Iec61850Config copy = new Iec61850Config();
        copy.enabled = enabled;
        copy.iedName = iedName;
        copy.apName = apName;
        copy.gooseEnabled = gooseEnabled;
        copy.gooseAppId = gooseAppId;
        copy.gooseMulticastMac = gooseMulticastMac;
        copy.gooseVlanId = gooseVlanId;
        copy.gooseVlanPriority = gooseVlanPriority;
        copy.mmsEnabled = mmsEnabled;
        copy.mmsPort = mmsPort;
        copy.logicalDevices.clear();
        copy.logicalDevices.addAll(logicalDevices);
        return copy;
    }
}
