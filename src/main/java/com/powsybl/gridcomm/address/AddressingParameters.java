/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.address;

import com.powsybl.gridcomm.util.Ipv4Addresses;

import java.util.Objects;

/**
 * Settings of subnet synthesis. Synthesized subnets are {@code <prefix>.<n>.0/24}, n counting up from the first
 * subnet number.
 */
public class AddressingParameters {

    public static final String SUBNET_PREFIX_DEFAULT_VALUE = "10.1";

    public static final int FIRST_SUBNET_NUMBER_DEFAULT_VALUE = 1;

    public static final String NETMASK_DEFAULT_VALUE = Ipv4Addresses.NETMASK_24;

    private String subnetPrefix = SUBNET_PREFIX_DEFAULT_VALUE;

    private int firstSubnetNumber = FIRST_SUBNET_NUMBER_DEFAULT_VALUE;

    private String netmask = NETMASK_DEFAULT_VALUE;

    public String getSubnetPrefix() {
        return subnetPrefix;
    }

    public AddressingParameters setSubnetPrefix(String subnetPrefix) {
        this.subnetPrefix = Objects.requireNonNull(subnetPrefix);
        return this;
    }

    public int getFirstSubnetNumber() {
        return firstSubnetNumber;
    }

    public AddressingParameters setFirstSubnetNumber(int firstSubnetNumber) {
        this.firstSubnetNumber = firstSubnetNumber;
        return this;
    }

    public String getNetmask() {
        return netmask;
    }

    public AddressingParameters setNetmask(String netmask) {
        this.netmask = Objects.requireNonNull(netmask);
        return this;
    }

    @Override
    public String toString() {
        return "AddressingParameters(subnetPrefix=" + subnetPrefix
                + ", firstSubnetNumber=" + firstSubnetNumber
                + ", netmask=" + netmask
                + ")";
    }
}
