/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.address;

import com.powsybl.commons.PowsyblException;
import com.powsybl.gridcomm.util.Ipv4Addresses;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Addressing state of one resolution run: the subnets and addresses already taken, and the counter used to
 * synthesize fresh subnets. An allocator is never shared between runs.
 */
public class SubnetAllocator {

    private static final int MAX_HOST_NUMBER = 254;

    private final AddressingParameters parameters;

    private final Set<String> usedSubnets = new HashSet<>();

    private final Set<String> usedAddresses = new HashSet<>();

    private int nextSubnetNumber;

    public SubnetAllocator() {
        this(new AddressingParameters());
    }

    public SubnetAllocator(AddressingParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
        this.nextSubnetNumber = parameters.getFirstSubnetNumber();
    }

    public AddressingParameters getParameters() {
        return parameters;
    }

    /**
     * Marks a configured address, and its /24 subnet, as taken.
     */
    public void reserveAddress(String address) {
        usedAddresses.add(address);
        usedSubnets.add(Ipv4Addresses.subnet24(address));
    }

    /**
     * @return false when the subnet was already taken
     */
    public boolean reserveSubnet(String subnet) {
        return usedSubnets.add(subnet);
    }

    public boolean isAddressUsed(String address) {
        return usedAddresses.contains(address);
    }

    /**
     * Synthesizes the next subnet that no configured address lives in.
     */
    public String nextSubnet() {
        while (nextSubnetNumber <= 255) {
            String subnet = parameters.getSubnetPrefix() + "." + nextSubnetNumber++ + ".0";
            if (usedSubnets.add(subnet)) {
                return subnet;
            }
        }
        throw new PowsyblException("No subnet left under " + parameters.getSubnetPrefix() + ".0.0/16");
    }

    /**
     * Takes the lowest free host address of a /24 subnet.
     */
    public String nextHost(String subnet) {
        for (int n = 1; n <= MAX_HOST_NUMBER; n++) {
            String address = Ipv4Addresses.withHostNumber(subnet, n);
            if (usedAddresses.add(address)) {
                return address;
            }
        }
        throw new PowsyblException("No host address left in subnet " + subnet);
    }
}
