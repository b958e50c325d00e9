/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.util;

import com.google.common.net.InetAddresses;
import com.powsybl.commons.PowsyblException;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.Objects;

/**
 * Dotted-quad IPv4 helpers. Addresses are kept as strings in the model, as the generated scripts consume them.
 */
public final class Ipv4Addresses {

    public static final String ANY = "0.0.0.0";

    public static final String NETMASK_24 = "255.255.255.0";

    private Ipv4Addresses() {
    }

    public static boolean isValid(String address) {
        return address != null && InetAddresses.isInetAddress(address) && InetAddresses.forString(address) instanceof Inet4Address;
    }

    public static int toInt(String address) {
        Objects.requireNonNull(address);
        if (!isValid(address)) {
            throw new PowsyblException("Invalid IPv4 address '" + address + "'");
        }
        return InetAddresses.coerceToInteger(InetAddresses.forString(address));
    }

    public static String fromInt(int value) {
        InetAddress address = InetAddresses.fromInteger(value);
        return InetAddresses.toAddrString(address);
    }

    public static String prefixToNetmask(int prefixLength) {
        if (prefixLength < 0 || prefixLength > 32) {
            throw new PowsyblException("Invalid prefix length " + prefixLength);
        }
        int mask = prefixLength == 0 ? 0 : -1 << (32 - prefixLength);
        return fromInt(mask);
    }

    public static int netmaskToPrefix(String netmask) {
        return Integer.bitCount(toInt(netmask));
    }

    public static String networkOf(String address, int prefixLength) {
        int mask = prefixLength == 0 ? 0 : -1 << (32 - prefixLength);
        return fromInt(toInt(address) & mask);
    }

    /**
     * Network address of the /24 containing the given address, for instance {@code 10.1.3.0} for {@code 10.1.3.7}.
     */
    public static String subnet24(String address) {
        return networkOf(address, 24);
    }

    public static int hostOctet(String address) {
        return toInt(address) & 0xFF;
    }

    public static String withHostNumber(String subnet, int hostNumber) {
        return fromInt((toInt(subnet) & 0xFFFFFF00) | (hostNumber & 0xFF));
    }

    public static boolean sameNetwork(String address1, String address2, int prefixLength) {
        return networkOf(address1, prefixLength).equals(networkOf(address2, prefixLength));
    }
}
