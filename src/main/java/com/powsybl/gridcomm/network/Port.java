/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.gridcomm.util.Ipv4Addresses;

import java.util.Objects;

/**
 * Network attachment point of a node. A port is bound to at most one link, and the binding is only changed by
 * {@link Network} so that the port and the link always reference each other.
 */
public class Port {

    public static final String DUPLEX_DEFAULT_VALUE = "full";

    public static final int MTU_DEFAULT_VALUE = 1500;

    public static final int VLAN_ID_DEFAULT_VALUE = 1;

    public static final String TRUNK_ALLOWED_VLANS_DEFAULT_VALUE = "1-4094";

    public static final String NETMASK_DEFAULT_VALUE = Ipv4Addresses.NETMASK_24;

    private final String id;

    private final int number;

    private final PortType type;

    private String name;

    private String speed;

    private String duplex = DUPLEX_DEFAULT_VALUE;

    private boolean enabled = true;

    private int mtu = MTU_DEFAULT_VALUE;

    private String macAddress;

    private int vlanId = VLAN_ID_DEFAULT_VALUE;

    private VlanMode vlanMode = VlanMode.ACCESS;

    private String trunkAllowedVlans = TRUNK_ALLOWED_VLANS_DEFAULT_VALUE;

    private String ipAddress;

    private String netmask = NETMASK_DEFAULT_VALUE;

    private String linkId;

    public Port(String id, int number, PortType type) {
        this.id = Objects.requireNonNull(id);
        this.number = number;
        this.type = Objects.requireNonNull(type);
        this.name = type.getPrefix() + number;
        this.speed = type.getSpeed();
    }

    public String getId() {
        return id;
    }

    public int getNumber() {
        return number;
    }

    public PortType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public Port setName(String name) {
        this.name = Objects.requireNonNull(name);
        return this;
    }

    public String getSpeed() {
        return speed;
    }

    public Port setSpeed(String speed) {
        this.speed = Objects.requireNonNull(speed);
        return this;
    }

    public String getDuplex() {
        return duplex;
    }

    public Port setDuplex(String duplex) {
        this.duplex = Objects.requireNonNull(duplex);
        return this;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Port setEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public int getMtu() {
        return mtu;
    }

    public Port setMtu(int mtu) {
        this.mtu = mtu;
        return this;
    }

    public String getMacAddress() {
        return macAddress;
    }

    public Port setMacAddress(String macAddress) {
        this.macAddress = macAddress;
        return this;
    }

    public int getVlanId() {
        return vlanId;
    }

    public Port setVlanId(int vlanId) {
        if (vlanId < 1 || vlanId > 4094) {
            throw new PowsyblException("Invalid VLAN id " + vlanId + " on port " + id);
        }
        this.vlanId = vlanId;
        return this;
    }

    public VlanMode getVlanMode() {
        return vlanMode;
    }

    public Port setVlanMode(VlanMode vlanMode) {
        this.vlanMode = Objects.requireNonNull(vlanMode);
        return this;
    }

    public String getTrunkAllowedVlans() {
        return trunkAllowedVlans;
    }

    public Port setTrunkAllowedVlans(String trunkAllowedVlans) {
        this.trunkAllowedVlans = Objects.requireNonNull(trunkAllowedVlans);
        return this;
    }

    /**
     * @return the configured address, or null when none
     */
    public String getIpAddress() {
        return ipAddress;
    }

    public boolean hasIpAddress() {
        return ipAddress != null && !ipAddress.isEmpty();
    }

    public String getNetmask() {
        return netmask;
    }

    public Port setAddress(String ipAddress, String netmask) {
        if (!Ipv4Addresses.isValid(ipAddress)) {
            throw new PowsyblException("Invalid IPv4 address '" + ipAddress + "' on port " + id);
        }
        this.ipAddress = ipAddress;
        this.netmask = Objects.requireNonNull(netmask);
        return this;
    }

    public Port setIpAddress(String ipAddress) {
        return setAddress(ipAddress, netmask);
    }

    public void clearAddress() {
        ipAddress = null;
        netmask = NETMASK_DEFAULT_VALUE;
    }

    /**
     * @return id of the link this port is bound to, or null when free
     */
    public String getLinkId() {
        return linkId;
    }

    public boolean isBound() {
        return linkId != null;
    }

    void bind(String linkId) {
        if (this.linkId != null) {
            throw new PowsyblException("Port " + id + " is already bound to link " + this.linkId);
        }
        this.linkId = Objects.requireNonNull(linkId);
    }

    void unbind() {
        linkId = null;
    }

    Port copy() {
        Port copy = new Port(id, number, type);
        copy.name = name;
        copy.speed = speed;
        copy.duplex = duplex;
        copy.enabled = enabled;
        copy.mtu = mtu;
        copy.macAddress = macAddress;
        copy.vlanId = vlanId;
        copy.vlanMode = vlanMode;
        copy.trunkAllowedVlans = trunkAllowedVlans;
        copy.ipAddress = ipAddress;
        copy.netmask = netmask;
        copy.linkId = linkId;
        return copy;
    }

    @Override
    public String toString() {
        return id;
    }
}
