/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.converter;

import com.powsybl.gridcomm.address.AddressingParameters;

import java.util.Objects;

public class ConverterParameters {

    public static final double NODE_SPACING_DEFAULT_VALUE = 150;

    public static final int LINE_LAYOUT_THRESHOLD_DEFAULT_VALUE = 4;

    public static final int VIRTUAL_SWITCH_MEMBER_THRESHOLD_DEFAULT_VALUE = 2;

    private double nodeSpacing = NODE_SPACING_DEFAULT_VALUE;

    private int lineLayoutThreshold = LINE_LAYOUT_THRESHOLD_DEFAULT_VALUE;

    private int virtualSwitchMemberThreshold = VIRTUAL_SWITCH_MEMBER_THRESHOLD_DEFAULT_VALUE;

    private AddressingParameters addressingParameters = new AddressingParameters();

    public double getNodeSpacing() {
        return nodeSpacing;
    }

    public ConverterParameters setNodeSpacing(double nodeSpacing) {
        if (nodeSpacing <= 0) {
            throw new IllegalArgumentException("Invalid node spacing: " + nodeSpacing);
        }
        this.nodeSpacing = nodeSpacing;
        return this;
    }

    /**
     * Up to this number of non-switch nodes, nodes are laid out on a line, beyond on a circle.
     */
    public int getLineLayoutThreshold() {
        return lineLayoutThreshold;
    }

    public ConverterParameters setLineLayoutThreshold(int lineLayoutThreshold) {
        this.lineLayoutThreshold = lineLayoutThreshold;
        return this;
    }

    /**
     * A shared medium segment gets a virtual switch only when it has more members than this.
     */
    public int getVirtualSwitchMemberThreshold() {
        return virtualSwitchMemberThreshold;
    }

    public ConverterParameters setVirtualSwitchMemberThreshold(int virtualSwitchMemberThreshold) {
        this.virtualSwitchMemberThreshold = virtualSwitchMemberThreshold;
        return this;
    }

    public AddressingParameters getAddressingParameters() {
        return addressingParameters;
    }

    public ConverterParameters setAddressingParameters(AddressingParameters addressingParameters) {
        this.addressingParameters = Objects.requireNonNull(addressingParameters);
        return this;
    }

    @Override
    public String toString() {
        return "ConverterParameters(" +
                "nodeSpacing=" + nodeSpacing +
                ", lineLayoutThreshold=" + lineLayoutThreshold +
                ", virtualSwitchMemberThreshold=" + virtualSwitchMemberThreshold +
                ", addressingParameters=" + addressingParameters +
                ')';
    }
}
