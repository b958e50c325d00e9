/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

/**
 * DNP3 outstation or master settings of a grid node, with its point counts.
 */
public class Dnp3Config {

    public static final int MASTER_ADDRESS_DEFAULT_VALUE = 1;
    public static final int SLAVE_ADDRESS_DEFAULT_VALUE = 10;
    public static final int CONFIRM_TIMEOUT_MS_DEFAULT_VALUE = 1000;
    public static final int MAX_RETRIES_DEFAULT_VALUE = 3;
    public static final int RESPONSE_TIMEOUT_MS_DEFAULT_VALUE = 5000;

    private boolean enabled = true;
    private int masterAddress = MASTER_ADDRESS_DEFAULT_VALUE;
    private int slaveAddress = SLAVE_ADDRESS_DEFAULT_VALUE;
    private int confirmTimeoutMs = CONFIRM_TIMEOUT_MS_DEFAULT_VALUE;
    private int maxRetries = MAX_RETRIES_DEFAULT_VALUE;
    private int responseTimeoutMs = RESPONSE_TIMEOUT_MS_DEFAULT_VALUE;
    private boolean unsolicitedEnabled = true;
    private boolean class1Events = true;
    private boolean class2Events = true;
    private boolean class3Events = true;
    private int binaryInputs = 32;
    private int binaryOutputs = 16;
    private int analogInputs = 32;
    private int analogOutputs = 8;
    private int counters = 8;

    public boolean isEnabled() {
        return enabled;
    }

    public Dnp3Config setEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public int getMasterAddress() {
        return masterAddress;
    }

    public Dnp3Config setMasterAddress(int masterAddress) {
        this.masterAddress = masterAddress;
        return this;
    }

    public int getSlaveAddress() {
        return slaveAddress;
    }

    public Dnp3Config setSlaveAddress(int slaveAddress) {
        this.slaveAddress = slaveAddress;
        return this;
    }

    public int getConfirmTimeoutMs() {
        return confirmTimeoutMs;
    }

    public Dnp3Config setConfirmTimeoutMs(int confirmTimeoutMs) {
        this.confirmTimeoutMs = confirmTimeoutMs;
        return this;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Dnp3Config setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public int getResponseTimeoutMs() {
        return responseTimeoutMs;
    }

    public Dnp3Config setResponseTimeoutMs(int responseTimeoutMs) {
        this.responseTimeoutMs = responseTimeoutMs;
        return this;
    }

    public boolean isUnsolicitedEnabled() {
        return unsolicitedEnabled;
    }

    public Dnp3Config setUnsolicitedEnabled(boolean unsolicitedEnabled) {
        this.unsolicitedEnabled = unsolicitedEnabled;
        return this;
    }

    public boolean isClass1Events() {
        return class1Events;
    }

    public Dnp3Config setClass1Events(boolean class1Events) {
        this.class1Events = class1Events;
        return this;
    }

    public boolean isClass2Events() {
        return class2Events;
    }

    public Dnp3Config setClass2Events(boolean class2Events) {
        this.class2Events = class2Events;
        return this;
    }

    public boolean isClass3Events() {
        return class3Events;
    }

    public Dnp3Config setClass3Events(boolean class3Events) {
        this.class3Events = class3Events;
        return this;
    }

    public int getBinaryInputs() {
        return binaryInputs;
    }

    public Dnp3Config setBinaryInputs(int binaryInputs) {
        this.binaryInputs = binaryInputs;
        return this;
    }

    public int getBinaryOutputs() {
        return binaryOutputs;
    }

    public Dnp3Config setBinaryOutputs(int binaryOutputs) {
        this.binaryOutputs = binaryOutputs;
        return this;
    }

    public int getAnalogInputs() {
        return analogInputs;
    }

    public Dnp3Config setAnalogInputs(int analogInputs) {
        this.analogInputs = analogInputs;
        return this;
    }

    public int getAnalogOutputs() {
        return analogOutputs;
    }

    public Dnp3Config setAnalogOutputs(int analogOutputs) {
        this.analogOutputs = analogOutputs;
        return this;
    }

    public int getCounters() {
        return counters;
    }

    public Dnp3Config setCounters(int counters) {
        this.counters = counters;
        return this;
    }

    public int getPointCount() {
        return binaryInputs + binaryOutputs + analogInputs + analogOutputs + counters;
    }

    Dnp3Config copy() {
        Dnp3Config copy = new Dnp3Config();
        copy.enabled = enabled;
        copy.masterAddress = masterAddress;
        copy.slaveAddress = slaveAddress;
        copy.confirmTimeoutMs = confirmTimeoutMs;
        copy.maxRetries = maxRetries;
        copy.responseTimeoutMs = responseTimeoutMs;
        copy.unsolicitedEnabled = unsolicitedEnabled;
        copy.class1Events = class1Events;
        copy.class2Events = class2Events;
        copy.class3Events = class3Events;
        copy.binaryInputs = binaryInputs;
        copy.binaryOutputs = binaryOutputs;
        copy.analogInputs = analogInputs;
        copy.analogOutputs = analogOutputs;
        copy.counters = counters;
        return copy;
    }
}
