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

/**
 * DNP3 request carried by a polling flow, used to estimate request and response sizes.
 */
public class Dnp3MessageConfig {

    static final int HEADER_BYTES = 10;

    static final int OBJECT_HEADER_BYTES = 3;

    private Dnp3FunctionCode functionCode = Dnp3FunctionCode.READ;

    private final List<Dnp3Object> objects = new ArrayList<>();

    private boolean class1;

    private boolean class2;

    private boolean class3;

    private boolean integrityScan;

    private boolean confirmRequired;

    private boolean unsolicited;

    /**
     * An integrity scan reading all classes plus the static binary inputs, analog inputs and counters.
     */
    public static Dnp3MessageConfig integrityPoll() {
        Dnp3MessageConfig config = new Dnp3MessageConfig();
        config.integrityScan = true;
        config.objects.add(new Dnp3Object(Dnp3Object.BINARY_INPUT, 2, 32));
        config.objects.add(new Dnp3Object(Dnp3Object.ANALOG_INPUT, 1, 32));
        config.objects.add(new Dnp3Object(Dnp3Object.COUNTER, 1, 8));
        return config.setAllClasses(true);
    }

    public Dnp3FunctionCode getFunctionCode() {
        return functionCode;
    }

    public Dnp3MessageConfig setFunctionCode(Dnp3FunctionCode functionCode) {
        this.functionCode = Objects.requireNonNull(functionCode);
        return this;
    }

    public List<Dnp3Object> getObjects() {
        return Collections.unmodifiableList(objects);
    }

    public Dnp3MessageConfig addObject(Dnp3Object object) {
        objects.add(Objects.requireNonNull(object));
        return this;
    }

    public boolean isClass1() {
        return class1;
    }

    public boolean isClass2() {
        return class2;
    }

    public boolean isClass3() {
        return class3;
    }

    public Dnp3MessageConfig setAllClasses(boolean enabled) {
        class1 = enabled;
        class2 = enabled;
        class3 = enabled;
        return this;
    }

    public boolean isIntegrityScan() {
        return integrityScan;
    }

    public boolean isConfirmRequired() {
        return confirmRequired;
    }

    public Dnp3MessageConfig setConfirmRequired(boolean confirmRequired) {
        this.confirmRequired = confirmRequired;
        return this;
    }

    public boolean isUnsolicited() {
        return unsolicited;
    }

    public Dnp3MessageConfig setUnsolicited(boolean unsolicited) {
        this.unsolicited = unsolicited;
        return this;
    }

    public int getEstimatedRequestBytes() {
        return HEADER_BYTES + objects.size() * 2;
    }

    public int getEstimatedResponseBytes() {
        int size = HEADER_BYTES;
        for (Dnp3Object object : objects) {
            size += object.count() * object.getBytesPerPoint() + OBJECT_HEADER_BYTES;
        }
        return size;
    }

    Dnp3MessageConfig copy() {
        Dnp3MessageConfig copy = new Dnp3MessageConfig();
        copy.functionCode = functionCode;
        copy.objects.addAll(objects);
        copy.class1 = class1;
        copy.class2 = class2;
        copy.class3 = class3;
        copy.integrityScan = integrityScan;
        copy.confirmRequired = confirmRequired;
        copy.unsolicited = unsolicited;
        return copy;
    }
}
