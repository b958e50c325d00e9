/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Free-form annotations attached to a topology element, such as the advisory role inferred during conversion.
 */
public abstract class AbstractPropertyBag {

    protected Map<String, String> properties;

    public String getProperty(String name) {
        Objects.requireNonNull(name);
        if (properties == null) {
            return null;
        }
        return properties.get(name);
    }

    public boolean hasProperty(String name) {
        return getProperty(name) != null;
    }

    public void setProperty(String name, String value) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(value);
        if (properties == null) {
            properties = new LinkedHashMap<>();
        }
        properties.put(name, value);
    }

    public void removeProperty(String name) {
        Objects.requireNonNull(name);
        if (properties != null) {
            properties.remove(name);
        }
    }

    public Map<String, String> getProperties() {
        return properties == null ? Collections.emptyMap() : Collections.unmodifiableMap(properties);
    }

    protected void copyPropertiesFrom(AbstractPropertyBag other) {
        if (other.properties != null) {
            properties = new LinkedHashMap<>(other.properties);
        }
    }
}
