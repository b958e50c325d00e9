/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

import java.util.Objects;

/**
 * Identifies an extracted node by the container variable it was created in and its index in that container.
 */
public record NodeKey(String container, int index) implements Comparable<NodeKey> {

    public NodeKey {
        Objects.requireNonNull(container);
    }

    @Override
    public int compareTo(NodeKey other) {
        int c = container.compareTo(other.container);
        return c != 0 ? c : Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return container + "[" + index + "]";
    }
}
