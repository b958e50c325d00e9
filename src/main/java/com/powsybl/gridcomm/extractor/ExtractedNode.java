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
 * A node materialized by a container creation. Role and medium hint are refined while the script is walked and
 * during post-processing.
 */
public class ExtractedNode {

    private final NodeKey key;

    private NodeRole role;

    private MediumHint mediumHint;

    private String inferredRole = "";

    public ExtractedNode(String container, int index, NodeRole role, MediumHint mediumHint) {
        this.key = new NodeKey(container, index);
        this.role = Objects.requireNonNull(role);
        this.mediumHint = Objects.requireNonNull(mediumHint);
    }

    public NodeKey getKey() {
        return key;
    }

    public String getContainer() {
        return key.container();
    }

    public int getIndex() {
        return key.index();
    }

    public NodeRole getRole() {
        return role;
    }

    public ExtractedNode setRole(NodeRole role) {
        this.role = Objects.requireNonNull(role);
        return this;
    }

    public MediumHint getMediumHint() {
        return mediumHint;
    }

    public ExtractedNode setMediumHint(MediumHint mediumHint) {
        this.mediumHint = Objects.requireNonNull(mediumHint);
        return this;
    }

    public String getInferredRole() {
        return inferredRole;
    }

    public ExtractedNode setInferredRole(String inferredRole) {
        this.inferredRole = Objects.requireNonNull(inferredRole);
        return this;
    }

    @Override
    public String toString() {
        return key.toString();
    }
}
