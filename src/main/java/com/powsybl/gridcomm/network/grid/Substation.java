/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import java.util.*;

/**
 * Logical grouping of the RTUs, IEDs and gateways of one electrical substation. A substation is not a node of the
 * communication network.
 */
public class Substation {

    private final String id;

    private String name;

    private String region = "";

    private double latitude;

    private double longitude;

    private final List<VoltageLevel> voltageLevels = new ArrayList<>();

    private boolean transmission = true;

    private String primaryCommPath = "";

    private String backupCommPath = "";

    private final List<String> rtuIds = new ArrayList<>();

    private final List<String> iedIds = new ArrayList<>();

    private final List<String> gatewayIds = new ArrayList<>();

    public Substation(String id) {
        this(id, "Substation_" + id);
    }

    public Substation(String id, String name) {
        this.id = Objects.requireNonNull(id);
        this.name = Objects.requireNonNull(name);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Substation setName(String name) {
        this.name = Objects.requireNonNull(name);
        return this;
    }

    public String getRegion() {
        return region;
    }

    public Substation setRegion(String region) {
        this.region = Objects.requireNonNull(region);
        return this;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public Substation setCoordinates(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
        return this;
    }

    public List<VoltageLevel> getVoltageLevels() {
        return Collections.unmodifiableList(voltageLevels);
    }

    public Substation addVoltageLevel(VoltageLevel voltageLevel) {
        voltageLevels.add(Objects.requireNonNull(voltageLevel));
        return this;
    }

    public boolean isTransmission() {
        return transmission;
    }

    public Substation setTransmission(boolean transmission) {
        this.transmission = transmission;
        return this;
    }

    public String getPrimaryCommPath() {
        return primaryCommPath;
    }

    public Substation setPrimaryCommPath(String primaryCommPath) {
        this.primaryCommPath = Objects.requireNonNull(primaryCommPath);
        return this;
    }

    public String getBackupCommPath() {
        return backupCommPath;
    }

    public Substation setBackupCommPath(String backupCommPath) {
        this.backupCommPath = Objects.requireNonNull(backupCommPath);
        return this;
    }

    public List<String> getRtuIds() {
        return Collections.unmodifiableList(rtuIds);
    }

    public List<String> getIedIds() {
        return Collections.unmodifiableList(iedIds);
    }

    public List<String> getGatewayIds() {
        return Collections.unmodifiableList(gatewayIds);
    }

    public List<String> getDeviceIds() {
        List<String> ids = new ArrayList<>(rtuIds);
        ids.addAll(iedIds);
        ids.addAll(gatewayIds);
        return ids;
    }

    public int getDeviceCount() {
        return rtuIds.size() + iedIds.size() + gatewayIds.size();
    }

    /**
     * Attaches a device to this substation. Only RTUs, IEDs and gateways are listed, other types just get their
     * substation id set.
     */
    public void addDevice(GridNode node) {
        Objects.requireNonNull(node);
        node.setSubstationId(id);
        List<String> ids = switch (node.getGridType()) {
            case RTU -> rtuIds;
            case IED -> iedIds;
            case GATEWAY -> gatewayIds;
            default -> null;
        };
        if (ids != null && !ids.contains(node.getId())) {
            ids.add(node.getId());
        }
    }
}
