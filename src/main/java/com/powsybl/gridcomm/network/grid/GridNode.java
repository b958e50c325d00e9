/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import com.powsybl.gridcomm.network.Node;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A node refined with its grid equipment type.
 * <p>
 * Role, scan class and protocol are resolved once at construction: an explicit value given through
 * {@link Overrides} wins, otherwise the default of the {@link GridNodeType} applies. They are never recomputed
 * afterwards, and a later setter call only changes the stored value.
 */
public class GridNode extends Node {

    public static final int POLLING_GROUP_DEFAULT_VALUE = 1;
    public static final int RESPONSE_TIMEOUT_MS_DEFAULT_VALUE = 5000;
    public static final int RETRY_COUNT_DEFAULT_VALUE = 3;
    public static final int FAILOVER_TRIGGER_MS_DEFAULT_VALUE = 10000;

    /**
     * Values a caller sets explicitly, each one left empty to take the type default.
     */
    public static class Overrides {

        private GridNodeRole role;

        private ScanClass scanClass;

        private GridProtocol protocol;

        public Optional<GridNodeRole> getRole() {
            return Optional.ofNullable(role);
        }

        public Overrides setRole(GridNodeRole role) {
            this.role = role;
            return this;
        }

        public Optional<ScanClass> getScanClass() {
            return Optional.ofNullable(scanClass);
        }

        public Overrides setScanClass(ScanClass scanClass) {
            this.scanClass = scanClass;
            return this;
        }

        public Optional<GridProtocol> getProtocol() {
            return Optional.ofNullable(protocol);
        }

        public Overrides setProtocol(GridProtocol protocol) {
            this.protocol = protocol;
            return this;
        }
    }

    private final GridNodeType gridType;

    private GridNodeRole role;

    private ScanClass scanClass;

    private GridProtocol protocol;

    private String substationId = "";

    private String parentNodeId = "";

    private VoltageLevel voltageLevel;

    private final Dnp3Config dnp3Config;

    private final Iec61850Config iec61850Config;

    private String primaryIp = "";

    private String backupIp = "";

    private int pollingGroup = POLLING_GROUP_DEFAULT_VALUE;

    private int pollIntervalMs = 0;

    private int responseTimeoutMs = RESPONSE_TIMEOUT_MS_DEFAULT_VALUE;

    private int retryCount = RETRY_COUNT_DEFAULT_VALUE;

    private boolean backup = false;

    private String redundancyGroup = "";

    private int failoverPriority = 0;

    private int failoverTriggerMs = FAILOVER_TRIGGER_MS_DEFAULT_VALUE;

    public GridNode(String id, GridNodeType gridType) {
        this(id, gridType, new Overrides());
    }

    public GridNode(String id, GridNodeType gridType, Overrides overrides) {
        this(id, defaultName(id, gridType), gridType, overrides);
    }

    public GridNode(String id, String name, GridNodeType gridType, Overrides overrides) {
        super(id, name, Objects.requireNonNull(gridType).getBaseKind());
        Objects.requireNonNull(overrides);
        this.gridType = gridType;
        this.role = overrides.getRole().orElse(gridType.getDefaultRole());
        this.scanClass = overrides.getScanClass().orElse(gridType.getDefaultScanClass());
        this.protocol = overrides.getProtocol().orElse(gridType.getDefaultProtocol());
        this.dnp3Config = new Dnp3Config();
        this.iec61850Config = new Iec61850Config();
    }

    protected GridNode(GridNode other) {
        super(other);
        gridType = other.gridType;
        role = other.role;
        scanClass = other.scanClass;
        protocol = other.protocol;
        substationId = other.substationId;
        parentNodeId = other.parentNodeId;
        voltageLevel = other.voltageLevel;
        dnp3Config = other.dnp3Config.copy();
        iec61850Config = other.iec61850Config.copy();
        primaryIp = other.primaryIp;
        backupIp = other.backupIp;
        pollingGroup = other.pollingGroup;
        pollIntervalMs = other.pollIntervalMs;
        responseTimeoutMs = other.responseTimeoutMs;
        retryCount = other.retryCount;
        backup = other.backup;
        redundancyGroup = other.redundancyGroup;
        failoverPriority = other.failoverPriority;
        failoverTriggerMs = other.failoverTriggerMs;
    }

    private static String defaultName(String id, GridNodeType gridType) {
        return gridType.name().toLowerCase(Locale.ROOT) + "_" + StringUtils.left(id, 4);
    }

    @Override
    public GridNode copy() {
        return new GridNode(this);
    }

    public GridNodeType getGridType() {
        return gridType;
    }

    public GridNodeRole getRole() {
        return role;
    }

    public GridNode setRole(GridNodeRole role) {
        this.role = Objects.requireNonNull(role);
        return this;
    }

    public ScanClass getScanClass() {
        return scanClass;
    }

    public GridNode setScanClass(ScanClass scanClass) {
        this.scanClass = Objects.requireNonNull(scanClass);
        return this;
    }

    public GridProtocol getProtocol() {
        return protocol;
    }

    public GridNode setProtocol(GridProtocol protocol) {
        this.protocol = Objects.requireNonNull(protocol);
        return this;
    }

    public boolean isMaster() {
        return role == GridNodeRole.MASTER;
    }

    public boolean isSlave() {
        return role == GridNodeRole.SLAVE;
    }

    public boolean isFieldDevice() {
        return gridType.isFieldDevice();
    }

    public boolean supportsGoose() {
        return (gridType == GridNodeType.IED || gridType == GridNodeType.RELAY)
                && iec61850Config.isEnabled()
                && iec61850Config.isGooseEnabled();
    }

    /**
     * The node poll interval when set, otherwise the interval of its scan class.
     */
    public int getEffectivePollIntervalMs() {
        return pollIntervalMs > 0 ? pollIntervalMs : scanClass.getPollIntervalMs();
    }

    public String getSubstationId() {
        return substationId;
    }

    public GridNode setSubstationId(String substationId) {
        this.substationId = Objects.requireNonNull(substationId);
        return this;
    }

    public String getParentNodeId() {
        return parentNodeId;
    }

    public GridNode setParentNodeId(String parentNodeId) {
        this.parentNodeId = Objects.requireNonNull(parentNodeId);
        return this;
    }

    public Optional<VoltageLevel> getVoltageLevel() {
        return Optional.ofNullable(voltageLevel);
    }

    public GridNode setVoltageLevel(VoltageLevel voltageLevel) {
        this.voltageLevel = voltageLevel;
        return this;
    }

    public Dnp3Config getDnp3Config() {
        return dnp3Config;
    }

    public Iec61850Config getIec61850Config() {
        return iec61850Config;
    }

    public String getPrimaryIp() {
        return primaryIp;
    }

    public GridNode setPrimaryIp(String primaryIp) {
        this.primaryIp = Objects.requireNonNull(primaryIp);
        return this;
    }

    public String getBackupIp() {
        return backupIp;
    }

    public GridNode setBackupIp(String backupIp) {
        this.backupIp = Objects.requireNonNull(backupIp);
        return this;
    }

    public int getPollingGroup() {
        return pollingGroup;
    }

    public GridNode setPollingGroup(int pollingGroup) {
        this.pollingGroup = pollingGroup;
        return this;
    }

    public int getPollIntervalMs() {
        return pollIntervalMs;
    }

    public GridNode setPollIntervalMs(int pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
        return this;
    }

    public int getResponseTimeoutMs() {
        return responseTimeoutMs;
    }

    public GridNode setResponseTimeoutMs(int responseTimeoutMs) {
        this.responseTimeoutMs = responseTimeoutMs;
        return this;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public GridNode setRetryCount(int retryCount) {
        this.retryCount = retryCount;
        return this;
    }

    public boolean isBackup() {
        return backup;
    }

    public GridNode setBackup(boolean backup) {
        this.backup = backup;
        return this;
    }

    public String getRedundancyGroup() {
        return redundancyGroup;
    }

    public GridNode setRedundancyGroup(String redundancyGroup) {
        this.redundancyGroup = Objects.requireNonNull(redundancyGroup);
        return this;
    }

    public int getFailoverPriority() {
        return failoverPriority;
    }

    public GridNode setFailoverPriority(int failoverPriority) {
        this.failoverPriority = failoverPriority;
        return this;
    }

    public int getFailoverTriggerMs() {
        return failoverTriggerMs;
    }

    public GridNode setFailoverTriggerMs(int failoverTriggerMs) {
        this.failoverTriggerMs = failoverTriggerMs;
        return this;
    }
}
