/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import com.powsybl.commons.PowsyblException;
import com.powsybl.gridcomm.network.Link;
import com.powsybl.gridcomm.network.LinkEndpoint;
import com.powsybl.gridcomm.network.Network;

import java.util.Objects;
import java.util.Optional;

/**
 * A link refined with its grid communication technology.
 * <p>
 * The channel kind follows the {@link GridLinkType}. Rate, delay, bit error rate and reliability class come from
 * {@link Overrides} when given, from the type defaults otherwise, and are resolved once at construction.
 * Radio, cellular and satellite links carry exactly one matching {@link PhysicalParameters} block.
 */
public class GridLink extends Link {

    public static final double MTBF_HOURS_DEFAULT_VALUE = 8760;
    public static final double MTTR_HOURS_DEFAULT_VALUE = 4;
    public static final int FAILOVER_TIME_MS_DEFAULT_VALUE = 5000;

    public static class Overrides {

        private String dataRate;

        private String delay;

        private Double bitErrorRate;

        private ReliabilityClass reliabilityClass;

        private PhysicalParameters physicalParameters;

        public Optional<String> getDataRate() {
            return Optional.ofNullable(dataRate);
        }

        public Overrides setDataRate(String dataRate) {
            this.dataRate = dataRate;
            return this;
        }

        public Optional<String> getDelay() {
            return Optional.ofNullable(delay);
        }

        public Overrides setDelay(String delay) {
            this.delay = delay;
            return this;
        }

        public Optional<Double> getBitErrorRate() {
            return Optional.ofNullable(bitErrorRate);
        }

        public Overrides setBitErrorRate(Double bitErrorRate) {
            this.bitErrorRate = bitErrorRate;
            return this;
        }

        public Optional<ReliabilityClass> getReliabilityClass() {
            return Optional.ofNullable(reliabilityClass);
        }

        public Overrides setReliabilityClass(ReliabilityClass reliabilityClass) {
            this.reliabilityClass = reliabilityClass;
            return this;
        }

        public Optional<PhysicalParameters> getPhysicalParameters() {
            return Optional.ofNullable(physicalParameters);
        }

        public Overrides setPhysicalParameters(PhysicalParameters physicalParameters) {
            this.physicalParameters = physicalParameters;
            return this;
        }
    }

    private final GridLinkType gridLinkType;

    private double bitErrorRate;

    private ReliabilityClass reliabilityClass;

    private final PhysicalParameters physicalParameters;

    private double distanceKm = 0;

    private double packetErrorRate = 0;

    private boolean burstErrorEnabled = false;

    private double burstErrorRate = 0;

    private double mtbfHours = MTBF_HOURS_DEFAULT_VALUE;

    private double mttrHours = MTTR_HOURS_DEFAULT_VALUE;

    private LinkOwnership ownership = LinkOwnership.UTILITY_OWNED;

    private String carrierName = "";

    private String circuitId = "";

    private boolean backupPath = false;

    private String backupForLinkId = "";

    private String primaryLinkId = "";

    private int failoverTimeMs = FAILOVER_TIME_MS_DEFAULT_VALUE;

    private boolean autoFailover = true;

    private int trafficPriority = 0;

    public GridLink(String id, LinkEndpoint source, LinkEndpoint target, GridLinkType gridLinkType) {
        this(id, source, target, gridLinkType, new Overrides());
    }

    public GridLink(String id, LinkEndpoint source, LinkEndpoint target, GridLinkType gridLinkType, Overrides overrides) {
        super(id, source, target);
        this.gridLinkType = Objects.requireNonNull(gridLinkType);
        Objects.requireNonNull(overrides);
        setChannel(gridLinkType.getChannel());
        dataRate = overrides.getDataRate().orElse(gridLinkType.getDefaultDataRate());
        delay = overrides.getDelay().orElse(gridLinkType.getDefaultDelay());
        bitErrorRate = overrides.getBitErrorRate().orElse(gridLinkType.getDefaultBitErrorRate());
        reliabilityClass = overrides.getReliabilityClass().orElse(gridLinkType.getDefaultReliabilityClass());
        physicalParameters = overrides.getPhysicalParameters()
                .map(p -> checkParameters(id, gridLinkType, p))
                .orElseGet(() -> defaultParameters(gridLinkType));
    }

    protected GridLink(GridLink other) {
        super(other);
        gridLinkType = other.gridLinkType;
        bitErrorRate = other.bitErrorRate;
        reliabilityClass = other.reliabilityClass;
        physicalParameters = other.physicalParameters != null ? other.physicalParameters.copy() : null;
        distanceKm = other.distanceKm;
        packetErrorRate = other.packetErrorRate;
        burstErrorEnabled = other.burstErrorEnabled;
        burstErrorRate = other.burstErrorRate;
        mtbfHours = other.mtbfHours;
        mttrHours = other.mttrHours;
        ownership = other.ownership;
        carrierName = other.carrierName;
        circuitId = other.circuitId;
        backupPath = other.backupPath;
        backupForLinkId = other.backupForLinkId;
        primaryLinkId = other.primaryLinkId;
        failoverTimeMs = other.failoverTimeMs;
        autoFailover = other.autoFailover;
        trafficPriority = other.trafficPriority;
    }

    private static PhysicalParameters defaultParameters(GridLinkType type) {
        if (type.isRadio()) {
            return new WirelessParameters();
        } else if (type.isCellular()) {
            return new CellularParameters();
        } else if (type == GridLinkType.SATELLITE_LEO) {
            return SatelliteParameters.leo();
        } else if (type == GridLinkType.SATELLITE_GEO) {
            return new SatelliteParameters();
        }
        return null;
    }

    private static PhysicalParameters checkParameters(String id, GridLinkType type, PhysicalParameters parameters) {
        boolean matches = type.isRadio() && parameters instanceof WirelessParameters
                || type.isCellular() && parameters instanceof CellularParameters
                || type.isSatellite() && parameters instanceof SatelliteParameters;
        if (!matches) {
            throw new PowsyblException("Link '" + id + "' of type " + type + " cannot carry "
                    + parameters.getClass().getSimpleName());
        }
        return parameters;
    }

    /**
     * Factory connecting a backup path between the same two nodes as the given primary link, on free ports.
     */
    public static Network.LinkFactory<GridLink> backupOf(GridLink primary, GridLinkType backupType) {
        Objects.requireNonNull(primary);
        Objects.requireNonNull(backupType);
        return (id, source, target) -> {
            GridLink backup = new GridLink(id, source, target, backupType);
            backup.distanceKm = primary.distanceKm;
            backup.backupPath = true;
            backup.backupForLinkId = primary.getId();
            backup.primaryLinkId = primary.getId();
            return backup;
        };
    }

    @Override
    public GridLink copy() {
        return new GridLink(this);
    }

    public GridLinkType getGridLinkType() {
        return gridLinkType;
    }

    public boolean isWireless() {
        return gridLinkType.isWireless();
    }

    /**
     * Only geostationary satellite hops exceed 100 ms one way.
     */
    public boolean isHighLatency() {
        return gridLinkType == GridLinkType.SATELLITE_GEO;
    }

    public Optional<PhysicalParameters> getPhysicalParameters() {
        return Optional.ofNullable(physicalParameters);
    }

    public Optional<WirelessParameters> getWirelessParameters() {
        return physicalParameters instanceof WirelessParameters w ? Optional.of(w) : Optional.empty();
    }

    public Optional<CellularParameters> getCellularParameters() {
        return physicalParameters instanceof CellularParameters c ? Optional.of(c) : Optional.empty();
    }

    public Optional<SatelliteParameters> getSatelliteParameters() {
        return physicalParameters instanceof SatelliteParameters s ? Optional.of(s) : Optional.empty();
    }

    public double getBitErrorRate() {
        return bitErrorRate;
    }

    public GridLink setBitErrorRate(double bitErrorRate) {
        this.bitErrorRate = bitErrorRate;
        return this;
    }

    public ReliabilityClass getReliabilityClass() {
        return reliabilityClass;
    }

    public GridLink setReliabilityClass(ReliabilityClass reliabilityClass) {
        this.reliabilityClass = Objects.requireNonNull(reliabilityClass);
        return this;
    }

    /**
     * Receive error model to install on both devices, empty for an error free link. A burst model replaces the
     * bit rate model when burst errors are enabled.
     */
    public Optional<ErrorModel> getErrorModel() {
        if (bitErrorRate <= 0) {
            return Optional.empty();
        }
        return Optional.of(burstErrorEnabled
                ? new ErrorModel(ErrorModel.Kind.BURST, burstErrorRate)
                : new ErrorModel(ErrorModel.Kind.RATE, bitErrorRate));
    }

    public double getAvailabilityPercent() {
        if (mtbfHours <= 0) {
            return 0;
        }
        return mtbfHours / (mtbfHours + mttrHours) * 100;
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    public GridLink setDistanceKm(double distanceKm) {
        this.distanceKm = distanceKm;
        return this;
    }

    public double getPacketErrorRate() {
        return packetErrorRate;
    }

    public GridLink setPacketErrorRate(double packetErrorRate) {
        this.packetErrorRate = packetErrorRate;
        return this;
    }

    public boolean isBurstErrorEnabled() {
        return burstErrorEnabled;
    }

    public GridLink setBurstErrorEnabled(boolean burstErrorEnabled) {
        this.burstErrorEnabled = burstErrorEnabled;
        return this;
    }

    public double getBurstErrorRate() {
        return burstErrorRate;
    }

    public GridLink setBurstErrorRate(double burstErrorRate) {
        this.burstErrorRate = burstErrorRate;
        return this;
    }

    public double getMtbfHours() {
        return mtbfHours;
    }

    public GridLink setMtbfHours(double mtbfHours) {
        this.mtbfHours = mtbfHours;
        return this;
    }

    public double getMttrHours() {
        return mttrHours;
    }

    public GridLink setMttrHours(double mttrHours) {
        this.mttrHours = mttrHours;
        return this;
    }

    public LinkOwnership getOwnership() {
        return ownership;
    }

    public GridLink setOwnership(LinkOwnership ownership) {
        this.ownership = Objects.requireNonNull(ownership);
        return this;
    }

    public String getCarrierName() {
        return carrierName;
    }

    public GridLink setCarrierName(String carrierName) {
        this.carrierName = Objects.requireNonNull(carrierName);
        return this;
    }

    public String getCircuitId() {
        return circuitId;
    }

    public GridLink setCircuitId(String circuitId) {
        this.circuitId = Objects.requireNonNull(circuitId);
        return this;
    }

    public boolean isBackupPath() {
        return backupPath;
    }

    public String getBackupForLinkId() {
        return backupForLinkId;
    }

    public String getPrimaryLinkId() {
        return primaryLinkId;
    }

    public int getFailoverTimeMs() {
        return failoverTimeMs;
    }

    public GridLink setFailoverTimeMs(int failoverTimeMs) {
        this.failoverTimeMs = failoverTimeMs;
        return this;
    }

    public boolean isAutoFailover() {
        return autoFailover;
    }

    public GridLink setAutoFailover(boolean autoFailover) {
        this.autoFailover = autoFailover;
        return this;
    }

    public int getTrafficPriority() {
        return trafficPriority;
    }

    public GridLink setTrafficPriority(int trafficPriority) {
        this.trafficPriority = trafficPriority;
        return this;
    }
}
