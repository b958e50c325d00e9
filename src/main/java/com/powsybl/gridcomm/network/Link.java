/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

import com.powsybl.commons.PowsyblException;

import java.util.Objects;

/**
 * A channel between exactly two (node, port) endpoints.
 */
public class Link extends AbstractElement {

    public static final String DATA_RATE_DEFAULT_VALUE = "100Mbps";

    public static final String DELAY_DEFAULT_VALUE = "2ms";

    private final LinkEndpoint source;

    private final LinkEndpoint target;

    private ChannelKind channel = ChannelKind.POINT_TO_POINT;

    protected String dataRate = DATA_RATE_DEFAULT_VALUE;

    protected String delay = DELAY_DEFAULT_VALUE;

    public Link(String id, LinkEndpoint source, LinkEndpoint target) {
        super(id, id);
        this.source = Objects.requireNonNull(source);
        this.target = Objects.requireNonNull(target);
    }

    protected Link(Link other) {
        super(other.id, other.name);
        source = other.source;
        target = other.target;
        channel = other.channel;
        dataRate = other.dataRate;
        delay = other.delay;
        copyPropertiesFrom(other);
    }

    public Link copy() {
        return new Link(this);
    }

    public LinkEndpoint getSource() {
        return source;
    }

    public LinkEndpoint getTarget() {
        return target;
    }

    public LinkEndpoint getEndpoint(LinkSide side) {
        return side == LinkSide.SOURCE ? source : target;
    }

    public String getSourceNodeId() {
        return source.nodeId();
    }

    public String getTargetNodeId() {
        return target.nodeId();
    }

    public boolean touches(String nodeId) {
        return source.nodeId().equals(nodeId) || target.nodeId().equals(nodeId);
    }

    public LinkSide getSide(String nodeId) {
        if (source.nodeId().equals(nodeId)) {
            return LinkSide.SOURCE;
        } else if (target.nodeId().equals(nodeId)) {
            return LinkSide.TARGET;
        }
        throw new PowsyblException("Node " + nodeId + " is not an endpoint of link " + id);
    }

    public String getOtherNodeId(String nodeId) {
        return getEndpoint(getSide(nodeId).getOpposite()).nodeId();
    }

    public ChannelKind getChannel() {
        return channel;
    }

    public Link setChannel(ChannelKind channel) {
        this.channel = Objects.requireNonNull(channel);
        return this;
    }

    public String getDataRate() {
        return dataRate;
    }

    public Link setDataRate(String dataRate) {
        this.dataRate = Objects.requireNonNull(dataRate);
        return this;
    }

    public String getDelay() {
        return delay;
    }

    public Link setDelay(String delay) {
        this.delay = Objects.requireNonNull(delay);
        return this;
    }
}
