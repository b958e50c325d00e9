/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

import com.powsybl.gridcomm.extractor.ast.Expression;
import com.powsybl.gridcomm.extractor.ast.Expression.*;
import com.powsybl.gridcomm.extractor.ast.ExpressionWalker;
import com.powsybl.gridcomm.extractor.ast.Statement;
import com.powsybl.gridcomm.extractor.ast.Statement.*;
import com.powsybl.gridcomm.extractor.ast.StatementWalker;
import com.powsybl.gridcomm.simulation.TrafficProtocol;
import com.powsybl.gridcomm.util.Ipv4Addresses;
import com.powsybl.gridcomm.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Walks a parsed script once. Assignments feed a symbol table of the helpers, containers and numbers the script
 * declares, and every call is matched against the recognized method names of those symbols, in source order.
 */
class TopologyVisitor extends StatementWalker {

    private static final Logger LOGGER = LoggerFactory.getLogger(TopologyVisitor.class);

    static final int CREATE_COUNT_DEFAULT_VALUE = 3;

    private static final Set<String> SIMULATOR_OBJECTS = Set.of("Simulator", "ns");

    private record AddressBase(String base, String netmask) {
    }

    private record ContainerRange(String container, int start, Integer end) {
    }

    private record SocketAddress(String address, int port) {
    }

    /**
     * Configuration of an application helper, copied into every application it installs.
     */
    private static final class ApplicationConfig {

        private final ApplicationKind kind;
        private TrafficProtocol protocol = TrafficProtocol.UDP;
        private String remoteAddress = "";
        private int port = ExtractedApplication.PORT_DEFAULT_VALUE;
        private String dataRate = "";
        private int packetSize = 0;

        private ApplicationConfig(ApplicationKind kind) {
            this.kind = kind;
        }

        private ExtractedApplication newApplication(NodeKey node, String helperName) {
            return new ExtractedApplication(kind, node, helperName)
                    .setProtocol(protocol)
                    .setRemoteAddress(remoteAddress)
                    .setPort(port)
                    .setDataRate(dataRate)
                    .setPacketSize(packetSize);
        }
    }

    private final class CallWalker extends ExpressionWalker {

        @Override
        public Void visitCall(Call call) {
            processCall(call);
            return super.visitCall(call);
        }
    }

    private final ExtractionResult result;

    private final Map<String, Number> variables = new HashMap<>();

    private final Map<String, HelperKind> helperKinds = new HashMap<>();

    private final Map<String, ApplicationConfig> applicationHelpers = new HashMap<>();

    private final Map<String, AddressBase> addressBases = new HashMap<>();

    private final Map<String, ExtractedAddressAssignment> interfaceContainers = new HashMap<>();

    private final Map<String, List<ExtractedApplication>> applicationContainers = new HashMap<>();

    private final CallWalker callWalker = new CallWalker();

    private Call assignedCall;

    private String assignedName;

    private String installedDevices = "";

    TopologyVisitor(ExtractionResult result) {
        this.result = Objects.requireNonNull(result);
    }

    @Override
    protected void visitExpressions(List<Expression> expressions) {
        callWalker.walk(expressions);
    }

    @Override
    public Void visitClassDefinition(ClassDefinition statement) {
        return null;
    }

    @Override
    public Void visitAssignment(Assignment statement) {
        Expression value = statement.value();
        if (value != null && statement.targets().size() == 1 && statement.targets().get(0) instanceof Name name) {
            trackAssignment(name.id(), value);
            if (value instanceof Call call) {
                assignedCall = call;
                assignedName = name.id();
            }
        }
        super.visitAssignment(statement);
        assignedCall = null;
        assignedName = null;
        return null;
    }

    @Override
    public Void visitFor(For statement) {
        if (statement.target() instanceof Name loopVariable
                && statement.iterable() instanceof Call range
                && range.function() instanceof Name function && function.id().equals("range")) {
            Integer start = 0;
            Integer stop = null;
            if (range.arguments().size() == 1) {
                stop = intValue(range.arguments().get(0));
            } else if (range.arguments().size() >= 2) {
                start = intValue(range.arguments().get(0));
                stop = intValue(range.arguments().get(1));
            }
            if (start != null && stop != null) {
                processLoopBody(statement.body(), loopVariable.id(), start, stop);
            }
        }
        return super.visitFor(statement);
    }

    // symbol table

    private void trackAssignment(String name, Expression value) {
        if (value instanceof NumberLiteral number) {
            variables.put(name, number.value());
            return;
        }
        variables.remove(name);
        if (!(value instanceof Call call)) {
            return;
        }
        String callee = calleeName(call);
        if (callee == null) {
            return;
        }
        Optional<HelperKind> kind = HelperKind.ofClassName(callee);
        Optional<ApplicationKind> applicationKind = Arrays.stream(ApplicationKind.values())
                .filter(k -> k.getHelperClass().equals(callee))
                .findFirst();
        if (kind.isPresent()) {
            helperKinds.put(name, kind.get());
            if (kind.get() == HelperKind.POINT_TO_POINT || kind.get() == HelperKind.CSMA || kind.get() == HelperKind.WIFI) {
                result.getHelperConfigs().putIfAbsent(name, new LinkedHashMap<>());
            }
        } else if (applicationKind.isPresent()) {
            helperKinds.put(name, HelperKind.APPLICATION_HELPER);
            applicationHelpers.put(name, parseApplicationHelper(applicationKind.get(), call));
        } else if (callee.equals("Install")) {
            String helper = objectName(call);
            if (helper != null && applicationHelpers.containsKey(helper)) {
                helperKinds.put(name, HelperKind.APPLICATION_CONTAINER);
            } else if (helper != null) {
                ChannelMedium medium = getDeviceMedium(helper);
                if (medium != null) {
                    helperKinds.put(name, HelperKind.NET_DEVICE_CONTAINER);
                    result.getDeviceContainers().put(name, medium);
                }
            }
        } else if (callee.equals("Assign")) {
            helperKinds.put(name, HelperKind.INTERFACE_CONTAINER);
        } else if (callee.endsWith("Helper")) {
            helperKinds.put(name, HelperKind.OTHER_HELPER);
        }
    }

    /**
     * Channel installed by the given helper variable, or null when the variable is known not to be a device helper.
     */
    private ChannelMedium getDeviceMedium(String helper) {
        HelperKind kind = helperKinds.get(helper);
        if (kind == null) {
            return ContainerNames.inferDeviceMedium(helper);
        }
        return kind.getDeviceMedium();
    }

    // call dispatch

    private void processCall(Call call) {
        String method = calleeName(call);
        String object = objectName(call);
        if (method == null) {
            return;
        }
        List<Expression> args = call.arguments();
        switch (method) {
            case "Create" -> {
                if (object != null && !args.isEmpty() && isContainerCandidate(object)) {
                    handleCreate(object, args.get(0));
                }
            }
            case "Install" -> {
                if (object != null && !args.isEmpty()) {
                    if (applicationHelpers.containsKey(object)) {
                        handleApplicationInstall(object, call);
                    } else {
                        installedDevices = call == assignedCall ? assignedName : "";
                        handleInstall(object, args);
                        installedDevices = "";
                    }
                }
            }
            case "SetDeviceAttribute", "SetChannelAttribute" -> {
                if (object != null && args.size() >= 2) {
                    handleSetAttribute(object, args);
                }
            }
            case "SetBase" -> {
                if (object != null && args.size() >= 2) {
                    handleSetBase(object, args);
                }
            }
            case "Assign" -> {
                if (object != null && !args.isEmpty() && isAddressHelperCandidate(object)) {
                    handleAssign(object, call);
                }
            }
            case "Stop" -> {
                if (object != null && !args.isEmpty()) {
                    if (SIMULATOR_OBJECTS.contains(object)) {
                        handleSimulatorStop(args.get(0));
                    } else {
                        handleApplicationTime(object, args.get(0), false);
                    }
                }
            }
            case "Start" -> {
                if (object != null && !args.isEmpty()) {
                    handleApplicationTime(object, args.get(0), true);
                }
            }
            case "SetAttribute", "SetConstantRate" -> {
                if (object != null && applicationHelpers.containsKey(object)) {
                    handleApplicationAttribute(applicationHelpers.get(object), method, args);
                }
            }
            default -> {
                // not a recognized method
            }
        }
    }

    private boolean isContainerCandidate(String name) {
        HelperKind kind = helperKinds.get(name);
        return kind == null || kind == HelperKind.NODE_CONTAINER;
    }

    private boolean isAddressHelperCandidate(String name) {
        HelperKind kind = helperKinds.get(name);
        return kind == null || kind == HelperKind.ADDRESS;
    }

    // nodes and links

    private void handleCreate(String container, Expression countArgument) {
        Integer count = intValue(countArgument);
        if (count == null) {
            Reports.reportUnknownNodeCount(result.getReportNode(), container, CREATE_COUNT_DEFAULT_VALUE);
            count = CREATE_COUNT_DEFAULT_VALUE;
        }
        NodeRole role = ContainerNames.inferRole(container);
        MediumHint medium = ContainerNames.inferMedium(container);
        result.getNodeContainers().put(container, count);
        helperKinds.putIfAbsent(container, HelperKind.NODE_CONTAINER);
        for (int i = 0; i < count; i++) {
            result.getNodes().add(new ExtractedNode(container, i, role, medium));
        }
        LOGGER.debug("Container {} creates {} nodes", container, count);
    }

    private void handleInstall(String helper, List<Expression> args) {
        ChannelMedium medium = getDeviceMedium(helper);
        if (medium == null) {
            return;
        }
        switch (medium) {
            case POINT_TO_POINT -> handlePointToPointInstall(helper, args, ChannelMedium.POINT_TO_POINT);
            case CSMA -> handleChainInstall(helper, args.get(0), ChannelMedium.CSMA);
            case WIFI -> handleWifiInstall(args.get(args.size() - 1));
            default -> handleUnknownInstall(helper, args);
        }
    }

    private void handleUnknownInstall(String helper, List<Expression> args) {
        if (args.size() == 2) {
            handlePointToPointInstall(helper, args, ChannelMedium.POINT_TO_POINT);
        } else if (args.size() == 1) {
            ContainerRange range = containerRange(args.get(0));
            if (range == null) {
                return;
            }
            if (result.getNodeCount(range.container()) == 2) {
                handlePointToPointInstall(helper, args, ChannelMedium.POINT_TO_POINT);
            } else {
                Reports.reportUnknownHelperInstall(result.getReportNode(), helper, range.container());
                handleChainInstall(helper, args.get(0), ChannelMedium.CSMA);
            }
        }
    }

    private void handlePointToPointInstall(String helper, List<Expression> args, ChannelMedium medium) {
        if (args.size() == 2) {
            NodeKey source = nodeReference(args.get(0));
            NodeKey target = nodeReference(args.get(1));
            if (source != null && target != null) {
                addLink(helper, source, target, medium);
            }
            return;
        }
        if (args.size() != 1) {
            return;
        }
        ContainerRange range = containerRange(args.get(0));
        if (range == null) {
            return;
        }
        int end = range.end() != null ? range.end() : result.getNodeCount(range.container()) - 1;
        int span = end - range.start();
        if (span < 1) {
            Reports.reportEmptyInstall(result.getReportNode(), helper, range.container());
        } else if (span == 1) {
            addLink(helper, new NodeKey(range.container(), range.start()), new NodeKey(range.container(), end), medium);
        } else {
            Reports.reportAmbiguousPointToPointInstall(result.getReportNode(), helper, span + 1, range.container());
            addChain(helper, range.container(), range.start(), end, medium);
        }
    }

    private void handleChainInstall(String helper, Expression argument, ChannelMedium medium) {
        ContainerRange range = containerRange(argument);
        if (range == null) {
            return;
        }
        int end = range.end() != null ? range.end() : result.getNodeCount(range.container()) - 1;
        addChain(helper, range.container(), range.start(), end, medium);
    }

    private void handleWifiInstall(Expression argument) {
        ContainerRange range = containerRange(argument);
        if (range == null) {
            return;
        }
        int count = result.getNodeCount(range.container());
        int end = range.end() != null ? range.end() : count - 1;
        MediumHint hint = ContainerNames.inferMedium(range.container());
        if (hint == MediumHint.WIRED) {
            hint = MediumHint.WIFI_STATION;
        }
        for (ExtractedNode node : result.getNodes()) {
            if (node.getContainer().equals(range.container()) && node.getIndex() >= range.start() && node.getIndex() <= end) {
                node.setMediumHint(hint);
            }
        }
        if (count >= 2) {
            addChain("", range.container(), range.start(), end, ChannelMedium.WIFI);
        }
    }

    private void addChain(String helper, String container, int start, int end, ChannelMedium medium) {
        for (int i = start; i < end; i++) {
            addLink(helper, new NodeKey(container, i), new NodeKey(container, i + 1), medium);
        }
    }

    private void addLink(String helper, NodeKey source, NodeKey target, ChannelMedium medium) {
        Map<String, String> config = result.getHelperConfig(helper);
        result.getLinks().add(new ExtractedLink(source, target, medium, config.get("DataRate"), config.get("Delay"), helper,
                installedDevices));
        LOGGER.debug("{} link {} - {} installed by {}", medium.getLabel(), source, target, helper);
    }

    /**
     * Recognizes the temporary container pattern, one link per iteration between the i-th node of a container and
     * a shared target:
     * <pre>
     * for i in range(n):
     *     container = ns.NodeContainer()
     *     container.Add(terminals.Get(i))
     *     container.Add(switch)
     *     link = csma.Install(container)
     * </pre>
     */
    private void processLoopBody(List<Statement> body, String loopVariable, int start, int stop) {
        String temporaryContainer = null;
        String source = null;
        String target = null;
        String helper = null;
        for (Statement statement : body) {
            Call call = null;
            if (statement instanceof Assignment assignment && assignment.targets().size() == 1
                    && assignment.targets().get(0) instanceof Name name && assignment.value() instanceof Call value) {
                if ("NodeContainer".equals(calleeName(value))) {
                    temporaryContainer = name.id();
                    continue;
                }
                call = value;
            } else if (statement instanceof ExpressionStatement expression && expression.expression() instanceof Call value) {
                call = value;
            }
            if (call == null) {
                continue;
            }
            String method = calleeName(call);
            String object = objectName(call);
            if ("Install".equals(method)) {
                helper = object;
            } else if ("Add".equals(method) && object != null && object.equals(temporaryContainer) && !call.arguments().isEmpty()) {
                String added = addedContainer(call.arguments().get(0));
                if (added != null) {
                    if (source == null) {
                        source = added;
                    } else {
                        target = added;
                    }
                }
            }
        }
        if (source != null && target != null && helper != null) {
            createLoopLinks(source, target, helper, loopVariable, start, stop);
        }
    }

    private static String addedContainer(Expression expression) {
        if (expression instanceof Call call && "Get".equals(calleeName(call))) {
            return objectName(call);
        } else if (expression instanceof Name name) {
            return name.id();
        } else if (expression instanceof Attribute attribute) {
            return attribute.name();
        }
        return null;
    }

    private void createLoopLinks(String source, String target, String helper, String loopVariable, int start, int stop) {
        ChannelMedium medium = Objects.requireNonNullElse(getDeviceMedium(helper), ChannelMedium.UNKNOWN);
        int sourceCount = result.getNodeCount(source);
        int targetCount = result.getNodeCount(target);
        int created = 0;
        for (int i = Math.max(start, 0); i < Math.min(stop, sourceCount); i++) {
            NodeKey sourceKey = new NodeKey(source, i);
            NodeKey targetKey = new NodeKey(target, targetCount <= 1 ? 0 : i % targetCount);
            if (result.getLinks().stream().noneMatch(link -> link.connects(sourceKey, targetKey))) {
                addLink(helper, sourceKey, targetKey, medium);
                created++;
            }
        }
        LOGGER.debug("Loop over {} created {} links from {} to {}", loopVariable, created, source, target);
    }

    private void handleSetAttribute(String helper, List<Expression> args) {
        String name = stringValue(args.get(0));
        String value = wrappedString(args.get(1));
        if (name != null && value != null) {
            result.getHelperConfigs().computeIfAbsent(helper, k -> new LinkedHashMap<>()).put(name, value);
        }
    }

    // addresses

    private void handleSetBase(String helper, List<Expression> args) {
        String base = wrappedString(args.get(0));
        String netmask = wrappedString(args.get(1));
        if (base != null && netmask != null) {
            addressBases.put(helper, new AddressBase(base, netmask));
        }
    }

    private void handleAssign(String helper, Call call) {
        AddressBase base = addressBases.get(helper);
        if (base != null && call.arguments().get(0) instanceof Name devices) {
            ExtractedAddressAssignment assignment = new ExtractedAddressAssignment(devices.id(), base.base(), base.netmask());
            result.getAddressAssignments().add(assignment);
            if (call == assignedCall) {
                interfaceContainers.put(assignedName, assignment);
            }
        }
    }

    private void handleSimulatorStop(Expression argument) {
        Double duration = timeValue(argument);
        if (duration != null && duration > 0) {
            result.setDuration(duration);
        }
    }

    // applications

    private ApplicationConfig parseApplicationHelper(ApplicationKind kind, Call call) {
        ApplicationConfig config = new ApplicationConfig(kind);
        List<Expression> args = call.arguments();
        switch (kind) {
            case ON_OFF, PACKET_SINK, BULK_SEND -> {
                if (kind == ApplicationKind.ON_OFF) {
                    config.dataRate = "500kb/s";
                }
                if (kind == ApplicationKind.BULK_SEND) {
                    config.protocol = TrafficProtocol.TCP;
                }
                String factory = args.isEmpty() ? null : stringValue(args.get(0));
                if (factory != null && factory.contains("Tcp")) {
                    config.protocol = TrafficProtocol.TCP;
                }
                SocketAddress socket = args.size() >= 2 ? socketAddress(args.get(1)) : null;
                if (socket != null) {
                    config.port = socket.port();
                    if (kind != ApplicationKind.PACKET_SINK) {
                        config.remoteAddress = socket.address();
                    }
                }
            }
            case UDP_ECHO_SERVER -> {
                Integer port = args.isEmpty() ? null : intValue(args.get(0));
                if (port != null && port > 0) {
                    config.port = port;
                }
            }
            case UDP_ECHO_CLIENT -> {
                if (!args.isEmpty()) {
                    config.remoteAddress = addressValue(args.get(0));
                }
                Integer port = args.size() >= 2 ? intValue(args.get(1)) : null;
                if (port != null && port > 0) {
                    config.port = port;
                }
            }
        }
        return config;
    }

    private void handleApplicationInstall(String helper, Call call) {
        NodeKey node = nodeReference(call.arguments().get(0));
        if (node == null) {
            return;
        }
        ExtractedApplication application = applicationHelpers.get(helper).newApplication(node, helper);
        result.getApplications().add(application);
        if (call == assignedCall) {
            applicationContainers.put(assignedName, new ArrayList<>(List.of(application)));
        }
        LOGGER.debug("Application {} installed by {}", application, helper);
    }

    private void handleApplicationTime(String container, Expression argument, boolean start) {
        Double time = timeValue(argument);
        if (time == null) {
            return;
        }
        List<ExtractedApplication> applications = applicationContainers.get(container);
        if (applications == null) {
            if (helperKinds.containsKey(container) || result.getApplications().isEmpty()) {
                return;
            }
            // unknown container, most likely the one returned by the last install
            applications = List.of(result.getApplications().get(result.getApplications().size() - 1));
        }
        for (ExtractedApplication application : applications) {
            if (start) {
                application.setStartTime(time);
            } else {
                application.setStopTime(time);
            }
        }
    }

    private void handleApplicationAttribute(ApplicationConfig config, String method, List<Expression> args) {
        if (method.equals("SetConstantRate")) {
            if (!args.isEmpty()) {
                String rate = dataRateValue(args.get(0));
                if (!rate.isEmpty()) {
                    config.dataRate = rate;
                }
            }
            return;
        }
        if (args.size() < 2) {
            return;
        }
        String attribute = stringValue(args.get(0));
        Expression value = args.get(1);
        if ("Remote".equals(attribute)) {
            String address = addressValue(value);
            if (!address.isEmpty()) {
                config.remoteAddress = address;
            }
            SocketAddress socket = socketAddress(value instanceof Call wrapper && !wrapper.arguments().isEmpty()
                    ? wrapper.arguments().get(0) : value);
            if (socket != null) {
                config.port = socket.port();
            }
        } else if ("DataRate".equals(attribute)) {
            String rate = dataRateValue(value);
            if (!rate.isEmpty()) {
                config.dataRate = rate;
            }
        } else if ("PacketSize".equals(attribute)) {
            Integer size = wrappedInt(value);
            if (size != null && size > 0) {
                config.packetSize = size;
            }
        }
    }

    // expression evaluation

    static String calleeName(Call call) {
        if (call.function() instanceof Attribute attribute) {
            return attribute.name();
        } else if (call.function() instanceof Name name) {
            return name.id();
        }
        return null;
    }

    static String objectName(Call call) {
        if (call.function() instanceof Attribute attribute) {
            if (attribute.value() instanceof Name name) {
                return name.id();
            } else if (attribute.value() instanceof Attribute parent) {
                return parent.name();
            }
        }
        return null;
    }

    private Integer intValue(Expression expression) {
        if (expression instanceof NumberLiteral number && number.isInteger()) {
            return number.value().intValue();
        } else if (expression instanceof Name name && variables.get(name.id()) instanceof Long value) {
            return value.intValue();
        } else if (expression instanceof UnaryOperation unary && unary.operator().equals("-")) {
            Integer operand = intValue(unary.operand());
            return operand != null ? -operand : null;
        }
        return null;
    }

    private Double numberValue(Expression expression) {
        if (expression instanceof NumberLiteral number) {
            return number.value().doubleValue();
        } else if (expression instanceof Name name && variables.containsKey(name.id())) {
            return variables.get(name.id()).doubleValue();
        }
        return null;
    }

    private Integer wrappedInt(Expression expression) {
        if (expression instanceof Call call && !call.arguments().isEmpty()) {
            return intValue(call.arguments().get(0));
        }
        return intValue(expression);
    }

    private static String stringValue(Expression expression) {
        if (expression instanceof StringLiteral string && !string.formatted()) {
            return string.value();
        }
        return null;
    }

    private static String wrappedString(Expression expression) {
        if (expression instanceof Call call) {
            return call.arguments().isEmpty() ? null : stringValue(call.arguments().get(0));
        }
        return stringValue(expression);
    }

    private Double timeValue(Expression expression) {
        if (!(expression instanceof Call call) || call.arguments().isEmpty()) {
            return null;
        }
        Double value = numberValue(call.arguments().get(0));
        if (value == null) {
            return null;
        }
        return switch (Objects.requireNonNullElse(calleeName(call), "")) {
            case "Seconds", "Second" -> value;
            case "MilliSeconds" -> value / 1000.0;
            case "MicroSeconds" -> value / 1_000_000.0;
            default -> null;
        };
    }

    private static String dataRateValue(Expression expression) {
        if (expression instanceof StringLiteral string) {
            return string.value();
        }
        if (expression instanceof Call call && !call.arguments().isEmpty()) {
            return dataRateValue(call.arguments().get(0));
        }
        return "";
    }

    private String addressValue(Expression expression) {
        if (!(expression instanceof Call call)) {
            return "";
        }
        String method = Objects.requireNonNullElse(calleeName(call), "");
        switch (method) {
            case "Ipv4Address" -> {
                String address = call.arguments().isEmpty() ? null : stringValue(call.arguments().get(0));
                return Objects.requireNonNullElse(address, "");
            }
            case "GetAny" -> {
                return Ipv4Addresses.ANY;
            }
            case "AddressValue" -> {
                return call.arguments().isEmpty() ? "" : addressValue(call.arguments().get(0));
            }
            case "GetAddress" -> {
                return interfaceAddress(call);
            }
            case "ConvertTo" -> {
                return call.function() instanceof Attribute attribute ? addressValue(attribute.value()) : "";
            }
            default -> {
                SocketAddress socket = socketAddress(call);
                return socket != null ? socket.address() : "";
            }
        }
    }

    /**
     * Address of {@code interfaces.GetAddress(i)}: the helper numbers the devices of the container from host 1 in
     * device order.
     */
    private String interfaceAddress(Call call) {
        ExtractedAddressAssignment assignment = interfaceContainers.get(objectName(call));
        Integer index = call.arguments().isEmpty() ? null : intValue(call.arguments().get(0));
        if (assignment == null || index == null || !Ipv4Addresses.isValid(assignment.base())) {
            return "";
        }
        return Ipv4Addresses.fromInt(Ipv4Addresses.toInt(assignment.base()) + index + 1);
    }

    private SocketAddress socketAddress(Expression expression) {
        Expression inner = expression;
        if (inner instanceof Call call && "ConvertTo".equals(calleeName(call))
                && call.function() instanceof Attribute attribute) {
            inner = attribute.value();
        }
        if (!(inner instanceof Call call) || !"InetSocketAddress".equals(calleeName(call))) {
            return null;
        }
        String address = call.arguments().isEmpty() ? "" : addressValue(call.arguments().get(0));
        Integer port = call.arguments().size() >= 2 ? intValue(call.arguments().get(1)) : null;
        return new SocketAddress(address, port != null && port > 0 ? port : ExtractedApplication.PORT_DEFAULT_VALUE);
    }

    private NodeKey nodeReference(Expression expression) {
        if (expression instanceof Call call) {
            String object = objectName(call);
            if ("Get".equals(calleeName(call)) && object != null && !call.arguments().isEmpty()) {
                Integer index = intValue(call.arguments().get(0));
                return index != null ? new NodeKey(object, index) : null;
            }
        } else if (expression instanceof Name name) {
            return new NodeKey(name.id(), 0);
        } else if (expression instanceof Subscript subscript && subscript.value() instanceof Name name) {
            Integer index = intValue(subscript.index());
            return index != null ? new NodeKey(name.id(), index) : null;
        }
        return null;
    }

    /**
     * A whole container or a slice of it. The end index is inclusive and null when the slice is open.
     */
    private ContainerRange containerRange(Expression expression) {
        if (expression instanceof Name name) {
            return new ContainerRange(name.id(), 0, null);
        }
        if (expression instanceof Subscript subscript && subscript.value() instanceof Name name
                && subscript.index() instanceof Slice slice) {
            Integer lower = slice.lower() != null ? intValue(slice.lower()) : null;
            Integer upper = slice.upper() != null ? intValue(slice.upper()) : null;
            return new ContainerRange(name.id(), lower != null ? lower : 0, upper != null ? upper - 1 : null);
        }
        return null;
    }
}
