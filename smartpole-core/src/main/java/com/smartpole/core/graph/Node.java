package com.smartpole.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

/**
 * 图中的处理节点，由 {@link Graph} 独占持有。
 */
@Getter
public class Node {

    private final String name;
    private final String kind;
    private final boolean dynamicOutputs;
    private final List<Port> inputs = new ArrayList<>();
    private final List<Port> outputs = new ArrayList<>();
    private final Map<String, Object> parameters;

    Node(NodeSpec spec) {
        this.name = spec.getName();
        this.kind = spec.getKind();
        this.dynamicOutputs = spec.isDynamicOutputs();
        this.parameters = new LinkedHashMap<>(spec.getParameters() == null ? Map.of() : spec.getParameters());
        if (spec.getInputs() != null) {
            spec.getInputs().forEach(p -> inputs.add(new Port(name, p.getName(), PortDirection.INPUT, p.toShape())));
        }
        if (spec.getOutputs() != null) {
            spec.getOutputs().forEach(p -> outputs.add(new Port(name, p.getName(), PortDirection.OUTPUT, p.toShape())));
        }
    }

    public Optional<Port> findInput(String portName) {
        return inputs.stream().filter(p -> p.getName().equals(portName)).findFirst();
    }

    public Optional<Port> findOutput(String portName) {
        return outputs.stream().filter(p -> p.getName().equals(portName)).findFirst();
    }

    Port addOutput(String portName) {
        Port port = new Port(name, portName, PortDirection.OUTPUT, null);
        outputs.add(port);
        return port;
    }

    public List<Port> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<Port> getOutputs() {
        return Collections.unmodifiableList(outputs);
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    void putParameter(String key, Object value) {
        parameters.put(key, value);
    }

    public NodeHandle handle() {
        return new NodeHandle(name, kind, dynamicOutputs);
    }
}
