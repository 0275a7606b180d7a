package com.smartpole.core.graph;

import lombok.Value;

/**
 * {@link Graph#addNode(NodeSpec)} 返回的不可变节点句柄。
 */
@Value
public class NodeHandle {

    String name;
    String kind;
    boolean dynamicOutputs;

    public PortRef input(String portName) {
        return PortRef.input(name, portName);
    }

    public PortRef output(String portName) {
        return PortRef.output(name, portName);
    }

    public PortRef anyOutput() {
        return PortRef.output(name, null);
    }
}
