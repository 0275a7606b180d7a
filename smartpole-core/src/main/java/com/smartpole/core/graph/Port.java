package com.smartpole.core.graph;

import lombok.Getter;

/**
 * 节点上的连接点。只在控制线程上修改。
 */
@Getter
public class Port {

    private final String nodeName;
    private final String name;
    private final PortDirection direction;
    private PortShape shape;
    private boolean resolved;
    private GraphLink link;

    Port(String nodeName, String name, PortDirection direction, PortShape shape) {
        this.nodeName = nodeName;
        this.name = name;
        this.direction = direction;
        this.shape = shape;
        this.resolved = shape != null;
    }

    void resolve(PortShape negotiated) {
        this.shape = negotiated == null ? PortShape.ANY : negotiated;
        this.resolved = true;
    }

    void attach(GraphLink graphLink) {
        this.link = graphLink;
    }

    void detach() {
        this.link = null;
    }

    public boolean isLinked() {
        return link != null;
    }

    public PortRef ref() {
        return new PortRef(nodeName, name, direction);
    }

    @Override
    public String toString() {
        return nodeName + "." + name;
    }
}
