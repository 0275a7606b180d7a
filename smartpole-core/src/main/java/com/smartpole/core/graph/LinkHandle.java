package com.smartpole.core.graph;

import lombok.Value;

/**
 * 已建立的输出到输入连接。
 */
@Value
public class LinkHandle implements GraphLink {

    PortRef source;
    PortRef destination;
    // 由延迟连接补全而来时为 true
    boolean fromDeferred;

    @Override
    public boolean isActive() {
        return true;
    }

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}
