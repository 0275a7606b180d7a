package com.smartpole.core.graph;

import com.smartpole.core.exception.ConfigurationException;
import lombok.Value;

/**
 * 对某个节点端口的引用。portName 为 null 的输出引用表示“该节点运行时宣告的任意输出端口”。
 */
@Value
public class PortRef {

    String nodeName;
    String portName;
    PortDirection direction;

    public static PortRef output(String nodeName, String portName) {
        return new PortRef(nodeName, portName, PortDirection.OUTPUT);
    }

    public static PortRef input(String nodeName, String portName) {
        return new PortRef(nodeName, portName, PortDirection.INPUT);
    }

    /**
     * 解析 {@code node.port} 或 {@code node} 形式的引用。
     */
    public static PortRef parse(String text, PortDirection direction) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("端口引用不能为空");
        }
        int dot = text.indexOf('.');
        if (dot < 0) {
            return new PortRef(text.trim(), null, direction);
        }
        return new PortRef(text.substring(0, dot).trim(), text.substring(dot + 1).trim(), direction);
    }

    @Override
    public String toString() {
        return portName == null ? nodeName + ".*" : nodeName + "." + portName;
    }
}
