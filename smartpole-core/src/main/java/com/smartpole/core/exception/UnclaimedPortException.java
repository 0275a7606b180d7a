package com.smartpole.core.exception;

import lombok.Getter;

/**
 * 动态输出节点宣告了新端口，但没有任何延迟连接认领它。
 */
@Getter
public class UnclaimedPortException extends LinkException {

    private final String nodeName;
    private final String portName;

    public UnclaimedPortException(String nodeName, String portName) {
        super("没有延迟连接认领端口: %s.%s".formatted(nodeName, portName));
        this.nodeName = nodeName;
        this.portName = portName;
    }
}
