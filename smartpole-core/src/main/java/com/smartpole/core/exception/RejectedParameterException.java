package com.smartpole.core.exception;

import lombok.Getter;

/**
 * 节点运行时参数被拒绝，原值保持不变。
 */
@Getter
public class RejectedParameterException extends PipelineException {

    private final String nodeName;
    private final String key;

    public RejectedParameterException(String nodeName, String key, String reason) {
        super("参数被拒绝 %s.%s: %s".formatted(nodeName, key, reason));
        this.nodeName = nodeName;
        this.key = key;
    }
}
