package com.smartpole.core.exception;

/**
 * 运行期连接失败。只记录告警，受影响的分支保持断开，管线继续运行。
 */
public class LinkException extends PipelineException {

    public LinkException(String message) {
        super(message);
    }
}
