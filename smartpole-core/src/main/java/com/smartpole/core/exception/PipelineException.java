package com.smartpole.core.exception;

/**
 * 管线控制核心所有异常的基类。
 * 均为非受检异常，与引擎侧 RuntimeException 的使用方式保持一致。
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
