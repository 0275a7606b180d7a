package com.smartpole.core.exception;

/**
 * 定位失败。返回给调用方，生命周期状态不变。
 */
public class SeekException extends PipelineException {

    public SeekException(String message) {
        super(message);
    }
}
