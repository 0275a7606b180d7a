package com.smartpole.core.exception;

/**
 * 图拓扑或配置错误（重复节点、非法连接、环、未解析的延迟连接等）。
 * 构建期致命，不重试。
 */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
