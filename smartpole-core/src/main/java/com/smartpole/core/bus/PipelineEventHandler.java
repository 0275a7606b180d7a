package com.smartpole.core.bus;

/**
 * 事件处理器，只在控制线程上被调用。
 */
@FunctionalInterface
public interface PipelineEventHandler {

    void handle(PipelineEvent event);
}
