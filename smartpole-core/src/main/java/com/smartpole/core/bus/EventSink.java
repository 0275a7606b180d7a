package com.smartpole.core.bus;

/**
 * 引擎投递事件的入口，可在任意线程调用。
 */
@FunctionalInterface
public interface EventSink {

    /**
     * @return 事件是否成功入队
     */
    boolean post(PipelineEvent event);
}
