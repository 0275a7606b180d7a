package com.smartpole.core.bus;

import lombok.Getter;

/**
 * 由引擎工作线程产生、在控制线程上消费的事件。
 */
@Getter
public abstract class PipelineEvent {

    private final EventType type;
    // 产生事件的节点名称，可能为 null
    private final String source;
    private final long timestampNanos;

    protected PipelineEvent(EventType type, String source) {
        this.type = type;
        this.source = source;
        this.timestampNanos = System.nanoTime();
    }
}
