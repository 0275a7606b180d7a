package com.smartpole.core.metrics;

import java.util.EnumMap;
import java.util.Map;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.smartpole.core.bus.EventType;
import lombok.Getter;

/**
 * 管线控制核心的指标收集类。
 * 用于监控事件总线与生命周期的运行状况。
 */
@Getter
public class PipelineMetrics {

    private final String sessionName;
    private final MetricRegistry metricsRegistry;

    /**
     * 事件统计
     */
    private final Map<EventType, Meter> eventsDispatched = new EnumMap<>(EventType.class);
    private final Meter eventsDropped;
    private final Meter eventsOverflowed;
    private final Counter eventsUnhandled;
    private final Counter handlerErrors;

    /**
     * 生命周期统计
     */
    private final Counter transitionsRequested;
    private final Counter transitionsPending;
    private final Counter transitionsRejected;
    private final Counter transitionsSuperseded;

    /**
     * 播放控制统计
     */
    private final Counter eosRestarts;
    private final Counter eosRestartFailures;
    private final Counter queryFailures;

    /**
     * 图与参数统计
     */
    private final Counter linkFailures;
    private final Counter rejectedParameters;

    public PipelineMetrics(String sessionName) {
        this(sessionName, new MetricRegistry());
    }

    public PipelineMetrics(String sessionName, MetricRegistry metricsRegistry) {
        this.sessionName = sessionName;
        this.metricsRegistry = metricsRegistry;

        for (EventType type : EventType.values()) {
            eventsDispatched.put(type,
                    metricsRegistry.meter(MetricRegistry.name(sessionName, "events", type.name().toLowerCase())));
        }
        eventsDropped = metricsRegistry.meter(MetricRegistry.name(sessionName, "events", "dropped"));
        eventsOverflowed = metricsRegistry.meter(MetricRegistry.name(sessionName, "events", "overflowed"));
        eventsUnhandled = metricsRegistry.counter(MetricRegistry.name(sessionName, "events", "unhandled"));
        handlerErrors = metricsRegistry.counter(MetricRegistry.name(sessionName, "errors", "handlers"));

        transitionsRequested = metricsRegistry.counter(MetricRegistry.name(sessionName, "lifecycle", "requested"));
        transitionsPending = metricsRegistry.counter(MetricRegistry.name(sessionName, "lifecycle", "pending"));
        transitionsRejected = metricsRegistry.counter(MetricRegistry.name(sessionName, "lifecycle", "rejected"));
        transitionsSuperseded = metricsRegistry
                .counter(MetricRegistry.name(sessionName, "lifecycle", "superseded"));

        eosRestarts = metricsRegistry.counter(MetricRegistry.name(sessionName, "playback", "eosRestarts"));
        eosRestartFailures = metricsRegistry
                .counter(MetricRegistry.name(sessionName, "playback", "eosRestartFailures"));
        queryFailures = metricsRegistry.counter(MetricRegistry.name(sessionName, "playback", "queryFailures"));

        linkFailures = metricsRegistry.counter(MetricRegistry.name(sessionName, "graph", "linkFailures"));
        rejectedParameters = metricsRegistry.counter(MetricRegistry.name(sessionName, "toggles", "rejected"));
    }

    public void recordDispatched(EventType type) {
        eventsDispatched.get(type).mark();
    }

    public long dispatchedCount(EventType type) {
        return eventsDispatched.get(type).getCount();
    }
}
