package com.smartpole.core.bus;

import java.util.EnumMap;
import java.util.Map;

import com.smartpole.core.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

/**
 * 按事件种类分发到固定的处理器表，每个事件恰好触发一个处理器。
 * 未注册的种类以 debug 级别丢弃；处理器抛出的异常只记录，不会中断控制循环。
 */
@Slf4j
public class EventDispatcher {

    private final Map<EventType, PipelineEventHandler> handlers = new EnumMap<>(EventType.class);
    private final PipelineMetrics metrics;

    public EventDispatcher(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * 注册处理器。同一种类重复注册时后者覆盖前者。
     */
    public void register(EventType type, PipelineEventHandler handler) {
        PipelineEventHandler previous = handlers.put(type, handler);
        if (previous != null) {
            log.warn("EventDispatcher: 事件种类 {} 的处理器被覆盖", type);
        }
    }

    public void unregister(EventType type) {
        handlers.remove(type);
    }

    public boolean hasHandler(EventType type) {
        return handlers.containsKey(type);
    }

    public void dispatch(PipelineEvent event) {
        PipelineEventHandler handler = handlers.get(event.getType());
        if (handler == null) {
            log.debug("EventDispatcher: 没有注册处理器，事件被丢弃 type={}, source={}", event.getType(),
                    event.getSource());
            if (metrics != null) {
                metrics.getEventsUnhandled().inc();
            }
            return;
        }
        try {
            handler.handle(event);
            if (metrics != null) {
                metrics.recordDispatched(event.getType());
            }
        } catch (Exception e) {
            log.error("EventDispatcher: 处理事件失败 type={}, source={}", event.getType(), event.getSource(), e);
            if (metrics != null) {
                metrics.getHandlerErrors().inc();
            }
        }
    }
}
