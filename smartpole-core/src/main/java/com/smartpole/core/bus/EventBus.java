package com.smartpole.core.bus;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;

import com.smartpole.core.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.agrona.concurrent.ManyToOneConcurrentArrayQueue;

/**
 * 多生产者、单消费者的有序事件通道。
 * 引擎工作线程调用 {@link #post(PipelineEvent)}；控制线程通过 {@link #drain()} 排空并分发。
 * 同一生产者投递的事件按到达顺序处理。
 * <p>
 * 队列满时普通事件被丢弃；错误、流结束与状态变化转入无界的溢出队列，
 * 在主队列之后排空，保证挂起标记总能被确认或清除。
 */
@Slf4j
public class EventBus implements EventSink {

    public static final int DEFAULT_CAPACITY = 1024;

    private static final Set<EventType> NEVER_DROPPED =
            EnumSet.of(EventType.ERROR, EventType.END_OF_STREAM, EventType.STATE_CHANGED);

    private final ManyToOneConcurrentArrayQueue<PipelineEvent> queue;
    private final Queue<PipelineEvent> overflow = new ConcurrentLinkedQueue<>();
    private final EventDispatcher dispatcher;
    private final PipelineMetrics metrics;
    // 入队后唤醒控制线程
    private volatile Runnable wakeup;

    public EventBus(int requestedCapacity, EventDispatcher dispatcher, PipelineMetrics metrics) {
        this.queue = new ManyToOneConcurrentArrayQueue<>(Math.max(2, requestedCapacity));
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.metrics = metrics;
    }

    public void setWakeup(Runnable wakeup) {
        this.wakeup = wakeup;
    }

    @Override
    public boolean post(PipelineEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        // 溢出队列非空时关键事件继续排在其后，保持顺序
        boolean queued = overflow.isEmpty() && queue.offer(event);
        if (!queued) {
            if (NEVER_DROPPED.contains(event.getType())) {
                overflow.offer(event);
                log.warn("EventBus: 事件队列已满，关键事件转入溢出队列 type={}, source={}", event.getType(),
                        event.getSource());
                if (metrics != null) {
                    metrics.getEventsOverflowed().mark();
                }
            } else {
                log.warn("EventBus: 事件队列已满，事件被丢弃 type={}, source={}", event.getType(), event.getSource());
                if (metrics != null) {
                    metrics.getEventsDropped().mark();
                }
                return false;
            }
        }
        Runnable r = wakeup;
        if (r != null) {
            r.run();
        }
        return true;
    }

    /**
     * 在控制线程上排空队列，逐个分发。
     *
     * @return 本次处理的事件数量
     */
    public int drain() {
        int count = queue.drain(dispatcher::dispatch);
        PipelineEvent event;
        while ((event = overflow.poll()) != null) {
            dispatcher.dispatch(event);
            count++;
        }
        return count;
    }

    public int size() {
        return queue.size() + overflow.size();
    }

    public int capacity() {
        return queue.capacity();
    }
}
