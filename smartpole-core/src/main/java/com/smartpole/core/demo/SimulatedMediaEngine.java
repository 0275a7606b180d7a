package com.smartpole.core.demo;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.smartpole.core.bus.ApplicationEvent;
import com.smartpole.core.bus.EndOfStreamEvent;
import com.smartpole.core.bus.ErrorEvent;
import com.smartpole.core.bus.EventSink;
import com.smartpole.core.bus.PipelineEvent;
import com.smartpole.core.bus.PortAnnouncedEvent;
import com.smartpole.core.bus.StateChangedEvent;
import com.smartpole.core.bus.TagsDiscoveredEvent;
import com.smartpole.core.engine.MediaEngine;
import com.smartpole.core.engine.SeekFlag;
import com.smartpole.core.engine.StateChangeReturn;
import com.smartpole.core.engine.StreamKind;
import com.smartpole.core.graph.NodeSpec;
import com.smartpole.core.graph.PortRef;
import com.smartpole.core.graph.PortShape;
import com.smartpole.core.lifecycle.LifecycleState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * `SimulatedMediaEngine` 是 {@link MediaEngine} 的进程内模拟实现。
 * 它不解码任何媒体，用自己的工作线程模拟引擎行为：向上的状态切换异步逐级完成，
 * 动态输出节点在进入 READY 时宣告端口，播放位置按时间推进，到达时长后产生流结束。
 * 主要用于演示和端到端测试，以隔离真实媒体框架的复杂性。
 */
@Slf4j
public class SimulatedMediaEngine implements MediaEngine {

    public static final String DEFAULT_PORT_NAME = "stream_0";
    public static final PortShape DEFAULT_PORT_SHAPE = PortShape.parse("application/x-rtp, media=video");
    private static final long TICK_MS = 20;

    private final ScheduledExecutorService worker;
    private final Map<String, NodeSpec> nodes = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> properties = new ConcurrentHashMap<>();
    @Getter
    private final List<String> linkedPorts = new CopyOnWriteArrayList<>();
    @Getter
    private final List<LifecycleState> requestedStates = new CopyOnWriteArrayList<>();
    // 每次状态请求递增，被取代的异步步骤据此放弃
    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger durationQueryFailures = new AtomicInteger();

    private volatile EventSink sink;
    @Getter
    private volatile LifecycleState state = LifecycleState.NULL;
    private volatile long stepDelayMs = 20;
    private volatile long durationNanos = -1L;
    private volatile boolean announcePorts = true;
    private volatile PortShape announcedShape = DEFAULT_PORT_SHAPE;
    private volatile boolean failSeek = false;
    private volatile boolean rejectLinks = false;
    private volatile boolean tagsPublished = false;
    private volatile boolean eosPosted = false;
    private final Set<String> rejectedPropertyKeys = ConcurrentHashMap.newKeySet();

    // 播放位置：进入 PLAYING 时记录起点，离开时累加
    private volatile long positionBaseNanos;
    private volatile long playingSinceNanos = -1L;

    public SimulatedMediaEngine() {
        worker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "SimulatedMediaEngine-Worker");
            t.setDaemon(true);
            return t;
        });
        worker.scheduleWithFixedDelay(this::tick, TICK_MS, TICK_MS, TimeUnit.MILLISECONDS);
    }

    /**
     * 时长，负数表示直播流（时长未知，不会产生流结束）。
     */
    public SimulatedMediaEngine withDuration(Duration duration) {
        this.durationNanos = duration == null ? -1L : duration.toNanos();
        return this;
    }

    public SimulatedMediaEngine withStepDelay(Duration delay) {
        this.stepDelayMs = Math.max(0, delay.toMillis());
        return this;
    }

    public SimulatedMediaEngine withPortAnnouncement(boolean announce, PortShape shape) {
        this.announcePorts = announce;
        this.announcedShape = shape;
        return this;
    }

    public SimulatedMediaEngine withSeekFailure(boolean fail) {
        this.failSeek = fail;
        return this;
    }

    public SimulatedMediaEngine withLinkRejection(boolean reject) {
        this.rejectLinks = reject;
        return this;
    }

    public SimulatedMediaEngine rejectProperty(String key) {
        rejectedPropertyKeys.add(key);
        return this;
    }

    /**
     * 接下来 n 次时长查询失败。
     */
    public SimulatedMediaEngine failNextDurationQueries(int n) {
        durationQueryFailures.set(n);
        return this;
    }

    /**
     * 从工作线程投递一个引擎错误。
     */
    public void injectError(String source, String message, String detail) {
        worker.execute(() -> post(new ErrorEvent(source, message, detail)));
    }

    @Override
    public void setEventSink(EventSink sink) {
        this.sink = sink;
    }

    @Override
    public void createNode(NodeSpec spec) {
        nodes.put(spec.getName(), spec);
        properties.put(spec.getName(), new ConcurrentHashMap<>(spec.getParameters()));
        log.debug("SimulatedMediaEngine: 创建节点 {} ({})", spec.getName(), spec.getKind());
    }

    @Override
    public boolean linkPorts(PortRef output, PortRef input) {
        if (rejectLinks) {
            log.warn("SimulatedMediaEngine: 拒绝连接 {} -> {}", output, input);
            return false;
        }
        linkedPorts.add(output + " -> " + input);
        return true;
    }

    @Override
    public StateChangeReturn requestState(LifecycleState target) {
        requestedStates.add(target);
        long gen = generation.incrementAndGet();
        LifecycleState from = state;
        if (!target.isAtLeast(from) || target == from) {
            // 向下切换同步完成
            applyState(target);
            if (target == LifecycleState.NULL) {
                tagsPublished = false;
                positionBaseNanos = 0L;
            }
            log.debug("SimulatedMediaEngine: {} -> {} 同步完成", from, target);
            return StateChangeReturn.SUCCESS;
        }
        worker.schedule(() -> step(gen, target), stepDelayMs, TimeUnit.MILLISECONDS);
        return StateChangeReturn.ASYNC;
    }

    private void step(long gen, LifecycleState target) {
        if (gen != generation.get()) {
            log.debug("SimulatedMediaEngine: 目标 {} 已被取代", target);
            return;
        }
        LifecycleState from = state;
        if (from == target) {
            return;
        }
        LifecycleState next = LifecycleState.values()[from.ordinal() + 1];
        if (next == LifecycleState.READY && announcePorts) {
            nodes.values().stream()
                    .filter(NodeSpec::isDynamicOutputs)
                    .forEach(n -> post(new PortAnnouncedEvent(n.getName(), DEFAULT_PORT_NAME, announcedShape)));
        }
        applyState(next);
        post(new StateChangedEvent(null, from, next, next == target ? null : target));
        if (next == LifecycleState.PAUSED && !tagsPublished) {
            tagsPublished = true;
            post(new TagsDiscoveredEvent(null, 0, StreamKind.VIDEO));
            post(new ApplicationEvent(null, ApplicationEvent.TAGS_CHANGED));
        }
        if (next != target) {
            worker.schedule(() -> step(gen, target), stepDelayMs, TimeUnit.MILLISECONDS);
        }
    }

    private void applyState(LifecycleState next) {
        if (state == LifecycleState.PLAYING && next != LifecycleState.PLAYING) {
            positionBaseNanos = currentPosition();
            playingSinceNanos = -1L;
        } else if (state != LifecycleState.PLAYING && next == LifecycleState.PLAYING) {
            playingSinceNanos = System.nanoTime();
        }
        state = next;
    }

    private void tick() {
        long duration = durationNanos;
        if (state != LifecycleState.PLAYING || duration < 0 || eosPosted) {
            return;
        }
        if (currentPosition() >= duration) {
            eosPosted = true;
            post(new EndOfStreamEvent(null));
        }
    }

    private long currentPosition() {
        long since = playingSinceNanos;
        long position = positionBaseNanos + (since < 0 ? 0 : System.nanoTime() - since);
        long duration = durationNanos;
        return duration >= 0 ? Math.min(position, duration) : position;
    }

    @Override
    public OptionalLong queryDuration(Duration timeout) {
        if (state.isBelow(LifecycleState.PAUSED) || durationNanos < 0) {
            return OptionalLong.empty();
        }
        if (durationQueryFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(durationNanos);
    }

    @Override
    public OptionalLong queryPosition(Duration timeout) {
        if (state.isBelow(LifecycleState.PAUSED)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(currentPosition());
    }

    @Override
    public boolean seek(long positionNanos, Set<SeekFlag> flags) {
        if (failSeek || state == LifecycleState.NULL) {
            return false;
        }
        positionBaseNanos = positionNanos;
        if (playingSinceNanos >= 0) {
            playingSinceNanos = System.nanoTime();
        }
        eosPosted = false;
        log.debug("SimulatedMediaEngine: seek {} ns flags={}", positionNanos, flags);
        return true;
    }

    @Override
    public boolean setNodeProperty(String nodeName, String key, Object value) {
        Map<String, Object> props = properties.get(nodeName);
        if (props == null || rejectedPropertyKeys.contains(key)) {
            return false;
        }
        props.put(key, value);
        return true;
    }

    public Optional<Object> getNodeProperty(String nodeName, String key) {
        Map<String, Object> props = properties.get(nodeName);
        return props == null ? Optional.empty() : Optional.ofNullable(props.get(key));
    }

    @Override
    public int streamCount(StreamKind kind) {
        return kind == StreamKind.VIDEO && tagsPublished ? 1 : 0;
    }

    @Override
    public Optional<Map<String, Object>> streamTags(StreamKind kind, int streamIndex) {
        if (kind != StreamKind.VIDEO || streamIndex != 0 || !tagsPublished) {
            return Optional.empty();
        }
        return Optional.of(Map.of("video-codec", "H.264 (Main Profile)"));
    }

    @Override
    public void close() {
        generation.incrementAndGet();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(1, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SimulatedMediaEngine: 已关闭");
    }

    private void post(PipelineEvent event) {
        EventSink s = sink;
        if (s == null) {
            log.warn("SimulatedMediaEngine: 尚未设置事件接收方，事件被丢弃 {}", event.getType());
            return;
        }
        s.post(event);
    }
}
