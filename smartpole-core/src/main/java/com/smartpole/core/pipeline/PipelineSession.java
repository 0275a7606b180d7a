package com.smartpole.core.pipeline;

import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.smartpole.core.bus.ErrorEvent;
import com.smartpole.core.bus.EventBus;
import com.smartpole.core.bus.EventDispatcher;
import com.smartpole.core.bus.EventType;
import com.smartpole.core.bus.StateChangedEvent;
import com.smartpole.core.config.PipelineConfig;
import com.smartpole.core.engine.MediaEngine;
import com.smartpole.core.exception.ConfigurationException;
import com.smartpole.core.exception.PipelineException;
import com.smartpole.core.graph.DynamicLinker;
import com.smartpole.core.graph.Graph;
import com.smartpole.core.graph.GraphLoader;
import com.smartpole.core.graph.LinkHandle;
import com.smartpole.core.graph.NodeSpec;
import com.smartpole.core.graph.TopologySnapshotter;
import com.smartpole.core.lifecycle.LifecycleListener;
import com.smartpole.core.lifecycle.LifecycleState;
import com.smartpole.core.lifecycle.LifecycleStateMachine;
import com.smartpole.core.lifecycle.TransitionResult;
import com.smartpole.core.metadata.StreamInfoReporter;
import com.smartpole.core.metrics.PipelineMetrics;
import com.smartpole.core.playback.PlaybackController;
import com.smartpole.core.playback.PlaybackObserver;
import com.smartpole.core.playback.PlaybackPosition;
import com.smartpole.core.playback.PositionDisplay;
import com.smartpole.core.runloop.Runloop;
import com.smartpole.core.toggle.FeatureToggleRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 一个管线会话：持有控制线程、事件总线、图、生命周期、播放控制与参数注册表。
 * <p>
 * 对外的命令方法可在任意线程调用，命令被投递到控制线程执行，结果通过 {@link CompletableFuture} 返回。
 * 引擎只通过事件总线与会话交互。
 */
@Slf4j
public class PipelineSession implements AutoCloseable {

    private static final long START_TIMEOUT_SECONDS = 5;
    private static final long CLOSE_TIMEOUT_SECONDS = 3;

    @Getter
    private final String sessionName;
    private final PipelineConfig config;
    private final MediaEngine engine;
    private final PlaybackObserver observer;
    @Getter
    private final PipelineMetrics metrics;
    private final Runloop runloop;
    private final EventDispatcher dispatcher;
    private final EventBus eventBus;
    private final Graph graph;
    private final LifecycleStateMachine lifecycle;
    private final PlaybackController playback;
    private final FeatureToggleRegistry toggles;
    private final TopologySnapshotter snapshotter;
    private Runloop.TimerHandle pollTimer;
    private volatile boolean started = false;
    private volatile boolean closed = false;

    public PipelineSession(PipelineConfig config, MediaEngine engine, PlaybackObserver observer,
            PositionDisplay display) {
        this.config = Objects.requireNonNull(config, "config");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.observer = observer == null ? PlaybackObserver.NOOP : observer;
        this.sessionName = config.getSessionName();
        this.metrics = new PipelineMetrics(sessionName);

        // 构建期错误直接抛出 ConfigurationException
        this.graph = GraphLoader.build(config.getGraph());

        this.runloop = new Runloop(sessionName);
        this.dispatcher = new EventDispatcher(metrics);
        this.eventBus = new EventBus(config.getEventQueueCapacity(), dispatcher, metrics);
        this.lifecycle = new LifecycleStateMachine(engine, metrics);
        this.playback = new PlaybackController(engine, lifecycle, this.observer, display, metrics,
                config.queryTimeout(), config.isRestartOnEos());
        this.toggles = new FeatureToggleRegistry(graph, engine, metrics);
        this.snapshotter = new TopologySnapshotter(graph, config.resolveSnapshotDir(), config.getSnapshotPrefix());

        declareToggles();
        registerEventHandlers();
        lifecycle.addListener(playback);
        lifecycle.addListener(snapshotter);
        lifecycle.addListener(new ReadinessCheck());

        log.info("PipelineSession {}: 已创建，关联 Graph: {}", sessionName, graph.getName());
    }

    private void declareToggles() {
        if (config.getGraph().getNodes() == null) {
            return;
        }
        for (NodeSpec spec : config.getGraph().getNodes()) {
            if (spec.getToggles() != null) {
                spec.getToggles().forEach(toggle -> toggles.declare(spec.getName(), toggle));
            }
        }
    }

    private void registerEventHandlers() {
        StreamInfoReporter streamInfoReporter = new StreamInfoReporter(engine, observer);
        dispatcher.register(EventType.ERROR, event -> playback.onError((ErrorEvent) event));
        dispatcher.register(EventType.END_OF_STREAM, event -> playback.onEndOfStream());
        dispatcher.register(EventType.STATE_CHANGED, event -> lifecycle.onStateChanged((StateChangedEvent) event));
        dispatcher.register(EventType.TAGS_DISCOVERED, streamInfoReporter);
        dispatcher.register(EventType.APPLICATION, streamInfoReporter);
        dispatcher.register(EventType.PORT_ANNOUNCED, new DynamicLinker(graph, engine, metrics));
    }

    /**
     * 启动控制线程，在引擎中创建节点并建立静态连接，然后开始周期刷新。
     *
     * @throws ConfigurationException 引擎拒绝建立静态连接
     */
    public void start() {
        if (started) {
            log.warn("PipelineSession {}: 已启动", sessionName);
            return;
        }
        if (closed) {
            throw new IllegalStateException("PipelineSession 已关闭: " + sessionName);
        }
        started = true;
        engine.setEventSink(eventBus);
        eventBus.setWakeup(runloop::wakeup);
        runloop.registerExternalEventSource(eventBus::drain);
        runloop.start();

        await(runloop.submit(() -> {
            materialize();
            return null;
        }), START_TIMEOUT_SECONDS);
        pollTimer = runloop.schedulePeriodic(playback::pollPosition, config.pollInterval());
        log.info("PipelineSession {}: 已启动，刷新周期 {} ms", sessionName, config.getPollIntervalMs());
    }

    private void materialize() {
        for (NodeSpec spec : config.getGraph().getNodes()) {
            // 使用注册表写入默认值之后的参数
            NodeSpec effective = new NodeSpec(spec.getName(), spec.getKind(), spec.isDynamicOutputs(),
                    spec.getInputs(), spec.getOutputs(),
                    new LinkedHashMap<>(graph.requireNode(spec.getName()).getParameters()), spec.getToggles());
            engine.createNode(effective);
        }
        for (LinkHandle link : graph.getLinks()) {
            if (!engine.linkPorts(link.getSource(), link.getDestination())) {
                throw new ConfigurationException("引擎拒绝建立连接: " + link);
            }
        }
        log.info("PipelineSession {}: 引擎中已创建 {} 个节点、{} 条静态连接，{} 条延迟连接等待端口宣告", sessionName,
                graph.getNodes().size(), graph.getLinks().size(), graph.getDeferredLinks().size());
    }

    public CompletableFuture<TransitionResult> play() {
        return runloop.submit(playback::play);
    }

    public CompletableFuture<TransitionResult> pause() {
        return runloop.submit(playback::pause);
    }

    public CompletableFuture<TransitionResult> stop() {
        return runloop.submit(playback::stop);
    }

    /**
     * @return 实际跳转的位置；失败时以 SeekException 异常完成
     */
    public CompletableFuture<Long> seek(long targetNanos) {
        return runloop.submit(() -> playback.seek(targetNanos));
    }

    /**
     * 进度条通道的定位请求。
     *
     * @return 是否执行了定位
     */
    public CompletableFuture<Boolean> userSeek(long targetNanos) {
        return runloop.submit(() -> playback.userSeek(targetNanos));
    }

    public CompletableFuture<Object> setParameter(String nodeName, String key, Object value) {
        return runloop.submit(() -> toggles.setParameter(nodeName, key, value));
    }

    public CompletableFuture<Boolean> toggleParameter(String nodeName, String key) {
        return runloop.submit(() -> toggles.toggle(nodeName, key));
    }

    public CompletableFuture<Optional<Object>> getParameter(String nodeName, String key) {
        return runloop.submit(() -> toggles.getParameter(nodeName, key));
    }

    public CompletableFuture<PlaybackPosition> queryPosition() {
        return runloop.submit(playback::pollPosition);
    }

    public CompletableFuture<LifecycleState> state() {
        return runloop.submit(lifecycle::getCurrent);
    }

    public CompletableFuture<Optional<LifecycleState>> pendingTarget() {
        return runloop.submit(lifecycle::getPendingTarget);
    }

    public CompletableFuture<Boolean> isFailed() {
        return runloop.submit(lifecycle::isFailed);
    }

    /**
     * 当前拓扑的 DOT 文本。
     */
    public CompletableFuture<String> topology() {
        return runloop.submit(() -> graph.toDot(config.getSnapshotPrefix() + "_" + lifecycle.getCurrent()));
    }

    /**
     * 停止刷新，把管线降到 NULL，关闭控制线程与引擎。
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("PipelineSession {}: 正在关闭...", sessionName);
        if (pollTimer != null) {
            pollTimer.cancel();
        }
        if (started) {
            try {
                await(runloop.submit(() -> lifecycle.request(LifecycleState.NULL)), CLOSE_TIMEOUT_SECONDS);
            } catch (PipelineException | IllegalStateException e) {
                log.warn("PipelineSession {}: 关闭时无法回到 NULL: {}", sessionName, e.getMessage());
            }
            runloop.shutdown();
        }
        engine.close();
        log.info("PipelineSession {}: 已关闭", sessionName);
    }

    private static <T> T await(CompletableFuture<T> future, long timeoutSeconds) {
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("等待控制线程被中断", e);
        } catch (TimeoutException e) {
            throw new PipelineException("等待控制线程超时", e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new PipelineException("控制线程执行失败", cause);
        }
    }

    /**
     * 到达 READY 时仍有未补全的延迟连接属于致命配置错误：回到 READY 并通知外部。
     * 处理推迟到下一轮循环，避免在状态机回调中重入。
     */
    private class ReadinessCheck implements LifecycleListener {

        @Override
        public void onStateChanged(LifecycleState oldState, LifecycleState newState) {
            if (!oldState.isBelow(LifecycleState.READY) || newState.isBelow(LifecycleState.READY)) {
                return;
            }
            try {
                graph.validateForReady();
            } catch (ConfigurationException e) {
                log.error("PipelineSession {}: {}", sessionName, e.getMessage());
                runloop.postTask(() -> {
                    lifecycle.forceReady();
                    observer.onError(graph.getName(), e.getMessage(), "state=" + newState);
                });
            }
        }
    }
}
