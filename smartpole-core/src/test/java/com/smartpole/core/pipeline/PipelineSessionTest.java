package com.smartpole.core.pipeline;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

import com.smartpole.core.config.PipelineConfig;
import com.smartpole.core.config.PipelineConfigLoader;
import com.smartpole.core.demo.SimulatedMediaEngine;
import com.smartpole.core.engine.StreamKind;
import com.smartpole.core.exception.ConfigurationException;
import com.smartpole.core.exception.NotSeekableException;
import com.smartpole.core.exception.RejectedParameterException;
import com.smartpole.core.graph.PortShape;
import com.smartpole.core.lifecycle.LifecycleState;
import com.smartpole.core.lifecycle.TransitionResult;
import com.smartpole.core.playback.PlaybackObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端测试：PipelineSession 搭配 SimulatedMediaEngine
 * 引擎在自己的工作线程上产生事件，验证控制线程上的完整处理流程
 */
class PipelineSessionTest {

    private static final long TIMEOUT_MS = 3000;

    @TempDir
    Path snapshotDir;

    private PipelineConfig config;
    private SimulatedMediaEngine engine;
    private RecordingObserver observer;
    private PipelineSession session;

    @BeforeEach
    void setUp() {
        config = PipelineConfigLoader.loadDefault()
                .setPollIntervalMs(50)
                .setSnapshotDir(snapshotDir.toString());
        engine = new SimulatedMediaEngine().withStepDelay(Duration.ofMillis(10));
        observer = new RecordingObserver();
    }

    @AfterEach
    void tearDown() {
        if (session != null) {
            session.close();
        }
    }

    private void startSession() {
        session = new PipelineSession(config, engine, observer, null);
        session.start();
    }

    private LifecycleState state() {
        try {
            return session.state().get(1, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new AssertionError("无法读取状态", e);
        }
    }

    private static void awaitCondition(String description, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("等待超时: " + description);
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("播放：动态端口连接、状态逐级通知、流信息与拓扑快照")
    void testPlay() throws Exception {
        startSession();

        assertEquals(TransitionResult.PENDING, session.play().get(1, TimeUnit.SECONDS));
        awaitCondition("进入 PLAYING", () -> state() == LifecycleState.PLAYING);

        assertTrue(engine.getLinkedPorts().contains("src.stream_0 -> depay.sink"));
        assertTrue(session.pendingTarget().get(1, TimeUnit.SECONDS).isEmpty());
        assertEquals(List.of("NULL->READY", "READY->PAUSED", "PAUSED->PLAYING"), observer.states);
        awaitCondition("流信息", () -> !observer.metadata.isEmpty());
        assertEquals("video stream 0:\n  codec: H.264 (Main Profile)\n", observer.metadata.get(0));
        awaitCondition("进度刷新", () -> !observer.positions.isEmpty());
        assertTrue(observer.errors.isEmpty());

        try (Stream<Path> files = Files.list(snapshotDir)) {
            assertEquals(2, files.filter(f -> f.getFileName().toString().startsWith("cctv")).count());
        }
        assertTrue(session.topology().get(1, TimeUnit.SECONDS).contains("\"src\" -> \"depay\""));
    }

    @Test
    @DisplayName("低于 PAUSED 时定位失败")
    void testSeekBeforePlay() {
        startSession();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> session.seek(1_000_000_000L).get(1, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof NotSeekableException);
    }

    @Test
    @DisplayName("运行时切换人脸区域显示，不重启管线")
    void testToggleDisplay() throws Exception {
        startSession();
        assertEquals(Boolean.FALSE, engine.getNodeProperty("facedetect", "display").orElseThrow());
        session.play();
        awaitCondition("进入 PLAYING", () -> state() == LifecycleState.PLAYING);

        assertTrue(session.toggleParameter("facedetect", "display").get(1, TimeUnit.SECONDS));
        assertEquals(Boolean.TRUE, engine.getNodeProperty("facedetect", "display").orElseThrow());
        assertEquals(LifecycleState.PLAYING, state());

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> session.setParameter("facedetect", "updates", "sometimes").get(1, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof RejectedParameterException);
        assertEquals("every_frame", session.getParameter("facedetect", "updates").get(1, TimeUnit.SECONDS)
                .orElseThrow());
    }

    @Test
    @DisplayName("流结束后自动重播")
    void testEosRestart() throws Exception {
        engine.withDuration(Duration.ofMillis(200));
        startSession();
        session.play();

        awaitCondition("发生重播", () -> session.getMetrics().getEosRestarts().getCount() >= 1);
        awaitCondition("重播后回到 PLAYING", () -> state() == LifecycleState.PLAYING);
        assertTrue(observer.durations.contains(Duration.ofMillis(200).toNanos()));
        assertEquals(0, session.getMetrics().getEosRestartFailures().getCount());
    }

    @Test
    @DisplayName("引擎错误回到 READY 并通知外部")
    void testEngineError() throws Exception {
        startSession();
        session.play();
        awaitCondition("进入 PLAYING", () -> state() == LifecycleState.PLAYING);

        engine.injectError("src", "Could not read from resource.", "rtspsrc.c: connection lost");

        awaitCondition("收到错误", () -> !observer.errors.isEmpty());
        assertEquals(LifecycleState.READY, state());
        assertTrue(session.isFailed().get(1, TimeUnit.SECONDS));

        session.play();
        assertFalse(session.isFailed().get(1, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("到达 READY 时仍有未连接的动态端口属于配置错误")
    void testUnresolvedDeferredLink() throws Exception {
        engine.withPortAnnouncement(false, SimulatedMediaEngine.DEFAULT_PORT_SHAPE)
                .withStepDelay(Duration.ofMillis(200));
        startSession();
        session.play();

        awaitCondition("收到配置错误", () -> !observer.errors.isEmpty());
        assertTrue(session.isFailed().get(1, TimeUnit.SECONDS));
        assertEquals(LifecycleState.READY, state());
        assertTrue(session.pendingTarget().get(1, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    @DisplayName("动态端口格式不兼容时只告警，管线照常播放")
    void testIncompatibleAnnouncedPortDegrades() throws Exception {
        engine.withPortAnnouncement(true, PortShape.parse("application/x-rtp, media=audio"));
        startSession();
        session.play();

        awaitCondition("进入 PLAYING", () -> state() == LifecycleState.PLAYING);
        assertTrue(observer.errors.isEmpty());
        assertFalse(session.isFailed().get(1, TimeUnit.SECONDS));
        assertFalse(engine.getLinkedPorts().contains("src.stream_0 -> depay.sink"));
        assertEquals(1, session.getMetrics().getLinkFailures().getCount());
    }

    @Test
    @DisplayName("引擎拒绝静态连接时启动失败")
    void testStartFailsWhenEngineRejectsLink() {
        engine.withLinkRejection(true);
        session = new PipelineSession(config, engine, observer, null);

        assertThrows(ConfigurationException.class, session::start);
    }

    private static class RecordingObserver implements PlaybackObserver {
        final List<String> states = new CopyOnWriteArrayList<>();
        final List<Long> durations = new CopyOnWriteArrayList<>();
        final List<Long> positions = new CopyOnWriteArrayList<>();
        final List<String> errors = new CopyOnWriteArrayList<>();
        final List<String> metadata = new CopyOnWriteArrayList<>();

        @Override
        public void onDurationKnown(long durationNanos) {
            durations.add(durationNanos);
        }

        @Override
        public void onPositionUpdate(long positionNanos, long durationNanos) {
            positions.add(positionNanos);
        }

        @Override
        public void onStateUpdate(LifecycleState oldState, LifecycleState newState) {
            states.add(oldState + "->" + newState);
        }

        @Override
        public void onError(String source, String message, String detail) {
            errors.add(message);
        }

        @Override
        public void onMetadataUpdate(int streamIndex, StreamKind kind, String text) {
            metadata.add(text);
        }
    }
}
