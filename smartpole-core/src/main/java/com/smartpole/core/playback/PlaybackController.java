package com.smartpole.core.playback;

import java.time.Duration;
import java.util.EnumSet;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Function;

import com.smartpole.core.bus.ErrorEvent;
import com.smartpole.core.engine.MediaEngine;
import com.smartpole.core.engine.SeekFlag;
import com.smartpole.core.exception.NotSeekableException;
import com.smartpole.core.exception.SeekException;
import com.smartpole.core.lifecycle.LifecycleListener;
import com.smartpole.core.lifecycle.LifecycleState;
import com.smartpole.core.lifecycle.LifecycleStateMachine;
import com.smartpole.core.lifecycle.TransitionResult;
import com.smartpole.core.metrics.PipelineMetrics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 播放控制：把外部命令转换为生命周期请求，维护进度缓存，处理流结束后的自动重播。
 * 所有方法只在控制线程上调用。
 */
@Slf4j
public class PlaybackController implements LifecycleListener {

    private static final Set<SeekFlag> USER_SEEK_FLAGS = EnumSet.of(SeekFlag.FLUSH, SeekFlag.KEY_UNIT);
    private static final Set<SeekFlag> RESTART_SEEK_FLAGS = EnumSet.of(SeekFlag.FLUSH);

    private final MediaEngine engine;
    private final LifecycleStateMachine lifecycle;
    private final PlaybackObserver observer;
    private final PositionDisplay display;
    private final PipelineMetrics metrics;
    private final Duration queryTimeout;
    private final boolean restartOnEos;
    @Getter
    private final SignalGate sliderGate = new SignalGate();

    private boolean durationKnown;
    private long durationNanos = -1L;
    private long lastPositionNanos;
    @Getter
    private boolean restartInProgress;

    public PlaybackController(MediaEngine engine, LifecycleStateMachine lifecycle, PlaybackObserver observer,
            PositionDisplay display, PipelineMetrics metrics, Duration queryTimeout, boolean restartOnEos) {
        this.engine = engine;
        this.lifecycle = lifecycle;
        this.observer = observer == null ? PlaybackObserver.NOOP : observer;
        this.display = display == null ? PositionDisplay.NONE : display;
        this.metrics = metrics;
        this.queryTimeout = queryTimeout;
        this.restartOnEos = restartOnEos;
    }

    public TransitionResult play() {
        lifecycle.clearFailure();
        return lifecycle.request(LifecycleState.PLAYING);
    }

    public TransitionResult pause() {
        lifecycle.clearFailure();
        cancelRestart();
        return lifecycle.request(LifecycleState.PAUSED);
    }

    /**
     * 回到 READY，并清除已缓存的时长（下一次播放的源可能不同）。
     */
    public TransitionResult stop() {
        lifecycle.clearFailure();
        cancelRestart();
        return stopInternal();
    }

    /**
     * 跳转到指定位置（刷新 + 关键帧）。
     *
     * @return 实际跳转的位置（裁剪到 [0, 时长]）
     * @throws NotSeekableException 当前状态低于 PAUSED
     * @throws SeekException        引擎拒绝
     */
    public long seek(long targetNanos) {
        LifecycleState state = lifecycle.getCurrent();
        if (state.isBelow(LifecycleState.PAUSED)) {
            throw new NotSeekableException(state);
        }
        long effective = Math.max(0L, targetNanos);
        if (durationKnown && effective > durationNanos) {
            effective = durationNanos;
        }
        if (!engine.seek(effective, USER_SEEK_FLAGS)) {
            throw new SeekException("引擎拒绝定位到 %d ns".formatted(effective));
        }
        lastPositionNanos = effective;
        log.info("Playback: 已定位到 {} ns (请求 {} ns)", effective, targetNanos);
        return effective;
    }

    /**
     * 进度条的用户拖动。程序写入进度条期间产生的回传被忽略。
     *
     * @return 是否执行了定位
     */
    public boolean userSeek(long targetNanos) {
        if (sliderGate.isBlocked()) {
            log.debug("Playback: 忽略程序写入进度条引起的回传 {}", targetNanos);
            return false;
        }
        seek(targetNanos);
        return true;
    }

    /**
     * 周期刷新。低于 PAUSED 时直接返回缓存；查询失败时沿用缓存，不抛出异常。
     */
    public PlaybackPosition pollPosition() {
        if (lifecycle.getCurrent().isBelow(LifecycleState.PAUSED)) {
            return getPosition();
        }
        if (!durationKnown) {
            OptionalLong duration = query("duration", engine::queryDuration);
            if (duration.isPresent()) {
                durationKnown = true;
                durationNanos = duration.getAsLong();
                log.info("Playback: 时长已知 {} ns", durationNanos);
                observer.onDurationKnown(durationNanos);
                sliderGate.runBlocked(() -> display.setRange(durationNanos));
            }
        }
        OptionalLong position = query("position", engine::queryPosition);
        if (position.isPresent()) {
            lastPositionNanos = position.getAsLong();
            observer.onPositionUpdate(lastPositionNanos, durationKnown ? durationNanos : -1L);
            sliderGate.runBlocked(() -> display.setValue(lastPositionNanos));
        }
        return getPosition();
    }

    public PlaybackPosition getPosition() {
        return new PlaybackPosition(durationKnown, durationKnown ? durationNanos : -1L, lastPositionNanos);
    }

    /**
     * 流结束：停止、定位到开头、重新播放。重播进行中再次收到流结束时忽略。
     */
    public void onEndOfStream() {
        log.info("Playback: End-Of-Stream reached.");
        if (!restartOnEos) {
            stopInternal();
            return;
        }
        if (restartInProgress) {
            log.debug("Playback: 重播进行中，忽略重复的流结束");
            return;
        }
        restartInProgress = true;
        if (metrics != null) {
            metrics.getEosRestarts().inc();
        }

        if (stopInternal() == TransitionResult.REJECTED) {
            failRestart("流结束后无法回到 READY");
            return;
        }
        // 此时状态为 READY，绕过 seek() 的状态检查
        if (!engine.seek(0L, RESTART_SEEK_FLAGS)) {
            failRestart("流结束后定位到开头失败");
            return;
        }
        lastPositionNanos = 0L;
        // 同步完成时由 onTransitionSettled 清除重播标记
        if (lifecycle.request(LifecycleState.PLAYING) == TransitionResult.REJECTED) {
            failRestart("流结束后重新播放被拒绝");
        }
    }

    /**
     * 引擎错误：强制回到 READY 并通知外部。
     */
    public void onError(ErrorEvent event) {
        log.error("Playback: Error received from element {}: {} ({})", event.getSource(), event.getMessage(),
                event.getDetail());
        restartInProgress = false;
        lifecycle.forceReady();
        observer.onError(event.getSource(), event.getMessage(), event.getDetail());
    }

    @Override
    public void onStateChanged(LifecycleState oldState, LifecycleState newState) {
        observer.onStateUpdate(oldState, newState);
        if (oldState == LifecycleState.READY && newState == LifecycleState.PAUSED) {
            // 刚完成预卷，主动刷新一次，不等下一个周期
            pollPosition();
        }
    }

    @Override
    public void onTransitionSettled(LifecycleState state) {
        if (restartInProgress && state == LifecycleState.PLAYING) {
            restartInProgress = false;
            log.info("Playback: 重播已完成");
        }
    }

    private TransitionResult stopInternal() {
        durationKnown = false;
        durationNanos = -1L;
        return lifecycle.request(LifecycleState.READY);
    }

    // 用户的 pause/stop 取代了重播的 PLAYING 目标
    private void cancelRestart() {
        if (restartInProgress) {
            restartInProgress = false;
            log.info("Playback: 用户命令取消了进行中的重播");
        }
    }

    private void failRestart(String message) {
        restartInProgress = false;
        if (metrics != null) {
            metrics.getEosRestartFailures().inc();
        }
        log.warn("Playback: {}，保持停止状态", message);
        observer.onError(null, message, "state=" + lifecycle.getCurrent());
    }

    private OptionalLong query(String what, Function<Duration, OptionalLong> call) {
        OptionalLong result;
        try {
            result = call.apply(queryTimeout);
        } catch (RuntimeException e) {
            log.warn("Playback: 查询 {} 失败", what, e);
            result = OptionalLong.empty();
        }
        if (result.isEmpty() && metrics != null) {
            metrics.getQueryFailures().inc();
        }
        if (result.isEmpty()) {
            log.debug("Playback: 无法查询 {}，沿用缓存", what);
        }
        return result;
    }
}
