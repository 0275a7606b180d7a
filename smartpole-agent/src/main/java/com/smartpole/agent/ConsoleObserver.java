package com.smartpole.agent;

import java.util.concurrent.TimeUnit;

import com.smartpole.core.engine.StreamKind;
import com.smartpole.core.lifecycle.LifecycleState;
import com.smartpole.core.playback.PlaybackObserver;
import com.smartpole.core.playback.PositionDisplay;
import lombok.extern.slf4j.Slf4j;

/**
 * 控制台版的界面：把通知打印到标准输出，进度条用一行文字表示。
 */
@Slf4j
public class ConsoleObserver implements PlaybackObserver, PositionDisplay {

    private volatile long rangeNanos = -1L;

    @Override
    public void onDurationKnown(long durationNanos) {
        System.out.println("时长: " + format(durationNanos));
    }

    @Override
    public void onPositionUpdate(long positionNanos, long durationNanos) {
        log.debug("position={} duration={}", positionNanos, durationNanos);
    }

    @Override
    public void onStateUpdate(LifecycleState oldState, LifecycleState newState) {
        System.out.printf("状态: %s -> %s%n", oldState, newState);
    }

    @Override
    public void onError(String source, String message, String detail) {
        System.out.printf("错误 [%s]: %s%n", source == null ? "pipeline" : source, message);
        if (detail != null) {
            System.out.println("  调试信息: " + detail);
        }
    }

    @Override
    public void onMetadataUpdate(int streamIndex, StreamKind kind, String text) {
        System.out.print(text);
    }

    @Override
    public void setRange(long durationNanos) {
        rangeNanos = durationNanos;
    }

    @Override
    public void setValue(long positionNanos) {
        long range = rangeNanos;
        System.out.printf("\r[%s / %s]%n", format(positionNanos), range < 0 ? "--:--" : format(range));
    }

    private static String format(long nanos) {
        long seconds = TimeUnit.NANOSECONDS.toSeconds(nanos);
        return "%02d:%02d".formatted(seconds / 60, seconds % 60);
    }
}
