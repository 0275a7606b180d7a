package com.smartpole.core.playback;

import com.smartpole.core.engine.StreamKind;
import com.smartpole.core.lifecycle.LifecycleState;

/**
 * 外部界面接收通知的接口。所有回调都在控制线程上执行，实现方不得阻塞。
 */
public interface PlaybackObserver {

    void onDurationKnown(long durationNanos);

    /**
     * @param durationNanos 时长未知时为 -1
     */
    void onPositionUpdate(long positionNanos, long durationNanos);

    void onStateUpdate(LifecycleState oldState, LifecycleState newState);

    void onError(String source, String message, String detail);

    void onMetadataUpdate(int streamIndex, StreamKind kind, String text);

    PlaybackObserver NOOP = new PlaybackObserver() {
        @Override
        public void onDurationKnown(long durationNanos) {
        }

        @Override
        public void onPositionUpdate(long positionNanos, long durationNanos) {
        }

        @Override
        public void onStateUpdate(LifecycleState oldState, LifecycleState newState) {
        }

        @Override
        public void onError(String source, String message, String detail) {
        }

        @Override
        public void onMetadataUpdate(int streamIndex, StreamKind kind, String text) {
        }
    };
}
