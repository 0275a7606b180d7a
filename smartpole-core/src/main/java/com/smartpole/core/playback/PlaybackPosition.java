package com.smartpole.core.playback;

import lombok.Value;

/**
 * 播放进度快照。时长未知时 durationNanos 为 -1。
 */
@Value
public class PlaybackPosition {

    public static final PlaybackPosition UNKNOWN = new PlaybackPosition(false, -1L, 0L);

    boolean durationKnown;
    long durationNanos;
    long lastPositionNanos;
}
