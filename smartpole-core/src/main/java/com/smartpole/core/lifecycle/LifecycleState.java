package com.smartpole.core.lifecycle;

/**
 * 管线生命周期状态，按声明顺序递增：NULL &lt; READY &lt; PAUSED &lt; PLAYING。
 */
public enum LifecycleState {
    NULL,
    READY,
    PAUSED,
    PLAYING;

    public boolean isAtLeast(LifecycleState other) {
        return compareTo(other) >= 0;
    }

    public boolean isBelow(LifecycleState other) {
        return compareTo(other) < 0;
    }

    /**
     * 可以产出画面的状态。
     */
    public boolean isPlayable() {
        return this == PAUSED || this == PLAYING;
    }
}
