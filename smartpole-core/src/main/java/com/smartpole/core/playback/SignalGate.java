package com.smartpole.core.playback;

/**
 * 屏蔽进度条回传信号的开关，支持嵌套。只在控制线程上使用。
 */
public class SignalGate {

    private int depth;

    public void block() {
        depth++;
    }

    public void unblock() {
        if (depth == 0) {
            throw new IllegalStateException("SignalGate 未被屏蔽");
        }
        depth--;
    }

    public boolean isBlocked() {
        return depth > 0;
    }

    public void runBlocked(Runnable action) {
        block();
        try {
            action.run();
        } finally {
            unblock();
        }
    }
}
