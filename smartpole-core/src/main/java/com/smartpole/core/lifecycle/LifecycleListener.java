package com.smartpole.core.lifecycle;

/**
 * 生命周期变化的监听器，在控制线程上回调。
 */
public interface LifecycleListener {

    /**
     * 观察到的状态发生变化（包括引擎逐级切换时的中间状态）。
     */
    default void onStateChanged(LifecycleState oldState, LifecycleState newState) {
    }

    /**
     * 挂起的目标状态已被确认，或请求同步完成。
     */
    default void onTransitionSettled(LifecycleState state) {
    }
}
