package com.smartpole.core.lifecycle;

/**
 * 状态切换请求的即时结果。
 */
public enum TransitionResult {

    /**
     * 已完成，新状态立即生效
     */
    COMPLETED,

    /**
     * 等待引擎以 StateChanged 事件确认
     */
    PENDING,

    /**
     * 被引擎拒绝，状态不变
     */
    REJECTED
}
