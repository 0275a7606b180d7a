package com.smartpole.core.engine;

/**
 * 引擎对状态切换请求的即时答复。
 */
public enum StateChangeReturn {

    /**
     * 已同步完成
     */
    SUCCESS,

    /**
     * 异步进行中，稍后以 StateChanged 事件确认
     */
    ASYNC,

    /**
     * 已完成，但实时源在 PAUSED 下不产出数据
     */
    NO_PREROLL,

    /**
     * 拒绝
     */
    FAILURE
}
