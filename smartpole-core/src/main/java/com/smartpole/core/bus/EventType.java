package com.smartpole.core.bus;

/**
 * 事件总线上的事件种类，用作分发表的键。
 */
public enum EventType {

    /**
     * 引擎错误，结束当前会话
     */
    ERROR,

    /**
     * 流结束
     */
    END_OF_STREAM,

    /**
     * 引擎状态变化
     */
    STATE_CHANGED,

    /**
     * 发现流元数据
     */
    TAGS_DISCOVERED,

    /**
     * 应用自定义事件
     */
    APPLICATION,

    /**
     * 动态输出节点宣告了新端口
     */
    PORT_ANNOUNCED
}
