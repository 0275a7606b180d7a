package com.smartpole.core.engine;

public enum SeekFlag {

    /**
     * 丢弃已缓冲但尚未消费的数据，使新位置立即可见
     */
    FLUSH,

    /**
     * 定位到最近的关键帧
     */
    KEY_UNIT,

    ACCURATE
}
