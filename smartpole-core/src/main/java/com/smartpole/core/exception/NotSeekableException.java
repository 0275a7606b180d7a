package com.smartpole.core.exception;

import com.smartpole.core.lifecycle.LifecycleState;
import lombok.Getter;

@Getter
public class NotSeekableException extends SeekException {

    private final LifecycleState state;

    public NotSeekableException(LifecycleState state) {
        super("当前状态不支持定位: " + state);
        this.state = state;
    }
}
