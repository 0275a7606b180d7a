package com.smartpole.core.bus;

import com.smartpole.core.lifecycle.LifecycleState;
import lombok.Getter;
import lombok.ToString;

/**
 * 引擎报告的状态变化。pendingState 为 null 表示引擎已无后续目标。
 */
@Getter
@ToString
public class StateChangedEvent extends PipelineEvent {

    private final LifecycleState oldState;
    private final LifecycleState newState;
    private final LifecycleState pendingState;

    public StateChangedEvent(String source, LifecycleState oldState, LifecycleState newState,
            LifecycleState pendingState) {
        super(EventType.STATE_CHANGED, source);
        this.oldState = oldState;
        this.newState = newState;
        this.pendingState = pendingState;
    }
}
