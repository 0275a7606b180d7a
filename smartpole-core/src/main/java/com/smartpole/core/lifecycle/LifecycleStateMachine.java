package com.smartpole.core.lifecycle;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import com.smartpole.core.bus.StateChangedEvent;
import com.smartpole.core.engine.MediaEngine;
import com.smartpole.core.engine.StateChangeReturn;
import com.smartpole.core.metrics.PipelineMetrics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 驱动管线在 NULL / READY / PAUSED / PLAYING 之间切换，并维护“挂起”标记。
 * <p>
 * 任何时刻最多只有一个挂起目标：挂起期间的新请求会取代旧目标，
 * 被取代目标的确认事件不会清除挂起标记。所有方法只在控制线程上调用。
 */
@Slf4j
public class LifecycleStateMachine {

    private final MediaEngine engine;
    private final PipelineMetrics metrics;
    private final List<LifecycleListener> listeners = new CopyOnWriteArrayList<>();

    @Getter
    private LifecycleState current = LifecycleState.NULL;
    private LifecycleState pendingTarget;
    // 引擎错误后置位，下一次显式命令清除
    @Getter
    private boolean failed;

    public LifecycleStateMachine(MediaEngine engine, PipelineMetrics metrics) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.metrics = metrics;
    }

    public void addListener(LifecycleListener listener) {
        listeners.add(listener);
    }

    public Optional<LifecycleState> getPendingTarget() {
        return Optional.ofNullable(pendingTarget);
    }

    public boolean isPending() {
        return pendingTarget != null;
    }

    /**
     * 请求切换到目标状态，立即返回。
     *
     * @return COMPLETED 已生效；PENDING 等待引擎确认；REJECTED 引擎拒绝，状态不变
     */
    public TransitionResult request(LifecycleState target) {
        Objects.requireNonNull(target, "target");
        if (metrics != null) {
            metrics.getTransitionsRequested().inc();
        }
        if (pendingTarget == null && target == current) {
            log.debug("Lifecycle: 已处于 {}，无需切换", target);
            return TransitionResult.COMPLETED;
        }
        if (pendingTarget == target) {
            log.debug("Lifecycle: 目标 {} 已在挂起中", target);
            return TransitionResult.PENDING;
        }

        StateChangeReturn ret = engine.requestState(target);
        switch (ret) {
            case SUCCESS:
            case NO_PREROLL:
                if (pendingTarget != null) {
                    log.info("Lifecycle: 挂起目标 {} 被 {} 取代并同步完成", pendingTarget, target);
                    countSuperseded();
                }
                pendingTarget = null;
                LifecycleState old = current;
                current = target;
                log.info("Lifecycle: {} -> {} 已完成 ({})", old, target, ret);
                fireStateChanged(old, target);
                fireSettled(target);
                return TransitionResult.COMPLETED;
            case ASYNC:
                if (pendingTarget != null) {
                    log.info("Lifecycle: 挂起目标 {} 被 {} 取代", pendingTarget, target);
                    countSuperseded();
                }
                pendingTarget = target;
                if (metrics != null) {
                    metrics.getTransitionsPending().inc();
                }
                log.info("Lifecycle: {} -> {} 挂起中", current, target);
                return TransitionResult.PENDING;
            case FAILURE:
            default:
                if (metrics != null) {
                    metrics.getTransitionsRejected().inc();
                }
                log.warn("Lifecycle: 引擎拒绝切换 {} -> {}", current, target);
                return TransitionResult.REJECTED;
        }
    }

    /**
     * 处理引擎报告的状态变化。
     * <p>
     * newState 等于挂起目标时确认并清除挂起标记；否则只接受与当前状态衔接、
     * 且位于当前状态与挂起目标之间的中间状态。被取代目标或同步切换之前排队的确认一律忽略。
     */
    public void onStateChanged(StateChangedEvent event) {
        LifecycleState reported = event.getNewState();
        if (pendingTarget != null && reported == pendingTarget) {
            apply(reported, event);
            pendingTarget = null;
            log.info("Lifecycle: 挂起目标 {} 已确认", reported);
            fireSettled(reported);
            return;
        }
        if (!isConsistent(event)) {
            log.debug("Lifecycle: 忽略过期的状态变化 {} -> {} (当前 {}, 挂起 {})", event.getOldState(), reported,
                    current, pendingTarget);
            return;
        }
        apply(reported, event);
        if (pendingTarget != null) {
            log.debug("Lifecycle: 状态 {} 不是挂起目标 {}，保持挂起", reported, pendingTarget);
        }
    }

    private boolean isConsistent(StateChangedEvent event) {
        LifecycleState from = event.getOldState();
        if (from != null && from != current) {
            return false;
        }
        if (pendingTarget == null) {
            return true;
        }
        int reported = event.getNewState().ordinal();
        int low = Math.min(current.ordinal(), pendingTarget.ordinal());
        int high = Math.max(current.ordinal(), pendingTarget.ordinal());
        return reported >= low && reported <= high;
    }

    private void apply(LifecycleState reported, StateChangedEvent event) {
        if (reported == current) {
            return;
        }
        LifecycleState old = current;
        current = reported;
        log.info("Lifecycle: State set to {} (from {}, engine pending={})", reported, old, event.getPendingState());
        fireStateChanged(old, reported);
    }

    /**
     * 引擎错误：无论挂起目标为何，立即回到 READY 并清除挂起标记。
     */
    public void forceReady() {
        failed = true;
        if (pendingTarget != null) {
            log.warn("Lifecycle: 引擎错误，放弃挂起目标 {}", pendingTarget);
            pendingTarget = null;
        }
        StateChangeReturn ret = engine.requestState(LifecycleState.READY);
        if (ret == StateChangeReturn.FAILURE) {
            log.error("Lifecycle: 引擎拒绝回到 READY");
        }
        if (current != LifecycleState.READY) {
            LifecycleState old = current;
            current = LifecycleState.READY;
            fireStateChanged(old, LifecycleState.READY);
        }
        fireSettled(LifecycleState.READY);
    }

    public void clearFailure() {
        failed = false;
    }

    private void countSuperseded() {
        if (metrics != null) {
            metrics.getTransitionsSuperseded().inc();
        }
    }

    private void fireStateChanged(LifecycleState oldState, LifecycleState newState) {
        for (LifecycleListener listener : listeners) {
            try {
                listener.onStateChanged(oldState, newState);
            } catch (Exception e) {
                log.error("Lifecycle: 监听器处理状态变化失败 {} -> {}", oldState, newState, e);
            }
        }
    }

    private void fireSettled(LifecycleState state) {
        for (LifecycleListener listener : listeners) {
            try {
                listener.onTransitionSettled(state);
            } catch (Exception e) {
                log.error("Lifecycle: 监听器处理确认事件失败 {}", state, e);
            }
        }
    }
}
