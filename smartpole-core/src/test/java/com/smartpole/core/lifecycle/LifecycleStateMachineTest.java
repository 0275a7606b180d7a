package com.smartpole.core.lifecycle;

import java.util.ArrayList;
import java.util.List;

import com.smartpole.core.bus.StateChangedEvent;
import com.smartpole.core.engine.ScriptedMediaEngine;
import com.smartpole.core.engine.StateChangeReturn;
import com.smartpole.core.metrics.PipelineMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 生命周期状态机测试
 * 验证挂起目标的唯一性、取代与确认语义
 */
class LifecycleStateMachineTest {

    private ScriptedMediaEngine engine;
    private PipelineMetrics metrics;
    private LifecycleStateMachine lifecycle;
    private final List<String> changes = new ArrayList<>();
    private final List<LifecycleState> settled = new ArrayList<>();

    @BeforeEach
    void setUp() {
        engine = new ScriptedMediaEngine();
        metrics = new PipelineMetrics("lifecycle-test");
        lifecycle = new LifecycleStateMachine(engine, metrics);
        lifecycle.addListener(new LifecycleListener() {
            @Override
            public void onStateChanged(LifecycleState oldState, LifecycleState newState) {
                changes.add(oldState + "->" + newState);
            }

            @Override
            public void onTransitionSettled(LifecycleState state) {
                settled.add(state);
            }
        });
    }

    private static StateChangedEvent changed(LifecycleState from, LifecycleState to, LifecycleState pending) {
        return new StateChangedEvent("pipeline", from, to, pending);
    }

    @Test
    @DisplayName("同步完成的请求立即生效")
    void testSynchronousTransition() {
        assertEquals(TransitionResult.COMPLETED, lifecycle.request(LifecycleState.READY));

        assertEquals(LifecycleState.READY, lifecycle.getCurrent());
        assertFalse(lifecycle.isPending());
        assertEquals(List.of("NULL->READY"), changes);
        assertEquals(List.of(LifecycleState.READY), settled);
    }

    @Test
    @DisplayName("请求当前状态是无操作")
    void testSameStateIsNoop() {
        lifecycle.request(LifecycleState.READY);
        engine.requestedStates.clear();

        assertEquals(TransitionResult.COMPLETED, lifecycle.request(LifecycleState.READY));
        assertTrue(engine.requestedStates.isEmpty());
    }

    @Test
    @DisplayName("异步请求挂起，确认事件只清除一次")
    void testAsyncTransitionClearedOnce() {
        engine.answer(LifecycleState.PLAYING, StateChangeReturn.ASYNC);

        assertEquals(TransitionResult.PENDING, lifecycle.request(LifecycleState.PLAYING));
        assertEquals(LifecycleState.PLAYING, lifecycle.getPendingTarget().orElseThrow());

        lifecycle.onStateChanged(changed(LifecycleState.NULL, LifecycleState.READY, LifecycleState.PLAYING));
        lifecycle.onStateChanged(changed(LifecycleState.READY, LifecycleState.PAUSED, LifecycleState.PLAYING));
        assertTrue(lifecycle.isPending());
        assertEquals(LifecycleState.PAUSED, lifecycle.getCurrent());

        lifecycle.onStateChanged(changed(LifecycleState.PAUSED, LifecycleState.PLAYING, null));
        assertFalse(lifecycle.isPending());
        assertEquals(LifecycleState.PLAYING, lifecycle.getCurrent());

        // 重复的确认不会再次触发
        lifecycle.onStateChanged(changed(LifecycleState.PAUSED, LifecycleState.PLAYING, null));
        assertEquals(List.of(LifecycleState.PLAYING), settled);
        assertEquals(List.of("NULL->READY", "READY->PAUSED", "PAUSED->PLAYING"), changes);
    }

    @Test
    @DisplayName("挂起期间重复请求同一目标不会再次请求引擎")
    void testDoublePlayWhilePending() {
        engine.answer(LifecycleState.PLAYING, StateChangeReturn.ASYNC);

        assertEquals(TransitionResult.PENDING, lifecycle.request(LifecycleState.PLAYING));
        assertEquals(TransitionResult.PENDING, lifecycle.request(LifecycleState.PLAYING));

        assertEquals(List.of(LifecycleState.PLAYING), engine.requestedStates);
        assertEquals(LifecycleState.PLAYING, lifecycle.getPendingTarget().orElseThrow());
    }

    @Test
    @DisplayName("新目标取代挂起目标，旧目标的确认被忽略")
    void testSupersededTargetIgnored() {
        engine.answer(LifecycleState.PLAYING, StateChangeReturn.ASYNC);
        engine.answer(LifecycleState.PAUSED, StateChangeReturn.ASYNC);
        lifecycle.request(LifecycleState.PLAYING);

        assertEquals(TransitionResult.PENDING, lifecycle.request(LifecycleState.PAUSED));
        assertEquals(LifecycleState.PAUSED, lifecycle.getPendingTarget().orElseThrow());
        assertEquals(1, metrics.getTransitionsSuperseded().getCount());

        lifecycle.onStateChanged(changed(LifecycleState.NULL, LifecycleState.READY, LifecycleState.PAUSED));
        assertEquals(LifecycleState.READY, lifecycle.getCurrent());

        // 引擎在取代前已排队的 PLAYING 确认
        lifecycle.onStateChanged(changed(LifecycleState.PAUSED, LifecycleState.PLAYING, null));
        assertTrue(lifecycle.isPending());
        assertEquals(LifecycleState.READY, lifecycle.getCurrent());

        lifecycle.onStateChanged(changed(LifecycleState.READY, LifecycleState.PAUSED, null));
        assertFalse(lifecycle.isPending());
        assertEquals(LifecycleState.PAUSED, lifecycle.getCurrent());
        assertEquals(List.of(LifecycleState.PAUSED), settled);
        assertEquals(List.of("NULL->READY", "READY->PAUSED"), changes);
    }

    @Test
    @DisplayName("同步停止后到达的排队确认不改变状态")
    void testStaleConfirmationAfterSynchronousStop() {
        lifecycle.request(LifecycleState.PAUSED);
        engine.answer(LifecycleState.PLAYING, StateChangeReturn.ASYNC);
        assertEquals(TransitionResult.PENDING, lifecycle.request(LifecycleState.PLAYING));
        assertEquals(TransitionResult.COMPLETED, lifecycle.request(LifecycleState.READY));
        changes.clear();

        lifecycle.onStateChanged(changed(LifecycleState.PAUSED, LifecycleState.PLAYING, null));

        assertEquals(LifecycleState.READY, lifecycle.getCurrent());
        assertFalse(lifecycle.isPending());
        assertTrue(changes.isEmpty());
        assertEquals(List.of(LifecycleState.PAUSED, LifecycleState.READY), settled);
    }

    @Test
    @DisplayName("没有挂起目标时接受与当前状态衔接的变化")
    void testUnsolicitedChangeFromCurrent() {
        lifecycle.request(LifecycleState.PAUSED);
        changes.clear();

        lifecycle.onStateChanged(changed(LifecycleState.PAUSED, LifecycleState.READY, null));

        assertEquals(LifecycleState.READY, lifecycle.getCurrent());
        assertEquals(List.of("PAUSED->READY"), changes);
    }

    @Test
    @DisplayName("引擎拒绝时状态与挂起目标保持不变")
    void testRejected() {
        engine.answer(LifecycleState.PLAYING, StateChangeReturn.ASYNC);
        engine.answer(LifecycleState.PAUSED, StateChangeReturn.FAILURE);
        lifecycle.request(LifecycleState.PLAYING);

        assertEquals(TransitionResult.REJECTED, lifecycle.request(LifecycleState.PAUSED));

        assertEquals(LifecycleState.NULL, lifecycle.getCurrent());
        assertEquals(LifecycleState.PLAYING, lifecycle.getPendingTarget().orElseThrow());
        assertEquals(1, metrics.getTransitionsRejected().getCount());
    }

    @Test
    @DisplayName("引擎错误强制回到 READY 并清除挂起")
    void testForceReady() {
        lifecycle.request(LifecycleState.PAUSED);
        engine.answer(LifecycleState.PLAYING, StateChangeReturn.ASYNC);
        lifecycle.request(LifecycleState.PLAYING);

        lifecycle.forceReady();

        assertEquals(LifecycleState.READY, lifecycle.getCurrent());
        assertFalse(lifecycle.isPending());
        assertTrue(lifecycle.isFailed());
        assertEquals(LifecycleState.READY, engine.requestedStates.get(engine.requestedStates.size() - 1));

        lifecycle.clearFailure();
        assertFalse(lifecycle.isFailed());
    }

    @Test
    @DisplayName("监听器异常不影响状态机")
    void testListenerFailureIsolated() {
        lifecycle.addListener(new LifecycleListener() {
            @Override
            public void onStateChanged(LifecycleState oldState, LifecycleState newState) {
                throw new IllegalStateException("boom");
            }
        });

        assertEquals(TransitionResult.COMPLETED, lifecycle.request(LifecycleState.READY));
        assertEquals(LifecycleState.READY, lifecycle.getCurrent());
        assertEquals(List.of("NULL->READY"), changes);
    }

    @Test
    @DisplayName("状态顺序")
    void testStateOrdering() {
        assertTrue(LifecycleState.PLAYING.isAtLeast(LifecycleState.PAUSED));
        assertTrue(LifecycleState.READY.isBelow(LifecycleState.PAUSED));
        assertTrue(LifecycleState.PAUSED.isPlayable());
        assertFalse(LifecycleState.READY.isPlayable());
    }
}
