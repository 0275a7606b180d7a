package com.smartpole.core.engine;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import com.smartpole.core.bus.EventSink;
import com.smartpole.core.graph.NodeSpec;
import com.smartpole.core.graph.PortRef;
import com.smartpole.core.lifecycle.LifecycleState;

/**
 * 按脚本应答的引擎替身，记录控制核心发出的所有调用。只在测试线程上使用。
 */
public class ScriptedMediaEngine implements MediaEngine {

    public final List<LifecycleState> requestedStates = new ArrayList<>();
    public final List<String> createdNodes = new ArrayList<>();
    public final List<String> links = new ArrayList<>();
    public final List<Long> seeks = new ArrayList<>();
    public final List<Set<SeekFlag>> seekFlags = new ArrayList<>();
    public final Map<String, Object> properties = new HashMap<>();
    public final Deque<OptionalLong> durationAnswers = new ArrayDeque<>();
    public final Deque<OptionalLong> positionAnswers = new ArrayDeque<>();
    public final Map<StreamKind, List<Map<String, Object>>> tags = new EnumMap<>(StreamKind.class);
    public final Set<String> rejectedProperties = new HashSet<>();

    private final Map<LifecycleState, StateChangeReturn> stateAnswers = new EnumMap<>(LifecycleState.class);
    public EventSink sink;
    public boolean seekResult = true;
    public boolean linkResult = true;
    public OptionalLong defaultDuration = OptionalLong.empty();
    public OptionalLong defaultPosition = OptionalLong.empty();
    public int durationQueries;
    public boolean closed;

    public ScriptedMediaEngine answer(LifecycleState target, StateChangeReturn ret) {
        stateAnswers.put(target, ret);
        return this;
    }

    @Override
    public void setEventSink(EventSink sink) {
        this.sink = sink;
    }

    @Override
    public void createNode(NodeSpec spec) {
        createdNodes.add(spec.getName());
    }

    @Override
    public boolean linkPorts(PortRef output, PortRef input) {
        links.add(output + " -> " + input);
        return linkResult;
    }

    @Override
    public StateChangeReturn requestState(LifecycleState target) {
        requestedStates.add(target);
        return stateAnswers.getOrDefault(target, StateChangeReturn.SUCCESS);
    }

    @Override
    public OptionalLong queryDuration(Duration timeout) {
        durationQueries++;
        return durationAnswers.isEmpty() ? defaultDuration : durationAnswers.poll();
    }

    @Override
    public OptionalLong queryPosition(Duration timeout) {
        return positionAnswers.isEmpty() ? defaultPosition : positionAnswers.poll();
    }

    @Override
    public boolean seek(long positionNanos, Set<SeekFlag> flags) {
        seeks.add(positionNanos);
        seekFlags.add(flags);
        return seekResult;
    }

    @Override
    public boolean setNodeProperty(String nodeName, String key, Object value) {
        if (rejectedProperties.contains(key)) {
            return false;
        }
        properties.put(nodeName + "." + key, value);
        return true;
    }

    @Override
    public int streamCount(StreamKind kind) {
        return tags.getOrDefault(kind, List.of()).size();
    }

    @Override
    public Optional<Map<String, Object>> streamTags(StreamKind kind, int streamIndex) {
        List<Map<String, Object>> list = tags.getOrDefault(kind, List.of());
        return streamIndex < list.size() ? Optional.ofNullable(list.get(streamIndex)) : Optional.empty();
    }

    @Override
    public void close() {
        closed = true;
    }
}
