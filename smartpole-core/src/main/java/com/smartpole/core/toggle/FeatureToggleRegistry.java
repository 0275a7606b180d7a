package com.smartpole.core.toggle;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.smartpole.core.engine.MediaEngine;
import com.smartpole.core.exception.ConfigurationException;
import com.smartpole.core.exception.RejectedParameterException;
import com.smartpole.core.graph.Graph;
import com.smartpole.core.graph.Node;
import com.smartpole.core.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

/**
 * 节点级的运行时参数（例如人脸区域叠加层的显示开关）。
 * 修改立即下发到引擎，不重建也不重启管线；被拒绝时保留原值。只在控制线程上调用。
 */
@Slf4j
public class FeatureToggleRegistry {

    private final Graph graph;
    private final MediaEngine engine;
    private final PipelineMetrics metrics;
    // 键为 node/key
    private final Map<String, ParameterSpec> specs = new LinkedHashMap<>();

    public FeatureToggleRegistry(Graph graph, MediaEngine engine, PipelineMetrics metrics) {
        this.graph = graph;
        this.engine = engine;
        this.metrics = metrics;
    }

    /**
     * 声明参数。节点上已有的配置值按声明的类型规范化，尚无取值时写入默认值
     * （此时尚未下发到引擎，由建图时的初始参数携带）。
     *
     * @throws ConfigurationException 配置值或默认值不符合声明
     */
    public void declare(String nodeName, ParameterSpec spec) {
        Node node = graph.requireNode(nodeName);
        if (spec.getKey() == null || spec.getType() == null) {
            throw new IllegalArgumentException("参数声明缺少 key 或 type: " + nodeName);
        }
        Object configured = node.getParameters().get(spec.getKey());
        if (configured != null) {
            graph.updateParameter(nodeName, spec.getKey(), coerceConfigured(nodeName, spec, configured));
        } else if (spec.getDefaultValue() != null) {
            graph.updateParameter(nodeName, spec.getKey(), coerceConfigured(nodeName, spec, spec.getDefaultValue()));
        }
        specs.put(keyOf(nodeName, spec.getKey()), spec);
        log.debug("FeatureToggleRegistry: 已声明参数 {}.{} type={}", nodeName, spec.getKey(), spec.getType());
    }

    /**
     * 修改节点参数，下一个处理周期生效。
     *
     * @return 规范化后的取值
     * @throws RejectedParameterException 节点或参数未声明、取值非法或引擎拒绝
     */
    public Object setParameter(String nodeName, String key, Object value) {
        if (graph.findNode(nodeName).isEmpty()) {
            throw reject(nodeName, key, "节点不存在");
        }
        ParameterSpec spec = specs.get(keyOf(nodeName, key));
        if (spec == null) {
            throw reject(nodeName, key, "参数未声明为可切换");
        }
        Object coerced;
        try {
            coerced = spec.coerce(value);
        } catch (IllegalArgumentException e) {
            throw reject(nodeName, key, e.getMessage());
        }
        if (!engine.setNodeProperty(nodeName, key, coerced)) {
            throw reject(nodeName, key, "引擎拒绝该取值: " + coerced);
        }
        graph.updateParameter(nodeName, key, coerced);
        log.info("FeatureToggleRegistry: {}.{} = {}", nodeName, key, coerced);
        return coerced;
    }

    /**
     * 翻转布尔参数（按钮语义）。
     *
     * @return 翻转后的取值
     */
    public boolean toggle(String nodeName, String key) {
        ParameterSpec spec = specs.get(keyOf(nodeName, key));
        if (spec == null || spec.getType() != ParameterType.BOOLEAN) {
            throw reject(nodeName, key, "只有已声明的布尔参数可以翻转");
        }
        boolean current = getParameter(nodeName, key).map(Boolean.class::cast).orElse(Boolean.FALSE);
        return (Boolean) setParameter(nodeName, key, !current);
    }

    public Optional<Object> getParameter(String nodeName, String key) {
        return graph.findNode(nodeName).map(node -> node.getParameters().get(key));
    }

    public Optional<ParameterSpec> findSpec(String nodeName, String key) {
        return Optional.ofNullable(specs.get(keyOf(nodeName, key)));
    }

    private static Object coerceConfigured(String nodeName, ParameterSpec spec, Object value) {
        try {
            return spec.coerce(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("参数 %s.%s 的配置值非法: %s".formatted(nodeName, spec.getKey(),
                    e.getMessage()), e);
        }
    }

    private RejectedParameterException reject(String nodeName, String key, String reason) {
        log.warn("FeatureToggleRegistry: 参数 {}.{} 被拒绝: {}", nodeName, key, reason);
        if (metrics != null) {
            metrics.getRejectedParameters().inc();
        }
        return new RejectedParameterException(nodeName, key, reason);
    }

    private static String keyOf(String nodeName, String key) {
        return nodeName + "/" + key;
    }
}
