package com.smartpole.core.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartpole.core.toggle.ParameterSpec;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 节点的静态配置：名称、引擎类型、端口和初始参数。
 * dynamicOutputs 为 true 的节点（例如 rtspsrc）在运行时才宣告输出端口。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class NodeSpec {

    @JsonProperty("name")
    private String name;

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("dynamic_outputs")
    private boolean dynamicOutputs;

    @JsonProperty("inputs")
    private List<PortSpec> inputs = new ArrayList<>();

    @JsonProperty("outputs")
    private List<PortSpec> outputs = new ArrayList<>();

    @JsonProperty("parameters")
    private Map<String, Object> parameters = new LinkedHashMap<>();

    // 可在运行时切换的参数声明
    @JsonProperty("toggles")
    private List<ParameterSpec> toggles = new ArrayList<>();

    public static NodeSpec of(String name, String kind) {
        return new NodeSpec().setName(name).setKind(kind);
    }

    public NodeSpec addInput(String portName, String shape) {
        inputs.add(new PortSpec(portName, shape));
        return this;
    }

    public NodeSpec addOutput(String portName, String shape) {
        outputs.add(new PortSpec(portName, shape));
        return this;
    }

    public NodeSpec putParameter(String key, Object value) {
        parameters.put(key, value);
        return this;
    }

    public NodeSpec addToggle(ParameterSpec toggle) {
        toggles.add(toggle);
        return this;
    }
}
