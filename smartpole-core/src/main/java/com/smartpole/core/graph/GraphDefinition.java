package com.smartpole.core.graph;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 处理图的静态蓝图，不包含任何运行时状态。
 * 对应 pipeline.json 中的 "graph" 字段。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class GraphDefinition {

    @JsonProperty("graph_name")
    private String graphName;

    @JsonProperty("nodes")
    private List<NodeSpec> nodes = new ArrayList<>();

    @JsonProperty("connections")
    private List<ConnectionConfig> connections = new ArrayList<>();
}
