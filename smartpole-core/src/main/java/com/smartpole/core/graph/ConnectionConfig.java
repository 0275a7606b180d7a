package com.smartpole.core.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionConfig {
    /**
     * 源端口，形如 node.port；动态输出节点可以只写 node 或使用端口模板（如 src.stream_%u）
     */
    @JsonProperty("source")
    private String source;

    /**
     * 目标输入端口，形如 node.port
     */
    @JsonProperty("destination")
    private String destination;
}
