package com.smartpole.core.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 节点端口的静态声明，对应 graph 配置中的 inputs / outputs 条目。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class PortSpec {

    @JsonProperty("name")
    private String name;

    // caps 风格字符串，缺省为 ANY
    @JsonProperty("shape")
    private String shape;

    public PortShape toShape() {
        return PortShape.parse(shape);
    }
}
