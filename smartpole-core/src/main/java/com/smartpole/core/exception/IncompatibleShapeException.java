package com.smartpole.core.exception;

import com.smartpole.core.graph.PortShape;
import lombok.Getter;

@Getter
public class IncompatibleShapeException extends LinkException {

    private final PortShape outputShape;
    private final PortShape inputShape;

    public IncompatibleShapeException(String outputPort, PortShape outputShape, String inputPort,
            PortShape inputShape) {
        super("端口数据格式不兼容: %s(%s) -> %s(%s)".formatted(outputPort, outputShape, inputPort, inputShape));
        this.outputShape = outputShape;
        this.inputShape = inputShape;
    }
}
