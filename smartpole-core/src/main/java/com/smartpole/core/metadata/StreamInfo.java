package com.smartpole.core.metadata;

import com.smartpole.core.engine.StreamKind;
import lombok.Value;

@Value
public class StreamInfo {

    int streamIndex;
    StreamKind kind;
    String text;
}
