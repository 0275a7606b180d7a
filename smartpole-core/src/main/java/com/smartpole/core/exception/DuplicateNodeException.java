package com.smartpole.core.exception;

import lombok.Getter;

@Getter
public class DuplicateNodeException extends ConfigurationException {

    private final String nodeName;

    public DuplicateNodeException(String nodeName) {
        super("节点名称已存在: " + nodeName);
        this.nodeName = nodeName;
    }
}
