package com.smartpole.core.graph;

/**
 * 端口方向。连接只能从 OUTPUT 指向 INPUT。
 */
public enum PortDirection {
    INPUT,
    OUTPUT
}
