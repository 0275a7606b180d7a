package com.smartpole.core.graph;

/**
 * {@link Graph#link(PortRef, PortRef)} 的结果：立即建立的 {@link LinkHandle}
 * 或等待运行时端口的 {@link DeferredLinkHandle}。
 */
public interface GraphLink {

    PortRef getDestination();

    boolean isActive();
}
