package com.slotframe.core.enums;

/**
 * 组件实现类型
 */
public enum ComponentType {
    /**
     * 直接实现宿主契约
     */
    NATIVE,
    /**
     * 外部框架组件，经 FrameworkComponentWrapper 适配
     */
    FRAMEWORK
}
