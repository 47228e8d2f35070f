package com.slotframe.core.exception;

import com.slotframe.api.exception.SlotException;

/**
 * 组件定义冲突异常
 * <p>
 * 同一扩展点上出现互斥的定义方式（如名称与框架组件同时指定）。
 */
public class ComponentConflictException extends SlotException {

    private final String propertyName;

    public ComponentConflictException(String propertyName, String message) {
        super(message);
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
