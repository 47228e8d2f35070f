package com.slotframe.core.exception;

import com.slotframe.api.exception.SlotException;

/**
 * 组件重复注册异常
 */
public class DuplicateComponentException extends SlotException {

    private final String componentName;

    public DuplicateComponentException(String componentName, String message) {
        super(message);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }
}
