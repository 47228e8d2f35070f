package com.slotframe.core.exception;

import com.slotframe.api.exception.SlotException;

/**
 * 组件实例化异常
 */
public class ComponentCreationException extends SlotException {

    private final String propertyName;

    public ComponentCreationException(String propertyName, String message, Throwable cause) {
        super(message, cause);
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
