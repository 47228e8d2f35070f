package com.slotframe.core.exception;

import com.slotframe.api.exception.SlotException;

/**
 * 协作者注入异常
 */
public class ComponentWiringException extends SlotException {

    private final String componentClass;
    private final String fieldName;

    public ComponentWiringException(String componentClass, String fieldName, String message) {
        super(message);
        this.componentClass = componentClass;
        this.fieldName = fieldName;
    }

    public ComponentWiringException(String componentClass, String fieldName, String message, Throwable cause) {
        super(message, cause);
        this.componentClass = componentClass;
        this.fieldName = fieldName;
    }

    public String getComponentClass() {
        return componentClass;
    }

    public String getFieldName() {
        return fieldName;
    }
}
