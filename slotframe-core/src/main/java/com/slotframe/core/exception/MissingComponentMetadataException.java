package com.slotframe.core.exception;

import com.slotframe.api.exception.SlotException;

/**
 * 扩展点缺少生命周期元数据，无法适配框架组件
 */
public class MissingComponentMetadataException extends SlotException {

    private final String propertyName;

    public MissingComponentMetadataException(String propertyName) {
        super("No component metadata registered for: " + propertyName);
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
