package com.slotframe.core.exception;

import com.slotframe.api.exception.SlotException;

/**
 * 指定了框架组件，但宿主集成层没有安装 FrameworkComponentWrapper
 */
public class MissingFrameworkWrapperException extends SlotException {

    private final String propertyName;

    public MissingFrameworkWrapperException(String propertyName) {
        super("You are specifying a framework component but no FrameworkComponentWrapper is installed for: "
                + propertyName);
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
