package com.slotframe.core.exception;

import com.slotframe.api.exception.SlotException;

/**
 * 组件初始化失败
 * 通过创建 Future 的异常通道传递，不会重试。
 */
public class ComponentInitializationException extends SlotException {

    private final String componentClass;

    public ComponentInitializationException(String componentClass, Throwable cause) {
        super("Failed to initialise component: " + componentClass, cause);
        this.componentClass = componentClass;
    }

    public String getComponentClass() {
        return componentClass;
    }
}
