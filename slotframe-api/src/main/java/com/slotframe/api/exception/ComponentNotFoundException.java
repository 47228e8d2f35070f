package com.slotframe.api.exception;

/**
 * 组件未找到异常
 * 当必需 (mandatory) 的扩展点无法解析出任何实现时抛出此异常。
 */
public class ComponentNotFoundException extends SlotException {

    private final String propertyName;
    private final String componentName;

    public ComponentNotFoundException(String propertyName, String componentName) {
        super("Error creating component " + propertyName + " => " + componentName);
        this.propertyName = propertyName;
        this.componentName = componentName;
    }

    public String getPropertyName() {
        return propertyName;
    }

    public String getComponentName() {
        return componentName;
    }
}
