package com.slotframe.core.enums;

/**
 * 注册来源
 */
public enum RegistrationSource {
    /**
     * 启动时播种的内置组件
     */
    DEFAULT,
    /**
     * 显式注册
     */
    REGISTERED;

    public ComponentSource toComponentSource() {
        return this == REGISTERED ? ComponentSource.REGISTERED_BY_NAME : ComponentSource.DEFAULT;
    }
}
