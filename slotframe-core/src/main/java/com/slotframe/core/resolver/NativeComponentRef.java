package com.slotframe.core.resolver;

import com.slotframe.api.component.UserComponent;

/**
 * 原生组件的实例化引用
 */
public interface NativeComponentRef {

    /**
     * 实现类，用于在不创建实例的情况下做能力检查
     */
    Class<? extends UserComponent> getComponentClass();

    /**
     * 无参构造一个新实例，每次调用返回独立对象
     */
    UserComponent newInstance() throws ReflectiveOperationException;
}
