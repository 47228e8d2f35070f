package com.slotframe.core.resolver;

import com.slotframe.api.exception.InvalidArgumentException;
import com.slotframe.core.enums.ComponentSource;
import com.slotframe.core.enums.ComponentType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 单次解析的结果
 * <p>
 * type 为 NATIVE 时 component 是 {@link NativeComponentRef}；
 * 为 FRAMEWORK 时 component 是外部框架组件引用，交给 Wrapper 解释。
 */
@Value
@Builder
public class ComponentClassDef {
    Object component;
    ComponentType type;
    ComponentSource source;
    Map<String, Object> paramsFromSelector;

    public NativeComponentRef getNativeRef() {
        if (type != ComponentType.NATIVE) {
            throw new InvalidArgumentException("type", type, "Not a native component definition");
        }
        return (NativeComponentRef) component;
    }

    /**
     * 底层实现类：原生组件返回实现类，框架组件返回引用本身的类型（引用为 Class 时返回该 Class）
     */
    public Class<?> getImplementationClass() {
        if (type == ComponentType.NATIVE) {
            return getNativeRef().getComponentClass();
        }
        return component instanceof Class<?> ? (Class<?>) component : component.getClass();
    }
}
