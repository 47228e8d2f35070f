package com.slotframe.core.adapter;

import com.slotframe.api.component.AsyncInitializable;
import com.slotframe.api.component.UserComponent;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.Set;

/**
 * 框架组件动态代理
 * <p>
 * 宿主对包装对象的每个具名方法调用，转发给框架托管的 {@link FrameworkDelegate}：
 * <ul>
 * <li>initAsync -> mount，destroy -> unmount</li>
 * <li>必选/可选方法 -> delegate 同名方法；可选方法缺失时返回返回类型的默认值</li>
 * </ul>
 */
@Slf4j
public class FrameworkComponentProxy implements InvocationHandler {

    private final FrameworkDelegate delegate;
    private final Set<String> mandatoryMethods;
    private final Set<String> optionalMethods;
    private final String debugName;

    public FrameworkComponentProxy(FrameworkDelegate delegate,
                                   Set<String> mandatoryMethods,
                                   Set<String> optionalMethods,
                                   String debugName) {
        this.delegate = delegate;
        this.mandatoryMethods = mandatoryMethods;
        this.optionalMethods = optionalMethods;
        this.debugName = debugName;
    }

    public FrameworkDelegate getDelegate() {
        return delegate;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        String name = method.getName();
        if (method.getDeclaringClass() == Object.class) {
            return invokeObjectMethod(proxy, name, args);
        }

        if (method.getDeclaringClass() == AsyncInitializable.class) {
            return delegate.mount((Map<String, Object>) args[0]);
        }
        if (method.getDeclaringClass() == UserComponent.class && "destroy".equals(name)) {
            delegate.unmount();
            return null;
        }

        if (mandatoryMethods.contains(name) || optionalMethods.contains(name)) {
            if (delegate.hasMethod(name)) {
                return delegate.invokeMethod(name, args);
            }
            log.trace("[{}] Optional method {} not implemented by framework component", debugName, name);
            return defaultValue(method.getReturnType());
        }

        if (method.isDefault()) {
            return InvocationHandler.invokeDefault(proxy, method, args);
        }
        throw new UnsupportedOperationException(debugName + ": method " + name
                + " is not part of the framework component contract");
    }

    private Object invokeObjectMethod(Object proxy, String name, Object[] args) {
        switch (name) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            default:
                return "FrameworkComponent[" + debugName + "]";
        }
    }

    private static Object defaultValue(Class<?> type) {
        if (!type.isPrimitive() || type == void.class) return null;
        if (type == boolean.class) return false;
        if (type == char.class) return '\0';
        if (type == long.class) return 0L;
        if (type == float.class) return 0f;
        if (type == double.class) return 0d;
        if (type == byte.class) return (byte) 0;
        if (type == short.class) return (short) 0;
        return 0;
    }
}
