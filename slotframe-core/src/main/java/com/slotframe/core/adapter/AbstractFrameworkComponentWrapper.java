package com.slotframe.core.adapter;

import com.slotframe.api.component.AsyncInitializable;
import com.slotframe.api.component.UserComponent;
import com.slotframe.api.exception.InvalidArgumentException;
import com.slotframe.core.spi.FrameworkComponentWrapper;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Proxy;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 框架适配器基类
 * <p>
 * 子类只需负责创建框架托管的实例 ({@link #createDelegate})，
 * 本类校验必选方法并生成实现宿主契约的动态代理。
 */
@Slf4j
public abstract class AbstractFrameworkComponentWrapper implements FrameworkComponentWrapper {

    private final Class<?>[] proxyInterfaces;

    /**
     * @param componentInterfaces 代理额外实现的宿主组件接口（例如某个扩展点的业务接口）
     */
    protected AbstractFrameworkComponentWrapper(Class<?>... componentInterfaces) {
        Set<Class<?>> interfaces = new LinkedHashSet<>();
        interfaces.add(UserComponent.class);
        interfaces.add(AsyncInitializable.class);
        for (Class<?> type : componentInterfaces) {
            if (!type.isInterface()) {
                throw new InvalidArgumentException("componentInterfaces", type.getName(),
                        "Framework proxies can only implement interfaces: " + type.getName());
            }
            interfaces.add(type);
        }
        this.proxyInterfaces = interfaces.toArray(new Class<?>[0]);
    }

    @Override
    public UserComponent wrap(Object frameworkComponent,
                              Set<String> mandatoryMethods,
                              Set<String> optionalMethods,
                              String debugName) {
        FrameworkDelegate delegate = createDelegate(frameworkComponent, debugName);

        for (String method : mandatoryMethods) {
            if (!delegate.hasMethod(method)) {
                log.error("[{}] Framework component {} is missing mandatory method {}",
                        debugName, frameworkComponent, method);
                throw new InvalidArgumentException(debugName, frameworkComponent,
                        "Framework component " + debugName + " must implement method " + method);
            }
        }

        log.debug("[{}] Wrapping framework component {}", debugName, frameworkComponent);
        return (UserComponent) Proxy.newProxyInstance(
                getProxyClassLoader(),
                proxyInterfaces,
                new FrameworkComponentProxy(delegate, mandatoryMethods, optionalMethods, debugName));
    }

    /**
     * 创建框架托管的组件实例，尚未挂载
     */
    protected abstract FrameworkDelegate createDelegate(Object frameworkComponent, String debugName);

    protected ClassLoader getProxyClassLoader() {
        return getClass().getClassLoader();
    }
}
