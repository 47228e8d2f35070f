package com.slotframe.core.registry;

import com.slotframe.api.component.ComponentFunction;
import com.slotframe.api.component.UserComponent;
import com.slotframe.api.exception.InvalidArgumentException;
import com.slotframe.core.enums.ComponentType;
import com.slotframe.core.enums.RegistrationSource;
import com.slotframe.core.exception.DuplicateComponentException;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 用户组件注册表
 * <p>
 * 职责：
 * 1. 名称 -> 实现 的唯一映射
 * 2. 内置组件 (DEFAULT) 只能被显式 override 覆盖
 * 3. 只增不删；注册应在解析流量开始前完成
 */
@Slf4j
public class UserComponentRegistry {

    private final Map<String, RegisteredComponent> components = new ConcurrentHashMap<>();

    /**
     * 播种内置组件
     */
    public void registerDefault(String name, Object component, ComponentType type) {
        put(name, component, type, RegistrationSource.DEFAULT, false);
    }

    public void register(String name, Object component, ComponentType type) {
        put(name, component, type, RegistrationSource.REGISTERED, false);
    }

    /**
     * 显式注册
     *
     * @param override 为 true 时允许覆盖同名的内置组件；已显式注册的名称始终不可覆盖
     */
    public void register(String name, Object component, ComponentType type, boolean override) {
        put(name, component, type, RegistrationSource.REGISTERED, override);
    }

    /**
     * 批量注册原生组件
     */
    public void registerComponents(Map<String, ?> nativeComponents) {
        registerComponents(nativeComponents, false);
    }

    /**
     * 批量注册原生组件
     *
     * @param override 为 true 时整批组件都可以替换同名的内置组件
     */
    public void registerComponents(Map<String, ?> nativeComponents, boolean override) {
        if (nativeComponents == null) return;
        nativeComponents.forEach((name, component) -> register(name, component, ComponentType.NATIVE, override));
    }

    public void registerFrameworkComponents(Map<String, ?> frameworkComponents) {
        registerFrameworkComponents(frameworkComponents, false);
    }

    /**
     * 批量注册框架组件
     */
    public void registerFrameworkComponents(Map<String, ?> frameworkComponents, boolean override) {
        if (frameworkComponents == null) return;
        frameworkComponents.forEach((name, component) ->
                register(name, component, ComponentType.FRAMEWORK, override));
    }

    @Nullable
    public RegisteredComponent retrieve(String name) {
        if (name == null) return null;
        return components.get(name);
    }

    public boolean isRegistered(String name) {
        return name != null && components.containsKey(name);
    }

    public Set<String> getRegisteredNames() {
        return Collections.unmodifiableSet(new TreeSet<>(components.keySet()));
    }

    private void put(String name, Object component, ComponentType type,
                     RegistrationSource source, boolean override) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidArgumentException("name", "Component name cannot be blank");
        }
        if (type == null) {
            throw new InvalidArgumentException("type", "Component type cannot be null: " + name);
        }
        checkConformance(name, component, type);

        RegisteredComponent entry = new RegisteredComponent(name, component, type, source);
        RegisteredComponent existing = components.putIfAbsent(name, entry);
        if (existing == null) {
            log.debug("Registered component {} ({}, {})", name, type, source);
            return;
        }

        boolean shadowsDefault = existing.getSource() == RegistrationSource.DEFAULT
                && source == RegistrationSource.REGISTERED;
        if (shadowsDefault && override) {
            components.put(name, entry);
            log.info("Component {} overrides the built-in default", name);
            return;
        }

        log.error("Component {} is already registered ({}), registration rejected", name, existing.getSource());
        throw new DuplicateComponentException(name, shadowsDefault
                ? "Component " + name + " is a built-in default; register with override=true to replace it"
                : "Component already registered: " + name);
    }

    private void checkConformance(String name, Object component, ComponentType type) {
        if (component == null) {
            throw new InvalidArgumentException("component", "Component implementation cannot be null: " + name);
        }
        if (type == ComponentType.FRAMEWORK) {
            return; // 外部框架引用由 Wrapper 负责解释
        }
        if (component instanceof ComponentFunction) {
            return;
        }
        if (component instanceof Class<?> && UserComponent.class.isAssignableFrom((Class<?>) component)) {
            return;
        }
        throw new InvalidArgumentException("component", component,
                "Native component " + name + " must be a UserComponent class or a ComponentFunction");
    }
}
