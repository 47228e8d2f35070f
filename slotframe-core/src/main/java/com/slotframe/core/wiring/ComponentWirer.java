package com.slotframe.core.wiring;

import com.slotframe.api.annotation.Autowired;
import com.slotframe.core.exception.ComponentWiringException;
import com.slotframe.core.spi.CollaboratorRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 协作者注入器
 * <p>
 * 每个实例在初始化前调用一次：
 * 1. 为 {@link Autowired} 字段注入协作者（包括父类字段）
 * 2. 依次调用 {@link PostConstruct} 方法（父类优先）
 */
@Slf4j
public class ComponentWirer {

    private final CollaboratorRegistry collaborators;

    public ComponentWirer(CollaboratorRegistry collaborators) {
        this.collaborators = collaborators;
    }

    public void wireBean(Object component) {
        Deque<Class<?>> hierarchy = hierarchyOf(component.getClass());
        for (Class<?> clazz : hierarchy) {
            for (Field field : clazz.getDeclaredFields()) {
                Autowired annotation = field.getAnnotation(Autowired.class);
                if (annotation != null && !Modifier.isStatic(field.getModifiers())) {
                    injectField(component, field, annotation);
                }
            }
        }
        for (Class<?> clazz : hierarchy) {
            for (Method method : clazz.getDeclaredMethods()) {
                if (method.isAnnotationPresent(PostConstruct.class)) {
                    invokePostConstruct(component, method);
                }
            }
        }
    }

    private void injectField(Object component, Field field, Autowired annotation) {
        String componentClass = component.getClass().getName();
        try {
            field.setAccessible(true);

            // 组件自己已赋值的字段不覆盖
            if (field.get(component) != null) {
                log.debug("Field {}.{} already set, skipping injection", componentClass, field.getName());
                return;
            }

            Object collaborator = annotation.value().isEmpty()
                    ? collaborators.getBean(field.getType())
                    : collaborators.getBean(annotation.value());

            if (collaborator == null) {
                if (annotation.optional()) {
                    return;
                }
                throw new ComponentWiringException(componentClass, field.getName(),
                        "No collaborator for " + componentClass + "." + field.getName());
            }
            if (!field.getType().isInstance(collaborator)) {
                throw new ComponentWiringException(componentClass, field.getName(),
                        "Collaborator " + collaborator.getClass().getName() + " is not assignable to "
                                + componentClass + "." + field.getName());
            }
            field.set(component, collaborator);
        } catch (IllegalAccessException e) {
            throw new ComponentWiringException(componentClass, field.getName(),
                    "Failed to inject " + componentClass + "." + field.getName(), e);
        }
    }

    private void invokePostConstruct(Object component, Method method) {
        String componentClass = component.getClass().getName();
        if (method.getParameterCount() != 0) {
            throw new ComponentWiringException(componentClass, method.getName(),
                    "@PostConstruct method must not have parameters: " + method.getName());
        }
        try {
            method.setAccessible(true);
            method.invoke(component);
        } catch (InvocationTargetException e) {
            throw new ComponentWiringException(componentClass, method.getName(),
                    "@PostConstruct method failed: " + method.getName(), e.getTargetException());
        } catch (IllegalAccessException e) {
            throw new ComponentWiringException(componentClass, method.getName(),
                    "Cannot invoke @PostConstruct method: " + method.getName(), e);
        }
    }

    private static Deque<Class<?>> hierarchyOf(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.addFirst(c);
        }
        return hierarchy;
    }
}
