package com.slotframe.core.adapter;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;

/**
 * 通过反射把具名方法转发给框架实例的 Delegate 基类
 * 挂载细节由子类实现。
 */
public abstract class ReflectiveFrameworkDelegate implements FrameworkDelegate {

    private final Object target;
    private final Map<String, Method> methods = new HashMap<>();

    protected ReflectiveFrameworkDelegate(Object target) {
        this.target = target;
        for (Method method : target.getClass().getMethods()) {
            if (method.getDeclaringClass() != Object.class) {
                // 同名重载取第一个，宿主方法按名称约定
                methods.putIfAbsent(method.getName(), method);
            }
        }
    }

    public Object getTarget() {
        return target;
    }

    @Override
    public boolean hasMethod(String methodName) {
        return methods.containsKey(methodName);
    }

    @Override
    public Object invokeMethod(String methodName, Object[] args) throws Throwable {
        Method method = methods.get(methodName);
        if (method == null) {
            throw new NoSuchMethodException(target.getClass().getName() + "." + methodName);
        }
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    @Override
    public void unmount() {
    }
}
