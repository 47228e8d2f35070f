package com.slotframe.api.config;

import org.jspecify.annotations.Nullable;

/**
 * 组件定义持有者
 * <p>
 * 外部拥有的只读配置对象（全局选项、单项定义、特性参数等）。
 * 对扩展点 P，约定读取以下属性：
 * <ul>
 * <li>{@code P}: Boolean.TRUE / 组件名称 / 组件类 / {@link com.slotframe.api.component.ComponentFunction}</li>
 * <li>{@code P + "Framework"}: 外部框架组件引用</li>
 * <li>{@code P + "Selector"}: {@link com.slotframe.api.component.ComponentSelector}</li>
 * <li>{@code P + "Params"}: Map 或 {@link com.slotframe.api.component.ParamsFunction}</li>
 * </ul>
 */
public interface ComponentDefinition {

    String FRAMEWORK_SUFFIX = "Framework";
    String SELECTOR_SUFFIX = "Selector";
    String PARAMS_SUFFIX = "Params";

    @Nullable
    Object get(String property);
}
