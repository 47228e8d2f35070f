package com.slotframe.api.component;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * 组件选择器
 * 在解析时根据参数动态选择组件名称及附加参数。
 */
@FunctionalInterface
public interface ComponentSelector {

    /**
     * @param params 宿主传入的解析参数
     * @return 选择结果，返回 null 表示不做选择
     */
    @Nullable
    SelectorResult select(Map<String, Object> params);
}
