package com.slotframe.api.component;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 选择器结果
 */
@Value
@Builder
public class SelectorResult {

    /**
     * 选中的注册组件名称，可为空
     */
    String component;

    /**
     * 附加参数，优先级最高
     */
    Map<String, Object> params;

    public static SelectorResult of(String component) {
        return new SelectorResult(component, null);
    }

    public static SelectorResult of(String component, Map<String, Object> params) {
        return new SelectorResult(component, params);
    }
}
