package com.slotframe.api.component;

import java.util.Map;

/**
 * 函数式组件
 * <p>
 * 一次性的内联定制，由框架包装成 {@link FunctionComponent}。
 */
@FunctionalInterface
public interface ComponentFunction {

    Object apply(Map<String, Object> params);
}
