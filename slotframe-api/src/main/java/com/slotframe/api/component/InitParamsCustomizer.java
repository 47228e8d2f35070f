package com.slotframe.api.component;

import java.util.Map;

/**
 * init 参数定制回调
 * <p>
 * 收到合并后的最终参数和即将初始化的实例，返回值替代原参数传给 init。
 */
@FunctionalInterface
public interface InitParamsCustomizer<T extends UserComponent> {

    Map<String, Object> customize(Map<String, Object> params, T component);
}
