package com.slotframe.api.component;

import java.util.Map;

/**
 * 派生参数函数，对应 P + "Params" 的函数形式
 */
@FunctionalInterface
public interface ParamsFunction {

    Map<String, Object> apply(Map<String, Object> paramsFromHost);
}
