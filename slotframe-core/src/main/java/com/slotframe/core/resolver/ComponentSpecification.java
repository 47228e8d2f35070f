package com.slotframe.core.resolver;

import com.slotframe.api.component.ComponentFunction;
import com.slotframe.api.component.ComponentSelector;
import com.slotframe.api.component.UserComponent;
import lombok.Builder;
import lombok.Value;

/**
 * 单个扩展点在一个定义持有者上的分类结果
 */
@Value
@Builder
public class ComponentSpecification {

    /**
     * P == true：使用默认组件，忽略取值
     */
    boolean useDefault;

    String name;
    Class<? extends UserComponent> nativeClass;
    ComponentFunction nativeFunction;
    Object frameworkComponent;
    ComponentSelector selector;

    public static ComponentSpecification empty() {
        return ComponentSpecification.builder().build();
    }

    /**
     * 原生硬编码形式 (名称 / 类 / 函数) 的数量
     */
    public int nativeHardcodedCount() {
        int count = 0;
        if (name != null) count++;
        if (nativeClass != null) count++;
        if (nativeFunction != null) count++;
        return count;
    }

    public boolean hasHardcoded() {
        return nativeHardcodedCount() > 0 || frameworkComponent != null;
    }
}
