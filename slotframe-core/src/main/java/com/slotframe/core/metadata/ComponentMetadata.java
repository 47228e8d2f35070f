package com.slotframe.core.metadata;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 扩展点生命周期方法描述
 * 仅在适配外部框架组件时使用。
 */
@Value
public class ComponentMetadata {
    Set<String> mandatoryMethods;
    Set<String> optionalMethods;

    public static ComponentMetadata of(Set<String> mandatoryMethods, Set<String> optionalMethods) {
        return new ComponentMetadata(
                Collections.unmodifiableSet(new LinkedHashSet<>(mandatoryMethods)),
                Collections.unmodifiableSet(new LinkedHashSet<>(optionalMethods)));
    }

    public static ComponentMetadata empty() {
        return new ComponentMetadata(Collections.emptySet(), Collections.emptySet());
    }
}
