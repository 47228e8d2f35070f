package com.slotframe.api.config;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 基于 Map 的组件定义
 */
public class MapComponentDefinition implements ComponentDefinition {

    private final Map<String, Object> properties;

    public MapComponentDefinition() {
        this.properties = new LinkedHashMap<>();
    }

    public MapComponentDefinition(Map<String, Object> properties) {
        this.properties = new LinkedHashMap<>(properties);
    }

    public static MapComponentDefinition of(Map<String, Object> properties) {
        return new MapComponentDefinition(properties);
    }

    public MapComponentDefinition with(String property, Object value) {
        properties.put(property, value);
        return this;
    }

    @Override
    @Nullable
    public Object get(String property) {
        return properties.get(property);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(properties);
    }

    @Override
    public String toString() {
        return "MapComponentDefinition" + properties.keySet();
    }
}
