package com.slotframe.core.metadata;

import com.slotframe.core.loader.ComponentMetadataLoader;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 扩展点元数据仓库
 */
@Slf4j
public class ComponentMetadataProvider {

    public static final String DEFAULT_RESOURCE = "META-INF/slotframe/component-metadata.yml";

    private final Map<String, ComponentMetadata> metadata = new ConcurrentHashMap<>();

    /**
     * 从 classpath 资源加载内置扩展点元数据
     */
    public static ComponentMetadataProvider fromClasspath(String resource, ClassLoader classLoader) {
        ComponentMetadataProvider provider = new ComponentMetadataProvider();
        Map<String, ComponentMetadata> loaded = ComponentMetadataLoader.load(resource, classLoader);
        loaded.forEach(provider::register);
        log.debug("Loaded metadata for {} extension points from {}", loaded.size(), resource);
        return provider;
    }

    public static ComponentMetadataProvider fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE, ComponentMetadataProvider.class.getClassLoader());
    }

    public void register(String propertyName, ComponentMetadata componentMetadata) {
        metadata.put(propertyName, componentMetadata);
    }

    @Nullable
    public ComponentMetadata retrieve(String propertyName) {
        return metadata.get(propertyName);
    }

    public int size() {
        return metadata.size();
    }
}
