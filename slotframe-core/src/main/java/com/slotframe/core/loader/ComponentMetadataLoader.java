package com.slotframe.core.loader;

import com.slotframe.api.exception.InvalidArgumentException;
import com.slotframe.core.metadata.ComponentMetadata;
import com.slotframe.core.util.YamlUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * 扩展点元数据加载器
 * <p>
 * 格式：
 * <pre>
 * filter:
 *   mandatoryMethods: [isFilterActive, doesFilterPass]
 *   optionalMethods: [afterGuiAttached]
 * </pre>
 */
@Slf4j
public class ComponentMetadataLoader {

    private static final String MANDATORY = "mandatoryMethods";
    private static final String OPTIONAL = "optionalMethods";

    public static Map<String, ComponentMetadata> load(String resource, ClassLoader classLoader) {
        try (InputStream is = classLoader.getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("Component metadata resource {} not found, no extension point metadata loaded", resource);
                return Collections.emptyMap();
            }
            return load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read component metadata: " + resource, e);
        }
    }

    public static Map<String, ComponentMetadata> load(InputStream inputStream) {
        Yaml yaml = YamlUtils.createLoaderYaml();
        Object root = yaml.load(inputStream);
        if (root == null) {
            return Collections.emptyMap();
        }
        if (!(root instanceof Map)) {
            throw new InvalidArgumentException("metadata", "Component metadata root must be a mapping");
        }

        Map<String, ComponentMetadata> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) root).entrySet()) {
            String propertyName = String.valueOf(entry.getKey());
            Map<?, ?> body = entry.getValue() instanceof Map ? (Map<?, ?>) entry.getValue() : Collections.emptyMap();
            result.put(propertyName, ComponentMetadata.of(
                    readMethods(propertyName, body.get(MANDATORY)),
                    readMethods(propertyName, body.get(OPTIONAL))));
        }
        return result;
    }

    private static Set<String> readMethods(String propertyName, Object value) {
        if (value == null) {
            return Collections.emptySet();
        }
        if (!(value instanceof List)) {
            throw InvalidArgumentException.forProperty(propertyName, propertyName, value,
                    "Method list of " + propertyName + " must be a YAML sequence");
        }
        Set<String> methods = new LinkedHashSet<>();
        for (Object method : (List<?>) value) {
            methods.add(String.valueOf(method));
        }
        return methods;
    }
}
