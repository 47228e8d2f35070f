package com.slotframe.core.loader;

import com.slotframe.api.config.MapComponentDefinition;
import com.slotframe.api.exception.InvalidArgumentException;
import com.slotframe.core.enums.ComponentType;
import com.slotframe.core.registry.UserComponentRegistry;
import com.slotframe.core.util.MapMergeUtils;
import com.slotframe.core.util.YamlUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Map;

/**
 * 全局定义加载器
 * <p>
 * 对应 slotframe.yml：
 * <pre>
 * overrideDefaults: true # 可选，允许同名组件替换内置组件
 * components:            # 名称 -> UserComponent 实现类
 *   fancyRenderer: com.example.FancyRenderer
 * frameworkComponents:   # 名称 -> 外部框架组件类
 *   reactRenderer: com.example.ReactRenderer
 * options:               # 全局定义 (定义持有者缺省时使用)
 *   cellRenderer: fancyRenderer
 *   cellRendererParams:
 *     color: red
 * </pre>
 * components / frameworkComponents 以 REGISTERED 来源写入注册表。
 * 未声明 overrideDefaults 时与内置组件重名会被拒绝。
 */
@Slf4j
public class DefinitionLoader {

    private static final String COMPONENTS = "components";
    private static final String FRAMEWORK_COMPONENTS = "frameworkComponents";
    private static final String OPTIONS = "options";
    private static final String OVERRIDE_DEFAULTS = "overrideDefaults";

    private final UserComponentRegistry registry;
    private final ClassLoader classLoader;

    public DefinitionLoader(UserComponentRegistry registry, ClassLoader classLoader) {
        this.registry = registry;
        this.classLoader = classLoader;
    }

    /**
     * 加载 classpath 资源，资源不存在时返回空定义
     */
    public MapComponentDefinition loadResource(String resource) {
        try (InputStream is = classLoader.getResourceAsStream(resource)) {
            if (is == null) {
                log.debug("Definition resource {} not found, using empty global definition", resource);
                return new MapComponentDefinition();
            }
            MapComponentDefinition definition = load(is);
            log.info("Loaded global component definition from {}", resource);
            return definition;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read definition resource: " + resource, e);
        }
    }

    @SuppressWarnings("unchecked")
    public MapComponentDefinition load(InputStream inputStream) {
        Yaml yaml = YamlUtils.createLoaderYaml();
        Object root = yaml.load(inputStream);
        if (root == null) {
            return new MapComponentDefinition();
        }
        if (!(root instanceof Map)) {
            throw new InvalidArgumentException("definition", "Definition root must be a mapping");
        }
        Map<String, Object> document = (Map<String, Object>) MapMergeUtils.deepCopy(root);

        boolean override = overrideDefaults(document);
        section(document, COMPONENTS).forEach((name, className) ->
                registry.register(name, loadClass(name, className), ComponentType.NATIVE, override));
        section(document, FRAMEWORK_COMPONENTS).forEach((name, className) ->
                registry.register(name, loadClass(name, className), ComponentType.FRAMEWORK, override));

        return new MapComponentDefinition(section(document, OPTIONS));
    }

    private static boolean overrideDefaults(Map<String, Object> document) {
        Object value = document.get(OVERRIDE_DEFAULTS);
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean)) {
            throw new InvalidArgumentException(OVERRIDE_DEFAULTS, value, "'" + OVERRIDE_DEFAULTS + "' must be true or false");
        }
        if ((Boolean) value) {
            log.info("Definition is allowed to replace built-in components");
        }
        return (Boolean) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> document, String key) {
        Object value = document.get(key);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw new InvalidArgumentException(key, value, "Section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private Class<?> loadClass(String name, Object className) {
        if (!(className instanceof String)) {
            throw new InvalidArgumentException(name, className, "Component " + name + " must map to a class name");
        }
        try {
            return Class.forName((String) className, false, classLoader);
        } catch (ClassNotFoundException e) {
            log.error("Component {} refers to unknown class {}", name, className);
            throw new InvalidArgumentException(name, "Class not found for component " + name + ": " + className, e);
        }
    }
}
