package com.slotframe.core.loader;

import com.slotframe.api.component.UserComponent;
import com.slotframe.api.config.MapComponentDefinition;
import com.slotframe.api.exception.InvalidArgumentException;
import com.slotframe.core.enums.ComponentType;
import com.slotframe.core.enums.RegistrationSource;
import com.slotframe.core.exception.DuplicateComponentException;
import com.slotframe.core.registry.UserComponentRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefinitionLoader 单元测试")
class DefinitionLoaderTest {

    public static class FancyRenderer implements UserComponent {
    }

    public static class ReactRenderer {
    }

    public static class BuiltInRenderer implements UserComponent {
    }

    private UserComponentRegistry registry;
    private DefinitionLoader loader;

    @BeforeEach
    void setUp() {
        registry = new UserComponentRegistry();
        loader = new DefinitionLoader(registry, getClass().getClassLoader());
    }

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("应注册组件并返回 options 作为全局定义")
    void shouldLoadResource() {
        MapComponentDefinition definition = loader.loadResource("definitions/grid-definition.yml");

        assertEquals("fancyRenderer", definition.get("cellRenderer"));
        assertEquals(Map.of("color", "red", "style", Map.of("bold", true)), definition.get("cellRendererParams"));

        assertEquals(FancyRenderer.class, registry.retrieve("fancyRenderer").getComponent());
        assertEquals(RegistrationSource.REGISTERED, registry.retrieve("fancyRenderer").getSource());
        assertEquals(ComponentType.FRAMEWORK, registry.retrieve("reactRenderer").getType());
        assertEquals(ReactRenderer.class, registry.retrieve("reactRenderer").getComponent());
    }

    @Test
    @DisplayName("资源不存在时返回空定义")
    void missingResourceShouldBeEmpty() {
        MapComponentDefinition definition = loader.loadResource("definitions/absent.yml");

        assertTrue(definition.asMap().isEmpty());
        assertTrue(registry.getRegisteredNames().isEmpty());
    }

    @Test
    @DisplayName("空文档返回空定义")
    void emptyDocumentShouldBeEmpty() {
        assertTrue(loader.load(yaml("")).asMap().isEmpty());
    }

    @Test
    @DisplayName("未知类名应报错")
    void unknownClassShouldFail() {
        InvalidArgumentException ex = assertThrows(InvalidArgumentException.class,
                () -> loader.load(yaml("components:\n  ghost: com.example.DoesNotExist\n")));
        assertEquals("ghost", ex.getParamName());
    }

    @Test
    @DisplayName("非 UserComponent 的原生组件被注册表拒绝")
    void nonConformingClassShouldFail() {
        assertThrows(InvalidArgumentException.class,
                () -> loader.load(yaml("components:\n  str: java.lang.String\n")));
    }

    @Test
    @DisplayName("段落必须是映射")
    void sectionMustBeMapping() {
        assertThrows(InvalidArgumentException.class, () -> loader.load(yaml("options: [a, b]\n")));
        assertThrows(InvalidArgumentException.class, () -> loader.load(yaml("- a\n- b\n")));
    }

    @Test
    @DisplayName("安全加载：拒绝任意类型标签")
    void shouldRejectGlobalTags() {
        assertThrows(YAMLException.class,
                () -> loader.load(yaml("options: !!java.util.Date {}\n")));
    }

    @Test
    @DisplayName("overrideDefaults 为 true 时可替换内置组件")
    void overrideDefaultsShouldReplaceBuiltIn() {
        registry.registerDefault("agCellRenderer", BuiltInRenderer.class, ComponentType.NATIVE);

        loader.load(yaml("overrideDefaults: true\n"
                + "components:\n  agCellRenderer: " + FancyRenderer.class.getName() + "\n"));

        assertEquals(RegistrationSource.REGISTERED, registry.retrieve("agCellRenderer").getSource());
        assertEquals(FancyRenderer.class, registry.retrieve("agCellRenderer").getComponent());
    }

    @Test
    @DisplayName("未声明 overrideDefaults 时与内置组件重名被拒绝")
    void builtInNameWithoutOverrideShouldFail() {
        registry.registerDefault("agCellRenderer", BuiltInRenderer.class, ComponentType.NATIVE);

        assertThrows(DuplicateComponentException.class, () -> loader.load(yaml(
                "components:\n  agCellRenderer: " + FancyRenderer.class.getName() + "\n")));
        assertEquals(BuiltInRenderer.class, registry.retrieve("agCellRenderer").getComponent());
    }

    @Test
    @DisplayName("overrideDefaults 不能替换已显式注册的组件")
    void overrideDefaultsShouldNotReplaceRegistered() {
        registry.register("fancyRenderer", BuiltInRenderer.class, ComponentType.NATIVE);

        assertThrows(DuplicateComponentException.class, () -> loader.load(yaml("overrideDefaults: true\n"
                + "components:\n  fancyRenderer: " + FancyRenderer.class.getName() + "\n")));
    }

    @Test
    @DisplayName("overrideDefaults 必须是布尔值")
    void overrideDefaultsMustBeBoolean() {
        InvalidArgumentException ex = assertThrows(InvalidArgumentException.class,
                () -> loader.load(yaml("overrideDefaults: yes-please\n")));
        assertEquals("overrideDefaults", ex.getParamName());
    }
}
