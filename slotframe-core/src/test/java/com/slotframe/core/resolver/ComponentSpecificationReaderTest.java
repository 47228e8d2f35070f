package com.slotframe.core.resolver;

import com.slotframe.api.component.ComponentFunction;
import com.slotframe.api.component.ComponentSelector;
import com.slotframe.api.component.SelectorResult;
import com.slotframe.api.component.UserComponent;
import com.slotframe.api.config.MapComponentDefinition;
import com.slotframe.api.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ComponentSpecificationReader 单元测试")
class ComponentSpecificationReaderTest {

    public static class CheckboxRenderer implements UserComponent {
    }

    private final ComponentSpecificationReader reader = new ComponentSpecificationReader();

    @Test
    @DisplayName("null 定义返回空规格")
    void nullDefinitionShouldBeEmpty() {
        ComponentSpecification spec = reader.read(null, "cellRenderer");

        assertFalse(spec.hasHardcoded());
        assertNull(spec.getSelector());
        assertFalse(spec.isUseDefault());
    }

    @Test
    @DisplayName("true 表示使用默认组件")
    void trueMeansUseDefault() {
        ComponentSpecification spec = reader.read(new MapComponentDefinition().with("filter", true), "filter");

        assertTrue(spec.isUseDefault());
        assertEquals(0, spec.nativeHardcodedCount());
    }

    @Test
    @DisplayName("false 与空字符串都被忽略")
    void falseAndBlankAreIgnored() {
        assertFalse(reader.read(new MapComponentDefinition().with("filter", false), "filter").hasHardcoded());
        assertFalse(reader.read(new MapComponentDefinition().with("filter", "  "), "filter").hasHardcoded());
    }

    @Test
    @DisplayName("应区分名称、类、函数与框架引用")
    void shouldClassifyEachForm() {
        ComponentFunction fn = params -> "x";
        Object frameworkRef = new Object();

        assertEquals("fancy", reader.read(new MapComponentDefinition().with("cellRenderer", "fancy"),
                "cellRenderer").getName());
        assertEquals(CheckboxRenderer.class, reader.read(new MapComponentDefinition()
                .with("cellRenderer", CheckboxRenderer.class), "cellRenderer").getNativeClass());
        assertSame(fn, reader.read(new MapComponentDefinition().with("cellRenderer", fn),
                "cellRenderer").getNativeFunction());
        assertSame(frameworkRef, reader.read(new MapComponentDefinition()
                .with("cellRendererFramework", frameworkRef), "cellRenderer").getFrameworkComponent());
    }

    @Test
    @DisplayName("应读取选择器")
    void shouldReadSelector() {
        ComponentSelector selector = params -> SelectorResult.of("fancy");

        ComponentSpecification spec = reader.read(new MapComponentDefinition()
                .with("cellRendererSelector", selector), "cellRenderer");

        assertSame(selector, spec.getSelector());
        assertFalse(spec.hasHardcoded());
    }

    @Test
    @DisplayName("不支持的取值应报错")
    void unsupportedValueShouldFail() {
        InvalidArgumentException ex = assertThrows(InvalidArgumentException.class,
                () -> reader.read(new MapComponentDefinition().with("cellRenderer", new CheckboxRenderer()),
                        "cellRenderer"));
        assertEquals("cellRenderer", ex.getParamName());

        assertThrows(InvalidArgumentException.class,
                () -> reader.read(new MapComponentDefinition().with("cellRenderer", String.class), "cellRenderer"));
    }

    @Test
    @DisplayName("选择器类型错误时异常携带所属扩展点")
    void invalidSelectorShouldNameExtensionPoint() {
        InvalidArgumentException ex = assertThrows(InvalidArgumentException.class,
                () -> reader.read(new MapComponentDefinition().with("cellRendererSelector", "fancy"),
                        "cellRenderer"));

        assertEquals("cellRenderer", ex.getPropertyName());
        assertEquals("cellRendererSelector", ex.getParamName());
        assertEquals("fancy", ex.getInvalidValue());
    }
}
