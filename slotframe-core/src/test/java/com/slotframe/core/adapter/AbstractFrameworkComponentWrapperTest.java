package com.slotframe.core.adapter;

import com.slotframe.api.component.AsyncInitializable;
import com.slotframe.api.component.UserComponent;
import com.slotframe.api.exception.InvalidArgumentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AbstractFrameworkComponentWrapper 单元测试")
class AbstractFrameworkComponentWrapperTest {

    /**
     * 宿主侧的过滤器契约
     */
    public interface HostFilter {
        boolean isFilterActive();

        boolean doesFilterPass(Object row);

        void afterGuiAttached();

        int getPriority();

        default String describe() {
            return "filter";
        }

        void notInContract();
    }

    /**
     * 模拟外部框架组件：只实现必选方法
     */
    public static class ExternalFilter {
        final List<String> events = new ArrayList<>();

        public boolean isFilterActive() {
            return true;
        }

        public boolean doesFilterPass(Object row) {
            return "keep".equals(row);
        }
    }

    static class TestDelegate extends ReflectiveFrameworkDelegate {
        TestDelegate(Object target) {
            super(target);
        }

        @Override
        public CompletionStage<Void> mount(Map<String, Object> params) {
            ((ExternalFilter) getTarget()).events.add("mount:" + params.get("id"));
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void unmount() {
            ((ExternalFilter) getTarget()).events.add("unmount");
        }
    }

    static class TestWrapper extends AbstractFrameworkComponentWrapper {
        TestWrapper() {
            super(HostFilter.class);
        }

        @Override
        protected FrameworkDelegate createDelegate(Object frameworkComponent, String debugName) {
            return new TestDelegate(frameworkComponent);
        }
    }

    private final Set<String> mandatory = Set.of("isFilterActive", "doesFilterPass");
    private final Set<String> optional = Set.of("afterGuiAttached", "getPriority");

    private TestWrapper wrapper;
    private ExternalFilter external;

    @BeforeEach
    void setUp() {
        wrapper = new TestWrapper();
        external = new ExternalFilter();
    }

    @Nested
    @DisplayName("包装")
    class WrapTests {

        @Test
        @DisplayName("代理实现宿主契约与初始化接口")
        void proxyShouldImplementContracts() {
            UserComponent component = wrapper.wrap(external, mandatory, optional, "filter");

            assertTrue(Proxy.isProxyClass(component.getClass()));
            assertInstanceOf(HostFilter.class, component);
            assertInstanceOf(AsyncInitializable.class, component);
            assertEquals("FrameworkComponent[filter]", component.toString());
        }

        @Test
        @DisplayName("缺少必选方法应报错")
        void missingMandatoryMethodShouldFail() {
            InvalidArgumentException ex = assertThrows(InvalidArgumentException.class,
                    () -> wrapper.wrap(external, Set.of("getModel"), optional, "filter"));
            assertEquals("filter", ex.getParamName());
        }

        @Test
        @DisplayName("额外类型必须是接口")
        void extraTypeMustBeInterface() {
            assertThrows(InvalidArgumentException.class, () -> new AbstractFrameworkComponentWrapper(String.class) {
                @Override
                protected FrameworkDelegate createDelegate(Object frameworkComponent, String debugName) {
                    return new TestDelegate(frameworkComponent);
                }
            });
        }
    }

    @Nested
    @DisplayName("方法转发")
    class ForwardingTests {

        @Test
        @DisplayName("必选方法转发给框架组件")
        void mandatoryMethodsShouldForward() {
            HostFilter filter = (HostFilter) wrapper.wrap(external, mandatory, optional, "filter");

            assertTrue(filter.isFilterActive());
            assertTrue(filter.doesFilterPass("keep"));
            assertFalse(filter.doesFilterPass("drop"));
        }

        @Test
        @DisplayName("未实现的可选方法返回默认值")
        void missingOptionalShouldReturnDefault() {
            HostFilter filter = (HostFilter) wrapper.wrap(external, mandatory, optional, "filter");

            assertDoesNotThrow(filter::afterGuiAttached);
            assertEquals(0, filter.getPriority());
        }

        @Test
        @DisplayName("默认方法走接口实现，契约外方法不支持")
        void defaultAndUnknownMethods() {
            HostFilter filter = (HostFilter) wrapper.wrap(external, mandatory, optional, "filter");

            assertEquals("filter", filter.describe());
            assertThrows(UnsupportedOperationException.class, filter::notInContract);
        }

        @Test
        @DisplayName("initAsync 对应 mount，destroy 对应 unmount")
        void lifecycleShouldMapToMountAndUnmount() {
            UserComponent component = wrapper.wrap(external, mandatory, optional, "filter");

            CompletionStage<Void> mounted = ((AsyncInitializable) component).initAsync(Map.of("id", 7));
            component.destroy();

            assertTrue(mounted.toCompletableFuture().isDone());
            assertEquals(List.of("mount:7", "unmount"), external.events);
        }
    }
}
