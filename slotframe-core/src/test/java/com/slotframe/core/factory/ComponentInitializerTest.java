package com.slotframe.core.factory;

import com.slotframe.api.component.AsyncInitializable;
import com.slotframe.api.component.Initializable;
import com.slotframe.api.component.UserComponent;
import com.slotframe.core.exception.ComponentInitializationException;
import com.slotframe.core.wiring.ComponentWirer;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ComponentInitializer 单元测试")
class ComponentInitializerTest {

    static class PlainComponent implements UserComponent {
    }

    static class SyncComponent implements UserComponent, Initializable {
        Map<String, Object> received;

        @Override
        public void init(Map<String, Object> params) {
            received = params;
        }
    }

    static class FailingComponent implements UserComponent, Initializable {
        @Override
        public void init(Map<String, Object> params) {
            throw new IllegalArgumentException("bad params");
        }
    }

    static class TemplateComponent implements UserComponent, Initializable {
        @Override
        @SneakyThrows
        public void init(Map<String, Object> params) {
            throw new IOException("template missing");
        }
    }

    static class UnlinkedComponent implements UserComponent, AsyncInitializable {
        @Override
        public CompletionStage<Void> initAsync(Map<String, Object> params) {
            throw new NoClassDefFoundError("com/example/Missing");
        }
    }

    static class DeferredComponent implements UserComponent, AsyncInitializable {
        final CompletableFuture<Void> mounted = new CompletableFuture<>();

        @Override
        public CompletionStage<Void> initAsync(Map<String, Object> params) {
            return mounted;
        }
    }

    /**
     * 同时实现两种初始化时只走异步入口
     */
    static class DualComponent implements UserComponent, Initializable, AsyncInitializable {
        boolean syncCalled;
        boolean asyncCalled;

        @Override
        public void init(Map<String, Object> params) {
            syncCalled = true;
        }

        @Override
        public CompletionStage<Void> initAsync(Map<String, Object> params) {
            asyncCalled = true;
            return null;
        }
    }

    @Mock
    private ComponentWirer wirer;

    private ComponentInitializer initializer;

    @BeforeEach
    void setUp() {
        initializer = new ComponentInitializer(wirer);
    }

    @Nested
    @DisplayName("同步初始化")
    class SyncTests {

        @Test
        @DisplayName("无初始化能力时立即完成，且不调用定制回调")
        void plainComponentCompletesImmediately() {
            PlainComponent component = new PlainComponent();

            CompletableFuture<PlainComponent> ready = initializer.initialise(component, Map.of(),
                    (params, c) -> fail("customizer must not run"));

            assertTrue(ready.isDone());
            assertSame(component, ready.join());
            verify(wirer).wireBean(component);
        }

        @Test
        @DisplayName("先注入后 init，Future 已完成")
        void shouldWireBeforeInit() {
            SyncComponent component = spy(new SyncComponent());

            CompletableFuture<SyncComponent> ready = initializer.initialise(component, Map.of("a", 1), null);

            assertTrue(ready.isDone());
            InOrder order = inOrder(wirer, component);
            order.verify(wirer).wireBean(component);
            order.verify(component).init(Map.of("a", 1));
        }

        @Test
        @DisplayName("定制回调的返回值作为 init 参数")
        void customizerResultReachesInit() {
            SyncComponent component = new SyncComponent();
            Map<String, Object> merged = Map.of("a", 1);

            initializer.initialise(component, merged, (params, c) -> {
                assertSame(merged, params);
                assertSame(component, c);
                return Map.of("custom", true);
            });

            assertEquals(Map.of("custom", true), component.received);
        }

        @Test
        @DisplayName("init 抛出的异常以失败的 Future 返回")
        void initFailureShouldFailFuture() {
            CompletableFuture<FailingComponent> ready = initializer.initialise(new FailingComponent(), Map.of(), null);

            assertTrue(ready.isCompletedExceptionally());
            ExecutionException ex = assertThrows(ExecutionException.class, ready::get);
            assertInstanceOf(ComponentInitializationException.class, ex.getCause());
            assertInstanceOf(IllegalArgumentException.class, ex.getCause().getCause());
        }

        @Test
        @DisplayName("init 抛出受检异常时同样以失败的 Future 返回")
        void checkedFailureShouldFailFuture() {
            CompletableFuture<TemplateComponent> ready = initializer.initialise(new TemplateComponent(), Map.of(), null);

            assertTrue(ready.isCompletedExceptionally());
            ExecutionException ex = assertThrows(ExecutionException.class, ready::get);
            assertInstanceOf(ComponentInitializationException.class, ex.getCause());
            assertInstanceOf(IOException.class, ex.getCause().getCause());
        }

        @Test
        @DisplayName("initAsync 抛出 Error 时以失败的 Future 返回")
        void linkageErrorShouldFailFuture() {
            CompletableFuture<UnlinkedComponent> ready = initializer.initialise(new UnlinkedComponent(), Map.of(), null);

            ExecutionException ex = assertThrows(ExecutionException.class, ready::get);
            assertInstanceOf(ComponentInitializationException.class, ex.getCause());
            assertInstanceOf(NoClassDefFoundError.class, ex.getCause().getCause());
        }

        @Test
        @DisplayName("注入失败同步抛出")
        void wiringFailureShouldThrow() {
            doThrow(new IllegalStateException("wiring")).when(wirer).wireBean(any());

            assertThrows(IllegalStateException.class,
                    () -> initializer.initialise(new SyncComponent(), Map.of(), null));
        }
    }

    @Nested
    @DisplayName("延迟初始化")
    class DeferredTests {

        @Test
        @DisplayName("Stage 完成前 Future 不完成")
        void shouldCompleteWhenStageCompletes() {
            DeferredComponent component = new DeferredComponent();

            CompletableFuture<DeferredComponent> ready = initializer.initialise(component, Map.of(), null);
            assertFalse(ready.isDone());

            CompletableFuture.runAsync(() -> component.mounted.complete(null),
                    CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS));

            await().atMost(Duration.ofSeconds(2)).until(ready::isDone);
            assertSame(component, ready.join());
        }

        @Test
        @DisplayName("Stage 失败时 Future 以 ComponentInitializationException 失败")
        void stageFailureShouldBeWrapped() {
            DeferredComponent component = new DeferredComponent();
            CompletableFuture<DeferredComponent> ready = initializer.initialise(component, Map.of(), null);

            component.mounted.completeExceptionally(new IllegalStateException("mount failed"));

            ExecutionException ex = assertThrows(ExecutionException.class, ready::get);
            assertInstanceOf(ComponentInitializationException.class, ex.getCause());
            assertEquals("mount failed", ex.getCause().getCause().getMessage());
        }

        @Test
        @DisplayName("异步入口优先，null Stage 视为已完成")
        void asyncEntryShouldWin() {
            DualComponent component = new DualComponent();

            CompletableFuture<DualComponent> ready = initializer.initialise(component, Map.of(), null);

            assertTrue(ready.isDone());
            assertTrue(component.asyncCalled);
            assertFalse(component.syncCalled);
        }
    }
}
