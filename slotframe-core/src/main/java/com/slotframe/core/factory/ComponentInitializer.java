package com.slotframe.core.factory;

import com.slotframe.api.component.AsyncInitializable;
import com.slotframe.api.component.InitParamsCustomizer;
import com.slotframe.api.component.Initializable;
import com.slotframe.api.component.UserComponent;
import com.slotframe.core.exception.ComponentInitializationException;
import com.slotframe.core.wiring.ComponentWirer;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * 注入协作者并执行初始化协议
 * <p>
 * 同步 init 返回已完成的 Future（调用方不会挂起），
 * 延迟 init 在 Stage 完成时完成 Future；失败统一包装为 {@link ComponentInitializationException}。
 */
@Slf4j
public class ComponentInitializer {

    private final ComponentWirer wirer;

    public ComponentInitializer(ComponentWirer wirer) {
        this.wirer = wirer;
    }

    public <T extends UserComponent> CompletableFuture<T> initialise(T component,
                                                                     Map<String, Object> params,
                                                                     @Nullable InitParamsCustomizer<T> customizer) {
        wirer.wireBean(component);

        boolean async = component instanceof AsyncInitializable;
        if (!async && !(component instanceof Initializable)) {
            return CompletableFuture.completedFuture(component);
        }

        String componentClass = component.getClass().getName();
        try {
            Map<String, Object> initParams = customizer == null ? params : customizer.customize(params, component);
            if (!async) {
                ((Initializable) component).init(initParams);
                return CompletableFuture.completedFuture(component);
            }

            CompletionStage<Void> deferred = ((AsyncInitializable) component).initAsync(initParams);
            if (deferred == null) {
                return CompletableFuture.completedFuture(component);
            }
            CompletableFuture<T> ready = new CompletableFuture<>();
            deferred.whenComplete((ignored, error) -> {
                if (error == null) {
                    ready.complete(component);
                } else {
                    ready.completeExceptionally(wrap(componentClass, error));
                }
            });
            return ready;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            // 包括绕过编译检查抛出的受检异常和链接错误
            log.error("Component {} failed to initialise", componentClass, e);
            return CompletableFuture.failedFuture(wrap(componentClass, e));
        }
    }

    private static ComponentInitializationException wrap(String componentClass, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof ComponentInitializationException) {
            return (ComponentInitializationException) cause;
        }
        return new ComponentInitializationException(componentClass, cause);
    }
}
