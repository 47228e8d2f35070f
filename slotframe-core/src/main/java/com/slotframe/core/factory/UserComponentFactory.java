package com.slotframe.core.factory;

import com.slotframe.api.component.InitParamsCustomizer;
import com.slotframe.api.component.UserComponent;
import com.slotframe.api.config.ComponentDefinition;
import com.slotframe.api.exception.ComponentNotFoundException;
import com.slotframe.core.context.ComponentContext;
import com.slotframe.core.exception.ComponentCreationException;
import com.slotframe.core.params.ComponentParamsMerger;
import com.slotframe.core.resolver.ComponentClassDef;
import com.slotframe.core.resolver.ComponentResolver;
import com.slotframe.core.wiring.ComponentWirer;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 用户组件工厂
 * <p>
 * 流程：解析 -> 合并参数 -> 实例化 -> 注入协作者 -> 初始化。
 * 所有校验失败都在调用线程同步抛出，只有初始化结果通过 Future 传递。
 */
@Slf4j
public class UserComponentFactory {

    private final ComponentContext context;
    private final ComponentResolver resolver;
    private final ComponentParamsMerger paramsMerger;
    private final ComponentInstantiator instantiator;
    private final ComponentInitializer initializer;

    public UserComponentFactory(ComponentContext context) {
        this(context,
                new ComponentResolver(context),
                new ComponentParamsMerger(context),
                new ComponentInstantiator(context),
                new ComponentInitializer(new ComponentWirer(context.getCollaborators())));
    }

    public UserComponentFactory(ComponentContext context,
                                ComponentResolver resolver,
                                ComponentParamsMerger paramsMerger,
                                ComponentInstantiator instantiator,
                                ComponentInitializer initializer) {
        this.context = context;
        this.resolver = resolver;
        this.paramsMerger = paramsMerger;
        this.instantiator = instantiator;
        this.initializer = initializer;
    }

    public ComponentContext getContext() {
        return context;
    }

    @Nullable
    public <T extends UserComponent> CompletableFuture<T> createUserComponent(@Nullable ComponentDefinition definition,
                                                                              @Nullable Map<String, Object> paramsFromHost,
                                                                              String propertyName) {
        return createUserComponent(definition, paramsFromHost, propertyName, null, true, null);
    }

    @Nullable
    public <T extends UserComponent> CompletableFuture<T> createUserComponent(@Nullable ComponentDefinition definition,
                                                                              @Nullable Map<String, Object> paramsFromHost,
                                                                              String propertyName,
                                                                              @Nullable String defaultComponentName) {
        return createUserComponent(definition, paramsFromHost, propertyName, defaultComponentName, true, null);
    }

    @Nullable
    public <T extends UserComponent> CompletableFuture<T> createUserComponent(@Nullable ComponentDefinition definition,
                                                                              @Nullable Map<String, Object> paramsFromHost,
                                                                              String propertyName,
                                                                              @Nullable String defaultComponentName,
                                                                              boolean mandatory) {
        return createUserComponent(definition, paramsFromHost, propertyName, defaultComponentName, mandatory, null);
    }

    /**
     * 解析并创建组件
     *
     * @param definition           定义持有者（全局选项、列定义等），为 null 时使用全局定义
     * @param paramsFromHost       宿主传给组件的参数，会与定义中的参数合并
     * @param propertyName         扩展点名称，如 cellRenderer、floatingFilterComponent
     * @param defaultComponentName 未指定组件时使用的注册名称
     * @param mandatory            为 true 时找不到组件抛出 {@link ComponentNotFoundException}，否则返回 null
     * @param customizer           在 init 前定制参数的回调
     * @return 组件就绪时完成的 Future；非必需且找不到组件时为 null
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public <T extends UserComponent> CompletableFuture<T> createUserComponent(@Nullable ComponentDefinition definition,
                                                                              @Nullable Map<String, Object> paramsFromHost,
                                                                              String propertyName,
                                                                              @Nullable String defaultComponentName,
                                                                              boolean mandatory,
                                                                              @Nullable InitParamsCustomizer<T> customizer) {
        ComponentDefinition holder = definition != null ? definition : context.getDefaultDefinition();

        ComponentClassDef classDef = resolver.resolve(holder, propertyName, paramsFromHost, defaultComponentName);
        if (classDef == null) {
            if (mandatory) {
                log.error("Error creating component {}=>{}", propertyName, defaultComponentName);
                throw new ComponentNotFoundException(propertyName, defaultComponentName);
            }
            log.debug("No optional component resolved for {}", propertyName);
            return null;
        }

        Map<String, Object> finalParams = paramsMerger.merge(holder, propertyName, paramsFromHost,
                classDef.getParamsFromSelector());

        T component = (T) instantiator.create(classDef, propertyName, defaultComponentName);
        return initializer.initialise(component, finalParams, customizer);
    }

    public <T extends UserComponent> T createUserComponentFromConcreteClass(Class<T> componentClass,
                                                                            Map<String, Object> params) {
        return createUserComponentFromConcreteClass(componentClass, params, null);
    }

    /**
     * 已知具体实现时的同步捷径：构造、注入、初始化
     * <p>
     * 参数不做合并。延迟初始化只启动不等待；同步初始化失败直接抛出。
     */
    public <T extends UserComponent> T createUserComponentFromConcreteClass(Class<T> componentClass,
                                                                            Map<String, Object> params,
                                                                            @Nullable InitParamsCustomizer<T> customizer) {
        T component;
        try {
            component = componentClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new ComponentCreationException(componentClass.getName(),
                    "Failed to instantiate " + componentClass.getName(), e);
        }

        CompletableFuture<T> ready = initializer.initialise(component, params, customizer);
        if (ready.isCompletedExceptionally()) {
            try {
                ready.join();
            } catch (CompletionException e) {
                throw (RuntimeException) e.getCause();
            }
        }
        if (!ready.isDone()) {
            ready.whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("Deferred init of {} failed", componentClass.getName(), error);
                }
            });
        }
        return component;
    }

    /**
     * 仅解析，不创建实例
     */
    @Nullable
    public ComponentClassDef getComponentClassDef(@Nullable ComponentDefinition definition,
                                                  String propertyName,
                                                  @Nullable Map<String, Object> params,
                                                  @Nullable String defaultComponentName) {
        return resolver.resolve(definition, propertyName, params, defaultComponentName);
    }

    @Nullable
    public ComponentClassDef getComponentClassDef(@Nullable ComponentDefinition definition, String propertyName) {
        return getComponentClassDef(definition, propertyName, null, null);
    }

    /**
     * 计算某个扩展点的最终参数，不创建实例
     */
    public Map<String, Object> createFinalParams(@Nullable ComponentDefinition definition,
                                                 String propertyName,
                                                 @Nullable Map<String, Object> paramsFromHost,
                                                 @Nullable Map<String, Object> paramsFromSelector) {
        ComponentDefinition holder = definition != null ? definition : context.getDefaultDefinition();
        return paramsMerger.merge(holder, propertyName, paramsFromHost, paramsFromSelector);
    }

    public Map<String, Object> createFinalParams(@Nullable ComponentDefinition definition,
                                                 String propertyName,
                                                 @Nullable Map<String, Object> paramsFromHost) {
        return createFinalParams(definition, propertyName, paramsFromHost, null);
    }
}
