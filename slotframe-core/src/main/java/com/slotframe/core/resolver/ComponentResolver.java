package com.slotframe.core.resolver;

import com.slotframe.api.component.ComponentFunction;
import com.slotframe.api.component.SelectorResult;
import com.slotframe.api.component.UserComponent;
import com.slotframe.api.config.ComponentDefinition;
import com.slotframe.core.context.ComponentContext;
import com.slotframe.core.enums.ComponentSource;
import com.slotframe.core.enums.ComponentType;
import com.slotframe.core.exception.MissingFrameworkWrapperException;
import com.slotframe.core.registry.RegisteredComponent;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * 组件解析器
 * <p>
 * 只读 + 校验，无副作用。决定一个扩展点最终使用哪个实现：
 * <ol>
 * <li>硬编码的框架组件 ({@code P + "Framework"})</li>
 * <li>硬编码的原生组件类</li>
 * <li>硬编码的函数，包装为 {@link com.slotframe.api.component.FunctionComponent}</li>
 * <li>注册表查找，名称依次取：选择器结果、硬编码名称、默认名称</li>
 * </ol>
 * 注册表中找不到时返回 null，是否报错由调用方根据 mandatory 决定。
 */
@Slf4j
public class ComponentResolver {

    private final ComponentContext context;
    private final ComponentSpecificationReader reader;
    private final ComponentSpecificationValidator validator;
    private final ComponentSelectorInvoker selectorInvoker;

    public ComponentResolver(ComponentContext context) {
        this(context, new ComponentSpecificationReader(), new ComponentSpecificationValidator(),
                new ComponentSelectorInvoker());
    }

    public ComponentResolver(ComponentContext context,
                             ComponentSpecificationReader reader,
                             ComponentSpecificationValidator validator,
                             ComponentSelectorInvoker selectorInvoker) {
        this.context = context;
        this.reader = reader;
        this.validator = validator;
        this.selectorInvoker = selectorInvoker;
    }

    /**
     * @param definition           定义持有者，为 null 时使用全局定义
     * @param propertyName         扩展点名称
     * @param params               解析参数，仅用于调用选择器
     * @param defaultComponentName 未指定组件时使用的注册名称
     */
    @Nullable
    public ComponentClassDef resolve(@Nullable ComponentDefinition definition,
                                     String propertyName,
                                     @Nullable Map<String, Object> params,
                                     @Nullable String defaultComponentName) {
        ComponentDefinition holder = definition != null ? definition : context.getDefaultDefinition();

        ComponentSpecification spec = reader.read(holder, propertyName);
        validator.validate(spec, propertyName, context.hasFrameworkWrapper());

        if (spec.getFrameworkComponent() != null) {
            return hardcoded(propertyName, spec.getFrameworkComponent(), ComponentType.FRAMEWORK);
        }
        if (spec.getNativeClass() != null) {
            return hardcoded(propertyName, new ClassComponentRef(spec.getNativeClass()), ComponentType.NATIVE);
        }
        if (spec.getNativeFunction() != null) {
            return hardcoded(propertyName, new FunctionComponentRef(spec.getNativeFunction()), ComponentType.NATIVE);
        }

        SelectorResult selectorResult = selectorInvoker.invoke(spec.getSelector(), params);

        String componentName;
        if (selectorResult != null && hasText(selectorResult.getComponent())) {
            componentName = selectorResult.getComponent();
        } else if (spec.getName() != null) {
            componentName = spec.getName();
        } else {
            componentName = defaultComponentName;
        }

        if (!hasText(componentName)) {
            log.debug("No component name resolved for {}", propertyName);
            return null;
        }

        RegisteredComponent registered = context.getRegistry().retrieve(componentName);
        if (registered == null) {
            log.debug("Component {} for {} is not registered", componentName, propertyName);
            return null;
        }

        Map<String, Object> paramsFromSelector = selectorResult != null ? selectorResult.getParams() : null;
        ComponentClassDef classDef = fromRegistered(propertyName, registered, paramsFromSelector);
        if (context.getConfig().isDevMode()) {
            log.info("Resolved {} => {} ({}, {})", propertyName, componentName, classDef.getType(), classDef.getSource());
        }
        return classDef;
    }

    @SuppressWarnings("unchecked")
    private ComponentClassDef fromRegistered(String propertyName, RegisteredComponent registered,
                                             @Nullable Map<String, Object> paramsFromSelector) {
        if (registered.getType() == ComponentType.FRAMEWORK) {
            // 框架组件必须按名称注册
            if (!context.hasFrameworkWrapper()) {
                log.error("Registered framework component {} needs a FrameworkComponentWrapper", registered.getName());
                throw new MissingFrameworkWrapperException(propertyName);
            }
            return ComponentClassDef.builder()
                    .component(registered.getComponent())
                    .type(ComponentType.FRAMEWORK)
                    .source(ComponentSource.REGISTERED_BY_NAME)
                    .paramsFromSelector(paramsFromSelector)
                    .build();
        }

        Object component = registered.getComponent();
        NativeComponentRef ref = component instanceof ComponentFunction
                ? new FunctionComponentRef((ComponentFunction) component)
                : new ClassComponentRef((Class<? extends UserComponent>) component);

        return ComponentClassDef.builder()
                .component(ref)
                .type(ComponentType.NATIVE)
                .source(registered.getSource().toComponentSource())
                .paramsFromSelector(paramsFromSelector)
                .build();
    }

    private ComponentClassDef hardcoded(String propertyName, Object component, ComponentType type) {
        log.debug("Using hardcoded {} component for {}: {}", type, propertyName, component);
        return ComponentClassDef.builder()
                .component(component)
                .type(type)
                .source(ComponentSource.HARDCODED)
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
