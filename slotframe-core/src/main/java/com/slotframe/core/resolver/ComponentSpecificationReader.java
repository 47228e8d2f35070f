package com.slotframe.core.resolver;

import com.slotframe.api.component.ComponentFunction;
import com.slotframe.api.component.ComponentSelector;
import com.slotframe.api.component.UserComponent;
import com.slotframe.api.config.ComponentDefinition;
import com.slotframe.api.exception.InvalidArgumentException;
import org.jspecify.annotations.Nullable;

/**
 * 从定义持有者中读取并分类扩展点配置，不做冲突校验
 */
public class ComponentSpecificationReader {

    public ComponentSpecification read(@Nullable ComponentDefinition definition, String propertyName) {
        if (definition == null) {
            return ComponentSpecification.empty();
        }
        ComponentSpecification.ComponentSpecificationBuilder builder = ComponentSpecification.builder();

        Object value = definition.get(propertyName);
        if (Boolean.TRUE.equals(value)) {
            builder.useDefault(true);
        } else if (value != null && !(value instanceof Boolean)) {
            classify(builder, propertyName, value);
        }

        builder.frameworkComponent(definition.get(propertyName + ComponentDefinition.FRAMEWORK_SUFFIX));

        Object selector = definition.get(propertyName + ComponentDefinition.SELECTOR_SUFFIX);
        if (selector != null) {
            if (!(selector instanceof ComponentSelector)) {
                throw InvalidArgumentException.forProperty(propertyName,
                        propertyName + ComponentDefinition.SELECTOR_SUFFIX, selector,
                        "Selector for " + propertyName + " must be a ComponentSelector");
            }
            builder.selector((ComponentSelector) selector);
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private void classify(ComponentSpecification.ComponentSpecificationBuilder builder,
                          String propertyName, Object value) {
        if (value instanceof String) {
            String name = (String) value;
            if (!name.trim().isEmpty()) {
                builder.name(name);
            }
        } else if (value instanceof Class<?> && UserComponent.class.isAssignableFrom((Class<?>) value)) {
            builder.nativeClass((Class<? extends UserComponent>) value);
        } else if (value instanceof ComponentFunction) {
            builder.nativeFunction((ComponentFunction) value);
        } else {
            throw InvalidArgumentException.forProperty(propertyName, propertyName, value,
                    "Unsupported value for " + propertyName
                            + ": expected a component name, a UserComponent class or a ComponentFunction");
        }
    }
}
