package com.slotframe.core.factory;

import com.slotframe.api.component.UserComponent;
import com.slotframe.core.context.ComponentContext;
import com.slotframe.core.exception.ComponentCreationException;
import com.slotframe.core.exception.MissingComponentMetadataException;
import com.slotframe.core.exception.MissingFrameworkWrapperException;
import com.slotframe.core.metadata.ComponentMetadata;
import com.slotframe.core.resolver.ComponentClassDef;
import com.slotframe.core.resolver.NativeComponentRef;
import com.slotframe.core.spi.FrameworkComponentWrapper;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

/**
 * 组件实例化：按 ComponentType 分派一次，原生直接构造，框架组件交给 Wrapper
 */
@Slf4j
public class ComponentInstantiator {

    private final ComponentContext context;

    public ComponentInstantiator(ComponentContext context) {
        this.context = context;
    }

    public UserComponent create(ComponentClassDef classDef, String propertyName,
                                @Nullable String defaultComponentName) {
        switch (classDef.getType()) {
            case NATIVE:
                return createNative(classDef.getNativeRef(), propertyName);
            case FRAMEWORK:
                return createFramework(classDef.getComponent(), propertyName,
                        defaultComponentName != null ? defaultComponentName : propertyName);
            default:
                throw new IllegalStateException("Unknown component type: " + classDef.getType());
        }
    }

    private UserComponent createNative(NativeComponentRef ref, String propertyName) {
        try {
            return ref.newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.error("[{}] Failed to instantiate {}", propertyName, ref, e);
            throw new ComponentCreationException(propertyName,
                    "Failed to instantiate " + ref + " for " + propertyName
                            + " (a public no-arg constructor is required)", e);
        }
    }

    private UserComponent createFramework(Object frameworkComponent, String propertyName, String debugName) {
        FrameworkComponentWrapper wrapper = context.getFrameworkComponentWrapper();
        if (wrapper == null) {
            throw new MissingFrameworkWrapperException(propertyName);
        }
        ComponentMetadata metadata = context.getMetadataProvider().retrieve(propertyName);
        if (metadata == null) {
            throw new MissingComponentMetadataException(propertyName);
        }
        return wrapper.wrap(frameworkComponent,
                metadata.getMandatoryMethods(),
                metadata.getOptionalMethods(),
                debugName);
    }
}
