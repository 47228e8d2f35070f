package com.slotframe.core.resolver;

import com.slotframe.api.component.UserComponent;
import lombok.EqualsAndHashCode;

@EqualsAndHashCode
public class ClassComponentRef implements NativeComponentRef {

    private final Class<? extends UserComponent> componentClass;

    public ClassComponentRef(Class<? extends UserComponent> componentClass) {
        this.componentClass = componentClass;
    }

    @Override
    public Class<? extends UserComponent> getComponentClass() {
        return componentClass;
    }

    @Override
    public UserComponent newInstance() throws ReflectiveOperationException {
        return componentClass.getDeclaredConstructor().newInstance();
    }

    @Override
    public String toString() {
        return componentClass.getName();
    }
}
