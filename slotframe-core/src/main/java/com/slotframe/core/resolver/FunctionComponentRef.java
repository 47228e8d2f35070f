package com.slotframe.core.resolver;

import com.slotframe.api.component.ComponentFunction;
import com.slotframe.api.component.FunctionComponent;
import com.slotframe.api.component.UserComponent;
import lombok.EqualsAndHashCode;

/**
 * 函数形式的原生组件，每次实例化都合成一个新的 {@link FunctionComponent}
 */
@EqualsAndHashCode
public class FunctionComponentRef implements NativeComponentRef {

    private final ComponentFunction function;

    public FunctionComponentRef(ComponentFunction function) {
        this.function = function;
    }

    public ComponentFunction getFunction() {
        return function;
    }

    @Override
    public Class<? extends UserComponent> getComponentClass() {
        return FunctionComponent.class;
    }

    @Override
    public UserComponent newInstance() {
        return new FunctionComponent(function);
    }

    @Override
    public String toString() {
        return "FunctionComponent(" + function + ")";
    }
}
