package com.slotframe.core.registry;

import com.slotframe.core.enums.ComponentType;
import com.slotframe.core.enums.RegistrationSource;
import lombok.Value;

/**
 * 注册表条目
 * <p>
 * component 为 NATIVE 时是 {@code Class<? extends UserComponent>} 或 ComponentFunction，
 * 为 FRAMEWORK 时是外部框架的组件引用。
 */
@Value
public class RegisteredComponent {
    String name;
    Object component;
    ComponentType type;
    RegistrationSource source;
}
