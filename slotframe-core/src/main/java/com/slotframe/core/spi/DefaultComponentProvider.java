package com.slotframe.core.spi;

import com.slotframe.core.registry.UserComponentRegistry;

/**
 * 内置组件提供者 SPI
 * 启动时调用，通过 {@link UserComponentRegistry#registerDefault} 播种内置组件。
 */
public interface DefaultComponentProvider {

    void registerDefaults(UserComponentRegistry registry);
}
