package com.slotframe.core.spi;

import org.jspecify.annotations.Nullable;

/**
 * 共享协作者仓库 SPI
 */
public interface CollaboratorRegistry {

    /**
     * 按名称获取协作者
     */
    @Nullable
    Object getBean(String name);

    /**
     * 按类型获取协作者
     */
    @Nullable
    <T> T getBean(Class<T> type);
}
