package com.slotframe.core.config;

import com.slotframe.core.metadata.ComponentMetadataProvider;
import lombok.Builder;
import lombok.Getter;

/**
 * 运行时配置
 */
@Getter
@Builder
public class SlotFrameConfig {

    /**
     * 最终参数中环境 API 句柄的键名
     */
    @Builder.Default
    private String apiParamKey = "api";

    /**
     * 扩展点元数据资源
     */
    @Builder.Default
    private String metadataResource = ComponentMetadataProvider.DEFAULT_RESOURCE;

    /**
     * 全局定义资源 (options / components / frameworkComponents)
     */
    @Builder.Default
    private String definitionResource = "slotframe.yml";

    /**
     * 开发模式：输出每次解析的决策日志
     */
    @Builder.Default
    private boolean devMode = false;

    public static SlotFrameConfig defaults() {
        return SlotFrameConfig.builder().build();
    }

    public static SlotFrameConfig development() {
        return SlotFrameConfig.builder()
                .devMode(true)
                .build();
    }

    @Override
    public String toString() {
        return String.format("SlotFrameConfig{apiParamKey=%s, definition=%s, devMode=%s}",
                apiParamKey, definitionResource, devMode);
    }
}
