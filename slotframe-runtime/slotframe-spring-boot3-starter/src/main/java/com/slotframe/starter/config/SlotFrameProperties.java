package com.slotframe.starter.config;

import com.slotframe.core.metadata.ComponentMetadataProvider;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * SlotFrame 配置属性
 * <p>
 * 示例：
 *
 * <pre>
 * slotframe:
 *   dev-mode: true
 *   api-bean-name: gridApi
 *   definition-resource: grid/slotframe.yml
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "slotframe")
public class SlotFrameProperties {

    /**
     * 是否启用 SlotFrame。
     */
    private boolean enabled = true;

    /**
     * 开发模式开关，开启后输出每次解析的决策日志。
     */
    private boolean devMode = false;

    /**
     * 最终参数中环境 API 句柄的键名。
     */
    private String apiParamKey = "api";

    /**
     * 作为环境 API 句柄注入组件参数的 Bean 名称，不配置则不注入。
     */
    private String apiBeanName;

    /**
     * 全局定义资源 (options / components / frameworkComponents)。
     */
    private String definitionResource = "slotframe.yml";

    /**
     * 扩展点元数据资源。
     */
    private String metadataResource = ComponentMetadataProvider.DEFAULT_RESOURCE;
}
