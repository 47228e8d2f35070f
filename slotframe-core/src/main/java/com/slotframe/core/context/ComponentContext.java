package com.slotframe.core.context;

import com.slotframe.api.config.ComponentDefinition;
import com.slotframe.api.config.MapComponentDefinition;
import com.slotframe.core.config.SlotFrameConfig;
import com.slotframe.core.metadata.ComponentMetadataProvider;
import com.slotframe.core.registry.UserComponentRegistry;
import com.slotframe.core.spi.CollaboratorRegistry;
import com.slotframe.core.spi.FrameworkComponentWrapper;
import com.slotframe.core.wiring.DefaultCollaboratorRegistry;
import lombok.Builder;
import lombok.Getter;
import org.jspecify.annotations.Nullable;

/**
 * 组件上下文
 * <p>
 * 启动时构造一次，显式传给每个需要查找的子系统，替代全局可变状态。
 */
@Getter
@Builder
public class ComponentContext {

    @Builder.Default
    private final UserComponentRegistry registry = new UserComponentRegistry();

    @Builder.Default
    private final ComponentMetadataProvider metadataProvider = new ComponentMetadataProvider();

    @Builder.Default
    private final CollaboratorRegistry collaborators = new DefaultCollaboratorRegistry();

    /**
     * 定义持有者缺省时使用的全局定义
     */
    @Builder.Default
    private final ComponentDefinition defaultDefinition = new MapComponentDefinition();

    /**
     * 注入最终参数的环境 API 句柄
     */
    @Nullable
    private final Object api;

    @Nullable
    private final FrameworkComponentWrapper frameworkComponentWrapper;

    @Builder.Default
    private final SlotFrameConfig config = SlotFrameConfig.defaults();

    public boolean hasFrameworkWrapper() {
        return frameworkComponentWrapper != null;
    }
}
