package com.slotframe.runtime;

import com.slotframe.api.config.MapComponentDefinition;
import com.slotframe.api.exception.InvalidArgumentException;
import com.slotframe.core.config.SlotFrameConfig;
import com.slotframe.core.context.ComponentContext;
import com.slotframe.core.factory.UserComponentFactory;
import com.slotframe.core.loader.DefinitionLoader;
import com.slotframe.core.metadata.ComponentMetadataProvider;
import com.slotframe.core.registry.UserComponentRegistry;
import com.slotframe.core.spi.CollaboratorRegistry;
import com.slotframe.core.spi.DefaultComponentProvider;
import com.slotframe.core.spi.FrameworkComponentWrapper;
import com.slotframe.core.wiring.DefaultCollaboratorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * SlotFrame Native 启动器
 * <p>
 * 不依赖 Spring，通过 ServiceLoader 发现 SPI：
 * 1. {@link DefaultComponentProvider} 播种内置组件
 * 2. {@link FrameworkComponentWrapper} 至多一个
 * 每次 start 都返回绑定到全新上下文的工厂，不持有全局状态。
 */
@Slf4j
public final class NativeSlotFrame {

    private NativeSlotFrame() {
    }

    /**
     * 启动 SlotFrame (使用默认配置)
     */
    public static UserComponentFactory start() {
        return start(SlotFrameConfig.defaults());
    }

    public static UserComponentFactory start(SlotFrameConfig config) {
        return start(config, null, new DefaultCollaboratorRegistry());
    }

    public static UserComponentFactory start(SlotFrameConfig config, @Nullable Object api) {
        return start(config, api, new DefaultCollaboratorRegistry());
    }

    /**
     * 启动 SlotFrame (自定义配置)
     *
     * @param config        运行时配置
     * @param api           注入每个组件参数的环境 API 句柄
     * @param collaborators 组件注入使用的协作者仓库
     */
    public static UserComponentFactory start(SlotFrameConfig config,
                                             @Nullable Object api,
                                             CollaboratorRegistry collaborators) {
        long start = System.currentTimeMillis();
        log.info("Starting SlotFrame Native Runtime...");
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader() != null
                ? Thread.currentThread().getContextClassLoader()
                : NativeSlotFrame.class.getClassLoader();

        // 内置组件先于用户定义播种，用户定义才能显式覆盖
        UserComponentRegistry registry = new UserComponentRegistry();
        int providers = 0;
        for (DefaultComponentProvider provider : ServiceLoader.load(DefaultComponentProvider.class, classLoader)) {
            provider.registerDefaults(registry);
            providers++;
        }

        ComponentMetadataProvider metadataProvider =
                ComponentMetadataProvider.fromClasspath(config.getMetadataResource(), classLoader);

        MapComponentDefinition globalDefinition =
                new DefinitionLoader(registry, classLoader).loadResource(config.getDefinitionResource());

        FrameworkComponentWrapper wrapper = discoverWrapper(classLoader);

        ComponentContext context = ComponentContext.builder()
                .registry(registry)
                .metadataProvider(metadataProvider)
                .collaborators(collaborators)
                .defaultDefinition(globalDefinition)
                .api(api)
                .frameworkComponentWrapper(wrapper)
                .config(config)
                .build();

        log.info("SlotFrame Native started in {} ms ({} default providers, {} components, framework wrapper: {})",
                System.currentTimeMillis() - start, providers, registry.getRegisteredNames().size(),
                wrapper != null ? wrapper.getClass().getName() : "none");
        return new UserComponentFactory(context);
    }

    @Nullable
    private static FrameworkComponentWrapper discoverWrapper(ClassLoader classLoader) {
        List<FrameworkComponentWrapper> wrappers = new ArrayList<>();
        ServiceLoader.load(FrameworkComponentWrapper.class, classLoader).forEach(wrappers::add);
        if (wrappers.size() > 1) {
            log.error("Found {} FrameworkComponentWrapper implementations, expected at most one", wrappers.size());
            throw new InvalidArgumentException("frameworkComponentWrapper",
                    "Only one FrameworkComponentWrapper may be installed, found " + wrappers.size());
        }
        return wrappers.isEmpty() ? null : wrappers.get(0);
    }
}
