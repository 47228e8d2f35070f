package com.slotframe.starter.configuration;

import com.slotframe.api.config.MapComponentDefinition;
import com.slotframe.core.config.SlotFrameConfig;
import com.slotframe.core.context.ComponentContext;
import com.slotframe.core.factory.UserComponentFactory;
import com.slotframe.core.loader.DefinitionLoader;
import com.slotframe.core.metadata.ComponentMetadataProvider;
import com.slotframe.core.registry.UserComponentRegistry;
import com.slotframe.core.spi.CollaboratorRegistry;
import com.slotframe.core.spi.DefaultComponentProvider;
import com.slotframe.core.spi.FrameworkComponentWrapper;
import com.slotframe.starter.adapter.SpringCollaboratorRegistry;
import com.slotframe.starter.config.SlotFrameProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(SlotFrameProperties.class)
@ConditionalOnProperty(prefix = "slotframe", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SlotFrameAutoConfiguration {

    // 1. 注册表：所有 DefaultComponentProvider Bean 按顺序播种内置组件
    @Bean
    @ConditionalOnMissingBean
    public UserComponentRegistry userComponentRegistry(ObjectProvider<DefaultComponentProvider> providers) {
        UserComponentRegistry registry = new UserComponentRegistry();
        providers.orderedStream().forEach(provider -> provider.registerDefaults(registry));
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ComponentMetadataProvider componentMetadataProvider(SlotFrameProperties properties,
                                                               ApplicationContext applicationContext) {
        return ComponentMetadataProvider.fromClasspath(properties.getMetadataResource(),
                applicationContext.getClassLoader());
    }

    // 2. 协作者直接取自 Spring 容器
    @Bean
    @ConditionalOnMissingBean
    public CollaboratorRegistry collaboratorRegistry(ApplicationContext applicationContext) {
        return new SpringCollaboratorRegistry(applicationContext);
    }

    @Bean
    @ConditionalOnMissingBean
    public ComponentContext componentContext(SlotFrameProperties properties,
                                             UserComponentRegistry registry,
                                             ComponentMetadataProvider metadataProvider,
                                             CollaboratorRegistry collaboratorRegistry,
                                             ObjectProvider<FrameworkComponentWrapper> frameworkComponentWrapper,
                                             ApplicationContext applicationContext) {
        SlotFrameConfig config = SlotFrameConfig.builder()
                .apiParamKey(properties.getApiParamKey())
                .definitionResource(properties.getDefinitionResource())
                .metadataResource(properties.getMetadataResource())
                .devMode(properties.isDevMode())
                .build();

        MapComponentDefinition globalDefinition = new DefinitionLoader(registry, applicationContext.getClassLoader())
                .loadResource(config.getDefinitionResource());

        Object api = properties.getApiBeanName() != null
                ? applicationContext.getBean(properties.getApiBeanName())
                : null;

        FrameworkComponentWrapper wrapper = frameworkComponentWrapper.getIfAvailable();
        log.info("SlotFrame context ready: {} components, framework wrapper: {}",
                registry.getRegisteredNames().size(), wrapper != null ? wrapper.getClass().getName() : "none");

        return ComponentContext.builder()
                .registry(registry)
                .metadataProvider(metadataProvider)
                .collaborators(collaboratorRegistry)
                .defaultDefinition(globalDefinition)
                .api(api)
                .frameworkComponentWrapper(wrapper)
                .config(config)
                .build();
    }

    // 3. 对外入口
    @Bean
    @ConditionalOnMissingBean
    public UserComponentFactory userComponentFactory(ComponentContext componentContext) {
        return new UserComponentFactory(componentContext);
    }
}
