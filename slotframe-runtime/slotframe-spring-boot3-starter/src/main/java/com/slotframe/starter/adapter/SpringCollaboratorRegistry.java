package com.slotframe.starter.adapter;

import com.slotframe.core.spi.CollaboratorRegistry;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.ListableBeanFactory;

/**
 * 以 Spring 容器作为组件协作者来源
 */
public class SpringCollaboratorRegistry implements CollaboratorRegistry {

    private final ListableBeanFactory beanFactory;

    public SpringCollaboratorRegistry(ListableBeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    @Override
    @Nullable
    public Object getBean(String name) {
        return beanFactory.containsBean(name) ? beanFactory.getBean(name) : null;
    }

    @Override
    @Nullable
    public <T> T getBean(Class<T> type) {
        // 多个候选时返回 null，由 @Autowired 的 optional 决定是否报错
        return beanFactory.getBeanProvider(type).getIfUnique();
    }
}
