package com.slotframe.core.wiring;

import com.slotframe.api.exception.InvalidArgumentException;
import com.slotframe.core.spi.CollaboratorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于名称的协作者仓库
 * 按类型查找时要求唯一匹配。
 */
@Slf4j
public class DefaultCollaboratorRegistry implements CollaboratorRegistry {

    private final Map<String, Object> beans = new ConcurrentHashMap<>();

    public DefaultCollaboratorRegistry register(String name, Object bean) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidArgumentException("name", "Collaborator name cannot be blank");
        }
        if (bean == null) {
            throw new InvalidArgumentException("bean", "Collaborator cannot be null: " + name);
        }
        Object old = beans.put(name, bean);
        if (old != null) {
            log.warn("Collaborator {} replaced: {} -> {}", name, old.getClass().getName(), bean.getClass().getName());
        }
        return this;
    }

    @Override
    @Nullable
    public Object getBean(String name) {
        return beans.get(name);
    }

    @Override
    @Nullable
    public <T> T getBean(Class<T> type) {
        List<Object> candidates = new ArrayList<>();
        for (Object bean : beans.values()) {
            if (type.isInstance(bean)) {
                candidates.add(bean);
            }
        }
        if (candidates.isEmpty()) {
            return null;
        }
        if (candidates.size() > 1) {
            throw new InvalidArgumentException("type", type.getName(),
                    candidates.size() + " collaborators match type " + type.getName() + ", inject by name instead");
        }
        return type.cast(candidates.get(0));
    }
}
