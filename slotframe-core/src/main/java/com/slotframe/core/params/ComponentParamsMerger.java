package com.slotframe.core.params;

import com.slotframe.api.component.ParamsFunction;
import com.slotframe.api.config.ComponentDefinition;
import com.slotframe.core.context.ComponentContext;
import com.slotframe.core.util.MapMergeUtils;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 最终参数合并器
 * <p>
 * 优先级由低到高：宿主参数 -> 定义中的 {@code P + "Params"} -> 选择器参数。
 * 合并完成后若缺少环境 API 句柄则注入。
 */
@Slf4j
public class ComponentParamsMerger {

    private final ComponentContext context;

    public ComponentParamsMerger(ComponentContext context) {
        this.context = context;
    }

    public Map<String, Object> merge(@Nullable ComponentDefinition definition,
                                     String propertyName,
                                     @Nullable Map<String, Object> paramsFromHost,
                                     @Nullable Map<String, Object> paramsFromSelector) {
        Map<String, Object> result = new LinkedHashMap<>();
        MapMergeUtils.mergeDeep(result, paramsFromHost);

        Object userParams = definition != null
                ? definition.get(propertyName + ComponentDefinition.PARAMS_SUFFIX)
                : null;
        if (userParams instanceof ParamsFunction) {
            // 函数拿到的是宿主参数的副本
            Map<String, Object> hostCopy = new LinkedHashMap<>();
            MapMergeUtils.mergeDeep(hostCopy, paramsFromHost);
            MapMergeUtils.mergeDeep(result, ((ParamsFunction) userParams).apply(hostCopy));
        } else if (userParams instanceof Map) {
            MapMergeUtils.mergeDeep(result, (Map<?, ?>) userParams);
        } else if (userParams != null) {
            log.warn("Ignoring {}{} of unsupported type {}", propertyName, ComponentDefinition.PARAMS_SUFFIX,
                    userParams.getClass().getName());
        }

        MapMergeUtils.mergeDeep(result, paramsFromSelector);

        String apiKey = context.getConfig().getApiParamKey();
        if (result.get(apiKey) == null) {
            result.put(apiKey, context.getApi());
        }
        return result;
    }
}
