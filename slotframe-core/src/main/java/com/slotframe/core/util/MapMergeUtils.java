package com.slotframe.core.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 参数 Map 深度合并工具
 */
public final class MapMergeUtils {

    private MapMergeUtils() {
    }

    /**
     * 把 source 深度合并进 dest
     * <p>
     * 两边都是 Map 的键递归合并，其余情况 source 的值覆盖 dest。
     * 写入 dest 的 Map / List 都是深拷贝，dest 不会与 source 共享可变结构。
     *
     * @param dest   目标，内部嵌套 Map 必须由本工具创建
     * @param source 来源，可为 null，不会被修改
     */
    @SuppressWarnings("unchecked")
    public static void mergeDeep(Map<String, Object> dest, Map<?, ?> source) {
        if (source == null) return;
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            Object existing = dest.get(key);
            if (value instanceof Map && existing instanceof Map) {
                mergeDeep((Map<String, Object>) existing, (Map<?, ?>) value);
            } else {
                dest.put(key, deepCopy(value));
            }
        }
    }

    public static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            mergeDeep(copy, (Map<?, ?>) value);
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>(((List<?>) value).size());
            for (Object item : (List<?>) value) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }
}
