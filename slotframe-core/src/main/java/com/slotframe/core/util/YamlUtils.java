package com.slotframe.core.util;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * YAML 工具类
 * <p>
 * 配置文件只包含标量、列表和映射，统一使用 SafeConstructor，
 * 不允许 !! 全局标签实例化任意类型。
 */
public final class YamlUtils {

    private static final int MAX_ALIASES = 50;

    private YamlUtils() {
    }

    /**
     * 创建仅用于加载的安全 Yaml 实例
     */
    public static Yaml createLoaderYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        loaderOptions.setMaxAliasesForCollections(MAX_ALIASES);
        return new Yaml(new SafeConstructor(loaderOptions));
    }
}
