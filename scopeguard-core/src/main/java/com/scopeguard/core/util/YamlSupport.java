package com.scopeguard.core.util;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * YAML 工具类
 * 统一创建绑定到指定根类型的 SnakeYAML 实例，不放行任何全局标签。
 */
public final class YamlSupport {

    private YamlSupport() {
    }

    public static Yaml createLoaderYaml(Class<?> rootType) {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(rootType, loaderOptions));
    }
}
