package com.scopeguard.core.config;

import com.scopeguard.core.exception.ConfigurationException;
import com.scopeguard.core.util.YamlSupport;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;

/**
 * 从 scopeguard.yml 加载引擎配置
 */
@Slf4j
public class ScopeGuardConfigLoader {

    public static final String DEFAULT_CONFIG_NAME = "scopeguard.yml";

    /**
     * 从类路径加载默认配置文件，不存在时返回默认配置
     */
    public static ScopeGuardConfig load() {
        InputStream is = ResourceLocations.classLoader().getResourceAsStream(DEFAULT_CONFIG_NAME);
        if (is == null) {
            log.debug("[Config] No {} on classpath, using defaults", DEFAULT_CONFIG_NAME);
            return ScopeGuardConfig.defaults();
        }
        return load(is, ResourceLocations.CLASSPATH_PREFIX + DEFAULT_CONFIG_NAME);
    }

    /**
     * 从指定位置加载，位置不存在时抛出 {@link ConfigurationException}
     */
    public static ScopeGuardConfig load(String location) {
        return load(ResourceLocations.open(location), location);
    }

    static ScopeGuardConfig load(InputStream inputStream, String location) {
        Yaml yaml = YamlSupport.createLoaderYaml(ScopeGuardConfig.class);
        try (InputStream is = inputStream) {
            ScopeGuardConfig config = yaml.loadAs(is, ScopeGuardConfig.class);
            if (config == null) {
                // 空文件
                return ScopeGuardConfig.defaults();
            }
            log.info("[Config] Loaded configuration from {}", location);
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException(location, "Invalid configuration in " + location, e);
        } catch (IOException e) {
            throw new ConfigurationException(location, "Failed to read " + location, e);
        }
    }
}
