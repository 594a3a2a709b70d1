package com.scopeguard.core.config;

import com.scopeguard.api.exception.InvalidArgumentException;
import com.scopeguard.api.security.Role;
import com.scopeguard.core.exception.ConfigurationException;
import com.scopeguard.core.util.YamlSupport;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 角色定义文件加载器
 */
@Slf4j
public class RoleDefinitionLoader {

    /**
     * 从 "classpath:xxx" 或文件路径加载角色
     *
     * @throws ConfigurationException 文件不存在、格式错误或角色定义不合法
     */
    public static List<Role> load(String location) {
        return load(ResourceLocations.open(location), location);
    }

    static List<Role> load(InputStream inputStream, String location) {
        Yaml yaml = YamlSupport.createLoaderYaml(RoleDefinitions.class);
        RoleDefinitions definitions;
        try (InputStream is = inputStream) {
            definitions = yaml.loadAs(is, RoleDefinitions.class);
        } catch (YAMLException e) {
            throw new ConfigurationException(location, "Invalid role definitions in " + location, e);
        } catch (IOException e) {
            throw new ConfigurationException(location, "Failed to read " + location, e);
        }

        if (definitions == null || definitions.getRoles() == null) {
            log.warn("[Config] Role definitions file {} declares no roles", location);
            return Collections.emptyList();
        }

        List<Role> roles = new ArrayList<>(definitions.getRoles().size());
        for (RoleDefinitions.RoleDefinition definition : definitions.getRoles()) {
            if (definition == null) {
                continue;
            }
            try {
                roles.add(definition.toRole());
            } catch (InvalidArgumentException e) {
                throw new ConfigurationException(location,
                        "Invalid role '" + definition.getName() + "' in " + location + ": " + e.getMessage(), e);
            }
        }
        log.info("[Config] Loaded {} role(s) from {}", roles.size(), location);
        return roles;
    }
}
