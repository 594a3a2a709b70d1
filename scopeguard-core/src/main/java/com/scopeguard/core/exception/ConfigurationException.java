package com.scopeguard.core.exception;

import com.scopeguard.api.exception.ScopeGuardException;

/**
 * 配置异常
 * <p>
 * 配置文件或角色定义文件无法读取、解析时抛出，只会出现在引擎构造阶段
 */
public class ConfigurationException extends ScopeGuardException {

    private final String location;

    public ConfigurationException(String location, String message) {
        super(message);
        this.location = location;
    }

    public ConfigurationException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
