package com.scopeguard.api.exception;

/**
 * ScopeGuard 异常基类
 * <p>
 * 所有由鉴权引擎主动抛出的异常均继承自此类。
 * 注意：鉴权查询本身永远不会抛出异常（失败即拒绝），异常只出现在值对象构造、配置加载与显式强制校验中。
 *
 * @author ScopeGuard
 */
public class ScopeGuardException extends RuntimeException {

    public ScopeGuardException(String message) {
        super(message);
    }

    public ScopeGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
