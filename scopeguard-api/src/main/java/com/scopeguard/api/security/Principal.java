package com.scopeguard.api.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 鉴权主体（只读）
 * <p>
 * 由外部身份源提供已提取的声明。缺失的 scopes / groups 归一化为空列表，null 元素被丢弃。
 * </p>
 *
 * @param id     主体 ID
 * @param scopes 作用域声明，如 "odata.read"，保持原始顺序
 * @param groups 用户组声明，保持原始顺序
 */
public record Principal(String id, List<String> scopes, List<String> groups) {

    public Principal {
        scopes = normalize(scopes);
        groups = normalize(groups);
    }

    public static Principal of(String id, List<String> scopes) {
        return new Principal(id, scopes, null);
    }

    public static Principal of(String id, List<String> scopes, List<String> groups) {
        return new Principal(id, scopes, groups);
    }

    private static List<String> normalize(List<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> copy = new ArrayList<>(values.size());
        for (String value : values) {
            if (value != null) {
                copy.add(value);
            }
        }
        return Collections.unmodifiableList(copy);
    }

    @Override
    public String toString() {
        return String.format("Principal{id='%s', scopes=%s, groups=%s}", Objects.toString(id), scopes, groups);
    }
}
