package com.scopeguard.core.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * 通用去重工具：按键函数去重，先出现者保留，保持输入顺序
 */
public final class Deduplicator {

    private Deduplicator() {
    }

    public static <T, K> List<T> distinctBy(Collection<? extends T> items, Function<? super T, ? extends K> keyFunction) {
        if (items == null || items.isEmpty()) {
            return Collections.emptyList();
        }
        Set<K> seen = new HashSet<>();
        List<T> result = new ArrayList<>(items.size());
        for (T item : items) {
            if (seen.add(keyFunction.apply(item))) {
                result.add(item);
            }
        }
        return Collections.unmodifiableList(result);
    }
}
