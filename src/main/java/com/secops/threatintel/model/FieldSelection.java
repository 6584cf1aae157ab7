package com.secops.threatintel.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 请求字段树中的一个节点
 *
 * @param name       字段名
 * @param selections 子字段，叶子节点为空列表
 */
public record FieldSelection(String name, List<FieldSelection> selections) {

    public FieldSelection {
        selections = selections == null ? List.of() : List.copyOf(selections);
    }

    public static FieldSelection leaf(String name) {
        return new FieldSelection(name, List.of());
    }

    public static FieldSelection of(String name, FieldSelection... children) {
        return new FieldSelection(name, List.of(children));
    }

    public boolean isLeaf() {
        return selections.isEmpty();
    }

    /**
     * 从解码后的嵌套 Map 构建字段树
     * 值为 Map 时视为子选择，其它值（null、true 等）视为叶子
     */
    public static List<FieldSelection> fromTree(Map<String, ?> tree) {
        if (tree == null || tree.isEmpty()) {
            return Collections.emptyList();
        }
        List<FieldSelection> result = new ArrayList<>(tree.size());
        for (Map.Entry<String, ?> entry : tree.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                @SuppressWarnings("unchecked")
                Map<String, ?> children = (Map<String, ?>) nested;
                result.add(new FieldSelection(entry.getKey(), fromTree(children)));
            } else {
                result.add(leaf(entry.getKey()));
            }
        }
        return result;
    }
}
