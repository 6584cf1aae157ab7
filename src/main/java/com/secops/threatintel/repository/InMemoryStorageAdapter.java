package com.secops.threatintel.repository;

import com.secops.threatintel.model.ThreatEntity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存存储适配器
 * 未接入持久层时的默认实现，也用于测试
 */
@Slf4j
public class InMemoryStorageAdapter implements StorageAdapter {

    /** type -> (id -> entity) */
    private final Map<String, Map<String, ThreatEntity>> store = new ConcurrentHashMap<>();

    public void save(ThreatEntity entity) {
        store.computeIfAbsent(entity.getType(), k -> new ConcurrentHashMap<>())
            .put(entity.getId(), entity);
    }

    public void delete(String entityType, String id) {
        Map<String, ThreatEntity> byId = store.get(entityType);
        if (byId != null) {
            byId.remove(id);
        }
    }

    @Override
    public List<ThreatEntity> fetchByIds(String entityType, List<String> ids) {
        Map<String, ThreatEntity> byId = store.getOrDefault(entityType, Map.of());
        List<ThreatEntity> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            ThreatEntity entity = byId.get(id);
            if (entity != null) {
                result.add(entity);
            }
        }
        log.debug("fetchByIds: type={}, requested={}, found={}", entityType, ids.size(), result.size());
        return result;
    }

    @Override
    public List<ThreatEntity> fetchByFilter(String entityType, Map<String, Object> filter) {
        List<ThreatEntity> result = new ArrayList<>();
        for (ThreatEntity entity : store.getOrDefault(entityType, Map.of()).values()) {
            if (matches(entity, filter)) {
                result.add(entity);
            }
        }
        return result;
    }

    private boolean matches(ThreatEntity entity, Map<String, Object> filter) {
        if (filter == null) {
            return true;
        }
        for (Map.Entry<String, Object> condition : filter.entrySet()) {
            Object actual = switch (condition.getKey()) {
                case "organizationId" -> entity.getOrganizationId();
                case "id" -> entity.getId();
                default -> entity.attribute(condition.getKey());
            };
            if (!Objects.equals(stringify(actual), stringify(condition.getValue()))) {
                return false;
            }
        }
        return true;
    }

    private static String stringify(Object value) {
        return value == null ? null : value.toString();
    }
}
