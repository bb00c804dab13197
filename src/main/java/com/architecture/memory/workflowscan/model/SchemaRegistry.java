package com.architecture.memory.workflowscan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name-to-table lookup built before the main scan. Each schema is registered under both its
 * entity name and its table name. When two schemas claim the same key the one with the higher
 * {@link SchemaSource} priority is kept; ties keep the first registration.
 *
 * <p>Written only by the schema pass, read-only afterwards.
 */
public class SchemaRegistry {

    private final Map<String, TableSchema> byName = new LinkedHashMap<>();
    private final List<TableSchema> schemas = new ArrayList<>();

    public void register(TableSchema schema) {
        schemas.add(schema);
        put(schema.getEntityName(), schema);
        put(schema.getTableName(), schema);
    }

    private void put(String key, TableSchema schema) {
        if (key == null || key.isBlank()) return;
        TableSchema existing = byName.get(key);
        if (existing == null || priority(schema) > priority(existing)) {
            byName.put(key, schema);
        }
    }

    private static int priority(TableSchema schema) {
        return schema.getSource() != null ? schema.getSource().getPriority() : 0;
    }

    public Optional<TableSchema> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Canonical table name for {@code name} (entity, DbSet property or table name), or
     * {@code name} itself when it is not registered.
     */
    public String resolveTableName(String name) {
        Optional<TableSchema> found = lookup(name);
        if (found.isEmpty()) return name;
        TableSchema schema = found.get();
        // a DbSet property name defers to a stronger mapping of its entity ([Table] attribute)
        TableSchema byEntity = byName.get(schema.getEntityName());
        if (byEntity != null && priority(byEntity) > priority(schema)) {
            schema = byEntity;
        }
        return schema.getTableName();
    }

    public List<TableSchema> getSchemas() {
        return Collections.unmodifiableList(schemas);
    }

    @JsonIgnore
    public Collection<String> getNames() {
        return Collections.unmodifiableSet(byName.keySet());
    }

    @JsonIgnore
    public int size() {
        return schemas.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return schemas.isEmpty();
    }
}
