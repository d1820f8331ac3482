package io.github.flameyossnowy.tally.memory;

import io.github.flameyossnowy.tally.api.exceptions.StoreException;
import io.github.flameyossnowy.tally.api.listener.ListenerRegistry;
import io.github.flameyossnowy.tally.api.listener.RelationChangeEvent;
import io.github.flameyossnowy.tally.api.meta.FieldModel;
import io.github.flameyossnowy.tally.api.meta.MetadataRegistry;
import io.github.flameyossnowy.tally.api.meta.RelationshipKind;
import io.github.flameyossnowy.tally.api.meta.RelationshipModel;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import io.github.flameyossnowy.tally.api.options.Query;
import io.github.flameyossnowy.tally.api.options.SelectQuery;
import io.github.flameyossnowy.tally.api.store.CounterStore;
import io.github.flameyossnowy.tally.api.utils.Logging;
import io.github.flameyossnowy.tally.api.value.CounterValue;
import io.github.flameyossnowy.tally.api.value.RelationCount;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A {@link CounterStore} keeping every row in memory.
 * <p>
 * Entities are stored as snapshots of their fields, so every load materializes a new, independent
 * instance of the row. Many-to-many members live in link tables and are changed through
 * {@link #relation(Object, String)}; foreign keys are plain fields.
 * <p>
 * All state is guarded by one read-write lock. Notifications are published after the lock is
 * released, so listeners may call back into the store.
 *
 * <pre>{@code
 * MemoryRepositoryAdapter store = MemoryRepositoryAdapter.builder(metadata)
 *     .withReportClearedIds(true)
 *     .build();
 *
 * Article article = store.insert(new Article());
 * store.relation(article, "tags").add(tag);
 * }</pre>
 */
public class MemoryRepositoryAdapter implements CounterStore {
    private final MetadataRegistry metadata;
    private final ListenerRegistry listeners = new ListenerRegistry();
    private final boolean reportClearedIds;
    private final StoreStatistics statistics = new StoreStatistics();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Class<?>, MemoryTable> tables = new ConcurrentHashMap<>();
    private final Map<String, LinkTable> linkTables = new ConcurrentHashMap<>();

    MemoryRepositoryAdapter(@NotNull MetadataRegistry metadata, boolean reportClearedIds) {
        this.metadata = metadata;
        this.reportClearedIds = reportClearedIds;
    }

    public static MemoryRepositoryAdapterBuilder builder(@NotNull MetadataRegistry metadata) {
        return new MemoryRepositoryAdapterBuilder(metadata);
    }

    @Override
    public @NotNull MetadataRegistry metadata() {
        return metadata;
    }

    @Override
    public @NotNull ListenerRegistry listeners() {
        return listeners;
    }

    public StoreStatistics statistics() {
        return statistics;
    }

    /**
     * Whether clears report the ids they removed in their post-clear notification.
     */
    public boolean reportsClearedIds() {
        return reportClearedIds;
    }

    /**
     * Inserts a new row. A missing auto-increment key is assigned from the type's sequence, and
     * counters without a value get their declared default.
     *
     * @return {@code entity}, now carrying its key
     * @throws StoreException if a row with the same key exists
     */
    public <T> T insert(@NotNull T entity) {
        RepositoryModel<T, Object> model = modelOf(entity);
        listeners.firePreInsert(entity);

        Object id;
        lock.writeLock().lock();
        try {
            MemoryTable table = table(model.getEntityClass());
            Object current = model.getPrimaryKeyValue(entity);

            if (current == null) {
                if (!model.getPrimaryKey().autoIncrement()) {
                    throw new IllegalArgumentException("Cannot insert " + model.entitySimpleName() + " without a key");
                }
                id = normalizeId(model, table.nextId());
                model.setPrimaryKeyValue(entity, id);
            } else {
                id = normalizeId(model, current);
                if (table.contains(id)) {
                    throw new StoreException("Duplicate key " + id + " for " + model.entitySimpleName());
                }
                table.observeId(id);
            }

            applyDefaults(model, entity);
            table.put(id, snapshot(model, entity));
            statistics.recordRowWrite();
        } finally {
            lock.writeLock().unlock();
        }

        Object insertedId = id;
        Logging.deepInfo(() -> "Inserted " + model.entitySimpleName() + '[' + insertedId + ']');
        listeners.firePostSave(entity, true);
        return entity;
    }

    /**
     * Writes an existing row. Counter fields are only written when named in
     * {@code counterFields} or when their in-memory value is {@code null}, so deltas applied
     * concurrently by other instances are never overwritten with a stale value.
     *
     * @throws StoreException if the row does not exist
     */
    public <T> void update(@NotNull T entity, @NotNull String... counterFields) {
        RepositoryModel<T, Object> model = modelOf(entity);
        Object id = requireId(model, entity);
        Set<String> listed = new HashSet<>(Arrays.asList(counterFields));

        for (String name : listed) {
            FieldModel<T> field = model.fieldByName(name);
            if (field == null || !field.isCounter()) {
                throw new IllegalArgumentException(model.entitySimpleName() + " has no counter named '" + name + '\'');
            }
        }

        lock.writeLock().lock();
        try {
            Map<String, Object> row = table(model.getEntityClass()).get(id);
            if (row == null) {
                throw new StoreException("No " + model.entitySimpleName() + " with key " + id);
            }

            for (FieldModel<T> field : model.fields()) {
                if (field.id() || isLinkOnly(field)) continue;

                Object value = field.getValue(entity);
                if (field.isCounter() && value != null && !listed.contains(field.name())) continue;

                row.put(field.name(), value);
            }
            statistics.recordRowWrite();
        } finally {
            lock.writeLock().unlock();
        }

        listeners.firePostSave(entity, false);
    }

    /**
     * Deletes a row together with its many-to-many link rows, then clears the entity's key.
     * Link rows are dropped without relation notifications.
     *
     * @throws StoreException if the row does not exist
     */
    public <T> void delete(@NotNull T entity) {
        RepositoryModel<T, Object> model = modelOf(entity);
        Object id = requireId(model, entity);
        listeners.firePreDelete(entity);

        lock.writeLock().lock();
        try {
            if (table(model.getEntityClass()).remove(id) == null) {
                throw new StoreException("No " + model.entitySimpleName() + " with key " + id);
            }

            for (RepositoryModel<?, ?> other : metadata.getAll()) {
                for (RelationshipModel<?> relationship : other.getRelationships()) {
                    if (relationship.relationshipKind() != RelationshipKind.MANY_TO_MANY) continue;

                    LinkTable links = linkTables.get(relationship.linkName());
                    if (links == null) continue;

                    if (relationship.declaringEntityType() == model.getEntityClass()) {
                        links.removeAll(false, id);
                    }
                    if (relationship.targetEntityType() == model.getEntityClass()) {
                        links.removeAll(true, id);
                    }
                }
            }
            statistics.recordRowWrite();
        } finally {
            lock.writeLock().unlock();
        }

        Logging.deepInfo(() -> "Deleted " + model.entitySimpleName() + '[' + id + ']');
        listeners.firePostDelete(entity);
        model.setPrimaryKeyValue(entity, null);
    }

    /**
     * Loads a new instance of the row with the given key.
     */
    public <T> @Nullable T findById(@NotNull Class<T> entityType, @NotNull Object id) {
        RepositoryModel<T, Object> model = metadata.require(entityType);
        Object key = normalizeId(model, id);

        Map<String, Object> row;
        lock.readLock().lock();
        try {
            Map<String, Object> stored = table(entityType).get(key);
            row = stored == null ? null : new LinkedHashMap<>(stored);
            statistics.recordRead();
        } finally {
            lock.readLock().unlock();
        }

        if (row == null) {
            return null;
        }

        T entity = materialize(model, row);
        listeners.firePostLoad(entity);
        return entity;
    }

    /**
     * Loads a new instance of every row matching {@code query}.
     */
    public <T> List<T> find(@NotNull Class<T> entityType, @NotNull SelectQuery query) {
        RepositoryModel<T, Object> model = metadata.require(entityType);

        List<Map<String, Object>> rows = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Map<String, Object> row : table(entityType).select(query).values()) {
                rows.add(new LinkedHashMap<>(row));
            }
            statistics.recordRead();
        } finally {
            lock.readLock().unlock();
        }

        List<T> entities = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            T entity = materialize(model, row);
            listeners.firePostLoad(entity);
            entities.add(entity);
        }
        return entities;
    }

    public <T> List<T> findAll(@NotNull Class<T> entityType) {
        return find(entityType, Query.select().build());
    }

    /**
     * A handle on the members of one many-to-many relation of {@code owner}, from either side.
     *
     * @throws IllegalArgumentException if the relation is not many-to-many
     */
    public <T> MemoryRelation<T> relation(@NotNull T owner, @NotNull String relationName) {
        RepositoryModel<T, Object> model = modelOf(owner);
        RelationshipModel<T> relationship = metadata.relationship(model.getEntityClass(), relationName);
        if (relationship.relationshipKind() != RelationshipKind.MANY_TO_MANY) {
            throw new IllegalArgumentException(model.entitySimpleName() + '.' + relationName + " is not a many-to-many relation");
        }
        return new MemoryRelation<>(this, owner, model, relationship);
    }

    @Override
    public int applyDeltas(@NotNull Class<?> entityType, @NotNull SelectQuery filter, @NotNull Map<String, Integer> deltas) {
        if (deltas.isEmpty()) return 0;

        RepositoryModel<?, ?> model = metadata.require(entityType);
        requireCounters(model, deltas.keySet());

        lock.writeLock().lock();
        try {
            Map<Object, Map<String, Object>> rows = table(entityType).select(filter);
            for (Map<String, Object> row : rows.values()) {
                for (Map.Entry<String, Integer> delta : deltas.entrySet()) {
                    Object current = row.get(delta.getKey());
                    if (current != null) {
                        row.put(delta.getKey(), ((Number) current).intValue() + delta.getValue());
                    }
                }
            }

            statistics.recordCounterWrite();
            return rows.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int assign(@NotNull Class<?> entityType, @NotNull SelectQuery filter, @NotNull Map<String, CounterValue> values) {
        if (values.isEmpty()) return 0;

        RepositoryModel<?, ?> model = metadata.require(entityType);
        requireCounters(model, values.keySet());

        Map<String, RelationshipModel<?>> counted = new LinkedHashMap<>();
        for (Map.Entry<String, CounterValue> entry : values.entrySet()) {
            if (entry.getValue() instanceof CounterValue.Deferred deferred) {
                if (!(deferred.expression() instanceof RelationCount count)) {
                    throw new StoreException("Unsupported deferred expression " + deferred.expression() + " for " + entry.getKey());
                }
                counted.put(entry.getKey(), metadata.relationship(entityType, count.relationName()));
            }
        }

        lock.writeLock().lock();
        try {
            Map<Object, Map<String, Object>> rows = table(entityType).select(filter);
            for (Map.Entry<Object, Map<String, Object>> row : rows.entrySet()) {
                for (Map.Entry<String, CounterValue> entry : values.entrySet()) {
                    int value = entry.getValue() instanceof CounterValue.Concrete concrete
                        ? concrete.value()
                        : memberIdsLocked(counted.get(entry.getKey()), row.getKey()).size();
                    row.getValue().put(entry.getKey(), value);
                }
            }

            statistics.recordCounterWrite();
            return rows.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public @NotNull Map<String, Object> readFields(@NotNull Class<?> entityType, @NotNull Object id, @NotNull Collection<String> fields) {
        RepositoryModel<?, ?> model = metadata.require(entityType);
        Object key = normalizeId(model, id);

        lock.readLock().lock();
        try {
            Map<String, Object> row = table(entityType).get(key);
            if (row == null) {
                throw new StoreException("No " + model.entitySimpleName() + " with key " + key);
            }

            Map<String, Object> result = new LinkedHashMap<>();
            for (String field : fields) {
                if (!row.containsKey(field)) {
                    throw new StoreException("Unknown field " + model.entitySimpleName() + '.' + field);
                }
                result.put(field, row.get(field));
            }

            statistics.recordRead();
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public @NotNull Set<Object> memberIds(@NotNull Class<?> ownerType, @NotNull Object ownerId, @NotNull String relationName) {
        RelationshipModel<?> relationship = metadata.relationship(ownerType, relationName);
        Object key = normalizeId(metadata.require(ownerType), ownerId);

        lock.readLock().lock();
        try {
            statistics.recordRead();
            return memberIdsLocked(relationship, key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of stored rows of a type.
     */
    public int count(@NotNull Class<?> entityType) {
        lock.readLock().lock();
        try {
            return table(entityType).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops every row and link. Listeners stay subscribed.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            tables.clear();
            linkTables.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    Set<Object> link(@NotNull RelationshipModel<?> relationship, @NotNull Object ownerId, @NotNull Collection<Object> memberIds) {
        boolean reverse = !relationship.isOwning();

        lock.writeLock().lock();
        try {
            MemoryTable members = table(relationship.targetEntityType());
            for (Object memberId : memberIds) {
                if (!members.contains(memberId)) {
                    throw new StoreException("No " + relationship.targetEntityType().getSimpleName() + " with key " + memberId);
                }
            }

            LinkTable links = linkTable(relationship);
            Set<Object> added = new LinkedHashSet<>();
            for (Object memberId : memberIds) {
                if (links.add(reverse, ownerId, memberId)) {
                    added.add(memberId);
                }
            }
            return added;
        } finally {
            lock.writeLock().unlock();
        }
    }

    Set<Object> unlink(@NotNull RelationshipModel<?> relationship, @NotNull Object ownerId, @NotNull Collection<Object> memberIds) {
        boolean reverse = !relationship.isOwning();

        lock.writeLock().lock();
        try {
            LinkTable links = linkTable(relationship);
            Set<Object> removed = new LinkedHashSet<>();
            for (Object memberId : memberIds) {
                if (links.remove(reverse, ownerId, memberId)) {
                    removed.add(memberId);
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    Set<Object> unlinkAll(@NotNull RelationshipModel<?> relationship, @NotNull Object ownerId) {
        lock.writeLock().lock();
        try {
            return linkTable(relationship).removeAll(!relationship.isOwning(), ownerId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void publish(@NotNull RelationChangeEvent event) {
        listeners.fireRelationChanged(event);
    }

    /**
     * The key of a member given either as an entity of the relation's target type or as a key.
     */
    Object memberIdOf(@NotNull RelationshipModel<?> relationship, @NotNull Object member) {
        RepositoryModel<Object, Object> model = erased(metadata.require(relationship.targetEntityType()));
        if (relationship.targetEntityType().isInstance(member)) {
            return requireId(model, member);
        }
        return normalizeId(model, member);
    }

    <T> Object requireId(@NotNull RepositoryModel<T, Object> model, @NotNull T entity) {
        Object id = model.getPrimaryKeyValue(entity);
        if (id == null) {
            throw new IllegalStateException(model.entitySimpleName() + " has not been inserted");
        }
        return normalizeId(model, id);
    }

    private Set<Object> memberIdsLocked(RelationshipModel<?> relationship, Object ownerId) {
        String joinField = relationship.joinField();

        return switch (relationship.relationshipKind()) {
            case MANY_TO_MANY -> linkTable(relationship).members(!relationship.isOwning(), ownerId);
            case ONE_TO_MANY -> new LinkedHashSet<>(table(relationship.targetEntityType()).idsWhere(Objects.requireNonNull(joinField), ownerId));
            case MANY_TO_ONE, ONE_TO_ONE -> {
                if (!relationship.isOwning()) {
                    yield new LinkedHashSet<>(table(relationship.targetEntityType()).idsWhere(Objects.requireNonNull(joinField), ownerId));
                }

                Map<String, Object> row = table(relationship.declaringEntityType()).get(ownerId);
                Object target = row == null ? null : row.get(joinField);

                Set<Object> single = new LinkedHashSet<>(1);
                if (target != null) {
                    single.add(target);
                }
                yield single;
            }
        };
    }

    private MemoryTable table(Class<?> entityType) {
        return tables.computeIfAbsent(entityType, ignored -> new MemoryTable());
    }

    private LinkTable linkTable(RelationshipModel<?> relationship) {
        return linkTables.computeIfAbsent(relationship.linkName(), ignored -> new LinkTable());
    }

    private static void requireCounters(RepositoryModel<?, ?> model, Collection<String> fields) {
        for (String name : fields) {
            FieldModel<?> field = model.fieldByName(name);
            if (field == null || !field.isCounter()) {
                throw new StoreException(model.entitySimpleName() + '.' + name + " is not a counter field");
            }
        }
    }

    private static <T> void applyDefaults(RepositoryModel<T, Object> model, T entity) {
        for (FieldModel<T> field : model.counterFields()) {
            String defaultValue = field.defaultValue();
            if (defaultValue == null || field.getValue(entity) != null) continue;

            try {
                field.setValue(entity, Integer.valueOf(defaultValue.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Default value '" + defaultValue + "' of " + model.entitySimpleName() + '.' + field.name() + " is not an integer", e);
            }
        }
    }

    private static <T> Map<String, Object> snapshot(RepositoryModel<T, Object> model, T entity) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (FieldModel<T> field : model.fields()) {
            if (isLinkOnly(field)) continue;
            row.put(field.name(), field.getValue(entity));
        }
        return row;
    }

    private static <T> T materialize(RepositoryModel<T, Object> model, Map<String, Object> row) {
        T entity = model.newInstance();
        for (FieldModel<T> field : model.fields()) {
            if (row.containsKey(field.name())) {
                field.setValue(entity, row.get(field.name()));
            }
        }
        return entity;
    }

    private static boolean isLinkOnly(FieldModel<?> field) {
        return field.relationshipKind() == RelationshipKind.MANY_TO_MANY;
    }

    private static Object normalizeId(RepositoryModel<?, ?> model, Object id) {
        if (id instanceof Number number) {
            Class<?> idClass = model.getIdClass();
            if (idClass == Long.class) return number.longValue();
            if (idClass == Integer.class) return number.intValue();
        }
        return id;
    }

    @SuppressWarnings("unchecked")
    private <T> RepositoryModel<T, Object> modelOf(T entity) {
        return (RepositoryModel<T, Object>) (RepositoryModel<?, ?>) metadata.require(entity.getClass());
    }

    @SuppressWarnings("unchecked")
    private static RepositoryModel<Object, Object> erased(RepositoryModel<?, ?> model) {
        return (RepositoryModel<Object, Object>) model;
    }
}
