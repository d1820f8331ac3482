package io.github.flameyossnowy.tally.counter;

import io.github.flameyossnowy.tally.api.exceptions.RelationConfigurationException;
import io.github.flameyossnowy.tally.api.listener.Subscription;
import io.github.flameyossnowy.tally.api.meta.FieldModel;
import io.github.flameyossnowy.tally.api.meta.MetadataRegistry;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import io.github.flameyossnowy.tally.api.store.CounterStore;
import io.github.flameyossnowy.tally.api.utils.Logging;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of counter synchronization for one {@link CounterStore}.
 * <p>
 * Building a registry subscribes it to the store's lifecycle notifications: loaded and
 * inserted entities are attached automatically, first persists migrate unsaved state, and
 * deletes drop the row's state. Relation trackers are created per (entity type, relation name)
 * when an entity type's counters are first used, or for every registered entity when the
 * registry is built with eager validation.
 *
 * <pre>{@code
 * RelationCounterRegistry registry = RelationCounterRegistry.builder(store)
 *     .withConfig(CounterConfig.defaults())
 *     .build();
 *
 * registry.counters(Article.class).field("views").increment(article);
 * }</pre>
 */
public final class RelationCounterRegistry implements AutoCloseable {
    private final CounterStore store;
    private final MetadataRegistry metadata;
    private final CounterConfig config;
    private final AtomicCounters counters;
    private final StateRegistry stateRegistry;
    private final ReentryGuard reentryGuard = new ReentryGuard();

    private final Map<Class<?>, EntityCounters<?>> entityCounters = new ConcurrentHashMap<>();
    private final Map<TrackerKey, RelationTracker> trackers = new ConcurrentHashMap<>();
    private final Subscription lifecycleSubscription;

    private RelationCounterRegistry(CounterStore store, CounterConfig config) {
        this.store = store;
        this.metadata = store.metadata();
        this.config = config;
        this.counters = new AtomicCounters(store);
        this.stateRegistry = new StateRegistry(counters);

        if (config.eagerValidation()) {
            try {
                validateAll();
            } catch (RelationConfigurationException e) {
                closeTrackers();
                throw e;
            }
        }

        this.lifecycleSubscription = store.listeners().addGlobalListener(new InstanceLifecycleListener(this));
    }

    public static Builder builder(@NotNull CounterStore store) {
        return new Builder(store);
    }

    public CounterStore store() {
        return store;
    }

    public CounterConfig config() {
        return config;
    }

    public AtomicCounters counters() {
        return counters;
    }

    public StateRegistry stateRegistry() {
        return stateRegistry;
    }

    public ReentryGuard reentryGuard() {
        return reentryGuard;
    }

    /**
     * The counters of an entity type. The first call for a type validates its relation counters
     * and creates their trackers.
     *
     * @throws IllegalStateException if the type was never registered
     * @throws RelationConfigurationException if a relation counter is declared on an invalid relation
     */
    @SuppressWarnings("unchecked")
    public <T> EntityCounters<T> counters(@NotNull Class<T> entityType) {
        EntityCounters<T> existing = (EntityCounters<T>) entityCounters.get(entityType);
        if (existing != null) {
            return existing;
        }

        RepositoryModel<T, Object> model = metadata.require(entityType);
        EntityCounters<T> created = new EntityCounters<>(this, model);
        EntityCounters<T> previous = (EntityCounters<T>) entityCounters.putIfAbsent(entityType, created);
        if (previous != null) {
            return previous;
        }

        for (RelationCounterField<T> field : created.relationFields()) {
            field.tracker();
        }
        return created;
    }

    /**
     * Shortcut for {@code counters(entityType).field(name)}.
     */
    public <T> CounterField<T> field(@NotNull Class<T> entityType, @NotNull String name) {
        return counters(entityType).field(name);
    }

    /**
     * Starts tracking an entity's relation counters and initializes any counter without a value.
     * Stores call this for every loaded and inserted entity; calling it again is harmless.
     * Entities without counters are ignored.
     */
    @SuppressWarnings("unchecked")
    public <T> void attach(@NotNull T entity) {
        Class<T> type = (Class<T>) entity.getClass();
        RepositoryModel<T, Object> model = metadata.getByEntityClass(type);
        if (model == null || !model.hasCounters()) {
            return;
        }

        counters(type).attach(entity);
    }

    /**
     * Whether any loaded representation is still tracked. Sweeps collected ones first.
     */
    public boolean hasTrackedStates() {
        return stateRegistry.hasTrackedStates();
    }

    /**
     * The tracker for one relation of an entity type, created and subscribed on first request.
     * Both ends of a many-to-many link are always tracked together.
     */
    public RelationTracker tracker(@NotNull Class<?> ownerType, @NotNull String relationName) {
        TrackerKey key = new TrackerKey(ownerType, relationName);
        RelationTracker tracker = trackers.get(key);
        if (tracker != null) {
            return tracker;
        }

        RelationTracker created;
        try {
            created = new RelationTracker(this, ownerType, relationName);
        } catch (RelationConfigurationException e) {
            Logging.error("Cannot track " + ownerType.getSimpleName() + '.' + relationName + ": " + e.getMessage());
            throw e;
        }

        RelationTracker previous = trackers.putIfAbsent(key, created);
        if (previous != null) {
            return previous;
        }

        created.subscribe();
        Logging.info(() -> "Created " + created);

        if (created.classification() != RelationClassification.REVERSE_SINGLE) {
            tracker(created.memberType(), created.relatedName());
        }
        return created;
    }

    /**
     * Names of the relation counters of {@code entityType} following {@code relationName}, or an
     * empty list if there are none.
     */
    public List<String> relationCounterFieldNames(@NotNull Class<?> entityType, @NotNull String relationName) {
        RepositoryModel<?, ?> model = metadata.getByEntityClass(entityType);
        if (model == null || model.relationCounterFields().isEmpty()) {
            return Collections.emptyList();
        }
        return counters(entityType).relationFieldNames(relationName);
    }

    /**
     * Replaces an entity's unsaved state with one saved state per counted relation.
     */
    void onFirstPersist(@NotNull Object entity) {
        RepositoryModel<Object, Object> model = erasedModel(entity.getClass());
        if (model.relationCounterFields().isEmpty()) {
            return;
        }

        Object id = model.getPrimaryKeyValue(entity);
        if (id == null) {
            return;
        }

        stateRegistry.resetState(model.getEntityClass(), id, entity);
        for (FieldModel<Object> field : model.relationCounterFields()) {
            stateRegistry.storeState(entity, model, field);
        }

        Logging.deepInfo(() -> "Migrated " + model.entitySimpleName() + '[' + id + "] to saved state");
    }

    /**
     * Drops every state of the entity's row.
     */
    void onPreDelete(@NotNull Object entity) {
        RepositoryModel<Object, Object> model = erasedModel(entity.getClass());
        if (model.relationCounterFields().isEmpty()) {
            return;
        }

        stateRegistry.resetState(model.getEntityClass(), model.getPrimaryKeyValue(entity), entity);
    }

    @ApiStatus.Internal
    @SuppressWarnings("unchecked")
    RepositoryModel<Object, Object> erasedModel(@NotNull Class<?> entityType) {
        return (RepositoryModel<Object, Object>) (RepositoryModel<?, ?>) metadata.require(entityType);
    }

    /**
     * Unsubscribes every tracker and forgets all tracked state. Trackers are recreated on next
     * use, or immediately if the registry validates eagerly.
     */
    public void reset() {
        closeTrackers();
        entityCounters.clear();
        stateRegistry.clear();

        if (config.eagerValidation()) {
            validateAll();
        }
    }

    @Override
    public void close() {
        closeTrackers();
        entityCounters.clear();
        stateRegistry.clear();
        lifecycleSubscription.close();
    }

    private void closeTrackers() {
        for (RelationTracker tracker : trackers.values()) {
            tracker.unsubscribe();
        }
        trackers.clear();
    }

    private void validateAll() {
        for (RepositoryModel<?, ?> model : metadata.getAll()) {
            if (model.hasCounters()) {
                counters(model.getEntityClass());
            }
        }
    }

    private record TrackerKey(Class<?> ownerType, String relationName) {
    }

    public static final class Builder {
        private final CounterStore store;
        private CounterConfig config = CounterConfig.defaults();

        private Builder(CounterStore store) {
            this.store = Objects.requireNonNull(store, "Store cannot be null");
        }

        public Builder withConfig(@NotNull CounterConfig config) {
            this.config = Objects.requireNonNull(config, "Config cannot be null");
            return this;
        }

        public Builder withReloadAfterWrite(boolean reloadAfterWrite) {
            this.config = config.withReloadAfterWrite(reloadAfterWrite);
            return this;
        }

        public Builder withEagerValidation(boolean eagerValidation) {
            this.config = config.withEagerValidation(eagerValidation);
            return this;
        }

        /**
         * @throws RelationConfigurationException if eager validation finds an invalid relation counter
         */
        public RelationCounterRegistry build() {
            return new RelationCounterRegistry(store, config);
        }
    }
}
