package io.github.flameyossnowy.tally.api.listener;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous notification hub owned by a store.
 * <p>
 * Listeners run on the publishing thread, global listeners before type-specific ones, each
 * group in subscription order. Exceptions thrown by a listener propagate to the publisher.
 */
@SuppressWarnings("unchecked")
public final class ListenerRegistry {
    private final List<EntityLifecycleListener<Object>> globalListeners = new CopyOnWriteArrayList<>();
    private final Map<Class<?>, List<EntityLifecycleListener<Object>>> entityListeners = new ConcurrentHashMap<>();
    private final Map<String, List<RelationChangeListener>> relationListeners = new ConcurrentHashMap<>();

    public Subscription addGlobalListener(@NotNull EntityLifecycleListener<Object> listener) {
        globalListeners.add(listener);
        return () -> globalListeners.remove(listener);
    }

    public <T> Subscription addEntityListener(@NotNull Class<T> entityType, @NotNull EntityLifecycleListener<? super T> listener) {
        EntityLifecycleListener<Object> erased = (EntityLifecycleListener<Object>) listener;
        List<EntityLifecycleListener<Object>> listeners =
            entityListeners.computeIfAbsent(entityType, ignored -> new CopyOnWriteArrayList<>());
        listeners.add(erased);
        return () -> listeners.remove(erased);
    }

    public Subscription addRelationListener(@NotNull String linkName, @NotNull RelationChangeListener listener) {
        List<RelationChangeListener> listeners =
            relationListeners.computeIfAbsent(linkName, ignored -> new CopyOnWriteArrayList<>());
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void firePostLoad(@NotNull Object entity) {
        for (EntityLifecycleListener<Object> listener : listenersFor(entity)) {
            listener.onPostLoad(entity);
        }
    }

    public void firePreInsert(@NotNull Object entity) {
        for (EntityLifecycleListener<Object> listener : listenersFor(entity)) {
            listener.onPreInsert(entity);
        }
    }

    public void firePostSave(@NotNull Object entity, boolean created) {
        for (EntityLifecycleListener<Object> listener : listenersFor(entity)) {
            listener.onPostSave(entity, created);
        }
    }

    public void firePreDelete(@NotNull Object entity) {
        for (EntityLifecycleListener<Object> listener : listenersFor(entity)) {
            listener.onPreDelete(entity);
        }
    }

    public void firePostDelete(@NotNull Object entity) {
        for (EntityLifecycleListener<Object> listener : listenersFor(entity)) {
            listener.onPostDelete(entity);
        }
    }

    public void fireRelationChanged(@NotNull RelationChangeEvent event) {
        List<RelationChangeListener> listeners = relationListeners.get(event.linkName());
        if (listeners == null) return;

        for (RelationChangeListener listener : listeners) {
            listener.onRelationChanged(event);
        }
    }

    public boolean hasRelationListeners(@NotNull String linkName) {
        List<RelationChangeListener> listeners = relationListeners.get(linkName);
        return listeners != null && !listeners.isEmpty();
    }

    private List<EntityLifecycleListener<Object>> listenersFor(Object entity) {
        List<EntityLifecycleListener<Object>> typed = entityListeners.get(entity.getClass());
        if (typed == null || typed.isEmpty()) {
            return globalListeners;
        }

        List<EntityLifecycleListener<Object>> all = new ArrayList<>(globalListeners.size() + typed.size());
        all.addAll(globalListeners);
        all.addAll(typed);
        return all;
    }
}
