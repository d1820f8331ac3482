package io.github.flameyossnowy.tally.counter;

import io.github.flameyossnowy.tally.api.listener.EntityLifecycleListener;
import org.jetbrains.annotations.ApiStatus;

/**
 * Connects a store's lifecycle notifications to a {@link RelationCounterRegistry}.
 */
@ApiStatus.Internal
final class InstanceLifecycleListener implements EntityLifecycleListener<Object> {
    private final RelationCounterRegistry registry;

    InstanceLifecycleListener(RelationCounterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onPostLoad(Object entity) {
        registry.attach(entity);
    }

    @Override
    public void onPreInsert(Object entity) {
        registry.attach(entity);
    }

    @Override
    public void onPostSave(Object entity, boolean created) {
        if (created) {
            registry.onFirstPersist(entity);
        }
    }

    @Override
    public void onPreDelete(Object entity) {
        registry.onPreDelete(entity);
    }
}
