package io.github.flameyossnowy.tally.api.listener;

@FunctionalInterface
public interface RelationChangeListener {
    void onRelationChanged(RelationChangeEvent event);
}
