package io.github.flameyossnowy.tally.counter;

import io.github.flameyossnowy.tally.api.listener.EntityLifecycleListener;
import io.github.flameyossnowy.tally.api.listener.RelationChangeEvent;
import io.github.flameyossnowy.tally.api.listener.Subscription;
import io.github.flameyossnowy.tally.api.meta.FieldModel;
import io.github.flameyossnowy.tally.api.meta.RelationshipModel;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import io.github.flameyossnowy.tally.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps the relation counters of one (owner type, relation name) pair in sync with the
 * relation's notifications.
 * <p>
 * For every change, exactly one loaded representation of each affected row receives a real
 * write, which is then copied to the row's other representations. Rows with nothing loaded are
 * updated by id without being loaded.
 * <p>
 * Many-to-many links publish changes from both of their ends on one channel, so a tracker only
 * handles changes made from its own end: the forward tracker of a link handles changes made
 * through the declaring side, and the reverse tracker those made through the other side. Each
 * updates both ends.
 * <p>
 * Store failures are not caught; they surface to whoever mutated the relation.
 */
public final class RelationTracker {
    private final RelationCounterRegistry registry;
    private final Class<?> ownerType;
    private final String relationName;
    private final RelationshipModel<?> relationship;
    private final RelationClassification classification;
    private final RepositoryModel<Object, Object> ownerModel;

    private final List<Subscription> subscriptions = new ArrayList<>(2);

    /**
     * @throws io.github.flameyossnowy.tally.api.exceptions.RelationConfigurationException
     *         if the relation does not exist or is single-valued on the owner's side
     */
    RelationTracker(@NotNull RelationCounterRegistry registry, @NotNull Class<?> ownerType, @NotNull String relationName) {
        this.registry = registry;
        this.ownerType = ownerType;
        this.relationName = relationName;
        this.relationship = registry.store().metadata().relationship(ownerType, relationName);
        this.classification = RelationClassification.of(relationship);
        this.ownerModel = registry.erasedModel(ownerType);
    }

    public Class<?> ownerType() {
        return ownerType;
    }

    public String relationName() {
        return relationName;
    }

    public RelationClassification classification() {
        return classification;
    }

    /**
     * The entity type on the other end of the relation.
     */
    public Class<?> memberType() {
        return relationship.targetEntityType();
    }

    /**
     * The relation's name as seen from {@link #memberType()}.
     */
    public String relatedName() {
        return relationship.relatedName();
    }

    void subscribe() {
        if (classification == RelationClassification.REVERSE_SINGLE) {
            subscriptions.add(registry.store().listeners().addEntityListener(
                relationship.targetEntityType(), new MemberListener()));
        } else {
            subscriptions.add(registry.store().listeners().addRelationListener(
                relationship.linkName(), this::onRelationChanged));
        }
    }

    void unsubscribe() {
        for (Subscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
    }

    void onRelationChanged(@NotNull RelationChangeEvent event) {
        if (event.reverse() != classification.isReverse()) {
            return;
        }

        Object ownerId = ownerModel.getPrimaryKeyValue(event.instance());
        if (ownerId == null) {
            throw new IllegalStateException("Relation '" + relationName + "' changed on an unsaved " + ownerModel.entitySimpleName());
        }

        Logging.deepInfo(() -> event.action() + " on " + ownerModel.entitySimpleName() + '[' + ownerId + "]." + relationName
            + (event.memberIds() == null ? "" : " " + event.memberIds()));

        switch (event.action()) {
            case MEMBERS_ADDED -> onMembersChanged(ownerId, event.memberIds(), 1);
            case MEMBERS_REMOVED -> onMembersChanged(ownerId, event.memberIds(), -1);
            case PRE_CLEAR -> onPreClear(ownerId);
            case POST_CLEAR -> onPostClear(ownerId, event.memberIds());
        }
    }

    private void onMembersChanged(Object ownerId, @Nullable Set<Object> memberIds, int sign) {
        if (memberIds == null || memberIds.isEmpty()) {
            return;
        }

        applyToOwner(ownerId, sign * memberIds.size());
        applyToMembers(memberIds, sign);
    }

    private void onPreClear(Object ownerId) {
        List<InstanceState> states = registry.stateRegistry().getSavedStates(ownerType, ownerId, relationName);
        if (states.isEmpty()) {
            return;
        }

        Set<Object> ids = registry.store().memberIds(ownerType, ownerId, relationName);
        states.get(0).cachePendingClear(ids);
    }

    private void onPostClear(Object ownerId, @Nullable Set<Object> reportedIds) {
        List<InstanceState> states = registry.stateRegistry().getSavedStates(ownerType, ownerId, relationName);
        Set<Object> ids = reportedIds;

        if (states.isEmpty()) {
            registry.counters().zeroCounts(ownerType, ownerId, ownerFieldNames());
        } else {
            Set<Object> cached = new LinkedHashSet<>();
            for (InstanceState state : states) {
                cached.addAll(state.consumePendingClear());
            }

            states.get(0).zeroFields();

            if (ids == null) {
                ids = cached;
            }
        }

        if (ids != null && !ids.isEmpty()) {
            applyToMembers(ids, -1);
        }
    }

    /**
     * Adds {@code delta} to the owner's counters for this relation.
     */
    void applyToOwner(@NotNull Object ownerId, int delta) {
        List<InstanceState> states = registry.stateRegistry().getSavedStates(ownerType, ownerId, relationName);
        if (!states.isEmpty()) {
            states.get(0).incrementFields(delta);
            return;
        }

        registry.counters().updateCounts(ownerType, List.of(ownerId), ownerFieldNames(), delta);
    }

    /**
     * Adds {@code sign} to the reciprocal counters of every member in {@code memberIds}.
     */
    void applyToMembers(@NotNull Collection<Object> memberIds, int sign) {
        Class<?> memberType = relationship.targetEntityType();
        String reciprocal = relationship.relatedName();

        List<String> fieldNames = registry.relationCounterFieldNames(memberType, reciprocal);
        if (fieldNames.isEmpty()) {
            return;
        }

        List<Object> unloaded = new ArrayList<>(memberIds.size());
        for (Object memberId : memberIds) {
            List<InstanceState> states = registry.stateRegistry().getSavedStates(memberType, memberId, reciprocal);
            if (states.isEmpty()) {
                unloaded.add(memberId);
            } else {
                states.get(0).incrementFields(sign);
            }
        }

        registry.counters().updateCounts(memberType, unloaded, fieldNames, sign);
    }

    private List<String> ownerFieldNames() {
        return registry.relationCounterFieldNames(ownerType, relationName);
    }

    private @Nullable Object ownerIdOf(Object member) {
        String joinField = relationship.joinField();
        if (joinField == null) {
            return null;
        }

        RepositoryModel<Object, Object> memberModel = registry.erasedModel(member.getClass());
        FieldModel<Object> field = memberModel.fieldByName(joinField);
        return field == null ? null : field.getValue(member);
    }

    @Override
    public String toString() {
        return "RelationTracker[" + ownerType.getSimpleName() + '.' + relationName + ", " + classification + ']';
    }

    /**
     * Follows the rows referencing an owner through a foreign key.
     */
    private final class MemberListener implements EntityLifecycleListener<Object> {
        @Override
        public void onPostSave(Object member, boolean created) {
            if (!created) {
                return;
            }

            Object ownerId = ownerIdOf(member);
            if (ownerId != null) {
                applyToOwner(ownerId, 1);
            }
        }

        @Override
        public void onPostDelete(Object member) {
            Object ownerId = ownerIdOf(member);
            if (ownerId != null) {
                applyToOwner(ownerId, -1);
            }
        }
    }
}
