package io.github.flameyossnowy.tally.api.meta;

import io.github.flameyossnowy.tally.api.annotations.Counter;
import io.github.flameyossnowy.tally.api.annotations.Id;
import io.github.flameyossnowy.tally.api.annotations.ManyToMany;
import io.github.flameyossnowy.tally.api.annotations.ManyToOne;
import io.github.flameyossnowy.tally.api.annotations.OneToOne;
import io.github.flameyossnowy.tally.api.annotations.RelationCounter;
import io.github.flameyossnowy.tally.api.value.CounterInitializer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;

/**
 * {@link FieldModel} backed by a {@link Field} and the annotations found on it.
 */
final class ReflectiveFieldModel<T> implements FieldModel<T> {
    private final Field field;
    private final boolean id;
    private final boolean autoIncrement;
    private final RelationshipKind relationshipKind;
    private final CounterKind counterKind;
    private final String counterRelation;
    private final CounterInitializer<T> initializer;
    private final String defaultValue;

    ReflectiveFieldModel(@NotNull Field field) {
        this.field = field;
        field.setAccessible(true);

        Id idAnnotation = field.getAnnotation(Id.class);
        this.id = idAnnotation != null;
        this.autoIncrement = id && idAnnotation.autoIncrement()
            && (field.getType() == Long.class || field.getType() == Integer.class);

        if (field.isAnnotationPresent(ManyToMany.class)) {
            this.relationshipKind = RelationshipKind.MANY_TO_MANY;
        } else if (field.isAnnotationPresent(ManyToOne.class)) {
            this.relationshipKind = RelationshipKind.MANY_TO_ONE;
        } else if (field.isAnnotationPresent(OneToOne.class)) {
            this.relationshipKind = RelationshipKind.ONE_TO_ONE;
        } else {
            this.relationshipKind = null;
        }

        RelationCounter relationCounter = field.getAnnotation(RelationCounter.class);
        Counter counter = field.getAnnotation(Counter.class);

        if (relationCounter != null && counter != null) {
            throw new IllegalStateException("Field " + describe() + " cannot be both @Counter and @RelationCounter");
        }

        if ((relationCounter != null || counter != null) && field.getType() != Integer.class) {
            throw new IllegalStateException("Counter field " + describe() + " must be declared as Integer");
        }

        if (relationCounter != null) {
            this.counterKind = CounterKind.RELATION_COUNTER;
            this.counterRelation = relationCounter.value();
            this.initializer = null;
            this.defaultValue = null;
        } else if (counter != null) {
            this.counterKind = CounterKind.COUNTER;
            this.counterRelation = null;
            this.initializer = instantiate(counter.initializer());
            this.defaultValue = counter.defaultValue().isEmpty() ? null : counter.defaultValue();
        } else {
            this.counterKind = CounterKind.NONE;
            this.counterRelation = null;
            this.initializer = null;
            this.defaultValue = null;
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private @Nullable CounterInitializer<T> instantiate(Class<? extends CounterInitializer> type) {
        if (type == CounterInitializer.None.class) {
            return null;
        }

        try {
            var constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot instantiate initializer " + type.getName() + " for " + describe(), e);
        }
    }

    private String describe() {
        return field.getDeclaringClass().getSimpleName() + '.' + field.getName();
    }

    Field field() {
        return field;
    }

    @Override
    public String name() {
        return field.getName();
    }

    @Override
    public Class<?> type() {
        return field.getType();
    }

    @Override
    public boolean id() {
        return id;
    }

    @Override
    public boolean autoIncrement() {
        return autoIncrement;
    }

    @Override
    public boolean relationship() {
        return relationshipKind != null;
    }

    @Override
    public @Nullable RelationshipKind relationshipKind() {
        return relationshipKind;
    }

    @Override
    public CounterKind counterKind() {
        return counterKind;
    }

    @Override
    public @Nullable String counterRelation() {
        return counterRelation;
    }

    @Override
    public @Nullable CounterInitializer<T> counterInitializer() {
        return initializer;
    }

    @Override
    public @Nullable String defaultValue() {
        return defaultValue;
    }

    @Override
    public Object getValue(T entity) {
        try {
            return field.get(entity);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read " + describe(), e);
        }
    }

    @Override
    public void setValue(T entity, Object value) {
        try {
            field.set(entity, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot write " + describe(), e);
        }
    }

    @Override
    public String toString() {
        return "FieldModel[" + describe() + ", counter=" + counterKind + ']';
    }
}
