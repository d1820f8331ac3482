package io.github.flameyossnowy.tally.api.meta;

import org.jetbrains.annotations.Nullable;

/**
 * Immutable {@link RelationshipModel}. Forward sides are built from field annotations, reverse
 * sides by {@link #reverse()}.
 */
record DeclaredRelationship<T>(
    String fieldName,
    RelationshipKind relationshipKind,
    boolean isOwning,
    boolean isCollection,
    Class<T> declaringEntityType,
    Class<?> targetEntityType,
    String relatedName,
    String linkName,
    @Nullable String joinField
) implements RelationshipModel<T> {

    static <T> DeclaredRelationship<T> forward(
        Class<T> declaringType,
        String fieldName,
        RelationshipKind kind,
        Class<?> targetType,
        String relatedName
    ) {
        String related = relatedName == null || relatedName.isBlank()
            ? defaultRelatedName(declaringType)
            : relatedName;

        return new DeclaredRelationship<>(
            fieldName,
            kind,
            true,
            kind == RelationshipKind.MANY_TO_MANY,
            declaringType,
            targetType,
            related,
            declaringType.getName() + '#' + fieldName,
            kind == RelationshipKind.MANY_TO_MANY ? null : fieldName
        );
    }

    @Override
    public RelationshipModel<?> reverse() {
        return reverseOf(targetEntityType);
    }

    private <R> DeclaredRelationship<R> reverseOf(Class<R> type) {
        RelationshipKind reverseKind = switch (relationshipKind) {
            case MANY_TO_ONE -> RelationshipKind.ONE_TO_MANY;
            case ONE_TO_MANY -> RelationshipKind.MANY_TO_ONE;
            case ONE_TO_ONE -> RelationshipKind.ONE_TO_ONE;
            case MANY_TO_MANY -> RelationshipKind.MANY_TO_MANY;
        };

        return new DeclaredRelationship<>(
            relatedName,
            reverseKind,
            !isOwning,
            reverseKind == RelationshipKind.MANY_TO_MANY || reverseKind == RelationshipKind.ONE_TO_MANY,
            type,
            declaringEntityType,
            fieldName,
            linkName,
            joinField
        );
    }

    private static String defaultRelatedName(Class<?> declaringType) {
        String simpleName = declaringType.getSimpleName();
        return Character.toLowerCase(simpleName.charAt(0)) + simpleName.substring(1) + "Set";
    }
}
