package io.github.flameyossnowy.tally.api.exceptions;

/**
 * Thrown when a relation or counter is declared in a way that can never work, such as a
 * relation counter on the single-valued side of a link. Raised when the entity is registered,
 * never retried.
 */
public class RelationConfigurationException extends RuntimeException {
    private final Class<?> entityType;
    private final String relationName;

    public RelationConfigurationException(String message, Class<?> entityType, String relationName) {
        super(message);
        this.entityType = entityType;
        this.relationName = relationName;
    }

    public RelationConfigurationException(String message, Class<?> entityType, String relationName, Throwable cause) {
        super(message, cause);
        this.entityType = entityType;
        this.relationName = relationName;
    }

    public Class<?> getEntityType() {
        return entityType;
    }

    public String getRelationName() {
        return relationName;
    }
}
