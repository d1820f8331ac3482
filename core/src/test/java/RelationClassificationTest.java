import io.github.flameyossnowy.tally.api.exceptions.RelationConfigurationException;
import io.github.flameyossnowy.tally.api.meta.MetadataRegistry;
import io.github.flameyossnowy.tally.counter.RelationClassification;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelationClassificationTest {
    final MetadataRegistry metadata = new MetadataRegistry().register(Post.class, Label.class, Reply.class);

    @Test
    void manyToManySidesAreMultiValued() {
        assertEquals(RelationClassification.FORWARD_MULTI, RelationClassification.of(metadata.relationship(Post.class, "labels")));
        assertEquals(RelationClassification.REVERSE_MULTI, RelationClassification.of(metadata.relationship(Label.class, "posts")));
    }

    @Test
    void reverseForeignKeyIsReverseSingle() {
        RelationClassification classification = RelationClassification.of(metadata.relationship(Post.class, "replies"));

        assertEquals(RelationClassification.REVERSE_SINGLE, classification);
        assertTrue(classification.isReverse());
        assertFalse(RelationClassification.FORWARD_MULTI.isReverse());
    }

    @Test
    void foreignKeySideCannotBeCounted() {
        RelationConfigurationException e = assertThrows(RelationConfigurationException.class,
            () -> RelationClassification.of(metadata.relationship(Reply.class, "post")));

        assertEquals(Reply.class, e.getEntityType());
        assertEquals("post", e.getRelationName());
    }

    @Test
    void oneToOneSidesCannotBeCounted() {
        assertThrows(RelationConfigurationException.class,
            () -> RelationClassification.of(metadata.relationship(Reply.class, "pinnedLabel")));
        assertThrows(RelationConfigurationException.class,
            () -> RelationClassification.of(metadata.relationship(Label.class, "pinnedReply")));
    }
}
