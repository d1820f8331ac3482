import io.github.flameyossnowy.tally.api.annotations.Counter;
import io.github.flameyossnowy.tally.api.annotations.Id;
import io.github.flameyossnowy.tally.api.annotations.RelationCounter;
import io.github.flameyossnowy.tally.api.exceptions.RelationConfigurationException;
import io.github.flameyossnowy.tally.api.meta.CounterKind;
import io.github.flameyossnowy.tally.api.meta.FieldModel;
import io.github.flameyossnowy.tally.api.meta.MetadataRegistry;
import io.github.flameyossnowy.tally.api.meta.RelationshipKind;
import io.github.flameyossnowy.tally.api.meta.RelationshipModel;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetadataRegistryTest {
    MetadataRegistry metadata;

    @BeforeEach
    void setup() {
        metadata = new MetadataRegistry().register(Post.class, Label.class, Reply.class);
    }

    @Test
    void counterFieldsAreClassified() {
        RepositoryModel<Post, Long> model = metadata.require(Post.class);

        assertEquals(Long.class, model.getIdClass());
        assertEquals("id", model.getPrimaryKey().name());
        assertEquals(List.of("labelCount", "likes", "score", "labelTotal"),
            model.counterFields().stream().map(FieldModel::name).toList());
        assertEquals(CounterKind.RELATION_COUNTER, model.fieldByName("labelCount").counterKind());
        assertEquals("labels", model.fieldByName("labelCount").counterRelation());
        assertNull(model.fieldByName("likes").counterInitializer());
        assertNotNull(model.fieldByName("score").counterInitializer());
        assertEquals(CounterKind.NONE, model.fieldByName("labels").counterKind());
    }

    @Test
    void forwardManyToManyIsOwningCollection() {
        RelationshipModel<Post> labels = metadata.relationship(Post.class, "labels");

        assertEquals(RelationshipKind.MANY_TO_MANY, labels.relationshipKind());
        assertTrue(labels.isOwning());
        assertTrue(labels.isCollection());
        assertEquals(Label.class, labels.targetEntityType());
        assertEquals("posts", labels.relatedName());
        assertNull(labels.joinField());
    }

    @Test
    void reverseManyToManyIsResolvedFromTarget() {
        RelationshipModel<Label> posts = metadata.relationship(Label.class, "posts");

        assertEquals(RelationshipKind.MANY_TO_MANY, posts.relationshipKind());
        assertFalse(posts.isOwning());
        assertEquals(Label.class, posts.declaringEntityType());
        assertEquals(Post.class, posts.targetEntityType());
        assertEquals("labels", posts.relatedName());
        assertEquals(metadata.relationship(Post.class, "labels").linkName(), posts.linkName());
    }

    @Test
    void reverseForeignKeyIsOneToMany() {
        RelationshipModel<Post> replies = metadata.relationship(Post.class, "replies");

        assertEquals(RelationshipKind.ONE_TO_MANY, replies.relationshipKind());
        assertFalse(replies.isOwning());
        assertTrue(replies.isCollection());
        assertEquals(Reply.class, replies.targetEntityType());
        assertEquals("post", replies.joinField());

        RelationshipModel<Reply> post = metadata.relationship(Reply.class, "post");
        assertEquals(RelationshipKind.MANY_TO_ONE, post.relationshipKind());
        assertFalse(post.isCollection());
    }

    @Test
    void unknownRelationIsAConfigurationError() {
        RelationConfigurationException e = assertThrows(RelationConfigurationException.class,
            () -> metadata.relationship(Post.class, "nope"));

        assertEquals(Post.class, e.getEntityType());
        assertEquals("nope", e.getRelationName());
    }

    @Test
    void unregisteredEntityIsRejected() {
        assertThrows(IllegalStateException.class, () -> metadata.require(String.class));
        assertThrows(RelationConfigurationException.class, () -> metadata.relationship(String.class, "x"));
    }

    @Test
    void counterMustBeDeclaredAsInteger() {
        assertThrows(IllegalStateException.class, () -> new MetadataRegistry().register(PrimitiveCounter.class));
    }

    @Test
    void counterAndRelationCounterCannotBeCombined() {
        assertThrows(IllegalStateException.class, () -> new MetadataRegistry().register(DoubleCounter.class));
    }

    @Test
    void entityNeedsAnId() {
        assertThrows(IllegalStateException.class, () -> new MetadataRegistry().register(NoId.class));
    }

    @Test
    void registeringTwiceKeepsTheFirstModel() {
        RepositoryModel<Post, Long> first = metadata.require(Post.class);
        metadata.register(Post.class);
        assertSame(first, metadata.require(Post.class));
    }

    public static class PrimitiveCounter {
        @Id
        private Long id;

        @Counter
        private int hits;
    }

    public static class DoubleCounter {
        @Id
        private Long id;

        @Counter
        @RelationCounter("things")
        private Integer things;
    }

    public static class NoId {
        @Counter
        private Integer hits;
    }
}
