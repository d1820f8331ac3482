import io.github.flameyossnowy.tally.api.exceptions.RelationConfigurationException;
import io.github.flameyossnowy.tally.api.meta.MetadataRegistry;
import io.github.flameyossnowy.tally.counter.InstanceState;
import io.github.flameyossnowy.tally.counter.RelationCounterRegistry;
import io.github.flameyossnowy.tally.memory.MemoryRelation;
import io.github.flameyossnowy.tally.memory.MemoryRepositoryAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.ref.WeakReference;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class RelationCounterSyncTest {
    MetadataRegistry metadata;
    MemoryRepositoryAdapter store;
    RelationCounterRegistry registry;

    @BeforeEach
    void setup() {
        metadata = new MetadataRegistry().register(Article.class, Tag.class, Comment.class);
        store = MemoryRepositoryAdapter.builder(metadata).build();
        registry = RelationCounterRegistry.builder(store).build();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void insertedEntitiesStartAtZero() {
        Article article = store.insert(new Article("First"));

        assertEquals(0, article.getTagCount());
        assertEquals(0, article.getCommentCount());
        assertEquals(0, stored(Article.class, article.getId(), "tagCount"));
    }

    @Test
    void addingFromDeclaringSideUpdatesBothEnds() {
        Article article = store.insert(new Article("First"));
        Tag java = store.insert(new Tag("java"));
        Tag maven = store.insert(new Tag("maven"));

        store.relation(article, "tags").add(java, maven);

        assertEquals(2, article.getTagCount());
        assertEquals(2, article.getTagCount2());
        assertEquals(1, java.getArticleCount());
        assertEquals(1, java.getArticleCount2());
        assertEquals(1, maven.getArticleCount());
        assertEquals(2, stored(Article.class, article.getId(), "tagCount"));
        assertEquals(1, stored(Tag.class, maven.getId(), "articleCount2"));
    }

    @Test
    void addingFromReverseSideUpdatesBothEnds() {
        Article first = store.insert(new Article("First"));
        Article second = store.insert(new Article("Second"));
        Tag java = store.insert(new Tag("java"));

        store.relation(java, "articles").add(first, second);

        assertEquals(2, java.getArticleCount());
        assertEquals(1, first.getTagCount());
        assertEquals(1, second.getTagCount2());
        assertEquals(1, stored(Article.class, second.getId(), "tagCount"));
    }

    @Test
    void removingFromReverseSideUpdatesBothEnds() {
        Article first = store.insert(new Article("First"));
        Article second = store.insert(new Article("Second"));
        Tag java = store.insert(new Tag("java"));
        MemoryRelation<Tag> articles = store.relation(java, "articles");
        articles.add(first, second);

        articles.remove(first);

        assertEquals(1, java.getArticleCount());
        assertEquals(1, java.getArticleCount2());
        assertEquals(0, first.getTagCount());
        assertEquals(0, first.getTagCount2());
        assertEquals(1, second.getTagCount());
        assertEquals(0, stored(Article.class, first.getId(), "tagCount"));
        assertEquals(1, stored(Tag.class, java.getId(), "articleCount"));
    }

    @Test
    void clearingFromReverseSideUpdatesEveryRepresentation() {
        Tag tag = store.insert(new Tag("java"));
        Tag tagCopy = store.findById(Tag.class, tag.getId());
        Article first = store.insert(new Article("First"));
        Article firstCopy = store.findById(Article.class, first.getId());
        Article second = store.insert(new Article("Second"));
        store.relation(tag, "articles").add(first, second);
        assertEquals(2, tagCopy.getArticleCount());
        assertEquals(1, firstCopy.getTagCount());
        store.statistics().reset();

        store.relation(tagCopy, "articles").clear();

        assertEquals(0, tag.getArticleCount());
        assertEquals(0, tagCopy.getArticleCount2());
        assertEquals(0, first.getTagCount());
        assertEquals(0, firstCopy.getTagCount());
        assertEquals(0, firstCopy.getTagCount2());
        assertEquals(0, second.getTagCount());
        assertEquals(0, stored(Tag.class, tag.getId(), "articleCount"));
        assertEquals(0, stored(Article.class, first.getId(), "tagCount2"));
        assertEquals(3, store.statistics().counterWrites());
    }

    @Test
    void clearingFromReverseSideReachesUnloadedMembers() {
        Tag tag = store.insert(new Tag("java"));
        Article first = store.insert(new Article("First"));
        Article second = store.insert(new Article("Second"));
        store.relation(tag, "articles").add(first, second);
        registry.reset();

        Tag loaded = store.findById(Tag.class, tag.getId());
        store.statistics().reset();
        store.relation(loaded, "articles").clear();

        assertEquals(0, loaded.getArticleCount());
        assertEquals(0, stored(Article.class, first.getId(), "tagCount"));
        assertEquals(0, stored(Article.class, second.getId(), "tagCount2"));
        assertEquals(1, first.getTagCount());
        assertEquals(2, store.statistics().counterWrites());
    }

    @Test
    void clearingUnloadedReverseOwnerZeroesItByKey() {
        Tag tag = store.insert(new Tag("java"));
        Article article = store.insert(new Article("First"));
        store.relation(tag, "articles").add(article);
        registry.reset();

        store.relation(tag, "articles").clear();

        assertEquals(0, stored(Tag.class, tag.getId(), "articleCount"));
        assertEquals(0, stored(Tag.class, tag.getId(), "articleCount2"));
        assertEquals(1, stored(Article.class, article.getId(), "tagCount"));

        Article loaded = store.findById(Article.class, article.getId());
        store.statistics().reset();
        registry.counters(Article.class).relationField("tagCount").reinit(loaded);

        assertEquals(0, loaded.getTagCount());
        assertEquals(1, store.statistics().counterWrites());
        assertEquals(1, store.statistics().reads());
        assertEquals(0, stored(Article.class, article.getId(), "tagCount"));
    }

    @Test
    void removingCountsOnlyLinkedMembers() {
        Article article = store.insert(new Article("First"));
        Tag java = store.insert(new Tag("java"));
        Tag maven = store.insert(new Tag("maven"));
        Tag gradle = store.insert(new Tag("gradle"));
        MemoryRelation<Article> tags = store.relation(article, "tags");
        tags.add(java, maven);

        tags.remove(maven, gradle);

        assertEquals(1, article.getTagCount());
        assertEquals(1, java.getArticleCount());
        assertEquals(0, maven.getArticleCount());
        assertEquals(0, gradle.getArticleCount());
    }

    @Test
    void loadedRepresentationsShareOneWrite() {
        Article first = store.insert(new Article("First"));
        Article second = store.findById(Article.class, first.getId());
        Tag tag = store.insert(new Tag("java"));
        store.statistics().reset();

        store.relation(first, "tags").add(tag);

        assertEquals(1, first.getTagCount());
        assertEquals(1, second.getTagCount());
        assertEquals(1, second.getTagCount2());
        assertEquals(1, tag.getArticleCount());
        assertEquals(2, store.statistics().counterWrites());
        assertEquals(2, registry.stateRegistry().getSavedStates(Article.class, first.getId(), "tags").size());
    }

    @Test
    void twoRepresentationsScenario() {
        Article first = store.insert(new Article("Owner"));
        Article second = store.findById(Article.class, first.getId());
        Tag member = store.insert(new Tag("member"));

        store.relation(first, "tags").add(member);
        assertEquals(1, first.getTagCount());
        assertEquals(1, second.getTagCount());
        assertEquals(1, member.getArticleCount());

        store.relation(second, "tags").remove(member);
        assertEquals(0, first.getTagCount());
        assertEquals(0, second.getTagCount());
        assertEquals(0, member.getArticleCount());

        Long javaId = store.insert(new Tag("java")).getId();
        Long mavenId = store.insert(new Tag("maven")).getId();
        store.relation(second, "tags").add(javaId, mavenId);
        store.relation(first, "tags").clear();

        assertEquals(0, first.getTagCount());
        assertEquals(0, second.getTagCount());

        Tag java = store.findById(Tag.class, javaId);
        registry.counters(Tag.class).relationField("articleCount").reinit(java);
        assertEquals(0, java.getArticleCount());
        assertEquals(0, stored(Tag.class, mavenId, "articleCount"));
    }

    @Test
    void clearingLoadedOwnerDecrementsEveryMember() {
        Article article = store.insert(new Article("First"));
        Tag java = store.insert(new Tag("java"));
        Tag maven = store.insert(new Tag("maven"));
        MemoryRelation<Article> tags = store.relation(article, "tags");
        tags.add(java, maven);

        tags.clear();

        assertEquals(0, article.getTagCount());
        assertEquals(0, article.getTagCount2());
        assertEquals(0, java.getArticleCount());
        assertEquals(0, maven.getArticleCount2());
        assertTrue(registry.stateRegistry().getSavedStates(Article.class, article.getId(), "tags").get(0).consumePendingClear().isEmpty());
    }

    @Test
    void clearingUnloadedOwnerZeroesItByKey() {
        Article article = store.insert(new Article("First"));
        Tag java = store.insert(new Tag("java"));
        store.relation(article, "tags").add(java);
        registry.reset();

        store.relation(article, "tags").clear();

        assertEquals(0, stored(Article.class, article.getId(), "tagCount"));
        assertEquals(0, stored(Article.class, article.getId(), "tagCount2"));
        // No ids were captured, so the member stays stale until recomputed.
        assertEquals(1, stored(Tag.class, java.getId(), "articleCount"));

        Tag loaded = store.findById(Tag.class, java.getId());
        registry.counters(Tag.class).relationField("articleCount").reinit(loaded);

        assertEquals(0, loaded.getArticleCount());
        assertEquals(0, stored(Tag.class, java.getId(), "articleCount"));
    }

    @Test
    void reportedClearIdsReachUnloadedMembers() {
        MemoryRepositoryAdapter reporting = MemoryRepositoryAdapter.builder(metadata)
            .withReportClearedIds(true)
            .build();

        try (RelationCounterRegistry counters = RelationCounterRegistry.builder(reporting).build()) {
            Article article = reporting.insert(new Article("First"));
            Tag java = reporting.insert(new Tag("java"));
            Tag maven = reporting.insert(new Tag("maven"));
            reporting.relation(article, "tags").add(java, maven);
            counters.reset();

            reporting.relation(article, "tags").clear();

            assertEquals(0, reporting.readFields(Article.class, article.getId(), List.of("tagCount")).get("tagCount"));
            assertEquals(0, reporting.readFields(Tag.class, java.getId(), List.of("articleCount")).get("articleCount"));
            assertEquals(0, reporting.readFields(Tag.class, maven.getId(), List.of("articleCount2")).get("articleCount2"));
        }
    }

    @Test
    void foreignKeyRowsAreCounted() {
        Article article = store.insert(new Article("First"));

        Comment first = store.insert(new Comment(article.getId(), "One"));
        store.insert(new Comment(article.getId(), "Two"));
        assertEquals(2, article.getCommentCount());
        assertEquals(2, article.getCommentCount2());

        first.setBody("Edited");
        store.update(first);
        assertEquals(2, article.getCommentCount());

        store.delete(first);
        assertEquals(1, article.getCommentCount());
        assertEquals(1, stored(Article.class, article.getId(), "commentCount"));
    }

    @Test
    void deletingForeignKeyRowUpdatesEveryOwnerRepresentation() {
        Article article = store.insert(new Article("First"));
        Article copy = store.findById(Article.class, article.getId());
        Comment first = store.insert(new Comment(article.getId(), "One"));
        store.insert(new Comment(article.getId(), "Two"));
        assertEquals(2, copy.getCommentCount());
        store.statistics().reset();

        store.delete(first);

        assertEquals(1, article.getCommentCount());
        assertEquals(1, article.getCommentCount2());
        assertEquals(1, copy.getCommentCount());
        assertEquals(1, copy.getCommentCount2());
        assertEquals(1, stored(Article.class, article.getId(), "commentCount"));
        assertEquals(1, store.statistics().counterWrites());
        assertEquals(1, store.statistics().rowWrites());
    }

    @Test
    void foreignKeyRowsReachUnloadedOwner() {
        Article article = store.insert(new Article("First"));
        registry.reset();

        store.insert(new Comment(article.getId(), "One"));

        assertEquals(0, article.getCommentCount());
        assertEquals(1, stored(Article.class, article.getId(), "commentCount"));
        assertEquals(1, store.findById(Article.class, article.getId()).getCommentCount2());
    }

    @Test
    void firstPersistReplacesUnsavedState() {
        Article article = new Article("Draft");

        assertEquals(0, registry.field(Article.class, "tagCount").value(article));
        assertNotNull(registry.stateRegistry().getUnsavedState(article));

        store.insert(article);

        assertNull(registry.stateRegistry().getUnsavedState(article));
        List<InstanceState> states = registry.stateRegistry().getSavedStates(Article.class, article.getId(), "tags");
        assertEquals(1, states.size());
        assertSame(article, states.get(0).entity());
        assertEquals(List.of("tagCount", "tagCount2"), states.get(0).fieldNames());
        assertEquals(1, registry.stateRegistry().getSavedStates(Article.class, article.getId(), "comments").size());

        store.relation(article, "tags").add(store.insert(new Tag("java")));
        assertEquals(1, article.getTagCount());
    }

    @Test
    void reusedKeyStartsFresh() {
        Article article = store.insert(new Article("First"));
        Long id = article.getId();
        Tag tag = store.insert(new Tag("java"));
        store.relation(article, "tags").add(tag);

        store.delete(article);
        assertTrue(registry.stateRegistry().getSavedStates(Article.class, id, "tags").isEmpty());

        Article replacement = new Article("Replacement");
        replacement.setId(id);
        store.insert(replacement);
        assertEquals(0, replacement.getTagCount());

        store.relation(replacement, "tags").add(tag);

        assertEquals(1, replacement.getTagCount());
        assertEquals(1, article.getTagCount());
        assertEquals(List.of(replacement), registry.stateRegistry().getSavedStates(Article.class, id, "tags")
            .stream().map(InstanceState::entity).toList());
    }

    @Test
    void countersMissingFromStorageAreComputedOnLoad() {
        MemoryRepositoryAdapter untracked = MemoryRepositoryAdapter.builder(metadata).build();
        Article article = untracked.insert(new Article("First"));
        untracked.relation(article, "tags").add(untracked.insert(new Tag("java")), untracked.insert(new Tag("maven")));
        untracked.insert(new Comment(article.getId(), "One"));
        assertNull(untracked.readFields(Article.class, article.getId(), List.of("tagCount")).get("tagCount"));

        try (RelationCounterRegistry counters = RelationCounterRegistry.builder(untracked).build()) {
            Article loaded = untracked.findById(Article.class, article.getId());

            assertEquals(2, loaded.getTagCount());
            assertEquals(2, loaded.getTagCount2());
            assertEquals(1, loaded.getCommentCount());
            assertEquals(2, untracked.readFields(Article.class, article.getId(), List.of("tagCount")).get("tagCount"));
            assertTrue(counters.reentryGuard().isEmpty());
        }
    }

    @Test
    void collectedRepresentationsAreSwept() throws InterruptedException {
        Long[] id = new Long[1];
        WeakReference<Article> reference = insertUnreferenced(id);

        for (int i = 0; i < 50 && reference.get() != null; i++) {
            System.gc();
            Thread.sleep(10);
        }
        assumeTrue(reference.get() == null, "Garbage collector did not run");

        assertFalse(registry.hasTrackedStates());

        Tag tag = store.insert(new Tag("java"));
        store.relation(tag, "articles").add(id[0]);

        assertEquals(1, tag.getArticleCount());
        assertEquals(1, stored(Article.class, id[0], "tagCount"));
    }

    @Test
    void closedRegistryStopsTracking() {
        Article article = store.insert(new Article("First"));
        Tag tag = store.insert(new Tag("java"));

        registry.close();
        store.relation(article, "tags").add(tag);

        assertEquals(0, article.getTagCount());
        assertEquals(0, stored(Article.class, article.getId(), "tagCount"));
        assertFalse(registry.hasTrackedStates());
    }

    @Test
    void countingSingleValuedRelationIsRejected() {
        MetadataRegistry invalid = new MetadataRegistry().register(Article.class, Tag.class, Comment.class, BadComment.class);
        MemoryRepositoryAdapter adapter = MemoryRepositoryAdapter.builder(invalid).build();

        assertThrows(RelationConfigurationException.class, () -> RelationCounterRegistry.builder(adapter).build());
        assertFalse(adapter.listeners().hasRelationListeners(invalid.relationship(Article.class, "tags").linkName()));

        try (RelationCounterRegistry lazy = RelationCounterRegistry.builder(adapter).withEagerValidation(false).build()) {
            assertNotNull(lazy.counters(Article.class));
            assertThrows(RelationConfigurationException.class, () -> lazy.counters(BadComment.class));
        }
    }

    private WeakReference<Article> insertUnreferenced(Long[] id) {
        Article article = store.insert(new Article("Temporary"));
        id[0] = article.getId();
        assertTrue(registry.hasTrackedStates());
        return new WeakReference<>(article);
    }

    private Object stored(Class<?> type, Object id, String field) {
        return store.readFields(type, id, List.of(field)).get(field);
    }
}
