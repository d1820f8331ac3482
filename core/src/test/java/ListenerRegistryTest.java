import io.github.flameyossnowy.tally.api.listener.EntityLifecycleListener;
import io.github.flameyossnowy.tally.api.listener.ListenerRegistry;
import io.github.flameyossnowy.tally.api.listener.RelationAction;
import io.github.flameyossnowy.tally.api.listener.RelationChangeEvent;
import io.github.flameyossnowy.tally.api.listener.RelationChangeListener;
import io.github.flameyossnowy.tally.api.listener.Subscription;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ListenerRegistryTest {

    @Test
    void globalListenersRunBeforeTypedOnes() {
        ListenerRegistry registry = new ListenerRegistry();
        List<String> calls = new ArrayList<>();

        registry.addEntityListener(Post.class, new EntityLifecycleListener<Post>() {
            @Override
            public void onPostSave(Post entity, boolean created) {
                calls.add("typed:" + created);
            }
        });
        registry.addGlobalListener(new EntityLifecycleListener<>() {
            @Override
            public void onPostSave(Object entity, boolean created) {
                calls.add("global:" + created);
            }
        });

        registry.firePostSave(new Post(1L), true);
        registry.firePostSave(new Label(1L), false);

        assertEquals(List.of("global:true", "typed:true", "global:false"), calls);
    }

    @Test
    @SuppressWarnings("unchecked")
    void closedSubscriptionStopsDelivery() {
        ListenerRegistry registry = new ListenerRegistry();
        EntityLifecycleListener<Post> listener = mock(EntityLifecycleListener.class);

        Subscription subscription = registry.addEntityListener(Post.class, listener);
        Post post = new Post(1L);
        registry.firePostLoad(post);

        subscription.close();
        subscription.close();
        registry.firePostLoad(post);

        verify(listener, times(1)).onPostLoad(post);
    }

    @Test
    void relationEventsAreRoutedByLinkName() {
        ListenerRegistry registry = new ListenerRegistry();
        RelationChangeListener tags = mock(RelationChangeListener.class);
        RelationChangeListener other = mock(RelationChangeListener.class);

        registry.addRelationListener("Post#labels", tags);
        registry.addRelationListener("Post#other", other);

        RelationChangeEvent event = new RelationChangeEvent(
            "Post#labels", RelationAction.MEMBERS_ADDED, false, new Post(1L), Label.class, Set.of(2L));
        registry.fireRelationChanged(event);

        verify(tags).onRelationChanged(event);
        verifyNoInteractions(other);
        assertTrue(registry.hasRelationListeners("Post#labels"));
        assertFalse(registry.hasRelationListeners("Post#nothing"));
    }

    @Test
    void listenerExceptionsReachThePublisher() {
        ListenerRegistry registry = new ListenerRegistry();
        registry.addGlobalListener(new EntityLifecycleListener<>() {
            @Override
            public void onPreDelete(Object entity) {
                throw new IllegalStateException("boom");
            }
        });

        assertThrows(IllegalStateException.class, () -> registry.firePreDelete(new Post(1L)));
    }
}
