import io.github.flameyossnowy.tally.counter.ReentryGuard;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReentryGuardTest {

    @Test
    void secondAcquireOfSamePairIsRefused() {
        ReentryGuard guard = new ReentryGuard();
        Object entity = new Object();

        ReentryGuard.Token first = guard.tryAcquire(entity, "count");
        assertNotNull(first);
        assertNull(guard.tryAcquire(entity, "count"));
        assertTrue(guard.isHeld(entity, "count"));

        first.close();
        assertFalse(guard.isHeld(entity, "count"));
        assertTrue(guard.isEmpty());
    }

    @Test
    void otherFieldsOfSameEntityAreIndependent() {
        ReentryGuard guard = new ReentryGuard();
        Object entity = new Object();

        try (ReentryGuard.Token ignored = guard.tryAcquire(entity, "a")) {
            assertNotNull(guard.tryAcquire(entity, "b"));
        }
    }

    @Test
    void entitiesAreComparedByIdentity() {
        ReentryGuard guard = new ReentryGuard();
        Key left = new Key(1);
        Key right = new Key(1);
        assertEquals(left, right);

        ReentryGuard.Token token = guard.tryAcquire(left, "count");
        assertNotNull(token);
        assertFalse(guard.isHeld(right, "count"));
        assertNotNull(guard.tryAcquire(right, "count"));
    }

    @Test
    void closingTwiceDoesNotReleaseSomeoneElsesHold() {
        ReentryGuard guard = new ReentryGuard();
        Object entity = new Object();

        ReentryGuard.Token first = guard.tryAcquire(entity, "count");
        assertNotNull(first);
        first.close();

        ReentryGuard.Token second = guard.tryAcquire(entity, "count");
        assertNotNull(second);

        first.close();
        assertTrue(guard.isHeld(entity, "count"));
        second.close();
        assertTrue(guard.isEmpty());
    }

    private record Key(int value) {
    }
}
