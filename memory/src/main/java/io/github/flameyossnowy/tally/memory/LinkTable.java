package io.github.flameyossnowy.tally.memory;

import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The rows of one many-to-many link. Each link row pairs a key of the declaring side with a key
 * of the target side. Not thread-safe; guarded by the adapter's lock.
 */
final class LinkTable {
    private final Set<Link> links = new LinkedHashSet<>();

    private record Link(Object forwardId, Object reverseId) {
        Object side(boolean reverse) {
            return reverse ? reverseId : forwardId;
        }

        Object other(boolean reverse) {
            return reverse ? forwardId : reverseId;
        }
    }

    private static Link link(boolean reverse, Object id, Object memberId) {
        return reverse ? new Link(memberId, id) : new Link(id, memberId);
    }

    /**
     * @param reverse whether {@code id} belongs to the target side of the link
     * @return whether the pair was not linked yet
     */
    boolean add(boolean reverse, @NotNull Object id, @NotNull Object memberId) {
        return links.add(link(reverse, id, memberId));
    }

    boolean remove(boolean reverse, @NotNull Object id, @NotNull Object memberId) {
        return links.remove(link(reverse, id, memberId));
    }

    Set<Object> members(boolean reverse, @NotNull Object id) {
        Set<Object> members = new LinkedHashSet<>();
        for (Link link : links) {
            if (link.side(reverse).equals(id)) {
                members.add(link.other(reverse));
            }
        }
        return members;
    }

    /**
     * Unlinks every member of {@code id}.
     *
     * @return the members that were unlinked
     */
    Set<Object> removeAll(boolean reverse, @NotNull Object id) {
        Set<Object> removed = new LinkedHashSet<>();
        Iterator<Link> iterator = links.iterator();
        while (iterator.hasNext()) {
            Link link = iterator.next();
            if (link.side(reverse).equals(id)) {
                removed.add(link.other(reverse));
                iterator.remove();
            }
        }
        return removed;
    }

    int size() {
        return links.size();
    }
}
