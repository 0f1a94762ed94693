package com.mimecast.wren.util;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Allocates unique output filenames for one message.
 *
 * <p>Names are unique for the lifetime of the allocator, collisions get an incrementing counter.
 * <br>The timestamp and source hash in each name keep messages apart, so one allocator per message is enough.
 */
public class NameAllocator {

    private final Set<String> used = new HashSet<>();
    private final Clock clock;

    /**
     * Constructs a new NameAllocator instance.
     *
     * @param clock Clock for timestamps.
     */
    public NameAllocator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Allocates a unique name.
     *
     * @param original Original name.
     * @param sourceId Source identifier.
     * @return Unique name.
     */
    public synchronized String allocate(String original, String sourceId) {
        Instant now = clock.instant();
        int counter = 0;
        String name = PathUtils.uniqueName(original, sourceId, now, counter);
        while (!used.add(name)) {
            name = PathUtils.uniqueName(original, sourceId, now, ++counter);
        }
        return name;
    }
}
