/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.noos.data.models.TimelineEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * In-memory, append-only timeline of {@link TimelineEntry} values shared by ingestion and rendering.
 *
 * <p>
 * Entries are kept in insertion order; ordering and future filtering happen at render time (see
 * {@link villagecompute.noos.templates.PageTemplate}). There is no update or delete.
 *
 * <p>
 * <b>Thread Safety:</b> every operation synchronizes on a single private lock for its own duration only. Renderers
 * take a {@link #snapshot()} and work on the copy, so the lock is never held across a render pass and concurrent feed
 * ingestion never waits on rendering.
 *
 * <p>
 * The application owns exactly one instance as a CDI bean; tests construct their own.
 */
@ApplicationScoped
public class TimelineStore {

    private static final Logger LOG = Logger.getLogger(TimelineStore.class);

    private final Object lock = new Object();

    private final List<TimelineEntry> entries = new ArrayList<>();

    /**
     * Appends one entry.
     *
     * @param entry
     *            the entry to add
     */
    public void append(TimelineEntry entry) {
        Objects.requireNonNull(entry, "entry");
        synchronized (lock) {
            entries.add(entry);
        }
    }

    /**
     * Appends a batch of entries under a single lock acquisition, preserving their order.
     *
     * @param batch
     *            entries to add
     */
    public void appendAll(Collection<TimelineEntry> batch) {
        List<TimelineEntry> copy = List.copyOf(batch);
        synchronized (lock) {
            entries.addAll(copy);
        }
        LOG.debugf("Appended %d entries to timeline", copy.size());
    }

    /**
     * Returns a point-in-time copy of all entries in insertion order.
     *
     * @return immutable snapshot
     */
    public List<TimelineEntry> snapshot() {
        synchronized (lock) {
            return List.copyOf(entries);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }
}
