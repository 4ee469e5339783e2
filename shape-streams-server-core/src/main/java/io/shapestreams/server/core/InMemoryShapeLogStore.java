package io.shapestreams.server.core;

import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.LogOffset;
import io.shapestreams.server.spi.AppendListener;
import io.shapestreams.server.spi.AppendOutcome;
import io.shapestreams.server.spi.LogStats;
import io.shapestreams.server.spi.ReadOutcome;
import io.shapestreams.server.spi.ShapeLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference in-memory {@link ShapeLogStore}.
 *
 * <p>Each generation's events live in a skip list keyed by offset; snapshot rows, which all share
 * {@link LogOffset#FIRST}, form one group under that key. Writers insert the new groups first and only
 * then publish the new head through a volatile field, so readers bound their scan by the head they
 * observed and never see half of an append. Readers take no lock.
 */
public final class InMemoryShapeLogStore implements ShapeLogStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryShapeLogStore.class);

    private final Map<String, ShapeLog> logs = new ConcurrentHashMap<>();
    private final List<AppendListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public boolean create(String shapeId) {
        Objects.requireNonNull(shapeId, "shapeId");
        return logs.putIfAbsent(shapeId, new ShapeLog()) == null;
    }

    @Override
    public AppendOutcome append(String shapeId, List<ChangeEvent> events) {
        Objects.requireNonNull(events, "events");
        ShapeLog l = logs.get(shapeId);
        if (l == null) return AppendOutcome.notFound();

        AppendOutcome out = l.append(events);
        if (out.appended() > 0) {
            log.debug("Appended {} events to {} (skipped {}), head {}", out.appended(), shapeId, out.skipped(), out.head());
            for (AppendListener listener : listeners) {
                listener.appended(shapeId, out.head());
            }
        } else if (out.skipped() > 0) {
            log.debug("Skipped {} already appended events for {}", out.skipped(), shapeId);
        }
        return out;
    }

    @Override
    public ReadOutcome readAfter(String shapeId, LogOffset after, int maxEvents) {
        Objects.requireNonNull(after, "after");
        if (maxEvents <= 0) throw new IllegalArgumentException("maxEvents must be > 0");
        ShapeLog l = logs.get(shapeId);
        if (l == null) return ReadOutcome.notFound();
        return l.read(after, maxEvents);
    }

    @Override
    public Optional<LogStats> stats(String shapeId) {
        ShapeLog l = logs.get(shapeId);
        if (l == null) return Optional.empty();
        return Optional.of(new LogStats(l.head, l.truncatedThrough, l.size));
    }

    @Override
    public long truncate(String shapeId, long keepEntries, LogOffset floor) {
        Objects.requireNonNull(floor, "floor");
        if (keepEntries < 0) return 0;
        ShapeLog l = logs.get(shapeId);
        if (l == null) return 0;
        long dropped = l.truncate(keepEntries, floor);
        if (dropped > 0) log.debug("Truncated {} events from {} through {}", dropped, shapeId, l.truncatedThrough);
        return dropped;
    }

    @Override
    public boolean drop(String shapeId) {
        return logs.remove(shapeId) != null;
    }

    @Override
    public void addAppendListener(AppendListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private static final class ShapeLog {
        private final ReentrantLock writeLock = new ReentrantLock();
        private final ConcurrentSkipListMap<LogOffset, List<ChangeEvent>> groups = new ConcurrentSkipListMap<>();

        private volatile LogOffset head = LogOffset.BEFORE_ALL;
        private volatile LogOffset truncatedThrough = LogOffset.BEFORE_ALL;
        private volatile long size;

        AppendOutcome append(List<ChangeEvent> events) {
            writeLock.lock();
            try {
                LogOffset current = head;
                List<ChangeEvent> fresh = new ArrayList<>(events.size());
                LogOffset previous = null;
                int skipped = 0;
                for (ChangeEvent e : events) {
                    LogOffset o = e.offset();
                    if (o.isBeforeAll()) throw new IllegalArgumentException("event offset must not be " + o);
                    if (previous != null) {
                        int c = o.compareTo(previous);
                        if (c < 0) throw new IllegalArgumentException("offsets decrease within batch: " + previous + " then " + o);
                        if (c == 0 && !o.equals(LogOffset.FIRST)) {
                            throw new IllegalArgumentException("duplicate offset within batch: " + o);
                        }
                    }
                    previous = o;
                    if (o.compareTo(current) <= 0) {
                        skipped++;
                        continue;
                    }
                    fresh.add(e);
                }
                if (fresh.isEmpty()) return new AppendOutcome(AppendOutcome.Status.APPENDED, current, 0, skipped);

                LogOffset groupOffset = null;
                List<ChangeEvent> group = null;
                for (ChangeEvent e : fresh) {
                    if (!e.offset().equals(groupOffset)) {
                        if (group != null) groups.put(groupOffset, List.copyOf(group));
                        groupOffset = e.offset();
                        group = new ArrayList<>();
                    }
                    group.add(e);
                }
                groups.put(groupOffset, List.copyOf(group));

                size += fresh.size();
                head = groupOffset;
                return new AppendOutcome(AppendOutcome.Status.APPENDED, groupOffset, fresh.size(), skipped);
            } finally {
                writeLock.unlock();
            }
        }

        ReadOutcome read(LogOffset after, int maxEvents) {
            LogOffset h = head;
            if (after.compareTo(truncatedThrough) < 0) return ReadOutcome.retentionExceeded();

            // An empty snapshot still ends at FIRST.
            LogOffset ceiling = h.compareTo(LogOffset.FIRST) < 0 ? LogOffset.FIRST : h;
            if (after.compareTo(ceiling) > 0) return ReadOutcome.offsetAhead();
            LogOffset resumeFrom = after.isBeforeAll() ? LogOffset.FIRST : after;
            if (h.compareTo(after) <= 0) return ReadOutcome.ok(List.of(), resumeFrom, true);

            List<ChangeEvent> out = new ArrayList<>();
            LogOffset last = resumeFrom;
            boolean reachedHead = true;
            for (Map.Entry<LogOffset, List<ChangeEvent>> g : groups.subMap(after, false, h, true).entrySet()) {
                List<ChangeEvent> group = g.getValue();
                // Groups are never split; an oversized first group is returned whole.
                if (!out.isEmpty() && out.size() + group.size() > maxEvents) {
                    reachedHead = false;
                    break;
                }
                out.addAll(group);
                last = g.getKey();
            }

            // A concurrent truncation may have removed part of the range we just scanned.
            if (after.compareTo(truncatedThrough) < 0) return ReadOutcome.retentionExceeded();
            return ReadOutcome.ok(out, last, reachedHead && last.equals(h));
        }

        long truncate(long keepEntries, LogOffset floor) {
            writeLock.lock();
            try {
                long excess = size - keepEntries;
                long dropped = 0;
                Iterator<Map.Entry<LogOffset, List<ChangeEvent>>> it = groups.entrySet().iterator();
                while (excess > 0 && it.hasNext()) {
                    Map.Entry<LogOffset, List<ChangeEvent>> g = it.next();
                    if (g.getKey().compareTo(floor) > 0) break;
                    // Publish the new boundary before removing so readers can detect the gap.
                    truncatedThrough = g.getKey();
                    it.remove();
                    int n = g.getValue().size();
                    excess -= n;
                    dropped += n;
                }
                size -= dropped;
                return dropped;
            } finally {
                writeLock.unlock();
            }
        }
    }
}
