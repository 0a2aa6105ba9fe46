package com.leo.positioning.service;

import com.leo.positioning.config.NavigationProperties;
import com.leo.positioning.dto.NavigationSnapshot;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Holds the latest published {@link NavigationSnapshot} and a short event log.
 *
 * <p>Snapshots are immutable and swapped through a single reference, so any number of readers may
 * call {@link #current()} concurrently with the engine's {@link #publish(NavigationSnapshot)}
 * without locking and never observe a partially written state.
 */
@Slf4j
@Component
public class NavigationStateStore {

    private static final DateTimeFormatter EVENT_TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final AtomicReference<NavigationSnapshot> current;
    private final Deque<String> events = new ArrayDeque<>();
    private final int eventCapacity;
    private final Clock clock;
    private final DateTimeFormatter timeFormat;

    @Autowired
    public NavigationStateStore(NavigationProperties properties, Clock clock) {
        this(properties.getPublication().getLogCapacity(), clock);
    }

    public NavigationStateStore(int eventCapacity, Clock clock) {
        if (eventCapacity < 1) {
            throw new IllegalArgumentException("Event log capacity must be at least 1");
        }
        this.eventCapacity = eventCapacity;
        this.clock = clock;
        this.timeFormat = EVENT_TIME_FORMAT.withZone(clock.getZone());
        this.current = new AtomicReference<>(NavigationSnapshot.booting(clock.instant()));
    }

    /** Latest published snapshot. Never null. */
    public NavigationSnapshot current() {
        return current.get();
    }

    /**
     * Replaces the published snapshot.
     *
     * @param snapshot the complete new state
     */
    public void publish(NavigationSnapshot snapshot) {
        current.set(Objects.requireNonNull(snapshot, "snapshot"));
    }

    /**
     * Appends a timestamped line to the event log, evicting the oldest line once full. The line
     * reaches readers with the next published snapshot.
     *
     * @param message event text
     */
    public void recordEvent(String message) {
        String line = "[" + timeFormat.format(clock.instant()) + "] " + message;
        log.info(message);
        synchronized (events) {
            events.addLast(line);
            while (events.size() > eventCapacity) {
                events.removeFirst();
            }
        }
    }

    /** Oldest first. */
    public List<String> recentEvents() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }
}
