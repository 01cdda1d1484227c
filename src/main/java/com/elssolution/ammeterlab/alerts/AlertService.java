package com.elssolution.ammeterlab.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory alert book for the lab: unreachable devices, aborted runs, archive write failures,
 * emulators that could not bind, uncaught thread errors.
 *
 * An alert key is "active" between {@link #raise} and {@link #resolve}; each such stretch is an
 * episode. Resolved WARN+ episodes are kept in a bounded history.
 */
@Slf4j
@Service
public class AlertService {

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    @Value @Builder
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        long firstSeen;   // epoch ms, start of the current episode
        long lastSeen;    // epoch ms
        int count;        // raise() calls in this episode
        boolean active;
    }

    @Value @Builder
    public static class EventView {
        String key;
        String message;
        Severity severity;
        long ts;
        String type;      // RAISE | RESOLVE
    }

    @Value @Builder
    public static class EpisodeView {
        String key;
        String message;
        Severity severity;
        long startedAt;
        long lastSeen;
        Long resolvedAt;  // null while active
        int count;
        boolean active;
    }

    @Value @Builder
    public static class AlertsSnapshot {
        List<AlertView> active;
        List<EventView> recent;       // newest first
        List<EpisodeView> episodes;   // active first, then resolved history, newest first
    }

    private static final int RECENT_CAPACITY = 50;
    private static final int HISTORY_CAPACITY = 100;
    private static final Severity HISTORY_MIN_SEVERITY = Severity.WARN;

    private final Map<String, MutableAlert> alerts = new ConcurrentHashMap<>();
    private final Deque<EventView> recent = new ArrayDeque<>();
    private final Deque<EpisodeView> history = new ArrayDeque<>();

    /** Raise or refresh an alert. Starts a new episode if the key was inactive. */
    public void raise(String key, String message, Severity sev) {
        long now = System.currentTimeMillis();
        MutableAlert a = alerts.computeIfAbsent(key, k -> new MutableAlert(k));
        synchronized (a) {
            if (!a.active) {
                a.firstSeen = now;
                a.count.set(0);
            }
            a.active = true;
            a.severity = sev;
            a.message = message;
            a.lastSeen = now;
            a.count.incrementAndGet();
        }
        log.warn("ALERT RAISE key={} sev={} msg={}", key, sev, message);
        record(key, message, sev, "RAISE", now);
    }

    /** Close the episode of {@code key}; no-op when it is not active. */
    public void resolve(String key) {
        MutableAlert a = alerts.get(key);
        if (a == null) return;

        long now = System.currentTimeMillis();
        EpisodeView finished;
        synchronized (a) {
            if (!a.active) return;
            a.active = false;
            finished = EpisodeView.builder()
                    .key(key).message(a.message).severity(a.severity)
                    .startedAt(a.firstSeen).lastSeen(a.lastSeen)
                    .resolvedAt(now).count(a.count.get()).active(false)
                    .build();
            a.lastSeen = now;
        }
        log.info("ALERT RESOLVE key={}", key);
        record(key, "recovered", finished.getSeverity(), "RESOLVE", now);
        if (finished.getSeverity().ordinal() >= HISTORY_MIN_SEVERITY.ordinal()) {
            synchronized (history) {
                history.addLast(finished);
                while (history.size() > HISTORY_CAPACITY) history.removeFirst();
            }
        }
    }

    public boolean isActive(String key) {
        MutableAlert a = alerts.get(key);
        return a != null && a.active;
    }

    public AlertsSnapshot snapshot() {
        List<AlertView> active = alerts.values().stream()
                .filter(a -> a.active)
                .sorted(Comparator.comparingLong((MutableAlert a) -> a.lastSeen).reversed())
                .map(MutableAlert::view)
                .toList();

        List<EventView> recentCopy;
        synchronized (recent) {
            recentCopy = new ArrayList<>(recent);
        }
        Collections.reverse(recentCopy);

        return AlertsSnapshot.builder()
                .active(active)
                .recent(recentCopy)
                .episodes(episodes(20))
                .build();
    }

    /** Active WARN+ episodes first, then resolved history; newest first, at most {@code limit}. */
    public List<EpisodeView> episodes(int limit) {
        int cap = Math.max(1, Math.min(limit, HISTORY_CAPACITY));
        List<EpisodeView> out = new ArrayList<>(cap);
        alerts.values().stream()
                .filter(a -> a.active && a.severity.ordinal() >= HISTORY_MIN_SEVERITY.ordinal())
                .sorted(Comparator.comparingLong((MutableAlert a) -> a.lastSeen).reversed())
                .limit(cap)
                .forEach(a -> out.add(a.episode()));
        synchronized (history) {
            Iterator<EpisodeView> it = history.descendingIterator();
            while (out.size() < cap && it.hasNext()) out.add(it.next());
        }
        return out;
    }

    private void record(String key, String msg, Severity sev, String type, long ts) {
        EventView ev = EventView.builder().key(key).message(msg).severity(sev).type(type).ts(ts).build();
        synchronized (recent) {
            recent.addLast(ev);
            while (recent.size() > RECENT_CAPACITY) recent.removeFirst();
        }
    }

    private static class MutableAlert {
        final String key;
        volatile String message;
        volatile Severity severity = Severity.INFO;
        volatile boolean active;
        volatile long firstSeen;
        volatile long lastSeen;
        final AtomicInteger count = new AtomicInteger();

        MutableAlert(String key) {
            this.key = key;
        }

        AlertView view() {
            return AlertView.builder()
                    .key(key).message(message).severity(severity).active(active)
                    .firstSeen(firstSeen).lastSeen(lastSeen).count(count.get())
                    .build();
        }

        EpisodeView episode() {
            return EpisodeView.builder()
                    .key(key).message(message).severity(severity)
                    .startedAt(firstSeen).lastSeen(lastSeen)
                    .resolvedAt(null).count(count.get()).active(true)
                    .build();
        }
    }
}
