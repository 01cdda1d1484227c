package com.elssolution.ammeterlab.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Last-resort handler for worker threads: logs and raises a CRITICAL alert.
 * Installed as JVM default and on every thread the lab creates (scheduler, pollers, emulators).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    private final AlertService alerts;

    private volatile boolean stopping = false;

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;
        String key = classify(t);
        log.error("Uncaught in {} -> {}", t.getName(), e.toString(), e);
        alerts.raise(key, t.getName() + ": " + e, AlertService.Severity.CRITICAL);
    }

    static String classify(Thread t) {
        String name = t.getName() == null ? "" : t.getName();
        if (name.startsWith("emu-")) return "EMULATOR_UNCAUGHT";
        if (name.startsWith("lab-poll-")) return "POLLER_UNCAUGHT";
        return "UNCAUGHT";
    }
}
