package com.elssolution.ammeterlab.service;

import com.elssolution.ammeterlab.alerts.AlertService;
import com.elssolution.ammeterlab.archive.ArchiveSummary;
import com.elssolution.ammeterlab.archive.ResultArchive;
import com.elssolution.ammeterlab.domain.DeviceEndpoint;
import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.AmmeterLabException;
import com.elssolution.ammeterlab.integration.emulator.AmmeterEmulator;
import com.elssolution.ammeterlab.integration.emulator.EmulatorHost;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Status aggregation.
 * - Emulator counters per device and where the client will connect.
 * - Latest archived run per device, archive totals, active alert count.
 */
@Slf4j
@Component
public class StatusService {

    private final ScheduledExecutorService scheduler;
    private final EmulatorHost emulators;
    private final DeviceRegistry devices;
    private final ResultArchive archive;
    private final AlertService alerts;
    private final Clock clock;

    public StatusService(ScheduledExecutorService scheduler,
                         EmulatorHost emulators,
                         DeviceRegistry devices,
                         ResultArchive archive,
                         AlertService alerts,
                         Clock clock) {
        this.scheduler = scheduler;
        this.emulators = emulators;
        this.devices = devices;
        this.archive = archive;
        this.alerts = alerts;
        this.clock = clock;
    }

    // Summary log period, 0 = off
    @Value("${lab.status.summaryEverySec:60}") private int summaryEverySec;

    @PostConstruct
    void startSummaryLogger() {
        if (summaryEverySec <= 0) {
            log.info("Status summary logger disabled");
            return;
        }
        scheduler.scheduleAtFixedRate(this::logSummarySafe, summaryEverySec, summaryEverySec, TimeUnit.SECONDS);
        log.info("Status summary logger started: every {}s", summaryEverySec);
    }

    // ---------------------- Public API ----------------------

    /** Used by controllers, health and the periodic logger. */
    public StatusView buildStatusView() {
        Instant now = clock.instant();
        List<DeviceStatus> perDevice = new ArrayList<>();
        for (DeviceKind kind : DeviceKind.values()) {
            perDevice.add(deviceStatus(kind, now));
        }

        ArchiveSummary totals = null;
        String archiveError = null;
        try {
            totals = archive.summary();
        } catch (AmmeterLabException e) {
            archiveError = e.getMessage();
        }

        return StatusView.builder()
                .emulatorsEnabled(emulators.isEnabled())
                .emulatorsRunning(emulators.running().size())
                .devices(perDevice)
                .archive(totals)
                .archiveError(archiveError)
                .activeAlerts(alerts.snapshot().getActive().size())
                .build();
    }

    // ---------------------- Log summary ----------------------

    private void logSummarySafe() {
        try {
            StatusView v = buildStatusView();
            StringBuilder sb = new StringBuilder();
            for (DeviceStatus d : v.devices) {
                sb.append(' ').append(d.kind)
                        .append("[emu=").append(d.emulatorRunning ? "up" : "-")
                        .append(" served=").append(d.measurementsServed)
                        .append(" rejected=").append(d.commandsRejected)
                        .append(" last=").append(d.lastRunStatus == null ? "-" : d.lastRunStatus)
                        .append(" (").append(d.lastRunAgeHuman).append(")]");
            }
            log.info("Status: emulators {}/{} up; runs={} completed={}; alerts={};{}",
                    v.emulatorsRunning, DeviceKind.values().length,
                    v.archive == null ? "-" : v.archive.totalRuns(),
                    v.archive == null ? "-" : v.archive.completedRuns(),
                    v.activeAlerts, sb);
        } catch (Exception e) {
            log.warn("status_summary_failed: {}", e.getMessage());
        }
    }

    private DeviceStatus deviceStatus(DeviceKind kind, Instant now) {
        Optional<AmmeterEmulator> emu = emulators.emulator(kind);
        DeviceEndpoint ep = devices.endpoint(kind);

        TestRun last = null;
        try {
            last = archive.latest(kind).orElse(null);
        } catch (AmmeterLabException e) {
            log.debug("status_latest_failed kind={}: {}", kind, e.getMessage());
        }
        long ageMs = (last == null || last.finishedAt() == null) ? -1
                : Math.max(0, Duration.between(last.finishedAt(), now).toMillis());

        return DeviceStatus.builder()
                .kind(kind)
                .address(ep.address())
                .emulatorRunning(emu.map(AmmeterEmulator::isRunning).orElse(false))
                .connectionsAccepted(emu.map(AmmeterEmulator::getConnectionsAccepted).orElse(0L))
                .measurementsServed(emu.map(AmmeterEmulator::getMeasurementsServed).orElse(0L))
                .commandsRejected(emu.map(AmmeterEmulator::getCommandsRejected).orElse(0L))
                .lastRunId(last == null ? null : last.runId())
                .lastRunStatus(last == null ? null : last.status().name())
                .lastRunMedian(last == null || last.stats() == null ? Double.NaN : last.stats().median())
                .lastRunAgeMs(ageMs)
                .lastRunAgeHuman(humanAge(ageMs))
                .unreachable(alerts.isActive("DEVICE_UNREACHABLE:" + kind))
                .build();
    }

    // ---------------------- formatting helpers ----------------------

    static String humanAge(long ageMs) {
        if (ageMs < 0) return "-";
        if (ageMs < 1000) return ageMs + " ms";
        long s = ageMs / 1000;
        if (s < 60) return s + " s";
        long m = s / 60;
        long remS = s % 60;
        if (m < 60) return m + " min " + remS + " s";
        return (m / 60) + " h " + (m % 60) + " min";
    }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class DeviceStatus {
        DeviceKind kind;
        String address;

        // Embedded emulator
        boolean emulatorRunning;
        long connectionsAccepted;
        long measurementsServed;
        long commandsRejected;

        // Last archived run
        String lastRunId;
        String lastRunStatus;
        double lastRunMedian;
        long lastRunAgeMs;
        String lastRunAgeHuman;

        boolean unreachable;
    }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class StatusView {
        boolean emulatorsEnabled;
        int emulatorsRunning;
        List<DeviceStatus> devices;
        ArchiveSummary archive;
        String archiveError;
        int activeAlerts;
    }
}
