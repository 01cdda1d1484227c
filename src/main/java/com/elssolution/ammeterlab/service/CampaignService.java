package com.elssolution.ammeterlab.service;

import com.elssolution.ammeterlab.alerts.AlertService;
import com.elssolution.ammeterlab.archive.ResultArchive;
import com.elssolution.ammeterlab.domain.AccuracyRanking;
import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.SamplingConfig;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.ArchiveException;
import com.elssolution.ammeterlab.exception.CampaignNotFoundException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Scheduler, statistics and archive glued together.
 *
 * {@link #run} blocks the caller; {@link #start} plans on the caller's thread (so a bad config
 * fails right away) and executes on the {@code campaignExecutor}, which rejects
 * a campaign outright (state FAILED) once {@code lab.scheduler.campaignThreads} are busy. A campaign whose runs cannot be
 * archived still reports its statistics; the failure is listed in {@code archiveErrors}
 * and raised as {@code ARCHIVE_WRITE_FAILED}.
 */
@Slf4j
@Service
public class CampaignService {

    public enum State { RUNNING, FINISHED, FAILED }

    @Value @Builder
    public static class CampaignView {
        String campaignId;
        State state;
        Instant startedAt;
        Instant finishedAt;         // null while running
        List<TestRun> runs;         // live snapshots while running
        AccuracyRanking ranking;    // null unless at least two runs have statistics
        List<String> archiveErrors;
        String cancelReason;
        String error;               // set when state == FAILED
    }

    static final String ARCHIVE_ALERT = "ARCHIVE_WRITE_FAILED";
    private static final int FINISHED_RETAINED = 50;

    private final SamplingScheduler scheduler;
    private final DeviceRegistry devices;
    private final StatisticsService statistics;
    private final ResultArchive archive;
    private final AlertService alerts;
    private final ExecutorService executor;
    private final Clock clock;

    private final Map<String, Campaign> campaigns = new LinkedHashMap<>();

    public CampaignService(SamplingScheduler scheduler,
                           DeviceRegistry devices,
                           StatisticsService statistics,
                           ResultArchive archive,
                           AlertService alerts,
                           @Qualifier("campaignExecutor") ExecutorService executor,
                           Clock clock) {
        this.scheduler = scheduler;
        this.devices = devices;
        this.statistics = statistics;
        this.archive = archive;
        this.alerts = alerts;
        this.executor = executor;
        this.clock = clock;
    }

    // ---------------------- Public API ----------------------

    /** Runs to completion on the calling thread. */
    public CampaignView run(Collection<DeviceKind> kinds, SamplingConfig config, CancellationSignal signal) {
        Campaign c = prepare(kinds, config, signal);
        execute(c);
        return c.view();
    }

    public CampaignView run(Collection<DeviceKind> kinds, SamplingConfig config) {
        return run(kinds, config, new CancellationSignal());
    }

    /**
     * @return the campaign id; poll it with {@link #find}
     * @throws com.elssolution.ammeterlab.exception.ConfigException if the config or device list is invalid
     */
    public String start(Collection<DeviceKind> kinds, SamplingConfig config) {
        Campaign c = prepare(kinds, config, new CancellationSignal());
        try {
            executor.execute(() -> execute(c));
        } catch (RejectedExecutionException e) {
            c.fail("executor rejected campaign: " + e.getMessage(), clock.instant());
            log.error("campaign_rejected id={}", c.id, e);
        }
        return c.id;
    }

    /** @return false if the campaign had already finished */
    public boolean cancel(String campaignId) {
        Campaign c = lookup(campaignId);
        if (c.state != State.RUNNING) return false;
        c.signal.cancel("cancelled by operator");
        log.info("campaign_cancel_requested id={}", campaignId);
        return true;
    }

    public CampaignView find(String campaignId) {
        return lookup(campaignId).view();
    }

    public List<CampaignView> list() {
        synchronized (campaigns) {
            List<CampaignView> out = new ArrayList<>(campaigns.size());
            campaigns.values().forEach(c -> out.add(c.view()));
            return out;
        }
    }

    // ---------------------- internals ----------------------

    private Campaign prepare(Collection<DeviceKind> kinds, SamplingConfig config, CancellationSignal signal) {
        SamplingPlan plan = scheduler.plan(devices.endpoints(kinds), config);
        Campaign c = new Campaign(UUID.randomUUID().toString(), plan, signal, clock.instant());
        synchronized (campaigns) {
            campaigns.put(c.id, c);
            evictFinished();
        }
        log.info("campaign_created id={} runs={}", c.id, plan.runIds());
        return c;
    }

    private void execute(Campaign c) {
        try {
            List<TestRun> runs = scheduler.execute(c.plan, c.signal);
            List<String> archiveErrors = archiveAll(runs);
            AccuracyRanking ranking = rank(runs);
            c.finish(runs, ranking, archiveErrors, clock.instant());
            log.info("campaign_finished id={} statuses={} archiveErrors={}",
                    c.id, runs.stream().map(TestRun::status).toList(), archiveErrors.size());
        } catch (RuntimeException e) {
            log.error("campaign_failed id={}", c.id, e);
            c.fail(e.getMessage(), clock.instant());
        }
    }

    private List<String> archiveAll(List<TestRun> runs) {
        List<String> errors = new ArrayList<>();
        for (TestRun run : runs) {
            try {
                archive.store(run);
            } catch (ArchiveException e) {
                log.error("archive_store_failed runId={}: {}", run.runId(), e.getMessage());
                errors.add(run.runId() + ": " + e.getMessage());
            }
        }
        if (errors.isEmpty()) {
            alerts.resolve(ARCHIVE_ALERT);
        } else {
            alerts.raise(ARCHIVE_ALERT, errors.size() + " run(s) not archived: " + errors.get(0),
                    AlertService.Severity.ERROR);
        }
        return errors;
    }

    private AccuracyRanking rank(List<TestRun> runs) {
        long measured = runs.stream().filter(r -> r.stats() != null).count();
        return measured > 1 ? statistics.rankAccuracy(runs) : null;
    }

    private Campaign lookup(String campaignId) {
        Campaign c;
        synchronized (campaigns) {
            c = campaigns.get(campaignId);
        }
        if (c == null) throw new CampaignNotFoundException(campaignId);
        return c;
    }

    private void evictFinished() {
        long finished = campaigns.values().stream().filter(c -> c.state != State.RUNNING).count();
        Iterator<Campaign> it = campaigns.values().iterator();
        while (finished > FINISHED_RETAINED && it.hasNext()) {
            if (it.next().state != State.RUNNING) {
                it.remove();
                finished--;
            }
        }
    }

    private static final class Campaign {
        final String id;
        final SamplingPlan plan;
        final CancellationSignal signal;
        final Instant startedAt;

        volatile State state = State.RUNNING;
        volatile Instant finishedAt;
        volatile List<TestRun> runs;
        volatile AccuracyRanking ranking;
        volatile List<String> archiveErrors = List.of();
        volatile String error;

        Campaign(String id, SamplingPlan plan, CancellationSignal signal, Instant startedAt) {
            this.id = id;
            this.plan = plan;
            this.signal = signal;
            this.startedAt = startedAt;
        }

        void finish(List<TestRun> done, AccuracyRanking rk, List<String> errors, Instant at) {
            runs = List.copyOf(done);
            ranking = rk;
            archiveErrors = List.copyOf(errors);
            finishedAt = at;
            state = State.FINISHED;
        }

        void fail(String message, Instant at) {
            error = message;
            finishedAt = at;
            state = State.FAILED;
        }

        CampaignView view() {
            return CampaignView.builder()
                    .campaignId(id)
                    .state(state)
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .runs(runs != null ? runs : plan.snapshots())
                    .ranking(ranking)
                    .archiveErrors(archiveErrors)
                    .cancelReason(signal.getReason())
                    .error(error)
                    .build();
        }
    }
}
