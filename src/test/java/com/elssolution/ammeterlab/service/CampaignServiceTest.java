package com.elssolution.ammeterlab.service;

import com.elssolution.ammeterlab.alerts.AlertService;
import com.elssolution.ammeterlab.archive.InMemoryResultArchive;
import com.elssolution.ammeterlab.archive.ResultArchive;
import com.elssolution.ammeterlab.domain.DeviceEndpoint;
import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.RunStatus;
import com.elssolution.ammeterlab.domain.SamplingConfig;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.ArchiveException;
import com.elssolution.ammeterlab.exception.CampaignNotFoundException;
import com.elssolution.ammeterlab.exception.ConfigException;
import com.elssolution.ammeterlab.integration.client.MeasurementClient;
import com.elssolution.ammeterlab.integration.emulator.AmmeterEmulator;
import com.elssolution.ammeterlab.integration.emulator.MeasurementModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CampaignServiceTest {

    private final Map<DeviceKind, AmmeterEmulator> emulators = new EnumMap<>(DeviceKind.class);
    private ExecutorService pollPool;
    private ScheduledExecutorService campaignPool;
    private AlertService alerts;
    private SamplingScheduler scheduler;
    private DeviceRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        for (DeviceKind kind : DeviceKind.values()) {
            AmmeterEmulator emu = new AmmeterEmulator(MeasurementModel.forKind(kind), "localhost", 0, 3);
            emu.start();
            emulators.put(kind, emu);
        }
        pollPool = Executors.newCachedThreadPool();
        campaignPool = Executors.newSingleThreadScheduledExecutor();
        alerts = new AlertService();
        MeasurementClient client = new MeasurementClient(300, 500, 1, 10, alerts);
        scheduler = new SamplingScheduler(client, new StatisticsService(), alerts, pollPool, Clock.systemUTC());

        registry = mock(DeviceRegistry.class);
        when(registry.endpoints(anyCollection())).thenAnswer(inv -> {
            Collection<DeviceKind> kinds = inv.getArgument(0);
            List<DeviceEndpoint> out = new ArrayList<>();
            for (DeviceKind k : kinds.isEmpty() ? List.of(DeviceKind.values()) : kinds) {
                out.add(DeviceEndpoint.of(k, "localhost", emulators.get(k).getPort()));
            }
            return out;
        });
    }

    @AfterEach
    void tearDown() {
        emulators.values().forEach(AmmeterEmulator::close);
        pollPool.shutdownNow();
        campaignPool.shutdownNow();
    }

    private CampaignService service(ResultArchive archive) {
        return new CampaignService(scheduler, registry, new StatisticsService(), archive, alerts, campaignPool,
                Clock.systemUTC());
    }

    @Test
    void blocking_campaign_archives_every_run_and_ranks_devices() {
        InMemoryResultArchive archive = new InMemoryResultArchive();
        CampaignService campaigns = service(archive);

        CampaignService.CampaignView v = campaigns.run(List.of(), new SamplingConfig(4, 0, 40, 3));

        assertThat(v.getState()).isEqualTo(CampaignService.State.FINISHED);
        assertThat(v.getRuns()).hasSize(3).allMatch(r -> r.status() == RunStatus.COMPLETED);
        assertThat(v.getArchiveErrors()).isEmpty();
        assertThat(v.getRanking().entries()).hasSize(3);
        for (TestRun r : v.getRuns()) {
            assertThat(archive.get(r.runId())).isEqualTo(r);
        }
        assertThat(campaigns.find(v.getCampaignId()).getState()).isEqualTo(CampaignService.State.FINISHED);
    }

    @Test
    void single_device_has_no_ranking() {
        CampaignService.CampaignView v = service(new InMemoryResultArchive())
                .run(List.of(DeviceKind.ENTES), new SamplingConfig(2, 0, 40, 3));
        assertThat(v.getRuns()).hasSize(1);
        assertThat(v.getRanking()).isNull();
    }

    @Test
    void archive_failure_keeps_statistics_and_raises_alert() {
        ResultArchive broken = mock(ResultArchive.class);
        doThrow(new ArchiveException("disk full")).when(broken).store(any());

        CampaignService.CampaignView v = service(broken).run(List.of(DeviceKind.GREENLEE), new SamplingConfig(3, 0, 40, 3));

        assertThat(v.getState()).isEqualTo(CampaignService.State.FINISHED);
        assertThat(v.getRuns().get(0).stats().count()).isEqualTo(3);
        assertThat(v.getArchiveErrors()).singleElement().asString().contains("disk full");
        assertThat(alerts.isActive("ARCHIVE_WRITE_FAILED")).isTrue();
    }

    @Test
    void async_campaign_can_be_cancelled() throws InterruptedException {
        CampaignService campaigns = service(new InMemoryResultArchive());
        String id = campaigns.start(List.of(DeviceKind.CIRCUTOR), new SamplingConfig(10_000, 0, 20, 3));

        assertThat(campaigns.find(id).getState()).isEqualTo(CampaignService.State.RUNNING);
        Thread.sleep(200);
        assertThat(campaigns.cancel(id)).isTrue();

        CampaignService.CampaignView v = awaitDone(campaigns, id);
        assertThat(v.getState()).isEqualTo(CampaignService.State.FINISHED);
        assertThat(v.getRuns().get(0).status()).isEqualTo(RunStatus.INTERRUPTED);
        assertThat(v.getCancelReason()).isEqualTo("cancelled by operator");
        assertThat(campaigns.cancel(id)).isFalse();
    }

    @Test
    void campaigns_beyond_the_campaign_pool_are_rejected_not_parked() throws InterruptedException {
        ExecutorService oneSlot = new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS, new SynchronousQueue<>());
        try {
            CampaignService campaigns = new CampaignService(scheduler, registry, new StatisticsService(),
                    new InMemoryResultArchive(), alerts, oneSlot, Clock.systemUTC());
            String first = campaigns.start(List.of(DeviceKind.ENTES), new SamplingConfig(10_000, 0, 20, 3));
            String second = campaigns.start(List.of(DeviceKind.GREENLEE), new SamplingConfig(10_000, 0, 20, 3));

            assertThat(campaigns.find(first).getState()).isEqualTo(CampaignService.State.RUNNING);
            CampaignService.CampaignView rejected = campaigns.find(second);
            assertThat(rejected.getState()).isEqualTo(CampaignService.State.FAILED);
            assertThat(rejected.getError()).contains("rejected");

            campaigns.cancel(first);
            assertThat(awaitDone(campaigns, first).getState()).isEqualTo(CampaignService.State.FINISHED);
        } finally {
            oneSlot.shutdownNow();
        }
    }

    @Test
    void bad_config_is_rejected_synchronously() {
        CampaignService campaigns = service(new InMemoryResultArchive());
        assertThatThrownBy(() -> campaigns.start(List.of(DeviceKind.ENTES), new SamplingConfig(0, 0, 1, 3)))
                .isInstanceOf(ConfigException.class);
        assertThat(campaigns.list()).isEmpty();
    }

    @Test
    void unknown_campaign() {
        assertThatThrownBy(() -> service(new InMemoryResultArchive()).find("x"))
                .isInstanceOf(CampaignNotFoundException.class);
    }

    private static CampaignService.CampaignView awaitDone(CampaignService campaigns, String id) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        CampaignService.CampaignView v = campaigns.find(id);
        while (v.getState() == CampaignService.State.RUNNING && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            v = campaigns.find(id);
        }
        return v;
    }
}
