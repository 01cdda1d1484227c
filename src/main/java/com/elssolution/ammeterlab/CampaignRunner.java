package com.elssolution.ammeterlab;

import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.RunStatus;
import com.elssolution.ammeterlab.domain.SamplingConfig;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.ConfigException;
import com.elssolution.ammeterlab.exception.ErrorKind;
import com.elssolution.ammeterlab.service.CampaignService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot campaign at startup (lab.campaign.enabled=true).
 *
 * Exit codes:
 *   0  every run finished (COMPLETED, DEGRADED or INTERRUPTED)
 *   1  a run aborted on connection/timeout failures, or the campaign itself failed
 *   2  a run aborted on protocol/parse failures
 *   3  invalid sampling configuration
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "lab.campaign.enabled", havingValue = "true")
public class CampaignRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_CONNECTION = 1;
    static final int EXIT_PROTOCOL = 2;
    static final int EXIT_CONFIG = 3;

    @Value("${lab.campaign.devices:}")                   private String devices;
    @Value("${lab.campaign.numSamples:}")                private String numSamples;
    @Value("${lab.campaign.durationSeconds:}")           private String durationSeconds;
    @Value("${lab.campaign.frequencyHz:}")               private String frequencyHz;
    @Value("${lab.campaign.maxConsecutiveFailures:3}")   private int maxConsecutiveFailures;

    private final CampaignService campaigns;

    private volatile int exitCode = EXIT_OK;

    public CampaignRunner(CampaignService campaigns) {
        this.campaigns = campaigns;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<DeviceKind> kinds;
        SamplingConfig config;
        try {
            kinds = parseDevices(devices);
            config = SamplingConfig.resolve(
                    parseInt(numSamples, "numSamples"),
                    parseDouble(durationSeconds, "durationSeconds"),
                    parseDouble(frequencyHz, "frequencyHz"),
                    maxConsecutiveFailures);
        } catch (ConfigException e) {
            log.error("campaign_config_invalid: {}", e.getMessage());
            exitCode = EXIT_CONFIG;
            return;
        }

        CampaignService.CampaignView result;
        try {
            result = campaigns.run(kinds, config);
        } catch (ConfigException e) {
            log.error("campaign_config_invalid: {}", e.getMessage());
            exitCode = EXIT_CONFIG;
            return;
        }

        for (TestRun r : result.getRuns()) {
            log.info("Run {} {} status={} valid={}/{} stats={}",
                    r.deviceKind(), r.runId(), r.status(), r.validSampleCount(), r.samples().size(), r.stats());
        }
        if (result.getRanking() != null) {
            result.getRanking().entries().forEach(e -> log.info("Accuracy #{} {} median={} deviation={}",
                    e.rank(), e.deviceKind(), e.median(), e.deviation()));
        }
        exitCode = exitCodeFor(result);
        log.info("campaign_exit code={}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeFor(CampaignService.CampaignView result) {
        if (result.getState() == CampaignService.State.FAILED) return EXIT_CONNECTION;
        boolean connection = false;
        boolean protocol = false;
        for (TestRun r : result.getRuns()) {
            if (r.status() != RunStatus.ABORTED) continue;
            ErrorKind last = r.lastErrorKind();
            if (last != null && last.isTransient()) connection = true;
            else protocol = true;
        }
        if (connection) return EXIT_CONNECTION;
        if (protocol) return EXIT_PROTOCOL;
        return EXIT_OK;
    }

    static List<DeviceKind> parseDevices(String raw) {
        List<DeviceKind> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split(",")) {
            if (part.isBlank()) continue;
            try {
                out.add(DeviceKind.parse(part));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("unknown device '" + part.trim() + "'", e);
            }
        }
        return out;
    }

    private static Integer parseInt(String raw, String name) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(name + " is not an integer: '" + raw + "'", e);
        }
    }

    private static Double parseDouble(String raw, String name) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Double.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(name + " is not a number: '" + raw + "'", e);
        }
    }
}
