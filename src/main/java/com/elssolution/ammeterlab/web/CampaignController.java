package com.elssolution.ammeterlab.web;

import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.SamplingConfig;
import com.elssolution.ammeterlab.service.CampaignService;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/campaigns")
public class CampaignController {

    /**
     * At least two of numSamples / durationSeconds / frequencyHz.
     * Empty {@code devices} means all three; {@code wait=true} blocks until the campaign ends.
     */
    public record CampaignRequest(List<DeviceKind> devices,
                                  Integer numSamples,
                                  Double durationSeconds,
                                  Double frequencyHz,
                                  Integer maxConsecutiveFailures,
                                  @JsonProperty("wait") Boolean waitForCompletion) {

        SamplingConfig samplingConfig() {
            int maxFailures = maxConsecutiveFailures == null ? DEFAULT_MAX_FAILURES : maxConsecutiveFailures;
            return SamplingConfig.resolve(numSamples, durationSeconds, frequencyHz, maxFailures);
        }
    }

    static final int DEFAULT_MAX_FAILURES = 3;

    private final CampaignService campaigns;

    public CampaignController(CampaignService campaigns) {
        this.campaigns = campaigns;
    }

    @PostMapping
    public ResponseEntity<CampaignService.CampaignView> create(@RequestBody CampaignRequest req) {
        SamplingConfig cfg = req.samplingConfig();
        if (Boolean.TRUE.equals(req.waitForCompletion())) {
            return ResponseEntity.ok(campaigns.run(req.devices(), cfg));
        }
        String id = campaigns.start(req.devices(), cfg);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .location(URI.create("/campaigns/" + id))
                .body(campaigns.find(id));
    }

    @GetMapping
    public List<CampaignService.CampaignView> list() {
        return campaigns.list();
    }

    @GetMapping("/{id}")
    public CampaignService.CampaignView get(@PathVariable String id) {
        return campaigns.find(id);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> cancel(@PathVariable String id) {
        boolean cancelled = campaigns.cancel(id);
        return Map.of("campaignId", id, "cancelled", cancelled);
    }
}
