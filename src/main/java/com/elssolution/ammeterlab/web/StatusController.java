package com.elssolution.ammeterlab.web;

import com.elssolution.ammeterlab.alerts.AlertService;
import com.elssolution.ammeterlab.service.StatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class StatusController {

    private final AlertService alerts;

    private final StatusService status;

    public StatusController(AlertService alerts, StatusService status) {
        this.alerts = alerts;
        this.status = status;
    }

    @GetMapping("/status")
    public StatusService.StatusView getStatus() {
        return status.buildStatusView();
    }

    @GetMapping("/alerts")
    public AlertService.AlertsSnapshot getAlerts() {
        return alerts.snapshot();
    }

    @GetMapping("/alerts/episodes")
    public List<AlertService.EpisodeView> getEpisodes(@RequestParam(name = "limit", defaultValue = "10") int limit) {
        return alerts.episodes(limit);
    }
}
