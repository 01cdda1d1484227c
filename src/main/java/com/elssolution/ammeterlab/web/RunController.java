package com.elssolution.ammeterlab.web;

import com.elssolution.ammeterlab.archive.ArchiveSummary;
import com.elssolution.ammeterlab.archive.ResultArchive;
import com.elssolution.ammeterlab.domain.AccuracyRanking;
import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.DistributionAnalysis;
import com.elssolution.ammeterlab.domain.RunComparison;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.IncompatibleRunsException;
import com.elssolution.ammeterlab.exception.RunNotFoundException;
import com.elssolution.ammeterlab.service.StatisticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/** Read side of the archive plus the statistics that work on archived runs. */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final ResultArchive archive;
    private final StatisticsService statistics;

    public RunController(ResultArchive archive, StatisticsService statistics) {
        this.archive = archive;
        this.statistics = statistics;
    }

    @GetMapping
    public List<TestRun> query(@RequestParam(name = "device", required = false) String device,
                               @RequestParam(name = "from", required = false) Instant from,
                               @RequestParam(name = "to", required = false) Instant to,
                               @RequestParam(name = "limit", defaultValue = "100") int limit) {
        try (Stream<TestRun> runs = archive.query(kindOrNull(device), from, to)) {
            return runs.limit(Math.max(1, limit)).toList();
        }
    }

    @GetMapping("/latest")
    public TestRun latest(@RequestParam(name = "device", required = false) String device) {
        DeviceKind kind = kindOrNull(device);
        return archive.latest(kind)
                .orElseThrow(() -> new RunNotFoundException("latest" + (kind == null ? "" : " " + kind)));
    }

    @GetMapping("/summary")
    public ArchiveSummary summary() {
        return archive.summary();
    }

    @GetMapping("/compare")
    public RunComparison compare(@RequestParam("a") String a, @RequestParam("b") String b) {
        return archive.compare(a, b);
    }

    /** {@code ids} is comma separated or repeated. */
    @GetMapping("/accuracy")
    public AccuracyRanking accuracy(@RequestParam("ids") List<String> ids) {
        List<TestRun> runs = ids.stream().map(String::trim).filter(s -> !s.isEmpty()).map(archive::get).toList();
        if (runs.stream().noneMatch(r -> r.stats() != null)) {
            throw new IncompatibleRunsException("none of the requested runs has valid samples");
        }
        return statistics.rankAccuracy(runs);
    }

    @GetMapping("/{id}")
    public TestRun get(@PathVariable String id) {
        return archive.get(id);
    }

    @GetMapping("/{id}/analysis")
    public ResponseEntity<DistributionAnalysis> analysis(@PathVariable String id) {
        DistributionAnalysis a = statistics.analyze(archive.get(id).samples());
        return a == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(a);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (!archive.delete(id)) throw new RunNotFoundException(id);
        return ResponseEntity.noContent().build();
    }

    private static DeviceKind kindOrNull(String raw) {
        return (raw == null || raw.isBlank()) ? null : DeviceKind.parse(raw);
    }
}
