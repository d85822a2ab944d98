package com.baleen.corpus.ingest.api;

import com.baleen.corpus.config.IngestProperties;
import com.baleen.corpus.ingest.model.SchedulerStatus;
import com.baleen.corpus.ingest.service.IngestionSchedulerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final IngestionSchedulerService schedulerService;
    private final IngestProperties properties;

    public SchedulerController(IngestionSchedulerService schedulerService, IngestProperties properties) {
        this.schedulerService = schedulerService;
        this.properties = properties;
    }

    @PostMapping("/start")
    public SchedulerStatus start(@RequestParam(name = "intervalSeconds", required = false) Long intervalSeconds) {
        long seconds = intervalSeconds == null ? properties.getScheduler().getIntervalSeconds() : intervalSeconds;
        return schedulerService.start(Duration.ofSeconds(seconds));
    }

    @PostMapping("/stop")
    public SchedulerStatus stop() {
        return schedulerService.stop();
    }

    @GetMapping("/status")
    public SchedulerStatus status() {
        return schedulerService.getStatus();
    }
}
