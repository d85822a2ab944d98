package com.baleen.corpus.ingest.api;

import com.baleen.corpus.ingest.export.CorpusExportService;
import com.baleen.corpus.ingest.model.ExportSummary;
import com.baleen.corpus.ingest.model.IngestionJob;
import com.baleen.corpus.ingest.model.JobStatus;
import com.baleen.corpus.ingest.model.ReextractionSummary;
import com.baleen.corpus.ingest.model.StatusResponse;
import com.baleen.corpus.ingest.service.IngestStatusService;
import com.baleen.corpus.ingest.service.IngestionSchedulerService;
import com.baleen.corpus.ingest.service.ReextractionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Set;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class IngestController {
    private final IngestionSchedulerService schedulerService;
    private final IngestStatusService statusService;
    private final ReextractionService reextractionService;
    private final CorpusExportService exportService;

    public IngestController(
        IngestionSchedulerService schedulerService,
        IngestStatusService statusService,
        ReextractionService reextractionService,
        CorpusExportService exportService
    ) {
        this.schedulerService = schedulerService;
        this.statusService = statusService;
        this.reextractionService = reextractionService;
        this.exportService = exportService;
    }

    @PostMapping("/ingest/run")
    public IngestionJob runOnce() {
        return schedulerService.runOnce();
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/jobs")
    public List<IngestionJob> jobs(
        @RequestParam(name = "from", required = false) String from,
        @RequestParam(name = "to", required = false) String to,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "feedId", required = false) Long feedId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return statusService.listJobs(
            ApiParams.parseInstant("from", from),
            ApiParams.parseInstant("to", to),
            ApiParams.parseEnum("status", status, JobStatus.class),
            feedId,
            limit
        );
    }

    @GetMapping("/jobs/{jobId}")
    public IngestionJob job(@PathVariable("jobId") long jobId) {
        IngestionJob job = statusService.getJob(jobId);
        if (job == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown ingestion job " + jobId);
        }
        return job;
    }

    @PostMapping("/posts/reextract")
    public ReextractionSummary reextract(@RequestParam(name = "limit", required = false) Integer limit) {
        return reextractionService.reextractDegraded(limit);
    }

    @PostMapping("/export")
    public ExportSummary export(
        @RequestParam(name = "root", required = false) String root,
        @RequestParam(name = "format", required = false, defaultValue = "json") String format,
        @RequestParam(name = "level", required = false, defaultValue = "safe") String level,
        @RequestParam(name = "category", required = false) Set<String> categories
    ) {
        return exportService.export(root, format, level, categories);
    }
}
