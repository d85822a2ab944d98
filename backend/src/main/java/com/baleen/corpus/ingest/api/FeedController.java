package com.baleen.corpus.ingest.api;

import com.baleen.corpus.ingest.model.FeedRecord;
import com.baleen.corpus.ingest.model.FeedRegistration;
import com.baleen.corpus.ingest.model.FeedSeedSummary;
import com.baleen.corpus.ingest.model.FeedStatus;
import com.baleen.corpus.ingest.service.FeedRegistryService;
import com.baleen.corpus.ingest.service.IngestStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/feeds")
public class FeedController {
    private final FeedRegistryService registryService;
    private final IngestStatusService statusService;

    public FeedController(FeedRegistryService registryService, IngestStatusService statusService) {
        this.registryService = registryService;
        this.statusService = statusService;
    }

    @GetMapping
    public List<FeedRecord> feeds(
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "category", required = false) String category
    ) {
        return statusService.listFeeds(ApiParams.parseEnum("status", status, FeedStatus.class), category);
    }

    @PostMapping
    public FeedRecord register(@RequestBody FeedRegistration registration) {
        return registryService.register(registration);
    }

    @PostMapping("/seed")
    public FeedSeedSummary seed(@RequestParam(name = "path", required = false) String path) {
        return registryService.importSeedCsv(path);
    }

    @PostMapping("/{feedId}/deactivate")
    public FeedRecord deactivate(@PathVariable("feedId") long feedId) {
        return registryService.deactivate(feedId);
    }

    @PostMapping("/{feedId}/reactivate")
    public FeedRecord reactivate(@PathVariable("feedId") long feedId) {
        return registryService.reactivate(feedId);
    }
}
