package com.phillippitts.webpbatch.presentation.controller;

import com.phillippitts.webpbatch.config.properties.ConversionProperties;
import com.phillippitts.webpbatch.domain.RunConfiguration;
import com.phillippitts.webpbatch.service.history.HistoryEntry;
import com.phillippitts.webpbatch.service.history.RunHistoryStore;
import com.phillippitts.webpbatch.service.run.ConversionRunService;
import com.phillippitts.webpbatch.service.run.RunSnapshot;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

/**
 * REST surface for conversion runs and their history.
 */
@RestController
@RequestMapping("/api")
class ConversionController {

    private static final Logger LOG = LogManager.getLogger(ConversionController.class);

    private final ConversionRunService runService;
    private final RunHistoryStore historyStore;
    private final ConversionProperties defaults;

    ConversionController(ConversionRunService runService, RunHistoryStore historyStore,
                         ConversionProperties defaults) {
        this.runService = runService;
        this.historyStore = historyStore;
        this.defaults = defaults;
    }

    @PostMapping("/runs")
    ResponseEntity<RunSnapshot> start(@Valid @RequestBody RunRequest request) {
        RunConfiguration config = toConfiguration(request);
        LOG.info("Run requested for {} folder(s)", config.folders().size());
        return ResponseEntity.accepted().body(runService.start(config));
    }

    @GetMapping("/runs/current")
    ResponseEntity<RunSnapshot> current() {
        return ResponseEntity.ok(runService.current());
    }

    @PostMapping("/runs/current/cancel")
    ResponseEntity<RunSnapshot> cancel() {
        return ResponseEntity.accepted().body(runService.cancel());
    }

    @GetMapping("/history")
    ResponseEntity<List<HistoryEntry>> history() {
        return ResponseEntity.ok(historyStore.list());
    }

    @DeleteMapping("/history")
    ResponseEntity<Void> clearHistory() {
        historyStore.clear();
        LOG.info("Run history cleared");
        return ResponseEntity.noContent().build();
    }

    RunConfiguration toConfiguration(RunRequest request) {
        List<Path> folders = request.folders().stream().map(Path::of).toList();
        return new RunConfiguration(
                folders,
                request.quality() != null ? request.quality() : defaults.getDefaultQuality(),
                request.archiveFormat() != null ? request.archiveFormat() : defaults.getDefaultArchiveFormat(),
                Boolean.TRUE.equals(request.replaceOriginals()),
                request.skipExistingWebp() != null ? request.skipExistingWebp() : defaults.isSkipExistingWebp());
    }
}
