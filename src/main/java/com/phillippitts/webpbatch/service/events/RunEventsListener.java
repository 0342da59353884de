package com.phillippitts.webpbatch.service.events;

import com.phillippitts.webpbatch.service.run.event.RunFinishedEvent;
import com.phillippitts.webpbatch.service.run.event.RunProgressEvent;
import com.phillippitts.webpbatch.service.run.event.RunStatusEvent;
import com.phillippitts.webpbatch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes run events to the log. Progress is throttled per run to avoid log spam; status lines
 * go to DEBUG since a large folder produces one per image.
 */
@Component
class RunEventsListener {
    private static final Logger LOG = LogManager.getLogger(RunEventsListener.class);

    private static final Duration THROTTLE = Duration.ofSeconds(5);
    private static final int MAX_STATUS_CHARS = 500;

    private final Map<String, Instant> lastProgressLog = new ConcurrentHashMap<>();

    @EventListener
    void onProgress(RunProgressEvent e) {
        if (e.percent() >= 100 || shouldLog(e.runId())) {
            LOG.info("Run {} progress: {}%", e.runId(), e.percent());
        }
    }

    @EventListener
    void onStatus(RunStatusEvent e) {
        LOG.debug("Run {} status: {}", e.runId(),
                LogSanitizer.truncate(LogSanitizer.singleLine(e.message()), MAX_STATUS_CHARS));
    }

    @EventListener
    void onFinished(RunFinishedEvent e) {
        lastProgressLog.remove(e.runId());
        LOG.debug("Run {} finished", e.runId());
    }

    // Package-private for tests
    boolean shouldLog(String runId) {
        Instant now = Instant.now();
        Instant prev = lastProgressLog.get(runId);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastProgressLog.put(runId, now);
            return true;
        }
        return false;
    }
}
