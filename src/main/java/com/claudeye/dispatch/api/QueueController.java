package com.claudeye.dispatch.api;

import com.claudeye.core.processing.ItemOutcome;
import com.claudeye.core.processing.SessionItemProcessor;
import com.claudeye.core.processing.WorkTarget;
import com.claudeye.core.scheduler.QueueStatus;
import com.claudeye.core.scheduler.ScheduleOptions;
import com.claudeye.core.scheduler.WorkScheduler;
import com.claudeye.core.scheduler.WorkTask;
import com.claudeye.core.scheduler.WorkType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * REST endpoints for the work queue: run one item at high priority, and
 * report queue status.
 */
@RestController
@RequestMapping("/api")
public class QueueController {

    private static final Logger log = LoggerFactory.getLogger(QueueController.class);

    private final WorkScheduler scheduler;
    private final SessionItemProcessor processor;
    private final long waitMillis;

    public QueueController(WorkScheduler scheduler,
                           SessionItemProcessor processor,
                           @Value("${claudeye.api.queue-wait-ms:10000}") long waitMillis) {
        this.scheduler = scheduler;
        this.processor = processor;
        this.waitMillis = waitMillis;
    }

    /**
     * POST /api/queue-item: schedules one eval, enrichment or action at HIGH
     * priority and waits briefly for it. Returns the item outcome, or 202 with
     * the queue key when the work is still running.
     */
    @PostMapping("/queue-item")
    public ResponseEntity<?> queueItem(@RequestBody QueueItemRequest request) {
        if (!request.hasRequiredFields()) {
            return ResponseEntity.badRequest().body(error("Missing required fields"));
        }
        Optional<WorkType> type = WorkType.fromLabel(request.type());
        if (type.isEmpty()) {
            return ResponseEntity.badRequest().body(error("Invalid type: " + request.type()));
        }

        WorkTarget target = request.isSubagent()
                ? WorkTarget.subagent(request.projectName(), request.sessionId(), request.agentId(),
                        request.subagentType(), request.subagentDescription())
                : WorkTarget.session(request.projectName(), request.sessionId());
        String queueSessionId = target.sessionKey();
        boolean force = request.isForceRefresh();

        CompletableFuture<ItemOutcome<?>> future = scheduler.schedule(type.get(), request.projectName(),
                queueSessionId, request.itemName(), task(type.get(), target, request.itemName(), force),
                ScheduleOptions.high().withForceRefresh(force));

        try {
            return ResponseEntity.ok(future.get(waitMillis, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("ok", true);
            body.put("queued", true);
            body.put("key", WorkScheduler.key(type.get(), request.projectName(), queueSessionId, request.itemName()));
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Queue item {} failed: {}", request.itemName(), cause.getMessage(), cause);
            return ResponseEntity.internalServerError().body(error(
                    cause.getMessage() != null ? cause.getMessage() : cause.toString()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.internalServerError().body(error("Interrupted while waiting for queue item"));
        }
    }

    /**
     * GET /api/queue-status: snapshot of pending, processing and completed work.
     */
    @GetMapping("/queue-status")
    public QueueStatus queueStatus() {
        return scheduler.getStatus();
    }

    private WorkTask<ItemOutcome<?>> task(WorkType type, WorkTarget target, String itemName, boolean force) {
        return switch (type) {
            case EVAL -> () -> processor.processEval(target, itemName, force);
            case ENRICHMENT -> () -> processor.processEnrichment(target, itemName, force);
            case ACTION -> () -> processor.processAction(target, itemName, force);
        };
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("error", message);
        return body;
    }
}
