package com.crossreview.dispatch.api;

import com.crossreview.core.pipeline.CancelResult;
import com.crossreview.core.pipeline.FingerprintResult;
import com.crossreview.core.pipeline.HighRiskResult;
import com.crossreview.core.pipeline.InvalidateResult;
import com.crossreview.core.pipeline.LowRiskResult;
import com.crossreview.core.pipeline.ReviewError;
import com.crossreview.core.pipeline.ReviewOrchestrator;
import com.crossreview.core.pipeline.StartResult;
import com.crossreview.core.session.SessionRegistry;
import com.crossreview.core.session.SessionSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST surface of the review pipeline. One endpoint per pipeline step; the body is always the
 * operation's result record and the status code mirrors its {@link ReviewError}.
 */
@RestController
@RequestMapping("/api/v1/reviews")
public class ReviewController {

    private final ReviewOrchestrator orchestrator;
    private final SessionRegistry sessions;
    private final SseStreamingService sseStreamingService;

    public ReviewController(ReviewOrchestrator orchestrator, SessionRegistry sessions,
                            SseStreamingService sseStreamingService) {
        this.orchestrator = orchestrator;
        this.sessions = sessions;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/reviews: create a session and classify its files.
     */
    @PostMapping
    public ResponseEntity<StartResult> start(@RequestBody StartReviewRequest request) {
        StartResult result = orchestrator.start(request.projectPath(), request.files(), request.sessionId());
        return respond(result, result.success(), result.error());
    }

    /**
     * POST /api/v1/reviews/{id}/low-risk: confirm the partition and review the low-risk files.
     */
    @PostMapping("/{id}/low-risk")
    public ResponseEntity<LowRiskResult> startLowRisk(@PathVariable String id, @RequestBody LowRiskRequest request) {
        LowRiskResult result = orchestrator.startLowRisk(id, request.lowRiskFiles(), request.highRiskFiles());
        return respond(result, result.success(), result.error());
    }

    /**
     * POST /api/v1/reviews/{id}/high-risk/advance: review the next high-risk file.
     */
    @PostMapping("/{id}/high-risk/advance")
    public ResponseEntity<HighRiskResult> advanceHighRisk(@PathVariable String id) {
        HighRiskResult result = orchestrator.advanceHighRisk(id);
        return respond(result, result.success(), result.error());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<CancelResult> cancel(@PathVariable String id) {
        return ResponseEntity.ok(orchestrator.cancel(id));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SessionSnapshot> getSession(@PathVariable String id) {
        return sessions.find(id)
                .map(session -> ResponseEntity.ok(session.snapshot()))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String id) {
        return sseStreamingService.createEmitter(id);
    }

    @PostMapping("/fingerprints")
    public ResponseEntity<FingerprintResult> fingerprints(@RequestBody ProjectFilesRequest request) {
        FingerprintResult result = orchestrator.computeFingerprints(request.projectPath(), request.files());
        return respond(result, result.success(), result.error());
    }

    /**
     * POST /api/v1/reviews/cache/invalidate: "review again" for the given files (or the whole project).
     */
    @PostMapping("/cache/invalidate")
    public ResponseEntity<InvalidateResult> invalidate(@RequestBody ProjectFilesRequest request) {
        InvalidateResult result = orchestrator.invalidate(request.projectPath(), request.files());
        return respond(result, result.success(), result.error());
    }

    private static <T> ResponseEntity<T> respond(T body, boolean success, ReviewError error) {
        if (success) {
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.status(statusFor(error)).body(body);
    }

    static HttpStatus statusFor(ReviewError error) {
        if (error == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (error) {
            case SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case INVALID_STATE -> HttpStatus.CONFLICT;
            case STAGE_FAILED -> HttpStatus.BAD_GATEWAY;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
