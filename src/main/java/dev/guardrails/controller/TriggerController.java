package dev.guardrails.controller;

import dev.guardrails.pipeline.EventRouter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Operator entry point: scans a pull request on demand, outside the webhook path.
 */
@RestController
@RequestMapping("/trigger")
public class TriggerController {
    private final EventRouter eventRouter;
    public TriggerController(EventRouter eventRouter) { this.eventRouter = eventRouter; }

    @PostMapping("/{owner}/{repo}/{pr}")
    public ResponseEntity<Map<String, Object>> trigger(@PathVariable String owner,
                                                       @PathVariable String repo,
                                                       @PathVariable int pr) {
        if (pr <= 0) throw new IllegalArgumentException("Pull request number must be positive: " + pr);
        return ResponseEntity.ok(eventRouter.trigger(owner, repo, pr).toResponseBody());
    }
}
