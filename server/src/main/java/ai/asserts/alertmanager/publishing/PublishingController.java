/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

import static org.springframework.http.MediaType.APPLICATION_JSON_VALUE;

@Slf4j
@RestController
@SuppressWarnings("unused")
public class PublishingController {
    private static final String TARGETS = "/api/v2/publishing/targets";
    private static final String TARGETS_REFRESH = "/api/v2/publishing/targets/refresh";
    private static final String TARGETS_STATUS = "/api/v2/publishing/targets/status";

    private final RefreshManager refreshManager;
    private final PublishingTargetRegistry targetRegistry;

    public PublishingController(RefreshManager refreshManager, PublishingTargetRegistry targetRegistry) {
        this.refreshManager = refreshManager;
        this.targetRegistry = targetRegistry;
    }

    /**
     * 202 when a refresh was started. Rejections are mapped by the exception handler.
     */
    @PostMapping(path = TARGETS_REFRESH, produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> refresh() {
        refreshManager.refreshNow();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ImmutableMap.of(
                "status", "accepted",
                "message", "Target refresh started"));
    }

    @GetMapping(path = TARGETS_STATUS, produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<RefreshStatus> status() {
        return ResponseEntity.ok(refreshManager.getStatus());
    }

    @GetMapping(path = TARGETS, produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<List<PublishingTarget>> targets() {
        return ResponseEntity.ok(targetRegistry.getTargets());
    }
}
