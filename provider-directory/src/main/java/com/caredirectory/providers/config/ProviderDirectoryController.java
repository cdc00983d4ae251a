package com.caredirectory.providers.config;

import com.caredirectory.providers.model.HealthcareProviderDetail;
import com.caredirectory.providers.model.HealthcareProviderDetailList;
import com.caredirectory.providers.model.HealthcareProviderId;
import com.caredirectory.providers.model.HealthcareProviderIdList;
import com.caredirectory.providers.model.UpdateStatus;
import com.caredirectory.providers.model.UpdateStatusMessage;
import com.caredirectory.providers.service.ProviderQueryService;
import com.caredirectory.providers.service.ProviderRefreshService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;

@RestController
@RequestMapping("/providers")
@RequiredArgsConstructor
public class ProviderDirectoryController {

    private final ProviderRefreshService refreshService;
    private final ProviderQueryService queryService;

    // ── Refresh ───────────────────────────────────────────────────────────────

    /**
     * Runs a refresh synchronously. 422 if one is already running or the cycle fails.
     */
    @PostMapping("/update")
    public ResponseEntity<UpdateStatusMessage> update() {
        return ResponseEntity.ok(refreshService.runUpdate());
    }

    @GetMapping("/status")
    public ResponseEntity<UpdateStatus> status() {
        return ResponseEntity.ok(queryService.getStatus());
    }

    // ── Data ─────────────────────────────────────────────────────────────────

    @GetMapping("/all")
    public ResponseEntity<FileSystemResource> all() {
        Path snapshot = queryService.currentSnapshotPath();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("application/zip"))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(snapshot.getFileName().toString())
                        .build()
                        .toString())
                .body(new FileSystemResource(snapshot));
    }

    @GetMapping("/detail")
    public ResponseEntity<HealthcareProviderDetail> detail(@RequestParam Long locationId,
                                                           @RequestParam Long institutionId) {
        return ResponseEntity.ok(queryService.getDetail(new HealthcareProviderId(locationId, institutionId)));
    }

    @PostMapping("/details")
    public ResponseEntity<HealthcareProviderDetailList> details(@RequestBody HealthcareProviderIdList ids) {
        return ResponseEntity.ok(queryService.getDetails(ids));
    }
}
