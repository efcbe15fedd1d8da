package com.di.bidshub.upload;

import com.di.bidshub.upload.dto.RunReport;
import com.di.bidshub.upload.dto.UploadRequest;
import com.di.bidshub.upload.manifest.UploadManifest;
import com.di.bidshub.upload.validation.ValidationReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for dataset uploads.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/uploads</td>
 *     <td>Scan, validate, shard and upload a dataset (synchronous)</td></tr>
 * <tr><td>POST</td><td>/api/uploads/validate</td>
 *     <td>Scan and validate only</td></tr>
 * <tr><td>POST</td><td>/api/uploads/{datasetId}/cancel</td>
 *     <td>Stop issuing new shard work for an active run</td></tr>
 * <tr><td>GET</td><td>/api/uploads/{datasetId}/manifest</td>
 *     <td>Persisted upload manifest</td></tr>
 * </table>
 *
 * <p>{@code POST /api/uploads} blocks until the run ends. A validation block is answered
 * by {@link com.di.bidshub.exception.GlobalExceptionHandler} with the full report.
 */
@RestController
@RequestMapping("/api/uploads")
@Slf4j
@RequiredArgsConstructor
public class DatasetUploadController {

    private final DatasetUploadOrchestrator orchestrator;

    /**
     * Returns {@code 201 Created} when the run is complete, {@code 202 Accepted} when it
     * ended with shards outstanding.
     */
    @PostMapping
    public ResponseEntity<RunReport> upload(@Valid @RequestBody UploadRequest request) {
        log.info("[CONTROLLER] POST /api/uploads dataset={} kind={} root={}",
                request.getDatasetId(), request.getDatasetKind(), request.getDatasetRoot());

        RunReport report = orchestrator.execute(request);
        HttpStatus status = report.isComplete() ? HttpStatus.CREATED : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(report);
    }

    @PostMapping("/validate")
    public ValidationReport validate(@Valid @RequestBody UploadRequest request) {
        log.info("[CONTROLLER] POST /api/uploads/validate dataset={} kind={}",
                request.getDatasetId(), request.getDatasetKind());
        return orchestrator.validateOnly(request);
    }

    @PostMapping("/{datasetId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String datasetId) {
        boolean signalled = orchestrator.cancel(datasetId);
        if (!signalled) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("ok", false, "datasetId", datasetId, "message", "No active run"));
        }
        return ResponseEntity.accepted()
                .body(Map.of("ok", true, "datasetId", datasetId, "message", "Cancellation requested"));
    }

    @GetMapping("/{datasetId}/manifest")
    public ResponseEntity<UploadManifest> manifest(@PathVariable String datasetId) {
        return orchestrator.manifest(datasetId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
