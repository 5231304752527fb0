package org.iceforge.tilecut.api;

import org.iceforge.tilecut.TilecutProperties;
import org.iceforge.tilecut.catalog.CatalogInspector;
import org.iceforge.tilecut.catalog.CatalogReport;
import org.iceforge.tilecut.catalog.CatalogUploadStore;
import org.iceforge.tilecut.catalog.UploadedCatalog;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Client-side catalogs: upload one, check it, then submit a task with its {@code uploadId}.
 */
@RestController
@RequestMapping("/api/catalogs")
public class CatalogController {

    private final CatalogUploadStore uploads;
    private final CatalogInspector inspector;
    private final TilecutProperties props;

    public CatalogController(CatalogUploadStore uploads, CatalogInspector inspector, TilecutProperties props) {
        this.uploads = Objects.requireNonNull(uploads);
        this.inspector = Objects.requireNonNull(inspector);
        this.props = Objects.requireNonNull(props);
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadedCatalog> upload(@RequestParam("catalog") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded catalog is empty");
        }
        try (InputStream in = file.getInputStream()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(uploads.store(file.getOriginalFilename(), in));
        }
    }

    @GetMapping("/{uploadId}/validation")
    public ResponseEntity<CatalogReport> validate(@PathVariable String uploadId,
                                                  @RequestParam(required = false) String raColumn,
                                                  @RequestParam(required = false) String decColumn,
                                                  @RequestParam(required = false) String idColumn,
                                                  @RequestParam(required = false) Integer maxRows) {
        int cap = maxRows != null ? maxRows : props.getMaxCatalogRows();
        if (cap < 1) {
            throw new IllegalArgumentException("maxRows must be positive");
        }
        return uploads.resolve(uploadId)
                .map(path -> ResponseEntity.ok(inspector.inspect(path, raColumn, decColumn, idColumn, cap)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
