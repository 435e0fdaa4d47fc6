package com.project.image.bgremover.controller;

import com.project.image.bgremover.DTOs.BackgroundSpec;
import com.project.image.bgremover.DTOs.BatchItemResult;
import com.project.image.bgremover.DTOs.ChangeBackgroundRequest;
import com.project.image.bgremover.DTOs.OutputFormat;
import com.project.image.bgremover.DTOs.ProcessingOptions;
import com.project.image.bgremover.exceptions.ModelUnavailableException;
import com.project.image.bgremover.exceptions.StorageException;
import com.project.image.bgremover.service.BackgroundRemovalService;
import com.project.image.bgremover.service.StorageService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON API around the background removal pipeline. Uploads and results live on disk through
 * {@link StorageService}; the pipeline itself only sees file paths.
 */
@RestController
@RequestMapping("/api")
@Validated
public class BackgroundRemovalController {
    private static final Logger log = LoggerFactory.getLogger(BackgroundRemovalController.class);

    private static final int GALLERY_LIMIT = 50;

    private final BackgroundRemovalService backgroundRemovalService;
    private final StorageService storageService;

    @Value("${app.batch.max-files:10}")
    private int maxBatchFiles;

    public BackgroundRemovalController(BackgroundRemovalService backgroundRemovalService, StorageService storageService) {
        this.backgroundRemovalService = backgroundRemovalService;
        this.storageService = storageService;
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(name = "background_color", defaultValue = ProcessingOptions.TRANSPARENT) String backgroundColor,
            @RequestParam(name = "background_image", required = false) String backgroundImage,
            @RequestParam(name = "output_format", defaultValue = "png") String outputFormat) throws IOException {

        ProcessingOptions options = toOptions(backgroundColor, backgroundImage, outputFormat);
        // nothing is written to disk while the model is unavailable
        if (!backgroundRemovalService.isModelReady()) {
            throw new ModelUnavailableException("AI model not available. Background removal is disabled.");
        }
        var stored = storageService.store(file);
        log.info("Processing file: {} ({}KB)", file.getOriginalFilename(), file.getSize() / 1024);

        var processed = backgroundRemovalService.removeBackgroundAndStore(stored.path(), options);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("original_url", "/" + stored.relativeWebPath());
        body.put("processed_url", "/" + processed.relativeWebPath());
        body.put("original_filename", stored.filename());
        body.put("processed_filename", processed.filename());
        body.put("original_size", Files.size(stored.path()));
        body.put("processed_size", Files.size(processed.path()));
        body.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.ok(body);
    }

    @PostMapping(value = "/batch-upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> batchUpload(
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam(name = "background_color", defaultValue = ProcessingOptions.TRANSPARENT) String backgroundColor,
            @RequestParam(name = "background_image", required = false) String backgroundImage,
            @RequestParam(name = "output_format", defaultValue = "png") String outputFormat) {

        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("No files provided");
        }
        if (files.size() > maxBatchFiles) {
            throw new IllegalArgumentException("Maximum " + maxBatchFiles + " files allowed per batch");
        }
        ProcessingOptions options = toOptions(backgroundColor, backgroundImage, outputFormat);
        if (!backgroundRemovalService.isModelReady()) {
            throw new ModelUnavailableException("AI model not available. Background removal is disabled.");
        }

        List<BatchItemResult> results = new ArrayList<>();
        List<Path> storedPaths = new ArrayList<>();
        List<String> originalNames = new ArrayList<>();
        for (MultipartFile file : files) {
            try {
                storedPaths.add(storageService.store(file).path());
                originalNames.add(file.getOriginalFilename());
            } catch (StorageException e) {
                log.warn("Skipping upload {}: {}", file.getOriginalFilename(), e.getMessage());
                results.add(BatchItemResult.failed(file.getOriginalFilename(), e.errorKind(), e.getMessage()));
            }
        }

        List<BatchItemResult> processed = backgroundRemovalService.removeBackgroundBatch(storedPaths, options);
        for (int i = 0; i < processed.size(); i++) {
            BatchItemResult item = processed.get(i);
            // report the name the client uploaded, not the storage name
            results.add(new BatchItemResult(item.success(), originalNames.get(i), item.processedFilename(),
                    item.processedUrl(), item.errorKind(), item.error()));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("results", results);
        body.put("total", files.size());
        body.put("processed", results.stream().filter(BatchItemResult::success).count());
        return ResponseEntity.ok(body);
    }

    @PostMapping(value = "/change-background", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> changeBackground(@Valid @RequestBody ChangeBackgroundRequest request) {
        Path subject = storageService.resolveProcessed(Path.of(request.originalFile()).getFileName().toString());
        if (!Files.isRegularFile(subject)) {
            return notFound();
        }
        OutputFormat format = OutputFormat.parse(request.outputFormat());
        var stored = backgroundRemovalService.changeBackgroundAndStore(subject, toBackgroundSpec(request), format);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("url", "/" + stored.relativeWebPath());
        body.put("filename", stored.filename());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/download/{filename}")
    public ResponseEntity<Resource> download(@PathVariable String filename) {
        Path path = storageService.resolveProcessed(filename);
        if (!Files.isRegularFile(path)) {
            return ResponseEntity.notFound().build();
        }
        Resource resource = new FileSystemResource(path);
        return ResponseEntity.ok()
                .contentType(MediaTypeFactory.getMediaType(resource).orElse(MediaType.APPLICATION_OCTET_STREAM))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(path.getFileName().toString()).build().toString())
                .body(resource);
    }

    @DeleteMapping("/delete/{filename}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String filename) {
        if (!storageService.deleteProcessed(filename)) {
            return notFound();
        }
        log.info("Deleted processed image {}", filename);
        return ResponseEntity.ok(Map.of("success", true));
    }

    @GetMapping("/gallery")
    public Map<String, Object> gallery() {
        List<Map<String, Object>> images = new ArrayList<>();
        for (StorageService.GalleryEntry entry : storageService.listProcessed(GALLERY_LIMIT)) {
            Map<String, Object> image = new LinkedHashMap<>();
            image.put("filename", entry.filename());
            image.put("url", "/" + entry.relativeWebPath());
            image.put("size", entry.size());
            image.put("created", entry.created().toString());
            images.add(image);
        }
        return Map.of("images", images);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("model_loaded", backgroundRemovalService.isModelReady());
        body.put("timestamp", LocalDateTime.now().toString());
        return body;
    }

    private ProcessingOptions toOptions(String backgroundColor, String backgroundImage, String outputFormat) {
        // background images are previously uploaded files, addressed by name
        Path backgroundPath = StringUtils.hasText(backgroundImage)
                ? storageService.resolveUpload(Path.of(backgroundImage).getFileName().toString())
                : null;
        return new ProcessingOptions(backgroundColor, backgroundPath, OutputFormat.parse(outputFormat));
    }

    private BackgroundSpec toBackgroundSpec(ChangeBackgroundRequest request) {
        String type = request.backgroundType() == null ? "color" : request.backgroundType();
        switch (type) {
            case "image":
                return BackgroundSpec.image(StringUtils.hasText(request.backgroundValue())
                        ? storageService.resolveUpload(Path.of(request.backgroundValue()).getFileName().toString())
                        : null);
            case "gradient":
                ChangeBackgroundRequest.Gradient gradient = request.gradient();
                return gradient == null
                        ? BackgroundSpec.gradient(null, null)
                        : BackgroundSpec.gradient(gradient.color1(), gradient.color2());
            case "color":
                return BackgroundSpec.color(request.backgroundValue() == null ? "#ffffff" : request.backgroundValue());
            default:
                throw new IllegalArgumentException("Unknown background type: " + type);
        }
    }

    private static ResponseEntity<Map<String, Object>> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "File not found"));
    }
}
