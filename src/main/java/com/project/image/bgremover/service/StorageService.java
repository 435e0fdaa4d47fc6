package com.project.image.bgremover.service;

import com.project.image.bgremover.DTOs.OutputFormat;
import com.project.image.bgremover.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Keeps uploaded originals and processed results in two directories on disk.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);

    public static final Set<String> ALLOWED_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp", "bmp");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path uploadDir;
    private final Path processedDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String uploadRoot,
                          @Value("${app.processed.dir:processed}") String processedRoot) {
        this.uploadDir = createDirectory(uploadRoot);
        this.processedDir = createDirectory(processedRoot);
        log.info("Using upload directory: {}, processed directory: {}", uploadDir, processedDir);
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public record GalleryEntry(String filename, String relativeWebPath, long size, FileTime created) {}

    public Path uploadDir() { return uploadDir; }

    public Path processedDir() { return processedDir; }

    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        if (!isAllowed(original)) {
            throw new StorageException("Invalid file type. Allowed: " + String.join(", ", ALLOWED_EXTENSIONS));
        }
        String filename = uniqueName(extensionOf(original));
        Path target = uploadDir.resolve(filename);
        try {
            Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    /** Stores a result as {@code <base>_<suffix>.<ext>}, next to the other processed images. */
    public StoredFile storeResult(String sourceFilename, String suffix, OutputFormat format, byte[] bytes) {
        String base = baseName(sourceFilename);
        String filename = base + "_" + suffix + "." + format.extension();
        Path target = processedDir.resolve(filename);
        try {
            Files.write(target, bytes);
            return new StoredFile(target, filename, "processed/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store result image", e);
        }
    }

    /** Resolves a name inside the processed directory; anything escaping it is rejected. */
    public Path resolveProcessed(String filename) {
        return resolveInside(processedDir, filename);
    }

    public Path resolveUpload(String filename) {
        return resolveInside(uploadDir, filename);
    }

    public boolean deleteProcessed(String filename) {
        try {
            return Files.deleteIfExists(resolveProcessed(filename));
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + filename, e);
        }
    }

    /** Processed images, newest first. */
    public List<GalleryEntry> listProcessed(int limit) {
        List<GalleryEntry> entries = new ArrayList<>();
        try (Stream<Path> files = Files.list(processedDir)) {
            for (Path path : (Iterable<Path>) files::iterator) {
                String name = path.getFileName().toString();
                if (!Files.isRegularFile(path) || !isAllowed(name)) continue;
                FileTime modified = Files.getLastModifiedTime(path);
                entries.add(new GalleryEntry(name, "processed/" + name, Files.size(path), modified));
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list processed images", e);
        }
        entries.sort(Comparator.comparing(GalleryEntry::created).reversed());
        return entries.size() > limit ? new ArrayList<>(entries.subList(0, limit)) : entries;
    }

    public static boolean isAllowed(String filename) {
        return filename != null && ALLOWED_EXTENSIONS.contains(extensionOf(filename));
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static String baseName(String filename) {
        String name = Paths.get(filename).getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot <= 0 ? name : name.substring(0, dot);
        return base.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    private static String uniqueName(String extension) {
        String timestamp = TIMESTAMP.format(LocalDateTime.now());
        String uniqueId = UUID.randomUUID().toString().substring(0, 8);
        return timestamp + "_" + uniqueId + "." + (extension.isEmpty() ? "png" : extension);
    }

    private static Path resolveInside(Path root, String filename) {
        if (!StringUtils.hasText(filename)) {
            throw new StorageException("Filename required");
        }
        Path resolved = root.resolve(filename).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new StorageException("Invalid filename: " + filename);
        }
        return resolved;
    }

    private static Path createDirectory(String root) {
        Path dir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create directory: " + dir, e);
        }
        return dir;
    }
}
