package com.project.image.bgremover.service;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Fetches the model weights from an ordered list of mirrors. The only integrity check is the
 * byte count: it must match the {@code Content-Length} header when the server sends one, the
 * expected size when one is configured, and reach the minimum size.
 */
@Component
public class ModelDownloader {
    private static final Logger log = LoggerFactory.getLogger(ModelDownloader.class);

    private final OkHttpClient httpClient;

    public ModelDownloader(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /** True when {@code target} exists and is at least {@code minSizeBytes} long. */
    public boolean isUsable(Path target, long minSizeBytes) {
        if (!Files.isRegularFile(target)) {
            return false;
        }
        try {
            long size = Files.size(target);
            if (size < minSizeBytes) {
                log.warn("Model file {} seems corrupted (too small: {} bytes)", target, size);
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("Cannot inspect model file {}: {}", target, e.getMessage());
            return false;
        }
    }

    /**
     * Tries each mirror in order until one yields a file of acceptable size.
     *
     * @param expectedSizeBytes exact size to require, or {@code <= 0} to skip that check
     * @return whether {@code target} now holds a downloaded model
     */
    public boolean download(List<String> mirrors, Path target, long minSizeBytes, long expectedSizeBytes) {
        if (mirrors.isEmpty()) {
            log.warn("No model mirrors configured, cannot download {}", target.getFileName());
            return false;
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            log.error("Cannot create model directory for {}", target, e);
            return false;
        }

        Path part = target.resolveSibling(target.getFileName() + ".part");
        for (int i = 0; i < mirrors.size(); i++) {
            String url = mirrors.get(i).trim();
            log.info("Downloading model, attempt {}/{} from {}", i + 1, mirrors.size(), url);
            try {
                long size = fetch(url, part);
                checkSize(size, minSizeBytes, expectedSizeBytes);
                Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
                log.info("Model downloaded to {} ({} bytes)", target, size);
                return true;
            } catch (IOException | RuntimeException e) {
                log.warn("Download from {} failed: {}", url, e.getMessage());
                deleteQuietly(part);
            }
        }
        log.error("All {} model download attempts failed. Place the weights manually at {}",
                mirrors.size(), target.toAbsolutePath());
        return false;
    }

    private long fetch(String url, Path destination) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Empty response body");
            }
            long declared = body.contentLength();
            long written;
            try (InputStream in = body.byteStream()) {
                written = Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
            }
            if (declared >= 0 && declared != written) {
                throw new IOException("Size mismatch: received " + written + " of " + declared + " bytes");
            }
            return written;
        }
    }

    private static void checkSize(long size, long minSizeBytes, long expectedSizeBytes) throws IOException {
        if (expectedSizeBytes > 0 && size != expectedSizeBytes) {
            throw new IOException("Size mismatch: received " + size + " bytes, expected " + expectedSizeBytes);
        }
        if (size < minSizeBytes) {
            throw new IOException("Downloaded file too small: " + size + " bytes");
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete partial download {}: {}", path, e.getMessage());
        }
    }
}
