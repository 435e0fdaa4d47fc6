package com.project.image.bgremover.service;

import com.project.image.bgremover.DTOs.AlphaMask;
import com.project.image.bgremover.DTOs.BackgroundSpec;
import com.project.image.bgremover.DTOs.BatchItemResult;
import com.project.image.bgremover.DTOs.OutputFormat;
import com.project.image.bgremover.DTOs.PreprocessedImage;
import com.project.image.bgremover.DTOs.ProcessingOptions;
import com.project.image.bgremover.DTOs.RawMask;
import com.project.image.bgremover.DTOs.RemovalResult;
import com.project.image.bgremover.exceptions.BackgroundRemovalException;
import com.project.image.bgremover.exceptions.InferenceException;
import com.project.image.bgremover.exceptions.ModelUnavailableException;
import com.project.image.bgremover.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Background removal pipeline: preprocess, predict, postprocess, composite, encode.
 * Every call works on its own intermediate data; the model is the only shared state.
 */
@Service
public class BackgroundRemovalService {
    private static final Logger log = LoggerFactory.getLogger(BackgroundRemovalService.class);

    private final SaliencyModel model;
    private final ImagePreprocessor preprocessor;
    private final MaskPostprocessor postprocessor;
    private final Compositor compositor;
    private final BackgroundSynthesizer backgroundSynthesizer;
    private final ImageEncoder encoder;
    private final ImageLoader imageLoader;
    private final StorageService storageService;

    public BackgroundRemovalService(SaliencyModel model,
                                    ImagePreprocessor preprocessor,
                                    MaskPostprocessor postprocessor,
                                    Compositor compositor,
                                    BackgroundSynthesizer backgroundSynthesizer,
                                    ImageEncoder encoder,
                                    ImageLoader imageLoader,
                                    StorageService storageService) {
        this.model = model;
        this.preprocessor = preprocessor;
        this.postprocessor = postprocessor;
        this.compositor = compositor;
        this.backgroundSynthesizer = backgroundSynthesizer;
        this.encoder = encoder;
        this.imageLoader = imageLoader;
        this.storageService = storageService;
    }

    public boolean isModelReady() {
        return model.isReady();
    }

    /**
     * Removes the background of the image at {@code path}.
     *
     * @throws ModelUnavailableException if the model is not loaded
     * @throws com.project.image.bgremover.exceptions.DecodeException if the file is not an image
     * @throws InferenceException if the model fails on this input
     */
    public RemovalResult removeBackground(Path path, ProcessingOptions options) {
        if (!model.isReady()) {
            throw new ModelUnavailableException("Model not loaded. Cannot process image.");
        }
        log.info("Removing background from {} (background={}, format={})", path.getFileName(),
                options.backgroundImagePath() != null ? "image" : options.backgroundColor(), options.outputFormat());

        PreprocessedImage preprocessed = preprocessor.preprocess(path);
        RawMask raw = predict(preprocessed);
        AlphaMask mask = postprocessor.postprocess(raw, preprocessed.originalWidth(), preprocessed.originalHeight());
        BufferedImage composite = compositor.composite(preprocessed.source(), mask, options);
        byte[] encoded = encoder.encode(composite, options.outputFormat());

        log.info("Background removed from {} ({}x{})", path.getFileName(),
                composite.getWidth(), composite.getHeight());
        return new RemovalResult(encoded, options.outputFormat(), composite.getWidth(), composite.getHeight());
    }

    /** Removes the background and stores the result as {@code <name>_processed.<ext>}. */
    public StorageService.StoredFile removeBackgroundAndStore(Path path, ProcessingOptions options) {
        RemovalResult result = removeBackground(path, options);
        return storageService.storeResult(path.getFileName().toString(), "processed", result.format(), result.encoded());
    }

    /**
     * Processes each image independently. A failing image, whether it fails to decode, to run or
     * to be stored, is reported in its own entry and does not stop the others.
     */
    public List<BatchItemResult> removeBackgroundBatch(List<Path> paths, ProcessingOptions options) {
        List<BatchItemResult> results = new ArrayList<>(paths.size());
        for (Path path : paths) {
            String name = path.getFileName().toString();
            try {
                StorageService.StoredFile stored = removeBackgroundAndStore(path, options);
                results.add(BatchItemResult.ok(name, stored.filename(), "/" + stored.relativeWebPath()));
            } catch (BackgroundRemovalException e) {
                log.warn("Batch item {} failed: {} ({})", name, e.getMessage(), e.errorKind());
                results.add(BatchItemResult.failed(name, e.errorKind(), e.getMessage()));
            } catch (StorageException e) {
                log.warn("Batch item {} could not be stored: {}", name, e.getMessage());
                results.add(BatchItemResult.failed(name, e.errorKind(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Batch item {} failed unexpectedly", name, e);
                results.add(BatchItemResult.failed(name, "ProcessingError", "Error processing image: " + e.getMessage()));
            }
        }
        long ok = results.stream().filter(BatchItemResult::success).count();
        log.info("Batch finished: {}/{} images processed", ok, paths.size());
        return results;
    }

    /**
     * Puts a previously produced subject image on a new background. No inference is involved, so
     * this works while the model is unavailable.
     */
    public RemovalResult changeBackground(Path subjectPath, BackgroundSpec spec, OutputFormat format) {
        BufferedImage loaded = imageLoader.read(subjectPath);
        BufferedImage subject = toArgb(loaded);
        BufferedImage background = backgroundSynthesizer.synthesize(subject.getWidth(), subject.getHeight(), spec);
        BufferedImage composite = compositor.over(subject, background);
        byte[] encoded = encoder.encode(composite, format);
        log.info("Background of {} changed to {}", subjectPath.getFileName(), spec.kind());
        return new RemovalResult(encoded, format, composite.getWidth(), composite.getHeight());
    }

    public StorageService.StoredFile changeBackgroundAndStore(Path subjectPath, BackgroundSpec spec, OutputFormat format) {
        RemovalResult result = changeBackground(subjectPath, spec, format);
        String suffix = "bg_" + spec.kind().name().toLowerCase(Locale.ROOT);
        return storageService.storeResult(subjectPath.getFileName().toString(), suffix, result.format(), result.encoded());
    }

    private RawMask predict(PreprocessedImage preprocessed) {
        try {
            return model.predict(preprocessed.input());
        } catch (BackgroundRemovalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InferenceException("Error processing image: " + e.getMessage(), e);
        }
    }

    private static BufferedImage toArgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_ARGB) {
            return image;
        }
        int w = image.getWidth(), h = image.getHeight();
        BufferedImage argb = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        argb.setRGB(0, 0, w, h, image.getRGB(0, 0, w, h, null, 0, w), 0, w);
        return argb;
    }
}
