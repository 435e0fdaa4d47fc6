package com.project.image.bgremover.service;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import com.project.image.bgremover.DTOs.NormalizedArray;
import com.project.image.bgremover.DTOs.RawMask;
import com.project.image.bgremover.exceptions.InferenceException;
import com.project.image.bgremover.exceptions.ModelUnavailableException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.FloatBuffer;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * U2-Net exported to ONNX, run with ONNX Runtime. The session is created once and only read
 * afterwards; a failed load leaves the model unavailable instead of failing startup.
 */
@Service
public class OnnxSaliencyModel implements SaliencyModel {
    private static final Logger log = LoggerFactory.getLogger(OnnxSaliencyModel.class);

    private final ModelDownloader downloader;
    private final Path modelPath;
    private final List<String> mirrors;
    private final boolean autoDownload;
    private final long minSizeBytes;
    private final long expectedSizeBytes;
    private final boolean serializeInference;
    private final Object lock = new Object();

    private volatile OrtEnvironment environment;
    private volatile OrtSession session;
    private volatile String inputName;

    public OnnxSaliencyModel(
            ModelDownloader downloader,
            @Value("${app.model.path:models/u2net.onnx}") String modelPath,
            @Value("${app.model.mirrors:}") List<String> mirrors,
            @Value("${app.model.auto-download:true}") boolean autoDownload,
            @Value("${app.model.min-size-bytes:100000000}") long minSizeBytes,
            @Value("${app.model.expected-size-bytes:0}") long expectedSizeBytes,
            @Value("${app.model.serialize-inference:false}") boolean serializeInference) {
        this.downloader = downloader;
        this.modelPath = Paths.get(modelPath).toAbsolutePath().normalize();
        this.mirrors = mirrors.stream().filter(m -> !m.isBlank()).collect(Collectors.toList());
        this.autoDownload = autoDownload;
        this.minSizeBytes = minSizeBytes;
        this.expectedSizeBytes = expectedSizeBytes;
        this.serializeInference = serializeInference;
    }

    @PostConstruct
    public void load() {
        log.info("Loading U2-Net model from {}", modelPath);
        if (!downloader.isUsable(modelPath, minSizeBytes)) {
            if (!autoDownload) {
                log.warn("Model file not found at {} and auto-download is disabled; starting without a model", modelPath);
                return;
            }
            log.warn("Model file not found. Attempting to download...");
            if (!downloader.download(mirrors, modelPath, minSizeBytes, expectedSizeBytes)) {
                log.error("Could not download model; background removal is disabled until it is placed at {}", modelPath);
                return;
            }
        }

        try {
            OrtEnvironment env = OrtEnvironment.getEnvironment();
            OrtSession created = env.createSession(modelPath.toString(), new OrtSession.SessionOptions());
            this.environment = env;
            this.inputName = created.getInputNames().iterator().next();
            this.session = created;
            log.info("Model ready, input '{}' with shape {}", inputName,
                    Arrays.toString(((TensorInfo) created.getInputInfo().get(inputName).getInfo()).getShape()));
        } catch (OrtException | RuntimeException | LinkageError e) {
            log.error("Error loading model from {}", modelPath, e);
        }
    }

    @Override
    public boolean isReady() {
        return session != null;
    }

    @Override
    public RawMask predict(NormalizedArray input) {
        OrtSession current = session;
        if (current == null) {
            throw new ModelUnavailableException("Model not loaded. Cannot process image.");
        }
        if (serializeInference) {
            synchronized (lock) {
                return run(current, input);
            }
        }
        return run(current, input);
    }

    private RawMask run(OrtSession current, NormalizedArray input) {
        try (OnnxTensor tensor = OnnxTensor.createTensor(environment, FloatBuffer.wrap(input.data()), input.shape());
             OrtSession.Result result = current.run(Collections.singletonMap(inputName, tensor))) {
            // d1 is the first and highest resolution side output, shape 1x1xHxW
            OnnxValue primary = result.get(0);
            if (!(primary instanceof OnnxTensor)) {
                throw new InferenceException("Unexpected model output type " + primary.getType());
            }
            OnnxTensor output = (OnnxTensor) primary;
            long[] shape = output.getInfo().getShape();
            int height = (int) shape[shape.length - 2];
            int width = (int) shape[shape.length - 1];
            FloatBuffer buffer = output.getFloatBuffer();
            if (buffer == null) {
                throw new InferenceException("Model output is not a float tensor");
            }
            float[] plane = new float[height * width];
            buffer.get(plane);
            return new RawMask(plane, height, width);
        } catch (OrtException e) {
            throw new InferenceException("Saliency model failed: " + e.getMessage(), e);
        }
    }

    @PreDestroy
    public void close() {
        OrtSession current = session;
        session = null;
        if (current != null) {
            try {
                current.close();
                log.info("Model session closed");
            } catch (OrtException e) {
                log.warn("Failed to close model session: {}", e.getMessage());
            }
        }
    }
}
