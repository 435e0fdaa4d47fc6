package com.project.image.bgremover.service;

import com.project.image.bgremover.DTOs.AlphaMask;
import com.project.image.bgremover.DTOs.RawMask;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Converts raw model output into a binary alpha mask at the original image size.
 * <p>
 * The output is min-max normalized against its own range on every call, so the cut-off adapts
 * to each image. Visually similar inputs can therefore land on slightly different masks.
 */
@Service
public class MaskPostprocessor {
    private static final Logger log = LoggerFactory.getLogger(MaskPostprocessor.class);

    /** Values strictly above this become foreground. */
    public static final int THRESHOLD = 128;

    public AlphaMask postprocess(RawMask raw, int originalWidth, int originalHeight) {
        if (originalWidth <= 0 || originalHeight <= 0) {
            throw new IllegalArgumentException("Invalid target size " + originalWidth + "x" + originalHeight);
        }
        MatSupport.ensureLoaded();

        byte[] scaled = scaleToByteRange(raw);
        Mat small = MatSupport.grayToMat(scaled, raw.width(), raw.height());
        Mat resized = MatSupport.resizeBilinear(small, originalWidth, originalHeight);

        // hard cut, no soft edges
        Mat binary = new Mat();
        Imgproc.threshold(resized, binary, THRESHOLD, 255, Imgproc.THRESH_BINARY);

        log.debug("Mask {}x{} resized to {}x{} and thresholded at {}",
                raw.width(), raw.height(), originalWidth, originalHeight, THRESHOLD);
        return new AlphaMask(MatSupport.matToBytes(binary), originalWidth, originalHeight);
    }

    /**
     * Min-max normalizes to [0,1], scales to [0,255] and truncates. A flat mask has no range to
     * normalize against and maps to all zeros.
     */
    static byte[] scaleToByteRange(RawMask raw) {
        float[] values = raw.data();
        float min = Float.MAX_VALUE;
        float max = -Float.MAX_VALUE;
        for (float v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
        }

        byte[] out = new byte[values.length];
        float range = max - min;
        if (!(range > 0f) || Float.isInfinite(range)) {
            log.debug("Degenerate mask range [{}, {}], treating everything as background", min, max);
            return out;
        }
        for (int i = 0; i < values.length; i++) {
            float normalized = (values[i] - min) / range;
            out[i] = (byte) (int) (normalized * 255f);
        }
        return out;
    }
}
