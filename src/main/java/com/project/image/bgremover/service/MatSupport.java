package com.project.image.bgremover.service;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Loads the bundled OpenCV natives and converts between {@link BufferedImage} and {@link Mat}.
 */
public final class MatSupport {
    private static final Logger log = LoggerFactory.getLogger(MatSupport.class);

    static {
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
        } catch (Throwable e) {
            log.error("Failed to load OpenCV", e);
        }
    }

    private MatSupport() {}

    /** Forces class initialisation, and with it the native library load. */
    public static void ensureLoaded() {
        // static initializer does the work
    }

    /** Copies an image into an 8-bit, 3 channel BGR {@link Mat}. */
    public static Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage bgrImage = image;
        if (image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
            bgrImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
            Graphics2D graphics = bgrImage.createGraphics();
            graphics.drawImage(image, 0, 0, null);
            graphics.dispose();
        }
        byte[] pixels = ((DataBufferByte) bgrImage.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }

    /** Converts an 8-bit BGR or BGRA {@link Mat} to an image without alpha. */
    public static BufferedImage matToRgbImage(Mat mat) {
        Mat bgr = mat;
        if (mat.channels() == 4) {
            bgr = new Mat();
            Imgproc.cvtColor(mat, bgr, Imgproc.COLOR_BGRA2BGR);
        } else if (mat.channels() == 1) {
            bgr = new Mat();
            Imgproc.cvtColor(mat, bgr, Imgproc.COLOR_GRAY2BGR);
        }
        BufferedImage image = new BufferedImage(bgr.cols(), bgr.rows(), BufferedImage.TYPE_3BYTE_BGR);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        bgr.get(0, 0, target);
        return image;
    }

    /** Wraps a row-major single channel byte array as a {@code CV_8UC1} {@link Mat}. */
    public static Mat grayToMat(byte[] data, int width, int height) {
        Mat mat = new Mat(height, width, CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }

    public static byte[] matToBytes(Mat mat) {
        byte[] data = new byte[(int) (mat.total() * mat.channels())];
        mat.get(0, 0, data);
        return data;
    }

    /** Bilinear resize to exactly {@code width x height}, ignoring aspect ratio. */
    public static Mat resizeBilinear(Mat src, int width, int height) {
        Mat dst = new Mat();
        Imgproc.resize(src, dst, new Size(width, height), 0, 0, Imgproc.INTER_LINEAR);
        return dst;
    }

    /** Bilinear resize of any image into a new {@code TYPE_INT_ARGB} image, alpha included. */
    public static BufferedImage resizeArgb(BufferedImage image, int width, int height) {
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        byte[] bgra = new byte[w * h * 4];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            bgra[4 * i] = (byte) p;
            bgra[4 * i + 1] = (byte) (p >> 8);
            bgra[4 * i + 2] = (byte) (p >> 16);
            bgra[4 * i + 3] = (byte) (p >>> 24);
        }
        Mat src = new Mat(h, w, CvType.CV_8UC4);
        src.put(0, 0, bgra);
        Mat dst = resizeBilinear(src, width, height);
        byte[] resized = matToBytes(dst);

        int[] out = new int[width * height];
        for (int i = 0; i < out.length; i++) {
            int b = resized[4 * i] & 0xFF;
            int g = resized[4 * i + 1] & 0xFF;
            int r = resized[4 * i + 2] & 0xFF;
            int a = resized[4 * i + 3] & 0xFF;
            out[i] = (a << 24) | (r << 16) | (g << 8) | b;
        }
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        result.setRGB(0, 0, width, height, out, 0, width);
        return result;
    }
}
