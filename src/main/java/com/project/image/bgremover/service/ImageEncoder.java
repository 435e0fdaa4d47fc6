package com.project.image.bgremover.service;

import com.project.image.bgremover.DTOs.OutputFormat;
import com.project.image.bgremover.exceptions.BackgroundRemovalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

@Service
public class ImageEncoder {
    private static final Logger log = LoggerFactory.getLogger(ImageEncoder.class);

    static final float JPEG_QUALITY = 0.95f;

    public byte[] encode(BufferedImage image, String formatToken) {
        return encode(image, OutputFormat.parse(formatToken));
    }

    /**
     * PNG keeps all four channels. JPEG has no alpha: the image is first flattened onto white
     * using its own alpha, so transparent areas come out white and the alpha is lost.
     */
    public byte[] encode(BufferedImage image, OutputFormat format) {
        byte[] bytes = format == OutputFormat.JPG ? toJpeg(flattenOnWhite(image)) : toPng(image);
        log.debug("Encoded {}x{} image as {} ({} bytes)", image.getWidth(), image.getHeight(), format, bytes.length);
        return bytes;
    }

    static BufferedImage flattenOnWhite(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < argb.length; i++) {
            argb[i] = Compositor.blendPixel(argb[i], 0xFFFFFFFF);
        }
        BufferedImage flat = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        flat.setRGB(0, 0, w, h, argb, 0, w);
        return flat;
    }

    private static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(img, "png", baos)) {
                throw new BackgroundRemovalException("No PNG writer available");
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new BackgroundRemovalException("Failed to encode image", e);
        }
    }

    private static byte[] toJpeg(BufferedImage img) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new BackgroundRemovalException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             ImageOutputStream output = ImageIO.createImageOutputStream(baos)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);
            writer.setOutput(output);
            writer.write(null, new IIOImage(img, null, null), param);
            output.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new BackgroundRemovalException("Failed to encode image", e);
        } finally {
            writer.dispose();
        }
    }
}
