package com.project.image.bgremover;

import com.project.image.bgremover.DTOs.AlphaMask;
import com.project.image.bgremover.DTOs.OutputFormat;
import com.project.image.bgremover.DTOs.ProcessingOptions;
import com.project.image.bgremover.DTOs.SourceImage;
import com.project.image.bgremover.service.BackgroundSynthesizer;
import com.project.image.bgremover.service.Compositor;
import com.project.image.bgremover.service.ImageLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class CompositorTest {
    private final Compositor compositor = new Compositor(new BackgroundSynthesizer(new ImageLoader()));

    @TempDir
    Path tmp;

    @Test
    void composite_opaqueMask_keepsSourcePixelsOnAnyBackground() {
        SourceImage source = source(TestImages.photo(40, 30));
        AlphaMask mask = mask(40, 30, 255);

        for (String color : new String[]{"#3498DB", "black", "red"}) {
            BufferedImage out = compositor.composite(source, mask, options(color, null));
            for (int y = 0; y < 30; y++) {
                for (int x = 0; x < 40; x++) {
                    assertThat(out.getRGB(x, y) & 0xFFFFFF).isEqualTo(source.rgb().getRGB(x, y) & 0xFFFFFF);
                }
            }
        }
    }

    @Test
    void composite_transparentMask_showsBackgroundEverywhere() {
        SourceImage source = source(TestImages.photo(40, 30));

        BufferedImage out = compositor.composite(source, mask(40, 30, 0), options("#3498DB", null));

        for (int y = 0; y < 30; y++) {
            for (int x = 0; x < 40; x++) {
                assertThat(out.getRGB(x, y)).isEqualTo(0xFF3498DB);
            }
        }
    }

    @Test
    void composite_transparentOption_returnsSubjectWithMaskAsAlpha() {
        SourceImage source = source(TestImages.photo(40, 30));
        AlphaMask mask = centerMask(40, 30);

        BufferedImage out = compositor.composite(source, mask, ProcessingOptions.defaults());

        assertThat(out.getColorModel().hasAlpha()).isTrue();
        assertThat(out.getRGB(0, 0) >>> 24).isZero();
        assertThat(out.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0x787878);
        assertThat(out.getRGB(20, 15)).isEqualTo(0xFFF08C14);
    }

    @Test
    void composite_missingBackgroundImage_fallsBackToWhite() {
        SourceImage source = source(TestImages.photo(40, 30));

        BufferedImage out = compositor.composite(source, centerMask(40, 30),
                options(ProcessingOptions.TRANSPARENT, tmp.resolve("nope.png")));

        assertThat(out.getRGB(0, 0)).isEqualTo(0xFFFFFFFF);
        assertThat(out.getRGB(20, 15)).isEqualTo(0xFFF08C14);
    }

    @Test
    void composite_missingBackgroundImage_keepsRequestedColor() {
        SourceImage source = source(TestImages.photo(40, 30));

        BufferedImage out = compositor.composite(source, centerMask(40, 30),
                options("#3498DB", tmp.resolve("nope.png")));

        assertThat(out.getRGB(0, 0)).isEqualTo(0xFF3498DB);
        assertThat(out.getRGB(20, 15)).isEqualTo(0xFFF08C14);
    }

    @Test
    void composite_existingBackgroundImage_winsOverColor() throws Exception {
        Path background = TestImages.write(TestImages.solid(10, 10, new Color(46, 204, 113), BufferedImage.TYPE_INT_RGB), "png",
                tmp.resolve("green.png"));

        BufferedImage out = compositor.composite(source(TestImages.photo(40, 30)), centerMask(40, 30),
                options("#3498DB", background));

        assertThat(out.getRGB(0, 0)).isEqualTo(0xFF2ECC71);
    }

    @Test
    void over_halfAlpha_blendsChannels() {
        BufferedImage subject = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        subject.setRGB(0, 0, (128 << 24) | 0xFF0000);
        BufferedImage background = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        background.setRGB(0, 0, 0xFF0000FF);

        int out = compositor.over(subject, background).getRGB(0, 0);

        assertThat(out >>> 24).isEqualTo(255);
        assertThat((out >> 16) & 0xFF).isEqualTo(128);
        assertThat(out & 0xFF).isEqualTo(127);
    }

    @Test
    void subject_sizeMismatch_isRejected() {
        SourceImage source = source(TestImages.photo(40, 30));

        assertThatThrownBy(() -> compositor.subject(source, mask(30, 40, 255)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ProcessingOptions options(String color, Path image) {
        return new ProcessingOptions(color, image, OutputFormat.PNG);
    }

    private static SourceImage source(BufferedImage img) {
        return new SourceImage(img, img.getWidth(), img.getHeight());
    }

    private static AlphaMask mask(int w, int h, int value) {
        byte[] data = new byte[w * h];
        Arrays.fill(data, (byte) value);
        return new AlphaMask(data, w, h);
    }

    private static AlphaMask centerMask(int w, int h) {
        byte[] data = new byte[w * h];
        for (int y = h / 4; y < 3 * h / 4; y++) {
            for (int x = w / 4; x < 3 * w / 4; x++) data[y * w + x] = (byte) 255;
        }
        return new AlphaMask(data, w, h);
    }
}
