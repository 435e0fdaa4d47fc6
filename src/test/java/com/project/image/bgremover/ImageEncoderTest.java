package com.project.image.bgremover;

import com.project.image.bgremover.DTOs.OutputFormat;
import com.project.image.bgremover.exceptions.UnsupportedFormatException;
import com.project.image.bgremover.service.ImageEncoder;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.*;

class ImageEncoderTest {
    private final ImageEncoder encoder = new ImageEncoder();

    @Test
    void png_keepsAlphaChannel() throws Exception {
        BufferedImage decoded = TestImages.read(encoder.encode(halfTransparent(), OutputFormat.PNG));

        assertThat(decoded.getColorModel().hasAlpha()).isTrue();
        assertThat(decoded.getRGB(2, 5)).isEqualTo(0x00FF0000);
        assertThat(decoded.getRGB(15, 5)).isEqualTo(0xFF0000FF);
    }

    @Test
    void jpeg_flattensOntoWhiteAndDropsAlpha() throws Exception {
        BufferedImage decoded = TestImages.read(encoder.encode(halfTransparent(), "jpg"));

        assertThat(decoded.getColorModel().hasAlpha()).isFalse();
        int left = decoded.getRGB(2, 5);
        assertThat((left >> 16) & 0xFF).isGreaterThan(240);
        assertThat((left >> 8) & 0xFF).isGreaterThan(240);
        assertThat(left & 0xFF).isGreaterThan(240);
        int right = decoded.getRGB(15, 5);
        assertThat((right >> 16) & 0xFF).isLessThan(20);
        assertThat(right & 0xFF).isGreaterThan(230);
    }

    @Test
    void unknownFormat_isRejected() {
        assertThatThrownBy(() -> encoder.encode(halfTransparent(), "gif"))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageContaining("gif");
    }

    @Test
    void parse_acceptsCommonSpellings() {
        assertThat(OutputFormat.parse("PNG")).isEqualTo(OutputFormat.PNG);
        assertThat(OutputFormat.parse("jpeg")).isEqualTo(OutputFormat.JPG);
        assertThat(OutputFormat.parse(null)).isEqualTo(OutputFormat.PNG);
    }

    /** Left half: red but fully transparent. Right half: opaque blue. */
    private static BufferedImage halfTransparent() {
        BufferedImage img = new BufferedImage(20, 10, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 20; x++) {
                img.setRGB(x, y, x < 10 ? 0x00FF0000 : 0xFF0000FF);
            }
        }
        return img;
    }
}
