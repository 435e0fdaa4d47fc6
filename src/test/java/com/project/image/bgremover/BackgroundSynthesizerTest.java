package com.project.image.bgremover;

import com.project.image.bgremover.DTOs.BackgroundSpec;
import com.project.image.bgremover.service.BackgroundSynthesizer;
import com.project.image.bgremover.service.ImageLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class BackgroundSynthesizerTest {
    private final BackgroundSynthesizer synthesizer = new BackgroundSynthesizer(new ImageLoader());

    @TempDir
    Path tmp;

    @Test
    void parseColor_namedHexAndUnknown() {
        assertThat(BackgroundSynthesizer.parseColor("white")).isEqualTo(new Color(255, 255, 255));
        assertThat(BackgroundSynthesizer.parseColor("black")).isEqualTo(new Color(0, 0, 0));
        assertThat(BackgroundSynthesizer.parseColor("blue")).isEqualTo(new Color(52, 152, 219));
        assertThat(BackgroundSynthesizer.parseColor("green")).isEqualTo(new Color(46, 204, 113));
        assertThat(BackgroundSynthesizer.parseColor("RED")).isEqualTo(new Color(231, 76, 60));
        assertThat(BackgroundSynthesizer.parseColor("#3498db")).isEqualTo(new Color(52, 152, 219));
        assertThat(BackgroundSynthesizer.parseColor("chartreuse")).isEqualTo(Color.WHITE);
        assertThat(BackgroundSynthesizer.parseColor("#12345")).isEqualTo(Color.WHITE);
    }

    @Test
    void synthesize_color_isOpaqueAndExactSize() {
        BufferedImage bg = synthesizer.synthesize(13, 7, BackgroundSpec.color("#2ECC71"));

        assertThat(bg.getWidth()).isEqualTo(13);
        assertThat(bg.getHeight()).isEqualTo(7);
        assertThat(bg.getRGB(0, 0)).isEqualTo(0xFF2ECC71);
        assertThat(bg.getRGB(12, 6)).isEqualTo(0xFF2ECC71);
    }

    @Test
    void gradient_startsAtFirstColorAndMovesMonotonicallyTowardsSecond() {
        Color top = new Color(10, 200, 40);
        Color bottom = new Color(250, 20, 40);

        BufferedImage bg = synthesizer.gradient(5, 120, top, bottom);

        assertThat(bg.getRGB(0, 0)).isEqualTo(0xFF000000 | top.getRGB());
        int prevR = 10, prevG = 200;
        for (int y = 1; y < 120; y++) {
            int p = bg.getRGB(2, y);
            assertThat(p >>> 24).isEqualTo(255);
            assertThat((p >> 16) & 0xFF).isGreaterThanOrEqualTo(prevR);
            assertThat((p >> 8) & 0xFF).isLessThanOrEqualTo(prevG);
            assertThat(bg.getRGB(0, y)).isEqualTo(bg.getRGB(4, y));
            prevR = (p >> 16) & 0xFF;
            prevG = (p >> 8) & 0xFF;
        }
        int last = bg.getRGB(0, 119);
        assertThat((last >> 16) & 0xFF).isCloseTo(250, within(3));
        assertThat((last >> 8) & 0xFF).isCloseTo(20, within(3));
    }

    @Test
    void synthesize_gradientDefaults() {
        BufferedImage bg = synthesizer.synthesize(4, 10, BackgroundSpec.gradient(null, null));

        assertThat(bg.getRGB(0, 0)).isEqualTo(0xFF667EEA);
    }

    @Test
    void synthesize_image_isStretchedToTargetSize() throws Exception {
        Path file = TestImages.write(TestImages.solid(4, 4, new Color(200, 30, 30), BufferedImage.TYPE_INT_RGB),
                "png", tmp.resolve("bg.png"));

        BufferedImage bg = synthesizer.synthesize(16, 9, BackgroundSpec.image(file));

        assertThat(bg.getWidth()).isEqualTo(16);
        assertThat(bg.getHeight()).isEqualTo(9);
        assertThat(bg.getRGB(0, 0)).isEqualTo(0xFFC81E1E);
        assertThat(bg.getRGB(15, 8)).isEqualTo(0xFFC81E1E);
    }

    @Test
    void synthesize_missingOrBrokenImage_fallsBackToWhite() throws Exception {
        Path broken = Files.writeString(tmp.resolve("broken.jpg"), "nope");

        BufferedImage missing = synthesizer.synthesize(3, 3, BackgroundSpec.image(tmp.resolve("missing.jpg")));
        BufferedImage unreadable = synthesizer.synthesize(3, 3, BackgroundSpec.image(broken));

        assertThat(missing.getRGB(1, 1)).isEqualTo(0xFFFFFFFF);
        assertThat(unreadable.getRGB(1, 1)).isEqualTo(0xFFFFFFFF);
    }
}
