package com.project.image.bgremover;

import com.project.image.bgremover.DTOs.AlphaMask;
import com.project.image.bgremover.DTOs.RawMask;
import com.project.image.bgremover.service.MaskPostprocessor;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class MaskPostprocessorTest {
    private final MaskPostprocessor postprocessor = new MaskPostprocessor();

    @Test
    void postprocess_randomOutput_isBinaryAtOriginalSize() {
        Random rnd = new Random(42);
        float[] data = new float[32 * 32];
        for (int i = 0; i < data.length; i++) data[i] = (float) (rnd.nextGaussian() * 7.5);

        AlphaMask mask = postprocessor.postprocess(new RawMask(data, 32, 32), 101, 57);

        assertThat(mask.width()).isEqualTo(101);
        assertThat(mask.height()).isEqualTo(57);
        for (byte b : mask.data()) {
            assertThat(b & 0xFF).isIn(0, 255);
        }
    }

    @Test
    void postprocess_scalesAgainstItsOwnRange() {
        float[] low = {10f, 10f, 11f, 11f};
        float[] high = {1000f, 1000f, 1001f, 1001f};

        AlphaMask a = postprocessor.postprocess(new RawMask(low, 1, 4), 4, 1);
        AlphaMask b = postprocessor.postprocess(new RawMask(high, 1, 4), 4, 1);

        assertThat(a.data()).containsExactly(b.data());
        assertThat(a.alphaAt(0, 0)).isZero();
        assertThat(a.alphaAt(3, 0)).isEqualTo(255);
    }

    @Test
    void postprocess_midpointStaysBackground() {
        // -2..2 maps to 0, 127, 255; only values above 128 are kept
        AlphaMask mask = postprocessor.postprocess(new RawMask(new float[]{-2f, 0f, 2f}, 1, 3), 3, 1);

        assertThat(mask.alphaAt(0, 0)).isZero();
        assertThat(mask.alphaAt(1, 0)).isZero();
        assertThat(mask.alphaAt(2, 0)).isEqualTo(255);
    }

    @Test
    void postprocess_upscalesLeftHalfForeground() {
        float[] data = new float[4 * 4];
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 2; x++) data[y * 4 + x] = 1f;
        }

        AlphaMask mask = postprocessor.postprocess(new RawMask(data, 4, 4), 8, 8);

        for (int y = 0; y < 8; y++) {
            assertThat(mask.alphaAt(0, y)).isEqualTo(255);
            assertThat(mask.alphaAt(7, y)).isZero();
        }
    }

    @Test
    void postprocess_flatOutput_isAllBackground() {
        float[] data = new float[16];
        Arrays.fill(data, 0.7f);

        AlphaMask mask = postprocessor.postprocess(new RawMask(data, 4, 4), 10, 10);

        for (byte b : mask.data()) {
            assertThat(b).isZero();
        }
    }
}
