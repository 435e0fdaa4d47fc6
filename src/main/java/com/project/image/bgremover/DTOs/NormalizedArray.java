package com.project.image.bgremover.DTOs;

/**
 * Model input tensor in NCHW layout with a batch size of one and three channels (R, G, B).
 */
public record NormalizedArray(float[] data, int height, int width) {

    public static final int CHANNELS = 3;

    public NormalizedArray {
        if (data.length != CHANNELS * height * width) {
            throw new IllegalArgumentException("Expected " + (CHANNELS * height * width)
                    + " values for 1x3x" + height + "x" + width + ", got " + data.length);
        }
    }

    public long[] shape() {
        return new long[]{1, CHANNELS, height, width};
    }

    public float valueAt(int channel, int y, int x) {
        return data[channel * height * width + y * width + x];
    }
}
