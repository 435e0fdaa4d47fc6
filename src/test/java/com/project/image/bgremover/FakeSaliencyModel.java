package com.project.image.bgremover;

import com.project.image.bgremover.DTOs.NormalizedArray;
import com.project.image.bgremover.DTOs.RawMask;
import com.project.image.bgremover.service.SaliencyModel;

/**
 * Predicts a centered square as foreground: logits of 4 inside, -4 outside. The square covers the
 * middle half of the model input in each direction.
 */
class FakeSaliencyModel implements SaliencyModel {

    private final boolean ready;

    FakeSaliencyModel() { this(true); }

    FakeSaliencyModel(boolean ready) { this.ready = ready; }

    @Override
    public boolean isReady() { return ready; }

    @Override
    public RawMask predict(NormalizedArray input) {
        int h = input.height(), w = input.width();
        float[] data = new float[h * w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                boolean inside = x >= w / 4 && x < 3 * w / 4 && y >= h / 4 && y < 3 * h / 4;
                data[y * w + x] = inside ? 4f : -4f;
            }
        }
        return new RawMask(data, h, w);
    }
}
