package io.github.drompincen.simgate.runtime.result;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Stride-based reduction of time series to a bounded number of points.
 * <p>
 * Sample {@code i} of a reduced series is sample {@code i * stride} of the original one. Values
 * are never reordered or interpolated, and the first sample is always kept.
 */
public final class Downsampler {

    private Downsampler() {}

    /**
     * Computes the reduction for a series of {@code length} samples.
     *
     * @throws IllegalArgumentException when {@code maxPoints < 1} or {@code length < 0}
     */
    public static Plan plan(int length, int maxPoints) {
        if (maxPoints < 1) {
            throw new IllegalArgumentException("maxPoints must be >= 1, got " + maxPoints);
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0, got " + length);
        }
        if (length <= maxPoints) {
            return new Plan(length, 1, false);
        }
        return new Plan(length, length / maxPoints, true);
    }

    public static <T> List<T> downsample(List<T> series, int maxPoints) {
        return plan(series.size(), maxPoints).apply(series);
    }

    /**
     * One computed reduction. Apply the same plan to the time axis and every variable so that
     * entries stay index aligned.
     *
     * @param length      number of samples the plan was computed for
     * @param stride      distance between kept samples, 1 when nothing is dropped
     * @param downsampled whether the length exceeded the bound
     */
    public record Plan(int length, int stride, boolean downsampled) {

        public int outputLength() {
            return (length + stride - 1) / stride;
        }

        public <T> List<T> apply(List<T> series) {
            checkLength(series.size());
            if (!downsampled) return series;
            List<T> out = new ArrayList<>(outputLength());
            for (int i = 0; i < series.size(); i += stride) {
                out.add(series.get(i));
            }
            return out;
        }

        public ArrayNode apply(ArrayNode series) {
            checkLength(series.size());
            if (!downsampled) return series;
            ArrayNode out = JsonNodeFactory.instance.arrayNode(outputLength());
            for (int i = 0; i < series.size(); i += stride) {
                out.add(series.get(i));
            }
            return out;
        }

        /** Converts an engine-native series and reduces it. */
        public ArrayNode convertAndApply(Object series) {
            return apply(NumericConversion.toJsonArray(series));
        }

        private void checkLength(int actual) {
            if (actual != length) {
                throw new IllegalArgumentException(
                        "Series has " + actual + " samples but the plan was computed for " + length);
            }
        }
    }
}
