package com.phillippitts.speakerverify.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed-length speaker embedding vector.
 *
 * <p>Immutable: the backing array is copied on the way in and on the way out.
 */
public final class Embedding {

    private final double[] values;

    private Embedding(double[] values) {
        this.values = values;
    }

    /**
     * Wraps raw values without normalizing.
     *
     * @throws IllegalArgumentException if empty or containing NaN/infinite components
     */
    public static Embedding of(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Embedding must not be empty");
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("Embedding contains non-finite value: " + v);
            }
        }
        return new Embedding(values.clone());
    }

    public static Embedding of(List<? extends Number> values) {
        if (values == null) {
            throw new IllegalArgumentException("Embedding must not be empty");
        }
        double[] arr = new double[values.size()];
        for (int i = 0; i < arr.length; i++) {
            Number n = values.get(i);
            if (n == null) {
                throw new IllegalArgumentException("Embedding contains null at index " + i);
            }
            arr[i] = n.doubleValue();
        }
        return of(arr);
    }

    public int dimension() {
        return values.length;
    }

    public double[] values() {
        return values.clone();
    }

    /** Euclidean length. */
    public double norm() {
        double sum = 0.0;
        for (double v : values) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * Returns a unit-length copy.
     *
     * @throws IllegalArgumentException if the vector has zero length
     */
    public Embedding normalized() {
        double n = norm();
        if (n == 0.0) {
            throw new IllegalArgumentException("Cannot normalize a zero-length embedding");
        }
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] / n;
        }
        return new Embedding(out);
    }

    public double dot(Embedding other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + values.length + " vs " + other.values.length);
        }
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * other.values[i];
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Embedding other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Embedding[dimension=" + values.length + "]";
    }
}
