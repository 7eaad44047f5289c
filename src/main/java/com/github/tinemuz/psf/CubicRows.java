/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.psf;

import java.util.BitSet;

/**
 * Row-direction cubic convolution coefficients of a look-up table.
 *
 * <p>Coefficients are indexed by flat (row-major) table index {@code k} and
 * derived from the samples {@code k-1 .. k+2}. Every sample read goes through
 * {@link #sample(int)}, which clamps to the table; indices before the first
 * sample read the first one and indices past the end repeat the last one.
 * Outside the flat range {@code [-2, N*N]} all four taps collapse onto the
 * same sample and the coefficients vanish, so that range is the whole
 * coefficient domain and tap indices are clamped into it.</p>
 */
final class CubicRows {
    /** Offset of flat index 0 in the coefficient arrays. */
    private static final int LOW = 2;

    private final double[] samples;
    private final double[] c1;
    private final double[] c2;
    private final double[] c3;

    private CubicRows(double[] samples) {
        this.samples = samples;
        int domain = samples.length + LOW + 1;
        this.c1 = new double[domain];
        this.c2 = new double[domain];
        this.c3 = new double[domain];
    }

    /** Coefficients for every index of the domain. */
    static CubicRows full(double[] samples) {
        CubicRows rows = new CubicRows(samples);
        for (int slot = 0; slot < rows.c1.length; slot++) {
            rows.derive(slot);
        }
        return rows;
    }

    /**
     * Coefficients only for the slots set in {@code needed}, as returned by
     * {@link #slot(long)}. Other slots stay zero and must not be read.
     */
    static CubicRows forSlots(double[] samples, BitSet needed) {
        CubicRows rows = new CubicRows(samples);
        for (int slot = needed.nextSetBit(0); slot >= 0; slot = needed.nextSetBit(slot + 1)) {
            rows.derive(slot);
        }
        return rows;
    }

    /** Number of coefficient slots, for sizing a {@link BitSet} of needed slots. */
    static int domainSize(int sampleCount) {
        return sampleCount + LOW + 1;
    }

    /** Slot of flat index {@code k}, clamped into the coefficient domain. */
    static int slot(long k, int sampleCount) {
        if (k < -LOW) return 0;
        if (k > sampleCount) return sampleCount + LOW;
        return (int) k + LOW;
    }

    int slot(long k) {
        return slot(k, samples.length);
    }

    private void derive(int slot) {
        int k = slot - LOW;
        double pm1 = sample(k - 1);
        double p0 = sample(k);
        double p1 = sample(k + 1);
        double p2 = sample(k + 2);
        c1[slot] = 0.5 * (p1 - pm1);
        c2[slot] = 2.0 * p1 + pm1 - 0.5 * (5.0 * p0 + p2);
        c3[slot] = 0.5 * (3.0 * (p0 - p1) + p2 - pm1);
    }

    private double sample(int k) {
        if (k < 0) return samples[0];
        if (k >= samples.length) return samples[samples.length - 1];
        return samples[k];
    }

    /** Cubic through the taps around {@code slot}, evaluated at fractional offset {@code d}. */
    double value(int slot, double d) {
        return d * (d * (d * c3[slot] + c2[slot]) + c1[slot]) + sample(slot - LOW);
    }

    /** First derivative of {@link #value} with respect to {@code d}. */
    double slope(int slot, double d) {
        return d * (d * 3.0 * c3[slot] + 2.0 * c2[slot]) + c1[slot];
    }

    /** Cubic through four arbitrary taps at fractional offset {@code d}. */
    static double value(double pm1, double p0, double p1, double p2, double d) {
        double a1 = 0.5 * (p1 - pm1);
        double a2 = 2.0 * p1 + pm1 - 0.5 * (5.0 * p0 + p2);
        double a3 = 0.5 * (3.0 * (p0 - p1) + p2 - pm1);
        return d * (d * (d * a3 + a2) + a1) + p0;
    }

    /** First derivative of {@link #value(double, double, double, double, double)}. */
    static double slope(double pm1, double p0, double p1, double p2, double d) {
        double a1 = 0.5 * (p1 - pm1);
        double a2 = 2.0 * p1 + pm1 - 0.5 * (5.0 * p0 + p2);
        double a3 = 0.5 * (3.0 * (p0 - p1) + p2 - pm1);
        return d * (d * 3.0 * a3 + 2.0 * a2) + a1;
    }
}
