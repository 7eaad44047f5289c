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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Residual look-up table of a PSF model.
 *
 * <p>The table is an {@code N x N} grid sampled at twice the image pixel
 * resolution, indexed {@code [row, col]} where the row follows y and the
 * column follows x. The centroid of the PSF sits on the central sample,
 * {@link #center()} in both axes.</p>
 *
 * <p>Samples are copied on construction and never modified afterwards, so a
 * table can be shared freely between threads and evaluations.
 * Single-precision input is widened to double; results are never computed in
 * a narrower type than the table was supplied in.</p>
 */
public final class LookupTable {
    private static final Logger log = LoggerFactory.getLogger(LookupTable.class);

    /** Smallest usable table: four interpolation taps plus an edge margin. */
    public static final int MIN_SIZE = 5;

    private final double[] samples; // row-major, size * size
    private final int size;
    private final ResidualForm form;

    private LookupTable(double[] samples, int size, ResidualForm form) {
        this.samples = samples;
        this.size = size;
        this.form = form;
    }

    /**
     * Table from a square grid.
     *
     * @throws IllegalArgumentException if the grid is ragged, not square or
     *         smaller than {@link #MIN_SIZE}
     */
    public static LookupTable of(double[][] grid) {
        Objects.requireNonNull(grid, "grid");
        int n = grid.length;
        double[] flat = new double[n * n];
        for (int r = 0; r < n; r++) {
            double[] row = grid[r];
            if (row == null || row.length != n) {
                throw malformed(
                        "Look-up table must be square; row " + r + " has "
                                + (row == null ? "no" : String.valueOf(row.length))
                                + " columns, expected " + n);
            }
            System.arraycopy(row, 0, flat, r * n, n);
        }
        return checked(flat, n, ResidualForm.FULL_2D);
    }

    /**
     * Table from a single-precision square grid, widened to double.
     *
     * @throws IllegalArgumentException if the grid is ragged, not square or
     *         smaller than {@link #MIN_SIZE}
     */
    public static LookupTable of(float[][] grid) {
        Objects.requireNonNull(grid, "grid");
        int n = grid.length;
        double[] flat = new double[n * n];
        for (int r = 0; r < n; r++) {
            float[] row = grid[r];
            if (row == null || row.length != n) {
                throw malformed(
                        "Look-up table must be square; row " + r + " has "
                                + (row == null ? "no" : String.valueOf(row.length))
                                + " columns, expected " + n);
            }
            for (int c = 0; c < n; c++) flat[r * n + c] = row[c];
        }
        return checked(flat, n, ResidualForm.FULL_2D);
    }

    /**
     * Table from its one-dimensional, row-major layout.
     *
     * @throws IllegalArgumentException if the length is not a perfect square
     *         or the implied size is smaller than {@link #MIN_SIZE}
     */
    public static LookupTable ofFlattened(double[] samples) {
        Objects.requireNonNull(samples, "samples");
        int n = (int) Math.round(Math.sqrt(samples.length));
        if (n * n != samples.length) {
            throw malformed(
                    "Flattened look-up table length " + samples.length
                            + " is not a perfect square");
        }
        return checked(samples.clone(), n, ResidualForm.RADIAL_1D);
    }

    private static LookupTable checked(double[] flat, int n, ResidualForm form) {
        if (n < MIN_SIZE) {
            throw malformed(
                    "Look-up table must be at least " + MIN_SIZE + "x" + MIN_SIZE
                            + ", got " + n + "x" + n);
        }
        return new LookupTable(flat, n, form);
    }

    private static IllegalArgumentException malformed(String message) {
        log.error(message);
        return new IllegalArgumentException(message);
    }

    /** Number of samples along each side. */
    public int size() {
        return size;
    }

    public ResidualForm form() {
        return form;
    }

    public double get(int row, int col) {
        if (row < 0 || row >= size || col < 0 || col >= size) {
            throw new IndexOutOfBoundsException(
                    "[" + row + ", " + col + "] outside " + size + "x" + size + " table");
        }
        return samples[row * size + col];
    }

    /** Grid coordinate of the PSF centroid, {@code (N - 1) / 2}. */
    public double center() {
        return (size - 1) / 2.0;
    }

    /** Row-major samples. Shared, not copied; callers inside the package only read it. */
    double[] samples() {
        return samples;
    }

    @Override
    public String toString() {
        return "LookupTable[" + size + "x" + size + ", " + form + "]";
    }
}
