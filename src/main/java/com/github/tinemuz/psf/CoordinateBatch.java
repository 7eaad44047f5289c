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

/**
 * Immutable batch of (x, y) sample positions.
 *
 * <p>A batch is either a single pair, a vector or a grid; the {@link Shape}
 * travels with every result computed from it. Coordinates are kept flattened
 * in row-major order so the evaluators can loop over them directly.</p>
 */
public final class CoordinateBatch {
    private final Shape shape;
    private final double[] xs;
    private final double[] ys;

    private CoordinateBatch(Shape shape, double[] xs, double[] ys) {
        this.shape = shape;
        this.xs = xs;
        this.ys = ys;
    }

    public static CoordinateBatch scalar(double x, double y) {
        return new CoordinateBatch(Shape.scalar(), new double[] {x}, new double[] {y});
    }

    /**
     * Vector batch. Arrays are copied.
     *
     * @throws IllegalArgumentException if the lengths differ
     */
    public static CoordinateBatch of(double[] xs, double[] ys) {
        Objects.requireNonNull(xs, "xs");
        Objects.requireNonNull(ys, "ys");
        if (xs.length != ys.length) {
            throw new IllegalArgumentException(
                    "xs and ys must have the same length, got " + xs.length + " and " + ys.length);
        }
        return new CoordinateBatch(Shape.vector(xs.length), xs.clone(), ys.clone());
    }

    /**
     * Grid batch. Both grids must be rectangular and of identical shape.
     *
     * @throws IllegalArgumentException on ragged or mismatched grids
     */
    public static CoordinateBatch of(double[][] xs, double[][] ys) {
        Objects.requireNonNull(xs, "xs");
        Objects.requireNonNull(ys, "ys");
        int rows = xs.length;
        if (ys.length != rows) {
            throw new IllegalArgumentException(
                    "xs and ys must have the same number of rows, got " + rows + " and " + ys.length);
        }
        int cols = rows == 0 ? 0 : xs[0].length;
        double[] fx = new double[rows * cols];
        double[] fy = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (xs[r].length != cols || ys[r].length != cols) {
                throw new IllegalArgumentException(
                        "Coordinate grids must be rectangular " + rows + "x" + cols
                                + "; row " + r + " has " + xs[r].length + " x and "
                                + ys[r].length + " y values");
            }
            System.arraycopy(xs[r], 0, fx, r * cols, cols);
            System.arraycopy(ys[r], 0, fy, r * cols, cols);
        }
        return new CoordinateBatch(Shape.grid(rows, cols), fx, fy);
    }

    public Shape shape() {
        return shape;
    }

    public int size() {
        return xs.length;
    }

    public double x(int i) {
        return xs[i];
    }

    public double y(int i) {
        return ys[i];
    }

    /** New batch of the same shape with {@code scale * v + offset} applied to both axes. */
    public CoordinateBatch map(double scale, double offset) {
        double[] mx = new double[xs.length];
        double[] my = new double[ys.length];
        for (int i = 0; i < xs.length; i++) {
            mx[i] = scale * xs[i] + offset;
            my[i] = scale * ys[i] + offset;
        }
        return new CoordinateBatch(shape, mx, my);
    }

    /**
     * True when every coordinate of both axes lies in {@code [lo, hi]}.
     * NaN never lies inside any range.
     */
    public boolean within(double lo, double hi) {
        for (int i = 0; i < xs.length; i++) {
            if (!(xs[i] >= lo && xs[i] <= hi && ys[i] >= lo && ys[i] <= hi)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "CoordinateBatch" + shape;
    }
}
