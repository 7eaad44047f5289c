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

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable real-valued array that remembers the shape of the coordinates it
 * was computed for. Elements are stored row-major.
 */
public final class ShapedArray {
    private final Shape shape;
    private final double[] data;

    private ShapedArray(Shape shape, double[] data) {
        this.shape = shape;
        this.data = data;
    }

    /**
     * Wrap {@code data} without copying. Callers hand over ownership of the
     * array and must not touch it afterwards.
     */
    static ShapedArray wrap(Shape shape, double[] data) {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(data, "data");
        if (data.length != shape.size()) {
            throw new IllegalArgumentException(
                    "Data length " + data.length + " does not match shape " + shape);
        }
        return new ShapedArray(shape, data);
    }

    /** Zero-filled array of the given shape. */
    public static ShapedArray zeros(Shape shape) {
        return new ShapedArray(Objects.requireNonNull(shape, "shape"), new double[shape.size()]);
    }

    public Shape shape() {
        return shape;
    }

    public int size() {
        return data.length;
    }

    /** Element at flat (row-major) index {@code i}. */
    public double get(int i) {
        return data[i];
    }

    /** Element at {@code [row, col]}; for vectors and scalars {@code row} is 0. */
    public double get(int row, int col) {
        if (row < 0 || row >= shape.rows() || col < 0 || col >= shape.cols()) {
            throw new IndexOutOfBoundsException(
                    "[" + row + ", " + col + "] outside " + shape);
        }
        return data[row * shape.cols() + col];
    }

    /**
     * The single value of a scalar or one-element array.
     *
     * @throws IllegalStateException if the array holds more than one element
     */
    public double asScalar() {
        if (data.length != 1) {
            throw new IllegalStateException("Array of shape " + shape + " is not a scalar");
        }
        return data[0];
    }

    /** Copy of the elements in row-major order. */
    public double[] toVector() {
        return data.clone();
    }

    /** Copy of the elements as {@code rows x cols}. */
    public double[][] toGrid() {
        double[][] out = new double[shape.rows()][];
        for (int r = 0; r < shape.rows(); r++) {
            out[r] = Arrays.copyOfRange(data, r * shape.cols(), (r + 1) * shape.cols());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShapedArray)) return false;
        ShapedArray that = (ShapedArray) o;
        return shape.equals(that.shape) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * shape.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ShapedArray" + shape + Arrays.toString(data);
    }
}
