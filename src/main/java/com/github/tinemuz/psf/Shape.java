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

/**
 * Shape of a coordinate batch or of an output array.
 *
 * <p>Rank 0 is a single scalar pair, rank 1 a vector of {@code cols}
 * elements and rank 2 a {@code rows x cols} grid stored row-major.</p>
 *
 * @param rank 0, 1 or 2
 * @param rows number of rows (1 for scalars and vectors)
 * @param cols number of columns (vector length for rank 1)
 */
public record Shape(int rank, int rows, int cols) {

    public Shape {
        if (rank < 0 || rank > 2) {
            throw new IllegalArgumentException("Shape rank must be 0, 1 or 2, got " + rank);
        }
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException(
                    "Shape extents must be non-negative, got " + rows + "x" + cols);
        }
        if (rank == 0 && (rows != 1 || cols != 1)) {
            throw new IllegalArgumentException("Scalar shape must be 1x1");
        }
        if (rank == 1 && rows != 1) {
            throw new IllegalArgumentException("Vector shape must have a single row");
        }
    }

    public static Shape scalar() {
        return new Shape(0, 1, 1);
    }

    public static Shape vector(int length) {
        return new Shape(1, 1, length);
    }

    public static Shape grid(int rows, int cols) {
        return new Shape(2, rows, cols);
    }

    /** Number of elements. */
    public int size() {
        return rows * cols;
    }

    @Override
    public String toString() {
        switch (rank) {
            case 0:
                return "scalar";
            case 1:
                return "[" + cols + "]";
            default:
                return "[" + rows + "x" + cols + "]";
        }
    }
}
