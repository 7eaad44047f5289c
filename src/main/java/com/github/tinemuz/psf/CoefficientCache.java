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
 * Row-direction interpolation coefficients of one look-up table, derived once
 * by {@link Interpolator#precompute(LookupTable)} and reused for every
 * subsequent batch against that table.
 *
 * <p>The cache is complete when constructed and never modified afterwards; it
 * can be shared between threads without synchronization.</p>
 */
public final class CoefficientCache {
    private final LookupTable table;
    private final CubicRows rows;

    CoefficientCache(LookupTable table, CubicRows rows) {
        this.table = table;
        this.rows = rows;
    }

    /** The table these coefficients were derived from. */
    public LookupTable table() {
        return table;
    }

    CubicRows rows() {
        return rows;
    }

    @Override
    public String toString() {
        return "CoefficientCache[" + table + "]";
    }
}
