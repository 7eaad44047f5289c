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
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Separable cubic convolution of a look-up table at arbitrary real
 * coordinates, with optional analytic first derivatives.
 *
 * <p>The kernel is the Catmull-Rom cubic (a = -0.5): four taps per axis and
 * a continuous first derivative. Coordinates are in table units, x along the
 * columns and y along the rows, so {@code (x, y) = (3, 2)} is the sample
 * {@code table.get(2, 3)}. At integer coordinates the interpolant reproduces
 * the table exactly.</p>
 *
 * <p>Interpolation is only meaningful where all four taps of both axes lie
 * inside the table, that is for {@code 1 <= x, y <= N - 2}. Closer to the
 * border the taps are clamped to the nearest sample: the results are then
 * meaningless but no error is raised. Callers that need valid values must
 * check the range first, as {@link PsfEvaluator} does.</p>
 *
 * <p>Two ways in:</p>
 * <ul>
 *   <li>{@link #interpolate(LookupTable, CoordinateBatch, boolean)} derives
 *       coefficients only for the table indices the batch actually touches.</li>
 *   <li>{@link #precompute(LookupTable)} derives them for the whole table once;
 *       pass the returned cache to
 *       {@link #interpolate(CoefficientCache, CoordinateBatch, boolean)} when
 *       many batches are interpolated against the same table.</li>
 * </ul>
 * Both give identical results.
 */
public final class Interpolator {
    private static final Logger log = LoggerFactory.getLogger(Interpolator.class);

    private Interpolator() {}

    /**
     * Derive the row-direction coefficients of {@code table} for reuse across
     * calls.
     *
     * @param table look-up table
     * @return immutable cache bound to {@code table}
     */
    public static CoefficientCache precompute(LookupTable table) {
        Objects.requireNonNull(table, "table");
        CubicRows rows = CubicRows.full(table.samples());
        log.debug("Precomputed cubic coefficients for {}", table);
        return new CoefficientCache(table, rows);
    }

    /**
     * Interpolate {@code table} at every position of {@code coords}.
     *
     * @param table           look-up table
     * @param coords          positions in table units
     * @param wantDerivatives also compute d/dx and d/dy
     * @return values, and derivatives if requested, shaped like {@code coords}
     */
    public static Result interpolate(
            LookupTable table, CoordinateBatch coords, boolean wantDerivatives) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(coords, "coords");
        int size = table.size();
        int count = table.samples().length;

        // Gather the distinct coefficient slots the batch touches
        BitSet needed = new BitSet(CubicRows.domainSize(count));
        for (int s = 0; s < coords.size(); s++) {
            long base = baseIndex(coords.x(s), coords.y(s), size);
            for (int r = 0; r < 4; r++) {
                needed.set(CubicRows.slot(base + (long) r * size, count));
            }
        }
        CubicRows rows = CubicRows.forSlots(table.samples(), needed);
        return evaluate(rows, size, coords, wantDerivatives);
    }

    /**
     * Interpolate the table behind {@code cache} at every position of
     * {@code coords}.
     *
     * @param cache           coefficients from {@link #precompute(LookupTable)}
     * @param coords          positions in table units
     * @param wantDerivatives also compute d/dx and d/dy
     * @return values, and derivatives if requested, shaped like {@code coords}
     */
    public static Result interpolate(
            CoefficientCache cache, CoordinateBatch coords, boolean wantDerivatives) {
        Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(coords, "coords");
        return evaluate(cache.rows(), cache.table().size(), coords, wantDerivatives);
    }

    private static Result evaluate(
            CubicRows rows, int size, CoordinateBatch coords, boolean wantDerivatives) {
        int n = coords.size();
        double[] value = new double[n];
        double[] dfdx = wantDerivatives ? new double[n] : null;
        double[] dfdy = wantDerivatives ? new double[n] : null;

        for (int s = 0; s < n; s++) {
            double x = coords.x(s);
            double y = coords.y(s);
            double dx = x - Math.floor(x);
            double dy = y - Math.floor(y);
            long base = baseIndex(x, y, size);
            int km1 = rows.slot(base);
            int k0 = rows.slot(base + size);
            int k1 = rows.slot(base + 2L * size);
            int k2 = rows.slot(base + 3L * size);

            // Along x on the four neighbouring rows, then along y through those four
            double ym1 = rows.value(km1, dx);
            double y0 = rows.value(k0, dx);
            double y1 = rows.value(k1, dx);
            double y2 = rows.value(k2, dx);
            value[s] = CubicRows.value(ym1, y0, y1, y2, dy);

            if (wantDerivatives) {
                dfdx[s] = CubicRows.value(
                        rows.slope(km1, dx),
                        rows.slope(k0, dx),
                        rows.slope(k1, dx),
                        rows.slope(k2, dx),
                        dy);
                dfdy[s] = CubicRows.slope(ym1, y0, y1, y2, dy);
            }
        }

        Shape shape = coords.shape();
        return new Result(
                ShapedArray.wrap(shape, value),
                wantDerivatives ? ShapedArray.wrap(shape, dfdx) : null,
                wantDerivatives ? ShapedArray.wrap(shape, dfdy) : null);
    }

    /**
     * Flat index of the first tap (row {@code j - 1}, column {@code i}). The
     * integer parts are limited to a few table widths beyond the border so
     * the index arithmetic cannot overflow; such positions clamp to the same
     * edge samples either way.
     */
    private static long baseIndex(double x, double y, int size) {
        long limit = 2L * size + 4;
        long i = clamp((long) Math.floor(x), -limit, limit);
        long j = clamp((long) Math.floor(y), -limit, limit);
        return size * (j - 1) + i;
    }

    private static long clamp(long v, long lo, long hi) {
        return v < lo ? lo : (v > hi ? hi : v);
    }

    /**
     * Interpolated values with optional derivatives, all shaped like the
     * coordinate batch. Derivatives are in table units per table cell.
     */
    public static final class Result {
        /** Interpolated values. */
        public final ShapedArray value;

        /** d/dx (along columns), or {@code null} if not requested. */
        public final ShapedArray dfdx;

        /** d/dy (along rows), or {@code null} if not requested. */
        public final ShapedArray dfdy;

        private Result(ShapedArray value, ShapedArray dfdx, ShapedArray dfdy) {
            this.value = value;
            this.dfdx = dfdx;
            this.dfdy = dfdy;
        }

        public boolean hasDerivatives() {
            return dfdx != null;
        }
    }
}
