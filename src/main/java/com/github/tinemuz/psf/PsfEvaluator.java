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
 * Value of a DAOPHOT point-spread function at a set of points.
 *
 * <p>The PSF is the sum of an analytic Gaussian core, supplied by a
 * {@link GaussianModel}, and a residual interpolated from a
 * {@link LookupTable} that has a half-pixel grid spacing. Sample positions
 * are given in image pixels relative to the PSF centroid, which coincides
 * with the central sample of the table.</p>
 *
 * <p>If any position of a batch maps to within one table cell of the table
 * border the whole batch is rejected: the result has status
 * {@link Status#TOO_CLOSE_TO_EDGE} and zero-filled arrays of the batch shape.
 * This is common near frame edges and is reported through the result, never
 * thrown.</p>
 *
 * <p>Instances are immutable and thread safe.</p>
 */
public final class PsfEvaluator {
    private static final Logger log = LoggerFactory.getLogger(PsfEvaluator.class);

    /** Table samples per image pixel along each axis. */
    public static final double OVERSAMPLING = 2.0;

    private final GaussianModel gaussian;

    /** Evaluator using the pixel-integrated Gaussian. */
    public PsfEvaluator() {
        this(new PixelIntegratedGaussian());
    }

    public PsfEvaluator(GaussianModel gaussian) {
        this.gaussian = Objects.requireNonNull(gaussian, "gaussian");
    }

    /**
     * Evaluate the PSF at vector positions.
     *
     * @see #evaluate(CoordinateBatch, GaussianParams, LookupTable, boolean)
     */
    public Value evaluate(
            double[] xs, double[] ys, GaussianParams gauss, LookupTable table, boolean wantDerivatives) {
        return evaluate(CoordinateBatch.of(xs, ys), gauss, table, wantDerivatives);
    }

    /**
     * Evaluate the PSF at every position of {@code coords}.
     *
     * @param coords          positions relative to the PSF centroid (pixels)
     * @param gauss           Gaussian core parameters
     * @param table           residual look-up table
     * @param wantDerivatives also compute d/dx and d/dy of the composite PSF
     * @return value and, if requested, derivatives, shaped like {@code coords}
     */
    public Value evaluate(
            CoordinateBatch coords, GaussianParams gauss, LookupTable table, boolean wantDerivatives) {
        Objects.requireNonNull(table, "table");
        return evaluate(coords, gauss, table, null, wantDerivatives);
    }

    /**
     * Evaluate the PSF using coefficients precomputed by
     * {@link Interpolator#precompute(LookupTable)}. Results are identical to
     * {@link #evaluate(CoordinateBatch, GaussianParams, LookupTable, boolean)}
     * against the cached table.
     */
    public Value evaluate(
            CoordinateBatch coords, GaussianParams gauss, CoefficientCache cache, boolean wantDerivatives) {
        Objects.requireNonNull(cache, "cache");
        return evaluate(coords, gauss, cache.table(), cache, wantDerivatives);
    }

    private Value evaluate(
            CoordinateBatch coords,
            GaussianParams gauss,
            LookupTable table,
            CoefficientCache cache,
            boolean wantDerivatives) {
        Objects.requireNonNull(coords, "coords");
        Objects.requireNonNull(gauss, "gauss");
        Shape shape = coords.shape();

        // Table coordinates relative to the table corner; the table has a half-pixel grid
        CoordinateBatch grid = coords.map(OVERSAMPLING, table.center());
        if (!grid.within(1.0, table.size() - 2.0)) {
            log.debug("Positions of {} too close to the edge of {}", coords, table);
            return Value.tooCloseToEdge(shape, wantDerivatives);
        }

        GaussianModel.Evaluation e = gaussian.evaluate(coords, gauss);
        requireShape(e.value, shape, "value");
        Interpolator.Result residual = cache != null
                ? Interpolator.interpolate(cache, grid, wantDerivatives)
                : Interpolator.interpolate(table, grid, wantDerivatives);

        int n = coords.size();
        double[] value = new double[n];
        for (int i = 0; i < n; i++) {
            value[i] = e.value.get(i) + residual.value.get(i);
        }
        if (!wantDerivatives) {
            return new Value(Status.OK, ShapedArray.wrap(shape, value), null, null);
        }

        requireShape(e.dXCenter, shape, "x partial");
        requireShape(e.dYCenter, shape, "y partial");
        // Table derivatives are per half pixel; the Gaussian partials are taken
        // with respect to its centre, hence the subtraction
        double[] dvdx = new double[n];
        double[] dvdy = new double[n];
        for (int i = 0; i < n; i++) {
            dvdx[i] = OVERSAMPLING * residual.dfdx.get(i) - e.dXCenter.get(i);
            dvdy[i] = OVERSAMPLING * residual.dfdy.get(i) - e.dYCenter.get(i);
        }
        return new Value(
                Status.OK,
                ShapedArray.wrap(shape, value),
                ShapedArray.wrap(shape, dvdx),
                ShapedArray.wrap(shape, dvdy));
    }

    private void requireShape(ShapedArray array, Shape expected, String what) {
        if (!array.shape().equals(expected)) {
            throw new IllegalStateException(
                    gaussian.getClass().getSimpleName() + " returned " + what + " of shape "
                            + array.shape() + " for coordinates of shape " + expected);
        }
    }

    /** Outcome of an evaluation. */
    public enum Status {
        /** All positions were inside the usable part of the table. */
        OK,
        /** At least one position fell within one table cell of the border; arrays are zero. */
        TOO_CLOSE_TO_EDGE
    }

    /**
     * PSF value at each position, with derivatives in ADU per image pixel
     * when requested.
     */
    public static final class Value {
        public final Status status;

        /** Composite PSF value. */
        public final ShapedArray value;

        /** d/dx of the composite PSF, or {@code null} if not requested. */
        public final ShapedArray dvdx;

        /** d/dy of the composite PSF, or {@code null} if not requested. */
        public final ShapedArray dvdy;

        private Value(Status status, ShapedArray value, ShapedArray dvdx, ShapedArray dvdy) {
            this.status = status;
            this.value = value;
            this.dvdx = dvdx;
            this.dvdy = dvdy;
        }

        private static Value tooCloseToEdge(Shape shape, boolean wantDerivatives) {
            return new Value(
                    Status.TOO_CLOSE_TO_EDGE,
                    ShapedArray.zeros(shape),
                    wantDerivatives ? ShapedArray.zeros(shape) : null,
                    wantDerivatives ? ShapedArray.zeros(shape) : null);
        }

        public boolean isValid() {
            return status == Status.OK;
        }

        public boolean hasDerivatives() {
            return dvdx != null;
        }
    }
}
