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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the composite PSF: rescaling into the table, the edge guard,
 * and how the Gaussian and residual values and derivatives are combined.
 */
class PsfEvaluatorTest {

    private static final double TOLERANCE = 1e-12;
    private static final double FD_STEP = 1e-5;
    private static final double FD_TOLERANCE = 1e-5;

    private static final GaussianParams FLAT_GAUSSIAN = new GaussianParams(0.0, 0.0, 0.0, 1.0, 1.0);
    private static final GaussianParams STAR = new GaussianParams(1200.0, 0.12, -0.08, 1.4, 1.1);

    @Nested
    @DisplayName("Composite value")
    class ValueTests {

        @Test
        @DisplayName("Constant residual with a degenerate Gaussian returns the constant")
        void constantResidualAtCentre() {
            LookupTable table = LookupTable.of(InterpolatorTest.constantGrid(7, 1.0));
            PsfEvaluator.Value v = new PsfEvaluator()
                    .evaluate(new double[] {0.0}, new double[] {0.0}, FLAT_GAUSSIAN, table, false);

            assertTrue(v.isValid());
            assertEquals(Shape.vector(1), v.value.shape());
            assertEquals(1.0, v.value.get(0), 0.0);
            assertFalse(v.hasDerivatives());
        }

        @Test
        @DisplayName("Zero residuals reduce to the Gaussian with negated centre partials")
        void zeroResidualIsPureGaussian() {
            LookupTable table = LookupTable.of(InterpolatorTest.constantGrid(25, 0.0));
            PixelIntegratedGaussian gaussian = new PixelIntegratedGaussian();
            double[][] xs = {{-2.0, -0.7, 0.0}, {0.3, 1.55, 4.9}};
            double[][] ys = {{1.0, -3.2, 0.0}, {2.5, -0.45, -5.0}};
            CoordinateBatch coords = CoordinateBatch.of(xs, ys);

            PsfEvaluator.Value v = new PsfEvaluator(gaussian).evaluate(coords, STAR, table, true);
            GaussianModel.Evaluation e = gaussian.evaluate(coords, STAR);

            assertTrue(v.isValid());
            assertEquals(Shape.grid(2, 3), v.value.shape());
            for (int i = 0; i < coords.size(); i++) {
                assertEquals(e.value.get(i), v.value.get(i), 0.0, "value " + i);
                assertEquals(-e.dXCenter.get(i), v.dvdx.get(i), 0.0, "dvdx " + i);
                assertEquals(-e.dYCenter.get(i), v.dvdy.get(i), 0.0, "dvdy " + i);
            }
        }

        @Test
        @DisplayName("Residual slopes are doubled and Gaussian centre partials subtracted")
        void derivativeCombination() {
            // Residual rises by one per table cell along x and is flat along y
            int n = 9;
            double[][] grid = new double[n][n];
            for (int row = 0; row < n; row++) {
                for (int col = 0; col < n; col++) {
                    grid[row][col] = col;
                }
            }
            GaussianModel fixed = (coords, params) -> new GaussianModel.Evaluation(
                    filled(coords.shape(), 10.0),
                    filled(coords.shape(), 1.0),
                    filled(coords.shape(), 0.25),
                    filled(coords.shape(), -0.5));

            PsfEvaluator.Value v = new PsfEvaluator(fixed).evaluate(
                    CoordinateBatch.scalar(0.75, -0.5), FLAT_GAUSSIAN, LookupTable.of(grid), true);

            // x = 0.75 maps to table column 2 * 0.75 + 4 = 5.5
            assertEquals(10.0 + 5.5, v.value.asScalar(), TOLERANCE);
            assertEquals(2.0 * 1.0 - 0.25, v.dvdx.asScalar(), TOLERANCE);
            assertEquals(2.0 * 0.0 + 0.5, v.dvdy.asScalar(), TOLERANCE);
        }

        @Test
        @DisplayName("Composite derivatives match finite differences of the composite value")
        void compositeDerivativesMatchFiniteDifferences() {
            int n = 21;
            double[][] grid = new double[n][n];
            for (int row = 0; row < n; row++) {
                for (int col = 0; col < n; col++) {
                    double dx = col - 10.0;
                    double dy = row - 10.0;
                    grid[row][col] = 15.0 * Math.exp(-(dx * dx + dy * dy) / 30.0) * Math.cos(0.2 * dx);
                }
            }
            LookupTable table = LookupTable.of(grid);
            PsfEvaluator psf = new PsfEvaluator();
            double[] xs = {-1.3, 0.2, 2.45, -3.1};
            double[] ys = {0.6, -2.05, 1.15, 3.3};

            PsfEvaluator.Value v = psf.evaluate(xs, ys, STAR, table, true);
            for (int i = 0; i < xs.length; i++) {
                double fdx = (valueAt(psf, table, xs[i] + FD_STEP, ys[i])
                        - valueAt(psf, table, xs[i] - FD_STEP, ys[i])) / (2 * FD_STEP);
                double fdy = (valueAt(psf, table, xs[i], ys[i] + FD_STEP)
                        - valueAt(psf, table, xs[i], ys[i] - FD_STEP)) / (2 * FD_STEP);
                assertEquals(fdx, v.dvdx.get(i), FD_TOLERANCE * Math.max(1.0, Math.abs(fdx)), "dvdx " + i);
                assertEquals(fdy, v.dvdy.get(i), FD_TOLERANCE * Math.max(1.0, Math.abs(fdy)), "dvdy " + i);
            }
        }
    }

    @Nested
    @DisplayName("Edge guard")
    class EdgeGuardTests {

        @Test
        @DisplayName("A position half a cell from the corner returns zeros")
        void halfCellFromCorner() {
            LookupTable table = LookupTable.of(InterpolatorTest.constantGrid(7, 1.0));
            // 2 * -1.25 + 3 = 0.5, outside [1, 5]
            PsfEvaluator.Value v = new PsfEvaluator()
                    .evaluate(new double[] {-1.25}, new double[] {0.0}, STAR, table, true);

            assertFalse(v.isValid());
            assertEquals(PsfEvaluator.Status.TOO_CLOSE_TO_EDGE, v.status);
            assertEquals(Shape.vector(1), v.value.shape());
            assertEquals(0.0, v.value.get(0), 0.0);
            assertEquals(0.0, v.dvdx.get(0), 0.0);
            assertEquals(0.0, v.dvdy.get(0), 0.0);
        }

        @Test
        @DisplayName("One bad position rejects the whole batch without evaluating anything")
        void allOrNothing() {
            AtomicInteger calls = new AtomicInteger();
            GaussianModel counting = (coords, params) -> {
                calls.incrementAndGet();
                return new PixelIntegratedGaussian().evaluate(coords, params);
            };
            LookupTable table = LookupTable.of(InterpolatorTest.constantGrid(9, 2.0));
            double[][] xs = {{0.0, 0.5}, {1.0, 3.0}};
            double[][] ys = {{0.0, 0.0}, {0.0, 0.0}};

            PsfEvaluator.Value v = new PsfEvaluator(counting)
                    .evaluate(CoordinateBatch.of(xs, ys), STAR, table, false);

            assertEquals(PsfEvaluator.Status.TOO_CLOSE_TO_EDGE, v.status);
            assertEquals(Shape.grid(2, 2), v.value.shape());
            assertArrayEquals(new double[4], v.value.toVector(), 0.0);
            assertNull(v.dvdx);
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("The limits of the usable range are inclusive")
        void inclusiveLimits() {
            LookupTable table = LookupTable.of(InterpolatorTest.constantGrid(7, 1.0));
            // 2 * -1 + 3 = 1 and 2 * 1 + 3 = 5 = N - 2
            PsfEvaluator.Value v = new PsfEvaluator().evaluate(
                    new double[] {-1.0, 1.0, -1.0, 1.0},
                    new double[] {-1.0, 1.0, 1.0, -1.0},
                    FLAT_GAUSSIAN,
                    table,
                    true);
            assertTrue(v.isValid());
            for (int i = 0; i < 4; i++) {
                assertEquals(1.0, v.value.get(i), TOLERANCE);
            }
        }

        @Test
        @DisplayName("NaN positions are treated as out of range")
        void nanIsOutOfRange() {
            LookupTable table = LookupTable.of(InterpolatorTest.constantGrid(7, 1.0));
            PsfEvaluator.Value v = new PsfEvaluator()
                    .evaluate(CoordinateBatch.scalar(Double.NaN, 0.0), STAR, table, false);
            assertEquals(PsfEvaluator.Status.TOO_CLOSE_TO_EDGE, v.status);
            assertEquals(0.0, v.value.asScalar(), 0.0);
        }
    }

    @Nested
    @DisplayName("Table forms and caching")
    class FormTests {

        @Test
        @DisplayName("Flattened tables and precomputed caches agree with the full table")
        void formsAndCacheAgree() {
            double[][] grid = InterpolatorTest.randomGrid(15, 2024L);
            double[] flat = new double[15 * 15];
            for (int row = 0; row < 15; row++) {
                System.arraycopy(grid[row], 0, flat, row * 15, 15);
            }
            LookupTable full = LookupTable.of(grid);
            LookupTable flattened = LookupTable.ofFlattened(flat);
            CoordinateBatch coords = CoordinateBatch.of(
                    new double[] {-2.4, 0.0, 1.75, 3.0}, new double[] {1.1, 0.0, -2.3, 2.2});
            PsfEvaluator psf = new PsfEvaluator();

            PsfEvaluator.Value a = psf.evaluate(coords, STAR, full, true);
            PsfEvaluator.Value b = psf.evaluate(coords, STAR, flattened, true);
            PsfEvaluator.Value c = psf.evaluate(coords, STAR, Interpolator.precompute(full), true);

            assertTrue(a.isValid());
            assertEquals(a.value, b.value);
            assertEquals(a.value, c.value);
            assertEquals(a.dvdx, c.dvdx);
            assertEquals(a.dvdy, c.dvdy);
        }

        @Test
        @DisplayName("Gaussian models returning the wrong shape are rejected")
        void wrongShapeFromGaussian() {
            GaussianModel broken = (coords, params) -> {
                ShapedArray one = ShapedArray.zeros(Shape.scalar());
                return new GaussianModel.Evaluation(one, one, one, one);
            };
            LookupTable table = LookupTable.of(InterpolatorTest.constantGrid(7, 0.0));
            PsfEvaluator psf = new PsfEvaluator(broken);
            assertThrows(
                    IllegalStateException.class,
                    () -> psf.evaluate(new double[] {0.0, 0.5}, new double[] {0.0, 0.5}, STAR, table, false));
        }

        @Test
        @DisplayName("Mismatched coordinate lengths are rejected")
        void mismatchedCoordinates() {
            LookupTable table = LookupTable.of(InterpolatorTest.constantGrid(7, 0.0));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new PsfEvaluator().evaluate(new double[] {0.0, 0.5}, new double[] {0.0}, STAR, table, true));
        }
    }

    // Helper methods

    private static double valueAt(PsfEvaluator psf, LookupTable table, double x, double y) {
        return psf.evaluate(CoordinateBatch.scalar(x, y), STAR, table, false).value.asScalar();
    }

    private static ShapedArray filled(Shape shape, double value) {
        double[] data = new double[shape.size()];
        Arrays.fill(data, value);
        return ShapedArray.wrap(shape, data);
    }
}
