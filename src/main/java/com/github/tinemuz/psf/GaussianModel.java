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
 * Analytic core of a PSF: a bivariate Gaussian evaluated at sample positions
 * relative to the PSF centroid.
 *
 * <p>Implementations must be pure functions of their arguments and return
 * arrays of the coordinate batch's shape.</p>
 */
public interface GaussianModel {

    /**
     * Evaluate the Gaussian and its partial derivatives with respect to the
     * amplitude and the centre position.
     *
     * @param coords sample positions relative to the PSF centroid (pixels)
     * @param params Gaussian parameters
     * @return value and partials, each shaped like {@code coords}
     */
    Evaluation evaluate(CoordinateBatch coords, GaussianParams params);

    /**
     * Value of the Gaussian and its partial derivatives. The centre partials
     * are taken with respect to the Gaussian centre, so they carry the
     * opposite sign of the derivative with respect to the sample position.
     */
    final class Evaluation {
        /** Gaussian value at each sample. */
        public final ShapedArray value;

        /** Partial derivative with respect to the amplitude. */
        public final ShapedArray dAmplitude;

        /** Partial derivative with respect to the x centre. */
        public final ShapedArray dXCenter;

        /** Partial derivative with respect to the y centre. */
        public final ShapedArray dYCenter;

        public Evaluation(
                ShapedArray value,
                ShapedArray dAmplitude,
                ShapedArray dXCenter,
                ShapedArray dYCenter) {
            this.value = Objects.requireNonNull(value, "value");
            this.dAmplitude = Objects.requireNonNull(dAmplitude, "dAmplitude");
            this.dXCenter = Objects.requireNonNull(dXCenter, "dXCenter");
            this.dYCenter = Objects.requireNonNull(dYCenter, "dYCenter");
        }
    }
}
