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
 * The five parameters of the analytic bivariate Gaussian core of a PSF.
 *
 * @param amplitude peak height of the best-fitting Gaussian
 * @param xOffset   x offset of the Gaussian centre from the PSF centroid (pixels)
 * @param yOffset   y offset of the Gaussian centre from the PSF centroid (pixels)
 * @param sigmaX    x sigma (pixels), strictly positive
 * @param sigmaY    y sigma (pixels), strictly positive
 */
public record GaussianParams(
        double amplitude, double xOffset, double yOffset, double sigmaX, double sigmaY) {

    public GaussianParams {
        if (!Double.isFinite(amplitude) || !Double.isFinite(xOffset) || !Double.isFinite(yOffset)) {
            throw new IllegalArgumentException(
                    "Gaussian amplitude and offsets must be finite: "
                            + amplitude + ", " + xOffset + ", " + yOffset);
        }
        if (!(sigmaX > 0 && sigmaY > 0) || Double.isInfinite(sigmaX) || Double.isInfinite(sigmaY)) {
            throw new IllegalArgumentException(
                    "Gaussian sigmas must be finite and positive: " + sigmaX + ", " + sigmaY);
        }
    }

    /**
     * Parameters in the conventional order: amplitude, x offset, y offset,
     * x sigma, y sigma.
     *
     * @throws IllegalArgumentException unless exactly five values are given
     */
    public static GaussianParams of(double... gauss) {
        if (gauss == null || gauss.length != 5) {
            throw new IllegalArgumentException(
                    "Expected 5 Gaussian parameters, got " + (gauss == null ? 0 : gauss.length));
        }
        return new GaussianParams(gauss[0], gauss[1], gauss[2], gauss[3], gauss[4]);
    }

    public double[] toArray() {
        return new double[] {amplitude, xOffset, yOffset, sigmaX, sigmaY};
    }
}
