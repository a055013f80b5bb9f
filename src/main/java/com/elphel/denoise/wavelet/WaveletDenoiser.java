/**
 ** -----------------------------------------------------------------------------**
 ** WaveletDenoiser.java
 **
 ** Separates an image into denoised and noise components by wavelet thresholding
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WaveletDenoiser.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */
package com.elphel.denoise.wavelet;

import java.util.ArrayList;
import java.util.List;

/**
 * Decompose - estimate noise - threshold - shrink - reconstruct - subtract.
 * Instances keep only the (copied) parameters and the observer, so one instance may
 * be used for any number of images, including from several threads at once
 * if the observer allows it.
 */
public class WaveletDenoiser {
	private static final DenoiseObserver NO_OBSERVER = new DenoiseObserver() {};

	private final WaveletDenoiseParameters parameters;
	private final DenoiseObserver          observer;

	public WaveletDenoiser(WaveletDenoiseParameters parameters) {
		this(parameters, null);
	}

	/**
	 * @param parameters denoise parameters, copied
	 * @param observer diagnostics receiver, null for none
	 * @throws InvalidConfigurationException if the parameters are invalid regardless of the image
	 */
	public WaveletDenoiser(
			WaveletDenoiseParameters parameters,
			DenoiseObserver observer) {
		this.parameters = parameters.clone();
		this.parameters.validate();
		this.observer = (observer == null) ? NO_OBSERVER : observer;
	}

	public WaveletDenoiseParameters getParameters() {
		return parameters.clone();
	}

	/**
	 * Denoise one image. The input array is not modified.
	 * @param image [row][column] finite samples, rectangular
	 * @return denoised image, noise residual (image - denoised), thresholds used
	 * @throws InvalidConfigurationException for an empty or ragged image or too many levels for its size
	 */
	public DenoiseResult denoise(double [][] image) {
		int rows = checkShape(image);
		int cols = image[0].length;
		parameters.validate(rows, cols);

		double sigma = parameters.sigma;
		if (!parameters.hasSigma()) {
			sigma = NoiseEstimator.estimateGlobalSigma(image, parameters.basis);
		}
		observer.onGlobalSigma(sigma, !parameters.hasSigma());

		CoefficientTree tree = WaveletTransform2D.decompose(image, parameters.basis, parameters.levels);
		long num_pixels = ((long) rows) * cols;
		List<ThresholdRecord> thresholds = new ArrayList<ThresholdRecord>(3 * tree.getLevels());
		int zeroed = 0;
		for (int level = 1; level <= tree.getLevels(); level++) {
			ThresholdRecord [] level_records = new ThresholdRecord[Orientation.DETAILS.length];
			Subband [] details = tree.getDetails(level);
			for (int k = 0; k < details.length; k++) {
				Subband detail = details[k];
				double subband_sigma = parameters.method.usesGlobalSigma() ?
						sigma : NoiseEstimator.estimateSigma(detail);
				double threshold = ThresholdPolicy.threshold(
						parameters,
						level,
						detail.getOrientation(),
						subband_sigma,
						num_pixels);
				Subband shrunk = CoefficientShrinker.shrink(detail, threshold, parameters.mode);
				tree.replaceDetail(shrunk);
				zeroed += CoefficientShrinker.countZeros(shrunk);
				level_records[k] = new ThresholdRecord(level, detail.getOrientation(), subband_sigma, threshold);
				thresholds.add(level_records[k]);
				observer.onThreshold(level_records[k]);
			}
			observer.onLevelComplete(level, level_records);
		}
		double [][] denoised = WaveletTransform2D.reconstruct(tree);
		double [][] noise = extractNoise(image, denoised);
		return new DenoiseResult(denoised, noise, thresholds, sigma, zeroed);
	}

	/**
	 * @param original input image
	 * @param denoised denoised image of the same shape
	 * @return original - denoised, elementwise
	 */
	public static double [][] extractNoise(double [][] original, double [][] denoised) {
		if ((original.length != denoised.length) || (original[0].length != denoised[0].length)) {
			throw new ShapeMismatchException(original.length, original[0].length, denoised.length, denoised[0].length);
		}
		double [][] noise = new double [original.length][];
		for (int row = 0; row < original.length; row++) {
			double [] o = original[row];
			double [] d = denoised[row];
			double [] n = new double [o.length];
			for (int col = 0; col < o.length; col++) {
				n[col] = o[col] - d[col];
			}
			noise[row] = n;
		}
		return noise;
	}

	private static int checkShape(double [][] image) {
		if ((image == null) || (image.length == 0) || (image[0] == null) || (image[0].length == 0)) {
			throw new InvalidConfigurationException("Image is empty");
		}
		int cols = image[0].length;
		for (int row = 1; row < image.length; row++) {
			if ((image[row] == null) || (image[row].length != cols)) {
				throw new InvalidConfigurationException("Image row "+row+" length differs from "+cols);
			}
		}
		return image.length;
	}
}
