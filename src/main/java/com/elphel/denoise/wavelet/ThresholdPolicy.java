/**
 ** -----------------------------------------------------------------------------**
 ** ThresholdPolicy.java
 **
 ** Level and orientation dependent thresholds for detail subbands
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ThresholdPolicy.java is free software: you can redistribute it and/or modify
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

public class ThresholdPolicy {
	/** adaptive threshold halves with every finer level */
	public static final double LEVEL_DECAY =           0.5;
	public static final double DIAGONAL_WEIGHT =       2.0;
	public static final double HORIZONTAL_VERTICAL_WEIGHT = 1.5;

	private ThresholdPolicy() {
	}

	/**
	 * Threshold for one detail subband.
	 * <ul>
	 * <li>adaptive: sigma * threshold_factor * 0.5^(level-1) * (2.0 for diagonal, 1.5 otherwise),
	 * sigma estimated from the subband itself</li>
	 * <li>bayes, sure: sigma * threshold_factor * sqrt(2 * ln(N)), sigma is the global estimate,
	 * N - number of image pixels; same for all orientations and levels</li>
	 * </ul>
	 * @param parameters method and threshold factor (mode does not change the threshold)
	 * @param level detail level, 1 - coarsest
	 * @param orientation detail orientation (not APPROX)
	 * @param sigma local (adaptive) or global noise estimate
	 * @param num_pixels number of pixels in the original image
	 * @return non-negative threshold
	 */
	public static double threshold(
			WaveletDenoiseParameters parameters,
			int level,
			Orientation orientation,
			double sigma,
			long num_pixels) {
		if (!orientation.isDetail()) {
			throw new IllegalArgumentException("Approximation coefficients are never thresholded");
		}
		if (level < 1) {
			throw new IllegalArgumentException("Detail levels start from 1, got "+level);
		}
		switch (parameters.method) {
		case ADAPTIVE:
			return adaptiveThreshold(parameters.threshold_factor, level, orientation, sigma);
		case BAYES:
		case SURE:
		default:
			return universalThreshold(parameters.threshold_factor, sigma, num_pixels);
		}
	}

	public static double adaptiveThreshold(
			double threshold_factor,
			int level,
			Orientation orientation,
			double local_sigma) {
		double level_factor = threshold_factor * Math.pow(LEVEL_DECAY, level - 1);
		double weight = (orientation == Orientation.DIAGONAL) ? DIAGONAL_WEIGHT : HORIZONTAL_VERTICAL_WEIGHT;
		return local_sigma * level_factor * weight;
	}

	public static double universalThreshold(
			double threshold_factor,
			double sigma,
			long num_pixels) {
		return sigma * threshold_factor * Math.sqrt(2.0 * Math.log(num_pixels));
	}
}
