/**
 ** -----------------------------------------------------------------------------**
 ** NoiseEstimator.java
 **
 ** Robust noise sigma from wavelet coefficient magnitudes
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  NoiseEstimator.java is free software: you can redistribute it and/or modify
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

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * sigma = median(|c|) / 0.6745 (median absolute deviation of zero-mean coefficients
 * scaled to the standard deviation of a Gaussian)
 */
public class NoiseEstimator {
	public static final double MAD_TO_SIGMA = 0.6745;

	private NoiseEstimator() {
	}

	public static double estimateSigma(Subband subband) {
		return estimateSigma(subband.getData());
	}

	/**
	 * @param coefficients one or several subbands, pooled together
	 * @return sigma estimate, 0 for constant (all zero) coefficients
	 */
	public static double estimateSigma(double [][]... coefficients) {
		int size = 0;
		for (double [][] band : coefficients) {
			for (double [] row : band) size += row.length;
		}
		double [] magnitudes = new double [size];
		int indx = 0;
		for (double [][] band : coefficients) {
			for (double [] row : band) {
				for (double c : row) {
					magnitudes[indx++] = Math.abs(c);
				}
			}
		}
		// for an even count the default estimation averages the two central values
		return new Median().evaluate(magnitudes) / MAD_TO_SIGMA;
	}

	/**
	 * Single global estimate from the details of a one-level decomposition of the image
	 * (all three orientations pooled), used by the non-adaptive threshold methods.
	 * @param image [row][column] samples
	 * @param basis wavelet basis
	 * @return sigma estimate
	 */
	public static double estimateGlobalSigma(double [][] image, WaveletBasis basis) {
		double [][][] bands = WaveletTransform2D.dwt2(image, basis);
		return estimateSigma(bands[1], bands[2], bands[3]);
	}
}
