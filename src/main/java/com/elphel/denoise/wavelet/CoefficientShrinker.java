/**
 ** -----------------------------------------------------------------------------**
 ** CoefficientShrinker.java
 **
 ** Soft and hard thresholding of detail subbands
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CoefficientShrinker.java is free software: you can redistribute it and/or modify
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

public class CoefficientShrinker {

	private CoefficientShrinker() {
	}

	/**
	 * @param x coefficient
	 * @param threshold non-negative threshold
	 * @param mode soft: sign(x) * max(|x| - t, 0), hard: x if |x| > t, else 0
	 * @return shrunk coefficient
	 */
	public static double shrink(double x, double threshold, ThresholdMode mode) {
		double ax = Math.abs(x);
		switch (mode) {
		case HARD:
			return (ax > threshold) ? x : 0.0;
		case SOFT:
		default:
			if (ax > threshold) {
				return (x > 0) ? (ax - threshold) : (threshold - ax);
			}
			return 0.0;
		}
	}

	/**
	 * Shrink all coefficients of a subband. The input is not modified.
	 * @param subband detail subband
	 * @param threshold non-negative threshold
	 * @param mode shrinkage rule
	 * @return new subband with the same level, orientation and shape
	 */
	public static Subband shrink(Subband subband, double threshold, ThresholdMode mode) {
		if (!(threshold >= 0.0)) {
			throw new IllegalArgumentException("Threshold should be non-negative, got "+threshold);
		}
		double [][] data = subband.getData();
		double [][] shrunk = new double [data.length][];
		for (int row = 0; row < data.length; row++) {
			double [] src = data[row];
			double [] dst = new double [src.length];
			for (int col = 0; col < src.length; col++) {
				dst[col] = shrink(src[col], threshold, mode);
			}
			shrunk[row] = dst;
		}
		return subband.withData(shrunk);
	}

	public static int countZeros(Subband subband) {
		int zeros = 0;
		for (double [] row : subband.getData()) {
			for (double c : row) {
				if (c == 0.0) zeros++;
			}
		}
		return zeros;
	}
}
