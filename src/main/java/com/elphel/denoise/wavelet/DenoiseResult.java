/**
 ** -----------------------------------------------------------------------------**
 ** DenoiseResult.java
 **
 ** Denoised image, noise residual and the thresholds used
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DenoiseResult.java is free software: you can redistribute it and/or modify
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

import java.util.Collections;
import java.util.List;

public class DenoiseResult {
	private final double [][]           denoised;
	private final double [][]           noise;
	private final List<ThresholdRecord> thresholds;
	private final double                sigma;
	private final int                   zeroed_coefficients;

	public DenoiseResult(
			double [][]           denoised,
			double [][]           noise,
			List<ThresholdRecord> thresholds,
			double                sigma,
			int                   zeroed_coefficients) {
		this.denoised =            denoised;
		this.noise =               noise;
		this.thresholds =          Collections.unmodifiableList(thresholds);
		this.sigma =               sigma;
		this.zeroed_coefficients = zeroed_coefficients;
	}

	/** @return denoised image, same shape as the input */
	public double [][] getDenoised() {
		return denoised;
	}

	/** @return input minus denoised image */
	public double [][] getNoise() {
		return noise;
	}

	/** @return thresholds in processing order: level 1 (coarsest) first, h, v, d in each level */
	public List<ThresholdRecord> getThresholds() {
		return thresholds;
	}

	/** @return supplied or globally estimated sigma */
	public double getSigma() {
		return sigma;
	}

	/** @return number of detail coefficients equal to zero after shrinking */
	public int getZeroedCoefficients() {
		return zeroed_coefficients;
	}
}
