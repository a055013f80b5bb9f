/**
 ** -----------------------------------------------------------------------------**
 ** DenoiseObserver.java
 **
 ** Receives per-call diagnostics of the wavelet denoising
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DenoiseObserver.java is free software: you can redistribute it and/or modify
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

/**
 * Optional diagnostics sink. Methods are called from the thread running
 * {@link WaveletDenoiser#denoise(double[][])}, in processing order.
 */
public interface DenoiseObserver {

	/**
	 * @param sigma global noise sigma
	 * @param estimated true if estimated from the image, false if supplied in the parameters
	 */
	default void onGlobalSigma(double sigma, boolean estimated) {
	}

	/** Threshold that was just applied to one detail subband */
	default void onThreshold(ThresholdRecord record) {
	}

	/**
	 * @param level detail level, 1 - coarsest
	 * @param records thresholds of the horizontal, vertical and diagonal subbands
	 */
	default void onLevelComplete(int level, ThresholdRecord [] records) {
	}
}
