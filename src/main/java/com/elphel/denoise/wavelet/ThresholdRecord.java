/**
 ** -----------------------------------------------------------------------------**
 ** ThresholdRecord.java
 **
 ** Threshold applied to one detail subband
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ThresholdRecord.java is free software: you can redistribute it and/or modify
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

public class ThresholdRecord {
	private final int         level;
	private final Orientation orientation;
	private final double      sigma;     // noise estimate the threshold was derived from
	private final double      threshold;

	public ThresholdRecord(
			int level,
			Orientation orientation,
			double sigma,
			double threshold) {
		this.level =       level;
		this.orientation = orientation;
		this.sigma =       sigma;
		this.threshold =   threshold;
	}

	public int getLevel() {
		return level;
	}

	public Orientation getOrientation() {
		return orientation;
	}

	public double getSigma() {
		return sigma;
	}

	public double getThreshold() {
		return threshold;
	}

	@Override
	public String toString() {
		return String.format("%s@%d: sigma=%.6f threshold=%.6f", orientation, level, sigma, threshold);
	}
}
