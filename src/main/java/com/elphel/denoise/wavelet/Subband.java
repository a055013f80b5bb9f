/**
 ** -----------------------------------------------------------------------------**
 ** Subband.java
 **
 ** One tagged coefficient array of the wavelet decomposition
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Subband.java is free software: you can redistribute it and/or modify
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
 * Coefficient array tagged with its decomposition level and orientation.
 * Level 0 is reserved for the single {@link Orientation#APPROX} subband, detail
 * levels are numbered from 1 (coarsest) to L (finest).
 */
public class Subband {
	private final int          level;
	private final Orientation  orientation;
	private final double [][]  data; // [row][column]

	public Subband(
			int level,
			Orientation orientation,
			double [][] data) {
		if (orientation == null) {
			throw new IllegalArgumentException("Subband orientation is required");
		}
		if ((orientation == Orientation.APPROX) != (level == 0)) {
			throw new IllegalArgumentException("Approximation subband must be (only) at level 0, got "+
					orientation+" at level "+level);
		}
		if (level < 0) {
			throw new IllegalArgumentException("Negative subband level "+level);
		}
		if ((data == null) || (data.length == 0) || (data[0].length == 0)) {
			throw new IllegalArgumentException("Empty "+orientation+" subband at level "+level);
		}
		this.level =       level;
		this.orientation = orientation;
		this.data =        data;
	}

	public int getLevel() {
		return level;
	}

	public Orientation getOrientation() {
		return orientation;
	}

	/** @return coefficients, owned by this subband (do not modify) */
	public double [][] getData() {
		return data;
	}

	public int getRows() {
		return data.length;
	}

	public int getCols() {
		return data[0].length;
	}

	public int size() {
		return getRows() * getCols();
	}

	/**
	 * Same level and orientation, different coefficients of the same shape
	 * @param new_data replacement coefficients
	 * @return new subband
	 */
	public Subband withData(double [][] new_data) {
		if ((new_data.length != getRows()) || (new_data[0].length != getCols())) {
			throw new IllegalArgumentException("Replacement for "+this+" has shape "+
					new_data.length+"x"+new_data[0].length);
		}
		return new Subband(level, orientation, new_data);
	}

	@Override
	public String toString() {
		return orientation+"@"+level+" ("+getRows()+"x"+getCols()+")";
	}
}
