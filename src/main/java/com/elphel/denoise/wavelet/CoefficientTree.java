/**
 ** -----------------------------------------------------------------------------**
 ** CoefficientTree.java
 **
 ** Ordered sequence of tagged subbands produced by the forward transform
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CoefficientTree.java is free software: you can redistribute it and/or modify
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
import java.util.Collections;
import java.util.List;

/**
 * Approximation subband followed by levels 1 (coarsest) .. L (finest), each level
 * holding {@link Orientation#HORIZONTAL}, {@link Orientation#VERTICAL} and
 * {@link Orientation#DIAGONAL} subbands in that order. Subband at index
 * 1 + 3 * (level - 1) + k has orientation {@code Orientation.DETAILS[k]}.
 * Also remembers the basis and the shape of the transformed image.
 */
public class CoefficientTree {
	private final WaveletBasis  basis;
	private final int           rows;
	private final int           cols;
	private final int           levels;
	private final List<Subband> subbands;

	public CoefficientTree(
			WaveletBasis basis,
			int rows,
			int cols,
			List<Subband> subbands) {
		if ((subbands.size() < 4) || ((subbands.size() - 1) % 3 != 0)) {
			throw new IllegalArgumentException("Tree needs one approximation and 3 subbands per level, got "+subbands.size());
		}
		this.basis =    basis;
		this.rows =     rows;
		this.cols =     cols;
		this.levels =   (subbands.size() - 1) / 3;
		this.subbands = new ArrayList<Subband>(subbands);
		for (int i = 0; i < this.subbands.size(); i++) {
			Subband sb = this.subbands.get(i);
			if ((sb.getLevel() != levelOf(i)) || (sb.getOrientation() != orientationOf(i))) {
				throw new IllegalArgumentException("Subband "+sb+" is out of order at index "+i);
			}
		}
	}

	private static int levelOf(int index) {
		return (index == 0) ? 0 : ((index - 1) / 3 + 1);
	}

	private static Orientation orientationOf(int index) {
		return (index == 0) ? Orientation.APPROX : Orientation.DETAILS[(index - 1) % 3];
	}

	private static int indexOf(int level, Orientation orientation) {
		if (orientation == Orientation.APPROX) return 0;
		return 1 + 3 * (level - 1) + (orientation.ordinal() - Orientation.HORIZONTAL.ordinal());
	}

	public WaveletBasis getBasis() {
		return basis;
	}

	/** @return rows of the original image */
	public int getRows() {
		return rows;
	}

	/** @return columns of the original image */
	public int getCols() {
		return cols;
	}

	public int getLevels() {
		return levels;
	}

	public Subband getApproximation() {
		return subbands.get(0);
	}

	/**
	 * @param level 1 (coarsest) .. getLevels() (finest)
	 * @param orientation detail orientation
	 * @return detail subband
	 */
	public Subband getDetail(int level, Orientation orientation) {
		checkDetail(level, orientation);
		return subbands.get(indexOf(level, orientation));
	}

	/**
	 * @param level 1 (coarsest) .. getLevels() (finest)
	 * @return horizontal, vertical and diagonal subbands of the level
	 */
	public Subband [] getDetails(int level) {
		Subband [] details = new Subband[Orientation.DETAILS.length];
		for (int k = 0; k < details.length; k++) {
			details[k] = getDetail(level, Orientation.DETAILS[k]);
		}
		return details;
	}

	/** @return all subbands in tree order, read-only view */
	public List<Subband> getSubbands() {
		return Collections.unmodifiableList(subbands);
	}

	/**
	 * Put a shrunk detail subband back in place of the one with the same level and orientation.
	 * The approximation subband can not be replaced.
	 * @param subband replacement of the same shape
	 */
	public void replaceDetail(Subband subband) {
		checkDetail(subband.getLevel(), subband.getOrientation());
		int index = indexOf(subband.getLevel(), subband.getOrientation());
		Subband old = subbands.get(index);
		if ((old.getRows() != subband.getRows()) || (old.getCols() != subband.getCols())) {
			throw new IllegalArgumentException("Replacement "+subband+" does not match "+old);
		}
		subbands.set(index, subband);
	}

	private void checkDetail(int level, Orientation orientation) {
		if (!orientation.isDetail()) {
			throw new IllegalArgumentException("Not a detail orientation: "+orientation);
		}
		if ((level < 1) || (level > levels)) {
			throw new IllegalArgumentException("Detail level "+level+" is outside of 1.."+levels);
		}
	}
}
