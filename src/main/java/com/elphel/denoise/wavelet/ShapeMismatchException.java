/**
 ** -----------------------------------------------------------------------------**
 ** ShapeMismatchException.java
 **
 ** Raised when a reconstruction can not be cropped back to the input shape
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShapeMismatchException.java is free software: you can redistribute it and/or modify
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

public class ShapeMismatchException extends WaveletDenoiseException {
	private static final long serialVersionUID = 4406217583214690152L;

	private final int expected_rows;
	private final int expected_cols;
	private final int actual_rows;
	private final int actual_cols;

	public ShapeMismatchException(
			int expected_rows,
			int expected_cols,
			int actual_rows,
			int actual_cols) {
		super("Reconstruction "+actual_rows+"x"+actual_cols+
				" can not be cropped to "+expected_rows+"x"+expected_cols);
		this.expected_rows = expected_rows;
		this.expected_cols = expected_cols;
		this.actual_rows =   actual_rows;
		this.actual_cols =   actual_cols;
	}

	public int getExpectedRows() { return expected_rows; }
	public int getExpectedCols() { return expected_cols; }
	public int getActualRows()   { return actual_rows; }
	public int getActualCols()   { return actual_cols; }
}
