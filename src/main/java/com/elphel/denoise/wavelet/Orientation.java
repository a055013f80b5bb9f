/**
 ** -----------------------------------------------------------------------------**
 ** Orientation.java
 **
 ** Orientation tags of the wavelet subbands
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Orientation.java is free software: you can redistribute it and/or modify
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

public enum Orientation {
	APPROX     ("a"),
	/** high-pass across rows, low-pass along them: horizontal edges */
	HORIZONTAL ("h"),
	VERTICAL   ("v"),
	DIAGONAL   ("d");

	/** detail orientations in the order they are stored for each level */
	public static final Orientation [] DETAILS = {HORIZONTAL, VERTICAL, DIAGONAL};

	private final String abbreviation;

	Orientation(String abbreviation) {
		this.abbreviation = abbreviation;
	}

	public String getAbbreviation() {
		return abbreviation;
	}

	public boolean isDetail() {
		return this != APPROX;
	}
}
