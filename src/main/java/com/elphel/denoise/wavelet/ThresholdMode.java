/**
 ** -----------------------------------------------------------------------------**
 ** ThresholdMode.java
 **
 ** Shrinkage rules applied to detail coefficients
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ThresholdMode.java is free software: you can redistribute it and/or modify
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

import java.util.Locale;

public enum ThresholdMode {
	SOFT ("soft"),
	HARD ("hard");

	private final String label;

	ThresholdMode(String name) {
		this.label = name;
	}

	public String getName() {
		return label;
	}

	public static String [] getNames() {
		ThresholdMode [] modes = values();
		String [] names = new String[modes.length];
		for (int i = 0; i < modes.length; i++) names[i] = modes[i].label;
		return names;
	}

	public static ThresholdMode fromName(String name) {
		if (name != null) {
			String lc = name.trim().toLowerCase(Locale.ROOT);
			for (ThresholdMode mode : values()) {
				if (mode.label.equals(lc)) return mode;
			}
		}
		throw new InvalidConfigurationException("Unknown threshold mode \""+name+"\", expected one of soft, hard");
	}

	@Override
	public String toString() {
		return label;
	}
}
