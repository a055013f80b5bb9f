/**
 ** -----------------------------------------------------------------------------**
 ** ThresholdMethod.java
 **
 ** Threshold selection methods
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ThresholdMethod.java is free software: you can redistribute it and/or modify
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

public enum ThresholdMethod {
	/** per-subband sigma, geometric level factor and orientation weighting */
	ADAPTIVE ("adaptive"),
	/** universal threshold from the global sigma, same for every detail subband */
	BAYES    ("bayes"),
	/** handled exactly as {@link #BAYES} */
	SURE     ("sure");

	private final String label;

	ThresholdMethod(String name) {
		this.label = name;
	}

	public String getName() {
		return label;
	}

	public boolean usesGlobalSigma() {
		return this != ADAPTIVE;
	}

	public static String [] getNames() {
		ThresholdMethod [] methods = values();
		String [] names = new String[methods.length];
		for (int i = 0; i < methods.length; i++) names[i] = methods[i].label;
		return names;
	}

	public static ThresholdMethod fromName(String name) {
		if (name != null) {
			String lc = name.trim().toLowerCase(Locale.ROOT);
			for (ThresholdMethod method : values()) {
				if (method.label.equals(lc)) return method;
			}
		}
		throw new InvalidConfigurationException("Unknown threshold method \""+name+"\", expected one of adaptive, bayes, sure");
	}

	@Override
	public String toString() {
		return label;
	}
}
