/**
 ** -----------------------------------------------------------------------------**
 ** InvalidConfigurationException.java
 **
 ** Raised before any transform work for unusable denoise parameters
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  InvalidConfigurationException.java is free software: you can redistribute it and/or modify
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
 * Unknown basis/method/mode names, non-positive levels or threshold factor,
 * a non-positive supplied sigma, an empty or ragged image, or a number of levels
 * the image is too small for.
 */
public class InvalidConfigurationException extends WaveletDenoiseException {
	private static final long serialVersionUID = -2871364507012835914L;

	public InvalidConfigurationException(String message) {
		super(message);
	}

	public InvalidConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
