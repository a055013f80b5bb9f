/**
 ** -----------------------------------------------------------------------------**
 ** WaveletDenoiseException.java
 **
 ** Base class for failures of the wavelet denoising engine
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WaveletDenoiseException.java is free software: you can redistribute it and/or modify
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

public class WaveletDenoiseException extends RuntimeException {
	private static final long serialVersionUID = 6320953785306472614L;

	public WaveletDenoiseException(String message) {
		super(message);
	}

	public WaveletDenoiseException(String message, Throwable cause) {
		super(message, cause);
	}
}
