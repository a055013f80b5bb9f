/**
 ** -----------------------------------------------------------------------------**
 ** LoggingDenoiseObserver.java
 **
 ** Logs sigma estimates and applied thresholds
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LoggingDenoiseObserver.java is free software: you can redistribute it and/or modify
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDenoiseObserver implements DenoiseObserver {
	private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDenoiseObserver.class);

	private final String name;

	public LoggingDenoiseObserver() {
		this(null);
	}

	/** @param name image or slice name prepended to the messages, may be null */
	public LoggingDenoiseObserver(String name) {
		this.name = name;
	}

	private String prefix() {
		return (name == null) ? "" : (name + ": ");
	}

	@Override
	public void onGlobalSigma(double sigma, boolean estimated) {
		LOGGER.info(String.format("%s%s noise sigma: %.4f", prefix(), estimated ? "Estimated" : "Specified", sigma));
	}

	@Override
	public void onThreshold(ThresholdRecord record) {
		if (record.getSigma() == 0.0) {
			LOGGER.debug("{}{} has zero sigma, coefficients are kept", prefix(), record);
		}
	}

	@Override
	public void onLevelComplete(int level, ThresholdRecord [] records) {
		if (!LOGGER.isInfoEnabled()) return;
		StringBuilder sb = new StringBuilder();
		for (ThresholdRecord record : records) {
			if (sb.length() > 0) sb.append(", ");
			sb.append(record.getOrientation().getAbbreviation()).append('=');
			sb.append(String.format("%.4f", record.getThreshold()));
		}
		LOGGER.info(prefix()+"Level "+level+" thresholds: "+sb);
	}
}
