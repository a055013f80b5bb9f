/**
 ** -----------------------------------------------------------------------------**
 ** WaveletDenoiseParameters.java
 **
 ** Configuration parameters of the wavelet denoising
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WaveletDenoiseParameters.java is free software: you can redistribute it and/or modify
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
import java.util.Properties;

import ij.gui.GenericDialog;

public class WaveletDenoiseParameters {
	public static final String PRESET_DEFAULT =     "default";
	public static final String PRESET_SHARP =       "sharp";      // small sharp noise spots
	public static final String PRESET_SHARP_HARD =  "sharp_hard";
	public static final String PRESET_ULTRA_SHARP = "ultra_sharp";
	public static final String [] PRESET_NAMES = {PRESET_DEFAULT, PRESET_SHARP, PRESET_SHARP_HARD, PRESET_ULTRA_SHARP};

	public WaveletBasis    basis =            WaveletBasis.DEFAULT;
	public int             levels =           6;
	public double          threshold_factor = 0.1;   // lower - more sensitive
	public ThresholdMode   mode =             ThresholdMode.SOFT;
	public ThresholdMethod method =           ThresholdMethod.ADAPTIVE;
	public double          sigma =            Double.NaN; // NaN - estimate from the image

	public WaveletDenoiseParameters() {
	}

	public WaveletDenoiseParameters(
			WaveletBasis    basis,
			int             levels,
			double          threshold_factor,
			ThresholdMode   mode,
			ThresholdMethod method) {
		this.basis =            basis;
		this.levels =           levels;
		this.threshold_factor = threshold_factor;
		this.mode =             mode;
		this.method =           method;
	}

	public static WaveletDenoiseParameters getPreset(String name) {
		WaveletDenoiseParameters parameters = new WaveletDenoiseParameters();
		parameters.applyPreset(name);
		return parameters;
	}

	/**
	 * Replace basis, levels, threshold factor, mode and method with the named preset,
	 * sigma is kept.
	 * @param name one of {@link #PRESET_NAMES}
	 */
	public void applyPreset(String name) {
		String preset = (name == null) ? null : name.trim().toLowerCase(Locale.ROOT);
		if (PRESET_DEFAULT.equals(preset)) {
			set(WaveletBasis.BIOR4_4,  6, 0.1,   ThresholdMode.SOFT, ThresholdMethod.ADAPTIVE);
		} else if (PRESET_SHARP.equals(preset)) {
			set(WaveletBasis.BIOR4_4,  8, 0.03,  ThresholdMode.SOFT, ThresholdMethod.ADAPTIVE);
		} else if (PRESET_SHARP_HARD.equals(preset)) {
			set(WaveletBasis.DB4,     10, 0.01,  ThresholdMode.HARD, ThresholdMethod.ADAPTIVE);
		} else if (PRESET_ULTRA_SHARP.equals(preset)) {
			set(WaveletBasis.COIF1,   10, 0.005, ThresholdMode.HARD, ThresholdMethod.ADAPTIVE); // deepest for 1024 pixels
		} else {
			throw new InvalidConfigurationException("Unknown preset \""+name+"\"");
		}
	}

	private void set(
			WaveletBasis    basis,
			int             levels,
			double          threshold_factor,
			ThresholdMode   mode,
			ThresholdMethod method) {
		this.basis =            basis;
		this.levels =           levels;
		this.threshold_factor = threshold_factor;
		this.mode =             mode;
		this.method =           method;
	}

	public boolean hasSigma() {
		return !Double.isNaN(sigma);
	}

	/**
	 * Check values that do not depend on the image
	 * @throws InvalidConfigurationException on the first bad value
	 */
	public void validate() {
		if (basis == null)  throw new InvalidConfigurationException("Wavelet basis is not set");
		if (mode == null)   throw new InvalidConfigurationException("Threshold mode is not set");
		if (method == null) throw new InvalidConfigurationException("Threshold method is not set");
		if (levels < 1) {
			throw new InvalidConfigurationException("Number of decomposition levels should be positive, got "+levels);
		}
		if (!(threshold_factor > 0.0) || Double.isInfinite(threshold_factor)) {
			throw new InvalidConfigurationException("Threshold factor should be a positive number, got "+threshold_factor);
		}
		if (hasSigma() && (!(sigma > 0.0) || Double.isInfinite(sigma))) {
			throw new InvalidConfigurationException("Noise sigma should be a positive number, got "+sigma);
		}
	}

	/**
	 * Full check before processing an image of the specified size
	 * @param rows image height
	 * @param cols image width
	 */
	public void validate(int rows, int cols) {
		validate();
		if ((rows < 1) || (cols < 1)) {
			throw new InvalidConfigurationException("Empty image "+rows+"x"+cols);
		}
		WaveletTransform2D.checkLevels(rows, cols, basis, levels);
	}

	public void dialogQuestions(GenericDialog gd) {
		gd.addMessage("Wavelet thresholding parameters");
		gd.addChoice      ("Wavelet basis",                WaveletBasis.getNames(),    this.basis.getName());
		gd.addNumericField("Decomposition levels",         this.levels,             0, 3, "");
		gd.addNumericField("Threshold factor",             this.threshold_factor,   4, 8, "(lower - more sensitive)");
		gd.addChoice      ("Threshold mode",               ThresholdMode.getNames(),   this.mode.getName());
		gd.addChoice      ("Threshold method",             ThresholdMethod.getNames(), this.method.getName());
		gd.addNumericField("Noise sigma (0 - estimate)",   hasSigma() ? this.sigma : 0.0, 4, 8, "(bayes/sure only)");
	}

	public void dialogAnswers(GenericDialog gd) {
		this.basis =            WaveletBasis.fromName(gd.getNextChoice());
		this.levels =     (int) gd.getNextNumber();
		this.threshold_factor = gd.getNextNumber();
		this.mode =             ThresholdMode.fromName(gd.getNextChoice());
		this.method =           ThresholdMethod.fromName(gd.getNextChoice());
		double s =              gd.getNextNumber();
		this.sigma =            (s > 0.0) ? s : Double.NaN;
	}

	public void setProperties(String prefix, Properties properties) {
		properties.setProperty(prefix+"basis",            this.basis.getName());
		properties.setProperty(prefix+"levels",           this.levels+"");
		properties.setProperty(prefix+"threshold_factor", this.threshold_factor+"");
		properties.setProperty(prefix+"mode",             this.mode.getName());
		properties.setProperty(prefix+"method",           this.method.getName());
		if (hasSigma()) {
			properties.setProperty(prefix+"sigma",        this.sigma+"");
		} else {
			properties.remove(prefix+"sigma");
		}
	}

	/**
	 * Read values present in the properties, keep the current ones for missing keys
	 * @param prefix key prefix
	 * @param properties source
	 * @throws InvalidConfigurationException for unparsable values
	 */
	public void getProperties(String prefix, Properties properties) {
		try {
			if (properties.getProperty(prefix+"basis")!=null)            this.basis=WaveletBasis.fromName(properties.getProperty(prefix+"basis"));
			if (properties.getProperty(prefix+"levels")!=null)           this.levels=Integer.parseInt(properties.getProperty(prefix+"levels").trim());
			if (properties.getProperty(prefix+"threshold_factor")!=null) this.threshold_factor=Double.parseDouble(properties.getProperty(prefix+"threshold_factor"));
			if (properties.getProperty(prefix+"mode")!=null)             this.mode=ThresholdMode.fromName(properties.getProperty(prefix+"mode"));
			if (properties.getProperty(prefix+"method")!=null)           this.method=ThresholdMethod.fromName(properties.getProperty(prefix+"method"));
			if (properties.getProperty(prefix+"sigma")!=null) {
				String s = properties.getProperty(prefix+"sigma").trim();
				this.sigma = (s.isEmpty() || s.equalsIgnoreCase("auto")) ? Double.NaN : Double.parseDouble(s);
			}
		} catch (NumberFormatException e) {
			throw new InvalidConfigurationException("Bad numeric value in denoise properties: "+e.getMessage(), e);
		}
	}

	@Override
	public WaveletDenoiseParameters clone() {
		WaveletDenoiseParameters wdp = new WaveletDenoiseParameters(
				basis,
				levels,
				threshold_factor,
				mode,
				method);
		wdp.sigma = this.sigma;
		return wdp;
	}

	@Override
	public String toString() {
		return "basis="+basis+", levels="+levels+", threshold_factor="+threshold_factor+
				", mode="+mode+", method="+method+", sigma="+(hasSigma() ? (""+sigma) : "auto");
	}
}
