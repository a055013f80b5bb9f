/**
 * Copyright (C) 2026 Elphel, Inc.
 * SPDX-License-Identifier: GPL-3.0-or-later
 */

import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.denoise.io.ImagePlusDenoiser;
import com.elphel.denoise.wavelet.WaveletDenoiseException;
import com.elphel.denoise.wavelet.WaveletDenoiseParameters;

import ij.IJ;
import ij.ImagePlus;
import ij.Prefs;
import ij.gui.GenericDialog;
import ij.plugin.PlugIn;

/**
 * ImageJ plugin: split the current image into "denoised" and "noise" images.
 * Parameters are remembered in IJ_Prefs.txt under the "wavelet_denoise." prefix.
 */
public class Wavelet_Denoise implements PlugIn {
	private static final Logger LOGGER = LoggerFactory.getLogger(Wavelet_Denoise.class);

	public static final String PREFS_PREFIX = "wavelet_denoise.";
	public static final String [] KEYS = {"basis", "levels", "threshold_factor", "mode", "method", "sigma"};

	@Override
	public void run(String arg) {
		ImagePlus imp = IJ.getImage();
		if (imp == null) return;
		WaveletDenoiseParameters parameters = new WaveletDenoiseParameters();
		try {
			parameters.getProperties(PREFS_PREFIX, readPrefs());
		} catch (WaveletDenoiseException e) {
			LOGGER.warn("Ignoring stored parameters: "+e.getMessage());
			parameters = new WaveletDenoiseParameters();
		}
		GenericDialog gd = new GenericDialog("Wavelet denoise");
		parameters.dialogQuestions(gd);
		gd.showDialog();
		if (gd.wasCanceled()) return;
		try {
			parameters.dialogAnswers(gd);
			parameters.validate(imp.getHeight(), imp.getWidth());
			writePrefs(parameters);
			ImagePlus [] results = new ImagePlusDenoiser(parameters).denoise(imp);
			results[ImagePlusDenoiser.DENOISED].show();
			results[ImagePlusDenoiser.NOISE].show();
		} catch (WaveletDenoiseException e) {
			IJ.error("Wavelet denoise", e.getMessage());
		}
	}

	private static Properties readPrefs() {
		Properties properties = new Properties();
		for (String key : KEYS) {
			String value = Prefs.get(PREFS_PREFIX + key, null);
			if (value != null) properties.setProperty(PREFS_PREFIX + key, value);
		}
		return properties;
	}

	private static void writePrefs(WaveletDenoiseParameters parameters) {
		Properties properties = new Properties();
		parameters.setProperties(PREFS_PREFIX, properties);
		for (String key : KEYS) {
			String value = properties.getProperty(PREFS_PREFIX + key);
			Prefs.set(PREFS_PREFIX + key, (value == null) ? "" : value);
		}
	}
}
