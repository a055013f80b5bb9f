/**
 ** -----------------------------------------------------------------------------**
 ** WaveletDenoiseCommand.java
 **
 ** Command line front end of the wavelet denoising
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WaveletDenoiseCommand.java is free software: you can redistribute it and/or modify
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
package com.elphel.denoise.cli;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.denoise.common.EProperties;
import com.elphel.denoise.common.MultiThreading;
import com.elphel.denoise.io.ImagePlusDenoiser;
import com.elphel.denoise.wavelet.ThresholdMethod;
import com.elphel.denoise.wavelet.ThresholdMode;
import com.elphel.denoise.wavelet.WaveletBasis;
import com.elphel.denoise.wavelet.WaveletDenoiseException;
import com.elphel.denoise.wavelet.WaveletDenoiseParameters;

import ij.ImagePlus;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Denoise an image file, write 32-bit denoised and noise images as FITS or TIFF.
 * Parameters are taken from the defaults, then the properties file (--config),
 * then the preset (--preset), then the individual options.
 */
@Command(
		name = "wavelet-denoise",
		mixinStandardHelpOptions = true,
		version = "wavelet-denoise 1.0",
		description = "Separate an image into denoised and noise components with multi-level wavelet thresholding.")
public class WaveletDenoiseCommand implements Callable<Integer> {
	private static final Logger LOGGER = LoggerFactory.getLogger(WaveletDenoiseCommand.class);

	public static final int EXIT_OK =    0;
	public static final int EXIT_ERROR = 1;

	@Parameters(index = "0", description = "Input image (TIFF, FITS or any other format ImageJ reads)")
	File input;

	@Option(names = {"-o", "--output"}, description = "Denoised image output (FITS for .fits/.fit/.fts, TIFF otherwise), default <input>_denoised.tif or .fits for FITS input")
	File output;

	@Option(names = {"-n", "--noise"}, description = "Noise image output, same naming and format rules as --output")
	File noise;

	@Option(names = {"-w", "--wavelet"}, description = "Wavelet basis: haar, db2, db4, sym4, coif1, bior2.2, bior4.4 (default)")
	String wavelet;

	@Option(names = {"-s", "--sigma"}, description = "Noise standard deviation, estimated from the image if not specified")
	Double sigma;

	@Option(names = {"-m", "--mode"}, description = "Threshold mode: soft (default) or hard")
	String mode;

	@Option(names = {"--method"}, description = "Threshold method: adaptive (default), bayes or sure")
	String method;

	@Option(names = {"-l", "--levels"}, description = "Decomposition levels (default 6)")
	Integer levels;

	@Option(names = {"-t", "--threshold-factor"}, description = "Threshold factor, lower is more sensitive (default 0.1)")
	Double threshold_factor;

	@Option(names = {"--preset"}, description = "Parameter preset: default, sharp, sharp_hard, ultra_sharp")
	String preset;

	@Option(names = {"--config"}, description = "Properties file with basis, levels, threshold_factor, mode, method, sigma, threads")
	File config;

	@Option(names = {"--threads"}, description = "Maximal number of slices processed in parallel")
	Integer threads;

	public static void main(String... args) {
		System.exit(new CommandLine(new WaveletDenoiseCommand()).execute(args));
	}

	@Override
	public Integer call() {
		try {
			int max_threads = MultiThreading.THREADS_MAX;
			WaveletDenoiseParameters parameters = new WaveletDenoiseParameters();
			if (config != null) {
				EProperties properties = EProperties.load(config.toPath());
				parameters.getProperties("", properties);
				max_threads = properties.getProperty("threads", max_threads);
			}
			if (preset != null)           parameters.applyPreset(preset);
			if (wavelet != null)          parameters.basis =            WaveletBasis.fromName(wavelet);
			if (levels != null)           parameters.levels =           levels;
			if (threshold_factor != null) parameters.threshold_factor = threshold_factor;
			if (mode != null)             parameters.mode =             ThresholdMode.fromName(mode);
			if (method != null)           parameters.method =           ThresholdMethod.fromName(method);
			if (sigma != null)            parameters.sigma =            sigma;
			if (threads != null)          max_threads =                 threads;
			parameters.validate();
			LOGGER.info("Denoise parameters: "+parameters);

			String input_path = input.getPath();
			String base = stripExtension(input_path);
			// FITS input gives FITS output, anything else is written as 32-bit TIFF
			String extension = ImagePlusDenoiser.isFits(input_path) ? input_path.substring(base.length()) : ".tif";
			String output_path = (output != null) ? output.getPath() : (base + ImagePlusDenoiser.DENOISED_SUFFIX + extension);
			String noise_path =  (noise != null)  ? noise.getPath()  : (base + ImagePlusDenoiser.NOISE_SUFFIX + extension);

			ImagePlus imp = ImagePlusDenoiser.openImage(input_path);
			ImagePlus [] results = new ImagePlusDenoiser(parameters, max_threads).denoise(imp);
			ImagePlusDenoiser.saveImage(results[ImagePlusDenoiser.DENOISED], output_path);
			ImagePlusDenoiser.saveImage(results[ImagePlusDenoiser.NOISE],    noise_path);
			LOGGER.info("Done");
			return EXIT_OK;
		} catch (WaveletDenoiseException e) {
			LOGGER.error("Invalid denoise configuration: "+e.getMessage());
			return EXIT_ERROR;
		} catch (NumberFormatException e) {
			LOGGER.error("Invalid number in "+config+": "+e.getMessage());
			return EXIT_ERROR;
		} catch (IOException e) {
			LOGGER.error("I/O error: "+e.getMessage());
			return EXIT_ERROR;
		}
	}

	static String stripExtension(String path) {
		int dot =   path.lastIndexOf('.');
		int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf(File.separatorChar));
		return (dot > slash + 1) ? path.substring(0, dot) : path;
	}
}
