/**
 ** -----------------------------------------------------------------------------**
 ** ImagePlusDenoiser.java
 **
 ** Applies the wavelet denoising to ImageJ images and image files
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ImagePlusDenoiser.java is free software: you can redistribute it and/or modify
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
package com.elphel.denoise.io;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.denoise.common.MultiThreading;
import com.elphel.denoise.wavelet.DenoiseResult;
import com.elphel.denoise.wavelet.LoggingDenoiseObserver;
import com.elphel.denoise.wavelet.WaveletDenoiseParameters;
import com.elphel.denoise.wavelet.WaveletDenoiser;

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Reads images with ImageJ (TIFF, FITS and other supported formats), denoises every
 * slice independently and produces 32-bit "denoised" and "noise" images that carry
 * the source metadata (Info property with the FITS header or TIFF description,
 * calibration, slice labels) unchanged.
 */
public class ImagePlusDenoiser {
	private static final Logger LOGGER = LoggerFactory.getLogger(ImagePlusDenoiser.class);

	public static final String INFO_PROPERTY =   "Info";
	public static final String DENOISED_SUFFIX = "_denoised";
	public static final String NOISE_SUFFIX =    "_noise";
	public static final String [] FITS_EXTENSIONS = {".fits", ".fit", ".fts"};
	public static final int    DENOISED =        0;
	public static final int    NOISE =           1;

	private final WaveletDenoiseParameters parameters;
	private final int                      threads;

	/**
	 * @param parameters denoise parameters, copied
	 * @param threads maximal number of slices processed simultaneously
	 */
	public ImagePlusDenoiser(WaveletDenoiseParameters parameters, int threads) {
		this.parameters = parameters.clone();
		this.parameters.validate();
		this.threads =    Math.max(1, threads);
	}

	public ImagePlusDenoiser(WaveletDenoiseParameters parameters) {
		this(parameters, MultiThreading.THREADS_MAX);
	}

	public static ImagePlus openImage(String path) throws IOException {
		if (!new File(path).isFile()) {
			throw new IOException("Input file "+path+" does not exist");
		}
		ImagePlus imp = IJ.openImage(path);
		if (imp == null) {
			throw new IOException("ImageJ could not open "+path);
		}
		LOGGER.info("Opened "+path+": "+imp.getWidth()+"x"+imp.getHeight()+", "+
				imp.getStackSize()+" slice(s), "+imp.getBitDepth()+" bits");
		return imp;
	}

	public static void saveTiff(ImagePlus imp, String path) throws IOException {
		FileSaver fs = new FileSaver(imp);
		boolean ok = (imp.getStackSize() > 1) ? fs.saveAsTiffStack(path) : fs.saveAsTiff(path);
		if (!ok) {
			throw new IOException("Failed to save "+path);
		}
		LOGGER.info("Saved "+path);
	}

	public static void saveFits(ImagePlus imp, String path) throws IOException {
		if (!new FileSaver(imp).saveAsFits(path)) {
			throw new IOException("Failed to save "+path+" as FITS");
		}
		LOGGER.info("Saved "+path);
	}

	/**
	 * Save as FITS when the name has one of {@link #FITS_EXTENSIONS}, as TIFF otherwise
	 * @param imp image to save
	 * @param path output file path
	 * @throws IOException if ImageJ could not write the file
	 */
	public static void saveImage(ImagePlus imp, String path) throws IOException {
		if (isFits(path)) {
			saveFits(imp, path);
		} else {
			saveTiff(imp, path);
		}
	}

	public static boolean isFits(String path) {
		String lc = path.toLowerCase(Locale.ROOT);
		for (String ext : FITS_EXTENSIONS) {
			if (lc.endsWith(ext)) return true;
		}
		return false;
	}

	/**
	 * Denoise all slices of the image
	 * @param imp source image, not modified
	 * @return {denoised, noise} 32-bit images of the same size and number of slices
	 */
	public ImagePlus [] denoise(final ImagePlus imp) {
		final ImageStack stack = imp.getStack();
		final int num_slices = stack.getSize();
		final String title = imp.getTitle();
		final double [][][] denoised = new double [num_slices][][];
		final double [][][] noise =    new double [num_slices][][];
		MultiThreading.runIndexed(num_slices, threads, new MultiThreading.IndexedTask() {
			@Override
			public void run(int nSlice) {
				String name = (num_slices > 1) ? (title+":"+(nSlice+1)) : title;
				double [][] data = toArray(stack.getProcessor(nSlice + 1));
				int num_replaced = replaceNonFinite(data);
				if (num_replaced > 0) {
					LOGGER.warn(name+": replaced "+num_replaced+" non-finite sample(s) with the median");
				}
				WaveletDenoiser denoiser = new WaveletDenoiser(parameters, new LoggingDenoiseObserver(name));
				DenoiseResult result = denoiser.denoise(data);
				denoised[nSlice] = result.getDenoised();
				noise[nSlice] =    result.getNoise();
				if (LOGGER.isInfoEnabled()) {
					LOGGER.info(name+" original: "+ArrayStatistics.of(data));
					LOGGER.info(name+" denoised: "+ArrayStatistics.of(denoised[nSlice]));
					LOGGER.info(name+" noise:    "+ArrayStatistics.of(noise[nSlice]));
				}
			}
		});
		ImagePlus [] result = new ImagePlus[2];
		result[DENOISED] = makeImage(imp, denoised, stripExtension(title)+DENOISED_SUFFIX);
		result[NOISE] =    makeImage(imp, noise,    stripExtension(title)+NOISE_SUFFIX);
		return result;
	}

	private static ImagePlus makeImage(ImagePlus src, double [][][] slices, String title) {
		ImageStack src_stack = src.getStack();
		ImageStack stack = new ImageStack(src.getWidth(), src.getHeight());
		for (int n = 0; n < slices.length; n++) {
			stack.addSlice(src_stack.getSliceLabel(n + 1), toProcessor(slices[n]));
		}
		ImagePlus imp = new ImagePlus(title, stack);
		copyMetadata(src, imp);
		return imp;
	}

	/**
	 * Copy metadata verbatim: Info property, calibration and stack dimensions
	 */
	public static void copyMetadata(ImagePlus src, ImagePlus dst) {
		Object info = src.getProperty(INFO_PROPERTY);
		if (info != null) {
			dst.setProperty(INFO_PROPERTY, info);
		}
		dst.setCalibration(src.getCalibration().copy());
		if (src.getStackSize() == dst.getStackSize()) {
			dst.setDimensions(src.getNChannels(), src.getNSlices(), src.getNFrames());
		}
	}

	/**
	 * @param ip any ImageJ processor (color is converted to luminance)
	 * @return samples as [row][column]
	 */
	public static double [][] toArray(ImageProcessor ip) {
		FloatProcessor fp = (ip instanceof FloatProcessor) ? (FloatProcessor) ip : ip.convertToFloatProcessor();
		float [] pixels = (float []) fp.getPixels();
		int width =  fp.getWidth();
		int height = fp.getHeight();
		double [][] data = new double [height][width];
		for (int row = 0; row < height; row++) {
			int base = row * width;
			for (int col = 0; col < width; col++) {
				data[row][col] = pixels[base + col];
			}
		}
		return data;
	}

	public static FloatProcessor toProcessor(double [][] data) {
		int height = data.length;
		int width =  data[0].length;
		float [] pixels = new float [width * height];
		for (int row = 0; row < height; row++) {
			int base = row * width;
			for (int col = 0; col < width; col++) {
				pixels[base + col] = (float) data[row][col];
			}
		}
		return new FloatProcessor(width, height, pixels);
	}

	/**
	 * Replace NaN and infinite samples in place by the median of the finite ones
	 * (by 0 if there are none).
	 * @param data [row][column] samples
	 * @return number of replaced samples
	 */
	public static int replaceNonFinite(double [][] data) {
		int num_finite = 0;
		int num_samples = 0;
		for (double [] row : data) {
			num_samples += row.length;
			for (double d : row) {
				if (!Double.isNaN(d) && !Double.isInfinite(d)) num_finite++;
			}
		}
		if (num_finite == num_samples) return 0;
		double [] finite = new double [num_finite];
		int indx = 0;
		for (double [] row : data) {
			for (double d : row) {
				if (!Double.isNaN(d) && !Double.isInfinite(d)) finite[indx++] = d;
			}
		}
		double fill = (num_finite > 0) ? new Median().evaluate(finite) : 0.0;
		for (double [] row : data) {
			for (int col = 0; col < row.length; col++) {
				if (Double.isNaN(row[col]) || Double.isInfinite(row[col])) row[col] = fill;
			}
		}
		return num_samples - num_finite;
	}

	static String stripExtension(String name) {
		if (name == null) return "image";
		int dot = name.lastIndexOf('.');
		return (dot > 0) ? name.substring(0, dot) : name;
	}
}
