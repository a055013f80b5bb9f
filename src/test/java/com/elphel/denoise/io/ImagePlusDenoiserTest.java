package com.elphel.denoise.io;

import com.elphel.denoise.wavelet.InvalidConfigurationException;
import com.elphel.denoise.wavelet.ThresholdMethod;
import com.elphel.denoise.wavelet.ThresholdMode;
import com.elphel.denoise.wavelet.WaveletBasis;
import com.elphel.denoise.wavelet.WaveletDenoiseParameters;
import ij.ImagePlus;
import ij.ImageStack;
import ij.measure.Calibration;
import ij.process.FloatProcessor;
import ij.process.ShortProcessor;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImagePlusDenoiserTest {

	private static final String HEADER = "SIMPLE  =                    T\nEXPTIME =                 30.0";

	@TempDir
	Path dir;

	private static FloatProcessor noisySlice(int width, int height, long seed) {
		Random random = new Random(seed);
		FloatProcessor fp = new FloatProcessor(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				fp.setf(x, y, (float) (100.0 + 20.0 * Math.sin(x / 6.0) + 5.0 * random.nextGaussian()));
			}
		}
		return fp;
	}

	private static ImagePlus twoSliceImage() {
		ImageStack stack = new ImageStack(48, 40);
		stack.addSlice("red", noisySlice(48, 40, 1));
		stack.addSlice("blue", noisySlice(48, 40, 2));
		ImagePlus imp = new ImagePlus("frame.fits", stack);
		imp.setProperty(ImagePlusDenoiser.INFO_PROPERTY, HEADER);
		Calibration calibration = imp.getCalibration();
		calibration.pixelWidth = 0.5;
		calibration.pixelHeight = 0.5;
		calibration.setUnit("arcsec");
		return imp;
	}

	private static WaveletDenoiseParameters haarParameters() {
		return new WaveletDenoiseParameters(WaveletBasis.HAAR, 2, 0.5, ThresholdMode.SOFT, ThresholdMethod.ADAPTIVE);
	}

	@Test
	void stackSlicesAreDenoisedWithMetadata() {
		ImagePlus imp = twoSliceImage();
		ImagePlus[] result = new ImagePlusDenoiser(haarParameters(), 2).denoise(imp);

		Assertions.assertEquals("frame_denoised", result[ImagePlusDenoiser.DENOISED].getTitle());
		Assertions.assertEquals("frame_noise", result[ImagePlusDenoiser.NOISE].getTitle());
		for (ImagePlus out : result) {
			Assertions.assertEquals(48, out.getWidth());
			Assertions.assertEquals(40, out.getHeight());
			Assertions.assertEquals(2, out.getStackSize());
			Assertions.assertEquals(32, out.getBitDepth());
			Assertions.assertEquals(HEADER, out.getProperty(ImagePlusDenoiser.INFO_PROPERTY));
			Assertions.assertEquals(0.5, out.getCalibration().pixelWidth, 0.0);
			Assertions.assertEquals("arcsec", out.getCalibration().getUnit());
			Assertions.assertEquals("red", out.getStack().getSliceLabel(1));
			Assertions.assertEquals("blue", out.getStack().getSliceLabel(2));
		}

		for (int slice = 1; slice <= 2; slice++) {
			float[] original = (float[]) imp.getStack().getProcessor(slice).getPixels();
			float[] denoised = (float[]) result[0].getStack().getProcessor(slice).getPixels();
			float[] noise = (float[]) result[1].getStack().getProcessor(slice).getPixels();
			for (int i = 0; i < original.length; i++) {
				Assertions.assertEquals(original[i], denoised[i] + noise[i], 1e-3);
			}
		}
	}

	@Test
	void integerImagesAreConverted() {
		ShortProcessor sp = new ShortProcessor(32, 32);
		for (int i = 0; i < 32 * 32; i++) {
			sp.set(i, 1000 + (i % 7));
		}
		ImagePlus[] result = new ImagePlusDenoiser(haarParameters()).denoise(new ImagePlus("raw.tif", sp));
		Assertions.assertEquals(32, result[ImagePlusDenoiser.DENOISED].getBitDepth());
		Assertions.assertEquals(1, result[ImagePlusDenoiser.NOISE].getStackSize());
	}

	@Test
	void tooManyLevelsForImageSize() {
		WaveletDenoiseParameters deep = haarParameters();
		deep.levels = 7;
		ImagePlusDenoiser denoiser = new ImagePlusDenoiser(deep, 1);
		Assertions.assertThrows(InvalidConfigurationException.class,
				() -> denoiser.denoise(new ImagePlus("small", new FloatProcessor(64, 64))));
	}

	@Test
	void nonFiniteSamplesAreReplacedByMedian() {
		double[][] data = {{1, Double.NaN, 3}, {Double.POSITIVE_INFINITY, 10, 2}};
		Assertions.assertEquals(2, ImagePlusDenoiser.replaceNonFinite(data));
		Assertions.assertEquals(2.5, data[0][1], 0.0);
		Assertions.assertEquals(2.5, data[1][0], 0.0);
		Assertions.assertEquals(10.0, data[1][1], 0.0);

		double[][] none = {{Double.NaN, Double.NaN}};
		Assertions.assertEquals(2, ImagePlusDenoiser.replaceNonFinite(none));
		Assertions.assertEquals(0.0, none[0][0], 0.0);
		Assertions.assertEquals(0, ImagePlusDenoiser.replaceNonFinite(new double[][] {{1, 2}}));
	}

	@Test
	void processorConversionKeepsLayout() {
		double[][] data = {{1, 2, 3}, {4, 5, 6}};
		FloatProcessor fp = ImagePlusDenoiser.toProcessor(data);
		Assertions.assertEquals(3, fp.getWidth());
		Assertions.assertEquals(2, fp.getHeight());
		Assertions.assertEquals(6.0f, fp.getf(2, 1), 0.0f);
		double[][] back = ImagePlusDenoiser.toArray(fp);
		Assertions.assertArrayEquals(data[0], back[0], 0.0);
		Assertions.assertArrayEquals(data[1], back[1], 0.0);
	}

	@Test
	void savedTiffKeepsInfo() throws IOException {
		ImagePlus imp = new ImagePlus("single", noisySlice(20, 10, 3));
		imp.setProperty(ImagePlusDenoiser.INFO_PROPERTY, HEADER);
		String path = dir.resolve("single.tif").toString();
		ImagePlusDenoiser.saveTiff(imp, path);

		ImagePlus read = ImagePlusDenoiser.openImage(path);
		Assertions.assertEquals(20, read.getWidth());
		Assertions.assertEquals(10, read.getHeight());
		Assertions.assertEquals(32, read.getBitDepth());
		Assertions.assertEquals(HEADER, read.getInfoProperty());
		Assertions.assertEquals(imp.getProcessor().getf(5, 5), read.getProcessor().getf(5, 5), 0.0f);
	}

	@Test
	void fitsNamesAreSavedAsFits() throws IOException {
		Assertions.assertTrue(ImagePlusDenoiser.isFits("m31.FITS"));
		Assertions.assertTrue(ImagePlusDenoiser.isFits("dark.fit"));
		Assertions.assertFalse(ImagePlusDenoiser.isFits("m31.tif"));
		Assertions.assertFalse(ImagePlusDenoiser.isFits("fits/m31"));

		ImagePlus imp = new ImagePlus("single", noisySlice(20, 10, 4));
		String path = dir.resolve("single.fits").toString();
		ImagePlusDenoiser.saveImage(imp, path);
		ImagePlus read = ImagePlusDenoiser.openImage(path);
		Assertions.assertEquals(20, read.getWidth());
		Assertions.assertEquals(10, read.getHeight());
		Assertions.assertEquals(32, read.getBitDepth());
	}

	@Test
	void missingFileFails() {
		Assertions.assertThrows(IOException.class,
				() -> ImagePlusDenoiser.openImage(dir.resolve("absent.tif").toString()));
	}

	@Test
	void statisticsArePopulationBased() {
		ArrayStatistics stats = ArrayStatistics.of(new double[][] {{0, 2}, {4, 0}});
		Assertions.assertEquals(1.5, stats.getMean(), 1e-12);
		Assertions.assertEquals(Math.sqrt(2.75), stats.getStd(), 1e-12);
		Assertions.assertEquals(4.0, stats.getMax(), 0.0);
		Assertions.assertEquals(2, stats.getNonZero());
		Assertions.assertEquals(4, stats.getCount());
	}

	@Test
	void extensionIsStripped() {
		Assertions.assertEquals("m31", ImagePlusDenoiser.stripExtension("m31.fit"));
		Assertions.assertEquals("a.b", ImagePlusDenoiser.stripExtension("a.b.tif"));
		Assertions.assertEquals(".hidden", ImagePlusDenoiser.stripExtension(".hidden"));
		Assertions.assertEquals("image", ImagePlusDenoiser.stripExtension(null));
	}
}
