package com.elphel.denoise.cli;

import com.elphel.denoise.io.ImagePlusDenoiser;
import ij.IJ;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.FloatProcessor;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class WaveletDenoiseCommandTest {

	@TempDir
	Path dir;

	private String input;

	@BeforeEach
	void writeInput() {
		Random random = new Random(11);
		FloatProcessor fp = new FloatProcessor(64, 64);
		for (int i = 0; i < 64 * 64; i++) {
			fp.setf(i, (float) (500.0 + 10.0 * random.nextGaussian()));
		}
		input = dir.resolve("m42.tif").toString();
		Assertions.assertTrue(new FileSaver(new ImagePlus("m42", fp)).saveAsTiff(input));
	}

	private static int run(String... args) {
		return new CommandLine(new WaveletDenoiseCommand()).execute(args);
	}

	private Path writeConfig(String... lines) throws IOException {
		Path config = dir.resolve("denoise.properties");
		Files.write(config, Arrays.asList(lines), StandardCharsets.ISO_8859_1);
		return config;
	}

	@Test
	void writesDefaultOutputs() {
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_OK, run(input, "-w", "haar", "-l", "3"));
		Assertions.assertTrue(Files.isRegularFile(dir.resolve("m42_denoised.tif")));
		Assertions.assertTrue(Files.isRegularFile(dir.resolve("m42_noise.tif")));
	}

	@Test
	void writesExplicitOutputs() {
		String denoised = dir.resolve("clean.tif").toString();
		String noise = dir.resolve("residual.tif").toString();
		int code = run(input, "-o", denoised, "-n", noise, "-w", "db2", "-l", "2",
				"-m", "hard", "--method", "bayes", "-s", "10", "-t", "1.0", "--threads", "1");
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_OK, code);
		Assertions.assertTrue(new File(denoised).isFile());
		Assertions.assertTrue(new File(noise).isFile());
		Assertions.assertFalse(Files.exists(dir.resolve("m42_denoised.tif")));
	}

	@Test
	void defaultSettingsRunOnSmallImage() {
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_OK, run(input));
		Assertions.assertTrue(Files.isRegularFile(dir.resolve("m42_noise.tif")));
	}

	private static double pixelSum(String path) throws IOException {
		ImagePlus imp = ImagePlusDenoiser.openImage(path);
		Assertions.assertEquals(64, imp.getWidth());
		Assertions.assertEquals(64, imp.getHeight());
		Assertions.assertEquals(32, imp.getBitDepth());
		float[] pixels = (float[]) imp.getProcessor().convertToFloatProcessor().getPixels();
		double sum = 0;
		for (float p : pixels) {
			sum += p;
		}
		return sum;
	}

	@Test
	void fitsOutputNamesWriteFits() throws IOException {
		String denoised = dir.resolve("clean.fits").toString();
		String noise = dir.resolve("residual.fit").toString();
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_OK,
				run(input, "-o", denoised, "-n", noise, "-w", "haar", "-l", "3"));
		byte[] head = Arrays.copyOf(Files.readAllBytes(Paths.get(denoised)), 6);
		Assertions.assertEquals("SIMPLE", new String(head, StandardCharsets.US_ASCII));
		Assertions.assertEquals(pixelSum(input), pixelSum(denoised) + pixelSum(noise), 10.0);
	}

	@Test
	void fitsInputDefaultsToFitsOutput() throws IOException {
		String fits = dir.resolve("m31.fits").toString();
		Assertions.assertTrue(new FileSaver(IJ.openImage(input)).saveAsFits(fits));
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_OK, run(fits, "-w", "db2", "-l", "2"));
		Assertions.assertTrue(Files.isRegularFile(dir.resolve("m31_denoised.fits")));
		Assertions.assertTrue(Files.isRegularFile(dir.resolve("m31_noise.fits")));
		Assertions.assertFalse(Files.exists(dir.resolve("m31_denoised.tif")));
	}

	@Test
	void invalidSettingsFail() {
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_ERROR, run(input, "-w", "bior6.8"));
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_ERROR, run(input, "-m", "medium"));
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_ERROR, run(input, "-t", "0"));
		// bior4.4 reaches at most 6 levels on 64x64
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_ERROR, run(input, "-l", "7"));
		Assertions.assertFalse(Files.exists(dir.resolve("m42_denoised.tif")));
	}

	@Test
	void missingInputFails() {
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_ERROR,
				run(dir.resolve("absent.fits").toString(), "-w", "haar", "-l", "1"));
	}

	@Test
	void usageErrors() {
		Assertions.assertEquals(2, run());
		Assertions.assertEquals(2, run(input, "-l", "three"));
	}

	@Test
	void optionsOverrideConfig() throws IOException {
		Path config = writeConfig("basis=haar", "levels=9", "mode=hard", "threads=2");
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_ERROR, run(input, "--config", config.toString()));
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_OK,
				run(input, "--config", config.toString(), "-l", "4"));
	}

	@Test
	void presetOverridesConfig() throws IOException {
		Path config = writeConfig("basis=haar", "levels=2");
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_OK, run(input, "--config", config.toString()));
		// ultra_sharp asks for 12 levels
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_ERROR,
				run(input, "--config", config.toString(), "--preset", "ultra_sharp"));
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_OK,
				run(input, "--preset", "ultra_sharp", "-l", "2"));
	}

	@Test
	void badConfigValueFails() throws IOException {
		Path config = writeConfig("threads=several");
		Assertions.assertEquals(WaveletDenoiseCommand.EXIT_ERROR,
				run(input, "--config", config.toString(), "-w", "haar", "-l", "1"));
	}

	@Test
	void extensionIsStrippedFromFileNameOnly() {
		Assertions.assertEquals("data/m42", WaveletDenoiseCommand.stripExtension("data/m42.fits"));
		Assertions.assertEquals("data.d/m42", WaveletDenoiseCommand.stripExtension("data.d/m42"));
		Assertions.assertEquals("data/.hidden", WaveletDenoiseCommand.stripExtension("data/.hidden"));
	}
}
