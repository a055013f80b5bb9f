package com.elphel.denoise.wavelet;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class WaveletBasisTest {

	private static final double SQRT2 = Math.sqrt(2.0);

	@ParameterizedTest
	@EnumSource(WaveletBasis.class)
	void lowPassFiltersSumToSqrt2AndHighPassToZero(WaveletBasis basis) {
		Assertions.assertEquals(SQRT2, sum(basis.getDecompositionLowPass()), 1e-8);
		Assertions.assertEquals(SQRT2, sum(basis.getReconstructionLowPass()), 1e-8);
		Assertions.assertEquals(0.0, sum(basis.getDecompositionHighPass()), 1e-8);
		Assertions.assertEquals(0.0, sum(basis.getReconstructionHighPass()), 1e-8);
	}

	@ParameterizedTest
	@EnumSource(WaveletBasis.class)
	void filtersHaveSameEvenLength(WaveletBasis basis) {
		int length = basis.getFilterLength();
		Assertions.assertEquals(0, length % 2);
		Assertions.assertEquals(length, basis.getDecompositionHighPass().length);
		Assertions.assertEquals(length, basis.getReconstructionLowPass().length);
		Assertions.assertEquals(length, basis.getReconstructionHighPass().length);
	}

	@ParameterizedTest
	@EnumSource(value = WaveletBasis.class, names = {"HAAR", "DB2", "DB4", "SYM4", "COIF1"})
	void orthogonalFiltersHaveUnitNormAndAreOrthogonalToShifts(WaveletBasis basis) {
		double[] h = basis.getReconstructionLowPass();
		for (int shift = 0; shift < h.length; shift += 2) {
			double dot = 0;
			for (int k = 0; k + shift < h.length; k++) {
				dot += h[k] * h[k + shift];
			}
			Assertions.assertEquals(shift == 0 ? 1.0 : 0.0, dot, 1e-9, "shift " + shift);
		}
	}

	@Test
	void maxLevelStopsWhenInputIsShorterThanFilter() {
		Assertions.assertEquals(6, WaveletBasis.HAAR.getMaxLevel(64));
		Assertions.assertEquals(6, WaveletBasis.DB2.getMaxLevel(64));
		Assertions.assertEquals(6, WaveletBasis.BIOR4_4.getMaxLevel(64));
		Assertions.assertEquals(9, WaveletBasis.BIOR4_4.getMaxLevel(512));
		Assertions.assertEquals(10, WaveletBasis.BIOR4_4.getMaxLevel(1024));
		Assertions.assertEquals(3, WaveletBasis.DB4.getMaxLevel(13));
		// a level needs at least as many samples as filter taps
		Assertions.assertEquals(1, WaveletBasis.DB4.getMaxLevel(8));
		Assertions.assertEquals(0, WaveletBasis.DB4.getMaxLevel(7));
		Assertions.assertEquals(0, WaveletBasis.BIOR4_4.getMaxLevel(9));
		Assertions.assertEquals(0, WaveletBasis.HAAR.getMaxLevel(1));
	}

	@Test
	void namesResolveCaseInsensitively() {
		Assertions.assertEquals(WaveletBasis.BIOR4_4, WaveletBasis.fromName("bior4.4"));
		Assertions.assertEquals(WaveletBasis.HAAR, WaveletBasis.fromName(" HAAR "));
		Assertions.assertEquals(WaveletBasis.COIF1, WaveletBasis.fromName("coif1"));
		Assertions.assertEquals(WaveletBasis.BIOR4_4, WaveletBasis.DEFAULT);
	}

	@Test
	void unknownNameIsInvalidConfiguration() {
		InvalidConfigurationException e = Assertions.assertThrows(InvalidConfigurationException.class,
				() -> WaveletBasis.fromName("bior6.8"));
		Assertions.assertTrue(e.getMessage().contains("bior6.8"));
		Assertions.assertThrows(InvalidConfigurationException.class, () -> WaveletBasis.fromName(null));
	}

	private static double sum(double[] values) {
		double sum = 0;
		for (double v : values) {
			sum += v;
		}
		return sum;
	}
}
