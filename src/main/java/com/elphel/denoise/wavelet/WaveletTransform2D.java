/**
 ** -----------------------------------------------------------------------------**
 ** WaveletTransform2D.java
 **
 ** Separable multi-level 2-d discrete wavelet transform and its inverse
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WaveletTransform2D.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-level separable 2-d DWT with half-sample symmetric boundary extension
 * ( x[-1] = x[0], x[-2] = x[1], ..., x[N] = x[N-1], repeated with period 2*N
 * for signals shorter than the filter).
 *
 * One 1-d analysis step of a signal of length N with filters of length F produces
 * floor((N + F - 1) / 2) coefficients:
 * <pre>
 *   c[o] = sum(j = 0..F-1) h[j] * x[2*o + 1 - j]
 * </pre>
 * Synthesis from M coefficients produces 2*M - F + 2 samples, that is N for even N
 * and N + 1 for odd N. Extra samples are always at the end (bottom/right), so
 * the inverse crops the approximation to the shape of the detail subbands of the
 * same level, and the final image to the original shape, keeping the top-left corner.
 *
 * Both 2-d passes filter along columns first (across rows), then along rows.
 */
public class WaveletTransform2D {

	private WaveletTransform2D() {
	}

	/**
	 * Check that the image can be decomposed into the requested number of levels
	 * @param rows image height
	 * @param cols image width
	 * @param basis wavelet basis
	 * @param levels requested number of levels
	 * @throws InvalidConfigurationException when levels < 1 or some level would get an input shorter than the filter
	 */
	public static void checkLevels(int rows, int cols, WaveletBasis basis, int levels) {
		if (levels < 1) {
			throw new InvalidConfigurationException("Number of decomposition levels should be positive, got "+levels);
		}
		int max_level = basis.getMaxLevel(Math.min(rows, cols));
		if (levels > max_level) {
			throw new InvalidConfigurationException("Image "+rows+"x"+cols+" allows at most "+max_level+
					" decomposition level(s) with "+basis+" (filter length "+basis.getFilterLength()+
					"), requested "+levels);
		}
	}

	/**
	 * Forward multi-level transform
	 * @param image [row][column] samples, rectangular
	 * @param basis wavelet basis
	 * @param levels number of detail levels, 1 .. basis.getMaxLevel(min(rows, cols))
	 * @return coefficient tree, levels ordered from the coarsest to the finest
	 */
	public static CoefficientTree decompose(
			double [][] image,
			WaveletBasis basis,
			int levels) {
		int rows = image.length;
		int cols = image[0].length;
		checkLevels(rows, cols, basis, levels);
		// finest level is produced first
		Subband [][] details = new Subband[levels][];
		double [][] approx = image;
		for (int step = 0; step < levels; step++) {
			int level = levels - step;
			double [][][] bands = dwt2(approx, basis);
			approx = bands[0];
			details[level - 1] = new Subband[] {
					new Subband(level, Orientation.HORIZONTAL, bands[1]),
					new Subband(level, Orientation.VERTICAL,   bands[2]),
					new Subband(level, Orientation.DIAGONAL,   bands[3])};
		}
		List<Subband> subbands = new ArrayList<Subband>(1 + 3 * levels);
		subbands.add(new Subband(0, Orientation.APPROX, approx));
		for (int level = 1; level <= levels; level++) {
			for (Subband sb : details[level - 1]) {
				subbands.add(sb);
			}
		}
		return new CoefficientTree(basis, rows, cols, subbands);
	}

	/**
	 * Inverse multi-level transform, result cropped to the shape of the decomposed image
	 * @param tree coefficient tree (possibly with shrunk details)
	 * @return reconstructed image [row][column]
	 * @throws ShapeMismatchException if the reconstruction is smaller than the original image
	 */
	public static double [][] reconstruct(CoefficientTree tree) {
		WaveletBasis basis = tree.getBasis();
		double [][] approx = tree.getApproximation().getData();
		for (int level = 1; level <= tree.getLevels(); level++) {
			Subband [] details = tree.getDetails(level);
			int rows = details[0].getRows();
			int cols = details[0].getCols();
			if ((approx.length < rows) || (approx[0].length < cols)) {
				throw new ShapeMismatchException(rows, cols, approx.length, approx[0].length);
			}
			approx = idwt2(
					crop(approx, rows, cols),
					details[0].getData(),
					details[1].getData(),
					details[2].getData(),
					basis);
		}
		if ((approx.length < tree.getRows()) || (approx[0].length < tree.getCols())) {
			throw new ShapeMismatchException(tree.getRows(), tree.getCols(), approx.length, approx[0].length);
		}
		return crop(approx, tree.getRows(), tree.getCols());
	}

	/**
	 * Top-left crop, returns the same array when the shape already matches
	 */
	static double [][] crop(double [][] data, int rows, int cols) {
		if ((data.length == rows) && (data[0].length == cols)) {
			return data;
		}
		double [][] cropped = new double [rows][cols];
		for (int row = 0; row < rows; row++) {
			System.arraycopy(data[row], 0, cropped[row], 0, cols);
		}
		return cropped;
	}

	/**
	 * Single level 2-d analysis
	 * @return {approximation, horizontal, vertical, diagonal}
	 */
	static double [][][] dwt2(double [][] data, WaveletBasis basis) {
		int rows = data.length;
		int cols = data[0].length;
		int out_rows = outputLength(rows, basis);
		int out_cols = outputLength(cols, basis);
		// along columns
		double [][] lo = new double [out_rows][cols];
		double [][] hi = new double [out_rows][cols];
		double [] column = new double [rows];
		double [] clo =    new double [out_rows];
		double [] chi =    new double [out_rows];
		for (int col = 0; col < cols; col++) {
			for (int row = 0; row < rows; row++) column[row] = data[row][col];
			analyze(column, basis.decLo(), clo);
			analyze(column, basis.decHi(), chi);
			for (int row = 0; row < out_rows; row++) {
				lo[row][col] = clo[row];
				hi[row][col] = chi[row];
			}
		}
		// along rows
		double [][] aa = new double [out_rows][out_cols];
		double [][] ad = new double [out_rows][out_cols]; // vertical
		double [][] da = new double [out_rows][out_cols]; // horizontal
		double [][] dd = new double [out_rows][out_cols];
		for (int row = 0; row < out_rows; row++) {
			analyze(lo[row], basis.decLo(), aa[row]);
			analyze(lo[row], basis.decHi(), ad[row]);
			analyze(hi[row], basis.decLo(), da[row]);
			analyze(hi[row], basis.decHi(), dd[row]);
		}
		return new double [][][] {aa, da, ad, dd};
	}

	/**
	 * Single level 2-d synthesis, all four inputs of the same shape
	 */
	static double [][] idwt2(
			double [][] approx,
			double [][] horizontal,
			double [][] vertical,
			double [][] diagonal,
			WaveletBasis basis) {
		int in_rows = approx.length;
		int in_cols = approx[0].length;
		int out_rows = synthesisLength(in_rows, basis);
		int out_cols = synthesisLength(in_cols, basis);
		if ((out_rows < 1) || (out_cols < 1)) {
			throw new ShapeMismatchException(1, 1, out_rows, out_cols);
		}
		// along rows
		double [][] lo = new double [in_rows][out_cols];
		double [][] hi = new double [in_rows][out_cols];
		for (int row = 0; row < in_rows; row++) {
			synthesize(approx[row],     vertical[row], basis, lo[row]);
			synthesize(horizontal[row], diagonal[row], basis, hi[row]);
		}
		// along columns
		double [][] result = new double [out_rows][out_cols];
		double [] clo =    new double [in_rows];
		double [] chi =    new double [in_rows];
		double [] column = new double [out_rows];
		for (int col = 0; col < out_cols; col++) {
			for (int row = 0; row < in_rows; row++) {
				clo[row] = lo[row][col];
				chi[row] = hi[row][col];
			}
			synthesize(clo, chi, basis, column);
			for (int row = 0; row < out_rows; row++) result[row][col] = column[row];
		}
		return result;
	}

	/** Number of coefficients produced from a signal of the given length */
	static int outputLength(int length, WaveletBasis basis) {
		return (length + basis.getFilterLength() - 1) / 2;
	}

	/** Number of samples restored from the given number of coefficients */
	static int synthesisLength(int coefficients, WaveletBasis basis) {
		return 2 * coefficients - basis.getFilterLength() + 2;
	}

	/**
	 * Filter and downsample by 2 with symmetric extension
	 * @param x input signal
	 * @param filter decomposition filter
	 * @param out output, (x.length + filter.length - 1) / 2 long
	 */
	static void analyze(double [] x, double [] filter, double [] out) {
		int n = x.length;
		int f = filter.length;
		for (int o = 0; o < out.length; o++) {
			int i = 2 * o + 1;
			double sum = 0.0;
			if ((i >= f - 1) && (i < n)) { // no boundary extension needed
				for (int j = 0; j < f; j++) {
					sum += filter[j] * x[i - j];
				}
			} else {
				for (int j = 0; j < f; j++) {
					sum += filter[j] * x[reflect(i - j, n)];
				}
			}
			out[o] = sum;
		}
	}

	/**
	 * Upsample by 2 and filter both coefficient sets, keeping the part that is
	 * free of boundary effects
	 * @param ca approximation coefficients
	 * @param cd detail coefficients, same length as ca
	 * @param basis wavelet basis
	 * @param out output, 2 * ca.length - F + 2 long
	 */
	static void synthesize(double [] ca, double [] cd, WaveletBasis basis, double [] out) {
		double [] g_lo = basis.recLo();
		double [] g_hi = basis.recHi();
		int f = g_lo.length;
		int m = ca.length;
		for (int n = 0; n < out.length; n++) {
			int t = n + f - 2;
			// k such that 0 <= t - 2 * k < f
			int k_min = Math.max(0, (t - f + 2) / 2);
			int k_max = Math.min(m - 1, t / 2);
			double sum = 0.0;
			for (int k = k_min; k <= k_max; k++) {
				int j = t - 2 * k;
				sum += ca[k] * g_lo[j] + cd[k] * g_hi[j];
			}
			out[n] = sum;
		}
	}

	/**
	 * Map an index of the extended signal into 0..length-1, half-sample symmetric
	 */
	static int reflect(int index, int length) {
		int period = 2 * length;
		int i = index % period;
		if (i < 0) i += period;
		return (i < length) ? i : (period - 1 - i);
	}
}
