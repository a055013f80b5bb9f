/**
 ** -----------------------------------------------------------------------------**
 ** WaveletBasis.java
 **
 ** Filter banks of the supported wavelet families
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WaveletBasis.java is free software: you can redistribute it and/or modify
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

/**
 * Wavelet families available to the transform. Each basis is defined by its
 * reconstruction low-pass filter (orthogonal families) or by the pair of
 * decomposition/reconstruction low-pass filters (biorthogonal families), both
 * of the same even length. High-pass filters are the quadrature mirrors:
 * <pre>
 *   rec_hi[k] = (-1)^k     * dec_lo[k]
 *   dec_hi[k] = (-1)^(k+1) * rec_lo[k]
 * </pre>
 * Coefficients are normalized to sum to sqrt(2), same as in the common
 * Matlab/PyWavelets tables, so subband magnitudes are comparable with them.
 */
public enum WaveletBasis {
	HAAR   ("haar", orthogonal(
			0.7071067811865476,   0.7071067811865476)),
	DB2    ("db2",  orthogonal(
			0.48296291314469025,  0.836516303737469,    0.22414386804185735, -0.12940952255092145)),
	DB4    ("db4",  orthogonal(
			0.23037781330885523,  0.7148465705525415,   0.6308807679295904,  -0.02798376941698385,
			-0.18703481171888114, 0.030841381835986965, 0.032883011666982945,-0.010597401784997278)),
	SYM4   ("sym4", orthogonal(
			0.03222310060407815, -0.012603967262261206,-0.09921954357695636,  0.29785779560560505,
			0.8037387518052163,   0.49761866763256545, -0.02963552764595273, -0.07576571478935668)),
	COIF1  ("coif1", orthogonal(
			-0.01565572813546454,-0.0727326195128539,   0.38486484686420286,  0.8525720202122554,
			0.3378976624578092,  -0.0727326195128539)),
	BIOR2_2("bior2.2", new double[][] {
		{ 0.0,                -0.1767766952966369,  0.3535533905932738,   1.0606601717798214,
		  0.3535533905932738, -0.1767766952966369},
		{ 0.0,                 0.3535533905932738,  0.7071067811865476,   0.3535533905932738,
		  0.0,                 0.0}}),
	/** CDF 9/7 */
	BIOR4_4("bior4.4", new double[][] {
		{ 0.0,                 0.03782845550726404,-0.023849465019556843,-0.11062440441843718,
		  0.37740285561283066, 0.8526986790088938,  0.37740285561283066, -0.11062440441843718,
		 -0.023849465019556843,0.03782845550726404},
		{ 0.0,                -0.06453888262869706,-0.04068941760916406,  0.41809227322161724,
		  0.7884856164055829,  0.41809227322161724,-0.04068941760916406, -0.06453888262869706,
		  0.0,                 0.0}});

	public static final WaveletBasis DEFAULT = BIOR4_4;

	private final String label;
	private final double [] dec_lo;
	private final double [] dec_hi;
	private final double [] rec_lo;
	private final double [] rec_hi;

	WaveletBasis(String label, double [][] lo_pair) { // {dec_lo, rec_lo}
		this.label = label;
		this.dec_lo = lo_pair[0];
		this.rec_lo = lo_pair[1];
		int len = dec_lo.length;
		this.dec_hi = new double [len];
		this.rec_hi = new double [len];
		for (int k = 0; k < len; k++) {
			rec_hi[k] = ((k & 1) == 0) ?  dec_lo[k] : -dec_lo[k];
			dec_hi[k] = ((k & 1) == 0) ? -rec_lo[k] :  rec_lo[k];
		}
	}

	private static double [][] orthogonal(double... rec_lo) {
		double [] dec_lo = new double [rec_lo.length];
		for (int k = 0; k < rec_lo.length; k++) {
			dec_lo[k] = rec_lo[rec_lo.length - 1 - k];
		}
		return new double [][] {dec_lo, rec_lo};
	}

	public String getName() {
		return label;
	}

	/** Length F of every filter of this basis (always even). */
	public int getFilterLength() {
		return dec_lo.length;
	}

	public double [] getDecompositionLowPass()    { return dec_lo.clone(); }
	public double [] getDecompositionHighPass()   { return dec_hi.clone(); }
	public double [] getReconstructionLowPass()   { return rec_lo.clone(); }
	public double [] getReconstructionHighPass()  { return rec_hi.clone(); }

	// shared arrays for the transform itself, never modified there
	double [] decLo() { return dec_lo; }
	double [] decHi() { return dec_hi; }
	double [] recLo() { return rec_lo; }
	double [] recHi() { return rec_hi; }

	/**
	 * Deepest decomposition level usable for a signal of the given length. A level is
	 * applied only to an input of at least F samples: from F - 1 or fewer samples the
	 * analysis produces (n + F - 1) / 2 >= n coefficients, so the signal would no longer
	 * shrink. Subbands shorter than the filter are fine, symmetric extension covers them.
	 * @param length signal length (minimal image dimension for 2-d)
	 * @return maximal number of levels, 0 when the signal is shorter than the filter
	 */
	public int getMaxLevel(int length) {
		int filter_length = getFilterLength();
		int level = 0;
		for (int n = length; n >= filter_length; n = WaveletTransform2D.outputLength(n, this)) {
			level++;
		}
		return level;
	}

	public static String [] getNames() {
		WaveletBasis [] bases = values();
		String [] names = new String[bases.length];
		for (int i = 0; i < bases.length; i++) names[i] = bases[i].label;
		return names;
	}

	public static WaveletBasis fromName(String name) {
		if (name != null) {
			String lc = name.trim().toLowerCase(Locale.ROOT);
			for (WaveletBasis basis : values()) {
				if (basis.label.equals(lc)) return basis;
			}
		}
		StringBuilder sb = new StringBuilder();
		for (String s : getNames()) {
			if (sb.length() > 0) sb.append(", ");
			sb.append(s);
		}
		throw new InvalidConfigurationException("Unknown wavelet basis \""+name+"\", supported: "+sb);
	}

	@Override
	public String toString() {
		return label;
	}
}
