/**
 ** -----------------------------------------------------------------------------**
 ** ArrayStatistics.java
 **
 ** Summary statistics of 2-d sample arrays
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ArrayStatistics.java is free software: you can redistribute it and/or modify
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

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

public class ArrayStatistics {
	private final double mean;
	private final double std;   // population standard deviation
	private final double min;
	private final double max;
	private final long   non_zero;
	private final long   count;

	private ArrayStatistics(SummaryStatistics stats, long non_zero) {
		this.count =    stats.getN();
		this.mean =     stats.getMean();
		this.std =      Math.sqrt(stats.getPopulationVariance());
		this.min =      stats.getMin();
		this.max =      stats.getMax();
		this.non_zero = non_zero;
	}

	public static ArrayStatistics of(double [][] data) {
		SummaryStatistics stats = new SummaryStatistics();
		long non_zero = 0;
		for (double [] row : data) {
			for (double d : row) {
				stats.addValue(d);
				if (d != 0.0) non_zero++;
			}
		}
		return new ArrayStatistics(stats, non_zero);
	}

	public double getMean()    { return mean; }
	public double getStd()     { return std; }
	public double getMin()     { return min; }
	public double getMax()     { return max; }
	public long   getNonZero() { return non_zero; }
	public long   getCount()   { return count; }

	@Override
	public String toString() {
		return String.format("mean=%.4f, std=%.4f, range=[%.2f, %.2f], non-zero %d of %d",
				mean, std, min, max, non_zero, count);
	}
}
