/*
 * MIT License
 *
 * Copyright (c) 2022 Justin Kunimune
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package cube;

import java.util.Arrays;

/**
 * a binned energy axis, described by its bin edges.
 */
public class EnergyAxis {
	private final double[] edges; // (TeV)

	/**
	 * @param edges the bin edges in TeV, strictly increasing and positive
	 */
	public EnergyAxis(double... edges) {
		if (edges.length < 2)
			throw new IllegalArgumentException("an energy axis needs at least one bin (two edges)");
		for (int i = 0; i < edges.length; i ++) {
			if (!(edges[i] > 0) || !Double.isFinite(edges[i]))
				throw new IllegalArgumentException("energy edges must be finite and positive, not "+edges[i]);
			if (i > 0 && edges[i] <= edges[i - 1])
				throw new IllegalArgumentException("energy edges must increase monotonically");
		}
		this.edges = edges.clone();
	}

	/**
	 * bins that are equally spaced in log energy
	 * @param min the lowest edge (TeV)
	 * @param max the highest edge (TeV)
	 * @param numBins the number of bins
	 */
	public static EnergyAxis logspace(double min, double max, int numBins) {
		double[] edges = new double[numBins + 1];
		for (int i = 0; i <= numBins; i ++)
			edges[i] = Math.exp(Math.log(min) + (Math.log(max) - Math.log(min))*i/numBins);
		edges[0] = min;
		edges[numBins] = max;
		return new EnergyAxis(edges);
	}

	public int getNumBins() {
		return edges.length - 1;
	}

	public double getEdge(int i) {
		return edges[i];
	}

	public double[] getEdges() {
		return edges.clone();
	}

	/**
	 * @return the log-centre of bin i (TeV)
	 */
	public double getCenter(int i) {
		return Math.sqrt(edges[i]*edges[i + 1]);
	}

	/**
	 * @return the width of bin i (TeV)
	 */
	public double getWidth(int i) {
		return edges[i + 1] - edges[i];
	}

	/**
	 * whether two axes have the same bins, to within a relative tolerance of 1e-6
	 */
	public boolean conformsTo(EnergyAxis that) {
		if (this.edges.length != that.edges.length)
			return false;
		for (int i = 0; i < edges.length; i ++)
			if (Math.abs(this.edges[i] - that.edges[i]) > 1e-6*this.edges[i])
				return false;
		return true;
	}

	@Override
	public String toString() {
		return "EnergyAxis"+Arrays.toString(edges)+" TeV";
	}
}
