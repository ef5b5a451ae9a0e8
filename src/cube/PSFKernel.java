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
import java.util.Locale;

/**
 * a point-spread function reduced to one square convolution kernel per true-energy bin, sampled on the pixel grid
 * of the map it will be applied to.
 */
public class PSFKernel {

	/** the number of subpixels along each axis used to integrate analytic profiles over a pixel */
	public static final int OVERSAMPLING = 5;

	private final double binsz; // (deg)
	private final EnergyAxis energy;
	private final double[][][] kernels; // [energy][row][collum]

	/**
	 * @param binsz the pixel size the kernels were sampled at (deg)
	 * @param energy the true-energy axis; there must be one kernel per bin
	 * @param kernels the kernels, each square with an odd side length so that it has a central pixel.  they
	 *                should each sum to 1 if they're to conserve counts.  the array is copied.
	 */
	public PSFKernel(double binsz, EnergyAxis energy, double[][][] kernels) {
		if (kernels.length != energy.getNumBins())
			throw new ShapeMismatchException(String.format(
				  "there are %d kernels for %d energy bins", kernels.length, energy.getNumBins()));
		this.kernels = new double[kernels.length][][];
		for (int e = 0; e < kernels.length; e ++) {
			int size = kernels[e].length;
			if (size%2 == 0)
				throw new ShapeMismatchException("equal convolution only works with odd kernels, not "+size);
			this.kernels[e] = new double[size][];
			for (int k = 0; k < size; k ++) {
				if (kernels[e][k].length != size)
					throw new ShapeMismatchException("PSF kernels must be square");
				for (double value: kernels[e][k])
					if (!(value >= 0) || !Double.isFinite(value))
						throw new IllegalArgumentException("PSF kernels must be finite and nonnegative");
				this.kernels[e][k] = kernels[e][k].clone();
			}
		}
		this.binsz = binsz;
		this.energy = energy;
	}

	/**
	 * a kernel that doesn't blur anything
	 */
	public static PSFKernel delta(MapGeometry geometry) {
		double[][][] kernels = new double[geometry.getEnergy().getNumBins()][][];
		for (int e = 0; e < kernels.length; e ++)
			kernels[e] = new double[][] {{1}};
		return new PSFKernel(geometry.getBinsz(), geometry.getEnergy(), kernels);
	}

	/**
	 * a normalized 2D Gaussian PSF with the same width at every energy
	 */
	public static PSFKernel gaussian(MapGeometry geometry, double sigma, double maxRadius) {
		double[] sigmas = new double[geometry.getEnergy().getNumBins()];
		Arrays.fill(sigmas, sigma);
		return gaussian(geometry, sigmas, maxRadius);
	}

	/**
	 * a normalized 2D Gaussian PSF whose width can change with energy.  each pixel gets the profile averaged over
	 * an {@link #OVERSAMPLING}² grid of subpixels, anything beyond maxRadius is cut off, and then every kernel is
	 * renormalized to 1.
	 * @param geometry the map the kernel will be applied to (true energy)
	 * @param sigma the standard deviation in each true-energy bin (deg)
	 * @param maxRadius the radius at which to truncate the kernel (deg)
	 */
	public static PSFKernel gaussian(MapGeometry geometry, double[] sigma, double maxRadius) {
		if (sigma.length != geometry.getEnergy().getNumBins())
			throw new ShapeMismatchException(String.format(
				  "there are %d widths for %d energy bins", sigma.length, geometry.getEnergy().getNumBins()));
		double binsz = geometry.getBinsz();
		int r = (int)Math.ceil(maxRadius/binsz);
		int size = 2*r + 1;
		double[][][] kernels = new double[sigma.length][size][size];
		for (int e = 0; e < sigma.length; e ++) {
			if (!(sigma[e] > 0))
				throw new IllegalArgumentException("the PSF width must be positive, not "+sigma[e]);
			double total = 0;
			for (int k = 0; k < size; k ++) {
				for (int l = 0; l < size; l ++) {
					double sum = 0;
					for (int a = 0; a < OVERSAMPLING; a ++) {
						for (int b = 0; b < OVERSAMPLING; b ++) {
							double y = (k - r + (a + 0.5)/OVERSAMPLING - 0.5)*binsz;
							double x = (l - r + (b + 0.5)/OVERSAMPLING - 0.5)*binsz;
							double ρ2 = x*x + y*y;
							if (ρ2 <= maxRadius*maxRadius)
								sum += Math.exp(-ρ2/(2*sigma[e]*sigma[e]));
						}
					}
					kernels[e][k][l] = sum;
					total += sum;
				}
			}
			for (int k = 0; k < size; k ++)
				for (int l = 0; l < size; l ++)
					kernels[e][k][l] /= total;
		}
		return new PSFKernel(binsz, geometry.getEnergy(), kernels);
	}

	/**
	 * do an equal 2D convolution of every energy slice of a cube with its kernel.  the output has the same grid as
	 * the input; whatever gets blurred past the edge of the map is lost.  the input is not modified.
	 * @throws ShapeMismatchException if the cube's pixels or energy bins don't match the kernel's
	 */
	public SkyCube apply(SkyCube source) {
		MapGeometry geometry = source.getGeometry();
		if (!this.conformsTo(geometry))
			throw new ShapeMismatchException("this PSF kernel doesn't fit "+geometry);
		SkyCube result = new SkyCube(geometry);
		for (int e = 0; e < kernels.length; e ++)
			convolve(source.getSlice(e), kernels[e], result.getSlice(e));
		return result;
	}

	/**
	 * scatter each source pixel thru the kernel into the result
	 */
	private static void convolve(double[][] source, double[][] kernel, double[][] result) {
		int n = source.length;
		int m = source[0].length;
		int r = kernel.length/2;
		for (int i = 0; i < n; i ++) {
			for (int j = 0; j < m; j ++) {
				double value = source[i][j];
				if (value != 0) {
					for (int k = Math.max(0, r - i); k < kernel.length && i + k - r < n; k ++) {
						double[] kernel_row = kernel[k];
						double[] result_row = result[i + k - r];
						for (int l = Math.max(0, r - j); l < kernel.length && j + l - r < m; l ++)
							result_row[j + l - r] += value*kernel_row[l];
					}
				}
			}
		}
	}

	/**
	 * whether this kernel can be applied to cubes on the given grid
	 */
	public boolean conformsTo(MapGeometry geometry) {
		return Math.abs(geometry.getBinsz() - binsz) <= 1e-9*binsz &&
		       geometry.getEnergy().conformsTo(energy);
	}

	public int getNumEnergyBins() {
		return kernels.length;
	}

	/**
	 * @return a copy of the kernel for true-energy bin e
	 */
	public double[][] getKernel(int e) {
		double[][] copy = new double[kernels[e].length][];
		for (int k = 0; k < copy.length; k ++)
			copy[k] = kernels[e][k].clone();
		return copy;
	}

	public EnergyAxis getEnergy() {
		return energy;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "PSFKernel(%d energies, %d×%d pixels of %.4f deg)",
		                     kernels.length, kernels[0].length, kernels[0].length, binsz);
	}
}
