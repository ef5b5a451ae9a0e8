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

/**
 * a file with some useful numerical analysis stuff.
 *
 * @author Justin Kunimune
 */
public class Math2 {

	public static double sum(double[] arr) {
		double s = 0;
		for (double x: arr)
			s += x;
		return s;
	}

	public static double sum(double[][] arr) {
		double s = 0;
		for (double[] row: arr)
			for (double x: row)
				s += x;
		return s;
	}

	public static double sum(double[][][] arr) {
		double s = 0;
		for (double[][] lvl: arr)
			for (double[] row: lvl)
				for (double x: row)
					s += x;
		return s;
	}

	public static double[][][] deepCopy(double[][][] arr) {
		double[][][] copy = new double[arr.length][][];
		for (int i = 0; i < arr.length; i ++) {
			copy[i] = new double[arr[i].length][];
			for (int j = 0; j < arr[i].length; j ++)
				copy[i][j] = arr[i][j].clone();
		}
		return copy;
	}

	/**
	 * coerce a number into an interval.  NaN bounds are treated as absent.
	 */
	public static double clamp(double x, double min, double max) {
		if (!Double.isNaN(min) && x < min)
			return min;
		if (!Double.isNaN(max) && x > max)
			return max;
		return x;
	}

	/**
	 * the great-circle distance between two points on the sky, using the haversine formula so that it stays
	 * accurate at the tiny separations within a single pixel.
	 * @param lon1 the longitude of the first point (degrees)
	 * @param lat1 the latitude of the first point (degrees)
	 * @param lon2 the longitude of the twoth point (degrees)
	 * @param lat2 the latitude of the twoth point (degrees)
	 * @return the separation (radians)
	 */
	public static double angularSeparation(double lon1, double lat1, double lon2, double lat2) {
		double φ1 = Math.toRadians(lat1), φ2 = Math.toRadians(lat2);
		double dφ = φ2 - φ1;
		double dλ = Math.toRadians(lon2 - lon1);
		double a = Math.pow(Math.sin(dφ/2), 2) + Math.cos(φ1)*Math.cos(φ2)*Math.pow(Math.sin(dλ/2), 2);
		return 2*Math.asin(Math.min(1, Math.sqrt(a)));
	}

	/**
	 * the error function, from the complementary error function with Chebyshev fitting given in
	 *     W. H. Press et al., <i>Numerical Recipes</i>, 2nd ed., §6.2 (1992).
	 * the fractional error is everywhere less than 1.2e-7.
	 */
	public static double erf(double x) {
		double z = Math.abs(x);
		double t = 1/(1 + z/2);
		double erfc = t*Math.exp(-z*z - 1.26551223 + t*(1.00002368 + t*(0.37409196 + t*(0.09678418 +
		              t*(-0.18628806 + t*(0.27886807 + t*(-1.13520398 + t*(1.48851587 +
		              t*(-0.82215223 + t*0.17087277)))))))));
		return (x >= 0) ? 1 - erfc : erfc - 1;
	}

	/**
	 * invert a square matrix by Gaussian elimination with partial pivoting.
	 * @param arr the matrix to invert (it won't be modified)
	 * @return the inverse.  if arr is singular the result will contain infs or NaNs.
	 */
	public static double[][] matinv(double[][] arr) {
		double[][] a = new double[arr.length][];
		for (int i = 0; i < arr.length; i ++) {
			if (arr[i].length != arr.length)
				throw new ShapeMismatchException("Only square matrices have inverses; not this "+arr.length+"×"+arr[i].length+" trash.");
			a[i] = arr[i].clone();
		}

		int n = a.length;
		if (n == 0)
			return new double[0][0];
		double[][] x = new double[n][n];
		double[][] b = new double[n][n];
		int[] index = new int[n];
		for (int i = 0; i < n; ++i)
			b[i][i] = 1;

		// Transform the matrix into an upper triangle
		gaussian(a, index);

		// Update the matrix b[i][j] with the ratios stored
		for (int i = 0; i < n - 1; ++i)
			for (int j = i + 1; j < n; ++j)
				for (int k = 0; k < n; ++k)
					b[index[j]][k] -= a[index[j]][i] * b[index[i]][k];

		// Perform backward substitutions
		for (int i = 0; i < n; ++i) {
			x[n - 1][i] = b[index[n - 1]][i] / a[index[n - 1]][n - 1];
			for (int j = n - 2; j >= 0; --j) {
				x[j][i] = b[index[j]][i];
				for (int k = j + 1; k < n; ++k) {
					x[j][i] -= a[index[j]][k] * x[k][i];
				}
				x[j][i] /= a[index[j]][j];
			}
		}
		return x;
	}

	/**
	 * Method to carry out the partial-pivoting Gaussian
	 * elimination. Here index[] stores pivoting order.
	 */
	private static void gaussian(double[][] a, int[] index) {
		int n = index.length;
		double[] c = new double[n];

		// Initialize the index
		for (int i = 0; i < n; ++i)
			index[i] = i;

		// Find the rescaling factors, one from each row
		for (int i = 0; i < n; ++i) {
			double c1 = 0;
			for (int j = 0; j < n; ++j) {
				double c0 = Math.abs(a[i][j]);
				if (c0 > c1)
					c1 = c0;
			}
			c[i] = c1;
		}

		// Search the pivoting element from each column
		for (int j = 0; j < n - 1; ++j) {
			int k = j;
			double pi1 = 0;
			for (int i = j; i < n; ++i) {
				double pi0 = Math.abs(a[index[i]][j]);
				pi0 /= c[index[i]];
				if (pi0 > pi1) {
					pi1 = pi0;
					k = i;
				}
			}

			// Interchange rows according to the pivoting order
			int itmp = index[j];
			index[j] = index[k];
			index[k] = itmp;
			for (int i = j + 1; i < n; ++i) {
				double pj = a[index[i]][j] / a[index[j]][j];

				// Record pivoting ratios below the diagonal
				a[index[i]][j] = pj;

				// Modify other elements accordingly
				for (int l = j + 1; l < n; ++l)
					a[index[i]][l] -= pj * a[index[j]][l];
			}
		}
	}

}
