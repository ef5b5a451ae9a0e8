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
 * a 3D array of numbers laid out on a {@link MapGeometry}, indexed [energy][lat][lon].  counts, exposure,
 * background, and predicted counts all live in one of these.
 */
public class SkyCube {
	private final MapGeometry geometry;
	private final double[][][] data;

	/**
	 * a cube of zeros
	 */
	public SkyCube(MapGeometry geometry) {
		this(geometry, new double[geometry.getShape()[0]][geometry.getShape()[1]][geometry.getShape()[2]]);
	}

	/**
	 * wrap some data on a grid.  the array is not copied.
	 * @throws ShapeMismatchException if the array doesn't have the geometry's shape
	 */
	public SkyCube(MapGeometry geometry, double[][][] data) {
		int[] shape = geometry.getShape();
		if (data.length != shape[0])
			throw new ShapeMismatchException(String.format(
				  "the data have %d energy bins but the geometry has %d", data.length, shape[0]));
		for (double[][] image: data) {
			if (image.length != shape[1])
				throw new ShapeMismatchException(String.format(
					  "the data have %d rows but the geometry has %d", image.length, shape[1]));
			for (double[] row: image)
				if (row.length != shape[2])
					throw new ShapeMismatchException(String.format(
						  "the data have %d collums but the geometry has %d", row.length, shape[2]));
		}
		this.geometry = geometry;
		this.data = data;
	}

	/**
	 * a cube with the same value everywhere
	 */
	public static SkyCube filled(MapGeometry geometry, double value) {
		SkyCube cube = new SkyCube(geometry);
		for (double[][] image: cube.data)
			for (double[] row: image)
				Arrays.fill(row, value);
		return cube;
	}

	public MapGeometry getGeometry() {
		return geometry;
	}

	public double get(int e, int i, int j) {
		return data[e][i][j];
	}

	public void set(int e, int i, int j, double value) {
		data[e][i][j] = value;
	}

	/**
	 * @return the underlying array (not a copy; don't modify it unless this cube is yours)
	 */
	public double[][][] getData() {
		return data;
	}

	/**
	 * @return the image in energy bin e (not a copy)
	 */
	public double[][] getSlice(int e) {
		return data[e];
	}

	public double sum() {
		return Math2.sum(data);
	}

	public double sumSlice(int e) {
		return Math2.sum(data[e]);
	}

	/**
	 * @return whether every value is finite and at least 0
	 */
	public boolean isNonNegative() {
		for (double[][] image: data)
			for (double[] row: image)
				for (double x: row)
					if (!(x >= 0) || x == Double.POSITIVE_INFINITY)
						return false;
		return true;
	}

	/**
	 * @return whether this cube's grid has the same shape as that one's
	 */
	public boolean sameShapeAs(SkyCube that) {
		return this.data.length == that.data.length &&
		       this.data[0].length == that.data[0].length &&
		       this.data[0][0].length == that.data[0][0].length;
	}

	public SkyCube copy() {
		return new SkyCube(geometry, Math2.deepCopy(data));
	}

	@Override
	public String toString() {
		return String.format("SkyCube(%s, sum=%.6g)", geometry, sum());
	}
}
