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
 * marks which bins of a cube count toward the fit statistic.  a mask is either a full cube of flags or a single
 * image that applies to every energy bin.
 */
public class SkyMask {
	private final boolean[][][] cube;
	private final boolean[][] image;

	/**
	 * a mask that can differ between energy bins, indexed [energy][lat][lon].  the array is copied.
	 */
	public SkyMask(boolean[][][] cube) {
		this.cube = new boolean[cube.length][][];
		for (int e = 0; e < cube.length; e ++) {
			this.cube[e] = new boolean[cube[e].length][];
			for (int i = 0; i < cube[e].length; i ++)
				this.cube[e][i] = cube[e][i].clone();
		}
		this.image = null;
	}

	/**
	 * a mask that is the same in every energy bin, indexed [lat][lon].  the array is copied.
	 */
	public SkyMask(boolean[][] image) {
		this.cube = null;
		this.image = new boolean[image.length][];
		for (int i = 0; i < image.length; i ++)
			this.image[i] = image[i].clone();
	}

	/**
	 * select (or exclude) every pixel in the geometry
	 */
	public static SkyMask uniform(MapGeometry geometry, boolean value) {
		boolean[][] image = new boolean[geometry.getNlat()][geometry.getNlon()];
		for (boolean[] row: image)
			Arrays.fill(row, value);
		return new SkyMask(image);
	}

	/**
	 * select the pixels whose centres fall within a circle on the sky
	 * @param lon the longitude of the centre of the circle (deg)
	 * @param lat the latitude of the centre of the circle (deg)
	 * @param radius the radius of the circle (deg)
	 */
	public static SkyMask circle(MapGeometry geometry, double lon, double lat, double radius) {
		boolean[][] image = new boolean[geometry.getNlat()][geometry.getNlon()];
		double limit = Math.toRadians(radius);
		for (int i = 0; i < geometry.getNlat(); i ++)
			for (int j = 0; j < geometry.getNlon(); j ++)
				image[i][j] = Math2.angularSeparation(
					  lon, lat, geometry.getLon(j), geometry.getLat(i)) <= limit;
		return new SkyMask(image);
	}

	public boolean get(int e, int i, int j) {
		if (cube != null)
			return cube[e][i][j];
		else
			return image[i][j];
	}

	/**
	 * whether this can be laid over a cube of the given shape
	 * @param shape {energy bins, rows, collums}
	 */
	public boolean conformsTo(int[] shape) {
		if (cube != null) {
			if (cube.length != shape[0])
				return false;
			for (boolean[][] layer: cube)
				if (!imageConforms(layer, shape))
					return false;
			return true;
		}
		else {
			return imageConforms(image, shape);
		}
	}

	private static boolean imageConforms(boolean[][] image, int[] shape) {
		if (image.length != shape[1])
			return false;
		for (boolean[] row: image)
			if (row.length != shape[2])
				return false;
		return true;
	}

	/**
	 * @return the number of selected bins in a cube with the given number of energy bins
	 */
	public int count(int numEnergyBins) {
		int count = 0;
		for (int e = 0; e < numEnergyBins; e ++) {
			boolean[][] layer = (cube != null) ? cube[e] : image;
			for (boolean[] row: layer)
				for (boolean flag: row)
					if (flag)
						count ++;
		}
		return count;
	}
}
