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

import java.util.Locale;

/**
 * the pixel grid of a cube: a square-pixel plate carrée patch of sky centred on (lon0, lat0), times an energy axis.
 * pixel (i, j) is the i-th row in latitude and the j-th collum in longitude; cubes index their data as
 * [energy][lat][lon].  longitude increases with j, the way the data are stored, not the way the sky is drawn.
 */
public class MapGeometry {
	private final double lon0; // (deg)
	private final double lat0; // (deg)
	private final double binsz; // (deg)
	private final int nlon;
	private final int nlat;
	private final EnergyAxis energy;

	/**
	 * @param lon0 the longitude of the centre of the map (deg)
	 * @param lat0 the latitude of the centre of the map (deg)
	 * @param binsz the side length of each pixel (deg)
	 * @param nlon the number of pixels along longitude
	 * @param nlat the number of pixels along latitude
	 * @param energy the energy binning
	 */
	public MapGeometry(double lon0, double lat0, double binsz, int nlon, int nlat, EnergyAxis energy) {
		if (!(binsz > 0))
			throw new IllegalArgumentException("the pixel size must be positive");
		if (nlon <= 0 || nlat <= 0)
			throw new IllegalArgumentException("a map needs at least one pixel, not "+nlon+"×"+nlat);
		if (Math.abs(lat0) + binsz*nlat/2. > 90)
			throw new IllegalArgumentException("this map would run off the pole");
		this.lon0 = lon0;
		this.lat0 = lat0;
		this.binsz = binsz;
		this.nlon = nlon;
		this.nlat = nlat;
		this.energy = energy;
	}

	/**
	 * build a geometry from its angular width rather than its pixel count, rounding to the nearest whole pixel
	 * @param width the extent along longitude (deg)
	 * @param height the extent along latitude (deg)
	 */
	public static MapGeometry create(double lon0, double lat0, double binsz,
	                                 double width, double height, EnergyAxis energy) {
		return new MapGeometry(lon0, lat0, binsz,
		                       (int)Math.round(width/binsz), (int)Math.round(height/binsz),
		                       energy);
	}

	/**
	 * the same spatial grid with a different energy axis
	 */
	public MapGeometry withEnergy(EnergyAxis energy) {
		return new MapGeometry(lon0, lat0, binsz, nlon, nlat, energy);
	}

	/**
	 * @return the longitude of the centre of collum j (deg)
	 */
	public double getLon(int j) {
		return lon0 + (j - (nlon - 1)/2.)*binsz;
	}

	/**
	 * @return the latitude of the centre of row i (deg)
	 */
	public double getLat(int i) {
		return lat0 + (i - (nlat - 1)/2.)*binsz;
	}

	/**
	 * @return the solid angle of a pixel in row i (sr)
	 */
	public double getSolidAngle(int i) {
		double dlon = Math.toRadians(binsz);
		double upper = Math.toRadians(getLat(i) + binsz/2);
		double lower = Math.toRadians(getLat(i) - binsz/2);
		return dlon*(Math.sin(upper) - Math.sin(lower));
	}

	public double getLon0() {
		return lon0;
	}

	public double getLat0() {
		return lat0;
	}

	public double getBinsz() {
		return binsz;
	}

	public int getNlon() {
		return nlon;
	}

	public int getNlat() {
		return nlat;
	}

	public EnergyAxis getEnergy() {
		return energy;
	}

	/**
	 * @return {energy bins, latitude pixels, longitude pixels}, the shape of a cube on this grid
	 */
	public int[] getShape() {
		return new int[] {energy.getNumBins(), nlat, nlon};
	}

	/**
	 * whether the two geometries have the same pixels, ignoring energy
	 */
	public boolean spatiallyConformsTo(MapGeometry that) {
		return this.nlon == that.nlon && this.nlat == that.nlat &&
		       Math.abs(this.binsz - that.binsz) <= 1e-9*this.binsz &&
		       Math.abs(this.lon0 - that.lon0) <= 1e-9 &&
		       Math.abs(this.lat0 - that.lat0) <= 1e-9;
	}

	/**
	 * whether the two geometries have the same pixels and the same energy bins
	 */
	public boolean conformsTo(MapGeometry that) {
		return this.spatiallyConformsTo(that) && this.energy.conformsTo(that.energy);
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "MapGeometry(%d×%d×%d, centre=(%.3f, %.3f) deg, binsz=%.4f deg)",
		                     energy.getNumBins(), nlat, nlon, lon0, lat0, binsz);
	}
}
