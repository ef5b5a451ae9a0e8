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
 * builds exposure cubes (effective area times livetime, per true-energy bin) from an effective area.
 */
public class ExposureMaps {

	/**
	 * compute the exposure of every pixel of a true-energy geometry for a single pointing.  each bin gets the
	 * effective area at its log-centre energy and at the offset of its centre from the pointing.
	 * @param pointingLon the longitude of the pointing direction (deg)
	 * @param pointingLat the latitude of the pointing direction (deg)
	 * @param livetime the observation time (s)
	 * @param aeff the effective area
	 * @param geometry the grid on which to compute it, with a true-energy axis
	 * @return the exposure (cm^2 s)
	 */
	public static SkyCube trueEnergy(double pointingLon, double pointingLat, double livetime,
	                                 EffectiveArea aeff, MapGeometry geometry) {
		if (!(livetime >= 0))
			throw new IllegalArgumentException("the livetime can't be negative");
		SkyCube exposure = new SkyCube(geometry);
		EnergyAxis energy = geometry.getEnergy();
		for (int i = 0; i < geometry.getNlat(); i ++) {
			for (int j = 0; j < geometry.getNlon(); j ++) {
				double offset = Math.toDegrees(Math2.angularSeparation(
					  pointingLon, pointingLat, geometry.getLon(j), geometry.getLat(i)));
				for (int e = 0; e < energy.getNumBins(); e ++) {
					double area = aeff.evaluate(energy.getCenter(e), offset);
					if (!(area >= 0))
						throw new IllegalArgumentException(String.format(
							  "the effective area at %.3g TeV and %.3g deg is %g", energy.getCenter(e), offset, area));
					exposure.set(e, i, j, area*livetime);
				}
			}
		}
		return exposure;
	}
}
