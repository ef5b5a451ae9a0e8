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
 * a disk of uniform brightness on the sphere with a sharp edge.
 */
public class SkyDisk implements SpatialModel {
	/** the smallest radius the disk can take without dividing by zero (deg) */
	public static final double MIN_RADIUS = 1e-6;

	private final Parameter lon_0;
	private final Parameter lat_0;
	private final Parameter r_0;
	private final ParameterSet parameters;

	/**
	 * @param lon_0 the longitude of the centre (deg)
	 * @param lat_0 the latitude of the centre (deg)
	 * @param r_0 the angular radius (deg)
	 * @throws IllegalArgumentException if r_0 is less than {@link #MIN_RADIUS} or more than 180
	 */
	public SkyDisk(double lon_0, double lat_0, double r_0) {
		this(new Parameter("lon_0", lon_0, "deg"),
		     new Parameter("lat_0", lat_0, "deg", -90, 90, false),
		     new Parameter("r_0", r_0, "deg", MIN_RADIUS, 180, false));
	}

	private SkyDisk(Parameter lon_0, Parameter lat_0, Parameter r_0) {
		this.lon_0 = lon_0;
		this.lat_0 = lat_0;
		this.r_0 = r_0;
		this.parameters = new ParameterSet(lon_0, lat_0, r_0);
	}

	@Override
	public double evaluate(double lon, double lat) {
		double θ = Math2.angularSeparation(lon_0.getValue(), lat_0.getValue(), lon, lat);
		double radius = Math.toRadians(r_0.getValue());
		if (θ <= radius)
			return 1/(4*Math.PI*Math.pow(Math.sin(radius/2), 2)); // 2π(1 - cos r), without the cancellation
		else
			return 0;
	}

	@Override
	public ParameterSet getParameters() {
		return parameters;
	}

	@Override
	public SkyDisk copy() {
		return new SkyDisk(lon_0.copy(), lat_0.copy(), r_0.copy());
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "SkyDisk(lon_0=%.4f, lat_0=%.4f, r_0=%.4f)",
		                     lon_0.getValue(), lat_0.getValue(), r_0.getValue());
	}
}
