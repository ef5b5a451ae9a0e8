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
 * a symmetric 2D Gaussian on the sphere, exp(-θ²/2σ²)/(2πσ²) where θ is the great-circle distance from the centre.
 */
public class SkyGaussian implements SpatialModel {
	/** the narrowest width the profile can take without dividing by zero (deg) */
	public static final double MIN_SIGMA = 1e-6;

	private final Parameter lon_0;
	private final Parameter lat_0;
	private final Parameter sigma;
	private final ParameterSet parameters;

	/**
	 * @param lon_0 the longitude of the centre (deg)
	 * @param lat_0 the latitude of the centre (deg)
	 * @param sigma the standard deviation (deg)
	 * @throws IllegalArgumentException if sigma is less than {@link #MIN_SIGMA}
	 */
	public SkyGaussian(double lon_0, double lat_0, double sigma) {
		this(new Parameter("lon_0", lon_0, "deg"),
		     new Parameter("lat_0", lat_0, "deg", -90, 90, false),
		     new Parameter("sigma", sigma, "deg", MIN_SIGMA, Double.NaN, false));
	}

	private SkyGaussian(Parameter lon_0, Parameter lat_0, Parameter sigma) {
		this.lon_0 = lon_0;
		this.lat_0 = lat_0;
		this.sigma = sigma;
		this.parameters = new ParameterSet(lon_0, lat_0, sigma);
	}

	@Override
	public double evaluate(double lon, double lat) {
		double θ = Math2.angularSeparation(lon_0.getValue(), lat_0.getValue(), lon, lat);
		double σ = Math.toRadians(sigma.getValue());
		return Math.exp(-θ*θ/(2*σ*σ))/(2*Math.PI*σ*σ);
	}

	@Override
	public ParameterSet getParameters() {
		return parameters;
	}

	@Override
	public SkyGaussian copy() {
		return new SkyGaussian(lon_0.copy(), lat_0.copy(), sigma.copy());
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "SkyGaussian(lon_0=%.4f, lat_0=%.4f, sigma=%.4f)",
		                     lon_0.getValue(), lat_0.getValue(), sigma.getValue());
	}
}
