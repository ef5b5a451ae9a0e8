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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * a source whose brightness factors into a spatial shape times a spectrum.  its parameters are those of its two
 * components, qualified as "spatial.lon_0", "spectral.index", and so on, and shared with them, so moving a
 * parameter of the sky model moves the component.
 */
public class SkyModel {
	public static final String SPATIAL_TAG = "spatial";
	public static final String SPECTRAL_TAG = "spectral";

	private final SpatialModel spatialModel;
	private final SpectralModel spectralModel;
	private final ParameterSet parameters;

	public SkyModel(SpatialModel spatialModel, SpectralModel spectralModel) {
		if (spatialModel == null || spectralModel == null)
			throw new IllegalArgumentException("a sky model needs both a spatial and a spectral component");
		this.spatialModel = spatialModel;
		this.spectralModel = spectralModel;
		Map<String, ParameterSet> tagged = new LinkedHashMap<>();
		tagged.put(SPATIAL_TAG, spatialModel.getParameters());
		tagged.put(SPECTRAL_TAG, spectralModel.getParameters());
		this.parameters = ParameterSet.concatenate(tagged);
	}

	/**
	 * @param lon the longitude (deg)
	 * @param lat the latitude (deg)
	 * @param energy the true energy (TeV)
	 * @return the differential flux per solid angle (cm^-2 s^-1 TeV^-1 sr^-1)
	 */
	public double evaluate(double lon, double lat, double energy) {
		return spatialModel.evaluate(lon, lat)*spectralModel.evaluate(energy);
	}

	/**
	 * evaluate the model at the centre of every bin of a geometry, energies taken at the log-centre of each bin.
	 * the spatial part is evaluated once per pixel and the spectral part once per energy.
	 * @return the differential flux per solid angle (cm^-2 s^-1 TeV^-1 sr^-1)
	 */
	public SkyCube evaluate(MapGeometry geometry) {
		double[][] image = new double[geometry.getNlat()][geometry.getNlon()];
		for (int i = 0; i < image.length; i ++)
			for (int j = 0; j < image[i].length; j ++)
				image[i][j] = spatialModel.evaluate(geometry.getLon(j), geometry.getLat(i));
		EnergyAxis energy = geometry.getEnergy();
		double[] spectrum = new double[energy.getNumBins()];
		for (int e = 0; e < spectrum.length; e ++)
			spectrum[e] = spectralModel.evaluate(energy.getCenter(e));

		SkyCube dnde = new SkyCube(geometry);
		for (int e = 0; e < spectrum.length; e ++) {
			double[][] slice = dnde.getSlice(e);
			for (int i = 0; i < image.length; i ++)
				for (int j = 0; j < image[i].length; j ++)
					slice[i][j] = image[i][j]*spectrum[e];
		}
		return dnde;
	}

	public SpatialModel getSpatialModel() {
		return spatialModel;
	}

	public SpectralModel getSpectralModel() {
		return spectralModel;
	}

	/**
	 * @return the combined parameters of both components (the live objects)
	 */
	public ParameterSet getParameters() {
		return parameters;
	}

	/**
	 * @return an independent model with copies of every parameter and of the covariance
	 */
	public SkyModel copy() {
		SkyModel copy = new SkyModel(spatialModel.copy(), spectralModel.copy());
		copy.parameters.copyCovarianceFrom(this.parameters);
		return copy;
	}

	@Override
	public String toString() {
		return "SkyModel(" + spatialModel + ", " + spectralModel + ")";
	}
}
