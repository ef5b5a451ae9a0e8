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

import java.util.logging.Logger;

/**
 * folds a sky model thru the instrument response to get the number of counts it predicts in each bin.  the steps
 * are, in order: differential flux at each true-energy bin, integration over the bin and the pixel, multiplication
 * by the exposure, convolution with the PSF, redistribution into reconstructed energy, and addition of the
 * background.  every call recomputes everything from the current parameter values, and none of the inputs are
 * ever modified.
 */
public class MapEvaluator {

	private static final Logger logger = Logger.getLogger("root");

	private final SkyModel model;
	private final SkyCube exposure;
	private final SkyCube background;
	private final PSFKernel psf;
	private final EnergyDispersion edisp;

	/**
	 * @param model the source model
	 * @param exposure the exposure on the true-energy grid (cm^2 s); it gets copied
	 * @param background the expected background counts on the reconstructed-energy grid, or null for none; it
	 *                   gets copied
	 * @param psf the PSF kernel, or null to skip the convolution
	 * @param edisp the energy dispersion, or null to take reconstructed energy to be true energy
	 * @throws ShapeMismatchException if the response products don't fit together
	 * @throws IllegalArgumentException if the exposure or background has negative or non-finite values
	 */
	public MapEvaluator(SkyModel model, SkyCube exposure, SkyCube background,
	                    PSFKernel psf, EnergyDispersion edisp) {
		if (model == null || exposure == null)
			throw new IllegalArgumentException("a map evaluator needs at least a model and an exposure");
		MapGeometry geometry = exposure.getGeometry();
		if (psf != null && !psf.conformsTo(geometry))
			throw new ShapeMismatchException(psf+" doesn't fit the exposure "+geometry);
		if (edisp != null && !edisp.getTrueEnergy().conformsTo(geometry.getEnergy()))
			throw new ShapeMismatchException(edisp+" doesn't start from the exposure's energy axis");
		if (!exposure.isNonNegative())
			throw new IllegalArgumentException("the exposure must be finite and nonnegative");
		if (background != null && !background.isNonNegative())
			throw new IllegalArgumentException("the background must be finite and nonnegative");
		this.model = model;
		this.exposure = exposure.copy();
		this.background = (background != null) ? background.copy() : null;
		this.psf = psf;
		this.edisp = edisp;
		if (background != null && !background.getGeometry().conformsTo(getRecoGeometry()))
			throw new ShapeMismatchException(String.format(
				  "the background %s isn't on the reconstructed grid %s", background.getGeometry(), getRecoGeometry()));
		logger.fine("set up "+this);
	}

	/**
	 * @return the true-energy grid on which the flux is computed
	 */
	public MapGeometry getGeometry() {
		return exposure.getGeometry();
	}

	/**
	 * @return the reconstructed-energy grid on which the predicted counts come out
	 */
	public MapGeometry getRecoGeometry() {
		if (edisp == null)
			return exposure.getGeometry();
		else
			return exposure.getGeometry().withEnergy(edisp.getRecoEnergy());
	}

	public SkyModel getModel() {
		return model;
	}

	/**
	 * @return the differential flux per solid angle in every true-energy bin (cm^-2 s^-1 TeV^-1 sr^-1)
	 */
	public SkyCube computeDnde() {
		return model.evaluate(getGeometry());
	}

	/**
	 * @return the flux integrated over each bin: dnde times the energy width times the solid angle (cm^-2 s^-1)
	 */
	public SkyCube computeFlux() {
		SkyCube flux = computeDnde();
		MapGeometry geometry = flux.getGeometry();
		EnergyAxis energy = geometry.getEnergy();
		for (int e = 0; e < energy.getNumBins(); e ++) {
			double width = energy.getWidth(e);
			double[][] slice = flux.getSlice(e);
			for (int i = 0; i < slice.length; i ++) {
				double Ω = geometry.getSolidAngle(i);
				for (int j = 0; j < slice[i].length; j ++)
					slice[i][j] *= width*Ω;
			}
		}
		return flux;
	}

	/**
	 * @return the flux times the exposure: expected counts before the PSF and dispersion
	 */
	public SkyCube applyExposure(SkyCube flux) {
		if (!flux.getGeometry().conformsTo(getGeometry()))
			throw new ShapeMismatchException("this flux isn't on the exposure grid: "+flux.getGeometry());
		SkyCube counts = flux.copy();
		double[][][] data = counts.getData();
		double[][][] exposure = this.exposure.getData();
		for (int e = 0; e < data.length; e ++)
			for (int i = 0; i < data[e].length; i ++)
				for (int j = 0; j < data[e][i].length; j ++)
					data[e][i][j] *= exposure[e][i][j];
		return counts;
	}

	/**
	 * @return the counts after being blurred by the PSF (a copy of the input if there's no PSF)
	 */
	public SkyCube applyPsf(SkyCube npred) {
		if (psf == null)
			return npred.copy();
		return psf.apply(npred);
	}

	/**
	 * @return the counts moved into reconstructed energy (a copy of the input if there's no dispersion)
	 */
	public SkyCube applyEdisp(SkyCube npred) {
		if (edisp == null)
			return npred.copy();
		return edisp.apply(npred);
	}

	/**
	 * run the whole chain at the current parameter values
	 * @return the predicted counts on the reconstructed-energy grid
	 */
	public SkyCube computeNpred() {
		SkyCube npred = applyEdisp(applyPsf(applyExposure(computeFlux())));
		if (background != null) {
			double[][][] data = npred.getData();
			double[][][] background = this.background.getData();
			for (int e = 0; e < data.length; e ++)
				for (int i = 0; i < data[e].length; i ++)
					for (int j = 0; j < data[e][i].length; j ++)
						data[e][i][j] += background[e][i][j];
		}
		return npred;
	}

	@Override
	public String toString() {
		return String.format("MapEvaluator(%s, psf=%s, edisp=%s, background=%b)",
		                     model, psf, edisp, background != null);
	}
}
