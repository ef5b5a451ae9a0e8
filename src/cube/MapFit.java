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

import java.io.File;
import java.io.IOException;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * a maximum-likelihood fit of a sky model to a counts cube.  the fit works on its own copy of the model, which it
 * moves around freely; the model passed in is never touched.  each call to {@link #run()} starts from wherever the
 * working model was left and produces a result with its own independent copy.
 */
public class MapFit {

	private static final Logger logger = Logger.getLogger("root");

	public enum State {
		CONSTRUCTED, RUNNING, CONVERGED, FAILED
	}

	private final SkyCube counts;
	private final SkyModel model;
	private final MapEvaluator evaluator;
	private final SkyMask mask;
	private final Minimizer minimizer;
	private final FitStatistic statistic;
	private State state;

	/**
	 * set up a fit with the default minimizer and the Cash statistic
	 * @see #MapFit(SkyCube, SkyModel, SkyCube, SkyCube, PSFKernel, EnergyDispersion, SkyMask, Minimizer, FitStatistic)
	 */
	public MapFit(SkyCube counts, SkyModel model, SkyCube exposure, SkyCube background,
	              PSFKernel psf, EnergyDispersion edisp, SkyMask mask) {
		this(counts, model, exposure, background, psf, edisp, mask, null, null);
	}

	/**
	 * @param counts the observed counts on the reconstructed-energy grid; they get copied
	 * @param model the model to fit; it gets copied
	 * @param exposure the exposure on the true-energy grid (cm^2 s)
	 * @param background the expected background counts, or null for none
	 * @param psf the PSF kernel, or null for none
	 * @param edisp the energy dispersion, or null for none
	 * @param mask the bins to fit, or null for all of them
	 * @param minimizer the optimization method, or null for {@link Minimizer#levenbergMarquardt()}
	 * @param statistic the fit statistic, or null for {@link FitStatistic#CASH}
	 * @throws ShapeMismatchException if the counts or the mask don't match the predicted counts' grid
	 * @throws IllegalArgumentException if the counts are negative or not finite
	 */
	public MapFit(SkyCube counts, SkyModel model, SkyCube exposure, SkyCube background,
	              PSFKernel psf, EnergyDispersion edisp, SkyMask mask,
	              Minimizer minimizer, FitStatistic statistic) {
		if (counts == null)
			throw new IllegalArgumentException("a fit needs counts");
		this.model = model.copy();
		this.evaluator = new MapEvaluator(this.model, exposure, background, psf, edisp);
		MapGeometry recoGeometry = evaluator.getRecoGeometry();
		if (!counts.getGeometry().conformsTo(recoGeometry))
			throw new ShapeMismatchException(String.format(
				  "the counts are on %s but the model predicts counts on %s", counts.getGeometry(), recoGeometry));
		if (!counts.isNonNegative())
			throw new IllegalArgumentException("the counts must be finite and nonnegative");
		if (mask != null && !mask.conformsTo(recoGeometry.getShape()))
			throw new ShapeMismatchException("the mask doesn't fit "+recoGeometry);
		this.counts = counts.copy();
		this.mask = mask;
		this.minimizer = (minimizer != null) ? minimizer : Minimizer.levenbergMarquardt();
		this.statistic = (statistic != null) ? statistic : FitStatistic.CASH;
		this.state = State.CONSTRUCTED;
	}

	/**
	 * minimize the fit statistic over the free parameters of the working model.  whether or not it converges, the
	 * working model is left at the best point found.  if it converges, the covariance is estimated from the
	 * hessian of the statistic and attached to the parameters.
	 * @return the result, with a copy of the fitted model
	 */
	public FitResult run() {
		state = State.RUNNING;
		ParameterSet parameters = model.getParameters();
		parameters.autoscale();
		double[] initial = parameters.getFreeFactors();
		double[][] bounds = parameters.getFreeFactorBounds();
		Function<double[], Double> objective = this::totalStat;
		logger.info(String.format("fitting %d free parameters with %s on the %s statistic",
		                          initial.length, minimizer.getName(), statistic.getName()));

		Optimize.Optimum optimum;
		double[][] hessian;
		try {
			optimum = minimizer.minimize(objective, initial, bounds[0], bounds[1]);
			hessian = optimum.hessian();
			if (optimum.success() && hessian == null)
				hessian = Optimize.hessian(objective, optimum.location(), bounds[0], bounds[1]);
		} catch (RuntimeException e) {
			state = State.FAILED;
			throw e;
		}

		parameters.setFreeFactors(optimum.location());
		if (optimum.success()) {
			attachCovariance(parameters, hessian);
			state = State.CONVERGED;
			logger.info(String.format("the fit converged after %d evaluations", optimum.evaluations()));
		}
		else {
			parameters.setCovariance(null);
			state = State.FAILED;
			logger.warning(String.format("the fit did not converge (%s); keeping the best values found",
			                             optimum.message()));
		}

		SkyCube npred = evaluator.computeNpred();
		double totalStat = statistic.total(counts, npred, mask);
		return new FitResult(model.copy(), optimum.success(), totalStat, statistic.getName(),
		                     minimizer.getName(), optimum.evaluations(), optimum.message(), npred);
	}

	/**
	 * turn the hessian of the statistic into a covariance, C = 2H⁻¹ (the statistic being -2 ln L), and give it
	 * to the parameters if it makes sense as one
	 */
	private static void attachCovariance(ParameterSet parameters, double[][] hessian) {
		int n = parameters.numFree();
		if (hessian == null || hessian.length != n) {
			logger.warning("there is no usable hessian, so the covariance can't be computed.");
			parameters.setCovariance(null);
			return;
		}
		Matrix covariance = new Matrix(hessian).inverse().times(2);
		Matrix symmetric = Matrix.zeros(n, n);
		for (int i = 0; i < n; i ++)
			for (int j = 0; j < n; j ++)
				symmetric.set(i, j, (covariance.get(i, j) + covariance.get(j, i))/2);
		boolean usable = symmetric.isFinite();
		for (int i = 0; i < n; i ++)
			if (!(symmetric.get(i, i) > 0))
				usable = false;
		if (usable) {
			parameters.setCovarianceFactors(symmetric);
		}
		else {
			logger.warning("the hessian at the optimum is not positive definite, so there is no covariance.");
			parameters.setCovariance(null);
		}
	}

	/**
	 * @return the fit statistic at the working model's current parameter values
	 */
	public double totalStat() {
		return statistic.total(counts, evaluator.computeNpred(), mask);
	}

	/**
	 * move the working model's free parameters to the given factors and evaluate the fit statistic there.  this
	 * is the funccion the minimizer sees.
	 */
	public double totalStat(double[] factors) {
		model.getParameters().setFreeFactors(factors);
		return totalStat();
	}

	/**
	 * @return the predicted counts at the working model's current parameter values
	 */
	public SkyCube getNpred() {
		return evaluator.computeNpred();
	}

	public State getState() {
		return state;
	}

	public FitStatistic getStatistic() {
		return statistic;
	}

	public Minimizer getMinimizer() {
		return minimizer;
	}

	/**
	 * the model this fit moves around.  it's not for anyone else to modify.
	 */
	SkyModel getWorkingModel() {
		return model;
	}


	/**
	 * fit a simulated Gaussian source with a power-law spectrum seen thru a Gaussian PSF
	 * @param args an optional directory in which to save the log
	 */
	public static void main(String[] args) throws IOException {
		Logging.configureLogger(logger, "cube-fit", (args.length > 0) ? new File(args[0]) : null);
		logger.setLevel(Level.FINE);

		EnergyAxis trueEnergy = EnergyAxis.logspace(0.1, 10, 3);
		EnergyAxis recoEnergy = EnergyAxis.logspace(0.1, 10, 2);
		MapGeometry geometry = MapGeometry.create(0, 0, 0.05, 2, 2, trueEnergy);
		SkyCube exposure = ExposureMaps.trueEnergy(
			  0, 0, 3600, EffectiveArea.gaussianFalloff(1e10, 2), geometry);
		PSFKernel psf = PSFKernel.gaussian(geometry, 0.1, 0.3);
		EnergyDispersion edisp = EnergyDispersion.fromDiagonalResponse(trueEnergy, recoEnergy);
		SkyCube background = SkyCube.filled(geometry.withEnergy(recoEnergy), 1e-2);
		SkyMask mask = SkyMask.circle(geometry.withEnergy(recoEnergy), 0.2, 0.1, 1);

		SkyModel truth = new SkyModel(new SkyGaussian(0.2, 0.1, 0.2),
		                              new PowerLaw(3, 1e-11, 1));
		SkyCube counts = new MapEvaluator(truth, exposure, background, psf, edisp).computeNpred();

		SkyModel model = new SkyModel(new SkyGaussian(0.5, 0.5, 0.2),
		                              new PowerLaw(2, 1e-11, 1));
		model.getParameters().get("sigma").setFrozen(true);

		MapFit fit = new MapFit(counts, model, exposure, background, psf, edisp, mask);
		FitResult result = fit.run();
		logger.info(result.toString());
		if (result.isSuccess())
			logger.info(String.format("index = %.4f ± %.4f", result.getParameters().get("index").getValue(),
			                          result.getParameters().error("index")));
	}
}
