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
 * the outcome of a {@link MapFit}.  the model is a copy made when the fit finished, so it won't change if the fit
 * is run again, and its parameter set carries the covariance (if there is one).
 */
public class FitResult {
	private final SkyModel model;
	private final boolean success;
	private final double totalStat;
	private final String statName;
	private final String backend;
	private final int evaluations;
	private final String message;
	private final SkyCube npred;

	/**
	 * @param model the fitted model; the caller must not keep a reference to it
	 * @param success whether the minimizer converged
	 * @param totalStat the fit statistic at the best parameters
	 * @param statName the name of the fit statistic
	 * @param backend the name of the minimizer
	 * @param evaluations the number of times the minimizer evaluated the statistic
	 * @param message the minimizer's description of how it ended
	 * @param npred the predicted counts at the best parameters
	 */
	public FitResult(SkyModel model, boolean success, double totalStat, String statName,
	                 String backend, int evaluations, String message, SkyCube npred) {
		this.model = model;
		this.success = success;
		this.totalStat = totalStat;
		this.statName = statName;
		this.backend = backend;
		this.evaluations = evaluations;
		this.message = message;
		this.npred = npred;
	}

	/**
	 * @return a copy of the fitted model, covariance included
	 */
	public SkyModel getModel() {
		return model.copy();
	}

	/**
	 * @return the parameters of a copy of the fitted model, covariance included
	 */
	public ParameterSet getParameters() {
		return model.copy().getParameters();
	}

	public boolean isSuccess() {
		return success;
	}

	public double getTotalStat() {
		return totalStat;
	}

	public String getStatName() {
		return statName;
	}

	public String getBackend() {
		return backend;
	}

	public int getEvaluations() {
		return evaluations;
	}

	public String getMessage() {
		return message;
	}

	/**
	 * @return a copy of the predicted counts at the best parameters
	 */
	public SkyCube getNpred() {
		return npred.copy();
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "FitResult%n" +
		                                "  backend     : %s%n" +
		                                "  success     : %b (%s)%n" +
		                                "  evaluations : %d%n" +
		                                "  total stat  : %.6f (%s)%n%n%s",
		                     backend, success, message, evaluations, totalStat, statName, model.getParameters());
	}
}
