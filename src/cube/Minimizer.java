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

import java.util.Random;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * something that can minimize a scalar funccion of a real vector within a box.  {@link MapFit} hands one of these
 * its objective in factor space and reads the hessian back off the result to get the covariance.
 */
public interface Minimizer {

	/**
	 * @return a short name for the method, for the fit result
	 */
	String getName();

	/**
	 * @param objective the funccion to minimize
	 * @param initial the starting point
	 * @param lower the lower bounds (may be -∞)
	 * @param upper the upper bounds (may be +∞)
	 * @return the best point found.  a failure to converge is reported in the result, not thrown.
	 */
	Optimize.Optimum minimize(Function<double[], Double> objective,
	                          double[] initial, double[] lower, double[] upper);

	/**
	 * the default local minimizer, with the default tolerance
	 */
	static Minimizer levenbergMarquardt() {
		return levenbergMarquardt(Optimize.EDM_TOLERANCE, Optimize.MAX_ITERATIONS);
	}

	/**
	 * a damped Newton method that returns the hessian at the optimum
	 * @param tolerance the estimated distance to the minimum at which to stop
	 * @param maxIterations the number of steps after which to give up
	 */
	static Minimizer levenbergMarquardt(double tolerance, int maxIterations) {
		Logger logger = Logger.getLogger("root");
		return new Minimizer() {
			@Override
			public String getName() {
				return "levenberg-marquardt";
			}

			@Override
			public Optimize.Optimum minimize(Function<double[], Double> objective,
			                                 double[] initial, double[] lower, double[] upper) {
				return Optimize.levenberg_marquardt(objective, initial, lower, upper,
				                                    tolerance, maxIterations, logger);
			}
		};
	}

	/**
	 * a global search, useful when the starting point may be far from the optimum.  it returns no hessian.
	 * @param spread the initial scatter of the population, relative to the magnitude of each coordinate
	 * @param maxIterations the number of generations after which to give up
	 * @param tolerance the spread in objective across the population at which to stop
	 * @param seed the random seed, so that fits are reproducible
	 */
	static Minimizer differentialEvolution(double spread, int maxIterations, double tolerance, long seed) {
		Logger logger = Logger.getLogger("root");
		return new Minimizer() {
			@Override
			public String getName() {
				return "differential-evolution";
			}

			@Override
			public Optimize.Optimum minimize(Function<double[], Double> objective,
			                                 double[] initial, double[] lower, double[] upper) {
				double[] scale = new double[initial.length];
				for (int i = 0; i < initial.length; i ++)
					scale[i] = spread*Math.max(Math.abs(initial[i]), 1);
				return Optimize.differential_evolution(
					  objective, initial, scale, lower, upper, maxIterations,
					  Math.max(10*initial.length, 8), 0.7, 0.3, 0.0, tolerance,
					  new Random(seed), logger);
			}
		};
	}
}
