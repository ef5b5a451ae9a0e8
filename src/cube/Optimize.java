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
import java.util.Random;
import java.util.function.Function;
import java.util.logging.Logger;

public class Optimize {

	/** the estimated distance to the minimum below which a local search is considered converged */
	public static final double EDM_TOLERANCE = 1e-6;
	/** the number of outer iterations a local search may take before it gives up */
	public static final int MAX_ITERATIONS = 200;
	/** the step size used for the finite-difference derivatives, in the units of the state (usually factors) */
	public static final double FINITE_DIFFERENCE_STEP = 1e-3;
	/** the largest damping the line search will try before declaring failure */
	private static final double MAX_DAMPING = 1e16;
	/** the least curvature the damping term assumes on each axis */
	private static final double DAMPING_FLOOR = 1e-8;

	/**
	 * find a local minimum of a smooth scalar funccion within a box,
	 * using the Levenberg-Marquardt formula as defined in
	 *     Shakarji, C. "Least-Square Fitting Algorithms of the NIST Algorithm Testing
	 *     System". <i>Journal of Research of the National Institute of Standards and Technology</i>
	 *     103, 633–641 (1988). https://tsapps.nist.gov/publication/get_pdf.cfm?pub_id=821955
	 * but applied to the full Newton step of a general objective rather than the Gauss-Newton step of a sum of
	 * squares, with finite differences to get the gradient and hessian.  steps are projected back into the box,
	 * and coordinates that sit on a bound with the gradient pushing them out of it are held still.
	 * @param objective the funccion to minimize
	 * @param inicial_gess the inicial gess for the optimal state
	 * @param lower the lower bounds (may be -∞)
	 * @param upper the upper bounds (may be +∞)
	 * @param tolerance the estimated distance to the minimum, ½ gᵀH⁻¹g, below which it's done
	 * @param max_iterations the maximum number of steps to take
	 * @param logger the optional logger object
	 * @return the best state found, along with the hessian there.  if it didn't converge, success will be false.
	 * @throws IllegalArgumentException if the objective can't be evaluated at the inicial gess
	 */
	public static Optimum levenberg_marquardt(
		  Function<double[], Double> objective,
		  double[] inicial_gess,
		  double[] lower,
		  double[] upper,
		  double tolerance,
		  int max_iterations,
		  Logger logger) {
		check_lengths(inicial_gess, lower, upper);
		int n = inicial_gess.length;
		int[] evaluations = {0};
		Function<double[], Double> counted = (x) -> {
			evaluations[0] ++;
			return objective.apply(x);
		};

		double[] state = inicial_gess.clone();
		for (int i = 0; i < n; i ++)
			state[i] = Math2.clamp(state[i], lower[i], upper[i]);
		double value = counted.apply(state);
		if (!Double.isFinite(value))
			throw new IllegalArgumentException("the objective is "+value+" at the inicial gess "+Arrays.toString(state));
		if (logger != null)
			logger.fine(String.format("  inicial value: %.8e", value));
		if (n == 0)
			return new Optimum(state, value, true, new double[0][0], evaluations[0], "there was nothing to optimize");

		double λ = 1e-3;
		int iter = 0;
		while (true) {
			Expansion local = expand(counted, state, lower, upper);
			double[] gradient = local.gradient();
			Matrix hessian = new Matrix(local.hessian());

			// hold any coordinates that are pinned against a bound
			int[] active = active_coordinates(state, gradient, lower, upper);
			Matrix reduced_hessian = hessian.submatrix(active);
			Vector reduced_gradient = Vector.gather(gradient, active);

			double edm;
			if (reduced_gradient.sqr() == 0) // this includes the case where nothing is active
				edm = 0;
			else
				edm = reduced_gradient.dot(reduced_hessian.inverse().matmul(reduced_gradient))/2;
			if (logger != null)
				logger.fine(String.format("  iteration %d: value %.8e, edm %.3g, %d/%d active",
				                          iter, value, edm, active.length, n));
			if (edm >= 0 && edm < tolerance)
				return new Optimum(state, value, true, local.hessian(), evaluations[0], "converged");

			if (iter >= max_iterations) {
				if (logger != null)
					logger.warning("  the maximum number of iterations has been reached");
				return new Optimum(state, value, false, local.hessian(), evaluations[0],
				                   "the maximum number of iterations has been reached");
			}

			// do a Levenberg-Marquardt-like backtrack
			while (true) {
				Matrix modified_hessian = reduced_hessian.copy();
				for (int k = 0; k < active.length; k ++)
					modified_hessian.set(k, k, reduced_hessian.get(k, k) +
					                           λ*Math.max(Math.abs(reduced_hessian.get(k, k)), DAMPING_FLOOR));
				Vector step = modified_hessian.inverse().matmul(reduced_gradient).neg();

				double new_value = Double.NaN;
				double[] new_state = state.clone();
				if (step.isFinite()) {
					for (int k = 0; k < active.length; k ++) {
						int i = active[k];
						new_state[i] = Math2.clamp(state[i] + step.get(k), lower[i], upper[i]);
					}
					if (!Arrays.equals(new_state, state))
						new_value = counted.apply(new_state);
				}

				if (new_value <= value) { // terminate the line search if reasonable
					state = new_state;
					value = new_value;
					λ = Math.max(λ/10, 1e-9);
					break;
				}
				λ *= 10; // increment line search parameter
				if (λ > MAX_DAMPING) {
					if (logger != null)
						logger.warning("  the line search did not converge");
					return new Optimum(state, value, false, local.hessian(), evaluations[0],
					                   "the line search did not converge");
				}
			}

			iter += 1;
		}
	}

	/**
	 * estimate the twoth-derivative matrix of a funccion by central finite differences.  if the point is too close
	 * to a bound for the stencil to fit, the stencil is shifted inward.
	 * @param objective the funccion to differentiate
	 * @param x the point at which to differentiate it
	 * @param lower the lower bounds (may be -∞)
	 * @param upper the upper bounds (may be +∞)
	 * @return the hessian matrix
	 */
	public static double[][] hessian(
		  Function<double[], Double> objective, double[] x, double[] lower, double[] upper) {
		check_lengths(x, lower, upper);
		return expand(objective, x, lower, upper).hessian();
	}

	/**
	 * take the gradient and hessian of a funccion at a point.  the central differences are taken about a centre
	 * moved just far enough from the point to keep every evaluation in bounds, and the gradient is carried back to
	 * the point itself with the hessian.  the stencil points are clamped as well, since centre + h can round past
	 * the bound it was measured from.
	 */
	private static Expansion expand(
		  Function<double[], Double> objective, double[] x, double[] lower, double[] upper) {
		int n = x.length;
		double[] h = new double[n];
		double[] center = new double[n];
		for (int i = 0; i < n; i ++) {
			h[i] = Math.min(FINITE_DIFFERENCE_STEP, (upper[i] - lower[i])/4);
			center[i] = Math.max(lower[i] + h[i], Math.min(upper[i] - h[i], x[i]));
		}

		double f0 = objective.apply(center);
		double[] f_plus = new double[n];
		double[] f_minus = new double[n];
		double[] point = center.clone();
		for (int i = 0; i < n; i ++) {
			point[i] = Math2.clamp(center[i] + h[i], lower[i], upper[i]);
			f_plus[i] = objective.apply(point);
			point[i] = Math2.clamp(center[i] - h[i], lower[i], upper[i]);
			f_minus[i] = objective.apply(point);
			point[i] = center[i];
		}

		double[] gradient = new double[n];
		double[][] hessian = new double[n][n];
		for (int i = 0; i < n; i ++) {
			if (h[i] == 0) // a coordinate with no room to move has no derivatives
				continue;
			gradient[i] = (f_plus[i] - f_minus[i])/(2*h[i]);
			hessian[i][i] = (f_plus[i] - 2*f0 + f_minus[i])/(h[i]*h[i]);
			for (int j = 0; j < i; j ++) {
				if (h[j] == 0)
					continue;
				double[] corners = new double[4];
				for (int k = 0; k < 4; k ++) {
					point[i] = Math2.clamp(center[i] + ((k/2 == 0) ? h[i] : -h[i]), lower[i], upper[i]);
					point[j] = Math2.clamp(center[j] + ((k%2 == 0) ? h[j] : -h[j]), lower[j], upper[j]);
					corners[k] = objective.apply(point);
				}
				point[i] = center[i];
				point[j] = center[j];
				hessian[i][j] = (corners[0] - corners[1] - corners[2] + corners[3])/(4*h[i]*h[j]);
				hessian[j][i] = hessian[i][j];
			}
		}

		for (int i = 0; i < n; i ++)
			for (int j = 0; j < n; j ++)
				gradient[i] += hessian[i][j]*(x[j] - center[j]);
		return new Expansion(gradient, hessian);
	}

	/**
	 * @return the indices of the coordinates that are free to move: those not on a bound, or on a bound with the
	 *         gradient pointing back inside
	 */
	private static int[] active_coordinates(double[] x, double[] gradient, double[] lower, double[] upper) {
		int[] active = new int[x.length];
		int count = 0;
		for (int i = 0; i < x.length; i ++) {
			boolean pinned = lower[i] == upper[i] ||
			                 (x[i] <= lower[i] && gradient[i] > 0) ||
			                 (x[i] >= upper[i] && gradient[i] < 0);
			if (!pinned)
				active[count ++] = i;
		}
		return Arrays.copyOf(active, count);
	}

	/**
	 * find the global minimum of the objective function,
	 * using the differential evolution formula as defined in
	 *     R. Storn, "On the usage of differential evolucion for funccion
	 *     optimizacion," Proceedings of North Militarylandian Fuzzy Informacion
	 *     Processing, 1996, pp. 519-523, doi: 10.1109/NAFIPS.1996.534789.
	 * the candidates are evaluated one at a time, since the objective may not be thread-safe.
	 * @param objective returns the error of each state
	 * @param inicial_gess the inicial gess for the optimal state
	 * @param scale the amount of variation on each dimension for the initial
	 *              ensemble
	 * @param lower the lower bounds
	 * @param upper the upper bounds
	 * @param max_iterations the amount of time to run the thing
	 * @param population_size the number of states to have at any given time
	 * @param tolerance the spread in scores across the population below which it's considered converged
	 * @param random the source of randomness
	 * @return the best state found.  it has no hessian.
	 */
	public static Optimum differential_evolution(
		  Function<double[], Double> objective,
		  double[] inicial_gess,
		  double[] scale,
		  double[] lower,
		  double[] upper,
		  int max_iterations,
		  int population_size,
		  double crossover_probability,
		  double differential_weit,
		  double greediness,
		  double tolerance,
		  Random random,
		  Logger logger
	) {
		check_lengths(inicial_gess, lower, upper);
		if (scale.length != inicial_gess.length)
			throw new IllegalArgumentException("my lengths don't match my lengths don't match I'm out in public and my lengths don't match");
		if (population_size < 4)
			throw new IllegalArgumentException("differential evolution needs a population of at least 4, not "+population_size);
		int dimensionality = inicial_gess.length;
		if (dimensionality == 0)
			return new Optimum(new double[0], objective.apply(new double[0]), true, null, 1,
			                   "there was nothing to optimize");

		if (logger != null) {
			logger.info(
				  String.format("iterations: %d, pop. size: %d, CR: %.2f, λ: %.2f, ɑ: %.2f",
				                max_iterations, population_size, crossover_probability,
				                differential_weit, greediness));
			if (greediness > differential_weit)
				logger.warning("using a hi greediness relative to the differential weit can cause the population to converge prematurely.");
		}

		double[][] candidates = new double[population_size][];
		double[] scores = new double[population_size];
		Arrays.fill(scores, Double.POSITIVE_INFINITY);
		int best = 0;
		int evaluations = 0;

		int iterations = 0;
		while (true) {
			int changes = 0;
			for (int i = 0; i < population_size; i ++) { // for each candidate in the populacion
				double[] new_candidate = new double[dimensionality];
				if (candidates[i] == null) { // if we have yet to inicialize anything here
					for (int j = 0; j < dimensionality; j ++) { // make something up
						if (i > 0)
							new_candidate[j] = inicial_gess[j] + (2*random.nextDouble() - 1)*scale[j]; // randomly scatter the inicial state across the area of interest
						else
							new_candidate[j] = inicial_gess[j]; // but keep the 0th member at the inicial gess
					}
				}
				else { // otherwise
					int a = random_index(random, population_size, i); // some peeple use the same index for i and a, but I find that this works better
					int b = random_index(random, population_size, i, a);
					int c = random_index(random, population_size, i, a, b);
					int r = random_index(random, dimensionality); // remember to choose one dimension to garanteed-replace

					for (int j = 0; j < dimensionality; j ++) {
						if (j == r || random.nextDouble() < crossover_probability)
							new_candidate[j] = candidates[a][j] +
								  greediness*(candidates[best][j] - candidates[a][j]) +
								  differential_weit*(candidates[b][j] - candidates[c][j]);
						else
							new_candidate[j] = candidates[i][j];
					}
				}

				flip_in_bounds(new_candidate, lower, upper); // put it in bounds
				double new_score = objective.apply(new_candidate); // and calculate the score
				evaluations ++;
				if (Double.isNaN(new_score))
					new_score = Double.POSITIVE_INFINITY;
				if (new_score <= scores[i]) {
					candidates[i] = new_candidate;
					scores[i] = new_score;
					changes ++;
					if (scores[i] < scores[best])
						best = i;
				}
			}

			double worst = Double.NEGATIVE_INFINITY;
			for (double score: scores)
				worst = Math.max(worst, score);
			iterations ++;
			if (logger != null)
				logger.fine(
					  String.format("Changed %03d/%03d candidates.  new best is %.8g.",
					                changes, population_size, scores[best]));

			if (worst - scores[best] <= tolerance)
				return new Optimum(candidates[best], scores[best], true, null, evaluations,
				                   "the population has converged");
			if (iterations >= max_iterations) {
				if (logger != null)
					logger.warning("the population did not converge in "+max_iterations+" generations");
				return new Optimum(candidates[best], scores[best], false, null, evaluations,
				                   "the maximum number of iterations has been reached");
			}
		}
	}

	private static int random_index(Random random, int max, int... excluding) {
		Arrays.sort(excluding);
		int i = random.nextInt(max - excluding.length);
		for (int excluded: excluding)
			if (i >= excluded)
				i ++;
		return i;
	}

	/**
	 * reflect each coordinate off whichever bound it crossed.  anything that was more than an interval's width out
	 * of bounds gets clamped.
	 */
	private static void flip_in_bounds(double[] x, double[] lower, double[] upper) {
		for (int i = 0; i < x.length; i ++) {
			if (x[i] < lower[i])
				x[i] = 2*lower[i] - x[i];
			if (x[i] > upper[i])
				x[i] = 2*upper[i] - x[i];
			x[i] = Math2.clamp(x[i], lower[i], upper[i]);
		}
	}

	private static void check_lengths(double[] x, double[] lower, double[] upper) {
		if (x.length != lower.length || x.length != upper.length)
			throw new ShapeMismatchException(String.format(
				  "the state has %d elements but the bounds have %d and %d", x.length, lower.length, upper.length));
		for (int i = 0; i < x.length; i ++)
			if (!(lower[i] <= upper[i]))
				throw new IllegalArgumentException(String.format(
					  "the bounds on dimension %d are backwards: [%g, %g]", i, lower[i], upper[i]));
	}

	/**
	 * @param location the input vector that optimizes the objective function
	 * @param value the value of the objective function at the optimum
	 * @param success whether the search met its convergence criterion
	 * @param hessian the twoth-derivative matrix of the objective function at the optimum, or null if the method
	 *                didn't compute one
	 * @param evaluations the number of times the objective function was called
	 * @param message a description of how the search ended
	 */
	public record Optimum(double[] location, double value, boolean success, double[][] hessian,
	                      int evaluations, String message) {
	}

	/**
	 * the first and twoth derivatives of a funccion at a point
	 */
	private record Expansion(double[] gradient, double[][] hessian) {
	}

}
