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

import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OptimizeTest {

	private static final double INF = Double.POSITIVE_INFINITY;

	/** a tilted bowl with its bottom at (1, -2) */
	private static final Function<double[], Double> BOWL = (x) ->
		  Math.pow(x[0] - 1, 2) + 10*Math.pow(x[1] + 2, 2) + (x[0] - 1)*(x[1] + 2);

	private static final Function<double[], Double> ROSENBROCK = (x) ->
		  Math.pow(1 - x[0], 2) + 100*Math.pow(x[1] - x[0]*x[0], 2);

	@Test
	public void levenbergMarquardtFindsTheBottomOfABowl() {
		Optimize.Optimum optimum = Optimize.levenberg_marquardt(
			  BOWL, new double[] {5, 5}, new double[] {-INF, -INF}, new double[] {INF, INF},
			  Optimize.EDM_TOLERANCE, Optimize.MAX_ITERATIONS, null);
		assertTrue(optimum.success(), optimum.message());
		assertArrayEquals(new double[] {1, -2}, optimum.location(), 1e-3);
		assertEquals(0, optimum.value(), 1e-6);
		assertEquals(2, optimum.hessian()[0][0], 1e-4);
		assertEquals(1, optimum.hessian()[0][1], 1e-4);
		assertEquals(20, optimum.hessian()[1][1], 1e-4);
		assertTrue(optimum.evaluations() > 0);
	}

	@Test
	public void levenbergMarquardtFollowsTheRosenbrockValley() {
		Optimize.Optimum optimum = Optimize.levenberg_marquardt(
			  ROSENBROCK, new double[] {-1.2, 1}, new double[] {-INF, -INF}, new double[] {INF, INF},
			  Optimize.EDM_TOLERANCE, 1000, null);
		assertTrue(optimum.success(), optimum.message());
		assertArrayEquals(new double[] {1, 1}, optimum.location(), 1e-2);
	}

	@Test
	public void levenbergMarquardtStopsAtTheBound() {
		Function<double[], Double> parabola = (x) -> Math.pow(x[0] - 3, 2) + Math.pow(x[1], 2);
		double[] lower = {0, -1};
		double[] upper = {2, 1};
		Optimize.Optimum optimum = Optimize.levenberg_marquardt(
			  (x) -> {
				  for (int i = 0; i < 2; i ++)
					  if (x[i] < lower[i] || x[i] > upper[i])
						  throw new IllegalStateException("evaluated outside the bounds at "+x[i]);
				  return parabola.apply(x);
			  },
			  new double[] {0.5, 0.5}, lower, upper, Optimize.EDM_TOLERANCE, Optimize.MAX_ITERATIONS, null);
		assertTrue(optimum.success(), optimum.message());
		assertEquals(2, optimum.location()[0]);
		assertEquals(0, optimum.location()[1], 1e-3);
		assertEquals(2, optimum.hessian()[0][0], 1e-4);
	}

	@Test
	public void levenbergMarquardtReportsFailureInsteadOfThrowing() {
		Optimize.Optimum optimum = Optimize.levenberg_marquardt(
			  ROSENBROCK, new double[] {-1.2, 1}, new double[] {-INF, -INF}, new double[] {INF, INF},
			  Optimize.EDM_TOLERANCE, 1, null);
		assertFalse(optimum.success());
		assertTrue(optimum.value() < ROSENBROCK.apply(new double[] {-1.2, 1}));
		assertEquals(2, optimum.hessian().length);
	}

	@Test
	public void levenbergMarquardtEdgeCases() {
		Optimize.Optimum nothing = Optimize.levenberg_marquardt(
			  (x) -> 7., new double[0], new double[0], new double[0], 1e-6, 10, null);
		assertTrue(nothing.success());
		assertEquals(7, nothing.value());
		assertEquals(0, nothing.location().length);

		assertThrows(IllegalArgumentException.class, () -> Optimize.levenberg_marquardt(
			  (x) -> Double.NaN, new double[] {1}, new double[] {-INF}, new double[] {INF}, 1e-6, 10, null));
		assertThrows(ShapeMismatchException.class, () -> Optimize.levenberg_marquardt(
			  BOWL, new double[] {1, 2}, new double[] {-INF}, new double[] {INF}, 1e-6, 10, null));
		assertThrows(IllegalArgumentException.class, () -> Optimize.levenberg_marquardt(
			  BOWL, new double[] {1, 2}, new double[] {0, 0}, new double[] {-1, 1}, 1e-6, 10, null));

		Optimize.Optimum flat = Optimize.levenberg_marquardt(
			  (x) -> 0., new double[] {1, 2}, new double[] {-INF, -INF}, new double[] {INF, INF}, 1e-6, 10, null);
		assertTrue(flat.success());
		assertArrayEquals(new double[] {1, 2}, flat.location());
	}

	@Test
	public void hessianNearABound() {
		double[][] hessian = Optimize.hessian(BOWL, new double[] {0, 0}, new double[] {0, -INF}, new double[] {INF, 0});
		assertEquals(2, hessian[0][0], 1e-6);
		assertEquals(1, hessian[0][1], 1e-6);
		assertEquals(1, hessian[1][0], 1e-6);
		assertEquals(20, hessian[1][1], 1e-6);
	}

	@Test
	public void differentialEvolutionFindsTheBottomOfABowl() {
		Optimize.Optimum optimum = Optimize.differential_evolution(
			  BOWL, new double[] {0, 0}, new double[] {3, 3}, new double[] {-5, -5}, new double[] {5, 5},
			  5000, 20, 0.7, 0.3, 0.0, 1e-10, new Random(0), null);
		assertTrue(optimum.success(), optimum.message());
		assertArrayEquals(new double[] {1, -2}, optimum.location(), 1e-3);
		assertNull(optimum.hessian());
		for (double x: optimum.location())
			assertTrue(x >= -5 && x <= 5);
	}

	@Test
	public void differentialEvolutionIsReproducible() {
		Minimizer minimizer = Minimizer.differentialEvolution(0.5, 50, 0, 42);
		Optimize.Optimum first = minimizer.minimize(
			  ROSENBROCK, new double[] {0, 0}, new double[] {-2, -2}, new double[] {2, 2});
		Optimize.Optimum twoth = minimizer.minimize(
			  ROSENBROCK, new double[] {0, 0}, new double[] {-2, -2}, new double[] {2, 2});
		assertArrayEquals(first.location(), twoth.location());
		assertEquals(first.evaluations(), twoth.evaluations());
		assertEquals("differential-evolution", minimizer.getName());
	}

	@Test
	public void minimizerFactories() {
		Minimizer minimizer = Minimizer.levenbergMarquardt();
		assertEquals("levenberg-marquardt", minimizer.getName());
		Optimize.Optimum optimum = minimizer.minimize(
			  BOWL, new double[] {0, 0}, new double[] {-INF, -INF}, new double[] {INF, INF});
		assertTrue(optimum.success());
		assertArrayEquals(new double[] {1, -2}, optimum.location(), 1e-3);
	}
}
