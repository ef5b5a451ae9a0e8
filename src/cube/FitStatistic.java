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
 * a Poisson likelihood statistic, in the -2 ln L convention, so that a difference of 1 in the total corresponds to
 * one standard deviation in a single parameter.
 */
public enum FitStatistic {
	/**
	 * the Cash statistic, 2(μ - n ln μ).  it drops the terms that don't depend on the model, so its value at the
	 * optimum is not 0.
	 */
	CASH("cash") {
		@Override
		public double evaluate(double counts, double npred) {
			double μ = Math.max(npred, TRUNCATION_VALUE);
			return 2*(μ - counts*Math.log(μ));
		}
	},

	/**
	 * the Cash statistic with the model-independent terms put back, 2(μ - n + n ln(n/μ)), so a perfect model
	 * scores 0 and the total is a goodness of fit.
	 */
	CSTAT("cstat") {
		@Override
		public double evaluate(double counts, double npred) {
			double μ = Math.max(npred, TRUNCATION_VALUE);
			if (counts <= 0)
				return 2*μ;
			else
				return 2*(μ - counts + counts*Math.log(counts/μ));
		}
	};

	/** the smallest predicted count the statistic will take the log of */
	public static final double TRUNCATION_VALUE = 1e-25;

	private final String name;

	FitStatistic(String name) {
		this.name = name;
	}

	/**
	 * the contribution of a single bin
	 * @param counts the observed number of counts n
	 * @param npred the predicted number of counts μ
	 */
	public abstract double evaluate(double counts, double npred);

	/**
	 * sum the statistic over every bin the mask selects
	 * @param mask the bins to include, or null for all of them
	 * @throws ShapeMismatchException if the cubes or the mask don't line up
	 */
	public double total(SkyCube counts, SkyCube npred, SkyMask mask) {
		if (!counts.sameShapeAs(npred))
			throw new ShapeMismatchException("the counts and predicted counts have different shapes");
		double[][][] n = counts.getData();
		double[][][] μ = npred.getData();
		if (mask != null && !mask.conformsTo(new int[] {n.length, n[0].length, n[0][0].length}))
			throw new ShapeMismatchException("the mask doesn't have the same shape as the counts");
		double total = 0;
		for (int e = 0; e < n.length; e ++)
			for (int i = 0; i < n[e].length; i ++)
				for (int j = 0; j < n[e][i].length; j ++)
					if (mask == null || mask.get(e, i, j))
						total += evaluate(n[e][i][j], μ[e][i][j]);
		return total;
	}

	public String getName() {
		return name;
	}
}
