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
 * a spectrum that curves in log-log space, A (E/E0)^(-α - β ln(E/E0)).
 */
public class LogParabola implements SpectralModel {
	private final Parameter amplitude;
	private final Parameter reference;
	private final Parameter alpha;
	private final Parameter beta;
	private final ParameterSet parameters;

	/**
	 * @param amplitude the differential flux at the reference energy (cm^-2 s^-1 TeV^-1)
	 * @param reference the reference energy E0 (TeV)
	 * @param alpha the spectral index at the reference energy
	 * @param beta the curvature
	 */
	public LogParabola(double amplitude, double reference, double alpha, double beta) {
		this(new Parameter("amplitude", amplitude, "cm-2 s-1 TeV-1"),
		     new Parameter("reference", reference, "TeV", Double.NaN, Double.NaN, true),
		     new Parameter("alpha", alpha, ""),
		     new Parameter("beta", beta, ""));
	}

	private LogParabola(Parameter amplitude, Parameter reference, Parameter alpha, Parameter beta) {
		this.amplitude = amplitude;
		this.reference = reference;
		this.alpha = alpha;
		this.beta = beta;
		this.parameters = new ParameterSet(amplitude, reference, alpha, beta);
	}

	@Override
	public double evaluate(double energy) {
		double x = energy/reference.getValue();
		return amplitude.getValue()*Math.pow(x, -alpha.getValue() - beta.getValue()*Math.log(x));
	}

	@Override
	public ParameterSet getParameters() {
		return parameters;
	}

	@Override
	public LogParabola copy() {
		return new LogParabola(amplitude.copy(), reference.copy(), alpha.copy(), beta.copy());
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "LogParabola(amplitude=%.4g, reference=%.4g, alpha=%.4f, beta=%.4f)",
		                     amplitude.getValue(), reference.getValue(), alpha.getValue(), beta.getValue());
	}
}
