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
 * a power law with an exponential cutoff, A (E/E0)^-Γ exp(-λE).
 */
public class ExponentialCutoffPowerLaw implements SpectralModel {
	private final Parameter index;
	private final Parameter amplitude;
	private final Parameter reference;
	private final Parameter lambda_;
	private final ParameterSet parameters;

	/**
	 * @param index the spectral index Γ
	 * @param amplitude the differential flux at the reference energy, not counting the cutoff (cm^-2 s^-1 TeV^-1)
	 * @param reference the reference energy E0 (TeV)
	 * @param lambda_ the inverse of the cutoff energy (TeV^-1)
	 */
	public ExponentialCutoffPowerLaw(double index, double amplitude, double reference, double lambda_) {
		this(new Parameter("index", index, ""),
		     new Parameter("amplitude", amplitude, "cm-2 s-1 TeV-1"),
		     new Parameter("reference", reference, "TeV", Double.NaN, Double.NaN, true),
		     new Parameter("lambda_", lambda_, "TeV-1"));
	}

	private ExponentialCutoffPowerLaw(Parameter index, Parameter amplitude, Parameter reference, Parameter lambda_) {
		this.index = index;
		this.amplitude = amplitude;
		this.reference = reference;
		this.lambda_ = lambda_;
		this.parameters = new ParameterSet(index, amplitude, reference, lambda_);
	}

	@Override
	public double evaluate(double energy) {
		return amplitude.getValue()*
		       Math.pow(energy/reference.getValue(), -index.getValue())*
		       Math.exp(-lambda_.getValue()*energy);
	}

	@Override
	public ParameterSet getParameters() {
		return parameters;
	}

	@Override
	public ExponentialCutoffPowerLaw copy() {
		return new ExponentialCutoffPowerLaw(index.copy(), amplitude.copy(), reference.copy(), lambda_.copy());
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "ExponentialCutoffPowerLaw(index=%.4f, amplitude=%.4g, reference=%.4g, lambda_=%.4g)",
		                     index.getValue(), amplitude.getValue(), reference.getValue(), lambda_.getValue());
	}
}
