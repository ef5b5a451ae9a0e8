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
 * a power-law spectrum, A (E/E0)^-Γ.  the reference energy is frozen because it's degenerate with the amplitude.
 */
public class PowerLaw implements SpectralModel {
	private final Parameter index;
	private final Parameter amplitude;
	private final Parameter reference;
	private final ParameterSet parameters;

	/**
	 * @param index the spectral index Γ
	 * @param amplitude the differential flux at the reference energy (cm^-2 s^-1 TeV^-1)
	 * @param reference the reference energy E0 (TeV)
	 */
	public PowerLaw(double index, double amplitude, double reference) {
		this(new Parameter("index", index, ""),
		     new Parameter("amplitude", amplitude, "cm-2 s-1 TeV-1"),
		     new Parameter("reference", reference, "TeV", Double.NaN, Double.NaN, true));
	}

	private PowerLaw(Parameter index, Parameter amplitude, Parameter reference) {
		this.index = index;
		this.amplitude = amplitude;
		this.reference = reference;
		this.parameters = new ParameterSet(index, amplitude, reference);
	}

	@Override
	public double evaluate(double energy) {
		return amplitude.getValue()*Math.pow(energy/reference.getValue(), -index.getValue());
	}

	@Override
	public ParameterSet getParameters() {
		return parameters;
	}

	@Override
	public PowerLaw copy() {
		return new PowerLaw(index.copy(), amplitude.copy(), reference.copy());
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "PowerLaw(index=%.4f, amplitude=%.4g, reference=%.4g)",
		                     index.getValue(), amplitude.getValue(), reference.getValue());
	}
}
