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
 * the same surface brightness in every direction
 */
public class SkyDiffuseConstant implements SpatialModel {
	private final Parameter value;
	private final ParameterSet parameters;

	/**
	 * @param value the surface brightness (sr^-1)
	 */
	public SkyDiffuseConstant(double value) {
		this(new Parameter("value", value, "sr-1"));
	}

	private SkyDiffuseConstant(Parameter value) {
		this.value = value;
		this.parameters = new ParameterSet(value);
	}

	@Override
	public double evaluate(double lon, double lat) {
		return value.getValue();
	}

	@Override
	public ParameterSet getParameters() {
		return parameters;
	}

	@Override
	public SkyDiffuseConstant copy() {
		return new SkyDiffuseConstant(value.copy());
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "SkyDiffuseConstant(value=%.4g)", value.getValue());
	}
}
