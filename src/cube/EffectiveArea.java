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
 * the collecting area of the instrument as a function of true energy and offset from the pointing direction.
 */
@FunctionalInterface
public interface EffectiveArea {

	/**
	 * @param energy the true energy (TeV)
	 * @param offset the angle from the pointing direction (deg)
	 * @return the effective area (cm^2)
	 */
	double evaluate(double energy, double offset);

	/**
	 * the same area everywhere
	 */
	static EffectiveArea constant(double area) {
		return (energy, offset) -> area;
	}

	/**
	 * an area that falls off as a Gaussian away from the centre of the field of view
	 * @param area the on-axis area (cm^2)
	 * @param fieldOfView the standard deviation of the falloff (deg)
	 */
	static EffectiveArea gaussianFalloff(double area, double fieldOfView) {
		return (energy, offset) -> area*Math.exp(-offset*offset/(2*fieldOfView*fieldOfView));
	}
}
