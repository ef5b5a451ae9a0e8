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
 * a single named model parameter.  the optimizer never sees the value directly; it sees the factor, value/scale,
 * which {@link #autoscale()} keeps close to 1 so that parameters of wildly different magnitudes (a position in
 * degrees, a flux normalization of 1e-11) can share one finite-difference step size.
 */
public class Parameter {
	private final String name;
	private final String unit;
	private double value;
	private double scale;
	private double min;
	private double max;
	private boolean frozen;
	private double error;

	/**
	 * @param name the name of the parameter, unique within its model
	 * @param value the initial value
	 * @param unit the physical unit in which the value is expressed (may be empty)
	 */
	public Parameter(String name, double value, String unit) {
		this(name, value, unit, Double.NaN, Double.NaN, false);
	}

	/**
	 * @param min the lower bound, or NaN for none
	 * @param max the upper bound, or NaN for none
	 */
	public Parameter(String name, double value, String unit, double min, double max, boolean frozen) {
		if (name == null || name.isEmpty())
			throw new IllegalArgumentException("a parameter needs a name");
		if (!Double.isNaN(min) && !Double.isNaN(max) && min > max)
			throw new IllegalArgumentException("the bounds of "+name+" are backwards: ["+min+", "+max+"]");
		this.name = name;
		this.unit = (unit == null) ? "" : unit;
		this.min = min;
		this.max = max;
		this.frozen = frozen;
		this.scale = 1;
		this.error = Double.NaN;
		this.setValue(value);
	}

	/**
	 * build a parameter from a string like "0.2 deg" or "1e-11 cm-2 s-1 TeV-1".
	 */
	public static Parameter parse(String name, String quantity) {
		String trimmed = quantity.trim();
		int space = trimmed.indexOf(' ');
		String number = (space < 0) ? trimmed : trimmed.substring(0, space);
		String unit = (space < 0) ? "" : trimmed.substring(space + 1).trim();
		try {
			return new Parameter(name, Double.parseDouble(number), unit);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("can't read a number out of '"+quantity+"'", e);
		}
	}

	/**
	 * copy everything but the error, which belongs to whatever fit computed it.
	 */
	public Parameter copy() {
		Parameter copy = new Parameter(name, value, unit, min, max, frozen);
		copy.scale = this.scale;
		return copy;
	}

	public String getName() {
		return name;
	}

	public String getUnit() {
		return unit;
	}

	public double getValue() {
		return value;
	}

	/**
	 * @throws IllegalArgumentException if the value is NaN or falls outside the bounds
	 */
	public void setValue(double value) {
		if (Double.isNaN(value))
			throw new IllegalArgumentException(name+" can't be NaN");
		if ((!Double.isNaN(min) && value < min) || (!Double.isNaN(max) && value > max))
			throw new IllegalArgumentException(String.format(
				  "%s = %.6g is outside of its bounds [%.6g, %.6g]", name, value, min, max));
		this.value = value;
	}

	public double getScale() {
		return scale;
	}

	public void setScale(double scale) {
		if (!(scale > 0) || !Double.isFinite(scale))
			throw new IllegalArgumentException("the scale of "+name+" must be finite and positive");
		this.scale = scale;
	}

	public double getFactor() {
		return value/scale;
	}

	/**
	 * set the value by way of its factor.  rounding in factor*scale can push a value that the optimizer put
	 * exactly on a bound a hair past it, so the product gets clamped back in.
	 */
	public void setFactor(double factor) {
		this.setValue(Math2.clamp(factor*scale, min, max));
	}

	/**
	 * pick the scale as the power of ten of the current value, so the factor lands in [1, 10).
	 */
	public void autoscale() {
		if (value != 0 && Double.isFinite(value))
			this.scale = Math.pow(10, Math.floor(Math.log10(Math.abs(value))));
		else
			this.scale = 1;
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}

	/**
	 * @param min the new lower bound, or NaN to remove it
	 * @param max the new upper bound, or NaN to remove it
	 */
	public void setBounds(double min, double max) {
		if (!Double.isNaN(min) && !Double.isNaN(max) && min > max)
			throw new IllegalArgumentException("the bounds of "+name+" are backwards: ["+min+", "+max+"]");
		if ((!Double.isNaN(min) && value < min) || (!Double.isNaN(max) && value > max))
			throw new IllegalArgumentException(String.format(
				  "%s = %.6g is already outside of [%.6g, %.6g]", name, value, min, max));
		this.min = min;
		this.max = max;
	}

	/** the lower bound in factor space, or -∞ */
	double getFactorMin() {
		if (Double.isNaN(min))
			return Double.NEGATIVE_INFINITY;
		return min/scale;
	}

	/** the upper bound in factor space, or +∞ */
	double getFactorMax() {
		if (Double.isNaN(max))
			return Double.POSITIVE_INFINITY;
		return max/scale;
	}

	public boolean isFrozen() {
		return frozen;
	}

	public void setFrozen(boolean frozen) {
		this.frozen = frozen;
	}

	/**
	 * @return the one-sigma error from the last covariance assigned to the owning set, or NaN
	 */
	public double getError() {
		return error;
	}

	void setError(double error) {
		this.error = error;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "Parameter(name=%s, value=%.6g, error=%.3g, unit=%s, min=%.6g, max=%.6g, frozen=%b)",
		                     name, value, error, unit, min, max, frozen);
	}
}
