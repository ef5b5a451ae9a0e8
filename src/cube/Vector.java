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

/**
 * a column of numbers, the thing the optimizer steps around in.  the values sit in a plain array that the vector
 * owns, so wrap an array only if you're done with it.
 */
public class Vector {
	private final double[] values;

	/**
	 * wrap an array as a vector.  the array is not copied.
	 */
	public Vector(double... values) {
		this.values = values;
	}

	public static Vector zeros(int length) {
		return new Vector(new double[length]);
	}

	/**
	 * pull a subset of the components out of a full state
	 * @param full the complete state
	 * @param indices the components to keep, in the order they should appear
	 */
	public static Vector gather(double[] full, int[] indices) {
		double[] values = new double[indices.length];
		for (int k = 0; k < indices.length; k ++)
			values[k] = full[indices[k]];
		return new Vector(values);
	}

	public Vector plus(Vector that) {
		check_length(that);
		double[] sum = new double[values.length];
		for (int i = 0; i < values.length; i ++)
			sum[i] = this.values[i] + that.values[i];
		return new Vector(sum);
	}

	public Vector times(double scalar) {
		double[] product = new double[values.length];
		for (int i = 0; i < values.length; i ++)
			product[i] = this.values[i]*scalar;
		return new Vector(product);
	}

	public Vector neg() {
		return this.times(-1);
	}

	public double dot(Vector that) {
		check_length(that);
		double product = 0;
		for (int i = 0; i < values.length; i ++)
			product += this.values[i]*that.values[i];
		return product;
	}

	/**
	 * @return the square of the 2-norm
	 */
	public double sqr() {
		return this.dot(this);
	}

	public int getLength() {
		return values.length;
	}

	public double get(int i) {
		return values[i];
	}

	public void set(int i, double value) {
		values[i] = value;
	}

	/**
	 * @return the backing array itself, not a copy
	 */
	public double[] getValues() {
		return values;
	}

	public Vector copy() {
		return new Vector(values.clone());
	}

	/**
	 * @return whether every component is neither infinite nor NaN
	 */
	public boolean isFinite() {
		for (double x: values)
			if (!Double.isFinite(x))
				return false;
		return true;
	}

	private void check_length(Vector that) {
		if (that.values.length != this.values.length)
			throw new ShapeMismatchException(
				  "can't combine a "+that.values.length+"-vector with a "+this.values.length+"-vector");
	}

	@Override
	public String toString() {
		return "Vector"+Arrays.toString(values);
	}
}
