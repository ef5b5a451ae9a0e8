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
 * a small dense matrix, big enough for Hessians and covariances and dispersion tables.
 */
public class Matrix {
	/** the number of rows */
	public final int m;
	/** the number of collums */
	public final int n;
	/** the data */
	private final Vector[] rows;

	/**
	 * generate a new matrix by giving dimensions and a list of rows.
	 */
	public Matrix(int m, int n, Vector[] rows) {
		this.m = m;
		if (rows.length != m)
			throw new ShapeMismatchException("the height doesn’t match the data.");
		this.n = n;
		for (Vector row: rows)
			if (row.getLength() != n)
				throw new ShapeMismatchException("do not accept jagged arrays.");
		this.rows = rows;
	}

	/**
	 * generate a new matrix by specifying all of its values explicitly.  the values are copied.
	 */
	public Matrix(double[][] values) {
		this.m = values.length;
		this.n = (values.length > 0) ? values[0].length : 0;
		this.rows = new Vector[m];
		for (int i = 0; i < m; i ++) {
			if (values[i].length != n)
				throw new ShapeMismatchException("do not accept jagged arrays.");
			this.rows[i] = new Vector(values[i].clone());
		}
	}

	/**
	 * generate a square diagonal matrix, given the diagonal values.
	 */
	public static Matrix diagonal(double... values) {
		Matrix result = zeros(values.length, values.length);
		for (int i = 0; i < values.length; i ++)
			result.set(i, i, values[i]);
		return result;
	}

	/**
	 * generate an identity matrix.
	 */
	public static Matrix identity(int n) {
		Matrix result = zeros(n, n);
		for (int i = 0; i < n; i ++)
			result.set(i, i, 1);
		return result;
	}

	/**
	 * generate a zero matrix.
	 */
	public static Matrix zeros(int m, int n) {
		Vector[] rows = new Vector[m];
		for (int i = 0; i < m; i ++)
			rows[i] = Vector.zeros(n);
		return new Matrix(m, n, rows);
	}

	public Matrix times(double a) {
		Vector[] rows = new Vector[m];
		for (int i = 0; i < m; i ++)
			rows[i] = this.rows[i].times(a);
		return new Matrix(m, n, rows);
	}

	public Vector matmul(double... v) {
		return this.matmul(new Vector(v));
	}

	public Vector matmul(Vector v) {
		if (v.getLength() != this.n)
			throw new ShapeMismatchException("the dimensions don't match.");
		double[] product = new double[this.m];
		for (int i = 0; i < this.m; i ++)
			product[i] = this.rows[i].dot(v);
		return new Vector(product);
	}

	public Matrix matmul(Matrix that) {
		if (this.n != that.m)
			throw new ShapeMismatchException("the matrix dimensions don't match");
		Matrix product = zeros(this.m, that.n);
		for (int j = 0; j < that.n; j ++) {
			Vector column = that.getColumn(j);
			for (int i = 0; i < this.m; i ++)
				product.set(i, j, this.rows[i].dot(column));
		}
		return product;
	}

	/**
	 * @return the inverse of this matrix.  a singular matrix will come back full of infs and NaNs rather than
	 * throwing, so check {@link #isFinite()} if you care.
	 */
	public Matrix inverse() {
		if (this.m != this.n)
			throw new ShapeMismatchException("only square matrices have inverses, not "+m+"×"+n);
		return new Matrix(Math2.matinv(this.getValues()));
	}

	/**
	 * pull out the square block that sits on the given rows and collums
	 * @param indices the row (and collum) indices to keep, in the order they should appear
	 */
	public Matrix submatrix(int[] indices) {
		Matrix result = zeros(indices.length, indices.length);
		for (int i = 0; i < indices.length; i ++)
			for (int j = 0; j < indices.length; j ++)
				result.set(i, j, this.get(indices[i], indices[j]));
		return result;
	}

	/**
	 * @param tolerance the largest acceptable |a_ij - a_ji| relative to the larger of the two diagonal magnitudes
	 */
	public boolean isSymmetric(double tolerance) {
		if (this.m != this.n)
			return false;
		for (int i = 0; i < this.m; i ++) {
			for (int j = 0; j < i; j ++) {
				double size = Math.max(Math.sqrt(Math.abs(this.get(i, i)*this.get(j, j))), Double.MIN_NORMAL);
				if (Math.abs(this.get(i, j) - this.get(j, i)) > tolerance*size)
					return false;
			}
		}
		return true;
	}

	public boolean isFinite() {
		for (Vector row: this.rows)
			if (!row.isFinite())
				return false;
		return true;
	}

	public Matrix copy() {
		Vector[] rows = new Vector[this.rows.length];
		for (int i = 0; i < rows.length; i ++)
			rows[i] = this.rows[i].copy();
		return new Matrix(m, n, rows);
	}

	public void set(int i, int j, double a) {
		this.rows[i].set(j, a);
	}

	public double get(int i, int j) {
		return this.rows[i].get(j);
	}

	public Vector getColumn(int j) {
		Vector result = Vector.zeros(this.m);
		for (int i = 0; i < this.m; i ++)
			result.set(i, this.get(i, j));
		return result;
	}

	/**
	 * @return a fresh copy of the values as a 2D array
	 */
	public double[][] getValues() {
		double[][] values = new double[this.m][];
		for (int i = 0; i < this.m; i ++)
			values[i] = this.rows[i].getValues().clone();
		return values;
	}

	@Override
	public String toString() {
		if (this.m*this.n < 1000) {
			StringBuilder s = new StringBuilder(String.format("Matrix %d×%d [\n  ", m, n));
			for (int i = 0; i < this.m; i++) {
				for (int j = 0; j < this.n; j++) {
					s.append(String.format("%10.4g", this.get(i, j)));
					s.append("  ");
				}
				s.append("\n  ");
			}
			s.append("]");
			return s.toString();
		}
		else {
			return String.format("Matrix %d×%d [ … ]", m, n);
		}
	}

}
