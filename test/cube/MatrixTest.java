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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MatrixTest {

	@Test
	public void inverseTimesMatrixIsIdentity() {
		Matrix a = new Matrix(new double[][] {
			  {4, 1, 0},
			  {1, 3, 1},
			  {0, 1, 2}});
		Matrix product = a.matmul(a.inverse());
		for (int i = 0; i < 3; i ++)
			for (int j = 0; j < 3; j ++)
				assertEquals((i == j) ? 1 : 0, product.get(i, j), 1e-12);
	}

	@Test
	public void singularInverseIsNotFinite() {
		Matrix singular = new Matrix(new double[][] {{1, 2}, {2, 4}});
		assertFalse(singular.inverse().isFinite());
		assertTrue(Matrix.zeros(0, 0).inverse().isFinite());
	}

	@Test
	public void submatrixPicksRowsAndCollums() {
		Matrix a = new Matrix(new double[][] {
			  {1, 2, 3},
			  {4, 5, 6},
			  {7, 8, 9}});
		Matrix sub = a.submatrix(new int[] {2, 0});
		assertArrayEquals(new double[][] {{9, 7}, {3, 1}}, sub.getValues());
		assertArrayEquals(new double[] {2, 5, 8}, a.getColumn(1).getValues());
	}

	@Test
	public void symmetryAllowsRoundoff() {
		Matrix nearly = new Matrix(new double[][] {{2, 1}, {1 + 1e-12, 3}});
		assertTrue(nearly.isSymmetric(1e-6));
		Matrix lopsided = new Matrix(new double[][] {{2, 1}, {0, 3}});
		assertFalse(lopsided.isSymmetric(1e-6));
	}

	@Test
	public void shapesAreChecked() {
		assertThrows(ShapeMismatchException.class, () -> new Matrix(new double[][] {{1, 2}, {3}}));
		assertThrows(ShapeMismatchException.class, () -> new Matrix(new double[][] {{1, 2}}).inverse());
		assertThrows(ShapeMismatchException.class, () -> new Vector(1, 2).dot(new Vector(1, 2, 3)));
	}

	@Test
	public void copiesAreIndependent() {
		Matrix a = Matrix.identity(2);
		Matrix b = a.copy();
		b.set(0, 1, 5);
		assertEquals(0, a.get(0, 1));
		double[][] values = a.getValues();
		values[1][1] = 7;
		assertEquals(1, a.get(1, 1));

		Vector v = new Vector(1, 2);
		Vector w = v.copy();
		w.set(0, 9);
		assertEquals(1, v.get(0));
	}

	@Test
	public void vectorArithmetic() {
		Vector v = new Vector(1, 2, 2);
		Vector w = new Vector(0, 1, -1);
		assertEquals(9, v.sqr());
		assertEquals(0, v.dot(w));
		assertArrayEquals(new double[] {1, 3, 1}, v.plus(w).getValues());
		assertArrayEquals(new double[] {-2, -4, -4}, v.times(-2).getValues());
		assertArrayEquals(new double[] {2, 7, 6}, new Matrix(new double[][] {
			  {2, 0, 0},
			  {1, 1, 2},
			  {0, 1, 2}}).matmul(v).getValues());
	}

	@Test
	public void gatherPicksComponents() {
		Vector v = Vector.gather(new double[] {5, 6, 7, 8}, new int[] {3, 1});
		assertArrayEquals(new double[] {8, 6}, v.getValues());
		assertEquals(0, Vector.gather(new double[] {1}, new int[0]).getLength());
	}
}
