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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EnergyDispersionTest {

	private static final EnergyAxis TRUE_ENERGY = EnergyAxis.logspace(0.1, 10, 3);
	private static final EnergyAxis RECO_ENERGY = EnergyAxis.logspace(0.1, 10, 2);

	@Test
	public void diagonalResponseSplitsBinsByLogOverlap() {
		Matrix pdf = EnergyDispersion.fromDiagonalResponse(TRUE_ENERGY, RECO_ENERGY).getPdfMatrix();
		assertEquals(3, pdf.m);
		assertEquals(2, pdf.n);
		assertEquals(1, pdf.get(0, 0), 1e-12);
		assertEquals(0, pdf.get(0, 1), 1e-12);
		assertEquals(0.5, pdf.get(1, 0), 1e-12);
		assertEquals(0.5, pdf.get(1, 1), 1e-12);
		assertEquals(0, pdf.get(2, 0), 1e-12);
		assertEquals(1, pdf.get(2, 1), 1e-12);
	}

	@Test
	public void foldingMovesCountsIntoRecoBins() {
		MapGeometry geometry = new MapGeometry(0, 0, 0.1, 3, 2, TRUE_ENERGY);
		SkyCube source = new SkyCube(geometry);
		source.set(0, 1, 2, 10);
		source.set(1, 1, 2, 4);
		source.set(2, 0, 0, 3);
		SkyCube folded = EnergyDispersion.fromDiagonalResponse(TRUE_ENERGY, RECO_ENERGY).apply(source);
		assertTrue(folded.getGeometry().getEnergy().conformsTo(RECO_ENERGY));
		assertEquals(12, folded.get(0, 1, 2), 1e-12);
		assertEquals(2, folded.get(1, 1, 2), 1e-12);
		assertEquals(3, folded.get(1, 0, 0), 1e-12);
		assertEquals(source.sum(), folded.sum(), 1e-12);
		assertEquals(10, source.get(0, 1, 2));
	}

	@Test
	public void identityLeavesTheCubeAlone() {
		MapGeometry geometry = new MapGeometry(0, 0, 0.1, 2, 2, TRUE_ENERGY);
		SkyCube source = SkyCube.filled(geometry, 2.5);
		SkyCube folded = EnergyDispersion.identity(TRUE_ENERGY).apply(source);
		for (int e = 0; e < 3; e ++)
			assertEquals(10, folded.sumSlice(e), 1e-12);
	}

	@Test
	public void gaussianDispersionIsAProbability() {
		EnergyAxis fine = EnergyAxis.logspace(0.1, 100, 30);
		Matrix narrow = EnergyDispersion.fromGauss(fine, fine, 0.01, 0).getPdfMatrix();
		for (int t = 0; t < narrow.m; t ++)
			assertEquals(1, narrow.get(t, t), 1e-6);

		Matrix wide = EnergyDispersion.fromGauss(fine, fine, 0.3, 0.1).getPdfMatrix();
		for (int t = 0; t < wide.m; t ++) {
			double total = 0;
			for (int r = 0; r < wide.n; r ++)
				total += wide.get(t, r);
			assertTrue(total <= 1 + 1e-6);
		}
		// a positive bias pushes events up in energy
		assertTrue(wide.get(15, 16) > wide.get(15, 14));
		// events near the edges get lost off the axis
		assertTrue(wide.get(0, 0) + wide.get(0, 1) + wide.get(0, 2) < 0.99);
	}

	@Test
	public void badMatricesAreRejected() {
		assertThrows(ShapeMismatchException.class,
		             () -> new EnergyDispersion(TRUE_ENERGY, RECO_ENERGY, Matrix.identity(3)));
		assertThrows(IllegalArgumentException.class,
		             () -> new EnergyDispersion(RECO_ENERGY, RECO_ENERGY, Matrix.diagonal(1.5, 1)));
		assertThrows(IllegalArgumentException.class,
		             () -> new EnergyDispersion(RECO_ENERGY, RECO_ENERGY, Matrix.diagonal(-0.1, 1)));
		EnergyDispersion edisp = EnergyDispersion.identity(RECO_ENERGY);
		assertThrows(ShapeMismatchException.class,
		             () -> edisp.apply(new SkyCube(new MapGeometry(0, 0, 0.1, 2, 2, TRUE_ENERGY))));
	}
}
