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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PSFKernelTest {

	private static final EnergyAxis ENERGY = EnergyAxis.logspace(0.1, 10, 2);
	private static final MapGeometry GEOMETRY = new MapGeometry(0, 0, 0.05, 41, 41, ENERGY);

	@Test
	public void gaussianKernelsAreNormalizedAndSymmetric() {
		PSFKernel psf = PSFKernel.gaussian(GEOMETRY, new double[] {0.1, 0.2}, 0.5);
		assertEquals(2, psf.getNumEnergyBins());
		for (int e = 0; e < 2; e ++) {
			double[][] kernel = psf.getKernel(e);
			assertEquals(1, kernel.length%2);
			assertEquals(1, Math2.sum(kernel), 1e-12);
			int r = kernel.length/2;
			assertEquals(kernel[r][r + 3], kernel[r + 3][r], 1e-15);
			assertEquals(kernel[r][r - 2], kernel[r][r + 2], 1e-15);
			assertTrue(kernel[r][r] > kernel[r][r + 1]);
		}
		int r = psf.getKernel(0).length/2;
		assertTrue(psf.getKernel(0)[r][r] > psf.getKernel(1)[r][r]);
	}

	@Test
	public void convolutionConservesCountsAwayFromTheEdge() {
		SkyCube source = new SkyCube(GEOMETRY);
		source.set(0, 20, 20, 100);
		source.set(1, 18, 23, 50);
		SkyCube blurred = PSFKernel.gaussian(GEOMETRY, 0.1, 0.3).apply(source);
		assertEquals(100, blurred.sumSlice(0), 1e-9);
		assertEquals(50, blurred.sumSlice(1), 1e-9);
		assertTrue(blurred.get(0, 20, 20) < 100);
		assertTrue(blurred.get(0, 20, 21) > 0);
		assertEquals(0, blurred.get(0, 0, 0));
		// the input is left alone
		assertEquals(100, source.get(0, 20, 20));
		assertEquals(150, source.sum());
	}

	@Test
	public void countsBlurredOffTheMapAreLost() {
		SkyCube source = new SkyCube(GEOMETRY);
		source.set(0, 0, 0, 1);
		SkyCube blurred = PSFKernel.gaussian(GEOMETRY, 0.1, 0.3).apply(source);
		assertTrue(blurred.sumSlice(0) < 0.5);
		assertTrue(blurred.sumSlice(0) > 0.2);
	}

	@Test
	public void deltaKernelChangesNothing() {
		SkyCube source = new SkyCube(GEOMETRY);
		for (int i = 0; i < 41; i ++)
			source.set(1, i, 40 - i, i);
		SkyCube blurred = PSFKernel.delta(GEOMETRY).apply(source);
		for (int e = 0; e < 2; e ++)
			for (int i = 0; i < 41; i ++)
				assertArrayEquals(source.getSlice(e)[i], blurred.getSlice(e)[i]);
	}

	@Test
	public void mismatchedGridsAreRejected() {
		PSFKernel psf = PSFKernel.gaussian(GEOMETRY, 0.1, 0.3);
		MapGeometry coarse = new MapGeometry(0, 0, 0.1, 21, 21, ENERGY);
		assertThrows(ShapeMismatchException.class, () -> psf.apply(new SkyCube(coarse)));
		MapGeometry moreEnergies = GEOMETRY.withEnergy(EnergyAxis.logspace(0.1, 10, 3));
		assertThrows(ShapeMismatchException.class, () -> psf.apply(new SkyCube(moreEnergies)));
		assertThrows(ShapeMismatchException.class,
		             () -> new PSFKernel(0.05, ENERGY, new double[][][] {{{0.5, 0.5}, {0, 0}}, {{1, 0}, {0, 0}}}));
		assertThrows(ShapeMismatchException.class,
		             () -> new PSFKernel(0.05, ENERGY, new double[][][] {{{1}}}));
		assertThrows(IllegalArgumentException.class,
		             () -> PSFKernel.gaussian(GEOMETRY, -0.1, 0.3));
	}
}
