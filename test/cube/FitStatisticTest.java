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

public class FitStatisticTest {

	@Test
	public void cashPerBin() {
		assertEquals(4, FitStatistic.CASH.evaluate(0, 2), 1e-12);
		assertEquals(2*(3 - 3*Math.log(3)), FitStatistic.CASH.evaluate(3, 3), 1e-12);
		assertEquals(2*(2 - 5*Math.log(2)), FitStatistic.CASH.evaluate(5, 2), 1e-12);
	}

	@Test
	public void cashIsTruncatedNearZero() {
		double floor = FitStatistic.CASH.evaluate(1, 0);
		assertTrue(Double.isFinite(floor));
		assertEquals(2*(FitStatistic.TRUNCATION_VALUE - Math.log(FitStatistic.TRUNCATION_VALUE)), floor, 1e-9);
		assertEquals(floor, FitStatistic.CASH.evaluate(1, -5), 1e-12);
	}

	@Test
	public void cstatIsZeroForAPerfectModel() {
		assertEquals(0, FitStatistic.CSTAT.evaluate(3, 3), 1e-12);
		assertEquals(4, FitStatistic.CSTAT.evaluate(0, 2), 1e-12);
		assertTrue(FitStatistic.CSTAT.evaluate(3, 4) > 0);
		// the two differ by a term that doesn't depend on the model
		double offset = FitStatistic.CASH.evaluate(7, 5) - FitStatistic.CSTAT.evaluate(7, 5);
		assertEquals(offset, FitStatistic.CASH.evaluate(7, 9) - FitStatistic.CSTAT.evaluate(7, 9), 1e-12);
	}

	@Test
	public void totalOnlyCountsMaskedInBins() {
		MapGeometry geometry = new MapGeometry(0, 0, 0.1, 3, 2, EnergyAxis.logspace(1, 10, 2));
		SkyCube counts = SkyCube.filled(geometry, 1);
		SkyCube npred = SkyCube.filled(geometry, 2);
		double perBin = FitStatistic.CASH.evaluate(1, 2);
		assertEquals(12*perBin, FitStatistic.CASH.total(counts, npred, null), 1e-9);

		boolean[][] image = {{true, false, false}, {false, false, true}};
		assertEquals(4*perBin, FitStatistic.CASH.total(counts, npred, new SkyMask(image)), 1e-9);
		assertEquals(0, FitStatistic.CASH.total(counts, npred, SkyMask.uniform(geometry, false)));

		boolean[][][] cube = new boolean[2][2][3];
		cube[1][0][1] = true;
		assertEquals(perBin, FitStatistic.CASH.total(counts, npred, new SkyMask(cube)), 1e-12);
	}

	@Test
	public void totalChecksShapes() {
		MapGeometry geometry = new MapGeometry(0, 0, 0.1, 3, 2, EnergyAxis.logspace(1, 10, 2));
		SkyCube counts = new SkyCube(geometry);
		SkyCube wider = new SkyCube(new MapGeometry(0, 0, 0.1, 4, 2, EnergyAxis.logspace(1, 10, 2)));
		assertThrows(ShapeMismatchException.class, () -> FitStatistic.CSTAT.total(counts, wider, null));
		SkyMask mask = new SkyMask(new boolean[2][2]);
		assertThrows(ShapeMismatchException.class, () -> FitStatistic.CSTAT.total(counts, counts, mask));
	}

	@Test
	public void names() {
		assertEquals("cash", FitStatistic.CASH.getName());
		assertEquals("cstat", FitStatistic.CSTAT.getName());
	}
}
