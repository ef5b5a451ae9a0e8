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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ParameterSetTest {

	private ParameterSet first;
	private ParameterSet second;
	private ParameterSet all;

	@BeforeEach
	public void setUp() {
		first = new ParameterSet(new Parameter("x", 1, "deg"),
		                         new Parameter("y", 2, "deg"));
		second = new ParameterSet(new Parameter("x", 3, ""),
		                          new Parameter("z", 4, "TeV", Double.NaN, Double.NaN, true));
		Map<String, ParameterSet> tagged = new LinkedHashMap<>();
		tagged.put("a", first);
		tagged.put("b", second);
		all = ParameterSet.concatenate(tagged);
	}

	@Test
	public void qualifiesNamesAndSharesParameters() {
		assertEquals(List.of("a.x", "a.y", "b.x", "b.z"), all.getNames());
		assertSame(first.get("x"), all.get("a.x"));
		assertSame(second.get("z"), all.get("z"));
		assertEquals(3, all.get("b.x").getValue());

		all.get("a.y").setValue(5);
		assertEquals(5, first.get("y").getValue());
	}

	@Test
	public void lookupFailures() {
		assertThrows(ParameterNotFoundException.class, () -> all.get("w"));
		assertThrows(IllegalArgumentException.class, () -> all.get("x"));
		assertFalse(all.contains("w"));
		assertTrue(all.contains("y"));
		assertThrows(IllegalArgumentException.class,
		             () -> new ParameterSet(new Parameter("x", 0, ""), new Parameter("x", 1, "")));
	}

	@Test
	public void freeParametersSkipFrozenOnes() {
		assertEquals(3, all.numFree());
		assertArrayEquals(new double[] {1, 2, 3}, all.getFreeValues());
		all.setFreeValues(new double[] {-1, -2, -3});
		assertEquals(-3, second.get("x").getValue());
		assertEquals(4, second.get("z").getValue());
		assertThrows(ShapeMismatchException.class, () -> all.setFreeValues(new double[] {1, 2}));
		assertThrows(ShapeMismatchException.class, () -> all.setFreeFactors(new double[] {1, 2, 3, 4}));

		second.get("z").setFrozen(false);
		assertEquals(4, all.numFree());
	}

	@Test
	public void factorBoundsFollowTheScale() {
		ParameterSet set = new ParameterSet(new Parameter("amplitude", 2e-12, "", 0, 1e-10, false),
		                                    new Parameter("index", 2, ""));
		set.autoscale();
		assertArrayEquals(new double[] {2, 2}, set.getFreeFactors(), 1e-12);
		double[][] bounds = set.getFreeFactorBounds();
		assertEquals(0, bounds[0][0]);
		assertEquals(100, bounds[1][0], 1e-9);
		assertEquals(Double.NEGATIVE_INFINITY, bounds[0][1]);
		assertEquals(Double.POSITIVE_INFINITY, bounds[1][1]);
	}

	@Test
	public void covarianceIsHandedDownToMembers() {
		Matrix covariance = new Matrix(new double[][] {
			  {1, 1, 0},
			  {1, 4, 0},
			  {0, 0, 9}});
		all.setCovariance(covariance);

		assertEquals(2, all.error("a.y"), 1e-12);
		assertEquals(2, first.error("y"), 1e-12);
		assertEquals(3, second.error("x"), 1e-12);
		assertEquals(3, second.get("x").getError(), 1e-12);
		assertEquals(0.5, first.correlation("x", "y"), 1e-12);
		assertEquals(0, all.correlation("a.x", "b.x"), 1e-12);
		assertEquals(2, first.getCovariance().m);
		assertEquals(1, second.getCovariance().m);

		assertThrows(ErrorNotAvailableException.class, () -> all.error("z"));
		assertThrows(ErrorNotAvailableException.class, () -> second.error("z"));
	}

	@Test
	public void factorCovarianceIsConvertedToValueUnits() {
		ParameterSet set = new ParameterSet(new Parameter("amplitude", 3e-11, ""),
		                                    new Parameter("index", 2, ""));
		set.autoscale();
		set.setCovarianceFactors(Matrix.diagonal(4, 0.01));
		assertEquals(2e-11, set.error("amplitude"), 1e-24);
		assertEquals(0.1, set.error("index"), 1e-12);
		assertEquals(4e-22, set.getCovariance().get(0, 0), 1e-34);
	}

	@Test
	public void badCovariancesAreRejected() {
		assertThrows(ShapeMismatchException.class, () -> all.setCovariance(Matrix.identity(4)));
		assertThrows(IllegalArgumentException.class, () -> all.setCovariance(new Matrix(new double[][] {
			  {1, 0.5, 0},
			  {0, 1, 0},
			  {0, 0, 1}})));
		assertThrows(IllegalArgumentException.class, () -> all.setCovariance(Matrix.diagonal(1, -1, 1)));
		assertNull(all.getCovariance());
	}

	@Test
	public void errorsNeedACovariance() {
		assertThrows(ErrorNotAvailableException.class, () -> all.error("a.x"));
		assertTrue(Double.isNaN(all.get("a.x").getError()));

		all.setCovariance(Matrix.identity(3));
		all.setCovariance(null);
		assertThrows(ErrorNotAvailableException.class, () -> first.error("x"));
		assertTrue(Double.isNaN(first.get("x").getError()));
	}

	@Test
	public void copyIsDeepAndHasNoCovariance() {
		all.setCovariance(Matrix.identity(3));
		ParameterSet copy = all.copy();
		assertEquals(all.getNames(), copy.getNames());
		assertNotSame(all.get("a.x"), copy.get("a.x"));
		assertNull(copy.getCovariance());
		assertTrue(copy.get("b.z").isFrozen());

		copy.get("a.x").setValue(100);
		assertEquals(1, all.get("a.x").getValue());
		assertEquals(100, copy.getMember("a").get("x").getValue());

		copy.copyCovarianceFrom(all);
		assertEquals(1, copy.error("a.x"), 1e-12);
		assertEquals(1, copy.getMember("b").error("x"), 1e-12);
	}

	@Test
	public void tableListsEveryParameter() {
		String table = all.toString();
		for (String name: all.getNames())
			assertTrue(table.contains(name), table);
		assertTrue(table.contains("TeV"));
	}
}
