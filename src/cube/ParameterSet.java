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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * an ordered collection of named parameters, plus the covariance matrix of whichever of them were free when it was
 * last computed.  the order of the parameters is the order in which the optimizer sees them.
 *
 * a set can be built by concatenating other sets, each under a tag (that's how a sky model exposes its spatial and
 * spectral parameters as one).  the concatenated set shares its Parameter objects with its members, and any
 * covariance assigned to it is handed down to the members in pieces, so a member set always knows its own errors.
 */
public class ParameterSet implements Iterable<Parameter> {
	private final List<String> names;
	private final List<Parameter> parameters;
	private final List<String> memberTags;
	private final List<ParameterSet> members;
	private Matrix covariance;
	private int[] covarianceIndices;

	/**
	 * build a flat set whose qualified names are just the parameters' own names.
	 */
	public ParameterSet(Parameter... parameters) {
		this(Arrays.asList(parameters));
	}

	public ParameterSet(List<Parameter> parameters) {
		this.names = new ArrayList<>(parameters.size());
		this.parameters = new ArrayList<>(parameters);
		for (Parameter parameter: parameters) {
			if (names.contains(parameter.getName()))
				throw new IllegalArgumentException("there are two parameters called "+parameter.getName());
			names.add(parameter.getName());
		}
		this.memberTags = Collections.emptyList();
		this.members = Collections.emptyList();
	}

	private ParameterSet(List<String> names, List<Parameter> parameters,
	                     List<String> memberTags, List<ParameterSet> members) {
		this.names = names;
		this.parameters = parameters;
		this.memberTags = memberTags;
		this.members = members;
	}

	/**
	 * join several sets into one, qualifying each parameter's name with the tag of the set it came from
	 * ("spatial.lon_0").  the parameters themselves are shared, not copied.
	 * @param tagged the member sets, in order, keyed by tag
	 */
	public static ParameterSet concatenate(Map<String, ParameterSet> tagged) {
		List<String> names = new ArrayList<>();
		List<Parameter> parameters = new ArrayList<>();
		for (Map.Entry<String, ParameterSet> entry: tagged.entrySet()) {
			ParameterSet member = entry.getValue();
			for (int i = 0; i < member.size(); i ++) {
				names.add(entry.getKey() + "." + member.names.get(i));
				parameters.add(member.parameters.get(i));
			}
		}
		return new ParameterSet(names, parameters,
		                        new ArrayList<>(tagged.keySet()),
		                        new ArrayList<>(tagged.values()));
	}

	/**
	 * look up a parameter by its qualified name or, failing that, by its own name if exactly one member has it.
	 * @throws ParameterNotFoundException if nothing matches
	 * @throws IllegalArgumentException if the unqualified name is shared by several parameters
	 */
	public Parameter get(String name) {
		return parameters.get(indexOf(name));
	}

	private int indexOf(String name) {
		int index = names.indexOf(name);
		if (index >= 0)
			return index;
		for (int i = 0; i < parameters.size(); i ++) {
			if (parameters.get(i).getName().equals(name)) {
				if (index >= 0)
					throw new IllegalArgumentException(String.format(
						  "'%s' is ambiguous between %s and %s", name, names.get(index), names.get(i)));
				index = i;
			}
		}
		if (index < 0)
			throw new ParameterNotFoundException(name);
		return index;
	}

	public boolean contains(String name) {
		try {
			indexOf(name);
			return true;
		} catch (ParameterNotFoundException e) {
			return false;
		}
	}

	public int size() {
		return parameters.size();
	}

	public List<String> getNames() {
		return Collections.unmodifiableList(names);
	}

	@Override
	public Iterator<Parameter> iterator() {
		return Collections.unmodifiableList(parameters).iterator();
	}

	/**
	 * @return the parameters that aren't frozen, in declaration order
	 */
	public List<Parameter> freeParameters() {
		List<Parameter> free = new ArrayList<>(parameters.size());
		for (Parameter parameter: parameters)
			if (!parameter.isFrozen())
				free.add(parameter);
		return free;
	}

	public int numFree() {
		return freeParameters().size();
	}

	private int[] freeIndices() {
		int[] indices = new int[numFree()];
		int k = 0;
		for (int i = 0; i < parameters.size(); i ++)
			if (!parameters.get(i).isFrozen())
				indices[k ++] = i;
		return indices;
	}

	public double[] getFreeValues() {
		List<Parameter> free = freeParameters();
		double[] values = new double[free.size()];
		for (int i = 0; i < values.length; i ++)
			values[i] = free.get(i).getValue();
		return values;
	}

	/**
	 * assign every free parameter at once.
	 * @param values the new values, in the order of {@link #freeParameters()}
	 * @throws ShapeMismatchException if there isn't exactly one value per free parameter
	 */
	public void setFreeValues(double[] values) {
		List<Parameter> free = freeParameters();
		if (values.length != free.size())
			throw new ShapeMismatchException("expected "+free.size()+" free values but got "+values.length);
		for (int i = 0; i < values.length; i ++)
			free.get(i).setValue(values[i]);
	}

	public double[] getFreeFactors() {
		List<Parameter> free = freeParameters();
		double[] factors = new double[free.size()];
		for (int i = 0; i < factors.length; i ++)
			factors[i] = free.get(i).getFactor();
		return factors;
	}

	/**
	 * @throws ShapeMismatchException if there isn't exactly one factor per free parameter
	 */
	public void setFreeFactors(double[] factors) {
		List<Parameter> free = freeParameters();
		if (factors.length != free.size())
			throw new ShapeMismatchException("expected "+free.size()+" free factors but got "+factors.length);
		for (int i = 0; i < factors.length; i ++)
			free.get(i).setFactor(factors[i]);
	}

	/**
	 * @return the bounds of the free parameters in factor space, as {lower, upper}, with infinities where
	 *         there's no bound
	 */
	public double[][] getFreeFactorBounds() {
		List<Parameter> free = freeParameters();
		double[][] bounds = new double[2][free.size()];
		for (int i = 0; i < free.size(); i ++) {
			bounds[0][i] = free.get(i).getFactorMin();
			bounds[1][i] = free.get(i).getFactorMax();
		}
		return bounds;
	}

	public void autoscale() {
		for (Parameter parameter: parameters)
			parameter.autoscale();
	}

	/**
	 * @return the covariance of the parameters that were free when it was set, or null if there is none
	 */
	public Matrix getCovariance() {
		return (covariance == null) ? null : covariance.copy();
	}

	/**
	 * attach a covariance matrix, indexed like {@link #freeParameters()}.  this also sets the error of each free
	 * parameter and passes the relevant blocks down to any member sets.  pass null to clear it.
	 * @throws ShapeMismatchException if the matrix isn't n×n for n free parameters
	 * @throws IllegalArgumentException if the matrix isn't symmetric with a nonnegative diagonal
	 */
	public void setCovariance(Matrix covariance) {
		if (covariance == null)
			assignCovariance(null, null);
		else
			assignCovariance(covariance.copy(), freeIndices());
	}

	/**
	 * attach a covariance computed in factor space, converting it to value space with each parameter's scale.
	 */
	public void setCovarianceFactors(Matrix factorCovariance) {
		List<Parameter> free = freeParameters();
		if (factorCovariance.m != free.size() || factorCovariance.n != free.size())
			throw new ShapeMismatchException(String.format(
				  "a %d×%d covariance doesn't fit %d free parameters", factorCovariance.m, factorCovariance.n, free.size()));
		Matrix converted = Matrix.zeros(free.size(), free.size());
		for (int i = 0; i < free.size(); i ++)
			for (int j = 0; j < free.size(); j ++)
				converted.set(i, j, factorCovariance.get(i, j)*free.get(i).getScale()*free.get(j).getScale());
		assignCovariance(converted, freeIndices());
	}

	private void assignCovariance(Matrix covariance, int[] indices) {
		for (Parameter parameter: parameters)
			parameter.setError(Double.NaN);
		if (covariance == null) {
			this.covariance = null;
			this.covarianceIndices = null;
		}
		else {
			if (covariance.m != indices.length || covariance.n != indices.length)
				throw new ShapeMismatchException(String.format(
					  "a %d×%d covariance doesn't fit %d free parameters", covariance.m, covariance.n, indices.length));
			if (!covariance.isFinite() || !covariance.isSymmetric(1e-6))
				throw new IllegalArgumentException("a covariance matrix must be finite and symmetric");
			for (int i = 0; i < indices.length; i ++)
				if (covariance.get(i, i) < 0)
					throw new IllegalArgumentException("a covariance matrix can't have negative variances");
			this.covariance = covariance;
			this.covarianceIndices = indices;
			for (int i = 0; i < indices.length; i ++)
				parameters.get(indices[i]).setError(Math.sqrt(covariance.get(i, i)));
		}

		int offset = 0;
		for (ParameterSet member: members) {
			if (covariance == null) {
				member.assignCovariance(null, null);
			}
			else {
				List<Integer> local = new ArrayList<>();
				List<Integer> global = new ArrayList<>();
				for (int k = 0; k < indices.length; k ++) {
					if (indices[k] >= offset && indices[k] < offset + member.size()) {
						local.add(indices[k] - offset);
						global.add(k);
					}
				}
				member.assignCovariance(
					  covariance.submatrix(global.stream().mapToInt(Integer::intValue).toArray()),
					  local.stream().mapToInt(Integer::intValue).toArray());
			}
			offset += member.size();
		}
	}

	/**
	 * @return the one-sigma error of the named parameter, from the covariance diagonal
	 * @throws ParameterNotFoundException if there's no such parameter
	 * @throws ErrorNotAvailableException if it's frozen or there's no covariance that covers it
	 */
	public double error(String name) {
		int index = indexOf(name);
		if (parameters.get(index).isFrozen())
			throw new ErrorNotAvailableException(names.get(index)+" is frozen, so it has no error");
		int k = covarianceIndexOf(index);
		return Math.sqrt(covariance.get(k, k));
	}

	/**
	 * @return the correlation coefficient of two parameters, from the covariance
	 * @throws ErrorNotAvailableException if the covariance doesn't cover both of them
	 */
	public double correlation(String a, String b) {
		int i = covarianceIndexOf(indexOf(a));
		int j = covarianceIndexOf(indexOf(b));
		return covariance.get(i, j)/Math.sqrt(covariance.get(i, i)*covariance.get(j, j));
	}

	private int covarianceIndexOf(int index) {
		if (covariance == null)
			throw new ErrorNotAvailableException("no covariance has been computed for these parameters");
		for (int k = 0; k < covarianceIndices.length; k ++)
			if (covarianceIndices[k] == index)
				return k;
		throw new ErrorNotAvailableException(names.get(index)+" was not free when the covariance was computed");
	}

	/**
	 * @return a deep copy of these parameters (bounds, frozen flags, and scales included) without the covariance
	 */
	public ParameterSet copy() {
		if (members.isEmpty()) {
			List<Parameter> copies = new ArrayList<>(parameters.size());
			for (Parameter parameter: parameters)
				copies.add(parameter.copy());
			return new ParameterSet(new ArrayList<>(names), copies,
			                        Collections.emptyList(), Collections.emptyList());
		}
		else {
			Map<String, ParameterSet> copies = new LinkedHashMap<>();
			for (int i = 0; i < members.size(); i ++)
				copies.put(memberTags.get(i), members.get(i).copy());
			return concatenate(copies);
		}
	}

	/**
	 * give this set the same covariance as another set with the same layout, such as the one it was copied from.
	 */
	public void copyCovarianceFrom(ParameterSet source) {
		if (source.size() != this.size())
			throw new ShapeMismatchException("can't copy a covariance between sets of "+source.size()+" and "+this.size());
		if (source.covariance == null)
			assignCovariance(null, null);
		else
			assignCovariance(source.covariance.copy(), source.covarianceIndices.clone());
	}

	/**
	 * the member set with the given tag
	 * @throws ParameterNotFoundException if this set has no such member
	 */
	ParameterSet getMember(String tag) {
		int index = memberTags.indexOf(tag);
		if (index < 0)
			throw new ParameterNotFoundException(tag);
		return members.get(index);
	}

	@Override
	public String toString() {
		StringBuilder s = new StringBuilder(String.format(Locale.US, "%-20s %12s %10s %-18s %10s %10s %s%n",
		                                                  "name", "value", "error", "unit", "min", "max", "frozen"));
		for (int i = 0; i < parameters.size(); i ++) {
			Parameter p = parameters.get(i);
			s.append(String.format(Locale.US, "%-20s %12.5g %10.3g %-18s %10.3g %10.3g %s%n",
			                       names.get(i), p.getValue(), p.getError(), p.getUnit(),
			                       p.getMin(), p.getMax(), p.isFrozen()));
		}
		return s.toString();
	}
}
