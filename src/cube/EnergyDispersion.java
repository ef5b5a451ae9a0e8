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
 * the probability of an event in true-energy bin t being reconstructed in energy bin r, as a matrix whose rows are
 * true energies and whose collums are reconstructed energies.  a row may sum to less than 1 (events that migrate
 * outside the reconstructed range are lost) but never more.
 */
public class EnergyDispersion {
	private final EnergyAxis trueEnergy;
	private final EnergyAxis recoEnergy;
	private final Matrix pdf;

	/**
	 * @param pdf the migration matrix, [true][reco]
	 * @throws ShapeMismatchException if the matrix doesn't match the axes
	 * @throws IllegalArgumentException if it has negative entries or rows that sum to more than 1
	 */
	public EnergyDispersion(EnergyAxis trueEnergy, EnergyAxis recoEnergy, Matrix pdf) {
		if (pdf.m != trueEnergy.getNumBins() || pdf.n != recoEnergy.getNumBins())
			throw new ShapeMismatchException(String.format(
				  "a %d×%d dispersion matrix doesn't go from %d true bins to %d reconstructed bins",
				  pdf.m, pdf.n, trueEnergy.getNumBins(), recoEnergy.getNumBins()));
		for (int t = 0; t < pdf.m; t ++) {
			double total = 0;
			for (int r = 0; r < pdf.n; r ++) {
				if (!(pdf.get(t, r) >= 0) || !Double.isFinite(pdf.get(t, r)))
					throw new IllegalArgumentException("dispersion probabilities must be finite and nonnegative");
				total += pdf.get(t, r);
			}
			if (total > 1 + 1e-6)
				throw new IllegalArgumentException(String.format(
					  "row %d of the dispersion matrix sums to %.6f, which is more than 1", t, total));
		}
		this.trueEnergy = trueEnergy;
		this.recoEnergy = recoEnergy;
		this.pdf = pdf.copy();
	}

	/**
	 * perfect energy resolution on a single axis
	 */
	public static EnergyDispersion identity(EnergyAxis axis) {
		return new EnergyDispersion(axis, axis, Matrix.identity(axis.getNumBins()));
	}

	/**
	 * a dispersion with perfect resolution but different binning: each true bin is shared among the reconstructed
	 * bins it overlaps, in proportion to the overlap in log energy.
	 */
	public static EnergyDispersion fromDiagonalResponse(EnergyAxis trueEnergy, EnergyAxis recoEnergy) {
		Matrix pdf = Matrix.zeros(trueEnergy.getNumBins(), recoEnergy.getNumBins());
		for (int t = 0; t < pdf.m; t ++) {
			double lo = Math.log(trueEnergy.getEdge(t));
			double hi = Math.log(trueEnergy.getEdge(t + 1));
			for (int r = 0; r < pdf.n; r ++) {
				double overlap = Math.min(hi, Math.log(recoEnergy.getEdge(r + 1))) -
				                 Math.max(lo, Math.log(recoEnergy.getEdge(r)));
				if (overlap > 0)
					pdf.set(t, r, Math.min(1, overlap/(hi - lo)));
			}
		}
		return new EnergyDispersion(trueEnergy, recoEnergy, pdf);
	}

	/**
	 * a dispersion where ln(E_reco/E_true) is normally distributed
	 * @param sigma the standard deviation of ln(E_reco/E_true)
	 * @param bias the mean of ln(E_reco/E_true)
	 */
	public static EnergyDispersion fromGauss(EnergyAxis trueEnergy, EnergyAxis recoEnergy,
	                                         double sigma, double bias) {
		if (!(sigma > 0))
			throw new IllegalArgumentException("the energy resolution must be positive, not "+sigma);
		Matrix pdf = Matrix.zeros(trueEnergy.getNumBins(), recoEnergy.getNumBins());
		double a = sigma*Math.sqrt(2);
		for (int t = 0; t < pdf.m; t ++) {
			double center = trueEnergy.getCenter(t);
			for (int r = 0; r < pdf.n; r ++) {
				double lo = (Math.log(recoEnergy.getEdge(r)/center) - bias)/a;
				double hi = (Math.log(recoEnergy.getEdge(r + 1)/center) - bias)/a;
				pdf.set(t, r, Math.max(0, (Math2.erf(hi) - Math2.erf(lo))/2));
			}
		}
		return new EnergyDispersion(trueEnergy, recoEnergy, pdf);
	}

	/**
	 * fold a true-energy cube thru the dispersion, independently at every pixel.  the input is not modified.
	 * @param source a cube whose energy axis is this dispersion's true-energy axis
	 * @return the corresponding cube in reconstructed energy
	 */
	public SkyCube apply(SkyCube source) {
		MapGeometry geometry = source.getGeometry();
		if (!geometry.getEnergy().conformsTo(trueEnergy))
			throw new ShapeMismatchException("this dispersion doesn't start from the energy axis of "+geometry);
		double[][] matrix = pdf.getValues();
		SkyCube result = new SkyCube(geometry.withEnergy(recoEnergy));
		for (int t = 0; t < matrix.length; t ++) {
			double[][] input = source.getSlice(t);
			for (int r = 0; r < matrix[t].length; r ++) {
				double p = matrix[t][r];
				if (p != 0) {
					double[][] output = result.getSlice(r);
					for (int i = 0; i < input.length; i ++)
						for (int j = 0; j < input[i].length; j ++)
							output[i][j] += p*input[i][j];
				}
			}
		}
		return result;
	}

	public EnergyAxis getTrueEnergy() {
		return trueEnergy;
	}

	public EnergyAxis getRecoEnergy() {
		return recoEnergy;
	}

	/**
	 * @return a copy of the migration matrix, [true][reco]
	 */
	public Matrix getPdfMatrix() {
		return pdf.copy();
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "EnergyDispersion(%d true bins → %d reconstructed bins)",
		                     trueEnergy.getNumBins(), recoEnergy.getNumBins());
	}
}
