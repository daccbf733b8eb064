package com.github.micycle1.curvefit.linalg;

import org.ejml.data.DMatrixRMaj;

/**
 * Polynomial expansion of order {@code n}: every predictor is raised,
 * independently, to the powers 1..n. Columns are grouped by power, so the
 * design reads {@code [X^1 | X^2 | ... | X^n]}. No cross terms.
 */
public final class PolynomialTransform implements DesignTransform {

	private final int order;

	public PolynomialTransform(int order) {
		if (order < 1) {
			throw new IllegalArgumentException("Polynomial order must be > 0 but was " + order);
		}
		this.order = order;
	}

	@Override
	public int arity() {
		return order;
	}

	@Override
	public DMatrixRMaj expand(DMatrixRMaj x) {
		final int k = x.numCols;
		DMatrixRMaj out = new DMatrixRMaj(x.numRows, k * order);
		for (int r = 0; r < x.numRows; r++) {
			for (int c = 0; c < k; c++) {
				double v = x.get(r, c);
				double p = 1.0;
				for (int i = 0; i < order; i++) {
					p *= v;
					out.set(r, i * k + c, p);
				}
			}
		}
		return out;
	}

	@Override
	public String name() {
		return "polynomial(" + order + ")";
	}
}
