package com.github.micycle1.curvefit.linalg;

import org.ejml.data.DMatrixRMaj;

/**
 * Exponential model {@code y = a * base^x + b}: the design is
 * {@code [1 | base^X]}.
 */
public final class ExponentTransform implements DesignTransform {

	private final double base;

	public ExponentTransform(double base) {
		if (!(base > 0) || !Double.isFinite(base)) {
			throw new IllegalArgumentException("Exponential base must be a positive finite number but was " + base);
		}
		this.base = base;
	}

	@Override
	public int arity() {
		return 1;
	}

	@Override
	public boolean interceptOptional() {
		return false;
	}

	@Override
	public DMatrixRMaj expand(DMatrixRMaj x) {
		DMatrixRMaj out = new DMatrixRMaj(x.numRows, x.numCols);
		for (int i = 0; i < x.getNumElements(); i++) {
			out.data[i] = Math.pow(base, x.data[i]);
		}
		return out;
	}

	@Override
	public String name() {
		return "exponential(" + base + ")";
	}
}
