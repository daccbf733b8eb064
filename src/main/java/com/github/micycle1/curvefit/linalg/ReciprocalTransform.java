package com.github.micycle1.curvefit.linalg;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.curvefit.DomainException;

/**
 * Rectangular hyperbola {@code y = a / x + b}: the design is
 * {@code [1 | X^-1]}, no log transform. Fitting rejects {@code x == 0};
 * prediction maps such rows to {@code NaN}.
 */
public final class ReciprocalTransform implements DesignTransform {

	static final ReciprocalTransform INSTANCE = new ReciprocalTransform();

	private ReciprocalTransform() {
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
	public void checkFitData(DMatrixRMaj x, DMatrixRMaj y) {
		for (int i = 0; i < x.getNumElements(); i++) {
			if (x.data[i] == 0) {
				throw new DomainException("'x' must not contain zeros");
			}
		}
	}

	@Override
	public DMatrixRMaj predict(DMatrixRMaj x, DMatrixRMaj betas, boolean intercept) {
		DMatrixRMaj out = DesignTransform.super.predict(x, betas, intercept);
		for (int r = 0; r < x.numRows; r++) {
			for (int c = 0; c < x.numCols; c++) {
				if (x.get(r, c) == 0) {
					for (int d = 0; d < out.numCols; d++) {
						out.set(r, d, Double.NaN);
					}
					break;
				}
			}
		}
		return out;
	}

	@Override
	public DMatrixRMaj expand(DMatrixRMaj x) {
		DMatrixRMaj out = new DMatrixRMaj(x.numRows, x.numCols);
		for (int i = 0; i < x.getNumElements(); i++) {
			out.data[i] = 1.0 / x.data[i];
		}
		return out;
	}

	@Override
	public String name() {
		return "hyperbolic";
	}
}
