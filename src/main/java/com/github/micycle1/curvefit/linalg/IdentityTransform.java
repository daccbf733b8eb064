package com.github.micycle1.curvefit.linalg;

import org.ejml.data.DMatrixRMaj;

/**
 * Plain linear design: the predictors are used as they are.
 */
public final class IdentityTransform implements DesignTransform {

	static final IdentityTransform INSTANCE = new IdentityTransform();

	private IdentityTransform() {
	}

	@Override
	public int arity() {
		return 1;
	}

	@Override
	public DMatrixRMaj expand(DMatrixRMaj x) {
		return x.copy();
	}

	@Override
	public String name() {
		return "linear";
	}
}
