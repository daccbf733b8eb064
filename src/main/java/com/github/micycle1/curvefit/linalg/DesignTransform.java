package com.github.micycle1.curvefit.linalg;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * <p>
 * Strategy that turns raw predictors into the columns of a design matrix for a
 * particular model family. Every non-conic model is the same least-squares
 * solve run against a different {@code DesignTransform}.
 * </p>
 *
 * <p>
 * Implementations: {@link IdentityTransform}, {@link PolynomialTransform},
 * {@link LogTransform}, {@link ReciprocalTransform} and
 * {@link ExponentTransform}. The optional intercept column is added by
 * {@link DesignMatrixBuilder}, not by the transform.
 * </p>
 */
public interface DesignTransform {

	/** Number of design columns produced per predictor column. */
	int arity();

	/**
	 * Expands {@code x} (samples x k) into {@code samples x (arity * k)} design
	 * columns.
	 */
	DMatrixRMaj expand(DMatrixRMaj x);

	/** Short human-readable name, e.g. {@code "polynomial(3)"}. */
	String name();

	/**
	 * Whether the caller may exclude the intercept column. Families whose
	 * closed form depends on the constant term always include it.
	 */
	default boolean interceptOptional() {
		return true;
	}

	/**
	 * Rejects fit data outside the model's domain, before any estimation.
	 * Prediction never rejects: rows outside the domain come back as
	 * {@code NaN}.
	 */
	default void checkFitData(DMatrixRMaj x, DMatrixRMaj y) {
	}

	/** The target actually regressed on; identity unless the fit is in a transformed space. */
	default DMatrixRMaj target(DMatrixRMaj y) {
		return y;
	}

	/**
	 * Maps the raw solve output back to the model's published coefficients. Runs
	 * once, inside the fit, before the coefficients become observable.
	 */
	default void finish(DMatrixRMaj betas) {
	}

	/**
	 * Evaluates the fitted model at {@code x}. The default is the linear
	 * prediction {@code design(x) * betas}.
	 */
	default DMatrixRMaj predict(DMatrixRMaj x, DMatrixRMaj betas, boolean intercept) {
		DMatrixRMaj design = DesignMatrixBuilder.build(x, this, intercept);
		DMatrixRMaj out = new DMatrixRMaj(design.numRows, betas.numCols);
		CommonOps_DDRM.mult(design, betas, out);
		return out;
	}

	static DesignTransform identity() {
		return IdentityTransform.INSTANCE;
	}

	static DesignTransform polynomial(int n) {
		return new PolynomialTransform(n);
	}

	static DesignTransform log() {
		return LogTransform.INSTANCE;
	}

	static DesignTransform reciprocal() {
		return ReciprocalTransform.INSTANCE;
	}

	static DesignTransform exponent(double base) {
		return new ExponentTransform(base);
	}
}
