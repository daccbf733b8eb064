package com.github.micycle1.curvefit.linalg;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.curvefit.NumericalException;
import com.github.micycle1.curvefit.ShapeException;

/**
 * <p>
 * Ordinary least squares via the normal equations, solved with the
 * Moore-Penrose pseudo-inverse:
 * </p>
 *
 * <pre>
 * betas = pinv(D' D) D' Y
 * </pre>
 *
 * <p>
 * Using the pseudo-inverse rather than a direct inverse means a singular or
 * rank-deficient {@code D'D} still yields the minimum-norm solution instead of
 * failing. The result has one row per design column and one column per target
 * dimension.
 * </p>
 */
public final class LeastSquaresEstimator {

	private static final Logger LOGGER = LoggerFactory.getLogger(LeastSquaresEstimator.class);

	private LeastSquaresEstimator() {
	}

	/**
	 * @param design samples x p design matrix
	 * @param target samples x d target matrix
	 * @return p x d coefficient matrix
	 * @throws ShapeException     if the row counts differ
	 * @throws NumericalException if any coefficient is not a finite real
	 */
	public static DMatrixRMaj fit(DMatrixRMaj design, DMatrixRMaj target) {
		Objects.requireNonNull(design, "design must not be null");
		Objects.requireNonNull(target, "target must not be null");
		if (design.numRows != target.numRows) {
			throw new ShapeException("Design has " + design.numRows + " rows but target has " + target.numRows);
		}

		final int p = design.numCols;
		final int d = target.numCols;

		DMatrixRMaj dtd = new DMatrixRMaj(p, p);
		CommonOps_DDRM.multTransA(design, design, dtd);

		int rank = MatrixFeatures_DDRM.rank(dtd);
		if (rank < p) {
			LOGGER.warn("Normal matrix is rank deficient (rank {} < {}); using minimum-norm solution", rank, p);
		}

		DMatrixRMaj dtdInv = new DMatrixRMaj(p, p);
		CommonOps_DDRM.pinv(dtd, dtdInv);

		DMatrixRMaj dty = new DMatrixRMaj(p, d);
		CommonOps_DDRM.multTransA(design, target, dty);

		DMatrixRMaj betas = new DMatrixRMaj(p, d);
		CommonOps_DDRM.mult(dtdInv, dty, betas);

		requireFinite(betas);
		LOGGER.debug("Solved {}x{} least squares for {} target dimension(s)", design.numRows, p, d);
		return betas;
	}

	/**
	 * Applies {@code transform} (plus optional intercept) to {@code x}, then
	 * solves against {@code y} in the transform's target space and finishes the
	 * coefficients.
	 */
	public static DMatrixRMaj fit(DMatrixRMaj x, DMatrixRMaj y, DesignTransform transform, boolean intercept) {
		transform.checkFitData(x, y);
		DMatrixRMaj design = DesignMatrixBuilder.build(x, transform, intercept);
		DMatrixRMaj betas = fit(design, transform.target(y));
		transform.finish(betas);
		requireFinite(betas);
		return betas;
	}

	static void requireFinite(DMatrixRMaj betas) {
		for (int i = 0; i < betas.getNumElements(); i++) {
			if (!Double.isFinite(betas.data[i])) {
				throw new NumericalException("Non-real coefficient found: " + betas.data[i]);
			}
		}
	}
}
