package com.github.micycle1.curvefit.linalg;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

import com.github.micycle1.curvefit.DomainException;

/**
 * <p>
 * Power model {@code y = a * x1^b1 * ... * xk^bk}, linearized by taking logs:
 * the solve runs on {@code [1 | ln X]} against {@code ln Y}, then the intercept
 * row is mapped back through {@code exp} to give {@code a}.
 * </p>
 * Prediction evaluates the product directly rather than going through log
 * space.
 */
public final class LogTransform implements DesignTransform {

	static final LogTransform INSTANCE = new LogTransform();

	private LogTransform() {
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
		requirePositive(x, "x");
		requirePositive(y, "y");
	}

	private static void requirePositive(DMatrixRMaj m, String name) {
		for (int i = 0; i < m.getNumElements(); i++) {
			if (!(m.data[i] > 0)) {
				throw new DomainException("'" + name + "' must be positive only, found " + m.data[i]);
			}
		}
	}

	@Override
	public DMatrixRMaj expand(DMatrixRMaj x) {
		return log(x);
	}

	@Override
	public DMatrixRMaj target(DMatrixRMaj y) {
		return log(y);
	}

	@Override
	public void finish(DMatrixRMaj betas) {
		for (int c = 0; c < betas.numCols; c++) {
			betas.set(0, c, Math.exp(betas.get(0, c)));
		}
	}

	@Override
	public DMatrixRMaj predict(DMatrixRMaj x, DMatrixRMaj betas, boolean intercept) {
		final int dims = betas.numCols;
		DMatrixRMaj out = new DMatrixRMaj(x.numRows, dims);
		for (int r = 0; r < x.numRows; r++) {
			for (int d = 0; d < dims; d++) {
				double v = betas.get(0, d);
				for (int f = 0; f < x.numCols; f++) {
					v *= Math.pow(x.get(r, f), betas.get(f + 1, d));
				}
				out.set(r, d, v);
			}
		}
		return out;
	}

	private static DMatrixRMaj log(DMatrixRMaj m) {
		DMatrixRMaj out = new DMatrixRMaj(m.numRows, m.numCols);
		CommonOps_DDRM.elementLog(m, out);
		return out;
	}

	@Override
	public String name() {
		return "power";
	}
}
