package com.github.micycle1.curvefit.conic;

import java.util.Objects;

import org.ejml.data.Complex_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import org.ejml.dense.row.SingularOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import org.ojalgo.matrix.decomposition.LU;
import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.R064Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.curvefit.DegenerateGeometryException;
import com.github.micycle1.curvefit.ShapeException;

/**
 * <p>
 * Direct least-squares ellipse fit after Halir and Flusser, "Numerically stable
 * direct least squares fitting of ellipses" (WSCG 1998).
 * </p>
 *
 * <p>
 * The design matrix is split into a quadratic part {@code D1 = [x^2, xy, y^2]}
 * and a linear part {@code D2 = [x, y, 1]}, giving scatter matrices
 * {@code S1 = D1'D1}, {@code S2 = D1'D2} and {@code S3 = D2'D2}. The linear
 * coefficients are eliminated through {@code T = -inv(S3) S2'}, leaving the
 * 3x3 reduced eigenproblem
 * </p>
 *
 * <pre>
 * M = inv(C) (S1 + S2 T),   C = [[0, 0, 2], [0, -1, 0], [2, 0, 0]]
 * </pre>
 *
 * <p>
 * whose eigenvector with {@code 4 e0 e2 - e1^2 > 0} holds the quadratic
 * coefficients of the ellipse. The linear coefficients follow as
 * {@code T e}.
 * </p>
 */
public final class ConicEstimator {

	private static final Logger LOGGER = LoggerFactory.getLogger(ConicEstimator.class);

	/** Fewest points that determine a conic. */
	public static final int MIN_POINTS = 5;

	// relative to the Frobenius norm of the reduced matrix
	static final double EIGENVALUE_TOLERANCE = 1e-9;

	// inv(C), constant
	private static final DMatrixRMaj C_INV = new DMatrixRMaj(new double[][] { //
			{ 0, 0, 0.5 }, //
			{ 0, -1, 0 }, //
			{ 0.5, 0, 0 } });

	private ConicEstimator() {
	}

	/**
	 * Fits an ellipse to the points {@code (x[i], y[i])}.
	 *
	 * @throws ShapeException               if the arrays differ in length or hold
	 *                                      fewer than {@link #MIN_POINTS} points
	 * @throws DegenerateGeometryException  if the linear scatter matrix is
	 *                                      singular or there is not exactly one
	 *                                      ellipse-valid eigenvector
	 */
	public static ConicCoefficients fitEllipse(double[] x, double[] y) {
		Objects.requireNonNull(x, "x must not be null");
		Objects.requireNonNull(y, "y must not be null");
		if (x.length != y.length) {
			throw new ShapeException("'x' and 'y' number of rows must be identical (" + x.length + " vs " + y.length + ")");
		}
		final int n = x.length;
		if (n < MIN_POINTS) {
			throw new ShapeException("At least " + MIN_POINTS + " points are required to fit an ellipse, got " + n);
		}

		DMatrixRMaj d1 = new DMatrixRMaj(n, 3);
		DMatrixRMaj d2 = new DMatrixRMaj(n, 3);
		for (int i = 0; i < n; i++) {
			d1.set(i, 0, x[i] * x[i]);
			d1.set(i, 1, x[i] * y[i]);
			d1.set(i, 2, y[i] * y[i]);
			d2.set(i, 0, x[i]);
			d2.set(i, 1, y[i]);
			d2.set(i, 2, 1.0);
		}

		DMatrixRMaj s1 = new DMatrixRMaj(3, 3);
		DMatrixRMaj s2 = new DMatrixRMaj(3, 3);
		DMatrixRMaj s3 = new DMatrixRMaj(3, 3);
		CommonOps_DDRM.multTransA(d1, d1, s1);
		CommonOps_DDRM.multTransA(d1, d2, s2);
		CommonOps_DDRM.multTransA(d2, d2, s3);

		DMatrixRMaj t = reduction(s2, s3);

		// M = inv(C) (S1 + S2 T)
		DMatrixRMaj s2t = new DMatrixRMaj(3, 3);
		CommonOps_DDRM.mult(s2, t, s2t);
		CommonOps_DDRM.addEquals(s2t, s1);
		DMatrixRMaj m = new DMatrixRMaj(3, 3);
		CommonOps_DDRM.mult(C_INV, s2t, m);

		DMatrixRMaj quadratic = ellipseEigenvector(m);
		DMatrixRMaj linear = new DMatrixRMaj(3, 1);
		CommonOps_DDRM.mult(t, quadratic, linear);

		ConicCoefficients coefs = new ConicCoefficients(quadratic.get(0), quadratic.get(1), quadratic.get(2), linear.get(0),
				linear.get(1), linear.get(2));
		LOGGER.debug("Fitted conic {} to {} points", coefs, n);
		return coefs;
	}

	/**
	 * {@code T = -inv(S3) S2'}, computed as the LU solution of
	 * {@code S3 T = -S2'}.
	 */
	static DMatrixRMaj reduction(DMatrixRMaj s2, DMatrixRMaj s3) {
		final R064Store a = R064Store.FACTORY.make(3, 3);
		final R064Store rhs = R064Store.FACTORY.make(3, 3);
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				a.set(i, j, s3.get(i, j));
				rhs.set(i, j, -s2.get(j, i));
			}
		}

		final LU<Double> lu = LU.R064.make();
		if (!lu.decompose(a) || !lu.isSolvable()) {
			throw new DegenerateGeometryException("Linear scatter matrix is singular (collinear points?)");
		}
		final MatrixStore<Double> solution = lu.getSolution(rhs);

		DMatrixRMaj t = new DMatrixRMaj(3, 3);
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				t.set(i, j, solution.doubleValue(i, j));
			}
		}
		return t;
	}

	/**
	 * Returns the unique real eigenvector of {@code m} with a non-negative
	 * eigenvalue that satisfies the ellipse constraint
	 * {@code 4 e0 e2 - e1^2 > 0}.
	 */
	static DMatrixRMaj ellipseEigenvector(DMatrixRMaj m) {
		EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(3, true);
		if (!eig.decompose(m.copy())) {
			throw new DegenerateGeometryException("Eigen decomposition of the reduced scatter matrix failed");
		}

		// the ellipse solution has a non-negative eigenvalue; the remaining ones are
		// negative and may share a 2D eigenspace
		final double floor = -EIGENVALUE_TOLERANCE * NormOps_DDRM.normF(m);
		DMatrixRMaj selected = null;
		int matches = 0;
		for (int i = 0; i < eig.getNumberOfEigenvalues(); i++) {
			Complex_F64 value = eig.getEigenvalue(i);
			if (!value.isReal() || value.getReal() < floor) {
				continue;
			}
			DMatrixRMaj v = eig.getEigenVector(i);
			if (v == null) {
				v = nullVector(m, value.getReal());
			}
			double con = 4 * v.get(0) * v.get(2) - v.get(1) * v.get(1);
			if (con > 0) {
				selected = v;
				matches++;
			}
		}

		if (matches != 1) {
			throw new DegenerateGeometryException("Expected exactly one ellipse-valid eigenvector but found " + matches);
		}
		// unit length, a > 0
		double norm = NormOps_DDRM.normF(selected);
		CommonOps_DDRM.divide(selected, selected.get(0) < 0 ? -norm : norm);
		return selected;
	}

	// eigenvector of m for eigenvalue lambda, as the right null vector of (m - lambda I)
	private static DMatrixRMaj nullVector(DMatrixRMaj m, double lambda) {
		DMatrixRMaj shifted = m.copy();
		for (int i = 0; i < 3; i++) {
			shifted.add(i, i, -lambda);
		}
		SingularValueDecomposition_F64<DMatrixRMaj> svd = DecompositionFactory_DDRM.svd(3, 3, true, true, false);
		if (!svd.decompose(shifted)) {
			throw new DegenerateGeometryException("SVD failed while recovering an eigenvector");
		}
		return SingularOps_DDRM.nullVector(svd, true, null);
	}
}
