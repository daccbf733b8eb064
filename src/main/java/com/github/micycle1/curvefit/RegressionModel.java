package com.github.micycle1.curvefit;

import java.util.Objects;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.ejml.data.DMatrixRMaj;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.curvefit.linalg.DesignMatrixBuilder;
import com.github.micycle1.curvefit.linalg.DesignTransform;
import com.github.micycle1.curvefit.linalg.LeastSquaresEstimator;

/**
 * <p>
 * A least-squares regression model: one coefficient column per target
 * dimension, one coefficient row per design column. The model family is
 * entirely determined by its {@link DesignTransform}; the estimator is shared.
 * </p>
 *
 * <p>
 * Families:
 * </p>
 * <ul>
 * <li>{@link #linear(Object, Object, boolean) linear}: {@code y = b0 + X b}</li>
 * <li>{@link #polynomial(Object, Object, int, boolean) polynomial}:
 * {@code y = b0 + X b1 + X^2 b2 + ... + X^n bn}</li>
 * <li>{@link #power(Object, Object) power}: {@code y = b0 * x1^b1 * ... * xk^bk}
 * (fit in log space)</li>
 * <li>{@link #hyperbolic(Object, Object) hyperbolic}: {@code y = b0 + b1 / x}</li>
 * <li>{@link #exponential(Object, Object, double) exponential}:
 * {@code y = b0 + b1 * base^x}</li>
 * </ul>
 *
 * <p>
 * Inputs accept anything {@link Table#from(Object, String)} does. The fit runs
 * entirely inside construction and the instance is immutable afterwards.
 * </p>
 */
public final class RegressionModel {

	private static final Logger LOGGER = LoggerFactory.getLogger(RegressionModel.class);

	private final Table y;
	private final Table x;
	private final DesignTransform transform;
	private final boolean fitIntercept;
	private final DMatrixRMaj betas;
	private final double[] rSquared; // per target dimension

	private RegressionModel(Object y, Object x, DesignTransform transform, boolean fitIntercept) {
		this.transform = Objects.requireNonNull(transform, "transform must not be null");
		if (!fitIntercept && !transform.interceptOptional()) {
			throw new IllegalArgumentException("The " + transform.name() + " model always includes the intercept");
		}
		this.fitIntercept = fitIntercept;
		this.y = Table.from(y, "Y");
		this.x = Table.from(x, "X");
		if (this.x.rows() != this.y.rows()) {
			throw new ShapeException("'x' and 'y' number of rows must be identical (" + this.x.rows() + " vs " + this.y.rows() + ")");
		}

		this.betas = LeastSquaresEstimator.fit(this.x.matrix(), this.y.matrix(), transform, fitIntercept);

		DMatrixRMaj fitted = transform.predict(this.x.matrix(), betas, fitIntercept);
		this.rSquared = new double[this.y.cols()];
		for (int d = 0; d < rSquared.length; d++) {
			rSquared[d] = squaredCorrelation(this.y.column(d), column(fitted, d));
		}
		LOGGER.debug("Fitted {} model on {} samples, {} feature(s), {} target(s)", transform.name(), this.x.rows(),
				this.x.cols(), this.y.cols());
	}

	public static RegressionModel linear(Object y, Object x) {
		return linear(y, x, true);
	}

	public static RegressionModel linear(Object y, Object x, boolean fitIntercept) {
		return new RegressionModel(y, x, DesignTransform.identity(), fitIntercept);
	}

	public static RegressionModel polynomial(Object y, Object x, int n) {
		return polynomial(y, x, n, true);
	}

	/**
	 * @param n polynomial order, {@code > 0}
	 */
	public static RegressionModel polynomial(Object y, Object x, int n, boolean fitIntercept) {
		return new RegressionModel(y, x, DesignTransform.polynomial(n), fitIntercept);
	}

	/**
	 * Power model; every x and y value must be strictly positive.
	 *
	 * @throws DomainException if any value is {@code <= 0}
	 */
	public static RegressionModel power(Object y, Object x) {
		return new RegressionModel(y, x, DesignTransform.log(), true);
	}

	/**
	 * @throws DomainException if any x value is zero
	 */
	public static RegressionModel hyperbolic(Object y, Object x) {
		return new RegressionModel(y, x, DesignTransform.reciprocal(), true);
	}

	/** Exponential model with base {@code e}. */
	public static RegressionModel exponential(Object y, Object x) {
		return exponential(y, x, Math.E);
	}

	public static RegressionModel exponential(Object y, Object x, double base) {
		return new RegressionModel(y, x, DesignTransform.exponent(base), true);
	}

	/**
	 * Predicts the target for new predictors. The result has one column per
	 * target dimension, labelled as the training targets. Rows outside the
	 * model's domain (e.g. {@code x == 0} for a hyperbolic model) are
	 * {@code NaN}.
	 *
	 * @throws ShapeException if {@code x} has a different number of columns than
	 *                        the training predictors
	 */
	public Table predict(Object x) {
		Table v = Table.from(x, "X");
		if (v.cols() != this.x.cols()) {
			throw new ShapeException("Expected " + this.x.cols() + " predictor column(s) but got " + v.cols());
		}
		DMatrixRMaj out = transform.predict(v.matrix(), betas, fitIntercept);
		return Table.results(y.columnNames().toArray(new String[0]), out);
	}

	/** Coefficient table, rows {@code beta0..betaN}, one column per target dimension. */
	public Table betas() {
		return Table.of(y.columnNames().toArray(new String[0]), betas)
				.withRowLabels(DesignMatrixBuilder.coefficientLabels(betas.numRows, fitIntercept));
	}

	/**
	 * Squared Pearson correlation between the training targets and the model's
	 * predictions on the training predictors. Only defined for a model with a
	 * single target dimension; {@code NaN} when the targets are constant.
	 */
	public double rSquared() {
		if (rSquared.length != 1) {
			throw new ShapeException("R-squared is defined for a single target dimension, model has " + rSquared.length);
		}
		return rSquared[0];
	}

	/** As {@link #rSquared()}, for one target dimension of a multi-target model. */
	public double rSquared(int dimension) {
		Objects.checkIndex(dimension, rSquared.length);
		return rSquared[dimension];
	}

	public boolean fitIntercept() {
		return fitIntercept;
	}

	public DesignTransform transform() {
		return transform;
	}

	public int features() {
		return x.cols();
	}

	public int dimensions() {
		return y.cols();
	}

	private static double squaredCorrelation(double[] a, double[] b) {
		if (a.length < 2 || isConstant(a)) {
			return Double.NaN;
		}
		double r = new PearsonsCorrelation().correlation(a, b);
		return r * r;
	}

	private static boolean isConstant(double[] v) {
		for (double d : v) {
			if (d != v[0]) {
				return false;
			}
		}
		return true;
	}

	private static double[] column(DMatrixRMaj m, int col) {
		double[] out = new double[m.numRows];
		for (int r = 0; r < out.length; r++) {
			out[r] = m.get(r, col);
		}
		return out;
	}

	@Override
	public String toString() {
		return betas().toString();
	}
}
