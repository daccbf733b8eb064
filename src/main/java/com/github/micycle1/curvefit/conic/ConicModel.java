package com.github.micycle1.curvefit.conic;

import java.util.List;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.curvefit.ShapeException;
import com.github.micycle1.curvefit.Table;
import com.github.micycle1.curvefit.linalg.RootPair;

/**
 * <p>
 * A closed conic (ellipse or circle) fitted to 2D samples. All geometry is
 * computed once at construction; instances are immutable.
 * </p>
 * <p>
 * Queries that invert the implicit equation ({@link #rootsAtX(double)},
 * {@link #rootsAtY(double)} and the batch {@code predict} forms) never throw
 * for points outside the shape: they return {@link RootPair#NONE} or a
 * {@code NaN} row instead.
 * </p>
 */
public interface ConicModel {

	/** Implicit-equation coefficients {@code (a, b, c, d, e, f)}. */
	ConicCoefficients conic();

	/** Fitted coefficients as a labelled table ({@code beta0..betaN}). */
	Table betas();

	Point center();

	double area();

	double perimeter();

	double eccentricity();

	/** The two foci (identical for a circle). */
	List<Point> foci();

	/** Extreme x values of the shape, ascending. */
	RootPair domain();

	/** Extreme y values of the shape, ascending. */
	RootPair codomain();

	/** The y values on the curve at {@code x}, or {@link RootPair#NONE}. */
	RootPair rootsAtX(double x);

	/** The x values on the curve at {@code y}, or {@link RootPair#NONE}. */
	RootPair rootsAtY(double y);

	/**
	 * Predicts y given x, or x given y. Exactly one of the two arguments must be
	 * non-null.
	 *
	 * @return n x 2 table: columns {@code Y0, Y1} for an x query, {@code X0, X1}
	 *         for a y query; rows with no solution are {@code NaN}
	 */
	default Table predict(Object x, Object y) {
		if (x == null && y == null) {
			throw new IllegalArgumentException("'x' or 'y' must be provided.");
		}
		if (x != null && y != null) {
			throw new IllegalArgumentException("only 'x' or 'y' must be provided.");
		}
		return x != null ? predictY(x) : predictX(y);
	}

	/** Batch form of {@link #rootsAtX(double)}. */
	default Table predictY(Object x) {
		Table v = Table.from(x, "X");
		if (v.cols() != 1) {
			throw new ShapeException("Only 1D arrays can be provided.");
		}
		DMatrixRMaj out = new DMatrixRMaj(v.rows(), 2);
		for (int i = 0; i < v.rows(); i++) {
			RootPair r = rootsAtX(v.get(i, 0));
			out.set(i, 0, r.first);
			out.set(i, 1, r.second);
		}
		return Table.results(new String[] { "Y0", "Y1" }, out);
	}

	/** Batch form of {@link #rootsAtY(double)}. */
	default Table predictX(Object y) {
		Table v = Table.from(y, "Y");
		if (v.cols() != 1) {
			throw new ShapeException("Only 1D arrays can be provided.");
		}
		DMatrixRMaj out = new DMatrixRMaj(v.rows(), 2);
		for (int i = 0; i < v.rows(); i++) {
			RootPair r = rootsAtY(v.get(i, 0));
			out.set(i, 0, r.first);
			out.set(i, 1, r.second);
		}
		return Table.results(new String[] { "X0", "X1" }, out);
	}

	/**
	 * Whether {@code (x, y)} lies inside the shape: {@code y} is above the lower
	 * curve value at {@code x} and not above the upper one.
	 */
	default boolean isInside(double x, double y) {
		RootPair r = rootsAtX(x);
		return r.exists() && y > r.min() && y <= r.max();
	}
}
