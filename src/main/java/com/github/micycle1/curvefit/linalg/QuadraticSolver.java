package com.github.micycle1.curvefit.linalg;

import com.github.micycle1.curvefit.NoRealRootException;

/**
 * Real roots of {@code a x^2 + b x + c = 0}.
 * <p>
 * {@link #solve(double, double, double)} throws when there is no real
 * solution; it is used where the roots are an algebraic necessity (axis
 * crossings, domain bounds). {@link #trySolve(double, double, double)} returns
 * {@link RootPair#NONE} instead and backs every per-point query.
 */
public final class QuadraticSolver {

	private QuadraticSolver() {
	}

	/**
	 * @return the roots in ascending order; identical when the discriminant is 0
	 * @throws NoRealRootException if {@code a == 0} or {@code b^2 - 4ac < 0}
	 */
	public static RootPair solve(double a, double b, double c) {
		if (a == 0) {
			throw new NoRealRootException("Coefficient a = 0: not a quadratic");
		}
		double disc = b * b - 4 * a * c;
		if (disc < 0 || Double.isNaN(disc)) {
			throw new NoRealRootException("b^2 - 4ac < 0 (" + disc + ")");
		}
		if (disc == 0) {
			double r = -b / (2 * a) + 0.0; // no -0.0
			return new RootPair(r, r);
		}
		// avoid cancellation between -b and sqrt(disc)
		double q = -0.5 * (b + Math.copySign(Math.sqrt(disc), b));
		double r0 = q / a;
		double r1 = q == 0 ? 0 : c / q;
		return r0 <= r1 ? new RootPair(r0, r1) : new RootPair(r1, r0);
	}

	/**
	 * As {@link #solve(double, double, double)}, but returns {@link RootPair#NONE}
	 * when there is no real solution.
	 */
	public static RootPair trySolve(double a, double b, double c) {
		if (a == 0 || !(b * b - 4 * a * c >= 0)) {
			return RootPair.NONE;
		}
		return solve(a, b, c);
	}
}
