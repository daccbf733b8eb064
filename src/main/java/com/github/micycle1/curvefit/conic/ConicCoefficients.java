package com.github.micycle1.curvefit.conic;

/**
 * The six coefficients of the general conic
 * {@code a x^2 + b xy + c y^2 + d x + e y + f = 0}.
 */
public final class ConicCoefficients {

	public final double a;
	public final double b;
	public final double c;
	public final double d;
	public final double e;
	public final double f;

	public ConicCoefficients(double a, double b, double c, double d, double e, double f) {
		this.a = a;
		this.b = b;
		this.c = c;
		this.d = d;
		this.e = e;
		this.f = f;
	}

	/** {@code b^2 - 4ac}; negative for ellipses. */
	public double discriminant() {
		return b * b - 4 * a * c;
	}

	/** Left-hand side of the implicit equation at (x, y). */
	public double evaluate(double x, double y) {
		return a * x * x + b * x * y + c * y * y + d * x + e * y + f;
	}

	public double[] toArray() {
		return new double[] { a, b, c, d, e, f };
	}

	@Override
	public String toString() {
		return String.format("%.6g x^2 + %.6g xy + %.6g y^2 + %.6g x + %.6g y + %.6g = 0", a, b, c, d, e, f);
	}
}
