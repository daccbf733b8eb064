package com.github.micycle1.curvefit.conic;

import java.util.List;

import org.ejml.data.DMatrixRMaj;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.curvefit.DegenerateGeometryException;
import com.github.micycle1.curvefit.NoRealRootException;
import com.github.micycle1.curvefit.Table;
import com.github.micycle1.curvefit.linalg.QuadraticSolver;
import com.github.micycle1.curvefit.linalg.RootPair;

/**
 * <p>
 * Ellipse fitted to 2D samples by {@link ConicEstimator}, with its derived
 * geometry.
 * </p>
 *
 * <p>
 * Construction computes, once:
 * </p>
 * <ul>
 * <li>the center, from the closed form
 * {@code ((2cd - be) / (b^2 - 4ac), (2ae - bd) / (b^2 - 4ac))};</li>
 * <li>the two axis directions, whose slopes are the roots
 * {@code k +- sqrt(k^2 + 1)} with {@code k = (c - a) / b} (evaluated as the
 * angle {@code atan2(b, a - c) / 2} so axis-aligned ellipses need no special
 * case);</li>
 * <li>each axis's vertices, where the axis line crosses the curve;</li>
 * <li>domain and codomain, from the discriminant-zero boundary of the implicit
 * equation.</li>
 * </ul>
 * Failure to find any of these aborts construction.
 */
public final class Ellipse implements ConicModel {

	private static final Logger LOGGER = LoggerFactory.getLogger(Ellipse.class);

	/** Convergence threshold of the perimeter series. */
	static final double PERIMETER_TOLERANCE = 1e-12;

	private final ConicCoefficients conic;
	private final Point center;
	private final Axis axisMajor;
	private final Axis axisMinor;
	private final RootPair domain;
	private final RootPair codomain;

	private Ellipse(ConicCoefficients conic) {
		this.conic = conic;
		this.center = center(conic);

		if (conic.a == 0 && conic.b == 0 && conic.c == 0) {
			throw new DegenerateGeometryException("Quadratic coefficients are all zero: axes cannot be determined");
		}
		double theta = 0.5 * Math.atan2(conic.b, conic.a - conic.c);
		Axis ax0 = axisAlong(theta);
		Axis ax1 = axisAlong(theta + Math.PI / 2);
		if (ax0.length() < ax1.length()) {
			Axis tmp = ax0;
			ax0 = ax1;
			ax1 = tmp;
		}
		this.axisMajor = ax0;
		this.axisMinor = ax1;

		// y-extremes of the curve bound x (and vice versa) where the discriminant
		// of the implicit equation vanishes
		double da = conic.b * conic.b - 4 * conic.a * conic.c;
		try {
			this.domain = QuadraticSolver.solve(da, 2 * conic.b * conic.e - 4 * conic.c * conic.d,
					conic.e * conic.e - 4 * conic.c * conic.f);
			this.codomain = QuadraticSolver.solve(da, 2 * conic.b * conic.d - 4 * conic.a * conic.e,
					conic.d * conic.d - 4 * conic.a * conic.f);
		} catch (NoRealRootException e) {
			throw new DegenerateGeometryException("Conic has no real extent", e);
		}

		LOGGER.debug("Ellipse center={} major={} minor={}", center, axisMajor, axisMinor);
	}

	/**
	 * Fits an ellipse to the samples. Both arguments accept anything
	 * {@link Table#from(Object, String)} does and must hold a single column.
	 */
	public static Ellipse fit(Object y, Object x) {
		PlanarSamples s = PlanarSamples.of(y, x, ConicEstimator.MIN_POINTS, "ellipse");
		return new Ellipse(ConicEstimator.fitEllipse(s.x, s.y));
	}

	/** Wraps already-known ellipse coefficients. */
	public static Ellipse of(ConicCoefficients conic) {
		if (!(conic.discriminant() < 0)) {
			throw new DegenerateGeometryException("Conic is not an ellipse: b^2 - 4ac = " + conic.discriminant());
		}
		return new Ellipse(conic);
	}

	private static Point center(ConicCoefficients k) {
		double den = k.discriminant();
		return new Point((2 * k.c * k.d - k.b * k.e) / den, (2 * k.a * k.e - k.b * k.d) / den);
	}

	// segment of the line through the center with direction angle theta, cut by
	// the curve
	private Axis axisAlong(double theta) {
		final double ux = Math.cos(theta);
		final double uy = Math.sin(theta);
		final double x0 = center.x;
		final double y0 = center.y;
		final ConicCoefficients k = conic;

		double qa = k.a * ux * ux + k.b * ux * uy + k.c * uy * uy;
		double qb = 2 * k.a * x0 * ux + k.b * (x0 * uy + y0 * ux) + 2 * k.c * y0 * uy + k.d * ux + k.e * uy;
		double qc = k.evaluate(x0, y0);

		RootPair t;
		try {
			t = QuadraticSolver.solve(qa, qb, qc);
		} catch (NoRealRootException e) {
			throw new DegenerateGeometryException("Axis line does not cross the conic", e);
		}
		return new Axis(new Point(x0 + t.first * ux, y0 + t.first * uy), new Point(x0 + t.second * ux, y0 + t.second * uy));
	}

	@Override
	public ConicCoefficients conic() {
		return conic;
	}

	@Override
	public Table betas() {
		return Table.of(new String[] { "COEFS" }, new DMatrixRMaj(6, 1, true, conic.toArray()))
				.withRowLabels(new String[] { "beta0", "beta1", "beta2", "beta3", "beta4", "beta5" });
	}

	@Override
	public Point center() {
		return center;
	}

	public Axis axisMajor() {
		return axisMajor;
	}

	public Axis axisMinor() {
		return axisMinor;
	}

	/** {@code pi * A * B}, with A and B the semi-axes. */
	@Override
	public double area() {
		return Math.PI * semiMajor() * semiMinor();
	}

	/**
	 * Perimeter from the series
	 * {@code P = pi (A + B) (1 + sum_{n>=1} h^n / 4^n)},
	 * {@code h = (A - B)^2 / (A^2 + B^2)}, summed until consecutive partial sums
	 * differ by less than {@value #PERIMETER_TOLERANCE}. Since {@code 0 <= h < 1}
	 * the terms decay geometrically.
	 */
	@Override
	public double perimeter() {
		double a = semiMajor();
		double b = semiMinor();
		if (a == 0 && b == 0) {
			throw new DegenerateGeometryException("a and b coefficients = 0.");
		}
		double h = (a - b) * (a - b) / (a * a + b * b);
		double c = Math.PI * (a + b);
		double q = 1;
		double term = 1;
		double p = c;
		double pOld;
		do {
			pOld = p;
			term *= h / 4;
			q += term;
			p = c * q;
		} while (Math.abs(pOld - p) > PERIMETER_TOLERANCE);
		return p;
	}

	@Override
	public double eccentricity() {
		double a = semiMajor();
		double b = semiMinor();
		if (a == 0) {
			throw new DegenerateGeometryException("coefficient a = 0");
		}
		return Math.sqrt(1 - (b * b) / (a * a));
	}

	/** {@code center -+ A e (cos t, sin t)}, t the major-axis angle. */
	@Override
	public List<Point> foci() {
		double dist = semiMajor() * eccentricity();
		double t = axisMajor.angle();
		double dx = dist * Math.cos(t);
		double dy = dist * Math.sin(t);
		return List.of(new Point(center.x - dx, center.y - dy), new Point(center.x + dx, center.y + dy));
	}

	@Override
	public RootPair domain() {
		return domain;
	}

	@Override
	public RootPair codomain() {
		return codomain;
	}

	@Override
	public RootPair rootsAtX(double x) {
		return QuadraticSolver.trySolve(conic.c, conic.b * x + conic.e, conic.f + conic.a * x * x + conic.d * x);
	}

	@Override
	public RootPair rootsAtY(double y) {
		return QuadraticSolver.trySolve(conic.a, conic.b * y + conic.d, conic.f + conic.c * y * y + conic.e * y);
	}

	private double semiMajor() {
		return axisMajor.length() / 2;
	}

	private double semiMinor() {
		return axisMinor.length() / 2;
	}

	@Override
	public String toString() {
		return betas().toString();
	}
}
