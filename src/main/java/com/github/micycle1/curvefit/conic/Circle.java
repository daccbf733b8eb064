package com.github.micycle1.curvefit.conic;

import java.util.List;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.curvefit.DegenerateGeometryException;
import com.github.micycle1.curvefit.Table;
import com.github.micycle1.curvefit.linalg.LeastSquaresEstimator;
import com.github.micycle1.curvefit.linalg.QuadraticSolver;
import com.github.micycle1.curvefit.linalg.RootPair;

/**
 * Least-squares circle. The fit is linear in the unknowns of
 * {@code x^2 + y^2 = a x + b y + c}, so it runs through the shared
 * {@link LeastSquaresEstimator} with design {@code [x, y, 1]} and target
 * {@code x^2 + y^2}; center and radius follow in closed form.
 */
public final class Circle implements ConicModel {

	public static final int MIN_POINTS = 3;

	private final double[] betas; // a, b, c
	private final Point center;
	private final double radius;

	private Circle(double a, double b, double c) {
		this.betas = new double[] { a, b, c };
		this.center = new Point(a * 0.5, b * 0.5);
		this.radius = Math.sqrt(4 * c + a * a + b * b) * 0.5;
		if (!(radius > 0)) {
			throw new DegenerateGeometryException("Fitted circle has no positive radius (4c + a^2 + b^2 <= 0)");
		}
	}

	/**
	 * Fits a circle to the samples. Both arguments accept anything
	 * {@link Table#from(Object, String)} does and must hold a single column.
	 */
	public static Circle fit(Object y, Object x) {
		PlanarSamples s = PlanarSamples.of(y, x, MIN_POINTS, "circle");
		final int n = s.size();
		// [x, y, 1]: constant column last
		DMatrixRMaj design = new DMatrixRMaj(n, 3);
		DMatrixRMaj target = new DMatrixRMaj(n, 1);
		for (int i = 0; i < n; i++) {
			design.set(i, 0, s.x[i]);
			design.set(i, 1, s.y[i]);
			design.set(i, 2, 1.0);
			target.set(i, 0, s.x[i] * s.x[i] + s.y[i] * s.y[i]);
		}
		DMatrixRMaj sol = LeastSquaresEstimator.fit(design, target);
		return new Circle(sol.get(0, 0), sol.get(1, 0), sol.get(2, 0));
	}

	/** Circle with the given center and radius. */
	public static Circle of(Point center, double radius) {
		double a = 2 * center.x;
		double b = 2 * center.y;
		double c = radius * radius - center.x * center.x - center.y * center.y;
		return new Circle(a, b, c);
	}

	public double radius() {
		return radius;
	}

	/** {@code x^2 + y^2 - a x - b y - c = 0}. */
	@Override
	public ConicCoefficients conic() {
		return new ConicCoefficients(1, 0, 1, -betas[0], -betas[1], -betas[2]);
	}

	@Override
	public Table betas() {
		return Table.of(new String[] { "COEFS" }, new DMatrixRMaj(3, 1, true, betas))
				.withRowLabels(new String[] { "beta0", "beta1", "beta2" });
	}

	@Override
	public Point center() {
		return center;
	}

	@Override
	public double area() {
		return Math.PI * radius * radius;
	}

	@Override
	public double perimeter() {
		return 2 * Math.PI * radius;
	}

	@Override
	public double eccentricity() {
		return 0;
	}

	@Override
	public List<Point> foci() {
		return List.of(center, center);
	}

	@Override
	public RootPair domain() {
		return new RootPair(center.x - radius, center.x + radius);
	}

	@Override
	public RootPair codomain() {
		return new RootPair(center.y - radius, center.y + radius);
	}

	@Override
	public RootPair rootsAtX(double x) {
		double dx = x - center.x;
		return QuadraticSolver.trySolve(1, -2 * center.y, center.y * center.y - radius * radius + dx * dx);
	}

	@Override
	public RootPair rootsAtY(double y) {
		double dy = y - center.y;
		return QuadraticSolver.trySolve(1, -2 * center.x, center.x * center.x - radius * radius + dy * dy);
	}

	@Override
	public String toString() {
		return betas().toString();
	}
}
