package com.github.micycle1.curvefit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

public class RegressionModelTest {

	private static double[] range(double from, double to, int n) {
		double[] out = new double[n];
		for (int i = 0; i < n; i++) {
			out[i] = from + (to - from) * i / (n - 1);
		}
		return out;
	}

	@Test
	void linearRecoversExactLine() {
		double[] x = range(0, 9, 10);
		double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = 2 + 3 * x[i];
		}
		RegressionModel m = RegressionModel.linear(y, x);
		Table betas = m.betas();
		assertEquals(List.of("beta0", "beta1"), betas.rowLabels());
		assertEquals(2, betas.get(0, 0), 1e-9);
		assertEquals(3, betas.get(1, 0), 1e-9);
		assertEquals(1, m.rSquared(), 1e-12);

		Table p = m.predict(new double[] { 20, -1 });
		assertEquals(62, p.get(0, 0), 1e-9);
		assertEquals(-1, p.get(1, 0), 1e-9);
		assertEquals(List.of("Y0"), p.columnNames());
	}

	@Test
	void linearWithoutIntercept() {
		double[] x = range(1, 5, 5);
		double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = 3 * x[i];
		}
		RegressionModel m = RegressionModel.linear(y, x, false);
		assertFalse(m.fitIntercept());
		assertEquals(List.of("beta1"), m.betas().rowLabels());
		assertEquals(3, m.betas().get(0, 0), 1e-9);
		assertEquals(30, m.predict(10).get(0, 0), 1e-9);
	}

	@Test
	void linearWithSeveralFeaturesAndTargets() {
		Random rnd = new Random(42);
		int n = 20;
		double[][] x = new double[n][2];
		double[][] y = new double[n][2];
		for (int i = 0; i < n; i++) {
			x[i][0] = rnd.nextDouble() * 10;
			x[i][1] = rnd.nextDouble() * 10;
			y[i][0] = 1 + 2 * x[i][0] - x[i][1];
			y[i][1] = -4 + 0.5 * x[i][1];
		}
		RegressionModel m = RegressionModel.linear(y, x);
		assertEquals(2, m.features());
		assertEquals(2, m.dimensions());

		Table b = m.betas();
		assertEquals(3, b.rows());
		assertEquals(2, b.cols());
		assertArrayEquals(new double[] { 1, 2, -1 }, b.column(0), 1e-9);
		assertArrayEquals(new double[] { -4, 0, 0.5 }, b.column(1), 1e-9);

		assertThrows(ShapeException.class, m::rSquared);
		assertEquals(1, m.rSquared(0), 1e-12);
		assertEquals(1, m.rSquared(1), 1e-12);
		assertThrows(IndexOutOfBoundsException.class, () -> m.rSquared(2));

		assertThrows(ShapeException.class, () -> m.predict(new double[] { 1, 2 }));
	}

	@Test
	void rSquaredBetweenZeroAndOneOnNoisyData() {
		Random rnd = new Random(7);
		double[] x = range(0, 10, 50);
		double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = 1 + 0.5 * x[i] + rnd.nextGaussian();
		}
		double r2 = RegressionModel.linear(y, x).rSquared();
		assertTrue(r2 > 0.5 && r2 < 1, "r2=" + r2);
	}

	@Test
	void rSquaredIsNaNForConstantTarget() {
		double[] x = range(0, 4, 5);
		double[] y = { 5, 5, 5, 5, 5 };
		assertTrue(Double.isNaN(RegressionModel.linear(y, x).rSquared()));
	}

	@Test
	void polynomialRecoversSquare() {
		double[] x = range(-3, 3, 13);
		double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = x[i] * x[i];
		}
		RegressionModel m = RegressionModel.polynomial(y, x, 2);
		Table b = m.betas();
		assertEquals(List.of("beta0", "beta1", "beta2"), b.rowLabels());
		assertEquals(0, b.get(0, 0), 1e-9);
		assertEquals(0, b.get(1, 0), 1e-9);
		assertEquals(1, b.get(2, 0), 1e-9);
		assertEquals(16, m.predict(-4).get(0, 0), 1e-8);
	}

	@Test
	void polynomialCubicWithoutIntercept() {
		double[] x = range(-2, 2, 9);
		double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = x[i] - 2 * x[i] * x[i] * x[i];
		}
		RegressionModel m = RegressionModel.polynomial(y, x, 3, false);
		assertArrayEquals(new double[] { 1, 0, -2 }, m.betas().column(0), 1e-9);
		assertEquals(List.of("beta1", "beta2", "beta3"), m.betas().rowLabels());
	}

	@Test
	void polynomialOrderMustBePositive() {
		assertThrows(IllegalArgumentException.class, () -> RegressionModel.polynomial(new double[] { 1, 2 }, new double[] { 1, 2 }, 0));
	}

	@Test
	void powerRecoversCoefficientAndExponent() {
		double[] x = range(1, 6, 6);
		double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = 2 * Math.pow(x[i], 3);
		}
		RegressionModel m = RegressionModel.power(y, x);
		assertEquals(2, m.betas().get(0, 0), 1e-9);
		assertEquals(3, m.betas().get(1, 0), 1e-9);
		assertEquals(686, m.predict(7).get(0, 0), 1e-6);
		assertEquals(1, m.rSquared(), 1e-12);
	}

	@Test
	void powerWithTwoFeatures() {
		Random rnd = new Random(3);
		int n = 15;
		double[][] x = new double[n][2];
		double[] y = new double[n];
		for (int i = 0; i < n; i++) {
			x[i][0] = 0.5 + rnd.nextDouble() * 4;
			x[i][1] = 0.5 + rnd.nextDouble() * 4;
			y[i] = 3 * x[i][0] * x[i][0] / x[i][1];
		}
		RegressionModel m = RegressionModel.power(y, x);
		assertArrayEquals(new double[] { 3, 2, -1 }, m.betas().column(0), 1e-9);
		assertEquals(3 * 4 / 2.0, m.predict(new double[][] { { 2, 2 } }).get(0, 0), 1e-9);
	}

	@Test
	void powerRejectsNonPositiveValues() {
		assertThrows(DomainException.class, () -> RegressionModel.power(new double[] { 1, 2, 3 }, new double[] { -1, 2, 3 }));
		assertThrows(DomainException.class, () -> RegressionModel.power(new double[] { 0, 2, 3 }, new double[] { 1, 2, 3 }));
	}

	@Test
	void hyperbolicRecoversCoefficients() {
		double[] x = range(1, 8, 8);
		double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = 4 / x[i] + 1;
		}
		RegressionModel m = RegressionModel.hyperbolic(y, x);
		assertEquals(1, m.betas().get(0, 0), 1e-9);
		assertEquals(4, m.betas().get(1, 0), 1e-9);
		assertEquals(1.5, m.predict(8.0).get(0, 0), 1e-9);

		Table batch = m.predict(new double[] { 2, 0, 4 });
		assertEquals(3, batch.get(0, 0), 1e-9);
		assertTrue(Double.isNaN(batch.get(1, 0)));
		assertEquals(2, batch.get(2, 0), 1e-9);
	}

	@Test
	void hyperbolicRejectsZero() {
		assertThrows(DomainException.class, () -> RegressionModel.hyperbolic(new double[] { 1, 2, 3 }, new double[] { 0, 1, 2 }));
	}

	@Test
	void exponentialDefaultBase() {
		double[] x = range(0, 5, 11);
		double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = 2 * Math.exp(x[i]) + 1;
		}
		RegressionModel m = RegressionModel.exponential(y, x);
		assertEquals(1, m.betas().get(0, 0), 1e-8);
		assertEquals(2, m.betas().get(1, 0), 1e-8);
		assertEquals(2 * Math.E + 1, m.predict(1).get(0, 0), 1e-8);
	}

	@Test
	void exponentialCustomBase() {
		double[] x = range(-2, 4, 7);
		double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = 3 * Math.pow(2, x[i]) - 1;
		}
		RegressionModel m = RegressionModel.exponential(y, x, 2);
		assertEquals(-1, m.betas().get(0, 0), 1e-9);
		assertEquals(3, m.betas().get(1, 0), 1e-9);
		assertThrows(IllegalArgumentException.class, () -> RegressionModel.exponential(y, x, -2));
	}

	@Test
	void rowMismatchFailsForEveryFamily() {
		double[] y = { 1, 2, 3 };
		double[] x = { 1, 2 };
		assertThrows(ShapeException.class, () -> RegressionModel.linear(y, x));
		assertThrows(ShapeException.class, () -> RegressionModel.polynomial(y, x, 2));
		assertThrows(ShapeException.class, () -> RegressionModel.power(y, x));
		assertThrows(ShapeException.class, () -> RegressionModel.hyperbolic(y, x));
		assertThrows(ShapeException.class, () -> RegressionModel.exponential(y, x));
	}

	@Test
	void predictIsIdempotent() {
		Random rnd = new Random(11);
		double[] x = range(0, 3, 20);
		double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = Math.sin(x[i]) + 0.1 * rnd.nextGaussian();
		}
		RegressionModel m = RegressionModel.polynomial(y, x, 4);
		double[] query = { 0.1, 0.7, 2.9 };
		assertArrayEquals(m.predict(query).toArray()[1], m.predict(query).toArray()[1]);
		assertArrayEquals(m.predict(query).column(0), m.predict(query).column(0));
	}

	@Test
	void acceptsListsAndTables() {
		List<Double> x = List.of(0.0, 1.0, 2.0, 3.0);
		List<Double> y = List.of(1.0, 3.0, 5.0, 7.0);
		RegressionModel fromLists = RegressionModel.linear(y, x);
		RegressionModel fromTables = RegressionModel.linear(Table.from(y, "Y"), Table.from(x, "X"));
		assertArrayEquals(fromLists.betas().column(0), fromTables.betas().column(0), 1e-12);
	}

	@Test
	void printsCoefficientTable() {
		RegressionModel m = RegressionModel.linear(new double[] { 1, 3, 5 }, new double[] { 0, 1, 2 });
		String s = m.toString();
		assertTrue(s.contains("beta0"), s);
		assertTrue(s.contains("beta1"), s);
		assertTrue(s.contains("Y0"), s);
	}
}
