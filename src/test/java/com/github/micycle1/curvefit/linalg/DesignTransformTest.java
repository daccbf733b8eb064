package com.github.micycle1.curvefit.linalg;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.micycle1.curvefit.DomainException;

public class DesignTransformTest {

	private static final DMatrixRMaj X = new DMatrixRMaj(new double[][] { { 2, 3 }, { -1, 0.5 } });

	@Test
	void polynomialGroupsColumnsByPower() {
		DMatrixRMaj d = DesignTransform.polynomial(3).expand(X);
		assertEquals(2, d.numRows);
		assertEquals(6, d.numCols);
		assertArrayEquals(new double[] { 2, 3, 4, 9, 8, 27 }, row(d, 0), 1e-15);
		assertArrayEquals(new double[] { -1, 0.5, 1, 0.25, -1, 0.125 }, row(d, 1), 1e-15);
	}

	@ParameterizedTest
	@ValueSource(ints = { 0, -1, -10 })
	void polynomialOrderMustBePositive(int n) {
		assertThrows(IllegalArgumentException.class, () -> DesignTransform.polynomial(n));
	}

	@Test
	void interceptIsLeadingColumn() {
		DMatrixRMaj d = DesignMatrixBuilder.build(X, DesignTransform.identity(), true);
		assertEquals(3, d.numCols);
		assertArrayEquals(new double[] { 1, 2, 3 }, row(d, 0), 0);
		assertArrayEquals(new double[] { 1, -1, 0.5 }, row(d, 1), 0);
	}

	@Test
	void columnCountMatchesArity() {
		assertEquals(7, DesignMatrixBuilder.columnCount(2, DesignTransform.polynomial(3), true));
		assertEquals(6, DesignMatrixBuilder.columnCount(2, DesignTransform.polynomial(3), false));
		DMatrixRMaj d = DesignMatrixBuilder.build(X, DesignTransform.polynomial(3), true);
		assertEquals(DesignMatrixBuilder.columnCount(2, DesignTransform.polynomial(3), true), d.numCols);
	}

	@Test
	void coefficientLabelsSkipBeta0WithoutIntercept() {
		assertArrayEquals(new String[] { "beta0", "beta1" }, DesignMatrixBuilder.coefficientLabels(2, true));
		assertArrayEquals(new String[] { "beta1", "beta2" }, DesignMatrixBuilder.coefficientLabels(2, false));
	}

	@Test
	void reciprocalAndExponent() {
		DMatrixRMaj r = DesignTransform.reciprocal().expand(X);
		assertArrayEquals(new double[] { 0.5, 1.0 / 3 }, row(r, 0), 1e-15);
		DMatrixRMaj e = DesignTransform.exponent(2).expand(X);
		assertArrayEquals(new double[] { 4, 8 }, row(e, 0), 1e-15);
		assertArrayEquals(new double[] { 0.5, Math.sqrt(2) }, row(e, 1), 1e-15);
	}

	@Test
	void reciprocalRejectsZeroWhenFitting() {
		DMatrixRMaj withZero = new DMatrixRMaj(new double[][] { { 2 }, { 0 } });
		DMatrixRMaj y = new DMatrixRMaj(new double[][] { { 1 }, { 2 } });
		assertThrows(DomainException.class, () -> DesignTransform.reciprocal().checkFitData(withZero, y));
	}

	@Test
	void reciprocalPredictsNaNAtZero() {
		DMatrixRMaj x = new DMatrixRMaj(new double[][] { { 2 }, { 0 }, { 4 } });
		DMatrixRMaj betas = new DMatrixRMaj(new double[][] { { 1 }, { 4 } });
		DMatrixRMaj p = DesignTransform.reciprocal().predict(x, betas, true);
		assertEquals(3, p.get(0, 0), 1e-15);
		assertTrue(Double.isNaN(p.get(1, 0)));
		assertEquals(2, p.get(2, 0), 1e-15);
	}

	@Test
	void logRejectsNonPositive() {
		DMatrixRMaj y = new DMatrixRMaj(new double[][] { { 1 }, { 2 } });
		assertThrows(DomainException.class, () -> DesignTransform.log().checkFitData(X, y));
		DMatrixRMaj xPos = new DMatrixRMaj(new double[][] { { 1 }, { 2 } });
		DMatrixRMaj yZero = new DMatrixRMaj(new double[][] { { 0 }, { 2 } });
		assertThrows(DomainException.class, () -> DesignTransform.log().checkFitData(xPos, yZero));
	}

	@ParameterizedTest
	@ValueSource(doubles = { 0, -2, Double.NaN, Double.POSITIVE_INFINITY })
	void exponentBaseMustBePositiveFinite(double base) {
		assertThrows(IllegalArgumentException.class, () -> DesignTransform.exponent(base));
	}

	@Test
	void interceptOptionality() {
		assertTrue(DesignTransform.identity().interceptOptional());
		assertTrue(DesignTransform.polynomial(2).interceptOptional());
		assertFalse(DesignTransform.log().interceptOptional());
		assertFalse(DesignTransform.reciprocal().interceptOptional());
		assertFalse(DesignTransform.exponent(Math.E).interceptOptional());
	}

	private static double[] row(DMatrixRMaj m, int r) {
		double[] out = new double[m.numCols];
		for (int c = 0; c < out.length; c++) {
			out[c] = m.get(r, c);
		}
		return out;
	}
}
