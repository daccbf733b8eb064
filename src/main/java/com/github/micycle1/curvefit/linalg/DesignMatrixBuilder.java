package com.github.micycle1.curvefit.linalg;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;

/**
 * Assembles design matrices: the transform's expansion of the predictors,
 * optionally preceded by a column of ones for the intercept.
 */
public final class DesignMatrixBuilder {

	private DesignMatrixBuilder() {
	}

	/**
	 * @return a {@code samples x (arity * k [+1])} design matrix
	 */
	public static DMatrixRMaj build(DMatrixRMaj x, DesignTransform transform, boolean intercept) {
		Objects.requireNonNull(x, "x must not be null");
		Objects.requireNonNull(transform, "transform must not be null");
		DMatrixRMaj expanded = transform.expand(x);
		return intercept ? addIntercept(expanded) : expanded;
	}

	/** Returns a copy of {@code m} with a leading column of ones. */
	public static DMatrixRMaj addIntercept(DMatrixRMaj m) {
		final int cols = m.numCols + 1;
		DMatrixRMaj out = new DMatrixRMaj(m.numRows, cols);
		for (int r = 0; r < m.numRows; r++) {
			out.data[r * cols] = 1.0;
			System.arraycopy(m.data, r * m.numCols, out.data, r * cols + 1, m.numCols);
		}
		return out;
	}

	/**
	 * Number of design columns for {@code features} predictor columns.
	 */
	public static int columnCount(int features, DesignTransform transform, boolean intercept) {
		return transform.arity() * features + (intercept ? 1 : 0);
	}

	/**
	 * Coefficient row labels {@code beta0..betaN}; numbering starts at
	 * {@code beta1} when there is no intercept, so {@code beta0} always denotes
	 * the constant term.
	 */
	public static String[] coefficientLabels(int rows, boolean intercept) {
		String[] labels = new String[rows];
		int offset = intercept ? 0 : 1;
		for (int i = 0; i < rows; i++) {
			labels[i] = "beta" + (i + offset);
		}
		return labels;
	}
}
