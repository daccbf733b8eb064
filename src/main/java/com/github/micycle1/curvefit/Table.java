package com.github.micycle1.curvefit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.ejml.data.DMatrixRMaj;

/**
 * <p>
 * An immutable rectangular matrix of finite doubles with a label per column
 * (and, optionally, per row). Every model in this library consumes and
 * produces its data as a {@code Table}.
 * </p>
 *
 * <p>
 * {@link #from(Object, String)} is the single normalization point for external
 * data. It accepts:
 * </p>
 * <ul>
 * <li>a scalar {@link Number} (becomes 1x1);</li>
 * <li>a flat sequence: {@code double[]}, {@code int[]}, {@code long[]},
 * {@code float[]}, {@code Number[]} or a {@link List} of numbers (becomes a
 * single column);</li>
 * <li>a rectangular 2D sequence: {@code double[][]}, {@code Number[][]}, or a
 * list of lists / arrays (one inner sequence per row);</li>
 * <li>an EJML {@link DMatrixRMaj};</li>
 * <li>another {@code Table}, which keeps its labels.</li>
 * </ul>
 * Ragged or higher-dimensional input raises {@link ShapeException};
 * non-numeric, null or non-finite entries raise
 * {@link IllegalArgumentException}. The input is always copied.
 */
public final class Table {

	private final String[] columns;
	private final String[] rowLabels; // null => row indices
	private final DMatrixRMaj values;

	private Table(String[] columns, String[] rowLabels, DMatrixRMaj values) {
		this.columns = columns;
		this.rowLabels = rowLabels;
		this.values = values;
	}

	/**
	 * Builds a table from an EJML matrix, labelling columns
	 * {@code prefix0..prefixK}. The matrix is copied.
	 */
	public static Table of(DMatrixRMaj values, String prefix) {
		Objects.requireNonNull(values, "values must not be null");
		return of(defaultLabels(prefix, values.numCols), values);
	}

	/**
	 * Builds a table from an EJML matrix with explicit column labels. The matrix
	 * is copied.
	 */
	public static Table of(String[] columns, DMatrixRMaj values) {
		Objects.requireNonNull(columns, "columns must not be null");
		Objects.requireNonNull(values, "values must not be null");
		if (columns.length != values.numCols) {
			throw new ShapeException("Expected " + values.numCols + " column labels but got " + columns.length);
		}
		if (values.numRows == 0 || values.numCols == 0) {
			throw new ShapeException("Table must contain at least one row and one column");
		}
		for (int i = 0; i < values.getNumElements(); i++) {
			checkFinite(values.data[i]);
		}
		return new Table(columns.clone(), null, values.copy());
	}

	/**
	 * Normalizes any supported data source into a table; see the class
	 * documentation for the accepted representations.
	 *
	 * @param data   the data to normalize
	 * @param prefix column label prefix, used unless {@code data} is already a
	 *               table
	 */
	public static Table from(Object data, String prefix) {
		Objects.requireNonNull(prefix, "prefix must not be null");
		if (data == null) {
			throw new IllegalArgumentException("data must not be null");
		}
		if (data instanceof Table) {
			return (Table) data;
		}
		if (data instanceof DMatrixRMaj) {
			return of((DMatrixRMaj) data, prefix);
		}
		if (data instanceof Number) {
			double v = toDouble(data);
			return of(new DMatrixRMaj(1, 1, true, v), prefix);
		}
		if (data instanceof double[][]) {
			return fromRows((double[][]) data, prefix);
		}
		if (isSequence(data)) {
			return fromSequence(asList(data), prefix);
		}
		throw new IllegalArgumentException("Unsupported data type: " + data.getClass().getName());
	}

	private static Table fromRows(double[][] rows, String prefix) {
		if (rows.length == 0) {
			throw new ShapeException("Table must contain at least one row");
		}
		int cols = -1;
		for (double[] row : rows) {
			if (row == null) {
				throw new IllegalArgumentException("Row must not be null");
			}
			if (cols == -1) {
				cols = row.length;
			} else if (row.length != cols) {
				throw new ShapeException("Ragged input: rows of length " + cols + " and " + row.length);
			}
		}
		return of(new DMatrixRMaj(rows), prefix);
	}

	private static Table fromSequence(List<Object> items, String prefix) {
		if (items.isEmpty()) {
			throw new ShapeException("Table must contain at least one row");
		}
		boolean nested = isSequence(items.get(0));
		if (!nested) {
			// flat: one sample per element
			DMatrixRMaj m = new DMatrixRMaj(items.size(), 1);
			for (int i = 0; i < items.size(); i++) {
				Object item = items.get(i);
				if (isSequence(item)) {
					throw new ShapeException("Ragged input: mixed scalars and sequences");
				}
				m.set(i, 0, toDouble(item));
			}
			return of(m, prefix);
		}

		List<List<Object>> rows = new ArrayList<>(items.size());
		int cols = -1;
		for (Object item : items) {
			if (!isSequence(item)) {
				throw new ShapeException("Ragged input: mixed scalars and sequences");
			}
			List<Object> row = asList(item);
			if (cols == -1) {
				cols = row.size();
			} else if (row.size() != cols) {
				throw new ShapeException("Ragged input: rows of length " + cols + " and " + row.size());
			}
			rows.add(row);
		}
		if (cols == 0) {
			throw new ShapeException("Table must contain at least one column");
		}

		DMatrixRMaj m = new DMatrixRMaj(rows.size(), cols);
		for (int r = 0; r < rows.size(); r++) {
			List<Object> row = rows.get(r);
			for (int c = 0; c < cols; c++) {
				Object v = row.get(c);
				if (isSequence(v)) {
					throw new ShapeException("Input has more than 2 dimensions");
				}
				m.set(r, c, toDouble(v));
			}
		}
		return of(m, prefix);
	}

	private static boolean isSequence(Object o) {
		return o instanceof List || o instanceof Object[] || o instanceof double[] || o instanceof int[] || o instanceof long[]
				|| o instanceof float[];
	}

	private static List<Object> asList(Object seq) {
		if (seq instanceof List) {
			return new ArrayList<>((List<?>) seq);
		}
		if (seq instanceof Object[]) {
			return new ArrayList<>(Arrays.asList((Object[]) seq));
		}
		List<Object> out = new ArrayList<>();
		if (seq instanceof double[]) {
			for (double v : (double[]) seq) {
				out.add(v);
			}
		} else if (seq instanceof int[]) {
			for (int v : (int[]) seq) {
				out.add(v);
			}
		} else if (seq instanceof long[]) {
			for (long v : (long[]) seq) {
				out.add(v);
			}
		} else {
			for (float v : (float[]) seq) {
				out.add(v);
			}
		}
		return out;
	}

	private static double toDouble(Object o) {
		if (!(o instanceof Number)) {
			throw new IllegalArgumentException("Non-numeric entry: " + o);
		}
		double v = ((Number) o).doubleValue();
		checkFinite(v);
		return v;
	}

	private static void checkFinite(double v) {
		if (!Double.isFinite(v)) {
			throw new IllegalArgumentException("Non-finite entry: " + v);
		}
	}

	private static String[] defaultLabels(String prefix, int n) {
		String[] labels = new String[n];
		for (int i = 0; i < n; i++) {
			labels[i] = prefix + i;
		}
		return labels;
	}

	/**
	 * Returns a copy of this table with the given row labels.
	 */
	public Table withRowLabels(String[] labels) {
		Objects.requireNonNull(labels, "labels must not be null");
		if (labels.length != rows()) {
			throw new ShapeException("Expected " + rows() + " row labels but got " + labels.length);
		}
		return new Table(columns, labels.clone(), values);
	}

	/**
	 * Builds a query-result table. Unlike {@link #of(String[], DMatrixRMaj)},
	 * {@code NaN} entries are allowed: they mark rows without a solution.
	 */
	public static Table results(String[] columns, DMatrixRMaj values) {
		if (columns.length != values.numCols) {
			throw new ShapeException("Expected " + values.numCols + " column labels but got " + columns.length);
		}
		return new Table(columns.clone(), null, values.copy());
	}

	public int rows() {
		return values.numRows;
	}

	public int cols() {
		return values.numCols;
	}

	public double get(int row, int col) {
		return values.get(row, col);
	}

	/** Copy of a single column. */
	public double[] column(int col) {
		double[] out = new double[rows()];
		for (int r = 0; r < out.length; r++) {
			out[r] = values.get(r, col);
		}
		return out;
	}

	public List<String> columnNames() {
		return List.of(columns);
	}

	public List<String> rowLabels() {
		if (rowLabels == null) {
			String[] idx = new String[rows()];
			for (int i = 0; i < idx.length; i++) {
				idx[i] = Integer.toString(i);
			}
			return List.of(idx);
		}
		return List.of(rowLabels);
	}

	/** Copy of the underlying values. */
	public DMatrixRMaj matrix() {
		return values.copy();
	}

	public double[][] toArray() {
		double[][] out = new double[rows()][];
		for (int r = 0; r < out.length; r++) {
			out[r] = Arrays.copyOfRange(values.data, r * cols(), (r + 1) * cols());
		}
		return out;
	}

	@Override
	public String toString() {
		List<String> labels = rowLabels();
		String[][] cells = new String[rows() + 1][cols() + 1];
		cells[0][0] = "";
		for (int c = 0; c < cols(); c++) {
			cells[0][c + 1] = columns[c];
		}
		for (int r = 0; r < rows(); r++) {
			cells[r + 1][0] = labels.get(r);
			for (int c = 0; c < cols(); c++) {
				cells[r + 1][c + 1] = Double.toString(values.get(r, c));
			}
		}

		int[] width = new int[cols() + 1];
		for (String[] row : cells) {
			for (int c = 0; c < row.length; c++) {
				width[c] = Math.max(width[c], row[c].length());
			}
		}

		StringBuilder sb = new StringBuilder();
		for (int r = 0; r < cells.length; r++) {
			if (r > 0) {
				sb.append('\n');
			}
			sb.append(String.format("%-" + Math.max(1, width[0]) + "s", cells[r][0]));
			for (int c = 1; c < cells[r].length; c++) {
				sb.append("  ").append(String.format("%" + width[c] + "s", cells[r][c]));
			}
		}
		return sb.toString();
	}
}
