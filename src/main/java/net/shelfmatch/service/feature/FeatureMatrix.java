package net.shelfmatch.service.feature;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-book feature rows in catalog order.
 *
 * <p>Each row is the L2-normalized text vector followed by the standardized like count and
 * standardized average rating. Only book ids are kept alongside the rows, so a cached matrix
 * never carries display fields; callers pair row {@code i} with entry {@code i} of their own
 * catalog. Instances are immutable and safe to share between requests.</p>
 */
public final class FeatureMatrix {

    private static final FeatureMatrix EMPTY = new FeatureMatrix(new long[0], new double[0][], 0);

    private final long[] bookIds;
    private final double[][] rows;
    private final double[] norms;
    private final int textDimensions;
    private final Map<Long, Integer> indexById;

    FeatureMatrix(long[] bookIds, double[][] rows, int textDimensions) {
        if (bookIds.length != rows.length) {
            throw new IllegalArgumentException("Row count " + rows.length + " does not match book count " + bookIds.length);
        }
        this.bookIds = bookIds.clone();
        this.rows = new double[rows.length][];
        this.norms = new double[rows.length];
        this.indexById = new HashMap<>();
        for (int i = 0; i < rows.length; i++) {
            this.rows[i] = rows[i].clone();
            this.norms[i] = VectorMath.norm(this.rows[i]);
            this.indexById.putIfAbsent(this.bookIds[i], i);
        }
        this.textDimensions = textDimensions;
    }

    public static FeatureMatrix empty() {
        return EMPTY;
    }

    public int size() {
        return bookIds.length;
    }

    public boolean isEmpty() {
        return bookIds.length == 0;
    }

    public long bookId(int index) {
        return bookIds[index];
    }

    /**
     * @return the row index of the book, or -1 when the book is not in this catalog
     */
    public int indexOf(long bookId) {
        Integer index = indexById.get(bookId);
        return index == null ? -1 : index;
    }

    public double[] row(int index) {
        return rows[index].clone();
    }

    /** Width of the text component; the full row adds two numeric columns. */
    public int textDimensions() {
        return textDimensions;
    }

    public int dimensions() {
        return textDimensions + 2;
    }

    /**
     * Cosine similarity between two rows; 0 when either row has zero norm.
     */
    public double cosine(int first, int second) {
        double denominator = norms[first] * norms[second];
        if (denominator == 0.0) {
            return 0.0;
        }
        return VectorMath.dot(rows[first], rows[second]) / denominator;
    }

    @Override
    public String toString() {
        return "FeatureMatrix{books=" + bookIds.length + ", dimensions=" + dimensions() + "}";
    }
}
