package villagecompute.clipindex.data.bulk;

/**
 * Outcome of a bulk upsert.
 *
 * @param success
 *            rows written
 * @param failure
 *            rows rejected as invalid or that failed to write
 */
public record BulkWriteResult(int success, int failure) {

    public static BulkWriteResult empty() {
        return new BulkWriteResult(0, 0);
    }

    public BulkWriteResult plus(BulkWriteResult other) {
        return new BulkWriteResult(success + other.success, failure + other.failure);
    }

    public int total() {
        return success + failure;
    }
}
