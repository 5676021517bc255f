package me.christianrobert.spmodernize.core.job;

/**
 * A job that changes objects in the target database.
 *
 * @param <T> The type of result data produced by the write operation (e.g. BatchSummary)
 */
public interface DatabaseWriteJob<T> extends Job<T> {

    /**
     * @return The database written to, e.g. "SQLSERVER"
     */
    String getTargetDatabase();

    /**
     * @return The kind of write, e.g. "PROCEDURE_MODERNIZATION"
     */
    String getWriteOperationType();

    Class<T> getResultType();

    /**
     * @return A unique identifier combining target database and operation type
     */
    default String getJobTypeIdentifier() {
        return getTargetDatabase() + "_" + getWriteOperationType();
    }
}
