package pacer.core.exception;

/**
 * Thrown when the backing table of a persistent store does not exist.
 */
public class TableNotFoundException extends RateLimitStoreException {

    private final String tableName;

    public TableNotFoundException(String tableName, String setupHint, Throwable cause) {
        super(
                "Table \"%s\" was not found. Create the table using your infrastructure (%s) before using this store."
                        .formatted(tableName, setupHint),
                cause);
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
