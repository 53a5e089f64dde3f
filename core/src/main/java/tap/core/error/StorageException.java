package tap.core.error;

/**
 * The quota journal could not be read or written.
 */
public class StorageException extends TapException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }

    public StorageException(String message) {
        super(ErrorCode.STORAGE_ERROR, message);
    }
}
