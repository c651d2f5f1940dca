package webqa.model;

/**
 * Raised by {@link JobCodec} when a queue message is not a usable
 * {@link TestCaseJob}: unparseable JSON, missing required fields or values of
 * the wrong type.
 */
public class MalformedJobException extends Exception {

    public MalformedJobException(String msg) {
        super(msg);
    }

    public MalformedJobException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
