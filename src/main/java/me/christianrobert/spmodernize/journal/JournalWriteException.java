package me.christianrobert.spmodernize.journal;

/**
 * The journal could not durably store or update a record.
 * An apply attempt that hits this must not commit anything.
 */
public class JournalWriteException extends JournalException {

    public JournalWriteException(String message) {
        super(message);
    }

    public JournalWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
