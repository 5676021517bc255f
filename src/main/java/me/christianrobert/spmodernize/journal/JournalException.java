package me.christianrobert.spmodernize.journal;

/**
 * The journal's backing store could not be read.
 */
public class JournalException extends RuntimeException {

    public JournalException(String message) {
        super(message);
    }

    public JournalException(String message, Throwable cause) {
        super(message, cause);
    }
}
