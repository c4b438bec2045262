package io.github.jbellis.smartmatch.lexicon;

/**
 * Thrown when a lexicon cannot be found, read or validated.
 */
public class LexiconException extends RuntimeException {
    public LexiconException(String message) {
        super(message);
    }

    public LexiconException(String message, Throwable cause) {
        super(message, cause);
    }
}
