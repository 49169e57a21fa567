package com.scenariomock.core.error;

/**
 * Raised by {@link com.scenariomock.core.http.Backend#execute} and by every record store and
 * builder operation. Callers branch on {@link #getKind()} rather than on the message.
 */
public class BackendException extends Exception {

    private final ErrorKind kind;

    public BackendException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackendException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static BackendException configuration(String message) {
        return new BackendException(ErrorKind.CONFIGURATION, message);
    }

    public static BackendException configuration(String message, Throwable cause) {
        return new BackendException(ErrorKind.CONFIGURATION, message, cause);
    }

    public static BackendException noMatch(String message) {
        return new BackendException(ErrorKind.NO_MATCH, message);
    }

    public static BackendException storage(String message, Throwable cause) {
        return new BackendException(ErrorKind.STORAGE, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isNoMatch() {
        return kind == ErrorKind.NO_MATCH;
    }

    @Override
    public String toString() {
        return "BackendException{" +
                "kind=" + kind +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
