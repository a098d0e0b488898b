package com.agentrooms.shared.error;

public class DispatchException extends RuntimeException {

    private final ErrorKind kind;

    public DispatchException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DispatchException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isCancellation() {
        return kind == ErrorKind.CANCELLED;
    }

    public static DispatchException validation(String message) {
        return new DispatchException(ErrorKind.VALIDATION, message);
    }

    public static DispatchException authentication(String message) {
        return new DispatchException(ErrorKind.AUTHENTICATION, message);
    }

    public static DispatchException backend(String message) {
        return new DispatchException(ErrorKind.BACKEND, message);
    }

    public static DispatchException backend(String message, Throwable cause) {
        return new DispatchException(ErrorKind.BACKEND, message, cause);
    }

    public static DispatchException timeout(String message) {
        return new DispatchException(ErrorKind.TIMEOUT, message);
    }

    public static DispatchException cancelled() {
        return new DispatchException(ErrorKind.CANCELLED, "Request aborted");
    }
}
