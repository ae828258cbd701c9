package io.kneo.autoflow.service.exceptions;

public class ActionDispatchException extends RuntimeException {

    public ActionDispatchException(String msg) {
        super(msg);
    }

    public ActionDispatchException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public String getDeveloperMessage() {
        return getMessage();
    }
}
