package io.schedula.core.error;

public final class RequestExpiredException extends SchedulaException {

    public RequestExpiredException(String message) {
        super("timeout", message);
    }

    @Override
    public int httpStatus() {
        return 503;
    }
}
