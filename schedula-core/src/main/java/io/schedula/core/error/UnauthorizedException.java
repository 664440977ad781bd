package io.schedula.core.error;

public final class UnauthorizedException extends SchedulaException {

    public UnauthorizedException(String message) {
        super("session", message);
    }

    @Override
    public int httpStatus() {
        return 401;
    }
}
