package io.schedula.core.error;

public final class ConflictException extends SchedulaException {

    public ConflictException(String message) {
        super("conflict", message);
    }

    @Override
    public int httpStatus() {
        return 409;
    }
}
