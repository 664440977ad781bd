package io.schedula.core.error;

public final class ValidationException extends SchedulaException {
    private final String field;

    public ValidationException(String field, String message) {
        super("validation", message);
        this.field = field;
    }

    public String field() {
        return field;
    }

    @Override
    public int httpStatus() {
        return 400;
    }
}
