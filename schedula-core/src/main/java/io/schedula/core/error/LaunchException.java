package io.schedula.core.error;

/**
 * The job launcher refused a run request. The message is the launcher's own text.
 */
public final class LaunchException extends SchedulaException {

    public LaunchException(String message) {
        super("launch", message);
    }

    public LaunchException(String message, Throwable cause) {
        super("launch", message, cause);
    }

    @Override
    public int httpStatus() {
        return 500;
    }
}
