package io.schedula.core.error;

public final class EventNotFoundException extends SchedulaException {
    private final String eventId;

    public EventNotFoundException(String eventId) {
        super("event", "Failed to locate event: " + eventId);
        this.eventId = eventId;
    }

    public String eventId() {
        return eventId;
    }

    @Override
    public int httpStatus() {
        return 404;
    }
}
