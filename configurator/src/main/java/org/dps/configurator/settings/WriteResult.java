package org.dps.configurator.settings;

public record WriteResult(String setting, String previous, String value, Status status, String message) {

    public enum Status {
        ACCEPTED,
        /** Stored although invalid; only environment imports do this. */
        STORED_INVALID,
        REJECTED
    }

    static WriteResult accepted(String setting, String previous, String value) {
        return new WriteResult(setting, previous, value, Status.ACCEPTED, null);
    }

    static WriteResult storedInvalid(String setting, String previous, String value, String message) {
        return new WriteResult(setting, previous, value, Status.STORED_INVALID, message);
    }

    static WriteResult rejected(String setting, String previous, String value, String message) {
        return new WriteResult(setting, previous, value, Status.REJECTED, message);
    }

    public boolean isAccepted() {
        return status != Status.REJECTED;
    }

    public boolean isChanged() {
        return isAccepted() && !value.equals(previous);
    }
}
