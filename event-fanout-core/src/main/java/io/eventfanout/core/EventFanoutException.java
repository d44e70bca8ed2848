package io.eventfanout.core;

/**
 * Base class for event fan-out related exceptions.
 *
 * <p>Provides a common hierarchy for configuration-time and runtime errors.
 * Subclasses should be specific to the error condition while preserving
 * the original cause when applicable.
 */
public abstract class EventFanoutException extends RuntimeException {

    protected EventFanoutException(String message) {
        super(message);
    }

    protected EventFanoutException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a provider slug is registered twice. This is a start-up configuration error.
     */
    public static class DuplicateProvider extends EventFanoutException {
        private final String slug;

        public DuplicateProvider(String slug) {
            super("event provider with slug '" + slug + "' is already registered");
            this.slug = slug;
        }

        public String slug() {
            return slug;
        }
    }

    /**
     * Raised when a slug is empty or contains characters that cannot appear in an event type.
     */
    public static class InvalidSlug extends EventFanoutException {
        public InvalidSlug(String message) {
            super(message);
        }
    }

    /**
     * Raised when an event payload cannot be encoded for the wire.
     */
    public static class EncodingFailed extends EventFanoutException {
        public EncodingFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
