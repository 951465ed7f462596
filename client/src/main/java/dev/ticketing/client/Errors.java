package dev.ticketing.client;

import io.grpc.Status;

/**
 * Exception types for the ticketing engine.
 *
 * <p>Business-rule rejections are not exceptions; they travel as {@link Result#err} values.
 * The types here cover caller bugs, storage conflicts and transport-facing translation.
 */
public final class Errors {

    private Errors() {}

    /**
     * Base exception for all ticketing errors.
     */
    public static class ClientError extends RuntimeException {
        public ClientError(String message) {
            super(message);
        }

        public ClientError(String message, Throwable cause) {
            super(message, cause);
        }

        /**
         * Returns true if this is a "not found" error.
         */
        public boolean isNotFound() {
            return false;
        }

        /**
         * Returns true if this is a "precondition failed" error.
         */
        public boolean isPreconditionFailed() {
            return false;
        }

        /**
         * Returns true if this is an "invalid argument" error.
         */
        public boolean isInvalidArgument() {
            return false;
        }

        /**
         * Returns true if a concurrent writer got there first.
         */
        public boolean isConflict() {
            return false;
        }
    }

    /**
     * Thrown when a rejected command has to surface as an exception, e.g. at a transport edge.
     *
     * <p>Carries the stable domain error code and the gRPC status it maps to:
     * <ul>
     *   <li>{@link Status.Code#FAILED_PRECONDITION} - state precondition not met (e.g. "Ticket is already closed")
     *   <li>{@link Status.Code#INVALID_ARGUMENT} - invalid command input (e.g. "Title is required")
     *   <li>{@link Status.Code#NOT_FOUND} - the target ticket has no history
     * </ul>
     */
    public static class CommandRejectedError extends ClientError {
        private final String code;
        private final Status.Code statusCode;

        public CommandRejectedError(String code, String message, Status.Code statusCode) {
            super(message);
            this.code = code;
            this.statusCode = statusCode;
        }

        /**
         * The stable error code callers may branch on.
         */
        public String getCode() {
            return code;
        }

        public Status.Code getStatusCode() {
            return statusCode;
        }

        /**
         * Convert to gRPC Status for RPC responses.
         */
        public Status toGrpcStatus() {
            return Status.fromCode(statusCode).withDescription(code + ": " + getMessage());
        }

        @Override
        public boolean isNotFound() {
            return statusCode == Status.Code.NOT_FOUND;
        }

        @Override
        public boolean isPreconditionFailed() {
            return statusCode == Status.Code.FAILED_PRECONDITION;
        }

        @Override
        public boolean isInvalidArgument() {
            return statusCode == Status.Code.INVALID_ARGUMENT;
        }
    }

    /**
     * Thrown when an append does not match the stream's current sequence.
     * The caller should reload and decide again.
     */
    public static class ConcurrencyError extends ClientError {
        private final int expectedSequence;
        private final int actualSequence;

        public ConcurrencyError(String root, int expectedSequence, int actualSequence) {
            super(String.format("Sequence mismatch for %s: expected %d, stream is at %d",
                root, expectedSequence, actualSequence));
            this.expectedSequence = expectedSequence;
            this.actualSequence = actualSequence;
        }

        public int getExpectedSequence() {
            return expectedSequence;
        }

        public int getActualSequence() {
            return actualSequence;
        }

        public Status toGrpcStatus() {
            return Status.ABORTED.withDescription(getMessage());
        }

        @Override
        public boolean isConflict() {
            return true;
        }
    }

    /**
     * Thrown when {@code unwrap}/{@code unwrapErr} is called on the wrong variant.
     * Indicates a programming bug in the caller.
     */
    public static class UnwrapError extends ClientError {
        public UnwrapError(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a stored event cannot be unpacked.
     */
    public static class CodecError extends ClientError {
        public CodecError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when an invalid argument is provided.
     */
    public static class InvalidArgumentError extends ClientError {
        public InvalidArgumentError(String message) {
            super(message);
        }

        @Override
        public boolean isInvalidArgument() {
            return true;
        }
    }
}
