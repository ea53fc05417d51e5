package dk.trustworks.leaveledger.exceptions;

import jakarta.ws.rs.core.Response;
import lombok.Getter;

/**
 * Base class of all domain failures raised by the ledger. The {@link ErrorType} decides
 * the HTTP status and the stable {@code code} clients switch on.
 */
@Getter
public abstract class LeaveLedgerException extends RuntimeException {

    private final ErrorType errorType;

    protected LeaveLedgerException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public enum ErrorType {
        NOT_ALLOTTED(Response.Status.BAD_REQUEST, "Leave category is not allotted to the employee"),
        INSUFFICIENT_BALANCE(Response.Status.BAD_REQUEST, "Requested amount exceeds the remaining balance"),
        DUPLICATE_ALLOTMENT(Response.Status.CONFLICT, "Employee already holds an allotment for the category"),
        INVALID_CATEGORY(Response.Status.BAD_REQUEST, "Leave category is missing, inactive or in use"),
        INVALID_AMOUNT(Response.Status.BAD_REQUEST, "Leave amount cannot be derived from the request"),
        SELF_APPROVAL_FORBIDDEN(Response.Status.FORBIDDEN, "HR cannot decide their own leave requests"),
        UNAUTHORIZED(Response.Status.FORBIDDEN, "Actor is not allowed to perform the action"),
        NOT_FOUND(Response.Status.NOT_FOUND, "Record not found"),
        INVALID_TRANSITION(Response.Status.CONFLICT, "Status change is not allowed");

        private final Response.Status status;
        private final String description;

        ErrorType(Response.Status status, String description) {
            this.status = status;
            this.description = description;
        }

        public Response.Status getStatus() {
            return status;
        }

        public String getDescription() {
            return description;
        }
    }
}
