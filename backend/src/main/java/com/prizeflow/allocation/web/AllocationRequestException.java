package com.prizeflow.allocation.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class AllocationRequestException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final boolean retryable;

    public AllocationRequestException(HttpStatus status, String code, String message) {
        this(status, code, message, false);
    }

    public AllocationRequestException(HttpStatus status, String code, String message, boolean retryable) {
        super(message);
        this.status = status;
        this.code = code;
        this.retryable = retryable;
    }

    public static AllocationRequestException emptyDecisions(String detail) {
        return new AllocationRequestException(HttpStatus.BAD_REQUEST, "empty_decisions", detail);
    }

    public static AllocationRequestException noAwards(String detail) {
        return new AllocationRequestException(HttpStatus.BAD_REQUEST, "no_awards", detail);
    }

    public static AllocationRequestException tooManyDecisions(String detail) {
        return new AllocationRequestException(HttpStatus.BAD_REQUEST, "too_many_decisions", detail);
    }

    public static AllocationRequestException duplicatePrize(String detail) {
        return new AllocationRequestException(HttpStatus.BAD_REQUEST, "duplicate_prize", detail);
    }

    public static AllocationRequestException unknownReference(String detail) {
        return new AllocationRequestException(HttpStatus.BAD_REQUEST, "unknown_reference", detail);
    }

    public static AllocationRequestException actorNotAuthorized(String detail) {
        return new AllocationRequestException(HttpStatus.FORBIDDEN, "actor_not_authorized", detail);
    }

    public static AllocationRequestException actorRequired(String detail) {
        return new AllocationRequestException(HttpStatus.UNAUTHORIZED, "actor_required", detail);
    }

    public static AllocationRequestException invalidActor(String detail) {
        return new AllocationRequestException(HttpStatus.BAD_REQUEST, "invalid_actor_id", detail);
    }

    public static AllocationRequestException versionConflict(String detail) {
        return new AllocationRequestException(HttpStatus.CONFLICT, "version_conflict", detail, true);
    }

    public static AllocationRequestException conflictAlreadyResolved(String detail) {
        return new AllocationRequestException(HttpStatus.CONFLICT, "conflict_already_resolved", detail);
    }
}
