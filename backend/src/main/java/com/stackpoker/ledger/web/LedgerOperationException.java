package com.stackpoker.ledger.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Rejection of a single ledger operation. Thrown before any state is mutated, so the
 * surrounding transaction rolls back cleanly.
 */
@Getter
public class LedgerOperationException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public LedgerOperationException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static LedgerOperationException invalidAmount(String detail) {
        return new LedgerOperationException(HttpStatus.BAD_REQUEST, "invalid_amount", detail);
    }

    public static LedgerOperationException invalidTimestamp(String detail) {
        return new LedgerOperationException(HttpStatus.BAD_REQUEST, "invalid_timestamp", detail);
    }

    public static LedgerOperationException invalidNote(String detail) {
        return new LedgerOperationException(HttpStatus.BAD_REQUEST, "invalid_note", detail);
    }

    public static LedgerOperationException invalidPercentage(String detail) {
        return new LedgerOperationException(HttpStatus.BAD_REQUEST, "invalid_percentage", detail);
    }

    public static LedgerOperationException invalidMarkup(String detail) {
        return new LedgerOperationException(HttpStatus.BAD_REQUEST, "invalid_markup", detail);
    }

    public static LedgerOperationException missingStaker(String detail) {
        return new LedgerOperationException(HttpStatus.BAD_REQUEST, "missing_staker", detail);
    }

    public static LedgerOperationException ambiguousStaker(String detail) {
        return new LedgerOperationException(HttpStatus.BAD_REQUEST, "ambiguous_staker", detail);
    }

    public static LedgerOperationException duplicateStake(String detail) {
        return new LedgerOperationException(HttpStatus.CONFLICT, "duplicate_stake", detail);
    }

    public static LedgerOperationException uninitializedSession(String detail) {
        return new LedgerOperationException(HttpStatus.CONFLICT, "uninitialized_session", detail);
    }

    public static LedgerOperationException invalidTransition(String detail) {
        return new LedgerOperationException(HttpStatus.CONFLICT, "invalid_transition", detail);
    }

    public static LedgerOperationException stakeAlreadySettled(String detail) {
        return new LedgerOperationException(HttpStatus.CONFLICT, "stake_already_settled", detail);
    }

    public static LedgerOperationException notStakeParty(String detail) {
        return new LedgerOperationException(HttpStatus.FORBIDDEN, "not_stake_party", detail);
    }

    public static LedgerOperationException selfConfirmation(String detail) {
        return new LedgerOperationException(HttpStatus.CONFLICT, "self_confirmation", detail);
    }

    public static LedgerOperationException sessionNotFound(String detail) {
        return new LedgerOperationException(HttpStatus.NOT_FOUND, "session_not_found", detail);
    }

    public static LedgerOperationException stakeNotFound(String detail) {
        return new LedgerOperationException(HttpStatus.NOT_FOUND, "stake_not_found", detail);
    }

    public static LedgerOperationException manualStakerNotFound(String detail) {
        return new LedgerOperationException(HttpStatus.NOT_FOUND, "manual_staker_not_found", detail);
    }
}
