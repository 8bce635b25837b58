package com.saltbet.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum BettingError {
    INVALID_AMOUNT(Category.VALIDATION, HttpStatus.BAD_REQUEST, "invalid_amount"),
    NO_OPEN_MATCH(Category.VALIDATION, HttpStatus.CONFLICT, "no_open_match"),
    MATCH_LOCKED(Category.VALIDATION, HttpStatus.CONFLICT, "match_locked"),
    INSUFFICIENT_FUNDS(Category.VALIDATION, HttpStatus.CONFLICT, "insufficient_funds"),
    DUPLICATE_MATCH(Category.STATE_CONFLICT, HttpStatus.CONFLICT, "duplicate_match"),
    MATCH_NOT_FOUND(Category.STATE_CONFLICT, HttpStatus.NOT_FOUND, "match_not_found"),
    ALREADY_CONCLUDED(Category.STATE_CONFLICT, HttpStatus.CONFLICT, "already_concluded"),
    NO_ACTIVE_STAKE(Category.STATE_CONFLICT, HttpStatus.CONFLICT, "no_active_stake"),
    STAKE_EXCEEDS_ACTIVE(Category.STATE_CONFLICT, HttpStatus.CONFLICT, "stake_exceeds_active"),
    MATCH_NOT_LOCKED(Category.STATE_CONFLICT, HttpStatus.CONFLICT, "match_not_locked"),
    UNRESOLVED_WINNER(Category.STATE_CONFLICT, HttpStatus.CONFLICT, "unresolved_winner"),
    USER_NOT_FOUND(Category.STATE_CONFLICT, HttpStatus.NOT_FOUND, "user_not_found"),
    CORRUPT_WINNER_MAPPING(Category.INTEGRITY, HttpStatus.INTERNAL_SERVER_ERROR, "corrupt_winner_mapping");

    private final Category category;
    private final HttpStatus status;
    private final String code;

    BettingError(Category category, HttpStatus status, String code) {
        this.category = category;
        this.status = status;
        this.code = code;
    }

    public enum Category {
        VALIDATION,
        STATE_CONFLICT,
        INTEGRITY
    }
}
