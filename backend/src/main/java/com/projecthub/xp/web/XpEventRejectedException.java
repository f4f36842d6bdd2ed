package com.projecthub.xp.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class XpEventRejectedException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public XpEventRejectedException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static XpEventRejectedException unknownEventType(String detail) {
        return new XpEventRejectedException(
                HttpStatus.BAD_REQUEST,
                "unknown_event_type",
                detail
        );
    }

    public static XpEventRejectedException malformedEvent(String detail) {
        return new XpEventRejectedException(
                HttpStatus.BAD_REQUEST,
                "malformed_event",
                detail
        );
    }

    public static XpEventRejectedException unknownActor(String detail) {
        return new XpEventRejectedException(
                HttpStatus.NOT_FOUND,
                "unknown_actor",
                detail
        );
    }

    public static XpEventRejectedException botAlertNotFound(String detail) {
        return new XpEventRejectedException(
                HttpStatus.NOT_FOUND,
                "bot_alert_not_found",
                detail
        );
    }

    public static XpEventRejectedException disputeNotAllowed(String detail) {
        return new XpEventRejectedException(
                HttpStatus.FORBIDDEN,
                "dispute_not_allowed",
                detail
        );
    }

    public static XpEventRejectedException alertAlreadyReviewed(String detail) {
        return new XpEventRejectedException(
                HttpStatus.CONFLICT,
                "alert_already_reviewed",
                detail
        );
    }
}
