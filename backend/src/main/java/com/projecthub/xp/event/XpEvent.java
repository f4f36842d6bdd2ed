package com.projecthub.xp.event;

import java.time.OffsetDateTime;

/**
 * A validated domain event. Each implementation carries exactly the references its {@link XpEventType} needs,
 * so consumers switch on {@link #type()} and cast to the matching record.
 */
public interface XpEvent {

    XpEventType type();

    OffsetDateTime occurredAt();
}
