package com.phillippitts.collabscribe.service.session.event;

import com.phillippitts.collabscribe.domain.SessionSummary;

/**
 * Published with the analytics of a session that just stopped.
 */
public record SessionSummaryGeneratedEvent(SessionSummary summary) { }
