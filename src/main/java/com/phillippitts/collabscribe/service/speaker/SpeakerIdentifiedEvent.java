package com.phillippitts.collabscribe.service.speaker;

import com.phillippitts.collabscribe.domain.SpeakerMatch;

import java.time.Instant;

/**
 * Published when an audio frame from {@code channelParticipantId} matched a known speaker profile.
 * Annotation only; transcript attribution always follows the channel.
 *
 * @param channelParticipantId participant whose channel delivered the frame
 * @param match matched speaker and similarity
 * @param at when the match was made
 */
public record SpeakerIdentifiedEvent(String channelParticipantId, SpeakerMatch match, Instant at) { }
