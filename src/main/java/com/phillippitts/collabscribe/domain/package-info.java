/**
 * Immutable value types shared by every layer of the transcription core.
 *
 * <p>Domain models are records that validate themselves on construction and carry no framework
 * annotations.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.collabscribe.domain.TranscriptionSegment} - one interim or final
 *       span of attributed speech</li>
 *   <li>{@link com.phillippitts.collabscribe.domain.SpeakerProfile} - moving-average voice features
 *       of a speaker</li>
 *   <li>{@link com.phillippitts.collabscribe.domain.SessionSummary} - end-of-session analytics</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.collabscribe.domain;
