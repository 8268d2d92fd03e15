/**
 * Transcription core services.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.ledger} - time-ordered segment store and its queries</li>
 *   <li>{@code service.session} - per-session state, the command queue and lifecycle events</li>
 *   <li>{@code service.recognition} - applies partial/final recognizer results</li>
 *   <li>{@code service.flush} - periodic interim-segment materialization</li>
 *   <li>{@code service.orchestration} - the session coordinator</li>
 *   <li>{@code service.quality}, {@code service.speaker}, {@code service.audio} - audio side channels</li>
 *   <li>{@code service.summary}, {@code service.export} - end-of-session outputs</li>
 *   <li>{@code service.roster} - collaboration room and participant roster</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Every mutation of a session's ledger or participant state runs on its command queue</li>
 *   <li>Bad recognizer input is clamped or dropped and counted, never thrown</li>
 *   <li>Services use constructor injection and are wired in {@code TranscriptionConfig}</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.collabscribe.service;
