/**
 * Session coordination: lifecycle, pause/resume, event intake and transcript queries.
 *
 * @see com.phillippitts.collabscribe.service.orchestration.TranscriptionSessionCoordinator
 */
package com.phillippitts.collabscribe.service.orchestration;
