/**
 * Audio side channels: level metering, frame analysis and the audio pipeline seam.
 */
package com.phillippitts.collabscribe.service.audio;
