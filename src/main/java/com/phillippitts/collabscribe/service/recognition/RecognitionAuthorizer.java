package com.phillippitts.collabscribe.service.recognition;

/**
 * Reports whether the host granted access to the speech recognition capability.
 */
@FunctionalInterface
public interface RecognitionAuthorizer {

    boolean isAuthorized();
}
