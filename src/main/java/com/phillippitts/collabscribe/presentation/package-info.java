/**
 * REST presentation layer over the transcription core.
 *
 * <p>Controllers translate HTTP requests to coordinator calls; they hold no session state.
 *
 * @since 1.0
 */
package com.phillippitts.collabscribe.presentation;
