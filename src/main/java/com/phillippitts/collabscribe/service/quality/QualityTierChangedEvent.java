package com.phillippitts.collabscribe.service.quality;

import com.phillippitts.collabscribe.domain.QualityTier;

import java.time.Instant;

/**
 * Published when the rolling audio level crosses into a different quality tier.
 *
 * @param previous tier before the sample
 * @param current tier after the sample
 * @param averageLevelDb window average that produced {@code current}
 * @param at when the change was observed
 */
public record QualityTierChangedEvent(QualityTier previous, QualityTier current,
                                      double averageLevelDb, Instant at) { }
