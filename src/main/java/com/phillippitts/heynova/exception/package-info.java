/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.heynova.exception.HeyNovaException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.heynova.exception.TranscriptionException} - a transcription
 *       backend failed; {@link com.phillippitts.heynova.exception.UnintelligibleSpeechException}
 *       marks audio that reached a backend but was not understood</li>
 *   <li>{@link com.phillippitts.heynova.exception.BackendUnavailableException} - an external
 *       service is unreachable or misconfigured</li>
 *   <li>{@link com.phillippitts.heynova.exception.SkillExecutionException} - a matched skill
 *       could not perform its side effect</li>
 *   <li>{@link com.phillippitts.heynova.exception.ModelNotFoundException} - the offline model
 *       is missing at startup</li>
 * </ul>
 *
 * <p>None of these leave a dispatch cycle. Each is absorbed by the stage that raised it and
 * turned into an empty result, a degraded fallback or a spoken apology.
 *
 * @see com.phillippitts.heynova.exception.HeyNovaException
 * @since 1.0
 */
package com.phillippitts.heynova.exception;
