/**
 * Immutable value types that flow through one dispatch cycle: utterances, transcription
 * results, routing outcomes and fallback decisions. Nothing here outlives a cycle.
 */
package com.phillippitts.heynova.domain;
