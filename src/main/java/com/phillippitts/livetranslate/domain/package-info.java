/**
 * Immutable domain types: session configuration, processing jobs and outcomes, transcription
 * and translation results. Wire messages sent to clients live in {@code domain.message}.
 */
package com.phillippitts.livetranslate.domain;
