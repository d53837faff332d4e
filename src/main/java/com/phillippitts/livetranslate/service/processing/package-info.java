/**
 * Heavy work off the session path: {@link com.phillippitts.livetranslate.service.processing.ProcessingDispatcher}
 * hands jobs to the bounded processing pool, where
 * {@link com.phillippitts.livetranslate.service.processing.TranscriptionPipeline} runs decode,
 * transcription and translation and turns any failure into a typed outcome.
 */
package com.phillippitts.livetranslate.service.processing;
