/**
 * Transcription engine configuration.
 *
 * <ul>
 *   <li>{@link com.phillippitts.livetranslate.config.stt.WhisperConfig} - {@code stt.whisper.*}
 *       (binary, model, timeout, threads)</li>
 *   <li>{@link com.phillippitts.livetranslate.config.stt.SttConcurrencyProperties} -
 *       {@code stt.concurrency.*}</li>
 * </ul>
 *
 * <p>Startup validation of the binary and model runs unless {@code stt.validation.enabled=false}.
 */
package com.phillippitts.livetranslate.config.stt;
