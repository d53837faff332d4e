/**
 * Audio primitives: the fixed PCM target format, the per-session compressed byte buffer,
 * WAV writing and silence detection. Chunk decoders live in the {@code decode} subpackage.
 */
package com.phillippitts.livetranslate.service.audio;
