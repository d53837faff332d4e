/**
 * Runtime exception hierarchy rooted at {@link com.phillippitts.livetranslate.exception.LiveTranslateException}.
 *
 * <p>Wire-level problems surface as {@link com.phillippitts.livetranslate.exception.MalformedMessageException}
 * and never reach the processing pool. Collaborator failures (decode, transcribe, translate) are caught
 * at the dispatcher boundary and turned into a failed
 * {@link com.phillippitts.livetranslate.domain.ProcessingOutcome}.
 */
package com.phillippitts.livetranslate.exception;
