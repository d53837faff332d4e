/**
 * Speech-to-text collaborator. {@link com.phillippitts.livetranslate.service.stt.SttEngine} is
 * the seam the pipeline depends on; the production engine shells out to whisper.cpp.
 */
package com.phillippitts.livetranslate.service.stt;
