/**
 * Per-connection streaming sessions: buffering, interim and final scheduling, and result
 * emission.
 */
package com.phillippitts.livetranslate.service.session;
