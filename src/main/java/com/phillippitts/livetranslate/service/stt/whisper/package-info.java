/**
 * whisper.cpp integration: process management, JSON parsing and the engine itself.
 */
package com.phillippitts.livetranslate.service.stt.whisper;
