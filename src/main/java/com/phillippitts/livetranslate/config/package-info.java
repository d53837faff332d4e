/**
 * Spring configuration: typed properties, executors, WebSocket registration, startup
 * validation of the transcription engine and logging helpers.
 */
package com.phillippitts.livetranslate.config;
