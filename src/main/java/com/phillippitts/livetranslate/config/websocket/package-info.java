/**
 * WebSocket endpoint registration.
 */
package com.phillippitts.livetranslate.config.websocket;
