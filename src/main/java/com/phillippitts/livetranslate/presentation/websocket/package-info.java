/**
 * WebSocket endpoint of the streaming protocol and its JSON wire codec.
 */
package com.phillippitts.livetranslate.presentation.websocket;
