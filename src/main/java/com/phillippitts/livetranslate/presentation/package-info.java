/**
 * Presentation layer: the WebSocket streaming endpoint and REST controllers.
 *
 * <p>Presentation depends on service, never the reverse. Handlers are thin adapters that parse
 * input and delegate to {@code service.session}.
 *
 * @see com.phillippitts.livetranslate.presentation.websocket
 * @see com.phillippitts.livetranslate.presentation.controller
 */
package com.phillippitts.livetranslate.presentation;
