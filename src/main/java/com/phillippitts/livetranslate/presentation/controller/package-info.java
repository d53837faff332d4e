/**
 * REST endpoints.
 */
package com.phillippitts.livetranslate.presentation.controller;
