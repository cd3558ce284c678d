/**
 * Logging helpers: payload truncation, secret masking and CLI-driven Logback levels.
 */
package ca.gc.cra.docrelay.logging;
