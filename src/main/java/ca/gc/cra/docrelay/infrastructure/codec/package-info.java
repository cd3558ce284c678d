/**
 * Jackson streaming codecs for JSON and MessagePack payloads.
 */
package ca.gc.cra.docrelay.infrastructure.codec;
