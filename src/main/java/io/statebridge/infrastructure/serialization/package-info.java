/**
 * Jackson streaming codecs for the state-bus JSON format.
 */
package io.statebridge.infrastructure.serialization;
