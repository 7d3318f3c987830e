/**
 * Runtime wiring package.
 *
 * <p>{@link io.xrelay.runtime.XRelayRuntime} selects the relay store, keeps the pool topped up
 * from the configured feeds and exposes dispatch and maintenance to the CLI and the gateway.
 */
package io.xrelay.runtime;
