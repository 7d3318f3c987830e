/**
 * xrelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.xrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.xrelay.cli.XRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.xrelay.runtime.XRelayRuntime} owns the pool, refill, dispatch and sweeping.</li>
 *   <li>{@code io.xrelay.storage.RelayRepository} is the contract both relay stores implement.</li>
 * </ul>
 */
package io.xrelay;
