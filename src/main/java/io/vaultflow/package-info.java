/**
 * VaultFlow source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.vaultflow.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.vaultflow.cli.VaultFlowCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.vaultflow.runtime.VaultFlowRuntime} wires the store, ledger and controllers of one vault.</li>
 *   <li>{@code io.vaultflow.storage.RecordStore} is the authoritative persistence contract.</li>
 * </ul>
 */
package io.vaultflow;
