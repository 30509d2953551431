/**
 * Runtime wiring.
 *
 * <p>{@link io.vaultflow.runtime.VaultFlowRuntime} builds the store, ledger and controllers of one
 * vault and exposes the operations the CLI offers; {@link io.vaultflow.runtime.ApprovalDispatcher}
 * is the loop that turns approved requests into executed, archived ones.
 */
package io.vaultflow.runtime;
