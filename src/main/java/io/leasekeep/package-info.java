/**
 * leasekeep source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.leasekeep.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.leasekeep.runtime.LeaseRuntime} wires the stack and drives the tick.</li>
 *   <li>{@code io.leasekeep.lease.SessionLockManager} owns the claim, save, release and force-load protocol.</li>
 *   <li>{@code io.leasekeep.storage.RemoteRecordGateway} retries single-record store calls through the write channel.</li>
 * </ul>
 */
package io.leasekeep;
