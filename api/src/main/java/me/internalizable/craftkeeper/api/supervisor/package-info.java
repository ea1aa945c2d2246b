/**
 * Public API of the CraftKeeper process supervisor.
 *
 * <p>Collaborators such as web back ends, chat bridges and dashboards drive
 * servers and read their status through {@link me.internalizable.craftkeeper.api.supervisor.SupervisorAPI}.
 * Failures are reported through the unchecked
 * {@link me.internalizable.craftkeeper.api.supervisor.SupervisorException} hierarchy.</p>
 *
 * @see me.internalizable.craftkeeper.api.supervisor.SupervisorAPI
 */
package me.internalizable.craftkeeper.api.supervisor;
