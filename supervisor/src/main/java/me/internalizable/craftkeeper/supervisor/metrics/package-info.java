/**
 * Resource sampling of server processes and threshold based alerting.
 */
package me.internalizable.craftkeeper.supervisor.metrics;
