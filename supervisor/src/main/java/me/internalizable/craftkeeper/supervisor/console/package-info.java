/**
 * Parsing of server console output into typed matches.
 */
package me.internalizable.craftkeeper.supervisor.console;
