/**
 * Operator console: command parsing and the interactive input loop.
 */
package me.internalizable.craftkeeper.supervisor.command;
