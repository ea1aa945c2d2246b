/**
 * Relays in-game chat and server notices to an external chat service.
 */
package me.internalizable.craftkeeper.supervisor.bridge;
