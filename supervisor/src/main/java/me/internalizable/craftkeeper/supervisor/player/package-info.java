/**
 * Player identity and play time tracking built from server events.
 */
package me.internalizable.craftkeeper.supervisor.player;
