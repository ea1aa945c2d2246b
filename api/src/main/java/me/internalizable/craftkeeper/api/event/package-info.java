/**
 * Typed event stream produced by supervised servers.
 */
package me.internalizable.craftkeeper.api.event;
