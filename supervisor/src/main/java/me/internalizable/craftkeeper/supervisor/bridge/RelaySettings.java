package me.internalizable.craftkeeper.supervisor.bridge;

/**
 * What a server relays to the external chat.
 *
 * @param chat player chat messages
 * @param playerEvents joins, leaves, advancements and deaths
 * @param status online, offline and crash notices
 */
public record RelaySettings(boolean chat, boolean playerEvents, boolean status) {

    public static RelaySettings all() {
        return new RelaySettings(true, true, true);
    }

    public static RelaySettings none() {
        return new RelaySettings(false, false, false);
    }
}
