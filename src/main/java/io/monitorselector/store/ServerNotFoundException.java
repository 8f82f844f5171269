package io.monitorselector.store;

import io.monitorselector.SelectorException;

/**
 * The server under review no longer exists.
 */
public class ServerNotFoundException extends SelectorException {

    public ServerNotFoundException(long serverId) {
        super("Server not found: " + serverId);
    }
}
