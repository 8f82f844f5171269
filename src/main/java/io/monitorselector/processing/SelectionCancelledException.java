package io.monitorselector.processing;

import io.monitorselector.SelectorException;

/**
 * Processing of a server was interrupted between two changes. Thrown inside the server's
 * transaction so nothing from the pass is committed.
 */
public class SelectionCancelledException extends SelectorException {

    public SelectionCancelledException(long serverId) {
        super("Selection cancelled while processing server " + serverId);
    }
}
