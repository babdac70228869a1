package com.signals.arena.ws;

import java.io.IOException;

/**
 * Transport-neutral view of one live client channel.
 */
public interface ArenaConnection {

    String id();

    boolean isOpen();

    void send(String text) throws IOException;

    void close();
}
