package com.lorasim.node;

/**
 * Receives the payload of every {@code transmit_packet} a node emits.
 */
@FunctionalInterface
public interface PacketListener {

    void onTransmit(String source, String hexData);
}
