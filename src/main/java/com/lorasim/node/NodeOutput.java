package com.lorasim.node;

/**
 * Classification of one line read from a node's stdout.
 * <p>
 * {@link TransmitPacket} lines are push events routed by the orchestrator;
 * {@link Response} lines are candidates for a pending query.
 */
public sealed interface NodeOutput
        permits NodeOutput.TransmitPacket, NodeOutput.Response, NodeOutput.MalformedTransmit {

    String line();

    /**
     * {@code transmit_packet,<LEN>,<HEXDATA>}. The length is kept verbatim.
     */
    record TransmitPacket(String line, String length, String hexData) implements NodeOutput {}

    /**
     * Any line that is not a transmit notification.
     */
    record Response(String line) implements NodeOutput {}

    /**
     * A {@code transmit_packet} line without its data field; dropped.
     */
    record MalformedTransmit(String line) implements NodeOutput {}
}
