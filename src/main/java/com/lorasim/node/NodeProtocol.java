package com.lorasim.node;

/**
 * Line protocol spoken with node processes over stdin/stdout.
 */
public final class NodeProtocol {

    private NodeProtocol() {}

    /** Query sent to a node; the answer line starts with the same token. */
    public static final String GET_STATE = "get_state";

    /** Command delivering a forwarded payload: {@code network_receive_packet,<HEXDATA>}. */
    public static final String RECEIVE_PACKET = "network_receive_packet";

    /** Push notification emitted by a node: {@code transmit_packet,<LEN>,<HEXDATA>}. */
    public static final String TRANSMIT_PACKET = "transmit_packet";

    public static String receivePacket(String hexData) {
        return RECEIVE_PACKET + "," + hexData;
    }
}
