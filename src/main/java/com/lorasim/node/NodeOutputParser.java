package com.lorasim.node;

/**
 * Splits node stdout into push and pull traffic. The node program does not
 * know about the orchestrator's query protocol, so every line is classified
 * here, at the consumer.
 */
public final class NodeOutputParser {

    private NodeOutputParser() {}

    public static NodeOutput classify(String line) {
        String[] parts = line.split(",", 3);
        if (!NodeProtocol.TRANSMIT_PACKET.equals(parts[0])) {
            return new NodeOutput.Response(line);
        }
        if (parts.length < 3) {
            return new NodeOutput.MalformedTransmit(line);
        }
        return new NodeOutput.TransmitPacket(line, parts[1], parts[2]);
    }
}
