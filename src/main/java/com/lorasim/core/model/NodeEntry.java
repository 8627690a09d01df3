package com.lorasim.core.model;

/**
 * One entry of a node's view of the network, as reported in a {@code get_state} response.
 * Values are kept verbatim; the node program decides their units.
 */
public record NodeEntry(
    String name,
    String timestamp,
    String latitude,
    String longitude
) {}
