package com.lorasim.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable directed reachability relation over a fixed, ordered set of node names.
 * <p>
 * Stored row-major: entry {@code i * N + j} is true when node {@code i} reaches
 * node {@code j}. Self-reachability may be stored, but {@link #reachableFrom}
 * never includes the source itself.
 */
public final class ConnectivityMatrix {

    private final List<String> nodeNames;
    private final Map<String, Integer> indexByName;
    private final boolean[] bits;

    private ConnectivityMatrix(List<String> nodeNames, boolean[] bits) {
        this.nodeNames = List.copyOf(nodeNames);
        this.indexByName = new HashMap<>();
        for (int i = 0; i < this.nodeNames.size(); i++) {
            if (indexByName.put(this.nodeNames.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate node name: " + this.nodeNames.get(i));
            }
        }
        this.bits = bits;
    }

    /**
     * A matrix in which no node reaches any other.
     */
    public static ConnectivityMatrix disconnected(List<String> nodeNames) {
        return new ConnectivityMatrix(nodeNames, new boolean[nodeNames.size() * nodeNames.size()]);
    }

    /**
     * Parses a row-major bitstring of {@code '0'}/{@code '1'} characters.
     *
     * @throws IllegalArgumentException if the length is not N*N or a character is not 0/1
     */
    public static ConnectivityMatrix parse(List<String> nodeNames, String bitstring) {
        int n = nodeNames.size();
        if (bitstring.length() != n * n) {
            throw new IllegalArgumentException("connectivity string length " + bitstring.length()
                    + " != " + n + "^2");
        }
        boolean[] bits = new boolean[n * n];
        for (int i = 0; i < bits.length; i++) {
            char c = bitstring.charAt(i);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException("invalid character '" + c
                        + "' at position " + i + " of connectivity string");
            }
            bits[i] = c == '1';
        }
        return new ConnectivityMatrix(nodeNames, bits);
    }

    public List<String> nodeNames() {
        return nodeNames;
    }

    public int size() {
        return nodeNames.size();
    }

    /**
     * Raw stored relation, including self-loops. Unknown names are unreachable.
     */
    public boolean reachable(String src, String dst) {
        Integer i = indexByName.get(src);
        Integer j = indexByName.get(dst);
        if (i == null || j == null) {
            return false;
        }
        return bits[i * nodeNames.size() + j];
    }

    /**
     * Destinations reachable from {@code src}, excluding {@code src}, in node order.
     */
    public List<String> reachableFrom(String src) {
        Integer i = indexByName.get(src);
        if (i == null) {
            return List.of();
        }
        int n = nodeNames.size();
        var result = new ArrayList<String>();
        for (int j = 0; j < n; j++) {
            if (j != i && bits[i * n + j]) {
                result.add(nodeNames.get(j));
            }
        }
        return result;
    }

    public String toBitstring() {
        var sb = new StringBuilder(bits.length);
        for (boolean bit : bits) {
            sb.append(bit ? '1' : '0');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectivityMatrix other)) return false;
        return nodeNames.equals(other.nodeNames) && Arrays.equals(bits, other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * nodeNames.hashCode() + Arrays.hashCode(bits);
    }

    @Override
    public String toString() {
        return "ConnectivityMatrix" + nodeNames + "[" + toBitstring() + "]";
    }
}
