package com.lorasim.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectivityMatrixTest {

    private static final List<String> ABC = List.of("A", "B", "C");

    @Test
    @DisplayName("starts fully disconnected")
    void disconnectedHasNoEdges() {
        var matrix = ConnectivityMatrix.disconnected(ABC);
        assertEquals("000000000", matrix.toBitstring());
        assertEquals(List.of(), matrix.reachableFrom("A"));
    }

    @Test
    @DisplayName("row i is reachability from node i")
    void rowMajorOrder() {
        // A -> B, B -> C
        var matrix = ConnectivityMatrix.parse(ABC, "010001000");
        assertTrue(matrix.reachable("A", "B"));
        assertFalse(matrix.reachable("B", "A"));
        assertTrue(matrix.reachable("B", "C"));
        assertEquals(List.of("B"), matrix.reachableFrom("A"));
        assertEquals(List.of("C"), matrix.reachableFrom("B"));
        assertEquals(List.of(), matrix.reachableFrom("C"));
    }

    @Test
    @DisplayName("self-loops are stored but never delivered")
    void reachableFromExcludesSelf() {
        var matrix = ConnectivityMatrix.parse(List.of("A", "B"), "1111");
        assertTrue(matrix.reachable("A", "A"));
        assertEquals(List.of("B"), matrix.reachableFrom("A"));
        assertEquals(List.of("A"), matrix.reachableFrom("B"));
    }

    @Test
    @DisplayName("rejects a bitstring of the wrong length")
    void rejectsWrongLength() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> ConnectivityMatrix.parse(ABC, "0101"));
        assertEquals("connectivity string length 4 != 3^2", e.getMessage());
    }

    @Test
    @DisplayName("rejects characters other than 0 and 1")
    void rejectsInvalidCharacters() {
        assertThrows(IllegalArgumentException.class, () -> ConnectivityMatrix.parse(List.of("A", "B"), "01x0"));
    }

    @Test
    @DisplayName("rejects duplicate node names")
    void rejectsDuplicateNames() {
        assertThrows(IllegalArgumentException.class, () -> ConnectivityMatrix.disconnected(List.of("A", "A")));
    }

    @Test
    void unknownNamesAreUnreachable() {
        var matrix = ConnectivityMatrix.parse(List.of("A", "B"), "0110");
        assertFalse(matrix.reachable("A", "Z"));
        assertEquals(List.of(), matrix.reachableFrom("Z"));
    }

    @Test
    void equalMatricesAreEqual() {
        var first = ConnectivityMatrix.parse(List.of("A", "B"), "0110");
        var second = ConnectivityMatrix.parse(List.of("A", "B"), "0110");
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, ConnectivityMatrix.disconnected(List.of("A", "B")));
    }
}
