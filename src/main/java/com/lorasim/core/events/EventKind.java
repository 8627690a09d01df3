package com.lorasim.core.events;

/**
 * Record kinds of the simulation event log. The wire name is the second
 * comma-separated field of every log line.
 */
public enum EventKind {
    INITIALIZED("initialized"),
    CONNECTIVITY_UPDATE("connectivity_update"),
    TX("tx"),
    FORWARD("forward"),
    SEND_COMMAND("send_command"),
    STATE("state");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
