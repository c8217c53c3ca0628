package com.fdsl.flow.io;

import java.util.Locale;

public enum Transport {
    REST, WS;

    public static Transport fromString(String s) {
        if (s == null)
            return REST;
        String t = s.trim().toUpperCase(Locale.ROOT);
        if (t.equals("WEBSOCKET"))
            return WS;
        try {
            return Transport.valueOf(t);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown transport: " + s, e);
        }
    }
}
