package com.fdsl.flow.graph;

import com.fdsl.flow.io.Transport;

import java.util.List;

/**
 * Client-facing surface. REST endpoints name a request and/or response entity;
 * WebSocket endpoints name the entities the client publishes and subscribes to.
 */
public record EndpointBinding(String name, Transport transport, String method, String path, List<String> params,
        String request, String response, String clientPublish, String clientSubscribe, String valueType) {

    public EndpointBinding {
        params = List.copyOf(params);
    }

    public boolean isDuplex() {
        return transport == Transport.WS;
    }
}
