package com.relay.common.api;

import com.relay.common.exception.NetworkException;

import java.net.URI;

/**
 * Creates unconnected handles bound to a ws/wss URI
 */
public interface ConnectionFactory {

    ConnectionHandle create(URI uri) throws NetworkException;
}
