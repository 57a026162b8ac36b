package com.relay.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Base shape for JSON-RPC requests carried in envelope payloads.
 * Subclass to bind a request topic to a concrete params type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonRpcRequest {
    private long id;
    private String jsonrpc = "2.0";
    private String method;
    private JsonNode params;

    public JsonRpcRequest() {
    }

    public JsonRpcRequest(long id, String method, JsonNode params) {
        this.id = id;
        this.method = method;
        this.params = params;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public void setJsonrpc(String jsonrpc) {
        this.jsonrpc = jsonrpc;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public JsonNode getParams() {
        return params;
    }

    public void setParams(JsonNode params) {
        this.params = params;
    }
}
