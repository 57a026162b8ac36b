package com.relay.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Base shape for JSON-RPC responses carried in envelope payloads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonRpcResponse {
    private long id;
    private String jsonrpc = "2.0";
    private JsonNode result;
    private JsonRpcError error;

    public JsonRpcResponse() {
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

    public JsonNode getResult() {
        return result;
    }

    public void setResult(JsonNode result) {
        this.result = result;
    }

    public JsonRpcError getError() {
        return error;
    }

    public void setError(JsonRpcError error) {
        this.error = error;
    }

    public boolean hasError() {
        return error != null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JsonRpcError {
        private int code;
        private String message;

        public JsonRpcError() {
        }

        public JsonRpcError(int code, String message) {
            this.code = code;
            this.message = message;
        }

        public int getCode() {
            return code;
        }

        public void setCode(int code) {
            this.code = code;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }
    }
}
