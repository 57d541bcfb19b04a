package com.tokendraw.engine.ledger.dto;

import java.util.List;

public record JsonRpcRequest(String jsonrpc, long id, String method, List<Object> params) {

  public static JsonRpcRequest of(long id, String method, List<Object> params) {
    return new JsonRpcRequest("2.0", id, method, params);
  }
}
