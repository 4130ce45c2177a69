package com.gentoro.tracedmcp.rpc;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.tracedmcp.tools.ToolException;
import com.gentoro.tracedmcp.tools.ToolRegistry;
import io.modelcontextprotocol.spec.McpSchema.ErrorCodes;
import java.util.Collection;

/** Maps {@link ToolException} kinds onto JSON-RPC errors. */
final class ToolErrors {
  private ToolErrors() {}

  static RpcException toRpcException(ToolException e) {
    ObjectNode data = McpMethodRouter.toolData(e.getToolName());
    switch (e.getKind()) {
      case NOT_FOUND:
        return new RpcException(ErrorCodes.INVALID_PARAMS, e.getMessage(), data, e);
      case INVALID_PARAMS:
        ArrayNode violations = data.putArray("violations");
        Object raw = e.getContext().get(ToolRegistry.CONTEXT_VIOLATIONS);
        if (raw instanceof Collection<?> list) {
          list.forEach(v -> violations.add(String.valueOf(v)));
        }
        return new RpcException(ErrorCodes.INVALID_PARAMS, e.getMessage(), data, e);
      case EXECUTION_FAILED:
        Object detail = e.getContext().get(ToolRegistry.CONTEXT_DETAIL);
        data.put("detail", detail == null ? e.getMessage() : String.valueOf(detail));
        return new RpcException(RpcException.EXECUTION_FAILED, e.getMessage(), data, e);
      default:
        return RpcException.internal(e.getMessage(), e);
    }
  }
}
