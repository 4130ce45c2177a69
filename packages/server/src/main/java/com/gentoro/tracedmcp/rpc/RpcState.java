package com.gentoro.tracedmcp.rpc;

/** Lifecycle of one request inside the dispatcher. States only move forward. */
public enum RpcState {
  RECEIVED,
  PARSED,
  AUTHORIZED,
  DISPATCHING,
  COMPLETED
}
