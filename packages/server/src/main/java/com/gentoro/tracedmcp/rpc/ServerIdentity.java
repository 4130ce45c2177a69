package com.gentoro.tracedmcp.rpc;

/** What {@code initialize} reports about this server. */
public record ServerIdentity(String name, String version, String instructions) {}
