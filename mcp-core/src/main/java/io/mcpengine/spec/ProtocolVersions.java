/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.spec;

/**
 * Published Model Context Protocol revisions.
 */
public interface ProtocolVersions {

	String MCP_2024_11_05 = "2024-11-05";

	String MCP_2025_03_26 = "2025-03-26";

	String MCP_2025_06_18 = "2025-06-18";

	String MCP_2025_11_25 = "2025-11-25";

}
