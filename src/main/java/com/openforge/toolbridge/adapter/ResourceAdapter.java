package com.openforge.toolbridge.adapter;

import com.openforge.toolbridge.tool.ToolResult;

/**
 * One external resource exposed as a single fetch-by-id operation.
 *
 * Implementations never throw for upstream trouble: absence is reported as
 * NOT_FOUND and every transport problem as ADAPTER_ERROR. A non-positive id is
 * rejected before any outbound call. Nothing is cached and nothing is retried.
 */
public interface ResourceAdapter {

    /** Name of the tool this adapter backs, e.g. "post_call". */
    String toolName();

    ToolResult fetch(long id);
}
