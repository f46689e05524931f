package com.openforge.toolbridge.llm;

import com.openforge.toolbridge.llm.model.Message;

import java.util.List;

/**
 * Opaque text-completion service: messages in, raw text out.
 *
 * Implementations block for at most their configured timeout and report every
 * failure (unreachable, timeout, bad status, empty answer) as
 * {@link LlmClient.LlmException}.
 */
public interface ModelBackend {

    String complete(List<Message> messages);
}
