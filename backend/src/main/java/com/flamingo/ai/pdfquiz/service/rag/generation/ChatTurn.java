package com.flamingo.ai.pdfquiz.service.rag.generation;

/**
 * One earlier message of a conversation.
 *
 * @param role {@code user} or {@code assistant}
 * @param content message text
 */
public record ChatTurn(String role, String content) {}
