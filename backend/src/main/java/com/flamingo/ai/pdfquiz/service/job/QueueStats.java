package com.flamingo.ai.pdfquiz.service.job;

/**
 * Job counts of one queue.
 *
 * @param name queue name
 * @param length jobs waiting to start
 */
public record QueueStats(
    String name, long length, long started, long finished, long failed, long canceled) {}
