package com.agentloom.core.memory;

import com.agentloom.core.model.Content;

import java.time.Instant;

/**
 * One remembered snippet.
 *
 * @param content   the remembered content
 * @param author    who produced it (nullable)
 * @param timestamp when it was recorded (nullable)
 */
public record MemoryEntry(Content content, String author, Instant timestamp) {}
