package io.b2mash.credentialjobs.orchestrator;

/** What the orchestrator returned after a task update. */
public record TaskAcknowledgement(String taskId, String status, String updatedBy) {}
