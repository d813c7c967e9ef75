/**
 * Handler pipelines.
 *
 * <p>A {@link com.mimecast.mailroom.pipeline.Pipeline} runs its handlers in order and records a
 * completion marker after each one, so a redelivered entry resumes after the last completed handler.
 * <br>Handler failures are classified as transient or permanent; anything else is a bug and shunts the entry.
 */
package com.mimecast.mailroom.pipeline;
