/**
 * JSON5 configuration.
 *
 * <p>{@code mailroom.json5} holds engine settings. Chains, pipelines and metrics may live inline or in
 * {@code chains.json5}, {@code pipelines.json5} and {@code metrics.json5} next to it.
 * <br>Each list has its own file in the lists directory.
 */
package com.mimecast.mailroom.config;
