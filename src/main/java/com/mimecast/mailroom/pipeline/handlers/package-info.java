/**
 * Built in handlers.
 */
package com.mimecast.mailroom.pipeline.handlers;
