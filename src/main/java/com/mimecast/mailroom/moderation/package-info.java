/**
 * Held message ledger and moderator actions.
 *
 * @see com.mimecast.mailroom.moderation.ModerationService
 */
package com.mimecast.mailroom.moderation;
