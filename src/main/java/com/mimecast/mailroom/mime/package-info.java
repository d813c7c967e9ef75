/**
 * Header level message model.
 *
 * <p>The {@link com.mimecast.mailroom.mime.MailMessage} keeps headers editable and the body as raw bytes,
 * <br>so handlers can cook headers without re-encoding the content.
 */
package com.mimecast.mailroom.mime;
