/**
 * Built in rules.
 */
package com.mimecast.mailroom.rules.builtin;
