/**
 * Engine wiring and lifecycle.
 */
package com.mimecast.mailroom.main;
