/**
 * Built-in dialects and the {@link io.caresync.jdbc.dialect.Dialects} registry.
 */
package io.caresync.jdbc.dialect;
