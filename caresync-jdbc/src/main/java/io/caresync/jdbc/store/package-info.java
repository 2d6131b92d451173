/**
 * Store implementations over the tables created by the dialect schema scripts.
 */
package io.caresync.jdbc.store;
