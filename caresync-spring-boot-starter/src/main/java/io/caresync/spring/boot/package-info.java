/**
 * Spring Boot auto-configuration for the care scheduler.
 */
package io.caresync.spring.boot;
