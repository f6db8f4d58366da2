/**
 * Spring Boot auto-configuration for the Watson client.
 */
package io.watson.spring.boot;
