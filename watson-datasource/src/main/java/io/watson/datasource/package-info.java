/**
 * Host-facing layer over the Watson client: provider configuration and data sources that report
 * problems as {@link io.watson.datasource.Diagnostics} instead of exceptions.
 */
package io.watson.datasource;
