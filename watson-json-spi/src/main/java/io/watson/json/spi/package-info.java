/**
 * Library-neutral JSON tree model used to decode Watson responses.
 */
package io.watson.json.spi;
