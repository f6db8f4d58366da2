/**
 * Pluggable HTTP transport used by the Watson client.
 *
 * <p>{@link io.watson.http.spi.JdkHttpClientAdapter} needs nothing beyond the JDK. The OkHttp and
 * Apache HttpClient 5 adapters are compiled against optional dependencies and only load when the
 * corresponding library is on the classpath.
 */
package io.watson.http.spi;
