package io.watson.http.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Helpers for releasing response bodies.
 */
public final class ResponseBodies {
    private static final Logger log = LoggerFactory.getLogger(ResponseBodies.class);

    private ResponseBodies() {}

    /**
     * Reads {@code body} to the end, discarding the bytes, then closes it.
     *
     * @param body the body stream, may be null
     */
    public static void drainAndClose(InputStream body) {
        if (body == null) {
            return;
        }
        try (InputStream in = body) {
            in.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            log.debug("Failed to drain response body; the connection will not be reused", e);
        }
    }

    static InputStream orEmpty(InputStream body) {
        return body != null ? body : InputStream.nullInputStream();
    }
}
