package fr.lapetina.possibility.infrastructure.http;

import java.io.Closeable;
import java.io.IOException;

/**
 * Open response body of one possibility request, read line by line.
 * Closing the stream from another thread makes a blocked {@link #readLine()} fail.
 */
public interface GenerationStream extends Closeable {

    /**
     * @return next line without its terminator, or null once the body is exhausted
     */
    String readLine() throws IOException;
}
