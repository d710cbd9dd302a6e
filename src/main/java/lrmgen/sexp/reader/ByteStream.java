// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.sexp.reader;

import java.io.IOException;
import java.io.InputStream;
import lrmgen.util.condition.ConditionContext;
import lrmgen.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An input stream of bytes with single-byte lookahead.
 * <p>
 * This class provides the lookahead necessary for the S-expression {@link Reader} to work.
 */
public final class ByteStream {
    /**
     * Initializes a new byte stream that will read bytes from the given input stream.
     * <p>
     * The stream is buffered internally in order to provide lookahead, so the passed stream does not need to be
     * buffered for performance.
     */
    public ByteStream(final InputStream stream) {
        this.stream = stream;
        buffer = new byte[streamBufferCapacity];
        position = 0;
        bufferSize = 0;
    }

    /**
     * Returns {@code true} iff this byte stream has reached the end.
     * <p>
     * If {@code false} is returned, it becomes safe to peek at the current byte by calling {@link #peek()} and
     * to discard it by calling {@link #discardPeek()}. After discarding, this method needs to be called again.
     * <p>
     * This method may perform read calls on the associated input stream to refill the internal buffer and to determine
     * if the end of input has actually been reached. If an I/O error occurs, the {@link IOException} is caught
     * and signaled as a fatal {@link IOExceptionCondition}.
     */
    public boolean reachedEnd() {
        return position >= bufferSize && refill().hitEof();
    }

    /**
     * Returns the current byte of this stream, without advancing the current position.
     * <p>
     * Calling this method without checking if the stream is at the end by calling {@link #reachedEnd()} first is
     * an error. This is not checked in any way.
     */
    public byte peek() {
        assert position < bufferSize;
        return buffer[position];
    }

    /**
     * Discards the current byte, advancing to the next one.
     * <p>
     * Calling this method without checking if the stream is at the end by calling {@link #reachedEnd()} first is
     * an error. This is not checked in any way.
     */
    public void discardPeek() {
        position += 1;
    }

    @SuppressWarnings("ArrayEquality")
    private HitEof refill() {
        if (buffer == endOfInputMarker) {
            return HitEof.YES;
        }
        final var source = stream;
        if (source != null) {
            final int numberOfBytesRead;
            try {
                numberOfBytesRead = source.read(buffer);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            if (numberOfBytesRead > 0) {
                assert numberOfBytesRead <= buffer.length;
                position = 0;
                bufferSize = numberOfBytesRead;
                return HitEof.NO;
            }
        }
        // Drop the stream so that further calls don't attempt to read from it again.
        stream = null;
        buffer = endOfInputMarker;
        position = 0;
        bufferSize = 0;
        return HitEof.YES;
    }

    private static final int streamBufferCapacity = 8192;
    private static final byte[] endOfInputMarker = new byte[0];

    private @Nullable InputStream stream;
    private byte[] buffer;
    private int position;
    private int bufferSize;
}
