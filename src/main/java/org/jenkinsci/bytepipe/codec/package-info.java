/**
 * Byte order aware encoding of fixed-width numbers over {@link java.io.InputStream}s and
 * {@link java.io.OutputStream}s.
 *
 * <p>
 * These are independent of the pipe, but since pipe endpoints are ordinary streams, structured values can be sent
 * through a pipe with them:
 *
 * <pre>
 * Endian.LITTLE.writeInt(pipe.getOut(), 42);
 * int answer = Endian.LITTLE.readInt(pipe.getIn());
 * </pre>
 */
package org.jenkinsci.bytepipe.codec;
