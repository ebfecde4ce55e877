/**
 * A blocking in-process byte pipe.
 *
 * <p>
 * {@link org.jenkinsci.bytepipe.BytePipe#create()} returns a connected pair of a
 * {@link org.jenkinsci.bytepipe.PipeInputStream} and a {@link org.jenkinsci.bytepipe.PipeOutputStream}. Both ends
 * can be duplicated so that several threads write to, or read from, the same stream of bytes. Bytes come out in
 * exactly the order they went in.
 *
 * <p>
 * Readers tell "nothing yet" from "nothing ever again" by the number of open write endpoints, and writers tell that
 * nobody will ever read by the number of open read endpoints.
 */
package org.jenkinsci.bytepipe;
