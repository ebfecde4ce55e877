/**
 * Data structures used by the pipe implementation.
 */
package org.jenkinsci.bytepipe.util;
