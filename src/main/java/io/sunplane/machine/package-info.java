/**
 * Remote command execution between registered machines.
 *
 * <p>A job moves {@code queued -> running -> succeeded|failed}, or straight to {@code denied} when the
 * target's current policy refuses it. Every transition is a compare-and-swap on the job object.
 */
package io.sunplane.machine;
