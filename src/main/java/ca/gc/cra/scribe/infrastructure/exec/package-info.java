/**
 * Thread and executor construction for background logging work.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.infrastructure.exec;
