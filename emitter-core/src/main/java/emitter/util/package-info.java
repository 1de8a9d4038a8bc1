/**
 * Small shared helpers: key validation and the daemon thread factory.
 */
package emitter.util;
