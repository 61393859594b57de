/**
 * Small shared helpers: JSON text encoding for job columns and daemon thread naming.
 */
package mailqueue.util;
