/**
 * Optional producer-side priority assignment.
 */
package taskqueue.classify;
