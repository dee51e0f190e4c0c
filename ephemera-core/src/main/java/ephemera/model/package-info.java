/**
 * Domain types: content items, submissions, engagement kinds, status templates and sweep
 * results.
 */
package ephemera.model;
