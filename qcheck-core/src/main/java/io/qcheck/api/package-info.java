/**
 * Invariants, their evaluation outcomes, and the exceptions raised for misuse of generators or
 * invalid configuration.
 */
package io.qcheck.api;
