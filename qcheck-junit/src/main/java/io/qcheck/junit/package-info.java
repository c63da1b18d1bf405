/**
 * JUnit 5 integration.
 *
 * <h2>Assertions</h2>
 *
 * <p>{@link io.qcheck.junit.QCheckAssertions#assertProperty} runs a check and fails the current
 * test with the counterexample report. Run size and seed come from the {@code qcheck.*} system
 * properties:
 *
 * <pre>{@code
 * mvn test -Dqcheck.trials=1000 -Dqcheck.seed=42
 * }</pre>
 *
 * <h2>Codec compatibility kit</h2>
 *
 * <p>{@link io.qcheck.junit.DocumentCodecTck} validates that a document codec round-trips
 * generated documents:
 *
 * <ul>
 *   <li><b>Fixed documents:</b> empty documents, key order, references
 *   <li><b>Generated documents:</b> flat, nested and reference-bearing documents
 * </ul>
 *
 * @see io.qcheck.junit.DocumentCodecTck
 */
package io.qcheck.junit;
