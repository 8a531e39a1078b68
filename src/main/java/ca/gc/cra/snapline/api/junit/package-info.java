/**
 * JUnit 5 integration injecting snapshot asserters bound to the running test.
 */
package ca.gc.cra.snapline.api.junit;
