/**
 * Reference chunk encoder writing gzip-compressed frame files named {@code <start>_<end>.sfr}.
 */
package ca.gc.cra.screenlog.infrastructure.encode;
