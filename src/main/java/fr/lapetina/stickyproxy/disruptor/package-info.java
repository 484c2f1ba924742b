/**
 * LMAX Disruptor ring buffer carrying serve telemetry from request workers to
 * the metrics registry.
 */
package fr.lapetina.stickyproxy.disruptor;
