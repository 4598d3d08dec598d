/**
 * Request correlation, MDC bridging, tenant-tagged metrics and tracing helpers shared by Arbor
 * services.
 */
package com.arbor.observability;
