/**
 * Request-scoped logging context.
 */
package com.phillippitts.streamwatch.config.logging;
