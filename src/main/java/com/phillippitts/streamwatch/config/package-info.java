/**
 * Spring configuration: thread pools, metrics binders and the scheduler wiring.
 */
package com.phillippitts.streamwatch.config;
