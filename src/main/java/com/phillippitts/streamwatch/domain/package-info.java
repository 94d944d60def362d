/**
 * Channel model: identity, configuration, runtime flags and the learned on-air pattern that drives adaptive
 * polling.
 */
package com.phillippitts.streamwatch.domain;
