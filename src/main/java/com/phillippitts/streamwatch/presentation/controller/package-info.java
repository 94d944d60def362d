/**
 * REST controllers: channel commands and status views under {@code /api/channels}.
 */
package com.phillippitts.streamwatch.presentation.controller;
