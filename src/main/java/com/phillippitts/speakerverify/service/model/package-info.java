/**
 * Lifecycle of the shared embedding model: lazy single-flight loading with retry and backoff,
 * leased handles that survive a reload, and background warm-up.
 */
package com.phillippitts.speakerverify.service.model;
