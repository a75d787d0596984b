/**
 * Micrometer instrumentation.
 */
package com.phillippitts.speakerverify.service.metrics;
