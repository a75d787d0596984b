/**
 * In-memory request statistics for the health endpoint.
 */
package com.phillippitts.speakerverify.service.stats;
