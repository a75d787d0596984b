/**
 * Actuator health contributors.
 */
package com.phillippitts.speakerverify.service.health;
