/**
 * Immutable domain types shared by the service and presentation layers.
 */
package com.phillippitts.speakerverify.domain;
