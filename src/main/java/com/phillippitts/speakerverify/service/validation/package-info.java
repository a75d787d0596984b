/**
 * Pre-extraction checks on resolved audio files.
 */
package com.phillippitts.speakerverify.service.validation;
