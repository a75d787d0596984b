/**
 * Verification pipeline and the similarity decision.
 */
package com.phillippitts.speakerverify.service.verification;
