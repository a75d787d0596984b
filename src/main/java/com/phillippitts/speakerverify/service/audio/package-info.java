/**
 * Audio intake: resolving uploads, URLs and local paths to files, downloading remote audio, and
 * guaranteed cleanup of request-owned temporaries.
 */
package com.phillippitts.speakerverify.service.audio;
