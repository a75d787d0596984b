/**
 * Content-addressed cache of remote audio with single-flight downloads and lease-protected eviction.
 */
package com.phillippitts.speakerverify.service.cache;
